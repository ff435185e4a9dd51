package com.neuronplatform.orchestrator.loader;

import com.neuronplatform.common.graph.BrainGraph;
import com.neuronplatform.common.graph.EdgeType;
import com.neuronplatform.common.graph.NodeCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphLoaderTest {

    private static Resource text(String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8), "inline graph");
    }

    @Nested
    @DisplayName("valid files")
    class ValidTests {

        @Test
        @DisplayName("comments and blank lines skipped, fields trimmed, edges may refer forward")
        void forwardEdges() {
            BrainGraph g = GraphLoader.load(text("""
                # a comment

                E | c_lake | goal_inform | causal | -0.4
                N | c_lake | concept | Lake | 0.1 | 0.05 | 0.3
                  N|goal_inform|GOAL|Inform|0.15|0.05|0.3
                """));

            assertEquals(2, g.nodeCount());
            assertEquals(1, g.edgeCount());
            assertEquals(NodeCategory.GOAL, g.node("goal_inform").orElseThrow().getCategory());
            assertEquals(0.1, g.node("c_lake").orElseThrow().getBaseline());
            assertEquals(EdgeType.CAUSAL, g.edges().get(0).getType());
            assertEquals(-0.4, g.edges().get(0).getWeight());
        }

        @Test
        @DisplayName("bundled graph loads cleanly with every goal the affinity table knows")
        void bundledGraph() {
            BrainGraph g = GraphLoader.load(new ClassPathResource("data/graph.brain"));

            assertTrue(g.validate().isEmpty());
            for (String goal : List.of("goal_inform", "goal_greet", "goal_describe", "goal_farewell", "goal_clarify")) {
                assertEquals(NodeCategory.GOAL, g.node(goal).orElseThrow().getCategory(), goal);
            }
        }
    }

    @Nested
    @DisplayName("diagnostics")
    class DiagnosticTests {

        @Test
        @DisplayName("every problem in the file is reported in one exception")
        void aggregated() {
            DataLoadException ex = assertThrows(DataLoadException.class, () -> GraphLoader.load(text("""
                # header
                N|c_a|concept|A|0|0.05|0.3
                N|c_b|concept|B
                N|c_c|planet|C|0|0.05|0.3
                N|c_a|topic|A2|0|0.05|0.3
                N|c_d|concept|D|zero|0.05|0.3
                X|whatever
                E|c_a|c_missing|excitatory|0.5
                E|c_a|c_a|sideways|0.5
                E|c_a
                E|c_a|c_a|excitatory|1.5
                """)));

            List<String> d = ex.getDiagnostics();
            assertEquals(10, d.size(), d.toString());
            assertEquals("Line 3: NODE record needs 7 fields, got 4", d.get(0));
            assertEquals("Line 4: Parse error: Invalid node category 'planet'", d.get(1));
            assertEquals("Line 5: Parse error: [c_a] Duplicate node id: c_a", d.get(2));
            assertTrue(d.get(3).startsWith("Line 6: Parse error:"));
            assertEquals("Line 7: Unknown record type 'X'", d.get(4));
            assertEquals("Line 9: Parse error: Invalid edge type 'sideways'", d.get(5));
            assertEquals("Line 10: EDGE record needs 5 fields, got 2", d.get(6));
            assertEquals("Line 11: Parse error: Weight 1.5 out of range [-1, 1]", d.get(7));
            assertEquals("Line 8: Edge error: [c_missing] Edge target 'c_missing' not found in graph", d.get(8));
            assertEquals("No goal nodes defined in graph", d.get(9));
            assertTrue(ex.getMessage().startsWith("Graph validation errors:\n"));
        }

        @Test
        @DisplayName("decay above one is a parse error on its line")
        void decayOutOfRange() {
            DataLoadException ex = assertThrows(DataLoadException.class, () -> GraphLoader.load(text("""
                N|goal_inform|goal|Inform|0.15|0.05|0.3
                N|a|concept|A|0.2|1.8|0.3
                """)));
            assertEquals(List.of("Line 2: Parse error: Decay 1.8 out of range [0, 1]"), ex.getDiagnostics());
        }

        @Test
        @DisplayName("a clean file without goal nodes still fails validation")
        void noGoals() {
            DataLoadException ex = assertThrows(DataLoadException.class,
                () -> GraphLoader.load(text("N|c_a|concept|A|0|0.05|0.3\n")));
            assertEquals(List.of("No goal nodes defined in graph"), ex.getDiagnostics());
        }

        @Test
        @DisplayName("missing file → DataLoadException naming the resource")
        void unreadable() {
            DataLoadException ex = assertThrows(DataLoadException.class,
                () -> GraphLoader.load(new ClassPathResource("data/no-such.brain")));
            assertEquals(1, ex.getDiagnostics().size());
            assertTrue(ex.getDiagnostics().get(0).startsWith("Cannot read"));
            assertNotNull(ex.getCause());
        }
    }
}
