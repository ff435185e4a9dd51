package com.neuronplatform.orchestrator.service;

import com.neuronplatform.common.dynamics.DynamicsConfig;
import com.neuronplatform.common.dynamics.Modulators;
import com.neuronplatform.common.graph.BrainGraph;
import com.neuronplatform.common.graph.Edge;
import com.neuronplatform.common.graph.EdgeType;
import com.neuronplatform.common.graph.Node;
import com.neuronplatform.common.graph.NodeCategory;
import com.neuronplatform.common.motor.PartOfSpeech;
import com.neuronplatform.common.trace.TraceContextUtil;
import com.neuronplatform.orchestrator.lexicon.Lexicon;
import com.neuronplatform.orchestrator.lexicon.LexiconEntry;
import com.neuronplatform.orchestrator.loader.GraphLoader;
import com.neuronplatform.orchestrator.loader.LexiconLoader;
import com.neuronplatform.orchestrator.logger.TurnFlowLogger;
import com.neuronplatform.orchestrator.trace.TraceFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationServiceTest {

    private static final double EPS = 1e-9;

    private static final List<String> SCRIPT = List.of(
        "hello there",
        "tell me about the lake",
        "is minnesota cold in winter?",
        "the north shore is beautiful",
        "bye");

    private ConversationService service;

    private static ConversationService bundled(long seed) {
        BrainGraph graph = GraphLoader.load(new ClassPathResource("data/graph.brain"));
        Lexicon lexicon  = LexiconLoader.load(new ClassPathResource("data/lexicon.brain"));
        return new ConversationService(graph, lexicon, DynamicsConfig.defaults(), seed, new TurnFlowLogger());
    }

    @BeforeEach
    void setUp() {
        service = bundled(42L);
    }

    @Nested
    @DisplayName("turn pipeline")
    class PipelineTests {

        @Test
        @DisplayName("same seed and same inputs give identical responses and traces")
        void deterministic() {
            ConversationService other = bundled(42L);
            for (String input : SCRIPT) {
                TurnResult a = service.processTurn(input, "t-a");
                TurnResult b = other.processTurn(input, "t-b");
                assertEquals(a.response(), b.response(), input);
                assertEquals(TraceFormatter.full(a.trace()), TraceFormatter.full(b.trace()), input);
            }
        }

        @Test
        @DisplayName("turn ids count from one; the trace carries the response words")
        void turnIds() {
            TurnResult first  = service.processTurn("hello", "t-1");
            TurnResult second = service.processTurn("tell me about the lake", "t-2");

            assertEquals(1, first.turnId());
            assertEquals(2, second.turnId());
            assertEquals(2, service.turnCount());
            assertFalse(second.response().isBlank());
            assertTrue(second.elapsedMillis() >= 0.0);
        }

        @Test
        @DisplayName("recognised words land in the trace mapping and initial activations")
        void perceptionInTrace() {
            TurnResult result = service.processTurn("tell me about the lake", "t-1");

            assertTrue(result.trace().inputMapping().stream().anyMatch(m -> m.text().equals("lake")));
            assertFalse(result.trace().initialActivations().isEmpty());
            assertFalse(result.trace().steps().isEmpty());
            assertNotNull(result.trace().selectedGoal());
        }

        @Test
        @DisplayName("repeating a topic boosts it from memory on the next turn")
        void memoryBoost() {
            TurnResult first = service.processTurn("tell me about the lake", "t-1");
            TurnResult again = service.processTurn("the lake", "t-2");

            assertTrue(first.trace().memoryEffects().isEmpty());
            assertFalse(again.trace().memoryEffects().isEmpty());
            assertEquals(2, service.profile().episodes());
        }

        @Test
        @DisplayName("recent words never exceed thirty")
        void recentWordsCapped() {
            for (int i = 0; i < 12; i++) {
                service.processTurn(SCRIPT.get(i % SCRIPT.size()), "t-" + i);
            }
            assertTrue(service.recentWords().size() <= ConversationService.RECENT_WORDS_LIMIT);
            assertFalse(service.recentWords().isEmpty());
        }

        @Test
        @DisplayName("blank text is rejected without consuming a turn")
        void blankRejected() {
            assertThrows(IllegalArgumentException.class, () -> service.processTurn("   ", "t-1"));
            assertThrows(IllegalArgumentException.class, () -> service.processTurn(null, "t-1"));
            assertEquals(0, service.turnCount());
        }

        @Test
        @DisplayName("reactive turn emits one result and carries the context trace id through")
        void reactiveTurn() {
            StepVerifier.create(TraceContextUtil.withTraceId(service.turn("hello"), "trace-xyz"))
                .assertNext(result -> {
                    assertEquals(1, result.turnId());
                    assertFalse(result.response().isBlank());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("reactive turn signals an error for blank text")
        void reactiveBlank() {
            StepVerifier.create(service.turn(""))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("default goal")
    class DefaultGoalTests {

        @Test
        @DisplayName("a graph without goal nodes falls back to goal_inform")
        void noGoals() {
            BrainGraph graph = new BrainGraph();
            graph.addNode(new Node("c_lake", NodeCategory.CONCEPT, "lake"));
            graph.addNode(new Node("c_water", NodeCategory.CONCEPT, "water"));
            graph.addEdge(new Edge("c_lake", "c_water", EdgeType.EXCITATORY, 0.6));

            Lexicon lexicon = new Lexicon();
            lexicon.addWord(new LexiconEntry("w1", "lake", List.of("c_lake"), PartOfSpeech.NOUN));
            lexicon.addWord(new LexiconEntry("w2", "water", List.of("c_water"), PartOfSpeech.NOUN));

            ConversationService bare = new ConversationService(
                graph, lexicon, DynamicsConfig.defaults(), 7L, new TurnFlowLogger());
            TurnResult result = bare.processTurn("lake", "t-1");

            assertEquals(ConversationService.DEFAULT_GOAL, result.trace().selectedGoal());
            assertTrue(result.trace().goalCandidates().isEmpty());
        }
    }

    @Nested
    @DisplayName("modulator drift")
    class DriftTests {

        @Test
        @DisplayName("a question raises curiosity; urgency decays every turn")
        void question() {
            service.processTurn("is minnesota cold?", "t-1");
            Modulators m = service.modulators();

            assertEquals(0.6, m.curiosity(), EPS);
            assertEquals(0.28, m.get(Modulators.URGENCY, 0), EPS);
            assertEquals(0.6, m.get(Modulators.CALM, 0), EPS);
        }

        @Test
        @DisplayName("a statement lowers curiosity")
        void statement() {
            service.processTurn("the lake is cold", "t-1");
            assertEquals(0.45, service.modulators().curiosity(), EPS);
        }

        @Test
        @DisplayName("curiosity caps at one and floors at 0.2; urgency floors at 0.1")
        void bounds() {
            Modulators high = Modulators.of(0.95, 0.6, 0.11);
            Modulators up = ConversationService.drift(high, true);
            assertEquals(1.0, up.curiosity(), EPS);
            assertEquals(0.1, up.get(Modulators.URGENCY, 0), EPS);

            Modulators low = ConversationService.drift(Modulators.of(0.22, 0.6, 0.3), false);
            assertEquals(0.2, low.curiosity(), EPS);
        }

        @Test
        @DisplayName("the trace records the modulators the turn ran with, not the drifted ones")
        void traceUsesPreTurnValues() {
            TurnResult result = service.processTurn("why?", "t-1");
            assertEquals(0.5, result.trace().modulators().get(Modulators.CURIOSITY), EPS);
        }
    }

    @Nested
    @DisplayName("session operations")
    class SessionTests {

        @Test
        @DisplayName("startup summary names the engine and the loaded brain")
        void startupSummary() {
            String summary = service.startupSummary();
            assertTrue(summary.contains("Neuron Conversation Engine"));
            assertTrue(summary.contains("Brain loaded: "));
            assertTrue(summary.contains("Seed: 42"));
        }

        @Test
        @DisplayName("brain stats list every category and add up to the graph size")
        void brainStats() {
            BrainStats stats = service.brainStats();

            assertEquals(NodeCategory.values().length, stats.nodesByCategory().size());
            assertEquals(stats.nodes(), stats.nodesByCategory().values().stream().mapToInt(Integer::intValue).sum());
            assertEquals(stats.edges(), stats.edgesByType().values().stream().mapToInt(Integer::intValue).sum());
            assertTrue(stats.render().startsWith("Brain: " + stats.nodes() + " nodes, " + stats.edges() + " edges"));
            assertTrue(stats.render().contains("  goal: 5"));
        }

        @Test
        @DisplayName("reseeding keeps memory and turn count")
        void reseed() {
            service.processTurn("hello", "t-1");
            service.setSeed(7L);

            SessionProfile profile = service.profile();
            assertEquals(7L, profile.seed());
            assertEquals(1, profile.turns());
            assertEquals(1, profile.episodes());
            assertTrue(profile.render().contains("Seed: 7"));
        }

        @Test
        @DisplayName("debug toggles")
        void debug() {
            assertFalse(service.isDebug());
            assertTrue(service.toggleDebug());
            assertTrue(service.profile().debug());
            assertFalse(service.toggleDebug());
        }
    }
}
