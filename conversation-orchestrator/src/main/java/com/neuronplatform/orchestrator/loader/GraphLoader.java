package com.neuronplatform.orchestrator.loader;

import com.neuronplatform.common.exception.GraphException;
import com.neuronplatform.common.graph.BrainGraph;
import com.neuronplatform.common.graph.Edge;
import com.neuronplatform.common.graph.EdgeType;
import com.neuronplatform.common.graph.Node;
import com.neuronplatform.common.graph.NodeCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link BrainGraph} from a graph file.
 *
 * <pre>
 *   N|id|category|label|baseline|decay|threshold
 *   E|source|target|type|weight
 * </pre>
 *
 * Edges are inserted only after every node was read, so they may refer forward.
 * Per-record failures become {@code Line N: ...} diagnostics; structural findings of
 * {@link BrainGraph#validate()} are appended. Any diagnostic fails the whole load.
 */
public final class GraphLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphLoader.class);

    static final String KIND = "Graph";

    private GraphLoader() {}

    private record PendingEdge(int lineNumber, Edge edge) {}

    /**
     * @throws DataLoadException carrying every diagnostic when the file is unusable
     */
    public static BrainGraph load(Resource resource) {
        BrainGraph graph = new BrainGraph();
        List<String> diagnostics = new ArrayList<>();
        List<PendingEdge> pending = new ArrayList<>();

        RecordFile.read(resource, KIND, (line, f) -> {
            try {
                switch (f[0]) {
                    case "N" -> {
                        if (f.length < 7) {
                            diagnostics.add("Line " + line + ": NODE record needs 7 fields, got " + f.length);
                            return;
                        }
                        graph.addNode(new Node(f[1], NodeCategory.fromTag(f[2]), f[3],
                            Double.parseDouble(f[4]), Double.parseDouble(f[5]), Double.parseDouble(f[6])));
                    }
                    case "E" -> {
                        if (f.length < 5) {
                            diagnostics.add("Line " + line + ": EDGE record needs 5 fields, got " + f.length);
                            return;
                        }
                        pending.add(new PendingEdge(line,
                            new Edge(f[1], f[2], EdgeType.fromTag(f[3]), Double.parseDouble(f[4]))));
                    }
                    default -> diagnostics.add("Line " + line + ": Unknown record type '" + f[0] + "'");
                }
            } catch (IllegalArgumentException | GraphException e) {
                diagnostics.add("Line " + line + ": Parse error: " + e.getMessage());
            }
        });

        for (PendingEdge p : pending) {
            try {
                graph.addEdge(p.edge());
            } catch (GraphException e) {
                diagnostics.add("Line " + p.lineNumber() + ": Edge error: " + e.getMessage());
            }
        }

        diagnostics.addAll(graph.validate());

        if (!diagnostics.isEmpty()) {
            log.error("[Loader] kind={} source={} diagnostics={}", KIND, resource.getDescription(), diagnostics.size());
            throw new DataLoadException(KIND, diagnostics);
        }

        log.info("[Loader] kind={} source={} loaded={}", KIND, resource.getDescription(), graph.summary());
        return graph;
    }
}
