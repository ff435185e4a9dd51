package com.neuronplatform.common.dynamics;

import com.neuronplatform.common.graph.BrainGraph;
import com.neuronplatform.common.graph.Edge;
import com.neuronplatform.common.graph.Node;
import com.neuronplatform.common.graph.NodeCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-step activation-spreading simulation over a {@link BrainGraph}.
 *
 * <h3>Per-run setup</h3>
 * Activations return to baseline, edge contributions to zero, then each injection is
 * added to its node's activation and capped at 1.0. Unknown ids are ignored.
 *
 * <h3>Per-step passes (fixed order)</h3>
 * <ol>
 *   <li><b>Decay</b>       — {@code a += (baseline − a) × decay}</li>
 *   <li><b>Spread</b>      — every edge with a firing source pushes
 *       {@code source.a × weight}, transformed by type:
 *       <pre>
 *   EXCITATORY  → unchanged
 *   INHIBITORY  → −|spread|
 *   ASSOCIATIVE → × (0.5 + curiosity × 0.5)
 *   CAUSAL      → × 0.8
 *       </pre>
 *       Deltas are summed per target and applied only after every edge was read, so
 *       sources always see pre-spread values. {@code |spread|} is credited to the edge.</li>
 *   <li><b>Competition</b> — per category, firing nodes ranked by activation (stable);
 *       rank {@code i ≥ 1} loses {@code inhibitionStrength × i / firingCount}.
 *       Ranking reads post-spread, pre-clamp values.</li>
 *   <li><b>Clamp</b>       — every activation into [0, 1].</li>
 *   <li><b>Record</b>      — top {@value #TOP_FIRING_PER_STEP} firing nodes.</li>
 * </ol>
 *
 * <p>Stateless; all run state lives on the graph passed in, which the call mutates
 * exclusively for its duration.
 */
public final class DynamicsEngine {

    private static final Logger log = LoggerFactory.getLogger(DynamicsEngine.class);

    static final int    TOP_FIRING_PER_STEP = 8;
    static final int    TOP_EDGES           = 10;
    static final double CAUSAL_FACTOR       = 0.8;

    private DynamicsEngine() {}

    /** Runs with {@link DynamicsConfig#defaults()} and {@link Modulators#defaults()}. */
    public static DynamicsResult run(BrainGraph graph, Map<String, Double> injections) {
        return run(graph, injections, DynamicsConfig.defaults(), Modulators.defaults());
    }

    /**
     * Resets the graph, applies injections and evolves it for {@code config.steps()} steps.
     *
     * @param graph      graph to evolve; its activations and contributions are overwritten
     * @param injections node id → additive activation; unknown ids are ignored
     * @param config     step count and competition settings
     * @param modulators behavioural modulators; curiosity falls back to
     *                   {@value Modulators#DEFAULT_CURIOSITY} when absent
     * @return step trace, final snapshot and top contributing edges; never null
     */
    public static DynamicsResult run(BrainGraph graph,
                                     Map<String, Double> injections,
                                     DynamicsConfig config,
                                     Modulators modulators) {
        graph.resetActivations();
        graph.resetContributions();
        inject(graph, injections);

        double curiosity = modulators.curiosity();
        double associativeFactor = 0.5 + curiosity * 0.5;

        List<Node> nodes = graph.nodes();
        List<Edge> edges = graph.edges();

        // id lookups resolved once; the step loop works on arena indices only
        int[] sourceIdx = new int[edges.size()];
        int[] targetIdx = new int[edges.size()];
        for (int e = 0; e < edges.size(); e++) {
            sourceIdx[e] = graph.indexOf(edges.get(e).getSourceId());
            targetIdx[e] = graph.indexOf(edges.get(e).getTargetId());
        }

        List<StepRecord> steps = new ArrayList<>(config.steps());
        double[] deltas = new double[nodes.size()];

        for (int step = 0; step < config.steps(); step++) {
            decay(nodes);
            spread(nodes, edges, sourceIdx, targetIdx, deltas, associativeFactor);
            if (config.competitionWithinCategory()) {
                compete(graph, config.inhibitionStrength());
            }
            for (Node n : nodes) n.clamp();
            steps.add(new StepRecord(step, topFiring(nodes)));
        }

        Map<String, Double> finalActivations = new LinkedHashMap<>();
        for (Node n : nodes) {
            finalActivations.put(n.getId(), n.getActivation());
        }

        List<EdgeContribution> topEdges = topContributingEdges(edges);

        if (log.isDebugEnabled()) {
            log.debug("[Dynamics] steps={} nodes={} edges={} curiosity={} firingAtEnd={} topEdge={}",
                config.steps(), nodes.size(), edges.size(), curiosity,
                steps.isEmpty() ? 0 : steps.get(steps.size() - 1).topFiring().size(),
                topEdges.isEmpty() ? "none" : topEdges.get(0));
        }

        return new DynamicsResult(
            Collections.unmodifiableList(steps),
            Collections.unmodifiableMap(finalActivations),
            topEdges);
    }

    // ── setup ────────────────────────────────────────────────────────────────

    private static void inject(BrainGraph graph, Map<String, Double> injections) {
        if (injections == null) return;
        for (Map.Entry<String, Double> entry : injections.entrySet()) {
            graph.node(entry.getKey()).ifPresent(node ->
                node.setActivation(Math.min(1.0, node.getActivation() + entry.getValue())));
        }
    }

    // ── passes ───────────────────────────────────────────────────────────────

    private static void decay(List<Node> nodes) {
        for (Node n : nodes) {
            n.setActivation(n.getActivation() + (n.getBaseline() - n.getActivation()) * n.getDecay());
        }
    }

    private static void spread(List<Node> nodes, List<Edge> edges,
                               int[] sourceIdx, int[] targetIdx,
                               double[] deltas, double associativeFactor) {
        Arrays.fill(deltas, 0.0);

        for (int e = 0; e < edges.size(); e++) {
            Node source = nodes.get(sourceIdx[e]);
            if (!source.isFiring()) continue;

            Edge edge = edges.get(e);
            double spread = source.getActivation() * edge.getWeight();
            spread = switch (edge.getType()) {
                case INHIBITORY  -> -Math.abs(spread);
                case ASSOCIATIVE -> spread * associativeFactor;
                case CAUSAL      -> spread * CAUSAL_FACTOR;
                case EXCITATORY  -> spread;
            };

            deltas[targetIdx[e]] += spread;
            edge.addContribution(Math.abs(spread));
        }

        for (int i = 0; i < deltas.length; i++) {
            if (deltas[i] != 0.0) {
                Node target = nodes.get(i);
                target.setActivation(target.getActivation() + deltas[i]);
            }
        }
    }

    private static void compete(BrainGraph graph, double inhibitionStrength) {
        for (NodeCategory category : NodeCategory.values()) {
            List<Node> firing = new ArrayList<>();
            for (Node n : graph.nodesByCategory(category)) {
                if (n.isFiring()) firing.add(n);
            }
            if (firing.size() <= 1) continue;

            // List.sort is stable: equal activations keep insertion order
            firing.sort(Comparator.comparingDouble(Node::getActivation).reversed());
            int count = firing.size();
            for (int rank = 1; rank < count; rank++) {
                Node n = firing.get(rank);
                n.setActivation(n.getActivation() - inhibitionStrength * ((double) rank / count));
            }
        }
    }

    // ── observability ────────────────────────────────────────────────────────

    private static List<NodeActivation> topFiring(List<Node> nodes) {
        List<NodeActivation> firing = new ArrayList<>();
        for (Node n : nodes) {
            if (n.isFiring()) firing.add(new NodeActivation(n.getId(), n.getActivation()));
        }
        firing.sort(Comparator.comparingDouble(NodeActivation::activation).reversed());
        return firing.size() > TOP_FIRING_PER_STEP ? firing.subList(0, TOP_FIRING_PER_STEP) : firing;
    }

    private static List<EdgeContribution> topContributingEdges(List<Edge> edges) {
        List<Edge> sorted = new ArrayList<>(edges);
        sorted.sort(Comparator.comparingDouble(Edge::getContribution).reversed());
        List<EdgeContribution> top = new ArrayList<>();
        for (Edge e : sorted.subList(0, Math.min(TOP_EDGES, sorted.size()))) {
            top.add(new EdgeContribution(e.getSourceId(), e.getTargetId(), e.getType(), e.getContribution()));
        }
        return Collections.unmodifiableList(top);
    }
}
