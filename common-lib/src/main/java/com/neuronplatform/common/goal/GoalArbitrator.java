package com.neuronplatform.common.goal;

import com.neuronplatform.common.graph.BrainGraph;
import com.neuronplatform.common.graph.Node;
import com.neuronplatform.common.graph.NodeCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the active conversational goal from a settled graph.
 *
 * <p>All goal nodes are ranked by activation descending (ties in insertion order) and
 * the top one wins even when it is not firing: a turn always gets a best-effort
 * intent. An empty result is returned only when the graph holds no goal node.
 *
 * <p>Stateless, read-only on the graph.
 */
public final class GoalArbitrator {

    private GoalArbitrator() {}

    public static GoalResult select(BrainGraph graph) {
        List<Node> goals = graph.nodesByCategory(NodeCategory.GOAL);
        if (goals.isEmpty()) {
            return GoalResult.none();
        }

        List<GoalCandidate> candidates = new ArrayList<>(goals.size());
        for (Node g : goals) {
            candidates.add(new GoalCandidate(g.getId(), g.getActivation()));
        }
        candidates.sort(Comparator.comparingDouble(GoalCandidate::activation).reversed());

        GoalCandidate top = candidates.get(0);
        return new GoalResult(List.copyOf(candidates), top.goalId(), top.activation());
    }
}
