package com.neuronplatform.common.goal;

import java.util.List;
import java.util.Optional;

/**
 * Ranked goal candidates plus the winner.
 *
 * <p>{@code selectedGoal} is {@code null} only when the graph has no goal nodes at all;
 * substituting a default goal is the orchestrator's job.
 */
public record GoalResult(
    List<GoalCandidate> candidates,
    String              selectedGoal,
    double              selectedActivation
) {
    static GoalResult none() {
        return new GoalResult(List.of(), null, 0.0);
    }

    public boolean hasSelection() {
        return selectedGoal != null;
    }

    public Optional<String> selected() {
        return Optional.ofNullable(selectedGoal);
    }
}
