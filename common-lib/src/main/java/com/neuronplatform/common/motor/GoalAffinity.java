package com.neuronplatform.common.motor;

import java.util.Map;

/**
 * Additive boost a goal lends to the concepts it points at, scaled by the goal edge's
 * |weight| during candidate scoring. Unknown goals get {@value #DEFAULT_BOOST}.
 */
public final class GoalAffinity {

    static final double DEFAULT_BOOST = 0.1;

    private static final Map<String, Double> BOOST_BY_GOAL = Map.of(
        "goal_inform",   0.3,
        "goal_greet",    0.4,
        "goal_describe", 0.3,
        "goal_farewell", 0.4,
        "goal_clarify",  0.2
    );

    private GoalAffinity() {}

    public static double boost(String goalId) {
        return BOOST_BY_GOAL.getOrDefault(goalId, DEFAULT_BOOST);
    }
}
