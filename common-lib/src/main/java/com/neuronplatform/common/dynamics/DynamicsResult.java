package com.neuronplatform.common.dynamics;

import java.util.List;
import java.util.Map;

/**
 * Read-only output of one {@link DynamicsEngine} run.
 *
 * <ul>
 *   <li>{@code steps}             — one {@link StepRecord} per step</li>
 *   <li>{@code finalActivations}  — node id → activation, node insertion order</li>
 *   <li>{@code topContributingEdges} — up to 10 edges by accumulated contribution</li>
 * </ul>
 */
public record DynamicsResult(
    List<StepRecord>       steps,
    Map<String, Double>    finalActivations,
    List<EdgeContribution> topContributingEdges
) {}
