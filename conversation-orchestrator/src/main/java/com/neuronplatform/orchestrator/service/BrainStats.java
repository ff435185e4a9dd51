package com.neuronplatform.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Node counts per category (every category, declaration order) and edge counts per
 * type (types present, first-seen order).
 */
public record BrainStats(
    @JsonProperty("nodes")            int                  nodes,
    @JsonProperty("edges")            int                  edges,
    @JsonProperty("nodesByCategory")  Map<String, Integer> nodesByCategory,
    @JsonProperty("edgesByType")      Map<String, Integer> edgesByType
) {
    public String render() {
        List<String> lines = new ArrayList<>();
        lines.add("Brain: " + nodes + " nodes, " + edges + " edges");
        lines.add("Node types:");
        nodesByCategory.forEach((category, count) -> lines.add("  " + category + ": " + count));
        lines.add("Edge types:");
        edgesByType.forEach((type, count) -> lines.add("  " + type + ": " + count));
        return String.join("\n", lines);
    }
}
