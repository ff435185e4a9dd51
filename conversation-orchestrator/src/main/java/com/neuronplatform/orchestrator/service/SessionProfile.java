package com.neuronplatform.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record SessionProfile(
    @JsonProperty("turns")      int                 turns,
    @JsonProperty("episodes")   int                 episodes,
    @JsonProperty("seed")       long                seed,
    @JsonProperty("modulators") Map<String, Double> modulators,
    @JsonProperty("debug")      boolean             debug
) {
    public String render() {
        return "Turns: " + turns
            + "\nMemory episodes: " + episodes
            + "\nSeed: " + seed
            + "\nModulators: " + modulators;
    }
}
