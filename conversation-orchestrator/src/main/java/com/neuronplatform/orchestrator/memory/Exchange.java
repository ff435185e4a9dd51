package com.neuronplatform.orchestrator.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One (user, system) pair of the short-term window. */
public record Exchange(
    @JsonProperty("userText")   String userText,
    @JsonProperty("systemText") String systemText
) {}
