package com.neuronplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TurnRequest(@JsonProperty("text") String text) {}
