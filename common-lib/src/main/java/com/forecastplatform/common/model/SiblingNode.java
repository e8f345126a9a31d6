package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Value copy of a branch that shares the target's parent. */
public record SiblingNode(
    @JsonProperty("event")       String event,
    @JsonProperty("probability") double probability,
    @JsonProperty("sentiment")   int    sentiment
) {}
