package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Value copy of one ancestor on the root-to-node chain. */
public record PathNode(
    @JsonProperty("event")         String event,
    @JsonProperty("probability")   double probability,
    @JsonProperty("sentiment")     int    sentiment,
    @JsonProperty("depth")         int    depth,
    @JsonProperty("justification") String justification
) {}
