package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Value copy of an immediate child together with the size of the subtree already
 * explored beneath it.
 */
public record ChildNode(
    @JsonProperty("event")           String event,
    @JsonProperty("probability")     double probability,
    @JsonProperty("sentiment")       int    sentiment,
    @JsonProperty("depth")           int    depth,
    @JsonProperty("descendantCount") int    descendantCount
) {}
