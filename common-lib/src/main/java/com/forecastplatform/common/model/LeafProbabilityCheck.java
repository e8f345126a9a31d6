package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Diagnostic result of summing the cumulative probability of every leaf.
 *
 * @param sum       total cumulative probability over all leaves
 * @param valid     {@code true} when {@code sum} is within tolerance of 1.0
 * @param leafCount number of leaves that contributed
 */
public record LeafProbabilityCheck(
    @JsonProperty("sum")       double  sum,
    @JsonProperty("isValid")   boolean valid,
    @JsonProperty("leafCount") int     leafCount
) {}
