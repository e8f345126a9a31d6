package com.forecastplatform.engine.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress counters for one session, computed from the tree on every call.
 *
 * <p>{@code pending} counts only nodes still eligible for expansion. Nodes sitting at
 * {@code maxDepth} are reported as {@code leaves} instead, since they are never expanded.
 */
public record SessionStatistics(
    @JsonProperty("totalNodes")   int totalNodes,
    @JsonProperty("pending")      int pending,
    @JsonProperty("processing")   int processing,
    @JsonProperty("completed")    int completed,
    @JsonProperty("failed")       int failed,
    @JsonProperty("leaves")       int leaves,
    @JsonProperty("currentDepth") int currentDepth
) {}
