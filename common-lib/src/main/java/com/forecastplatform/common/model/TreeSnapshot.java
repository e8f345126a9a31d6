package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Flat, point-in-time copy of a whole tree: root identifier plus every node, ordered by
 * depth and then by insertion.
 */
public record TreeSnapshot(
    @JsonProperty("rootId")     String         rootId,
    @JsonProperty("nodes")      List<NodeView> nodes,
    @JsonProperty("capturedAt") Instant        capturedAt
) {}
