package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable, serializable copy of a scenario node for renderers. Children are referenced
 * by identifier only, so a list of views never nests a node inside its own ancestor.
 */
public record NodeView(
    @JsonProperty("id")               String           id,
    @JsonProperty("event")            String           event,
    @JsonProperty("probability")      double           probability,
    @JsonProperty("sentiment")        int              sentiment,
    @JsonProperty("justification")    String           justification,
    @JsonProperty("sources")          List<Source>     sources,
    @JsonProperty("depth")            int              depth,
    @JsonProperty("parentId")         String           parentId,
    @JsonProperty("childIds")         List<String>     childIds,
    @JsonProperty("processingStatus") ProcessingStatus processingStatus
) {}
