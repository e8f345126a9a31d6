package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One complete root-to-leaf chain and the probability of the whole chain occurring. */
public record TerminalPath(
    @JsonProperty("nodes")                 List<PathNode> nodes,
    @JsonProperty("cumulativeProbability") double         cumulativeProbability
) {

    public PathNode leaf() {
        return nodes.get(nodes.size() - 1);
    }
}
