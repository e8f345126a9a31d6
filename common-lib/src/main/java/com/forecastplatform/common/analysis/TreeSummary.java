package com.forecastplatform.common.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tree-wide aggregates.
 *
 * @param totalNodes          every node including the root
 * @param averageSentiment    mean sentiment over every node
 * @param weightedProbability sentiment-weighted mean probability of the root's children
 */
public record TreeSummary(
    @JsonProperty("totalNodes")          int    totalNodes,
    @JsonProperty("averageSentiment")    double averageSentiment,
    @JsonProperty("weightedProbability") double weightedProbability
) {}
