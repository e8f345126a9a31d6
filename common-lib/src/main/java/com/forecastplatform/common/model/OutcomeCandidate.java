package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One candidate successor scenario as returned by the probability-synthesis collaborator.
 *
 * <p>The raw {@code probability} is only expected to lie in [0,1]; candidate sets are not
 * required to sum to 1.0 until they pass through
 * {@link com.forecastplatform.common.probability.ProbabilityNormalizer}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OutcomeCandidate(
    @JsonProperty("event")         String event,
    @JsonProperty("probability")   double probability,
    @JsonProperty("justification") String justification,
    @JsonProperty("sentiment")     int sentiment
) {

    /** Copy with a rescaled probability. The original instance is never mutated. */
    public OutcomeCandidate withProbability(double probability) {
        return new OutcomeCandidate(event, probability, justification, sentiment);
    }
}
