package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the research collaborator for one scenario.
 *
 * @param summary    free-text synthesis of what was found
 * @param sources    citations, in the order the researcher ranked them
 * @param queries    search queries that were executed
 * @param confidence researcher's self-reported confidence label ("high", "medium", ...)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResearchResult(
    @JsonProperty("summary")    String       summary,
    @JsonProperty("sources")    List<Source> sources,
    @JsonProperty("queries")    List<String> queries,
    @JsonProperty("confidence") String       confidence
) {

    public ResearchResult {
        summary    = summary != null ? summary : "";
        sources    = sources != null ? List.copyOf(sources) : List.of();
        queries    = queries != null ? List.copyOf(queries) : List.of();
        confidence = confidence != null ? confidence : "unknown";
    }

    public static ResearchResult empty() {
        return new ResearchResult("", List.of(), List.of(), "none");
    }
}
