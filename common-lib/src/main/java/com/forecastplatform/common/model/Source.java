package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Citation record attached to a scenario: one piece of research material the
 * justification may reference.
 */
public record Source(
    @JsonProperty("url")     String url,
    @JsonProperty("title")   String title,
    @JsonProperty("snippet") String snippet
) {}
