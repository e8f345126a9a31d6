package com.forecastplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a start request. Only {@code event} is required; omitted knobs fall back to
 * the configured defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StartForecastRequest(
    @JsonProperty("event")            String  event,
    @JsonProperty("context")          String  context,
    @JsonProperty("timeframe")        String  timeframe,
    @JsonProperty("maxDepth")         Integer maxDepth,
    @JsonProperty("concurrencyLimit") Integer concurrencyLimit
) {

    public static StartForecastRequest of(String event) {
        return new StartForecastRequest(event, null, null, null, null);
    }
}
