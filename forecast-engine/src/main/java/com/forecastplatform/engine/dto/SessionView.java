package com.forecastplatform.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forecastplatform.engine.session.GenerationSession;
import com.forecastplatform.engine.session.SessionStatistics;
import com.forecastplatform.engine.session.SessionStatus;

import java.time.Instant;

/** Read-only status of one session as returned by the REST API. */
public record SessionView(
    @JsonProperty("sessionId")        String            sessionId,
    @JsonProperty("seedEvent")        String            seedEvent,
    @JsonProperty("status")           SessionStatus     status,
    @JsonProperty("rootId")           String            rootId,
    @JsonProperty("maxDepth")         int               maxDepth,
    @JsonProperty("concurrencyLimit") int               concurrencyLimit,
    @JsonProperty("timeframe")        String            timeframe,
    @JsonProperty("statistics")       SessionStatistics statistics,
    @JsonProperty("startedAt")        Instant           startedAt,
    @JsonProperty("finishedAt")       Instant           finishedAt,
    @JsonProperty("errorMessage")     String            errorMessage
) {

    public static SessionView from(GenerationSession session) {
        return new SessionView(
            session.id(),
            session.seedEvent(),
            session.status(),
            session.store().rootId(),
            session.settings().maxDepth(),
            session.settings().concurrencyLimit(),
            session.settings().timeframe(),
            session.statistics(),
            session.startedAt(),
            session.finishedAt(),
            session.errorMessage());
    }
}
