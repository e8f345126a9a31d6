package com.forecastplatform.engine.collaborator.simulated;

import com.forecastplatform.common.model.ResearchResult;
import com.forecastplatform.common.model.Source;
import com.forecastplatform.engine.collaborator.ResearchCollaborator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Deterministic stand-in for the research service, active in profile {@code simulated}.
 *
 * <p>Returns {@code min(3 + depth, 5)} fixed sources, a templated summary and three
 * templated queries. An optional delay of {@code base + depth × perDepth} milliseconds
 * mimics network latency.
 */
@Component
@Profile("simulated")
public class SimulatedResearchCollaborator implements ResearchCollaborator {

    static final List<Source> SOURCES = List.of(
        new Source("https://example.com/article-1", "Analysis of Current Economic Trends",
            "Recent data suggests significant shifts in market dynamics with implications for future policy decisions."),
        new Source("https://example.com/article-2", "Geopolitical Impact Study",
            "International relations experts weigh in on potential consequences and strategic considerations."),
        new Source("https://example.com/article-3", "Technology and Innovation Report",
            "Latest developments in technology sectors show accelerating adoption and transformation patterns."),
        new Source("https://example.com/article-4", "Social and Cultural Effects Research",
            "Survey data reveals changing attitudes and behavioral patterns across demographic groups."),
        new Source("https://example.com/article-5", "Environmental Sustainability Review",
            "Climate experts assess potential environmental impacts and sustainability outcomes.")
    );

    private final long baseDelayMs;
    private final long perDepthDelayMs;

    public SimulatedResearchCollaborator(
            @Value("${forecast.simulated.base-delay-ms:0}")      long baseDelayMs,
            @Value("${forecast.simulated.per-depth-delay-ms:0}") long perDepthDelayMs) {
        this.baseDelayMs     = baseDelayMs;
        this.perDepthDelayMs = perDepthDelayMs;
    }

    @Override
    public Mono<ResearchResult> research(String eventText, String contextText, int depth) {
        int count = Math.min(3 + depth, SOURCES.size());
        ResearchResult result = new ResearchResult(
            "Simulated research summary for \"" + eventText + "\": historical patterns and current "
                + "trends indicate a range of possibilities with varying degrees of likelihood. Key "
                + "considerations include economic impacts, social dynamics and systemic effects.",
            SOURCES.subList(0, count),
            List.of(eventText + " analysis", eventText + " implications", eventText + " outcomes"),
            depth <= 1 ? "high" : depth == 2 ? "medium" : "moderate");

        long delayMs = baseDelayMs + depth * perDepthDelayMs;
        return delayMs > 0
            ? Mono.delay(Duration.ofMillis(delayMs)).thenReturn(result)
            : Mono.just(result);
    }
}
