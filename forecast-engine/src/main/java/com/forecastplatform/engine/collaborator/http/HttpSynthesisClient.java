package com.forecastplatform.engine.collaborator.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.exception.CollaboratorException;
import com.forecastplatform.common.exception.ScenarioValidationException;
import com.forecastplatform.common.model.OutcomeCandidate;
import com.forecastplatform.engine.collaborator.SynthesisCollaborator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probability synthesis over HTTP: {@code POST /api/v1/synthesize}.
 *
 * <p>Model output arrives loosely structured. Accepted shapes are a bare JSON array of
 * candidates or an object holding one under {@code outcomes} or {@code candidates},
 * optionally wrapped in a markdown code fence. Anything else is a
 * {@link ScenarioValidationException}, which the orchestrator retries once.
 *
 * <p>Missing numeric fields, fractional sentiments and sentiments beyond int range are
 * mapped to out-of-range values so the validator rejects them rather than admitting a
 * coerced value.
 */
@Component
@Profile("!simulated")
public class HttpSynthesisClient implements SynthesisCollaborator {

    private static final Logger log = LoggerFactory.getLogger(HttpSynthesisClient.class);

    private static final int MISSING_SENTIMENT = Integer.MIN_VALUE;

    private final WebClient    synthesisClient;
    private final ObjectMapper objectMapper;
    private final Duration     timeout;

    public HttpSynthesisClient(@Qualifier("synthesisClient") WebClient synthesisClient,
                               ObjectMapper objectMapper,
                               @Value("${services.synthesis.timeout-ms:60000}") long timeoutMs) {
        this.synthesisClient = synthesisClient;
        this.objectMapper    = objectMapper;
        this.timeout         = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Mono<List<OutcomeCandidate>> synthesize(String parentEvent, int depth, String researchDigest,
                                                   String timeframe, List<String> ancestryPath) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("parentEvent", parentEvent);
        body.put("depth", depth);
        body.put("researchSummary", researchDigest);
        body.put("timeframe", timeframe);
        body.put("ancestryPath", ancestryPath != null ? ancestryPath : List.of());

        return synthesisClient.post()
            .uri("/api/v1/synthesize")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .onErrorMap(e -> new CollaboratorException(NAME, "Synthesis call failed: " + e.getMessage(), e))
            .map(this::parse)
            .doOnNext(c -> log.debug("[Synthesis] Completed. depth={} candidates={}", depth, c.size()));
    }

    List<OutcomeCandidate> parse(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw));
        } catch (Exception e) {
            throw new ScenarioValidationException("Synthesis output is not valid JSON: " + e.getMessage());
        }

        JsonNode array = root;
        if (root != null && root.isObject()) {
            array = root.has("outcomes") ? root.get("outcomes") : root.path("candidates");
        }
        if (array == null || !array.isArray()) {
            throw new ScenarioValidationException("Synthesis output holds no candidate array");
        }

        List<OutcomeCandidate> candidates = new ArrayList<>();
        for (JsonNode c : array) {
            candidates.add(new OutcomeCandidate(
                c.path("event").asText(""),
                c.path("probability").isNumber() ? c.path("probability").asDouble() : Double.NaN,
                c.path("justification").asText(""),
                wholeSentiment(c.path("sentiment"))));
        }
        return candidates;
    }

    /** Integral values within int range only; anything else is left for validation to reject. */
    private static int wholeSentiment(JsonNode sentiment) {
        if (!sentiment.isNumber() || !sentiment.canConvertToInt()) {
            return MISSING_SENTIMENT;
        }
        if (sentiment.isIntegralNumber()) {
            return sentiment.intValue();
        }
        double value = sentiment.doubleValue();
        return value == Math.rint(value) ? (int) value : MISSING_SENTIMENT;
    }

    static String stripCodeFence(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : "";
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }
}
