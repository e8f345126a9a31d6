package com.forecastplatform.engine.collaborator.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.exception.CollaboratorException;
import com.forecastplatform.common.model.ResearchResult;
import com.forecastplatform.common.model.Source;
import com.forecastplatform.engine.collaborator.ResearchCollaborator;
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
 * Research over HTTP: {@code POST /api/v1/research} with the scenario and its context.
 *
 * <p>The response is read as a tree and mapped field by field, so extra or missing fields
 * never break the call. Transport errors, non-2xx responses and timeouts surface as
 * {@link CollaboratorException}.
 */
@Component
@Profile("!simulated")
public class HttpResearchClient implements ResearchCollaborator {

    private static final Logger log = LoggerFactory.getLogger(HttpResearchClient.class);

    private final WebClient    researchClient;
    private final ObjectMapper objectMapper;
    private final Duration     timeout;

    public HttpResearchClient(@Qualifier("researchClient") WebClient researchClient,
                              ObjectMapper objectMapper,
                              @Value("${services.research.timeout-ms:30000}") long timeoutMs) {
        this.researchClient = researchClient;
        this.objectMapper   = objectMapper;
        this.timeout        = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Mono<ResearchResult> research(String eventText, String contextText, int depth) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", eventText);
        body.put("context", contextText != null ? contextText : "");
        body.put("depth", depth);

        return researchClient.post()
            .uri("/api/v1/research")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .map(this::parse)
            .doOnNext(r -> log.debug("[Research] Completed. depth={} sources={} confidence={}",
                                     depth, r.sources().size(), r.confidence()))
            .onErrorMap(e -> !(e instanceof CollaboratorException),
                        e -> new CollaboratorException(NAME, "Research call failed: " + e.getMessage(), e));
    }

    ResearchResult parse(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (Exception e) {
            throw new CollaboratorException(NAME, "Unreadable research response", e);
        }
        if (root == null || !root.isObject()) {
            throw new CollaboratorException(NAME, "Research response is not a JSON object");
        }

        List<Source> sources = new ArrayList<>();
        for (JsonNode s : root.path("sources")) {
            sources.add(new Source(s.path("url").asText(""),
                                   s.path("title").asText(""),
                                   s.path("snippet").asText("")));
        }
        List<String> queries = new ArrayList<>();
        for (JsonNode q : root.path("queries")) {
            queries.add(q.asText());
        }
        return new ResearchResult(root.path("summary").asText(""), sources, queries,
                                  root.path("confidence").asText("unknown"));
    }
}
