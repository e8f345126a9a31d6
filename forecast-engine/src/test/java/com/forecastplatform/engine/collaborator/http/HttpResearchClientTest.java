package com.forecastplatform.engine.collaborator.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.exception.CollaboratorException;
import com.forecastplatform.common.model.ResearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class HttpResearchClientTest {

    private static HttpResearchClient clientAnswering(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build()))
            .build();
        return new HttpResearchClient(webClient, new ObjectMapper(), 5_000);
    }

    @Test
    @DisplayName("response fields map onto ResearchResult; unknown fields are ignored")
    void parsesResponse() {
        String body = """
            {"summary": "Yields fall on weak demand.",
             "sources": [{"url": "https://example.com/a", "title": "Yields", "snippet": "Down 4%"}],
             "queries": ["wheat yield forecast"],
             "confidence": "high",
             "iterations": 2}
            """;

        StepVerifier.create(clientAnswering(HttpStatus.OK, body).research("Drought cuts wheat harvest", "", 0))
            .assertNext(r -> {
                assertEquals("Yields fall on weak demand.", r.summary());
                assertEquals(1, r.sources().size());
                assertEquals("https://example.com/a", r.sources().get(0).url());
                assertEquals("high", r.confidence());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("missing fields default to empty values")
    void sparseResponse() {
        ResearchResult r = clientAnswering(HttpStatus.OK, "{}").parse("{\"summary\": \"Only a summary\"}");

        assertTrue(r.sources().isEmpty());
        assertTrue(r.queries().isEmpty());
        assertEquals("unknown", r.confidence());
    }

    @Test
    @DisplayName("empty response body → completes empty instead of failing on a null result")
    void emptyBody() {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()))
            .build();

        StepVerifier.create(new HttpResearchClient(webClient, new ObjectMapper(), 5_000)
                .research("Drought cuts wheat harvest", "", 0))
            .verifyComplete();
    }

    @Test
    @DisplayName("non-object body or server error → CollaboratorException")
    void failures() {
        StepVerifier.create(clientAnswering(HttpStatus.OK, "[1, 2]").research("Drought cuts wheat harvest", "", 0))
            .expectError(CollaboratorException.class)
            .verify();
        StepVerifier.create(clientAnswering(HttpStatus.SERVICE_UNAVAILABLE, "{}").research("Drought cuts wheat harvest", "", 0))
            .expectError(CollaboratorException.class)
            .verify();
    }
}
