package com.forecastplatform.engine.controller;

import com.forecastplatform.common.probability.CandidateValidator;
import com.forecastplatform.engine.collaborator.simulated.SimulatedResearchCollaborator;
import com.forecastplatform.engine.collaborator.simulated.SimulatedSynthesisCollaborator;
import com.forecastplatform.engine.dto.SessionView;
import com.forecastplatform.engine.dto.StartForecastRequest;
import com.forecastplatform.engine.logger.GenerationFlowLogger;
import com.forecastplatform.engine.orchestrator.GenerationOrchestrator;
import com.forecastplatform.engine.service.ForecastService;
import com.forecastplatform.engine.session.SessionRegistry;
import com.forecastplatform.engine.session.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.*;

class ForecastControllerTest {

    private static final String BASE = "/api/v1/forecast/sessions";

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        GenerationOrchestrator orchestrator = new GenerationOrchestrator(
            new SimulatedResearchCollaborator(0, 0),
            new SimulatedSynthesisCollaborator(0),
            CandidateValidator.defaults(),
            new GenerationFlowLogger());
        ForecastService service = new ForecastService(orchestrator, new SessionRegistry(10));
        ReflectionTestUtils.setField(service, "defaultMaxDepth", 2);
        ReflectionTestUtils.setField(service, "maxDepthLimit", 4);
        ReflectionTestUtils.setField(service, "defaultConcurrencyLimit", 2);
        ReflectionTestUtils.setField(service, "layerDelayMs", 0L);

        client = WebTestClient.bindToController(new ForecastController(service)).build();
    }

    private SessionView runSession() {
        SessionView view = client.post().uri(BASE + "/run")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new StartForecastRequest("Drought cuts wheat harvest", null, "1 year", 1, null))
            .exchange()
            .expectStatus().isOk()
            .expectBody(SessionView.class)
            .returnResult()
            .getResponseBody();
        assertNotNull(view);
        return view;
    }

    @Test
    @DisplayName("POST / → 201 with a session id")
    void start() {
        client.post().uri(BASE)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(StartForecastRequest.of("Drought cuts wheat harvest"))
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.sessionId").isNotEmpty()
            .jsonPath("$.maxDepth").isEqualTo(2);
    }

    @Test
    @DisplayName("POST /run → 200 with final status and statistics")
    void run() {
        SessionView view = runSession();

        assertEquals(SessionStatus.COMPLETED, view.status());
        assertEquals(5, view.statistics().totalNodes());
        assertEquals(4, view.statistics().leaves());
    }

    @Test
    @DisplayName("invalid start request → 400")
    void badRequest() {
        client.post().uri(BASE)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new StartForecastRequest("Drought cuts wheat harvest", null, null, 12, null))
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("unknown session or node → 404")
    void notFound() {
        SessionView view = runSession();

        client.get().uri(BASE + "/{id}", "missing").exchange().expectStatus().isNotFound();
        client.get().uri(BASE + "/{id}/tree", "missing").exchange().expectStatus().isNotFound();
        client.get().uri(BASE + "/{id}/nodes/{nodeId}/path", view.sessionId(), "missing")
            .exchange().expectStatus().isNotFound();
        client.delete().uri(BASE + "/{id}", "missing").exchange().expectStatus().isNotFound();
    }

    @Test
    @DisplayName("tree and derived views are served for a finished session")
    void views() {
        SessionView view = runSession();
        String id = view.sessionId();

        client.get().uri(BASE + "/{id}/tree", id).exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.rootId").isEqualTo(view.rootId())
            .jsonPath("$.nodes.length()").isEqualTo(5);

        client.get().uri(BASE + "/{id}/most-probable-path", id).exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2);

        client.get().uri(BASE + "/{id}/leaf-probability-sum", id).exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.isValid").isEqualTo(true)
            .jsonPath("$.leafCount").isEqualTo(4);

        client.get().uri(BASE + "/{id}/summary", id).exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.totalNodes").isEqualTo(5);

        client.get().uri(BASE + "/{id}/nodes/{nodeId}/context?includeChildren=false", id, view.rootId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.depth").isEqualTo(0)
            .jsonPath("$.existingChildren").doesNotExist()
            .jsonPath("$.timeframe").isEqualTo("1 year");
    }

    @Test
    @DisplayName("cancel and delete round trip")
    void cancelAndDelete() {
        String id = runSession().sessionId();

        client.post().uri(BASE + "/{id}/cancel", id).exchange().expectStatus().isOk();
        client.delete().uri(BASE + "/{id}", id).exchange().expectStatus().isNoContent();
        client.get().uri(BASE + "/{id}", id).exchange().expectStatus().isNotFound();
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client.get().uri(BASE + "/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
