package com.forecastplatform.engine.controller;

import com.forecastplatform.common.analysis.TreeSummary;
import com.forecastplatform.common.context.ScenarioContext;
import com.forecastplatform.common.exception.NodeNotFoundException;
import com.forecastplatform.common.model.ChildNode;
import com.forecastplatform.common.model.LeafProbabilityCheck;
import com.forecastplatform.common.model.NodeView;
import com.forecastplatform.common.model.PathNode;
import com.forecastplatform.common.model.SiblingNode;
import com.forecastplatform.common.model.TerminalPath;
import com.forecastplatform.common.model.TreeSnapshot;
import com.forecastplatform.engine.dto.SessionView;
import com.forecastplatform.engine.dto.StartForecastRequest;
import com.forecastplatform.engine.service.ForecastService;
import com.forecastplatform.engine.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * REST API over generation sessions and their trees.
 *
 * <p>Typical flow:
 * <ol>
 *   <li>POST /                     : start generation in the background (201)</li>
 *   <li>GET  /{id}                 : poll status and node counts</li>
 *   <li>GET  /{id}/tree            : flat snapshot for rendering</li>
 *   <li>GET  /{id}/nodes/{nodeId}/context: export input for one node</li>
 * </ol>
 *
 * <p>Unknown session or node ids answer 404; invalid start requests answer 400.
 */
@RestController
@RequestMapping("/api/v1/forecast/sessions")
public class ForecastController {

    private static final Logger log = LoggerFactory.getLogger(ForecastController.class);

    private final ForecastService forecastService;

    public ForecastController(ForecastService forecastService) {
        this.forecastService = forecastService;
    }

    // ── lifecycle ──────────────────────────────────────────────────────────

    @PostMapping
    public Mono<ResponseEntity<SessionView>> start(@RequestBody StartForecastRequest request) {
        return Mono.fromCallable(() -> SessionView.from(forecastService.start(request)))
            .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view))
            .onErrorResume(e -> Mono.just(errorResponse(e)));
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<SessionView>> run(@RequestBody StartForecastRequest request) {
        return forecastService.run(request)
            .map(session -> ResponseEntity.ok(SessionView.from(session)))
            .onErrorResume(e -> Mono.just(errorResponse(e)));
    }

    @GetMapping
    public ResponseEntity<List<SessionView>> list() {
        return ResponseEntity.ok(forecastService.list().stream().map(SessionView::from).toList());
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionView>> status(@PathVariable String id) {
        return respond(() -> SessionView.from(forecastService.get(id)));
    }

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<SessionView>> cancel(@PathVariable String id) {
        return respond(() -> SessionView.from(forecastService.cancel(id)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> discard(@PathVariable String id) {
        return Mono.fromRunnable(() -> forecastService.discard(id))
            .then(Mono.just(ResponseEntity.noContent().<Void>build()))
            .onErrorResume(e -> Mono.just(errorResponse(e)));
    }

    // ── tree views ─────────────────────────────────────────────────────────

    @GetMapping("/{id}/tree")
    public Mono<ResponseEntity<TreeSnapshot>> tree(@PathVariable String id) {
        return respond(() -> forecastService.snapshot(id));
    }

    @GetMapping("/{id}/most-probable-path")
    public Mono<ResponseEntity<List<NodeView>>> mostProbablePath(@PathVariable String id) {
        return respond(() -> forecastService.mostProbablePath(id));
    }

    @GetMapping("/{id}/cumulative-probabilities")
    public Mono<ResponseEntity<Map<String, Double>>> cumulativeProbabilities(@PathVariable String id) {
        return respond(() -> forecastService.cumulativeProbabilities(id));
    }

    @GetMapping("/{id}/leaf-probability-sum")
    public Mono<ResponseEntity<LeafProbabilityCheck>> leafProbabilitySum(@PathVariable String id) {
        return respond(() -> forecastService.leafProbabilitySum(id));
    }

    @GetMapping("/{id}/summary")
    public Mono<ResponseEntity<TreeSummary>> summary(@PathVariable String id) {
        return respond(() -> forecastService.summary(id));
    }

    @GetMapping("/{id}/terminal-paths")
    public Mono<ResponseEntity<List<TerminalPath>>> terminalPaths(@PathVariable String id) {
        return respond(() -> forecastService.terminalPaths(id));
    }

    // ── node views ─────────────────────────────────────────────────────────

    @GetMapping("/{id}/nodes/{nodeId}/path")
    public Mono<ResponseEntity<List<PathNode>>> path(@PathVariable String id, @PathVariable String nodeId) {
        return respond(() -> forecastService.pathFromRoot(id, nodeId));
    }

    @GetMapping("/{id}/nodes/{nodeId}/siblings")
    public Mono<ResponseEntity<List<SiblingNode>>> siblings(@PathVariable String id, @PathVariable String nodeId) {
        return respond(() -> forecastService.siblings(id, nodeId));
    }

    @GetMapping("/{id}/nodes/{nodeId}/children")
    public Mono<ResponseEntity<List<ChildNode>>> children(@PathVariable String id, @PathVariable String nodeId) {
        return respond(() -> forecastService.children(id, nodeId));
    }

    @GetMapping("/{id}/nodes/{nodeId}/context")
    public Mono<ResponseEntity<ScenarioContext>> context(
            @PathVariable String id,
            @PathVariable String nodeId,
            @RequestParam(defaultValue = "true") boolean includeChildren) {
        return respond(() -> forecastService.context(id, nodeId, includeChildren));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private <T> Mono<ResponseEntity<T>> respond(Callable<T> view) {
        return Mono.fromCallable(view)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(errorResponse(e)));
    }

    private <T> ResponseEntity<T> errorResponse(Throwable e) {
        if (e instanceof SessionNotFoundException || e instanceof NodeNotFoundException) {
            log.debug("[ForecastAPI] Not found. reason={}", e.getMessage());
            return ResponseEntity.notFound().build();
        }
        if (e instanceof IllegalArgumentException) {
            log.info("[ForecastAPI] Rejected request. reason={}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
        log.error("[ForecastAPI] Request failed. reason={}", e.getMessage(), e);
        return ResponseEntity.internalServerError().build();
    }
}
