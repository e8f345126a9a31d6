package com.forecastplatform.engine.service;

import com.forecastplatform.common.analysis.TreeAnalytics;
import com.forecastplatform.common.analysis.TreeSummary;
import com.forecastplatform.common.context.ScenarioContext;
import com.forecastplatform.common.context.ScenarioContextAssembler;
import com.forecastplatform.common.model.ChildNode;
import com.forecastplatform.common.model.LeafProbabilityCheck;
import com.forecastplatform.common.model.NodeView;
import com.forecastplatform.common.model.PathNode;
import com.forecastplatform.common.model.SiblingNode;
import com.forecastplatform.common.model.TerminalPath;
import com.forecastplatform.common.model.TreeSnapshot;
import com.forecastplatform.common.path.PathProbabilityCalculator;
import com.forecastplatform.common.tree.AncestryResolver;
import com.forecastplatform.common.tree.ScenarioNode;
import com.forecastplatform.engine.dto.StartForecastRequest;
import com.forecastplatform.engine.orchestrator.GenerationOrchestrator;
import com.forecastplatform.engine.session.GenerationSession;
import com.forecastplatform.engine.session.GenerationSettings;
import com.forecastplatform.engine.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entry point for forecasting sessions: creates them, runs them through the
 * {@link GenerationOrchestrator}, and serves read-only views over their trees.
 *
 * <p>Views are computed against the live store, so they can be requested while a session
 * is still running; each view reflects whatever sibling sets have been attached so far.
 */
@Service
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final GenerationOrchestrator orchestrator;
    private final SessionRegistry        registry;

    @Value("${forecast.generation.max-depth:3}")
    private int defaultMaxDepth;

    @Value("${forecast.generation.max-depth-limit:6}")
    private int maxDepthLimit;

    @Value("${forecast.generation.concurrency-limit:5}")
    private int defaultConcurrencyLimit;

    @Value("${forecast.generation.layer-delay-ms:2000}")
    private long layerDelayMs;

    public ForecastService(GenerationOrchestrator orchestrator, SessionRegistry registry) {
        this.orchestrator = orchestrator;
        this.registry     = registry;
    }

    // ── lifecycle ──────────────────────────────────────────────────────────

    /**
     * Creates a session and starts generation in the background.
     *
     * @throws IllegalArgumentException if the request is invalid
     */
    public GenerationSession start(StartForecastRequest request) {
        GenerationSession session = registry.register(newSession(request));
        log.info("[Forecast] Session started in background. sessionId={} maxDepth={} event=\"{}\"",
                 session.id(), session.settings().maxDepth(), session.seedEvent());

        orchestrator.run(session).subscribe(
            s -> log.info("[Forecast] Background session finished. sessionId={} status={}", s.id(), s.status()),
            e -> log.error("[Forecast] Background session failed. sessionId={} reason={}",
                           session.id(), e.getMessage())
        );
        return session;
    }

    /** Creates a session and completes when its generation finishes. */
    public Mono<GenerationSession> run(StartForecastRequest request) {
        return Mono.fromCallable(() -> registry.register(newSession(request)))
            .doOnNext(s -> log.info("[Forecast] Session started. sessionId={} maxDepth={} event=\"{}\"",
                                    s.id(), s.settings().maxDepth(), s.seedEvent()))
            .flatMap(orchestrator::run);
    }

    public GenerationSession get(String sessionId) {
        return registry.get(sessionId);
    }

    public List<GenerationSession> list() {
        return registry.all().stream().toList();
    }

    /** Requests cooperative cancellation; a no-op on a finished session. */
    public GenerationSession cancel(String sessionId) {
        GenerationSession session = registry.get(sessionId);
        if (!session.status().isFinished() && session.requestCancel()) {
            log.info("[Forecast] Cancellation requested. sessionId={}", sessionId);
        }
        return session;
    }

    /** Drops the session and its tree, cancelling it first if still running. */
    public void discard(String sessionId) {
        GenerationSession session = registry.remove(sessionId);
        session.requestCancel();
        log.info("[Forecast] Session discarded. sessionId={} status={}", sessionId, session.status());
    }

    // ── tree views ─────────────────────────────────────────────────────────

    public TreeSnapshot snapshot(String sessionId) {
        return registry.get(sessionId).store().snapshot();
    }

    public List<NodeView> mostProbablePath(String sessionId) {
        return PathProbabilityCalculator.mostProbablePath(registry.get(sessionId).store()).stream()
            .map(ScenarioNode::toView)
            .toList();
    }

    public Map<String, Double> cumulativeProbabilities(String sessionId) {
        return PathProbabilityCalculator.cumulativeProbabilities(registry.get(sessionId).store());
    }

    public LeafProbabilityCheck leafProbabilitySum(String sessionId) {
        GenerationSession session = registry.get(sessionId);
        return PathProbabilityCalculator.verifyLeafProbabilitySum(session.store(), session.settings().maxDepth());
    }

    public TreeSummary summary(String sessionId) {
        return TreeAnalytics.summarize(registry.get(sessionId).store());
    }

    public List<TerminalPath> terminalPaths(String sessionId) {
        GenerationSession session = registry.get(sessionId);
        return PathProbabilityCalculator.terminalPaths(session.store(), session.settings().maxDepth());
    }

    // ── node views ─────────────────────────────────────────────────────────

    public List<PathNode> pathFromRoot(String sessionId, String nodeId) {
        return resolver(sessionId).pathFromRoot(nodeId);
    }

    public List<SiblingNode> siblings(String sessionId, String nodeId) {
        return resolver(sessionId).siblings(nodeId);
    }

    public List<ChildNode> children(String sessionId, String nodeId) {
        return resolver(sessionId).children(nodeId);
    }

    public ScenarioContext context(String sessionId, String nodeId, boolean includeChildren) {
        GenerationSession session = registry.get(sessionId);
        return new ScenarioContextAssembler(session.store()).assemble(
            nodeId,
            session.researchFor(nodeId).orElse(null),
            session.settings().timeframe(),
            includeChildren);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private AncestryResolver resolver(String sessionId) {
        return new AncestryResolver(registry.get(sessionId).store());
    }

    GenerationSession newSession(StartForecastRequest request) {
        if (request == null || request.event() == null || request.event().isBlank()) {
            throw new IllegalArgumentException("event is required");
        }
        int maxDepth = request.maxDepth() != null ? request.maxDepth() : defaultMaxDepth;
        if (maxDepth < 1 || maxDepth > maxDepthLimit) {
            throw new IllegalArgumentException("maxDepth must be between 1 and " + maxDepthLimit + ", got " + maxDepth);
        }
        int concurrency = request.concurrencyLimit() != null ? request.concurrencyLimit() : defaultConcurrencyLimit;

        GenerationSettings settings = new GenerationSettings(
            maxDepth, concurrency, Duration.ofMillis(layerDelayMs), request.timeframe(), request.context());
        return new GenerationSession(request.event(), settings);
    }
}
