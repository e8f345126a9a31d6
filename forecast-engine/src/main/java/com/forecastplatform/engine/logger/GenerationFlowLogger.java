package com.forecastplatform.engine.logger;

import com.forecastplatform.common.trace.TraceContextUtil;
import com.forecastplatform.common.tree.ScenarioNode;
import com.forecastplatform.engine.session.GenerationSession;
import com.forecastplatform.engine.session.SessionStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for the tree-generation lifecycle. Pure side effects: nothing here
 * influences the pipeline.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #SESSION_STARTED}  : orchestrator accepted the session</li>
 *   <li>{@link #LAYER_STARTED}    : one depth layer dispatched</li>
 *   <li>{@link #NODE_EXPANDED}    : a node's children attached</li>
 *   <li>{@link #NODE_FAILED}      : a node ended {@code FAILED}; the session continues</li>
 *   <li>{@link #SESSION_CANCELLED}: cancellation observed, partial tree is final</li>
 *   <li>{@link #SESSION_COMPLETED}: every reachable layer processed</li>
 *   <li>{@link #SESSION_FAILED}   : tree-store corruption terminated the session</li>
 * </ol>
 *
 * <p>The session id is bridged into MDC only for the duration of each log call.
 */
@Component
public class GenerationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(GenerationFlowLogger.class);

    public static final String SESSION_STARTED   = "SESSION_STARTED";
    public static final String LAYER_STARTED     = "LAYER_STARTED";
    public static final String NODE_EXPANDED     = "NODE_EXPANDED";
    public static final String NODE_FAILED       = "NODE_FAILED";
    public static final String SESSION_CANCELLED = "SESSION_CANCELLED";
    public static final String SESSION_COMPLETED = "SESSION_COMPLETED";
    public static final String SESSION_FAILED    = "SESSION_FAILED";

    /**
     * {@code doOnEach} consumer that reads the session id from the Reactor Context.
     * Fires on {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String sessionId = TraceContextUtil.getSessionId(signal.getContextView());
            TraceContextUtil.withMdc(sessionId, () ->
                log.info("[GenerationFlow] stage={} sessionId={}", stageName, sessionId)
            );
        };
    }

    public void layerStarted(GenerationSession session, int depth, int nodes) {
        TraceContextUtil.withMdc(session.id(), () ->
            log.info("[GenerationFlow] stage={} depth={} nodes={} concurrencyLimit={} sessionId={}",
                     LAYER_STARTED, depth, nodes, session.settings().concurrencyLimit(), session.id())
        );
    }

    public void nodeExpanded(GenerationSession session, ScenarioNode node, int children) {
        TraceContextUtil.withMdc(session.id(), () ->
            log.info("[GenerationFlow] stage={} nodeId={} depth={} children={} sessionId={}",
                     NODE_EXPANDED, node.id(), node.depth(), children, session.id())
        );
    }

    public void nodeFailed(GenerationSession session, ScenarioNode node, Throwable cause) {
        TraceContextUtil.withMdc(session.id(), () ->
            log.warn("[GenerationFlow] stage={} nodeId={} depth={} event=\"{}\" reason={} sessionId={}",
                     NODE_FAILED, node.id(), node.depth(), node.event(), cause.getMessage(), session.id())
        );
    }

    public void sessionFinished(GenerationSession session) {
        SessionStatistics stats = session.statistics();
        String stage = switch (session.status()) {
            case CANCELLED -> SESSION_CANCELLED;
            case FAILED    -> SESSION_FAILED;
            default        -> SESSION_COMPLETED;
        };
        TraceContextUtil.withMdc(session.id(), () ->
            log.info("[GenerationFlow] stage={} totalNodes={} completed={} failed={} pending={} "
                     + "currentDepth={} sessionId={}",
                     stage, stats.totalNodes(), stats.completed(), stats.failed(), stats.pending(),
                     stats.currentDepth(), session.id())
        );
    }

    public void sessionFailed(GenerationSession session, Throwable cause) {
        TraceContextUtil.withMdc(session.id(), () ->
            log.error("[GenerationFlow] stage={} reason={} sessionId={}",
                      SESSION_FAILED, cause.getMessage(), session.id(), cause)
        );
    }
}
