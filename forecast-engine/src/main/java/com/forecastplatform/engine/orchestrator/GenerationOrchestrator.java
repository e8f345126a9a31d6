package com.forecastplatform.engine.orchestrator;

import com.forecastplatform.common.context.ResearchDigest;
import com.forecastplatform.common.exception.CollaboratorException;
import com.forecastplatform.common.exception.InvariantViolationException;
import com.forecastplatform.common.exception.NodeProcessingException;
import com.forecastplatform.common.exception.ScenarioValidationException;
import com.forecastplatform.common.model.OutcomeCandidate;
import com.forecastplatform.common.model.PathNode;
import com.forecastplatform.common.model.ProcessingStatus;
import com.forecastplatform.common.model.ResearchResult;
import com.forecastplatform.common.model.Source;
import com.forecastplatform.common.probability.CandidateValidator;
import com.forecastplatform.common.probability.ProbabilityNormalizer;
import com.forecastplatform.common.trace.TraceContextUtil;
import com.forecastplatform.common.tree.AncestryResolver;
import com.forecastplatform.common.tree.ScenarioNode;
import com.forecastplatform.common.tree.TreeStore;
import com.forecastplatform.engine.collaborator.ResearchCollaborator;
import com.forecastplatform.engine.collaborator.SynthesisCollaborator;
import com.forecastplatform.engine.logger.GenerationFlowLogger;
import com.forecastplatform.engine.session.GenerationSession;
import com.forecastplatform.engine.session.GenerationSettings;
import com.forecastplatform.engine.session.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a session's scenario tree breadth-first, one depth layer at a time.
 *
 * <h3>Per layer</h3>
 * <ol>
 *   <li>Stop if cancellation was requested or the layer is at {@code maxDepth}.</li>
 *   <li>Dispatch every {@code PENDING} node of the layer through a bounded
 *       {@code flatMap}; at most {@code concurrencyLimit} expansions are in flight.</li>
 *   <li>Each dispatch re-checks cancellation before claiming its node, so nodes still
 *       queued when cancellation lands stay {@code PENDING}. In-flight expansions finish.</li>
 *   <li>When the whole layer has settled, wait {@code layerDelay} and descend.</li>
 * </ol>
 *
 * <h3>Per node</h3>
 * research → digest → synthesis → validate → normalize → attach. Validation and
 * normalization failures get one more synthesis attempt; collaborator failures do not.
 * Any {@link NodeProcessingException} marks the node {@code FAILED} and the layer carries on.
 * Anything else (tree-store corruption) fails the whole session and propagates.
 *
 * <p>Fully non-blocking: suspension happens only inside the collaborator calls.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    /** Citations copied from a node's research onto each of its children. */
    static final int MAX_SOURCES_PER_CHILD = 5;

    private final ResearchCollaborator  research;
    private final SynthesisCollaborator synthesis;
    private final CandidateValidator    validator;
    private final GenerationFlowLogger  flowLogger;

    public GenerationOrchestrator(ResearchCollaborator research,
                                  SynthesisCollaborator synthesis,
                                  CandidateValidator validator,
                                  GenerationFlowLogger flowLogger) {
        this.research   = research;
        this.synthesis  = synthesis;
        this.validator  = validator;
        this.flowLogger = flowLogger;
    }

    /**
     * Runs the session to completion or cancellation.
     *
     * @return the same session once it is {@code COMPLETED} or {@code CANCELLED}; errors with
     *         the original cause after marking it {@code FAILED} on store corruption
     */
    public Mono<GenerationSession> run(GenerationSession session) {
        Mono<GenerationSession> pipeline = Mono.just(session)
            .doOnEach(flowLogger.stage(GenerationFlowLogger.SESSION_STARTED))
            .flatMap(s -> expandLayer(s, 0))
            .then(Mono.fromCallable(() -> {
                session.finish(session.isCancelRequested() ? SessionStatus.CANCELLED : SessionStatus.COMPLETED);
                flowLogger.sessionFinished(session);
                return session;
            }))
            .onErrorResume(e -> {
                session.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
                flowLogger.sessionFailed(session, e);
                return Mono.error(e);
            });

        return TraceContextUtil.withSessionId(pipeline, session.id());
    }

    // ── layers ─────────────────────────────────────────────────────────────

    private Mono<Void> expandLayer(GenerationSession session, int depth) {
        return Mono.defer(() -> {
            GenerationSettings settings = session.settings();
            if (session.isCancelRequested() || depth >= settings.maxDepth()) {
                return Mono.empty();
            }
            List<ScenarioNode> layer = pendingAt(session.store(), depth);
            if (layer.isEmpty()) {
                return Mono.empty();
            }

            session.advanceTo(depth);
            flowLogger.layerStarted(session, depth, layer.size());

            return Flux.fromIterable(layer)
                .flatMap(node -> Mono.defer(() ->
                        session.isCancelRequested() ? Mono.<Void>empty() : expandNode(session, node)),
                    settings.concurrencyLimit())
                .then(Mono.defer(() -> pauseBeforeNextLayer(session, depth + 1)))
                .then(expandLayer(session, depth + 1));
        });
    }

    private Mono<Void> pauseBeforeNextLayer(GenerationSession session, int nextDepth) {
        GenerationSettings settings = session.settings();
        if (settings.layerDelay().isZero()
                || session.isCancelRequested()
                || nextDepth >= settings.maxDepth()
                || pendingAt(session.store(), nextDepth).isEmpty()) {
            return Mono.empty();
        }
        log.debug("[Orchestrator] Pausing before next layer. depth={} delayMs={} sessionId={}",
                  nextDepth, settings.layerDelay().toMillis(), session.id());
        return Mono.delay(settings.layerDelay()).then();
    }

    private static List<ScenarioNode> pendingAt(TreeStore store, int depth) {
        return store.nodesAtDepth(depth).stream()
            .filter(n -> n.status() == ProcessingStatus.PENDING)
            .toList();
    }

    // ── nodes ──────────────────────────────────────────────────────────────

    /**
     * Expands one node. Expanding at or beyond {@code maxDepth} is a no-op.
     * Completes empty on per-node failure; errors only on store corruption.
     */
    Mono<Void> expandNode(GenerationSession session, ScenarioNode node) {
        if (node.depth() >= session.settings().maxDepth()) {
            return Mono.empty();
        }
        node.markProcessing();

        return Mono.fromCallable(() -> ancestryEvents(session.store(), node))
            .flatMap(ancestry -> expandWithAncestry(session, node, ancestry))
            .onErrorResume(NodeProcessingException.class, e -> {
                node.markFailed();
                flowLogger.nodeFailed(session, node, e);
                return Mono.empty();
            });
    }

    private Mono<Void> expandWithAncestry(GenerationSession session, ScenarioNode node, List<String> ancestry) {
        return callResearch(session, node, ancestry)
            .doOnNext(result -> session.recordResearch(node.id(), result))
            .flatMap(result -> {
                String digest = ResearchDigest.format(result);
                return synthesizeCandidates(session, node, digest, ancestry)
                    .onErrorResume(GenerationOrchestrator::isRetryable, e -> {
                        log.warn("[Orchestrator] Synthesis output rejected, retrying once. nodeId={} reason={} sessionId={}",
                                 node.id(), e.getMessage(), session.id());
                        return synthesizeCandidates(session, node, digest, ancestry);
                    })
                    .map(candidates -> toChildren(node, candidates, result));
            })
            .doOnNext(children -> {
                session.store().attachChildren(node.id(), children);
                flowLogger.nodeExpanded(session, node, children.size());
            })
            .then();
    }

    private static List<String> ancestryEvents(TreeStore store, ScenarioNode node) {
        return new AncestryResolver(store).pathFromRoot(node.id()).stream()
            .map(PathNode::event)
            .toList();
    }

    private Mono<ResearchResult> callResearch(GenerationSession session, ScenarioNode node,
                                              List<String> ancestry) {
        String contextText = researchContext(session.settings().context(), ancestry);
        return Mono.defer(() -> research.research(node.event(), contextText, node.depth()))
            .switchIfEmpty(Mono.error(() ->
                new CollaboratorException(ResearchCollaborator.NAME, "Research returned no result")))
            .onErrorMap(e -> !(e instanceof NodeProcessingException),
                        e -> new CollaboratorException(ResearchCollaborator.NAME, String.valueOf(e.getMessage()), e));
    }

    /** One synthesis attempt: call, validate, normalize. */
    private Mono<List<OutcomeCandidate>> synthesizeCandidates(GenerationSession session, ScenarioNode node,
                                                              String digest, List<String> ancestry) {
        return Mono.defer(() -> synthesis.synthesize(node.event(), node.depth(), digest,
                                                     session.settings().timeframe(), ancestry))
            .switchIfEmpty(Mono.error(() ->
                new CollaboratorException(SynthesisCollaborator.NAME, "Synthesis returned no candidates")))
            .onErrorMap(e -> !(e instanceof NodeProcessingException),
                        e -> new CollaboratorException(SynthesisCollaborator.NAME, String.valueOf(e.getMessage()), e))
            .map(validator::validate)
            .map(ProbabilityNormalizer::normalize);
    }

    private static List<ScenarioNode> toChildren(ScenarioNode parent, List<OutcomeCandidate> candidates,
                                                 ResearchResult research) {
        List<Source> citations = research.sources().size() > MAX_SOURCES_PER_CHILD
            ? research.sources().subList(0, MAX_SOURCES_PER_CHILD)
            : research.sources();

        List<ScenarioNode> children = new ArrayList<>(candidates.size());
        for (OutcomeCandidate c : candidates) {
            children.add(ScenarioNode.child(parent, c.event().trim(), c.probability(), c.sentiment(),
                                            c.justification().trim(), citations));
        }
        return children;
    }

    static String researchContext(String sessionContext, List<String> ancestry) {
        StringBuilder sb = new StringBuilder();
        if (sessionContext != null && !sessionContext.isBlank()) {
            sb.append(sessionContext.trim());
        }
        if (ancestry.size() > 1) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append("Scenario path: ").append(String.join(" -> ", ancestry));
        }
        return sb.toString();
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof ScenarioValidationException || e instanceof InvariantViolationException;
    }
}
