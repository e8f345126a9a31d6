package com.forecastplatform.engine.session;

import com.forecastplatform.common.model.ResearchResult;
import com.forecastplatform.common.tree.ScenarioNode;
import com.forecastplatform.common.tree.TreeStore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One forecasting request and the tree it owns.
 *
 * <p>The orchestrator is the only writer of the tree and of the lifecycle fields; the
 * REST layer only reads them. Cancellation is a one-way flag: once requested it is never
 * cleared, and the orchestrator observes it before each layer and before each node.
 *
 * <p>When the session finishes, its {@link TreeStore} receives no further writes and is
 * the final snapshot for every read-only view.
 */
public class GenerationSession {

    private final String             id;
    private final String             seedEvent;
    private final GenerationSettings settings;
    private final TreeStore          store;
    private final Instant            startedAt;

    private final Map<String, ResearchResult> researchByNode  = new ConcurrentHashMap<>();
    private final AtomicBoolean               cancelRequested = new AtomicBoolean(false);

    private volatile SessionStatus status       = SessionStatus.RUNNING;
    private volatile int           currentDepth;
    private volatile Instant       finishedAt;
    private volatile String        errorMessage;

    public GenerationSession(String seedEvent, GenerationSettings settings) {
        if (seedEvent == null || seedEvent.isBlank()) {
            throw new IllegalArgumentException("Seed event must not be blank");
        }
        this.id        = UUID.randomUUID().toString();
        this.seedEvent = seedEvent.trim();
        this.settings  = settings;
        this.store     = TreeStore.seeded(this.seedEvent);
        this.startedAt = Instant.now();
    }

    // ── cancellation ───────────────────────────────────────────────────────

    /** @return {@code true} if this call raised the flag, {@code false} if it was already set */
    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    // ── lifecycle (orchestrator only) ──────────────────────────────────────

    public void advanceTo(int depth) {
        this.currentDepth = depth;
    }

    public synchronized void finish(SessionStatus outcome) {
        if (outcome == SessionStatus.RUNNING || outcome == SessionStatus.FAILED) {
            throw new IllegalArgumentException("finish() expects COMPLETED or CANCELLED, got " + outcome);
        }
        if (status.isFinished()) {
            throw new IllegalStateException("Session already " + status + ". id=" + id);
        }
        this.finishedAt = Instant.now();
        this.status     = outcome;
    }

    public synchronized void fail(String reason) {
        if (status.isFinished()) {
            return;
        }
        this.errorMessage = reason;
        this.finishedAt   = Instant.now();
        this.status       = SessionStatus.FAILED;
    }

    public void recordResearch(String nodeId, ResearchResult research) {
        researchByNode.put(nodeId, research);
    }

    // ── accessors ──────────────────────────────────────────────────────────

    public String             id()           { return id; }
    public String             seedEvent()    { return seedEvent; }
    public GenerationSettings settings()     { return settings; }
    public TreeStore          store()        { return store; }
    public SessionStatus      status()       { return status; }
    public int                currentDepth() { return currentDepth; }
    public Instant            startedAt()    { return startedAt; }
    public Instant            finishedAt()   { return finishedAt; }
    public String             errorMessage() { return errorMessage; }

    public Optional<ResearchResult> researchFor(String nodeId) {
        return Optional.ofNullable(researchByNode.get(nodeId));
    }

    public SessionStatistics statistics() {
        int pending = 0, processing = 0, completed = 0, failed = 0, leaves = 0;
        for (ScenarioNode node : store.nodes()) {
            switch (node.status()) {
                case PENDING -> {
                    if (node.depth() >= settings.maxDepth()) leaves++;
                    else pending++;
                }
                case PROCESSING -> processing++;
                case COMPLETED  -> completed++;
                case FAILED     -> failed++;
            }
        }
        return new SessionStatistics(store.size(), pending, processing, completed, failed,
                                     leaves, currentDepth);
    }
}
