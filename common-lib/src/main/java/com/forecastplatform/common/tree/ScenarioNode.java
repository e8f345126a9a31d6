package com.forecastplatform.common.tree;

import com.forecastplatform.common.model.NodeView;
import com.forecastplatform.common.model.ProcessingStatus;
import com.forecastplatform.common.model.Source;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One hypothetical event at one point in the branching future.
 *
 * <p>The only upward reference is {@link #parentId()}, an identifier resolved through
 * {@link TreeStore}. Children are likewise held as identifiers, so a node never embeds
 * another node and flattens without cycles.
 *
 * <p>Everything except the child list and the processing status is fixed at construction.
 * Both mutable parts are written only through {@link TreeStore#attachChildren} and the
 * status transition methods below, which reject backward moves.
 */
public final class ScenarioNode {

    private final String       id;
    private final String       event;
    private final double       probability;
    private final int          sentiment;
    private final String       justification;
    private final List<Source>  sources;
    private final int          depth;
    private final String       parentId;
    private final Instant      createdAt;

    private volatile List<String>     childIds = List.of();
    private volatile ProcessingStatus status   = ProcessingStatus.PENDING;

    private ScenarioNode(String id, String event, double probability, int sentiment,
                         String justification, List<Source> sources, int depth, String parentId) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Scenario node id must not be blank");
        }
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("Scenario event must not be blank. id=" + id);
        }
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("Probability out of [0,1]. id=" + id + " probability=" + probability);
        }
        if (sentiment < -100 || sentiment > 100) {
            throw new IllegalArgumentException("Sentiment out of [-100,100]. id=" + id + " sentiment=" + sentiment);
        }
        if (depth < 0) {
            throw new IllegalArgumentException("Depth must be non-negative. id=" + id);
        }
        if ((depth == 0) != (parentId == null)) {
            throw new IllegalArgumentException("Only the depth-0 root may lack a parent. id=" + id + " depth=" + depth);
        }
        this.id            = id;
        this.event         = event;
        this.probability   = probability;
        this.sentiment     = sentiment;
        this.justification = justification != null ? justification : "";
        this.sources       = sources != null ? List.copyOf(sources) : List.of();
        this.depth         = depth;
        this.parentId      = parentId;
        this.createdAt     = Instant.now();
    }

    /** Seed node: depth 0, probability 1.0, no parent. */
    public static ScenarioNode root(String event, String justification) {
        return new ScenarioNode(UUID.randomUUID().toString(), event, 1.0, 0,
                                justification, List.of(), 0, null);
    }

    /** Successor of {@code parent}; depth is always {@code parent.depth() + 1}. */
    public static ScenarioNode child(ScenarioNode parent, String event, double probability, int sentiment,
                                     String justification, List<Source> sources) {
        Objects.requireNonNull(parent, "parent");
        return new ScenarioNode(UUID.randomUUID().toString(), event, probability, sentiment,
                                justification, sources, parent.depth + 1, parent.id);
    }

    static ScenarioNode withId(String id, String event, double probability, int sentiment,
                               String justification, int depth, String parentId) {
        return new ScenarioNode(id, event, probability, sentiment, justification, List.of(), depth, parentId);
    }

    // ── accessors ──────────────────────────────────────────────────────────

    public String           id()            { return id; }
    public String           event()         { return event; }
    public double           probability()   { return probability; }
    public int              sentiment()     { return sentiment; }
    public String           justification() { return justification; }
    public List<Source>     sources()       { return sources; }
    public int              depth()         { return depth; }
    public String           parentId()      { return parentId; }
    public Instant          createdAt()     { return createdAt; }
    public List<String>     childIds()      { return childIds; }
    public ProcessingStatus status()        { return status; }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean hasChildren() {
        return !childIds.isEmpty();
    }

    // ── lifecycle ──────────────────────────────────────────────────────────

    /**
     * Claims the node for expansion. Throws if another expansion already claimed it,
     * which keeps expansion single-writer per node.
     */
    public synchronized void markProcessing() {
        transition(ProcessingStatus.PROCESSING);
    }

    /** Terminal failure; the node keeps an empty child list. */
    public synchronized void markFailed() {
        transition(ProcessingStatus.FAILED);
    }

    synchronized void completeWith(List<String> children) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Node already " + status + ". id=" + id);
        }
        this.childIds = List.copyOf(children);
        this.status   = ProcessingStatus.COMPLETED;
    }

    private void transition(ProcessingStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Illegal status transition " + status + " -> " + next + ". id=" + id);
        }
        this.status = next;
    }

    public NodeView toView() {
        return new NodeView(id, event, probability, sentiment, justification, sources,
                            depth, parentId, childIds, status);
    }

    @Override
    public String toString() {
        return "ScenarioNode{id=" + id + ", depth=" + depth + ", p=" + probability
            + ", status=" + status + ", event='" + event + "'}";
    }
}
