package com.forecastplatform.common.tree;

import com.forecastplatform.common.exception.DuplicateNodeIdException;
import com.forecastplatform.common.exception.InvariantViolationException;
import com.forecastplatform.common.exception.NodeNotFoundException;
import com.forecastplatform.common.model.NodeView;
import com.forecastplatform.common.model.TreeSnapshot;
import com.forecastplatform.common.probability.ProbabilityNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifier-indexed owner of every node in one scenario tree.
 *
 * <p>Append-only: nodes are registered, never removed; the whole store is dropped as a
 * unit when its generation session is discarded. Lookups are lock-free. Writes
 * ({@link #register}, {@link #attachChildren}), {@link #nodes()} and {@link #snapshot()}
 * serialize on the store so a reader never observes a half-registered node or a
 * half-attached sibling set.
 */
public class TreeStore {

    private final Map<String, ScenarioNode> nodes = new ConcurrentHashMap<>();
    private final Map<String, Long>         order = new ConcurrentHashMap<>();
    private final AtomicLong                sequence = new AtomicLong();
    private final String                    rootId;

    public TreeStore(ScenarioNode root) {
        if (root == null || !root.isRoot() || root.depth() != 0 || root.probability() != 1.0) {
            throw new IllegalArgumentException("Tree root must have depth 0, probability 1.0 and no parent");
        }
        this.rootId = root.id();
        register(root);
    }

    public static TreeStore seeded(String seedEvent) {
        return new TreeStore(ScenarioNode.root(seedEvent, "Seed event"));
    }

    // ── writes ─────────────────────────────────────────────────────────────

    /**
     * @throws DuplicateNodeIdException if a node with the same id is already present
     */
    public synchronized void register(ScenarioNode node) {
        if (nodes.putIfAbsent(node.id(), node) != null) {
            throw new DuplicateNodeIdException(node.id());
        }
        order.put(node.id(), sequence.getAndIncrement());
    }

    /**
     * Validates and commits one parent's complete sibling set in a single step:
     * registers every child, installs the child list and marks the parent
     * {@code COMPLETED}.
     *
     * @throws NodeNotFoundException       if {@code parentId} is unknown
     * @throws DuplicateNodeIdException    if any child id is already registered
     * @throws InvariantViolationException if a child names another parent, skips a depth
     *                                     level, or the set does not sum to 1.0
     * @throws IllegalStateException       if the parent is already completed or failed
     */
    public synchronized void attachChildren(String parentId, List<ScenarioNode> children) {
        ScenarioNode parent = get(parentId);
        if (parent.status().isTerminal()) {
            throw new IllegalStateException(
                "Cannot attach children to a " + parent.status() + " node. id=" + parentId);
        }
        if (children == null || children.isEmpty()) {
            throw new InvariantViolationException("Empty sibling set for parent. id=" + parentId);
        }

        Set<String> batchIds = new HashSet<>();
        double sum = 0.0;
        for (ScenarioNode child : children) {
            if (!parentId.equals(child.parentId())) {
                throw new InvariantViolationException(
                    "Child " + child.id() + " names parent " + child.parentId() + ", expected " + parentId);
            }
            if (child.depth() != parent.depth() + 1) {
                throw new InvariantViolationException(
                    "Child " + child.id() + " at depth " + child.depth()
                        + " under parent at depth " + parent.depth());
            }
            if (nodes.containsKey(child.id()) || !batchIds.add(child.id())) {
                throw new DuplicateNodeIdException(child.id());
            }
            sum += child.probability();
        }
        if (Math.abs(sum - 1.0) > ProbabilityNormalizer.SUM_TOLERANCE) {
            throw new InvariantViolationException(
                "Sibling probabilities sum to " + sum + " for parent " + parentId);
        }

        List<String> childIds = new ArrayList<>(children.size());
        for (ScenarioNode child : children) {
            register(child);
            childIds.add(child.id());
        }
        parent.completeWith(childIds);
    }

    // ── reads ──────────────────────────────────────────────────────────────

    /**
     * @throws NodeNotFoundException if absent
     */
    public ScenarioNode get(String id) {
        ScenarioNode node = id != null ? nodes.get(id) : null;
        if (node == null) {
            throw new NodeNotFoundException(id);
        }
        return node;
    }

    public Optional<ScenarioNode> find(String id) {
        return id != null ? Optional.ofNullable(nodes.get(id)) : Optional.empty();
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    /** Live children of {@code id} in insertion order. */
    public List<ScenarioNode> children(String id) {
        List<String> childIds = get(id).childIds();
        List<ScenarioNode> result = new ArrayList<>(childIds.size());
        for (String childId : childIds) {
            result.add(get(childId));
        }
        return result;
    }

    /** Parent resolved by identifier lookup; empty for the root. */
    public Optional<ScenarioNode> parentOf(String id) {
        ScenarioNode node = get(id);
        return node.isRoot() ? Optional.empty() : Optional.of(get(node.parentId()));
    }

    public String rootId() {
        return rootId;
    }

    public ScenarioNode root() {
        return get(rootId);
    }

    public int size() {
        return nodes.size();
    }

    /** All nodes ordered by depth, then by registration order. */
    public synchronized List<ScenarioNode> nodes() {
        List<ScenarioNode> all = new ArrayList<>(nodes.values());
        all.sort(Comparator.comparingInt(ScenarioNode::depth)
                           .thenComparingLong(n -> order.getOrDefault(n.id(), Long.MAX_VALUE)));
        return Collections.unmodifiableList(all);
    }

    public List<ScenarioNode> nodesAtDepth(int depth) {
        return nodes().stream().filter(n -> n.depth() == depth).toList();
    }

    public synchronized TreeSnapshot snapshot() {
        List<NodeView> views = nodes().stream().map(ScenarioNode::toView).toList();
        return new TreeSnapshot(rootId, views, Instant.now());
    }
}
