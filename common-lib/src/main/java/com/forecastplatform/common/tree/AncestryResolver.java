package com.forecastplatform.common.tree;

import com.forecastplatform.common.exception.InvariantViolationException;
import com.forecastplatform.common.exception.NodeNotFoundException;
import com.forecastplatform.common.model.ChildNode;
import com.forecastplatform.common.model.PathNode;
import com.forecastplatform.common.model.SiblingNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flattens a node's position in the tree into acyclic value views: the ancestry chain
 * (upward), the sibling set (lateral) and the explored children (downward).
 *
 * <p>Every view is built by identifier lookups against the {@link TreeStore}; none of them
 * carries a live {@link ScenarioNode}. Read-only and idempotent: repeated calls against an
 * unchanged tree return equal values.
 */
public class AncestryResolver {

    private final TreeStore store;

    public AncestryResolver(TreeStore store) {
        this.store = store;
    }

    /**
     * Root-first chain ending with a copy of the target itself; length is
     * {@code depth + 1}. Walks {@code parentId} upward, so it terminates in O(depth).
     *
     * @throws NodeNotFoundException if {@code nodeId} or any ancestor is unknown
     */
    public List<PathNode> pathFromRoot(String nodeId) {
        ScenarioNode current = store.get(nodeId);
        List<PathNode> path = new ArrayList<>(current.depth() + 1);
        path.add(toPathNode(current));
        while (!current.isRoot()) {
            ScenarioNode parent = store.get(current.parentId());
            if (parent.depth() != current.depth() - 1) {
                throw new InvariantViolationException(
                    "Depth does not decrease by one from " + current.id() + " to parent " + parent.id());
            }
            path.add(toPathNode(parent));
            current = parent;
        }
        Collections.reverse(path);
        return List.copyOf(path);
    }

    /** The other children of the target's parent; empty for the root. */
    public List<SiblingNode> siblings(String nodeId) {
        ScenarioNode node = store.get(nodeId);
        if (node.isRoot()) {
            return List.of();
        }
        return store.children(node.parentId()).stream()
            .filter(child -> !child.id().equals(nodeId))
            .map(child -> new SiblingNode(child.event(), child.probability(), child.sentiment()))
            .toList();
    }

    /** Immediate children with the size of each one's explored subtree. */
    public List<ChildNode> children(String nodeId) {
        return store.children(nodeId).stream()
            .map(child -> new ChildNode(child.event(), child.probability(), child.sentiment(),
                                        child.depth(), descendantCount(child.id())))
            .toList();
    }

    /** Nodes strictly below the target; 0 for a leaf. */
    public int descendantCount(String nodeId) {
        int total = 0;
        for (String childId : store.get(nodeId).childIds()) {
            total += 1 + descendantCount(childId);
        }
        return total;
    }

    static PathNode toPathNode(ScenarioNode node) {
        return new PathNode(node.event(), node.probability(), node.sentiment(),
                            node.depth(), node.justification());
    }
}
