package com.forecastplatform.common.path;

import com.forecastplatform.common.model.LeafProbabilityCheck;
import com.forecastplatform.common.model.PathNode;
import com.forecastplatform.common.model.TerminalPath;
import com.forecastplatform.common.tree.AncestryResolver;
import com.forecastplatform.common.tree.ScenarioNode;
import com.forecastplatform.common.tree.TreeStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probability arithmetic over a scenario tree.
 *
 * <ul>
 *   <li><b>Cumulative probability</b>: product of local probabilities root → node;
 *       the root contributes a neutral 1.0.</li>
 *   <li><b>Most-probable path</b>: greedy descent into the locally most probable child,
 *       first child wins ties.</li>
 *   <li><b>Leaf sum</b>: Σ cumulative probability over all leaves. Diagnostic only:
 *       renormalization error compounds with depth, so only closeness to 1.0 within
 *       {@value #LEAF_SUM_TOLERANCE} is checked.</li>
 * </ul>
 *
 * <p>Pure static utility: reads the store, never writes it.
 */
public final class PathProbabilityCalculator {

    public static final double LEAF_SUM_TOLERANCE = 0.02;

    private PathProbabilityCalculator() {}

    public static double cumulativeProbability(List<PathNode> path) {
        double product = 1.0;
        for (PathNode node : path) {
            product *= node.probability();
        }
        return product;
    }

    /** Root → leaf chain following the highest local probability at every level. */
    public static List<ScenarioNode> mostProbablePath(TreeStore store) {
        List<ScenarioNode> path = new ArrayList<>();
        ScenarioNode current = store.root();
        path.add(current);
        while (current.hasChildren()) {
            ScenarioNode best = null;
            for (ScenarioNode child : store.children(current.id())) {
                if (best == null || child.probability() > best.probability()) {
                    best = child;
                }
            }
            path.add(best);
            current = best;
        }
        return List.copyOf(path);
    }

    public static LeafProbabilityCheck verifyLeafProbabilitySum(TreeStore store, int maxDepth) {
        return verifyLeafProbabilitySum(store, maxDepth, LEAF_SUM_TOLERANCE);
    }

    /**
     * A leaf is a node with no children or a node at {@code maxDepth}. Failed and
     * still-pending nodes are leaves too, so their probability mass stays in the sum.
     */
    public static LeafProbabilityCheck verifyLeafProbabilitySum(TreeStore store, int maxDepth, double tolerance) {
        AncestryResolver resolver = new AncestryResolver(store);
        double sum = 0.0;
        int leaves = 0;
        for (ScenarioNode node : store.nodes()) {
            if (isLeaf(node, maxDepth)) {
                sum += cumulativeProbability(resolver.pathFromRoot(node.id()));
                leaves++;
            }
        }
        return new LeafProbabilityCheck(sum, Math.abs(sum - 1.0) <= tolerance, leaves);
    }

    /** Cumulative probability of every node, keyed by id, computed top-down in one pass. */
    public static Map<String, Double> cumulativeProbabilities(TreeStore store) {
        Map<String, Double> result = new LinkedHashMap<>();
        Deque<ScenarioNode> queue = new ArrayDeque<>();
        ScenarioNode root = store.root();
        result.put(root.id(), root.probability());
        queue.add(root);
        while (!queue.isEmpty()) {
            ScenarioNode node = queue.poll();
            double base = result.get(node.id());
            for (ScenarioNode child : store.children(node.id())) {
                result.put(child.id(), base * child.probability());
                queue.add(child);
            }
        }
        return result;
    }

    /** Every root → leaf chain as value copies, in depth-first, insertion order. */
    public static List<TerminalPath> terminalPaths(TreeStore store, int maxDepth) {
        List<TerminalPath> paths = new ArrayList<>();
        collect(store, store.root(), new ArrayList<>(), maxDepth, paths);
        return paths;
    }

    private static void collect(TreeStore store, ScenarioNode node, List<PathNode> prefix,
                                int maxDepth, List<TerminalPath> out) {
        List<PathNode> path = new ArrayList<>(prefix);
        path.add(new PathNode(node.event(), node.probability(), node.sentiment(),
                              node.depth(), node.justification()));
        if (isLeaf(node, maxDepth)) {
            out.add(new TerminalPath(List.copyOf(path), cumulativeProbability(path)));
            return;
        }
        for (ScenarioNode child : store.children(node.id())) {
            collect(store, child, path, maxDepth, out);
        }
    }

    private static boolean isLeaf(ScenarioNode node, int maxDepth) {
        return !node.hasChildren() || node.depth() >= maxDepth;
    }
}
