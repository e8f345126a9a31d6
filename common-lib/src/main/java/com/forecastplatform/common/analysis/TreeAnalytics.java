package com.forecastplatform.common.analysis;

import com.forecastplatform.common.tree.ScenarioNode;
import com.forecastplatform.common.tree.TreeStore;

import java.util.List;

/**
 * Aggregate readings over a finished (or partial) tree.
 *
 * <h3>Weighted probability</h3>
 * <pre>
 *   weight_i = |sentiment_i| / 100           for each child of the root
 *   result   = Σ(p_i × weight_i) / Σ weight_i
 *   no children        → root probability
 *   all weights zero   → 0.5
 * </pre>
 *
 * <p>Pure static utility: no state, no Spring dependency.
 */
public final class TreeAnalytics {

    private static final double NEUTRAL_PROBABILITY = 0.5;

    private TreeAnalytics() {}

    public static TreeSummary summarize(TreeStore store) {
        return new TreeSummary(store.size(), averageSentiment(store), weightedProbability(store));
    }

    public static double averageSentiment(TreeStore store) {
        return store.nodes().stream()
            .mapToInt(ScenarioNode::sentiment)
            .average()
            .orElse(0.0);
    }

    public static double weightedProbability(TreeStore store) {
        ScenarioNode root = store.root();
        List<ScenarioNode> children = store.children(root.id());
        if (children.isEmpty()) {
            return root.probability();
        }
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (ScenarioNode child : children) {
            double weight = Math.abs(child.sentiment()) / 100.0;
            weightedSum += child.probability() * weight;
            totalWeight += weight;
        }
        return totalWeight > 0.0 ? weightedSum / totalWeight : NEUTRAL_PROBABILITY;
    }
}
