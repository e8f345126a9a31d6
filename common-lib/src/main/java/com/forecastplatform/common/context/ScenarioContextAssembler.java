package com.forecastplatform.common.context;

import com.forecastplatform.common.model.ChildNode;
import com.forecastplatform.common.model.PathNode;
import com.forecastplatform.common.model.ResearchResult;
import com.forecastplatform.common.path.PathProbabilityCalculator;
import com.forecastplatform.common.tree.AncestryResolver;
import com.forecastplatform.common.tree.ScenarioNode;
import com.forecastplatform.common.tree.TreeStore;

import java.util.List;

/**
 * Builds a {@link ScenarioContext} for one node from the resolver's three views plus the
 * research gathered when that node was expanded.
 *
 * <p>Transforms references into context:
 * <ul>
 *   <li>parent chain    → {@code pathFromRoot} and its cumulative probability</li>
 *   <li>parent.children → {@code siblings}</li>
 *   <li>node.children   → {@code existingChildren} (optional)</li>
 * </ul>
 */
public class ScenarioContextAssembler {

    private final TreeStore        store;
    private final AncestryResolver resolver;

    public ScenarioContextAssembler(TreeStore store) {
        this.store    = store;
        this.resolver = new AncestryResolver(store);
    }

    /**
     * @param research        research recorded for the node; {@code null} when the node was
     *                        never expanded
     * @param timeframe       forecasting horizon of the session, may be {@code null}
     * @param includeChildren whether to add the downward view
     */
    public ScenarioContext assemble(String nodeId, ResearchResult research,
                                    String timeframe, boolean includeChildren) {
        ScenarioNode node = store.get(nodeId);
        ResearchResult effective = research != null ? research : ResearchResult.empty();

        List<PathNode>  path     = resolver.pathFromRoot(nodeId);
        List<ChildNode> children = includeChildren ? resolver.children(nodeId) : null;

        return new ScenarioContext(
            node.event(),
            node.depth(),
            timeframe,
            path,
            PathProbabilityCalculator.cumulativeProbability(path),
            resolver.siblings(nodeId),
            children,
            effective.summary(),
            node.sources(),
            effective.queries(),
            node.sentiment(),
            node.justification()
        );
    }
}
