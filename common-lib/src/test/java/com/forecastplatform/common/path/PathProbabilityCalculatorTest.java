package com.forecastplatform.common.path;

import com.forecastplatform.common.model.LeafProbabilityCheck;
import com.forecastplatform.common.model.PathNode;
import com.forecastplatform.common.model.TerminalPath;
import com.forecastplatform.common.tree.ScenarioNode;
import com.forecastplatform.common.tree.TreeFixtures;
import com.forecastplatform.common.tree.TreeStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PathProbabilityCalculatorTest {

    @Nested
    @DisplayName("cumulativeProbability()")
    class Cumulative {

        @Test
        @DisplayName("product of local probabilities, root contributes 1.0")
        void product() {
            List<PathNode> path = List.of(
                new PathNode("Seed event for the test", 1.0, 0, 0, "seed"),
                new PathNode("First level outcome", 0.5, 10, 1, "j"),
                new PathNode("Second level outcome", 0.4, -10, 2, "j"));

            assertEquals(0.2, PathProbabilityCalculator.cumulativeProbability(path), 1e-12);
        }

        @Test
        @DisplayName("every node's cumulative probability is ≤ its parent's")
        void monotone() {
            TreeStore store = TreeFixtures.fullTree("Semiconductor export ban widens", 3, 0.6, 0.25, 0.15);
            Map<String, Double> cumulative = PathProbabilityCalculator.cumulativeProbabilities(store);

            assertEquals(store.size(), cumulative.size());
            for (ScenarioNode node : store.nodes()) {
                double p = cumulative.get(node.id());
                assertTrue(p <= 1.0 + 1e-9);
                store.parentOf(node.id()).ifPresent(parent ->
                    assertTrue(p <= cumulative.get(parent.id()) + 1e-12));
            }
        }
    }

    @Nested
    @DisplayName("mostProbablePath()")
    class MostProbable {

        @Test
        @DisplayName("follows the locally most probable child to a leaf")
        void greedy() {
            TreeStore store = TreeStore.seeded("Semiconductor export ban widens");
            List<ScenarioNode> l1 = TreeFixtures.expand(store, store.root(), 0.2, 0.7, 0.1);
            List<ScenarioNode> l2 = TreeFixtures.expand(store, l1.get(1), 0.35, 0.65);

            List<ScenarioNode> path = PathProbabilityCalculator.mostProbablePath(store);

            assertEquals(List.of(store.root(), l1.get(1), l2.get(1)), path);
        }

        @Test
        @DisplayName("ties resolve to the first child in insertion order")
        void tieBreak() {
            TreeStore store = TreeStore.seeded("Semiconductor export ban widens");
            List<ScenarioNode> l1 = TreeFixtures.expand(store, store.root(), 0.4, 0.4, 0.2);

            List<ScenarioNode> path = PathProbabilityCalculator.mostProbablePath(store);

            assertEquals(l1.get(0), path.get(1));
        }

        @Test
        @DisplayName("deterministic across repeated calls")
        void deterministic() {
            TreeStore store = TreeFixtures.fullTree("Semiconductor export ban widens", 2, 0.5, 0.5);
            assertEquals(PathProbabilityCalculator.mostProbablePath(store),
                         PathProbabilityCalculator.mostProbablePath(store));
        }

        @Test
        @DisplayName("unexpanded tree → root only")
        void rootOnly() {
            TreeStore store = TreeStore.seeded("Semiconductor export ban widens");
            assertEquals(List.of(store.root()), PathProbabilityCalculator.mostProbablePath(store));
        }
    }

    @Nested
    @DisplayName("verifyLeafProbabilitySum()")
    class LeafSum {

        @Test
        @DisplayName("3-level tree with children summing to 1.0 → valid, sum ≈ 1.0")
        void fullTree() {
            TreeStore store = TreeFixtures.fullTree("Semiconductor export ban widens", 3, 0.5, 0.3, 0.2);

            LeafProbabilityCheck check = PathProbabilityCalculator.verifyLeafProbabilitySum(store, 3);

            assertTrue(check.valid());
            assertEquals(1.0, check.sum(), PathProbabilityCalculator.LEAF_SUM_TOLERANCE);
            assertEquals(27, check.leafCount());
        }

        @Test
        @DisplayName("unexpanded nodes keep their mass as leaves")
        void partialTree() {
            TreeStore store = TreeStore.seeded("Semiconductor export ban widens");
            List<ScenarioNode> l1 = TreeFixtures.expand(store, store.root(), 0.5, 0.3, 0.2);
            TreeFixtures.expand(store, l1.get(0), 0.7, 0.3);

            LeafProbabilityCheck check = PathProbabilityCalculator.verifyLeafProbabilitySum(store, 3);

            assertEquals(4, check.leafCount());
            assertEquals(1.0, check.sum(), 1e-9);
            assertTrue(check.valid());
        }

        @Test
        @DisplayName("sum outside the given tolerance → invalid")
        void outsideTolerance() {
            TreeStore store = TreeStore.seeded("Semiconductor export ban widens");
            TreeFixtures.expand(store, store.root(), 0.5, 0.4995);

            LeafProbabilityCheck check = PathProbabilityCalculator.verifyLeafProbabilitySum(store, 1, 1e-5);

            assertFalse(check.valid());
            assertEquals(0.9995, check.sum(), 1e-9);
        }
    }

    @Nested
    @DisplayName("terminalPaths()")
    class TerminalPaths {

        @Test
        @DisplayName("one path per leaf, depth-first, each ending at a leaf")
        void paths() {
            TreeStore store = TreeStore.seeded("Semiconductor export ban widens");
            List<ScenarioNode> l1 = TreeFixtures.expand(store, store.root(), 0.6, 0.4);
            List<ScenarioNode> l2 = TreeFixtures.expand(store, l1.get(0), 0.5, 0.5);

            List<TerminalPath> paths = PathProbabilityCalculator.terminalPaths(store, 3);

            assertEquals(3, paths.size());
            assertEquals(l2.get(0).event(), paths.get(0).leaf().event());
            assertEquals(l2.get(1).event(), paths.get(1).leaf().event());
            assertEquals(l1.get(1).event(), paths.get(2).leaf().event());
            assertEquals(0.3, paths.get(0).cumulativeProbability(), 1e-12);
            assertEquals(0.4, paths.get(2).cumulativeProbability(), 1e-12);
            double total = paths.stream().mapToDouble(TerminalPath::cumulativeProbability).sum();
            assertEquals(1.0, total, 1e-9);
        }
    }
}
