package com.forecastplatform.common.analysis;

import com.forecastplatform.common.tree.TreeFixtures;
import com.forecastplatform.common.tree.TreeStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreeAnalyticsTest {

    @Test
    @DisplayName("unexpanded tree: weighted probability is the root's own 1.0")
    void rootOnly() {
        TreeStore store = TreeStore.seeded("Housing market correction begins");

        TreeSummary summary = TreeAnalytics.summarize(store);

        assertEquals(1, summary.totalNodes());
        assertEquals(0.0, summary.averageSentiment());
        assertEquals(1.0, summary.weightedProbability());
    }

    @Test
    @DisplayName("weights root children by |sentiment| / 100")
    void weighted() {
        TreeStore store = TreeStore.seeded("Housing market correction begins");
        TreeFixtures.expand(store, store.root(), new double[] {0.6, 0.4}, new int[] {60, -20});

        // (0.6*0.6 + 0.4*0.2) / (0.6 + 0.2) = 0.44 / 0.8
        assertEquals(0.55, TreeAnalytics.weightedProbability(store), 1e-12);
    }

    @Test
    @DisplayName("all-neutral children → 0.5")
    void neutralFallback() {
        TreeStore store = TreeStore.seeded("Housing market correction begins");
        TreeFixtures.expand(store, store.root(), 0.7, 0.3);

        assertEquals(0.5, TreeAnalytics.weightedProbability(store));
    }

    @Test
    @DisplayName("average sentiment covers every node including the root")
    void averageSentiment() {
        TreeStore store = TreeStore.seeded("Housing market correction begins");
        TreeFixtures.expand(store, store.root(), new double[] {0.5, 0.5}, new int[] {60, -30});

        // (0 + 60 - 30) / 3
        assertEquals(10.0, TreeAnalytics.averageSentiment(store), 1e-12);
        assertEquals(3, TreeAnalytics.summarize(store).totalNodes());
    }
}
