package com.forecastplatform.engine.session;

import java.time.Duration;

/**
 * Per-session generation knobs, fixed when the session is created.
 *
 * @param maxDepth         deepest level that receives nodes; nodes at this depth are never expanded
 * @param concurrencyLimit maximum nodes expanded at once within one layer
 * @param layerDelay       pause before each layer after the first; {@link Duration#ZERO} disables it
 * @param timeframe        forecasting horizon passed to synthesis, may be {@code null}
 * @param context          free-text background passed to research, may be {@code null}
 */
public record GenerationSettings(
    int      maxDepth,
    int      concurrencyLimit,
    Duration layerDelay,
    String   timeframe,
    String   context
) {

    public GenerationSettings {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative, got " + maxDepth);
        }
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1, got " + concurrencyLimit);
        }
        layerDelay = layerDelay != null && !layerDelay.isNegative() ? layerDelay : Duration.ZERO;
    }
}
