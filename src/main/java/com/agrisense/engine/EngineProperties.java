package com.agrisense.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Inference engine settings, bound from {@code agrisense.engine.*}.
 *
 * @param maxCycles           firings allowed per run before the run is aborted
 * @param historySize         firings attached to a cycle-limit error
 * @param strategy            conflict resolution order
 * @param incrementalMatching reuse per-rule join results while their fact kinds are unchanged
 */
@ConfigurationProperties(prefix = "agrisense.engine")
public record EngineProperties(
    @DefaultValue("10000") int maxCycles,
    @DefaultValue("10") int historySize,
    @DefaultValue("earliest-fact") ResolutionStrategy strategy,
    @DefaultValue("true") boolean incrementalMatching
) {

    public EngineProperties {
        if (maxCycles < 1) {
            throw new IllegalArgumentException("agrisense.engine.max-cycles must be positive");
        }
        if (historySize < 0) {
            throw new IllegalArgumentException("agrisense.engine.history-size must not be negative");
        }
        if (strategy == null) {
            strategy = ResolutionStrategy.EARLIEST_FACT;
        }
    }

    public static EngineProperties defaults() {
        return new EngineProperties(10_000, 10, ResolutionStrategy.EARLIEST_FACT, true);
    }
}
