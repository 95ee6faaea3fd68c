package org.resilience.cli.config;

import com.typesafe.config.Config;

/**
 * Run options from {@code resilience.simulation}, after command-line overrides.
 *
 * @param seed The model's random seed.
 * @param ticks The number of ticks to run, at least 0.
 * @param reportInterval Ticks between progress log lines, at least 1.
 */
public record RunSettings(long seed, long ticks, int reportInterval) {

    public RunSettings {
        if (ticks < 0) {
            throw new IllegalArgumentException("ticks must be >= 0, got " + ticks);
        }
        if (reportInterval < 1) {
            throw new IllegalArgumentException("report-interval must be >= 1, got " + reportInterval);
        }
    }

    /**
     * Reads the settings from a {@code resilience.simulation} block.
     */
    static RunSettings fromConfig(Config block) {
        return new RunSettings(block.getLong("seed"), block.getLong("ticks"), block.getInt("report-interval"));
    }

    /**
     * Replaces the values given on the command line; {@code null} keeps the configured one.
     *
     * @return New validated settings.
     */
    public RunSettings withOverrides(Long seedOverride, Long ticksOverride, Integer intervalOverride) {
        return new RunSettings(
            seedOverride != null ? seedOverride : seed,
            ticksOverride != null ? ticksOverride : ticks,
            intervalOverride != null ? intervalOverride : reportInterval);
    }
}
