package org.resilience.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable, validated model configuration.
 * <p>
 * Built from the {@code resilience.model} HOCON block (see {@code reference.conf}). Every
 * value is checked eagerly so that a bad configuration fails at setup instead of producing
 * negative or NaN state later in the run.
 *
 * @param width Grid width in cells.
 * @param height Grid height in cells.
 * @param agentCount Number of agent candidates to seed.
 * @param rateStaticGather Multiplier applied to the static harvest target.
 * @param rateDynamicGather Multiplier applied to the dynamic harvest target.
 * @param percentWasteGenerated Fraction of each harvest converted into agent waste.
 * @param dynamicVsStaticPreference Share of the harvest target drawn from dynamic energy.
 * @param wasteImpactRate Stored for model consumers; no transfer formula reads it.
 * @param initialStaticStore Static reserve of a freshly seeded agent.
 * @param initialDynamicStore Dynamic reserve of a freshly seeded agent.
 * @param initialWasteStore Waste of a freshly seeded agent.
 * @param deathRecycleRatio Fraction of a dead agent's holdings returned as dynamic energy.
 * @param maxDynamicStore Per-agent dynamic reserve capacity.
 * @param neededEnergy Per-agent harvest target per step.
 * @param totalEnergy Energy budget spread over the grid at initialization.
 * @param staticEnergyShare Fraction of the budget placed in static energy.
 * @param movementCost Energy spent per move.
 * @param overflowWasteFraction Fraction of a capacity overflow additionally created as cell waste.
 * @param emitFraction Fraction of the dynamic reserve emitted per step.
 * @param emitWasteFraction Fraction of the emission that becomes cell waste.
 */
public record ModelParameters(
    int width,
    int height,
    int agentCount,
    double rateStaticGather,
    double rateDynamicGather,
    double percentWasteGenerated,
    double dynamicVsStaticPreference,
    double wasteImpactRate,
    double initialStaticStore,
    double initialDynamicStore,
    double initialWasteStore,
    double deathRecycleRatio,
    double maxDynamicStore,
    double neededEnergy,
    double totalEnergy,
    double staticEnergyShare,
    double movementCost,
    double overflowWasteFraction,
    double emitFraction,
    double emitWasteFraction
) {

    /** Path of the model block inside the application configuration. */
    public static final String CONFIG_PATH = "resilience.model";

    public ModelParameters {
        requirePositive("width", width);
        requirePositive("height", height);
        if (agentCount < 0) {
            throw new IllegalArgumentException("agent-count must be >= 0, got " + agentCount);
        }
        requireNonNegative("rate-static-gather", rateStaticGather);
        requireNonNegative("rate-dynamic-gather", rateDynamicGather);
        requireFraction("percent-waste-generated", percentWasteGenerated);
        requireFraction("dynamic-vs-static-preference", dynamicVsStaticPreference);
        requireNonNegative("waste-impact-rate", wasteImpactRate);
        requireNonNegative("initial-static-store", initialStaticStore);
        requireNonNegative("initial-dynamic-store", initialDynamicStore);
        requireNonNegative("initial-waste-store", initialWasteStore);
        requireFraction("death-recycle-ratio", deathRecycleRatio);
        requirePositive("max-dynamic-store", maxDynamicStore);
        requirePositive("needed-energy", neededEnergy);
        requireNonNegative("total-energy", totalEnergy);
        requireFraction("static-energy-share", staticEnergyShare);
        requireNonNegative("movement-cost", movementCost);
        requireFraction("overflow-waste-fraction", overflowWasteFraction);
        requireFraction("emit-fraction", emitFraction);
        requireFraction("emit-waste-fraction", emitWasteFraction);
        if (initialDynamicStore > maxDynamicStore) {
            throw new IllegalArgumentException("initial-dynamic-store (" + initialDynamicStore
                + ") must not exceed max-dynamic-store (" + maxDynamicStore + ")");
        }
    }

    /**
     * Reads the parameters from a model configuration block. Keys absent from {@code config}
     * fall back to the classpath defaults.
     *
     * @param config The {@code resilience.model} block.
     * @return The validated parameters.
     * @throws IllegalArgumentException if a value is out of range.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     */
    public static ModelParameters fromConfig(Config config) {
        Config c = config.withFallback(ConfigFactory.defaultReference().getConfig(CONFIG_PATH));
        return new ModelParameters(
            c.getInt("width"),
            c.getInt("height"),
            c.getInt("agent-count"),
            c.getDouble("rate-static-gather"),
            c.getDouble("rate-dynamic-gather"),
            c.getDouble("percent-waste-generated"),
            c.getDouble("dynamic-vs-static-preference"),
            c.getDouble("waste-impact-rate"),
            c.getDouble("initial-static-store"),
            c.getDouble("initial-dynamic-store"),
            c.getDouble("initial-waste-store"),
            c.getDouble("death-recycle-ratio"),
            c.getDouble("max-dynamic-store"),
            c.getDouble("needed-energy"),
            c.getDouble("total-energy"),
            c.getDouble("static-energy-share"),
            c.getDouble("movement-cost"),
            c.getDouble("overflow-waste-fraction"),
            c.getDouble("emit-fraction"),
            c.getDouble("emit-waste-fraction"));
    }

    /**
     * @return The parameters defined in {@code reference.conf}.
     */
    public static ModelParameters defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * @return The dynamic harvest an agent aims for before the gather-rate multiplier.
     */
    public double dynamicTarget(double neededEnergy) {
        return neededEnergy * dynamicVsStaticPreference;
    }

    /**
     * @return The static harvest an agent aims for before the gather-rate multiplier.
     */
    public double staticTarget(double neededEnergy) {
        return neededEnergy * (1.0 - dynamicVsStaticPreference);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
    }

    private static void requireFraction(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }
}
