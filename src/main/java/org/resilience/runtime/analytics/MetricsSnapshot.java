package org.resilience.runtime.analytics;

/**
 * Aggregate values of a simulation after a given number of ticks.
 *
 * @param tick The number of completed ticks.
 * @param staticEnergy Static energy summed over all cells.
 * @param dynamicEnergy Dynamic energy summed over all cells.
 * @param totalWaste Waste summed over all cells.
 * @param agentHoldings Stores summed over all live agents.
 * @param totalEnergy Cells plus agents.
 * @param liveAgents The number of live agents.
 */
public record MetricsSnapshot(
    long tick,
    double staticEnergy,
    double dynamicEnergy,
    double totalWaste,
    double agentHoldings,
    double totalEnergy,
    int liveAgents
) {
}
