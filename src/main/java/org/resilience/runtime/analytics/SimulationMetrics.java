package org.resilience.runtime.analytics;

import org.resilience.runtime.Simulation;
import org.resilience.runtime.model.Agent;
import org.resilience.runtime.model.EnergyKind;

/**
 * Read-only reductions over a simulation's state. Safe to call between ticks; none of the
 * methods mutate anything.
 */
public final class SimulationMetrics {

    private SimulationMetrics() {
    }

    /**
     * @param simulation The simulation to inspect.
     * @return The sum of waste over all cells.
     */
    public static double totalWaste(Simulation simulation) {
        return simulation.getEnvironment().sum(EnergyKind.WASTE);
    }

    /**
     * @param simulation The simulation to inspect.
     * @return The sum of static, dynamic and waste stores over all live agents.
     */
    public static double agentHoldings(Simulation simulation) {
        double total = 0.0;
        for (Agent agent : simulation.getAgents()) {
            total += agent.getTotalHoldings();
        }
        return total;
    }

    /**
     * Total energy of the system: every cell pool, waste included, plus every live agent's stores.
     *
     * @param simulation The simulation to inspect.
     * @return The system total.
     */
    public static double totalEnergy(Simulation simulation) {
        var env = simulation.getEnvironment();
        return env.sum(EnergyKind.STATIC) + env.sum(EnergyKind.DYNAMIC) + env.sum(EnergyKind.WASTE)
            + agentHoldings(simulation);
    }

    /**
     * @param simulation The simulation to inspect.
     * @return The number of live agents.
     */
    public static int liveAgentCount(Simulation simulation) {
        return simulation.getLiveAgentCount();
    }

    /**
     * Captures all aggregates at once.
     * @param simulation The simulation to inspect.
     * @return A snapshot labelled with the number of completed ticks.
     */
    public static MetricsSnapshot snapshot(Simulation simulation) {
        var env = simulation.getEnvironment();
        double staticEnergy = env.sum(EnergyKind.STATIC);
        double dynamicEnergy = env.sum(EnergyKind.DYNAMIC);
        double waste = env.sum(EnergyKind.WASTE);
        double holdings = agentHoldings(simulation);
        return new MetricsSnapshot(
            simulation.getCurrentTick(),
            staticEnergy,
            dynamicEnergy,
            waste,
            holdings,
            staticEnergy + dynamicEnergy + waste + holdings,
            simulation.getLiveAgentCount());
    }
}
