package org.resilience.runtime.worldgen;

import org.resilience.runtime.ModelParameters;
import org.resilience.runtime.Simulation;
import org.resilience.runtime.model.EnergyKind;
import org.resilience.runtime.model.Environment;
import org.resilience.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a ready-to-run simulation from validated parameters: creates the grid, spreads the
 * energy budget over it and seeds the agents.
 */
public final class ModelInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(ModelInitializer.class);

    private ModelInitializer() {
    }

    /**
     * Creates and populates a simulation.
     *
     * @param params The model parameters.
     * @param random The model's single random source; seeding draws from it first.
     * @return The initialized simulation at tick 0.
     */
    public static Simulation initialize(ModelParameters params, IRandomProvider random) {
        Environment environment = new Environment(params.width(), params.height());
        new UniformEnergyDistributor(params.totalEnergy(), params.staticEnergyShare()).distribute(environment);

        Simulation simulation = new Simulation(environment, params, random);
        int placed = new AgentSeeder(random).seed(simulation);

        LOG.info("Initialized {}x{} grid: static={} dynamic={}, agents seeded {}/{}",
                params.width(), params.height(),
                environment.sum(EnergyKind.STATIC), environment.sum(EnergyKind.DYNAMIC),
                placed, params.agentCount());
        if (placed < params.agentCount()) {
            LOG.info("{} agent candidates skipped: their cells could not fund the initial stores",
                    params.agentCount() - placed);
        }
        return simulation;
    }
}
