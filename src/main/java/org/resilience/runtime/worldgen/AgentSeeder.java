package org.resilience.runtime.worldgen;

import org.resilience.runtime.ModelParameters;
import org.resilience.runtime.Simulation;
import org.resilience.runtime.model.Agent;
import org.resilience.runtime.model.EnergyKind;
import org.resilience.runtime.model.Environment;
import org.resilience.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places the initial agents, funding their stores from the grid.
 * <p>
 * For each of the {@code agentCount} candidates a cell is drawn uniformly at random. The
 * candidate's dynamic store is taken from the cell's dynamic energy as far as it goes; the
 * remaining dynamic shortfall plus the whole static store must be covered by the cell's static
 * energy. If the cell cannot cover it, the candidate is skipped and nothing is taken.
 * The initial waste store is not drawn from the grid.
 * <p>
 * Every candidate consumes one agent id, so a skipped candidate leaves a gap in the ids.
 */
public class AgentSeeder {

    private static final Logger LOG = LoggerFactory.getLogger(AgentSeeder.class);

    private final IRandomProvider random;

    /**
     * @param random The source for candidate positions.
     */
    public AgentSeeder(IRandomProvider random) {
        this.random = random;
    }

    /**
     * Seeds the configured number of candidates into the simulation.
     *
     * @param simulation The simulation to populate.
     * @return The number of agents actually placed.
     */
    public int seed(Simulation simulation) {
        ModelParameters params = simulation.getParameters();
        Environment environment = simulation.getEnvironment();
        int placed = 0;

        for (int i = 0; i < params.agentCount(); i++) {
            int id = simulation.getNextAgentId();
            int x = random.nextInt(environment.getWidth());
            int y = random.nextInt(environment.getHeight());

            double availableDynamic = Math.min(environment.energyAt(EnergyKind.DYNAMIC, x, y), params.initialDynamicStore());
            double dynamicShortfall = params.initialDynamicStore() - availableDynamic;
            double staticNeeded = params.initialStaticStore() + dynamicShortfall;

            if (environment.energyAt(EnergyKind.STATIC, x, y) < staticNeeded) {
                LOG.debug("Skipping agent candidate {} at [{}, {}]: cell holds static={} dynamic={}, needs static={}",
                        id, x, y, environment.energyAt(EnergyKind.STATIC, x, y),
                        environment.energyAt(EnergyKind.DYNAMIC, x, y), staticNeeded);
                continue;
            }

            environment.adjust(EnergyKind.DYNAMIC, x, y, -availableDynamic);
            environment.adjust(EnergyKind.STATIC, x, y, -staticNeeded);
            simulation.addAgent(new Agent(id, new int[]{x, y},
                    params.initialStaticStore(), params.initialDynamicStore(), params.initialWasteStore(),
                    params.maxDynamicStore(), params.neededEnergy()));
            placed++;
        }
        return placed;
    }
}
