package org.resilience.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.resilience.runtime.ModelParameters;
import org.resilience.runtime.Simulation;
import org.resilience.runtime.internal.services.SeededRandomProvider;
import org.resilience.runtime.model.Agent;
import org.resilience.runtime.model.EnergyKind;
import org.resilience.runtime.model.Environment;
import org.resilience.runtime.spi.IRandomProvider;
import org.resilience.test.utils.SimulationTestUtils;

/**
 * Unit tests for {@link AgentSeeder}: initial stores are drawn from the chosen cell.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class AgentSeederTest {

    @Mock
    private IRandomProvider random;

    private Simulation simulation(int agents) {
        ModelParameters params = SimulationTestUtils.parameters(Map.of(
            "width", 4, "height", 3, "agent-count", agents,
            "initial-static-store", 50.0, "initial-dynamic-store", 20.0, "initial-waste-store", 0.0));
        return SimulationTestUtils.createSimulation(params, 0L);
    }

    @Test
    void drawsInitialStoresFromTheCell() {
        Simulation sim = simulation(1);
        SimulationTestUtils.fillGrid(sim.getEnvironment(), 100.0, 30.0);
        when(random.nextInt(4)).thenReturn(1);
        when(random.nextInt(3)).thenReturn(2);

        int placed = new AgentSeeder(random).seed(sim);

        assertThat(placed).isEqualTo(1);
        Agent agent = sim.getAgents().get(0);
        assertThat(agent.getId()).isEqualTo(1);
        assertThat(agent.getPosition()).containsExactly(1, 2);
        assertThat(agent.getStaticStore()).isEqualTo(50.0);
        assertThat(agent.getDynamicStore()).isEqualTo(20.0);
        Environment env = sim.getEnvironment();
        assertThat(env.energyAt(EnergyKind.STATIC, 1, 2)).isEqualTo(50.0);
        assertThat(env.energyAt(EnergyKind.DYNAMIC, 1, 2)).isEqualTo(10.0);
    }

    @Test
    void dynamicShortfallIsCoveredFromStatic() {
        Simulation sim = simulation(1);
        SimulationTestUtils.fillGrid(sim.getEnvironment(), 100.0, 5.0);
        when(random.nextInt(4)).thenReturn(0);
        when(random.nextInt(3)).thenReturn(0);

        new AgentSeeder(random).seed(sim);

        Environment env = sim.getEnvironment();
        assertThat(env.energyAt(EnergyKind.DYNAMIC, 0, 0)).isZero();
        assertThat(env.energyAt(EnergyKind.STATIC, 0, 0)).isEqualTo(100.0 - 50.0 - 15.0);
        assertThat(sim.getAgents().get(0).getDynamicStore()).isEqualTo(20.0);
    }

    @Test
    void skipsCandidatesWhoseCellCannotFundThemAndKeepsTheirIds() {
        Simulation sim = simulation(3);
        SimulationTestUtils.fillGrid(sim.getEnvironment(), 100.0, 20.0);
        // all three candidates land on (2, 1); the cell funds only the first
        when(random.nextInt(4)).thenReturn(2);
        when(random.nextInt(3)).thenReturn(1);

        int placed = new AgentSeeder(random).seed(sim);

        assertThat(placed).isEqualTo(1);
        assertThat(sim.getLiveAgentCount()).isEqualTo(1);
        assertThat(sim.getEnvironment().energyAt(EnergyKind.STATIC, 2, 1)).isEqualTo(50.0);
        assertThat(sim.getNextAgentId()).isEqualTo(4);
    }

    @Test
    void seedingConservesTheTotalExceptInitialWaste() {
        ModelParameters params = SimulationTestUtils.parameters(Map.of(
            "width", 6, "height", 6, "agent-count", 20, "total-energy", 10000.0, "initial-waste-store", 2.0));
        Environment env = new Environment(6, 6);
        new UniformEnergyDistributor(params.totalEnergy(), params.staticEnergyShare()).distribute(env);
        Simulation sim = new Simulation(env, params, new SeededRandomProvider(9L));

        int placed = new AgentSeeder(sim.getRandomProvider()).seed(sim);

        double grid = env.sum(EnergyKind.STATIC) + env.sum(EnergyKind.DYNAMIC) + env.sum(EnergyKind.WASTE);
        double holdings = sim.getAgents().stream().mapToDouble(Agent::getTotalHoldings).sum();
        assertThat(grid + holdings).isCloseTo(10000.0 + 2.0 * placed, within(1e-6));
    }
}
