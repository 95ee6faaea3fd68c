package org.resilience.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.resilience.runtime.model.EnergyKind;
import org.resilience.runtime.model.Environment;

@Tag("unit")
class UniformEnergyDistributorTest {

    @Test
    void spreadsTheBudgetEvenlyBySharedRatio() {
        Environment env = new Environment(4, 5);
        env.set(EnergyKind.WASTE, 1, 1, 3.0);

        new UniformEnergyDistributor(2000.0, 0.8).distribute(env);

        assertThat(env.energyAt(EnergyKind.STATIC, 3, 4)).isCloseTo(80.0, within(1e-9));
        assertThat(env.energyAt(EnergyKind.DYNAMIC, 0, 0)).isCloseTo(20.0, within(1e-9));
        assertThat(env.sum(EnergyKind.WASTE)).isZero();
        assertThat(env.sum(EnergyKind.STATIC) + env.sum(EnergyKind.DYNAMIC)).isCloseTo(2000.0, within(1e-6));
    }

    @Test
    void rejectsInvalidBudget() {
        assertThatThrownBy(() -> new UniformEnergyDistributor(-1.0, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UniformEnergyDistributor(10.0, 1.2)).isInstanceOf(IllegalArgumentException.class);
    }
}
