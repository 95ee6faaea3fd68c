package org.resilience.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class AgentTest {

    @Test
    void rejectsInvalidStores() {
        assertThatThrownBy(() -> new Agent(1, new int[]{0, 0}, -1.0, 0.0, 0.0, 10.0, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Agent(1, new int[]{0, 0}, 1.0, 11.0, 0.0, 10.0, 1.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("11.0");
        assertThatThrownBy(() -> new Agent(1, new int[]{0}, 1.0, 1.0, 0.0, 10.0, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Agent(1, new int[]{0, 0}, 1.0, 1.0, 0.0, 10.0, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void diesOnlyWhenWasteExceedsStatic() {
        Agent agent = new Agent(1, new int[]{2, 3}, 5.0, 1.0, 5.0, 10.0, 1.0);
        assertThat(agent.isDeathConditionMet()).isFalse();

        agent.setWasteStore(5.0001);
        assertThat(agent.isDeathConditionMet()).isTrue();
    }

    @Test
    void killEmptiesTheStores() {
        Agent agent = new Agent(4, new int[]{2, 3}, 5.0, 1.0, 6.0, 10.0, 1.0);
        assertThat(agent.getTotalHoldings()).isEqualTo(12.0);

        agent.kill(17L);

        assertThat(agent.isDead()).isTrue();
        assertThat(agent.getDeathTick()).isEqualTo(17L);
        assertThat(agent.getTotalHoldings()).isZero();
        assertThat(agent.getPosition()).containsExactly(2, 3);
    }
}
