package org.resilience.runtime.spi;

import org.resilience.runtime.Simulation;

/**
 * Model-wide update hook that executes once per simulation tick.
 * <p>
 * Tick plugins run after every live agent has completed its transfer protocol and dead
 * agents have been removed. They have full read-write access to the simulation, including:
 * <ul>
 *   <li>Environment (static, dynamic and waste pools) via {@code simulation.getEnvironment()}</li>
 *   <li>Live agents via {@code simulation.getAgents()}</li>
 *   <li>Current tick via {@code simulation.getCurrentTick()}</li>
 *   <li>Random provider via {@code simulation.getRandomProvider()}</li>
 * </ul>
 * </p>
 * <p>
 * Plugins are executed sequentially in registration order. With no plugin registered a
 * tick performs no global mutation.
 * </p>
 */
@FunctionalInterface
public interface ITickPlugin {

    /**
     * Executes the plugin logic for the current tick.
     *
     * @param simulation The simulation instance providing access to environment and agents.
     */
    void execute(Simulation simulation);
}
