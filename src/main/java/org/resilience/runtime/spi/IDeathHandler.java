package org.resilience.runtime.spi;

/**
 * Interface for plugins that handle agent death events.
 * <p>
 * Death handlers are called right after an agent's holdings have been recycled into its
 * cell, in the order they were registered. They receive a read-only description of the
 * death through {@link DeathContext}; the recycling itself is part of the transfer protocol
 * and cannot be changed by a handler.
 * </p>
 * <p>
 * A handler that throws is logged and skipped; the tick continues.
 * </p>
 *
 * @see DeathContext
 * @see ITickPlugin
 */
public interface IDeathHandler {

    /**
     * Called once per agent death.
     *
     * @param context Describes the dead agent and what was recycled
     */
    void onDeath(DeathContext context);
}
