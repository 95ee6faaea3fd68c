package org.resilience.runtime.spi;

import java.util.Arrays;

/**
 * Context object passed to {@link IDeathHandler#onDeath(DeathContext)}.
 * <p>
 * Describes a dead agent as it was just before its holdings were recycled into its cell,
 * together with the amounts that went to the cell's dynamic energy and waste.
 * </p>
 * <p>
 * This class is reused across agent deaths to avoid allocation. Handlers must copy
 * anything they want to keep beyond the {@code onDeath} call.
 * </p>
 *
 * @see IDeathHandler
 */
public class DeathContext {

    private boolean initialized = false;
    private long tick;
    private int agentId;
    private final int[] position = new int[2];
    private double staticStore;
    private double dynamicStore;
    private double wasteStore;
    private double recycledToDynamic;
    private double recycledToWaste;

    /**
     * Resets context for reuse.
     * <p>
     * <b>Internal use only:</b> Called by the transfer protocol when an agent dies.
     * Death handlers should not call this method.
     *
     * @param tick The tick of death.
     * @param agentId The dying agent.
     * @param x The x coordinate of the death cell.
     * @param y The y coordinate of the death cell.
     * @param staticStore The static store before recycling.
     * @param dynamicStore The dynamic store before recycling.
     * @param wasteStore The waste store before recycling.
     * @param recycledToDynamic The amount added to the cell's dynamic energy.
     * @param recycledToWaste The amount added to the cell's waste.
     */
    public void reset(long tick, int agentId, int x, int y, double staticStore, double dynamicStore,
                      double wasteStore, double recycledToDynamic, double recycledToWaste) {
        this.tick = tick;
        this.agentId = agentId;
        this.position[0] = x;
        this.position[1] = y;
        this.staticStore = staticStore;
        this.dynamicStore = dynamicStore;
        this.wasteStore = wasteStore;
        this.recycledToDynamic = recycledToDynamic;
        this.recycledToWaste = recycledToWaste;
        this.initialized = true;
    }

    public long getTick() {
        checkInitialized();
        return tick;
    }

    public int getAgentId() {
        checkInitialized();
        return agentId;
    }

    public int[] getPosition() {
        checkInitialized();
        return position.clone();
    }

    public double getStaticStore() {
        checkInitialized();
        return staticStore;
    }

    public double getDynamicStore() {
        checkInitialized();
        return dynamicStore;
    }

    public double getWasteStore() {
        checkInitialized();
        return wasteStore;
    }

    /**
     * @return The agent's total holdings before recycling.
     */
    public double getTotalHoldings() {
        checkInitialized();
        return staticStore + dynamicStore + wasteStore;
    }

    public double getRecycledToDynamic() {
        checkInitialized();
        return recycledToDynamic;
    }

    public double getRecycledToWaste() {
        checkInitialized();
        return recycledToWaste;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("DeathContext not initialized - reset() must be called first");
        }
    }

    @Override
    public String toString() {
        return "DeathContext{tick=" + tick + ", agent=" + agentId + ", pos=" + Arrays.toString(position)
            + ", static=" + staticStore + ", dynamic=" + dynamicStore + ", waste=" + wasteStore + "}";
    }
}
