package org.resilience.runtime.model;

import java.util.Arrays;

import org.resilience.runtime.ModelParameters;
import org.resilience.runtime.Simulation;

/**
 * A mobile forager living on one grid cell at a time.
 * <p>
 * An agent carries three stores: a depletion-only static reserve, a dynamic working reserve
 * bounded by {@link #getMaxDynamicStore()}, and an accumulated waste store. It dies the step
 * its waste exceeds its static reserve.
 * <p>
 * <b>Thread safety:</b> Not thread-safe.
 */
public class Agent {

    private final int id;
    private int[] position;
    private double staticStore;
    private double dynamicStore;
    private double wasteStore;
    private final double maxDynamicStore;
    private final double neededEnergy;
    private boolean isDead = false;
    private long deathTick = -1L;

    /**
     * Constructs a new agent. Prefer {@link #create} inside a running simulation.
     *
     * @param id The unique identifier.
     * @param position The initial (x, y) cell.
     * @param staticStore The initial static reserve.
     * @param dynamicStore The initial dynamic reserve.
     * @param wasteStore The initial waste.
     * @param maxDynamicStore The dynamic reserve capacity, must be positive.
     * @param neededEnergy The per-step harvest target, must be positive.
     */
    public Agent(int id, int[] position, double staticStore, double dynamicStore, double wasteStore,
                 double maxDynamicStore, double neededEnergy) {
        if (position == null || position.length != 2) {
            throw new IllegalArgumentException("Agent position must be an (x, y) pair");
        }
        if (!(maxDynamicStore > 0.0)) {
            throw new IllegalArgumentException("maxDynamicStore must be > 0, got " + maxDynamicStore);
        }
        if (!(neededEnergy > 0.0)) {
            throw new IllegalArgumentException("neededEnergy must be > 0, got " + neededEnergy);
        }
        if (staticStore < 0.0 || dynamicStore < 0.0 || wasteStore < 0.0) {
            throw new IllegalArgumentException("Agent stores must be >= 0, got static=" + staticStore
                + " dynamic=" + dynamicStore + " waste=" + wasteStore);
        }
        if (dynamicStore > maxDynamicStore) {
            throw new IllegalArgumentException("dynamicStore " + dynamicStore
                + " exceeds maxDynamicStore " + maxDynamicStore);
        }
        this.id = id;
        this.position = position.clone();
        this.staticStore = staticStore;
        this.dynamicStore = dynamicStore;
        this.wasteStore = wasteStore;
        this.maxDynamicStore = maxDynamicStore;
        this.neededEnergy = neededEnergy;
    }

    /**
     * Creates an agent with the next free id of the simulation and the capacity and harvest
     * target configured in its {@link ModelParameters}. The agent is not added to the simulation.
     *
     * @param simulation The owning simulation.
     * @param position The initial (x, y) cell.
     * @param staticStore The initial static reserve.
     * @param dynamicStore The initial dynamic reserve.
     * @param wasteStore The initial waste.
     * @return The new agent.
     */
    public static Agent create(Simulation simulation, int[] position, double staticStore,
                               double dynamicStore, double wasteStore) {
        ModelParameters params = simulation.getParameters();
        return new Agent(simulation.getNextAgentId(), position, staticStore, dynamicStore, wasteStore,
            params.maxDynamicStore(), params.neededEnergy());
    }

    public int getId() {
        return id;
    }

    public int[] getPosition() {
        return position.clone();
    }

    public int getX() {
        return position[0];
    }

    public int getY() {
        return position[1];
    }

    /**
     * Relocates the agent. The coordinate must already be normalized by the environment.
     * @param newPosition The new (x, y) cell.
     */
    public void moveTo(int[] newPosition) {
        this.position = newPosition.clone();
    }

    public double getStaticStore() {
        return staticStore;
    }

    public void setStaticStore(double staticStore) {
        this.staticStore = staticStore;
    }

    public double getDynamicStore() {
        return dynamicStore;
    }

    public void setDynamicStore(double dynamicStore) {
        this.dynamicStore = dynamicStore;
    }

    public double getWasteStore() {
        return wasteStore;
    }

    public void setWasteStore(double wasteStore) {
        this.wasteStore = wasteStore;
    }

    public double getMaxDynamicStore() {
        return maxDynamicStore;
    }

    public double getNeededEnergy() {
        return neededEnergy;
    }

    /**
     * @return The sum of the static, dynamic and waste stores.
     */
    public double getTotalHoldings() {
        return staticStore + dynamicStore + wasteStore;
    }

    /**
     * @return {@code true} once waste has grown past the static reserve.
     */
    public boolean isDeathConditionMet() {
        return wasteStore > staticStore;
    }

    /**
     * Marks the agent dead and empties its stores. The caller must already have handed the
     * holdings back to the environment.
     *
     * @param tick The tick of death.
     */
    public void kill(long tick) {
        this.isDead = true;
        this.deathTick = tick;
        this.staticStore = 0.0;
        this.dynamicStore = 0.0;
        this.wasteStore = 0.0;
    }

    public boolean isDead() {
        return isDead;
    }

    /**
     * @return The tick the agent died in, or -1 while alive.
     */
    public long getDeathTick() {
        return deathTick;
    }

    @Override
    public String toString() {
        return "Agent{id=" + id + ", pos=" + Arrays.toString(position)
            + ", static=" + staticStore + ", dynamic=" + dynamicStore + ", waste=" + wasteStore
            + (isDead ? ", dead@" + deathTick : "") + "}";
    }
}
