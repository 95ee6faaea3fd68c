package org.resilience.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Index-based live set of agents.
 * <p>
 * Agents occupy slots in insertion order and are looked up by id through an id-to-slot
 * index. Deaths during a tick only mark the agent; {@link #compact()} drops dead agents and
 * rebuilds the index at the end of the tick, so the slot array is never mutated while a tick
 * iterates over it.
 */
public class AgentPopulation {

    private final List<Agent> slots = new ArrayList<>();
    private final Int2IntOpenHashMap slotById = new Int2IntOpenHashMap();
    private final IntOpenHashSet deadPending = new IntOpenHashSet();

    public AgentPopulation() {
        slotById.defaultReturnValue(-1);
    }

    /**
     * Adds a live agent.
     * @param agent The agent to add.
     * @throws IllegalArgumentException if an agent with the same id is already present or the agent is dead.
     */
    public void add(Agent agent) {
        if (agent.isDead()) {
            throw new IllegalArgumentException("Cannot add dead agent " + agent.getId());
        }
        if (slotById.containsKey(agent.getId())) {
            throw new IllegalArgumentException("Duplicate agent id " + agent.getId());
        }
        slotById.put(agent.getId(), slots.size());
        slots.add(agent);
    }

    /**
     * Looks up an agent by id. Agents marked dead remain reachable until {@link #compact()}.
     * @param id The agent id.
     * @return The agent, or {@code null} if none has this id.
     */
    public Agent get(int id) {
        int slot = slotById.get(id);
        return slot < 0 ? null : slots.get(slot);
    }

    /**
     * Returns the agent at a slot.
     * @param slot The slot index, in {@code [0, slotCount())}.
     * @return The agent in that slot.
     */
    public Agent atSlot(int slot) {
        return slots.get(slot);
    }

    public int slotCount() {
        return slots.size();
    }

    /**
     * Records that an agent in this population has died. The agent must already be killed.
     * @param agent The dead agent.
     */
    public void markDead(Agent agent) {
        if (!agent.isDead()) {
            throw new IllegalStateException("Agent " + agent.getId() + " is not dead");
        }
        deadPending.add(agent.getId());
    }

    /**
     * Returns the slots of all live agents in a freshly shuffled order.
     * @param random The random source driving the shuffle.
     * @return A new array of slot indices.
     */
    public int[] shuffledLiveSlots(Random random) {
        IntArrayList live = new IntArrayList(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            if (!slots.get(i).isDead()) {
                live.add(i);
            }
        }
        int[] order = live.toIntArray();
        IntArrays.shuffle(order, random);
        return order;
    }

    /**
     * Drops dead agents and rebuilds the id index.
     * @return The number of agents removed.
     */
    public int compact() {
        if (deadPending.isEmpty()) {
            return 0;
        }
        int before = slots.size();
        slots.removeIf(Agent::isDead);
        slotById.clear();
        for (int i = 0; i < slots.size(); i++) {
            slotById.put(slots.get(i).getId(), i);
        }
        deadPending.clear();
        return before - slots.size();
    }

    /**
     * @return The number of agents that are alive, excluding agents marked dead but not yet compacted.
     */
    public int liveCount() {
        return slots.size() - deadPending.size();
    }

    /**
     * @return An unmodifiable view of the live agents in slot order.
     */
    public List<Agent> liveAgents() {
        if (deadPending.isEmpty()) {
            return Collections.unmodifiableList(slots);
        }
        List<Agent> live = new ArrayList<>(liveCount());
        for (Agent agent : slots) {
            if (!agent.isDead()) {
                live.add(agent);
            }
        }
        return Collections.unmodifiableList(live);
    }
}
