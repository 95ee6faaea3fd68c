package org.resilience.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.resilience.runtime.model.Agent;
import org.resilience.runtime.model.AgentPopulation;
import org.resilience.runtime.model.Environment;
import org.resilience.runtime.spi.DeathContext;
import org.resilience.runtime.spi.IDeathHandler;
import org.resilience.runtime.spi.IRandomProvider;
import org.resilience.runtime.spi.ITickPlugin;
import org.resilience.runtime.transfer.ResourceTransferProtocol;
import org.resilience.runtime.transfer.TransferLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manages the core simulation loop. It owns the environment, the agent live set and the
 * model's single random source, and advances the model tick by tick.
 * <p>
 * A tick visits every live agent once, in an order reshuffled every tick, and runs the full
 * transfer protocol for one agent before starting the next. Agents acting later in a tick
 * see what earlier agents did to a shared cell. Dead agents are removed at the end of the
 * agent phase, then tick plugins run as the model-wide update.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. The whole model is driven by one thread.
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);
    private final Environment environment;
    private final ModelParameters parameters;
    private final IRandomProvider randomProvider;
    private final AgentPopulation population = new AgentPopulation();
    private final ResourceTransferProtocol protocol;
    private final TransferLedger ledger = new TransferLedger();
    private final List<ITickPlugin> tickPlugins = new ArrayList<>();
    private final List<IDeathHandler> deathHandlers = new ArrayList<>();
    private final DeathContext deathContext = new DeathContext();  // Reused across deaths
    private long currentTick = 0L;
    private int nextAgentId = 1;
    private long totalDeaths = 0L;

    /**
     * Constructs a new Simulation instance with no agents.
     *
     * @param environment The grid, already sized to the parameters.
     * @param parameters The model parameters.
     * @param randomProvider The single random source of this model.
     * @throws IllegalArgumentException if the environment size does not match the parameters.
     */
    public Simulation(Environment environment, ModelParameters parameters, IRandomProvider randomProvider) {
        if (environment.getWidth() != parameters.width() || environment.getHeight() != parameters.height()) {
            throw new IllegalArgumentException("Environment " + environment.getWidth() + "x" + environment.getHeight()
                + " does not match configured grid " + parameters.width() + "x" + parameters.height());
        }
        this.environment = environment;
        this.parameters = parameters;
        this.randomProvider = randomProvider;
        this.protocol = new ResourceTransferProtocol(parameters, randomProvider);
    }

    public ModelParameters getParameters() {
        return parameters;
    }

    /**
     * Adds a live agent to the simulation.
     * @param agent The agent to add.
     */
    public void addAgent(Agent agent) {
        population.add(agent);
    }

    /**
     * Returns the next available unique ID for an agent.
     * @return A unique agent ID.
     */
    public int getNextAgentId() {
        return nextAgentId++;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    /**
     * Adds a tick plugin. Plugins run in the order they are added, after the agent phase.
     * @param plugin The tick plugin to add.
     */
    public void addTickPlugin(ITickPlugin plugin) {
        this.tickPlugins.add(plugin);
    }

    /**
     * Returns the list of tick plugins.
     * @return An unmodifiable view of the tick plugins list.
     */
    public List<ITickPlugin> getTickPlugins() {
        return Collections.unmodifiableList(this.tickPlugins);
    }

    /**
     * Adds a death handler. Handlers are called in the order they are added, once per death,
     * after the agent's holdings have been recycled.
     * @param handler The death handler to add.
     */
    public void addDeathHandler(IDeathHandler handler) {
        this.deathHandlers.add(handler);
    }

    /**
     * Returns the list of death handlers.
     * @return An unmodifiable view of the death handlers list.
     */
    public List<IDeathHandler> getDeathHandlers() {
        return Collections.unmodifiableList(this.deathHandlers);
    }

    /**
     * Executes a single simulation tick.
     */
    public void tick() {
        ledger.clear();

        int[] order = population.shuffledLiveSlots(randomProvider.asJavaRandom());
        for (int slot : order) {
            Agent agent = population.atSlot(slot);
            if (protocol.step(agent, environment, ledger, currentTick, deathContext)) {
                population.markDead(agent);
                handleDeath(agent);
            }
        }
        int removed = population.compact();

        for (ITickPlugin plugin : tickPlugins) {
            try {
                plugin.execute(this);
            } catch (Exception e) {
                LOG.warn("Tick plugin '{}' failed at tick {}: {}",
                        plugin.getClass().getSimpleName(), currentTick, e.getMessage());
            }
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Tick={} Active={} Died={} Live={} Events={} NetChange={}",
                    currentTick, order.length, removed, population.liveCount(), ledger.size(), ledger.netChange());
        }
        this.currentTick++;
    }

    /**
     * Executes a fixed number of ticks.
     * @param ticks The number of ticks to run, must be >= 0.
     */
    public void run(long ticks) {
        if (ticks < 0) {
            throw new IllegalArgumentException("ticks must be >= 0, got " + ticks);
        }
        for (long i = 0; i < ticks; i++) {
            tick();
        }
    }

    /**
     * Invokes all registered death handlers for the agent that just died.
     *
     * @param agent The agent that has died
     */
    private void handleDeath(Agent agent) {
        totalDeaths++;
        for (IDeathHandler handler : deathHandlers) {
            try {
                handler.onDeath(deathContext);
            } catch (Exception e) {
                LOG.warn("Death handler '{}' failed for agent {}: {}",
                        handler.getClass().getSimpleName(), agent.getId(), e.getMessage());
            }
        }
    }

    /**
     * Returns the live agents in slot order.
     * @return An unmodifiable list of live agents.
     */
    public List<Agent> getAgents() {
        return population.liveAgents();
    }

    /**
     * Looks up a live agent by id.
     * @param id The agent id.
     * @return The agent, or {@code null} if it does not exist or has died.
     */
    public Agent getAgent(int id) {
        Agent agent = population.get(id);
        return agent == null || agent.isDead() ? null : agent;
    }

    public int getLiveAgentCount() {
        return population.liveCount();
    }

    /**
     * @return The number of agents that have died since the simulation was created.
     */
    public long getTotalDeaths() {
        return totalDeaths;
    }

    /**
     * Returns the operations log of the most recent tick.
     * @return The ledger, cleared at the start of every tick.
     */
    public TransferLedger getLedger() {
        return ledger;
    }

    public Environment getEnvironment() {
        return environment;
    }

    /**
     * Returns the current simulation tick count.
     * @return The number of completed ticks.
     */
    public long getCurrentTick() {
        return currentTick;
    }
}
