package org.resilience.runtime.transfer;

import java.util.List;

import org.resilience.runtime.ModelParameters;
import org.resilience.runtime.model.Agent;
import org.resilience.runtime.model.EnergyKind;
import org.resilience.runtime.model.Environment;
import org.resilience.runtime.spi.DeathContext;
import org.resilience.runtime.spi.IRandomProvider;

/**
 * The per-agent step: move, gather, emit, death check.
 * <p>
 * Each phase moves quantities between one agent and the cell it currently occupies and
 * records every movement in a {@link TransferLedger}. No phase drives a cell or an agent
 * store below zero. Three movements change the system total:
 * <ul>
 *   <li>the movement cost, which leaves the agent without going anywhere,</li>
 *   <li>the waste generated from a harvest, which appears in the agent's waste store,</li>
 *   <li>the overflow waste, which appears in the cell on top of the returned overflow.</li>
 * </ul>
 * Everything else is a transfer.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. One agent's step must complete before the next starts.
 */
public class ResourceTransferProtocol {

    private final ModelParameters params;
    private final IRandomProvider random;

    /**
     * @param params The model parameters supplying rates and fractions.
     * @param random The model's random source, used for move selection.
     */
    public ResourceTransferProtocol(ModelParameters params, IRandomProvider random) {
        this.params = params;
        this.random = random;
    }

    /**
     * Runs all four phases for one agent.
     *
     * @param agent The acting agent, must be alive.
     * @param environment The grid.
     * @param ledger Receives every movement.
     * @param tick The current tick.
     * @param deathContext Filled in if the agent dies.
     * @return {@code true} if the agent died in this step.
     */
    public boolean step(Agent agent, Environment environment, TransferLedger ledger, long tick,
                        DeathContext deathContext) {
        if (agent.isDead()) {
            throw new IllegalStateException("Dead agent " + agent.getId() + " cannot act");
        }
        move(agent, environment, ledger, tick);
        gather(agent, environment, ledger, tick);
        emit(agent, environment, ledger, tick);
        return checkDeath(agent, environment, ledger, tick, deathContext);
    }

    /**
     * Relocates the agent to a uniformly chosen Moore neighbour and charges the movement cost,
     * first from the dynamic store, then from the static store (floored at zero).
     * The cost is not returned to the environment.
     */
    public void move(Agent agent, Environment environment, TransferLedger ledger, long tick) {
        List<int[]> candidates = environment.neighbors(agent.getX(), agent.getY());
        if (!candidates.isEmpty()) {
            agent.moveTo(candidates.get(random.nextInt(candidates.size())));
        }

        double cost = params.movementCost();
        double dynamic = agent.getDynamicStore();
        if (dynamic >= cost) {
            agent.setDynamicStore(dynamic - cost);
            ledger.record(tick, agent.getId(), TransferEvent.Type.MOVEMENT_COST_DYNAMIC, cost);
        } else {
            double shortfall = cost - dynamic;
            agent.setDynamicStore(0.0);
            ledger.record(tick, agent.getId(), TransferEvent.Type.MOVEMENT_COST_DYNAMIC, dynamic);

            double staticBefore = agent.getStaticStore();
            double staticAfter = Math.max(staticBefore - shortfall, 0.0);
            agent.setStaticStore(staticAfter);
            ledger.record(tick, agent.getId(), TransferEvent.Type.MOVEMENT_COST_STATIC, staticBefore - staticAfter);
        }
    }

    /**
     * Harvests from the agent's cell into its dynamic store, adds the generated waste to its
     * waste store, and returns anything above capacity to the cell.
     */
    public void gather(Agent agent, Environment environment, TransferLedger ledger, long tick) {
        int x = agent.getX();
        int y = agent.getY();
        double need = agent.getNeededEnergy();

        double dynamicWanted = params.dynamicTarget(need) * params.rateDynamicGather();
        double staticWanted = params.staticTarget(need) * params.rateStaticGather();
        double dynamicGathered = Math.min(environment.energyAt(EnergyKind.DYNAMIC, x, y), dynamicWanted);
        double staticGathered = Math.min(environment.energyAt(EnergyKind.STATIC, x, y), staticWanted);

        environment.adjust(EnergyKind.DYNAMIC, x, y, -dynamicGathered);
        environment.adjust(EnergyKind.STATIC, x, y, -staticGathered);
        ledger.record(tick, agent.getId(), TransferEvent.Type.HARVEST_DYNAMIC, dynamicGathered);
        ledger.record(tick, agent.getId(), TransferEvent.Type.HARVEST_STATIC, staticGathered);

        double collected = dynamicGathered + staticGathered;
        agent.setDynamicStore(agent.getDynamicStore() + collected);

        double generatedWaste = collected * params.percentWasteGenerated();
        agent.setWasteStore(agent.getWasteStore() + generatedWaste);
        ledger.record(tick, agent.getId(), TransferEvent.Type.WASTE_GENERATED, generatedWaste);

        double capacity = agent.getMaxDynamicStore();
        if (agent.getDynamicStore() > capacity) {
            double excess = agent.getDynamicStore() - capacity;
            agent.setDynamicStore(capacity);

            double overflowWaste = excess * params.overflowWasteFraction();
            environment.adjust(EnergyKind.DYNAMIC, x, y, excess);
            environment.adjust(EnergyKind.WASTE, x, y, overflowWaste);
            ledger.record(tick, agent.getId(), TransferEvent.Type.OVERFLOW_RETURNED, excess);
            ledger.record(tick, agent.getId(), TransferEvent.Type.OVERFLOW_WASTE, overflowWaste);
        }
    }

    /**
     * Emits a fraction of the dynamic store into the cell, split between dynamic energy and waste.
     */
    public void emit(Agent agent, Environment environment, TransferLedger ledger, long tick) {
        double dynamic = agent.getDynamicStore();
        double output = Math.min(dynamic * params.emitFraction(), dynamic);
        agent.setDynamicStore(dynamic - output);

        double toWaste = output * params.emitWasteFraction();
        double toDynamic = output * (1.0 - params.emitWasteFraction());
        environment.adjust(EnergyKind.DYNAMIC, agent.getX(), agent.getY(), toDynamic);
        environment.adjust(EnergyKind.WASTE, agent.getX(), agent.getY(), toWaste);
        ledger.record(tick, agent.getId(), TransferEvent.Type.EMISSION_DYNAMIC, toDynamic);
        ledger.record(tick, agent.getId(), TransferEvent.Type.EMISSION_WASTE, toWaste);
    }

    /**
     * Kills the agent if its waste exceeds its static store. Its total holdings are split by the
     * death recycle ratio into the cell's dynamic energy and waste.
     *
     * @return {@code true} if the agent died.
     */
    public boolean checkDeath(Agent agent, Environment environment, TransferLedger ledger, long tick,
                              DeathContext deathContext) {
        if (!agent.isDeathConditionMet()) {
            return false;
        }
        int x = agent.getX();
        int y = agent.getY();
        double total = agent.getTotalHoldings();
        double toDynamic = total * params.deathRecycleRatio();
        double toWaste = total * (1.0 - params.deathRecycleRatio());

        deathContext.reset(tick, agent.getId(), x, y, agent.getStaticStore(), agent.getDynamicStore(),
            agent.getWasteStore(), toDynamic, toWaste);

        environment.adjust(EnergyKind.DYNAMIC, x, y, toDynamic);
        environment.adjust(EnergyKind.WASTE, x, y, toWaste);
        ledger.record(tick, agent.getId(), TransferEvent.Type.DEATH_RECYCLE_DYNAMIC, toDynamic);
        ledger.record(tick, agent.getId(), TransferEvent.Type.DEATH_RECYCLE_WASTE, toWaste);

        agent.kill(tick);
        return true;
    }
}
