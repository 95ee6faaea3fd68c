package org.resilience.runtime.transfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Operations log of the transfer protocol for the current tick.
 * <p>
 * The simulation clears the ledger at the start of every tick, so after a tick it holds
 * exactly the events of that tick in execution order.
 */
public class TransferLedger {

    private final List<TransferEvent> events = new ArrayList<>();

    /**
     * Appends an event. Zero amounts are not recorded.
     *
     * @param tick The current tick.
     * @param agentId The acting agent.
     * @param type The kind of movement.
     * @param amount The amount moved.
     */
    public void record(long tick, int agentId, TransferEvent.Type type, double amount) {
        if (amount == 0.0) {
            return;
        }
        events.add(new TransferEvent(tick, agentId, type, amount));
    }

    /**
     * @return An unmodifiable view of the recorded events in execution order.
     */
    public List<TransferEvent> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Sums the amounts of all events of one type.
     * @param type The type to sum.
     * @return The total amount.
     */
    public double total(TransferEvent.Type type) {
        double sum = 0.0;
        for (TransferEvent event : events) {
            if (event.type() == type) {
                sum += event.amount();
            }
        }
        return sum;
    }

    /**
     * @return Quantity created minus quantity destroyed by the recorded events.
     */
    public double netChange() {
        double sum = 0.0;
        for (TransferEvent event : events) {
            sum += event.netEffect();
        }
        return sum;
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
