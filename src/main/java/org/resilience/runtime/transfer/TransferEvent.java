package org.resilience.runtime.transfer;

/**
 * One quantity movement performed by the transfer protocol on behalf of an agent.
 *
 * @param tick The tick the movement happened in.
 * @param agentId The acting agent.
 * @param type What moved, and from where to where.
 * @param amount The non-negative amount moved.
 */
public record TransferEvent(long tick, int agentId, Type type, double amount) {

    /**
     * The protocol phase that produced an event.
     */
    public enum Phase { MOVE, GATHER, EMIT, DEATH }

    /**
     * How an event changes the total amount held by grid and agents together.
     */
    public enum Effect {
        /** Quantity appears without a source. */
        CREATED,
        /** Quantity disappears without a destination. */
        DESTROYED,
        /** Quantity moves between agent and cell; the total is unchanged. */
        TRANSFERRED
    }

    public enum Type {
        /** Movement cost paid from the dynamic store. */
        MOVEMENT_COST_DYNAMIC(Phase.MOVE, Effect.DESTROYED),
        /** Movement cost shortfall taken from the static store. */
        MOVEMENT_COST_STATIC(Phase.MOVE, Effect.DESTROYED),
        /** Cell dynamic energy to agent dynamic store. */
        HARVEST_DYNAMIC(Phase.GATHER, Effect.TRANSFERRED),
        /** Cell static energy to agent dynamic store. */
        HARVEST_STATIC(Phase.GATHER, Effect.TRANSFERRED),
        /** Agent waste generated from a harvest. */
        WASTE_GENERATED(Phase.GATHER, Effect.CREATED),
        /** Dynamic store above capacity returned to cell dynamic energy. */
        OVERFLOW_RETURNED(Phase.GATHER, Effect.TRANSFERRED),
        /** Cell waste generated on top of an overflow return. */
        OVERFLOW_WASTE(Phase.GATHER, Effect.CREATED),
        /** Emitted dynamic store to cell dynamic energy. */
        EMISSION_DYNAMIC(Phase.EMIT, Effect.TRANSFERRED),
        /** Emitted dynamic store to cell waste. */
        EMISSION_WASTE(Phase.EMIT, Effect.TRANSFERRED),
        /** Dead agent's holdings to cell dynamic energy. */
        DEATH_RECYCLE_DYNAMIC(Phase.DEATH, Effect.TRANSFERRED),
        /** Dead agent's holdings to cell waste. */
        DEATH_RECYCLE_WASTE(Phase.DEATH, Effect.TRANSFERRED);

        private final Phase phase;
        private final Effect effect;

        Type(Phase phase, Effect effect) {
            this.phase = phase;
            this.effect = effect;
        }

        public Phase phase() {
            return phase;
        }

        public Effect effect() {
            return effect;
        }
    }

    public TransferEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (!(amount >= 0.0)) {
            throw new IllegalArgumentException("amount must be >= 0, got " + amount);
        }
    }

    /**
     * @return The signed change this event applies to the system total.
     */
    public double netEffect() {
        return switch (type.effect()) {
            case CREATED -> amount;
            case DESTROYED -> -amount;
            case TRANSFERRED -> 0.0;
        };
    }
}
