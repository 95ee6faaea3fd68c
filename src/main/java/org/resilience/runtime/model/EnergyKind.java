package org.resilience.runtime.model;

/**
 * The three quantity pools held by every grid cell.
 */
public enum EnergyKind {
    /** Depletion-only resource, only drawn from by gathering. */
    STATIC,
    /** Replenishable resource, fed by emission, overflow returns and death recycling. */
    DYNAMIC,
    /** Byproduct pool, never removed. */
    WASTE
}
