package org.resilience.runtime.worldgen;

import org.resilience.runtime.model.EnergyKind;
import org.resilience.runtime.model.Environment;

/**
 * Spreads a total energy budget evenly over every cell of an environment.
 * <ul>
 *   <li><b>totalEnergy:</b> The budget for the whole grid.</li>
 *   <li><b>staticShare:</b> The fraction of each cell's share placed in static energy; the
 *   remainder goes to dynamic energy. 0.8 gives the classic 80/20 split.</li>
 * </ul>
 * Waste is reset to zero.
 */
public class UniformEnergyDistributor {

    private final double totalEnergy;
    private final double staticShare;

    /**
     * @param totalEnergy The energy budget for the whole grid, must be >= 0.
     * @param staticShare The static fraction of every cell's share, in [0, 1].
     */
    public UniformEnergyDistributor(double totalEnergy, double staticShare) {
        if (!(totalEnergy >= 0.0)) {
            throw new IllegalArgumentException("totalEnergy must be >= 0, got " + totalEnergy);
        }
        if (!(staticShare >= 0.0 && staticShare <= 1.0)) {
            throw new IllegalArgumentException("staticShare must be within [0, 1], got " + staticShare);
        }
        this.totalEnergy = totalEnergy;
        this.staticShare = staticShare;
    }

    /**
     * Overwrites all three pools of every cell.
     * @param environment The environment to fill.
     */
    public void distribute(Environment environment) {
        double perCell = totalEnergy / environment.getTotalCells();
        environment.fill(EnergyKind.STATIC, perCell * staticShare);
        environment.fill(EnergyKind.DYNAMIC, perCell * (1.0 - staticShare));
        environment.fill(EnergyKind.WASTE, 0.0);
    }
}
