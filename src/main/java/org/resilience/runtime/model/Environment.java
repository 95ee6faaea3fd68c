package org.resilience.runtime.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;

/**
 * Represents the simulation environment: a periodic (toroidal) two-dimensional grid where
 * every cell holds a static energy, a dynamic energy and a waste amount.
 * <p>
 * The environment is a plain arithmetic container. {@link #adjust} does not clamp; callers
 * must make sure a delta never drives a cell below zero.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. The simulation mutates it from a single thread.
 */
public class Environment {
    private final int[] shape;
    private final int[] strides;
    private final int totalCells;

    // One flat array per EnergyKind, indexed by ordinal
    private final double[][] pools;

    /**
     * Creates an empty environment of the given size. All pools start at zero.
     *
     * @param width The number of cells along x.
     * @param height The number of cells along y.
     * @throws IllegalArgumentException if a dimension is not positive or the grid is too large.
     */
    public Environment(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                "Grid dimensions must be positive, got " + width + "x" + height);
        }
        long sizeLong = (long) width * height;
        if (sizeLong > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                "World too large: " + sizeLong + " cells exceeds Integer.MAX_VALUE. Shape: " + width + "x" + height);
        }
        this.shape = new int[]{width, height};
        this.totalCells = (int) sizeLong;
        this.strides = new int[]{height, 1};
        this.pools = new double[EnergyKind.values().length][totalCells];
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getWidth() {
        return shape[0];
    }

    public int getHeight() {
        return shape[1];
    }

    public int getTotalCells() {
        return totalCells;
    }

    /**
     * Wraps a coordinate onto the torus.
     * @param coord The (x, y) coordinate, possibly outside the grid.
     * @return The equivalent coordinate inside the grid.
     */
    public int[] getNormalizedCoordinate(int... coord) {
        if (coord.length != shape.length) {
            throw new IllegalArgumentException("Coordinate dimensions do not match world dimensions.");
        }
        int[] normalized = new int[coord.length];
        for (int i = 0; i < coord.length; i++) {
            normalized[i] = Math.floorMod(coord[i], shape[i]);
        }
        return normalized;
    }

    private int getFlatIndex(int x, int y) {
        return Math.floorMod(x, shape[0]) * strides[0] + Math.floorMod(y, shape[1]) * strides[1];
    }

    /**
     * Returns the amount of the given kind stored at a cell.
     * @param kind The pool to read.
     * @param x The x coordinate (wrapped).
     * @param y The y coordinate (wrapped).
     * @return The current amount.
     */
    public double energyAt(EnergyKind kind, int x, int y) {
        return pools[kind.ordinal()][getFlatIndex(x, y)];
    }

    /**
     * Adds {@code delta} to a cell's pool. A negative delta withdraws; the caller guarantees
     * the withdrawal does not exceed the cell's current amount.
     *
     * @param kind The pool to change.
     * @param x The x coordinate (wrapped).
     * @param y The y coordinate (wrapped).
     * @param delta The signed change.
     */
    public void adjust(EnergyKind kind, int x, int y, double delta) {
        pools[kind.ordinal()][getFlatIndex(x, y)] += delta;
    }

    /**
     * Overwrites a cell's pool. Used by world generation and tests.
     *
     * @param kind The pool to set.
     * @param x The x coordinate (wrapped).
     * @param y The y coordinate (wrapped).
     * @param amount The new amount, must be non-negative.
     */
    public void set(EnergyKind kind, int x, int y, double amount) {
        if (amount < 0.0 || Double.isNaN(amount)) {
            throw new IllegalArgumentException("Cell amount must be >= 0, got " + amount);
        }
        pools[kind.ordinal()][getFlatIndex(x, y)] = amount;
    }

    /**
     * Fills every cell's pool of the given kind with the same amount.
     * @param kind The pool to fill.
     * @param amount The per-cell amount, must be non-negative.
     */
    public void fill(EnergyKind kind, double amount) {
        if (amount < 0.0 || Double.isNaN(amount)) {
            throw new IllegalArgumentException("Cell amount must be >= 0, got " + amount);
        }
        Arrays.fill(pools[kind.ordinal()], amount);
    }

    /**
     * Returns the Moore neighbourhood of a cell with periodic wrap-around. The centre cell is
     * excluded, and on grids narrower than the neighbourhood each distinct cell appears once.
     * <p>
     * Order is stable: x offset ascending, then y offset ascending.
     *
     * @param x The centre x coordinate.
     * @param y The centre y coordinate.
     * @param radius The Chebyshev radius, must be >= 1.
     * @return The neighbouring coordinates; empty on a 1x1 grid.
     */
    public List<int[]> neighbors(int x, int y, int radius) {
        if (radius < 1) {
            throw new IllegalArgumentException("radius must be >= 1, got " + radius);
        }
        int center = getFlatIndex(x, y);
        IntLinkedOpenHashSet seen = new IntLinkedOpenHashSet();
        List<int[]> result = new ArrayList<>();
        for (int dx = -radius; dx <= radius; dx++) {
            for (int dy = -radius; dy <= radius; dy++) {
                if (dx == 0 && dy == 0) continue;
                int index = getFlatIndex(x + dx, y + dy);
                if (index == center || !seen.add(index)) continue;
                result.add(getNormalizedCoordinate(x + dx, y + dy));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the 8-cell Moore neighbourhood (radius 1).
     * @param x The centre x coordinate.
     * @param y The centre y coordinate.
     * @return The neighbouring coordinates.
     */
    public List<int[]> neighbors(int x, int y) {
        return neighbors(x, y, 1);
    }

    /**
     * Sums a pool over all cells.
     * @param kind The pool to sum.
     * @return The grid-wide total.
     */
    public double sum(EnergyKind kind) {
        double total = 0.0;
        for (double value : pools[kind.ordinal()]) {
            total += value;
        }
        return total;
    }

    /**
     * Returns a copy of a pool as a {@code [x][y]} array for external inspection or plotting.
     * @param kind The pool to copy.
     * @return A detached copy; changing it does not affect the environment.
     */
    public double[][] snapshot(EnergyKind kind) {
        double[][] copy = new double[shape[0]][shape[1]];
        double[] pool = pools[kind.ordinal()];
        for (int x = 0; x < shape[0]; x++) {
            System.arraycopy(pool, x * strides[0], copy[x], 0, shape[1]);
        }
        return copy;
    }
}
