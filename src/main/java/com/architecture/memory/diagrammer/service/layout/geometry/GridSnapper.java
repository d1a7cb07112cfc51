package com.architecture.memory.diagrammer.service.layout.geometry;

/**
 * Grid snapping for every coordinate the engine persists.
 */
public final class GridSnapper {

    private GridSnapper() {
    }

    /**
     * Round a coordinate to the nearest grid multiple (halves round up).
     */
    public static double snap(double value, int gridSize) {
        int grid = effectiveGrid(gridSize);
        return Math.floor(value / grid + 0.5) * grid;
    }

    /**
     * Largest grid multiple not greater than {@code value}.
     */
    public static double snapDown(double value, int gridSize) {
        int grid = effectiveGrid(gridSize);
        return Math.floor(value / grid) * grid;
    }

    /**
     * Smallest grid multiple not less than {@code value}.
     */
    public static double snapUp(double value, int gridSize) {
        int grid = effectiveGrid(gridSize);
        return Math.ceil(value / grid) * grid;
    }

    public static boolean isOnGrid(double value, int gridSize) {
        int grid = effectiveGrid(gridSize);
        return Math.abs(value / grid - Math.rint(value / grid)) < 1e-9;
    }

    private static int effectiveGrid(int gridSize) {
        return Math.max(1, gridSize);
    }
}
