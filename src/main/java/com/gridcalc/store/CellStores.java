package com.gridcalc.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Factory and limits for cell stores.
 */
public final class CellStores {
    private static final Logger log = LogManager.getLogger(CellStores.class);

    public static final int MAX_ROWS = 999;
    public static final int MAX_COLS = 18278; // ZZZ
    public static final int DEFAULT_DENSE_CELL_LIMIT = 1_000_000;

    private CellStores() {
        // Utility class
    }

    public static CellStore create(int rows, int cols) {
        return create(rows, cols, StorageMode.AUTO, DEFAULT_DENSE_CELL_LIMIT);
    }

    /**
     * Builds a store for the given dimensions.
     *
     * @param mode           Forced layout, or AUTO.
     * @param denseCellLimit Largest rows x cols for which AUTO picks the dense layout.
     * @throws IllegalArgumentException if the dimensions are outside 1..999 x 1..18278.
     */
    public static CellStore create(int rows, int cols, StorageMode mode, int denseCellLimit) {
        checkDimensions(rows, cols);
        StorageMode resolved = mode;
        if (mode == null || mode == StorageMode.AUTO)
            resolved = (long) rows * cols <= denseCellLimit ? StorageMode.DENSE : StorageMode.SPARSE;
        log.debug("Creating {} store for {}x{} sheet", resolved, rows, cols);
        return resolved == StorageMode.DENSE ? new DenseCellStore(rows, cols) : new SparseCellStore(rows, cols);
    }

    public static void checkDimensions(int rows, int cols) {
        if (rows < 1 || rows > MAX_ROWS || cols < 1 || cols > MAX_COLS)
            throw new IllegalArgumentException(
                    "Invalid dimensions " + rows + "x" + cols + ": rows must be 1.." + MAX_ROWS
                            + ", cols 1.." + MAX_COLS);
    }
}
