package com.gridcalc.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gridcalc.api.SleepPolicy;
import com.gridcalc.store.CellStores;
import com.gridcalc.store.StorageMode;

import lombok.Data;

/**
 * POJO representation of a sheet configuration file.
 *
 * <pre>
 * {
 *   "rows": 999, "cols": 18278,
 *   "storage": "AUTO", "denseCellLimit": 1000000,
 *   "sleep": "REAL", "latencyTracking": false,
 *   "ringBufferSize": 1024
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SheetConfig {
    private int rows = CellStores.MAX_ROWS;
    private int cols = CellStores.MAX_COLS;
    private StorageMode storage = StorageMode.AUTO;
    private int denseCellLimit = CellStores.DEFAULT_DENSE_CELL_LIMIT;
    private SleepMode sleep = SleepMode.REAL;
    private boolean latencyTracking;
    private int ringBufferSize = 1024;

    /** How SLEEP formulas behave. */
    public enum SleepMode {
        REAL(SleepPolicy.REAL),
        NONE(SleepPolicy.NONE);

        private final SleepPolicy policy;

        SleepMode(SleepPolicy policy) {
            this.policy = policy;
        }

        public SleepPolicy policy() {
            return policy;
        }
    }

    public static SheetConfig of(int rows, int cols) {
        SheetConfig config = new SheetConfig();
        config.setRows(rows);
        config.setCols(cols);
        return config;
    }

    /**
     * @throws IllegalArgumentException on dimensions outside 1..999 x 1..18278,
     *                                  a negative dense limit or a ring buffer
     *                                  size that is not a power of two.
     */
    public SheetConfig validate() {
        CellStores.checkDimensions(rows, cols);
        if (denseCellLimit < 0)
            throw new IllegalArgumentException("denseCellLimit must be >= 0, got " + denseCellLimit);
        if (ringBufferSize < 1 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of two, got " + ringBufferSize);
        if (storage == null)
            storage = StorageMode.AUTO;
        if (sleep == null)
            sleep = SleepMode.REAL;
        return this;
    }
}
