package com.gridcalc.api;

/**
 * Observability interface for monitoring commits on a sheet.
 *
 * Implementations can be registered with the DependencyEngine to receive
 * callbacks during every set-formula call. This is the primary mechanism for:
 *
 * - Profiling: Measuring how long a commit and its recalculation take.
 * - Debugging: Tracing which cells are recomputed for a given edit.
 * - Metrics: Counting rejected edits or tracking the size of affected closures.
 *
 * Performance Warning:
 * These callbacks run inside the commit, on the writer thread. Any blocking
 * I/O here delays every caller queued behind the edit.
 */
public interface RecalcListener {

    /**
     * Called after the formula has been parsed and validated, before the
     * closure is recomputed.
     *
     * @param epoch  The commit number of the sheet.
     * @param target The cell being edited.
     */
    void onRecalcStart(long epoch, Coordinate target);

    /**
     * Called after one cell of the closure has been evaluated and stored.
     *
     * @param epoch         Current commit number.
     * @param cell          The recomputed cell.
     * @param value         The value now stored in the cell.
     * @param durationNanos Time spent evaluating the cell.
     */
    void onCellRecomputed(long epoch, Coordinate cell, Value value, long durationNanos);

    /**
     * Called when a cell's evaluation raised an advisory outcome (division by
     * zero, unknown operator, ...). The recalculation continues.
     */
    void onCellIssue(long epoch, Coordinate cell, EvalOutcome outcome);

    /**
     * Called when the edit was refused and the sheet left untouched.
     */
    void onCommitRejected(long epoch, Coordinate target, EngineError error);

    /**
     * Called when the recalculation pass is fully complete.
     *
     * @param epoch           Current commit number.
     * @param cellsRecomputed Number of cells evaluated in this commit.
     */
    void onRecalcEnd(long epoch, int cellsRecomputed);
}
