package com.gridcalc.engine;

import com.gridcalc.api.CellRange;
import com.gridcalc.api.CommitResult;
import com.gridcalc.api.Coordinate;
import com.gridcalc.api.EngineError;
import com.gridcalc.api.EvalOutcome;
import com.gridcalc.api.Operation;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;
import com.gridcalc.formula.FormulaParser;
import com.gridcalc.store.Cell;
import com.gridcalc.store.CellStore;

import lombok.extern.log4j.Log4j2;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The engine that applies formula edits and keeps every derived value
 * consistent with its inputs.
 *
 * Algorithm Details (one call to {@link #setFormula}):
 *
 * 1. Parse: The text is classified into an operation shape. Invalid text is
 * refused before anything is touched.
 *
 * 2. Validate: Every coordinate the shape names (and the target itself) must
 * lie inside the sheet, and a range must not be inverted.
 *
 * 3. Snapshot and Install: A {@link Transaction} captures the target's shape,
 * value and edges, then installs the new shape and its forward edges
 * speculatively.
 *
 * 4. Discover and Order: {@link AffectedClosure} walks dependents and range
 * memberships from the target and runs one Kahn pass, which both proves the
 * closure acyclic and yields its recomputation order.
 *
 * 5. Rollback or Recompute: On a cycle the transaction restores the pre-image
 * and the call returns CYCLE_DETECTED. Otherwise the superseded edges are
 * dropped and every closure cell is evaluated in drain order, each result
 * stored before the next cell is read.
 *
 * Soft evaluation errors are recorded per cell and do not stop the pass.
 *
 * Circuit Breaker:
 * An unexpected exception while recomputing, including one thrown by the
 * listener, leaves part of the closure stale. The engine then reports itself unhealthy and refuses further edits
 * until {@link #resetHealth()} is called.
 *
 * Threading: single writer, no internal locking. Callers on several threads
 * go through {@code SheetWriteGate}.
 */
@Log4j2
public final class DependencyEngine {
    private final CellStore store;
    private final RangeRegistry registry;
    private final Evaluator evaluator;

    private boolean healthy = true;
    private long epoch;
    private CommitResult lastCommit;
    private RecalcListener listener;

    public DependencyEngine(CellStore store, Evaluator evaluator) {
        this(store, new RangeRegistry(), evaluator);
    }

    public DependencyEngine(CellStore store, RangeRegistry registry, Evaluator evaluator) {
        this.store = store;
        this.registry = registry;
        this.evaluator = evaluator;
    }

    public void setListener(RecalcListener listener) {
        this.listener = listener;
    }

    /**
     * Parses {@code text} and installs it at {@code target}.
     *
     * @return the recomputed cells on success, or the reason the sheet was left
     *         unchanged.
     * @throws IllegalStateException if the engine is unhealthy, or if
     *                               recomputation failed unexpectedly.
     */
    public CommitResult setFormula(Coordinate target, String text) {
        if (!target.isWithin(store.rows(), store.cols()))
            return reject(target, EngineError.REFERENCE_OUT_OF_BOUNDS);
        Operation operation = FormulaParser.parse(text);
        if (operation.kind() == Operation.Kind.INVALID)
            return reject(target, EngineError.UNPARSABLE_FORMULA);
        return apply(target, operation);
    }

    /** Resets {@code target} to Empty (value 0). Its readers are recomputed. */
    public CommitResult clear(Coordinate target) {
        return apply(target, Operation.EMPTY);
    }

    /**
     * Installs an already parsed shape.
     *
     * @throws IllegalArgumentException if {@code operation} is Invalid.
     */
    public CommitResult apply(Coordinate target, Operation operation) {
        if (operation.kind() == Operation.Kind.INVALID)
            throw new IllegalArgumentException("Invalid operations are never installed");
        if (!healthy)
            throw new IllegalStateException(
                    "Sheet is in unhealthy state due to a failed recalculation. Manual reset required.");
        if (!isInBounds(target, operation))
            return reject(target, EngineError.REFERENCE_OUT_OF_BOUNDS);

        Transaction tx = new Transaction(store, registry, target, operation);
        tx.install();
        AffectedClosure closure = AffectedClosure.discover(target, store, registry);
        if (closure.hasCycle()) {
            tx.rollback();
            log.debug("Rolled back {} = '{}': cycle through {} cells", target, operation.toFormula(),
                    closure.size());
            return reject(target, EngineError.CYCLE_DETECTED);
        }
        tx.commit();
        return recompute(target, closure.order());
    }

    private CommitResult recompute(Coordinate target, List<Coordinate> order) {
        final long e = ++epoch;
        final RecalcListener l = this.listener;
        final boolean hasListener = l != null;
        Map<Coordinate, EvalOutcome> issues = new LinkedHashMap<>();

        int recomputed = 0;
        try {
            // Runs after commit: a throwing listener leaves the closure stale
            if (hasListener)
                l.onRecalcStart(e, target);
            for (Coordinate c : order) {
                Cell cell = store.get(c);
                long start = hasListener ? System.nanoTime() : 0;

                Evaluation result;
                if (cell.operation().kind() == Operation.Kind.EMPTY)
                    result = Evaluation.ok(0);
                else
                    result = evaluator.evaluate(cell.operation(), store);
                cell.setValue(result.value());
                recomputed++;

                if (!result.isOk())
                    issues.put(c, result.outcome());
                if (hasListener) {
                    l.onCellRecomputed(e, c, result.value(), System.nanoTime() - start);
                    if (!result.isOk())
                        l.onCellIssue(e, c, result.outcome());
                }
            }
        } catch (RuntimeException ex) {
            healthy = false;
            log.error("Recalculation of {} failed after {} of {} cells", target, recomputed, order.size(), ex);
            throw new IllegalStateException("Recalculation failed. Sheet is now unhealthy.", ex);
        } finally {
            if (hasListener)
                l.onRecalcEnd(e, recomputed);
        }

        log.debug("Commit #{} {} recomputed {} cells ({} issues)", e, target, recomputed, issues.size());
        lastCommit = CommitResult.accepted(e, target, order, issues);
        return lastCommit;
    }

    private CommitResult reject(Coordinate target, EngineError error) {
        final long e = ++epoch;
        log.debug("Rejected edit of {}: {}", target, error);
        if (listener != null)
            listener.onCommitRejected(e, target, error);
        lastCommit = CommitResult.rejected(e, target, error);
        return lastCommit;
    }

    private boolean isInBounds(Coordinate target, Operation operation) {
        final int rows = store.rows(), cols = store.cols();
        if (!target.isWithin(rows, cols))
            return false;
        for (Coordinate operand : operation.operands())
            if (!operand.isWithin(rows, cols))
                return false;
        for (CellRange range : operation.ranges())
            if (range.isInverted() || !range.isWithin(rows, cols))
                return false;
        return true;
    }

    /** Current value at {@code c}; 0 for cells never written. */
    public Value valueAt(Coordinate c) {
        return store.valueAt(c);
    }

    /** Shape stored at {@code c}; Empty for cells never written. */
    public Operation operationAt(Coordinate c) {
        Cell cell = store.get(c);
        return cell == null ? Operation.EMPTY : cell.operation();
    }

    /** Number of calls made so far, accepted or not. */
    public long epoch() {
        return epoch;
    }

    public CommitResult lastCommit() {
        return lastCommit;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void resetHealth() {
        this.healthy = true;
    }

    public CellStore store() {
        return store;
    }

    public RangeRegistry registry() {
        return registry;
    }
}
