package com.gridcalc.engine;

import com.gridcalc.api.CellRange;
import com.gridcalc.api.Coordinate;
import com.gridcalc.api.Operation;
import com.gridcalc.api.Value;
import com.gridcalc.store.Cell;
import com.gridcalc.store.CellStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Pre-image of one set-formula call and the edits made on top of it.
 *
 * The transaction touches exactly three things: the target cell's shape and
 * value, the target's entries in its operands' dependents, and the target's
 * range-registry rectangles. {@link #install()} applies the new shape
 * speculatively; afterwards exactly one of {@link #commit()} or
 * {@link #rollback()} is called.
 *
 * Lifecycle: OPEN -> INSTALLED -> (COMMITTED | ROLLED_BACK).
 */
final class Transaction {
    enum State {
        OPEN, INSTALLED, COMMITTED, ROLLED_BACK
    }

    private final CellStore store;
    private final RangeRegistry registry;
    private final Coordinate target;
    private final Operation newOperation;

    // Pre-image
    private final Operation oldOperation;
    private final Value oldValue;
    private List<CellRange> oldRanges = List.of();

    // Edits made by install(), undone by rollback()
    private final List<Coordinate> addedEdges = new ArrayList<>(2);
    private final Set<Coordinate> materialized = new LinkedHashSet<>(4);

    private State state = State.OPEN;

    Transaction(CellStore store, RangeRegistry registry, Coordinate target, Operation newOperation) {
        this.store = store;
        this.registry = registry;
        this.target = target;
        this.newOperation = newOperation;
        Cell current = store.get(target);
        this.oldOperation = current == null ? Operation.EMPTY : current.operation();
        this.oldValue = current == null ? Value.ZERO : current.value();
    }

    /** Writes the new shape, its forward edges and its registry rectangles. */
    void install() {
        requireState(State.OPEN);
        Cell cell = materialize(target);
        for (Coordinate operand : newOperation.operands()) {
            if (materialize(operand).addDependent(target))
                addedEdges.add(operand);
        }
        cell.setOperation(newOperation);
        oldRanges = registry.replace(target, newOperation.ranges());
        state = State.INSTALLED;
    }

    /** Drops the edges of the previous shape that the new one no longer names. */
    void commit() {
        requireState(State.INSTALLED);
        Set<Coordinate> kept = new HashSet<>(newOperation.operands());
        for (Coordinate operand : oldOperation.operands()) {
            if (kept.contains(operand))
                continue;
            Cell cell = store.get(operand);
            if (cell != null)
                cell.removeDependent(target);
        }
        state = State.COMMITTED;
    }

    /** Restores the pre-image exactly, including cells that install() materialized. */
    void rollback() {
        requireState(State.INSTALLED);
        for (Coordinate operand : addedEdges)
            store.get(operand).removeDependent(target);
        registry.restore(target, oldRanges);
        Cell cell = store.get(target);
        cell.setOperation(oldOperation);
        cell.setValue(oldValue);
        for (Coordinate c : materialized) {
            Cell placeholder = store.get(c);
            if (placeholder != null && placeholder.isBlank())
                store.evict(c);
        }
        state = State.ROLLED_BACK;
    }

    Coordinate target() {
        return target;
    }

    Operation oldOperation() {
        return oldOperation;
    }

    Operation newOperation() {
        return newOperation;
    }

    State state() {
        return state;
    }

    private Cell materialize(Coordinate c) {
        if (!store.isMaterialized(c))
            materialized.add(c);
        return store.getOrCreate(c);
    }

    private void requireState(State expected) {
        if (state != expected)
            throw new IllegalStateException("Transaction on " + target + " is " + state + ", expected " + expected);
    }
}
