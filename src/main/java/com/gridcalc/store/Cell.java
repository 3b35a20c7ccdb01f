package com.gridcalc.store;

import com.gridcalc.api.Coordinate;
import com.gridcalc.api.Operation;
import com.gridcalc.api.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable state of one addressable grid position.
 *
 * A cell only stores forward edges: {@link #dependents()} holds the cells
 * whose operation names this one as a direct operand. Range readers are kept
 * in the range registry instead, so a wide aggregate does not inflate the
 * dependents of every cell it covers.
 *
 * Mutation is reserved for the engine; collaborators read values through the
 * spreadsheet facade.
 */
public final class Cell {
    private Value value = Value.ZERO;
    private Operation operation = Operation.EMPTY;
    private final Set<Coordinate> dependents = new LinkedHashSet<>(4);

    public Value value() {
        return value;
    }

    public Operation operation() {
        return operation;
    }

    /** Read-only view, in insertion order. */
    public Set<Coordinate> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    public void setValue(Value value) {
        this.value = value;
    }

    public void setOperation(Operation operation) {
        this.operation = operation;
    }

    /** @return true if the edge was not present before. */
    public boolean addDependent(Coordinate reader) {
        return dependents.add(reader);
    }

    /** @return true if the edge was present. */
    public boolean removeDependent(Coordinate reader) {
        return dependents.remove(reader);
    }

    /** Indistinguishable from a cell that was never materialized. */
    public boolean isBlank() {
        return operation.kind() == Operation.Kind.EMPTY && dependents.isEmpty() && Value.ZERO.equals(value);
    }

    @Override
    public String toString() {
        return "Cell[" + operation.toFormula() + " = " + value.display() + ", dependents=" + dependents + "]";
    }
}
