package com.gridcalc.store;

import com.gridcalc.api.Coordinate;
import com.gridcalc.api.Value;

import java.util.function.BiConsumer;

/**
 * Fixed-size addressable collection of cells.
 *
 * Cells are materialized lazily: a position that was never addressed behaves
 * as an Empty cell holding 0. Dense and sparse implementations are
 * interchangeable; the engine only talks to this interface.
 */
public interface CellStore {

    int rows();

    int cols();

    /** @return the cell, or null if the position was never materialized. */
    Cell get(Coordinate c);

    /**
     * Returns the cell at {@code c}, materializing an Empty one if needed.
     *
     * @throws IllegalArgumentException if {@code c} is outside the sheet.
     */
    Cell getOrCreate(Coordinate c);

    /** Drops a materialized cell. Only blank cells may be evicted. */
    void evict(Coordinate c);

    /** Number of materialized cells. */
    int size();

    /** Visits every materialized cell. Order is implementation-defined. */
    void forEach(BiConsumer<Coordinate, Cell> visitor);

    /**
     * True when {@link #forEach} costs time proportional to {@link #size()}
     * rather than to the sheet's capacity.
     */
    default boolean isSparse() {
        return false;
    }

    default boolean isMaterialized(Coordinate c) {
        return get(c) != null;
    }

    default boolean contains(Coordinate c) {
        return c.isWithin(rows(), cols());
    }

    default long capacity() {
        return (long) rows() * cols();
    }

    /** Current value at {@code c}; 0 for positions never written. */
    default Value valueAt(Coordinate c) {
        Cell cell = get(c);
        return cell == null ? Value.ZERO : cell.value();
    }
}
