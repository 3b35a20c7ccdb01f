package com.gridcalc.engine;

import com.gridcalc.api.CellRange;
import com.gridcalc.api.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index of aggregate cells to the rectangles they read.
 *
 * Recording one edge per covered cell is not an option for ranges spanning
 * millions of positions, so membership is answered by coordinate arithmetic:
 * {@link #containing(Coordinate)} scans every registered rectangle. The scan
 * is linear in the number of registered aggregates, which is fine for sheets
 * with a modest number of range formulas.
 */
public final class RangeRegistry {
    private final Map<Coordinate, List<CellRange>> byOwner = new LinkedHashMap<>();

    /** Adds a rectangle read by {@code owner}. */
    public void register(Coordinate owner, CellRange range) {
        byOwner.computeIfAbsent(owner, k -> new ArrayList<>(1)).add(range);
    }

    /**
     * Removes every rectangle owned by {@code owner}.
     *
     * @return the removed rectangles, empty if none.
     */
    public List<CellRange> unregister(Coordinate owner) {
        List<CellRange> removed = byOwner.remove(owner);
        return removed == null ? List.of() : List.copyOf(removed);
    }

    /**
     * Replaces the rectangles owned by {@code owner}.
     *
     * @return the rectangles registered before the call.
     */
    public List<CellRange> replace(Coordinate owner, List<CellRange> ranges) {
        List<CellRange> previous = unregister(owner);
        restore(owner, ranges);
        return previous;
    }

    /** Puts back a list previously returned by {@link #replace} or {@link #unregister}. */
    public void restore(Coordinate owner, List<CellRange> ranges) {
        if (ranges.isEmpty())
            byOwner.remove(owner);
        else
            byOwner.put(owner, new ArrayList<>(ranges));
    }

    /** Rectangles read by {@code owner}; empty if it owns none. */
    public List<CellRange> ranges(Coordinate owner) {
        List<CellRange> ranges = byOwner.get(owner);
        return ranges == null ? List.of() : Collections.unmodifiableList(ranges);
    }

    /**
     * Aggregate cells with at least one registered rectangle covering {@code c},
     * in registration order, each listed once.
     */
    public List<Coordinate> containing(Coordinate c) {
        List<Coordinate> owners = null;
        for (var entry : byOwner.entrySet()) {
            for (CellRange range : entry.getValue()) {
                if (range.contains(c)) {
                    if (owners == null)
                        owners = new ArrayList<>(2);
                    owners.add(entry.getKey());
                    break;
                }
            }
        }
        return owners == null ? List.of() : owners;
    }

    /** Number of aggregate cells with registered rectangles. */
    public int size() {
        return byOwner.size();
    }

    public Map<Coordinate, List<CellRange>> snapshot() {
        Map<Coordinate, List<CellRange>> copy = new LinkedHashMap<>();
        byOwner.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return copy;
    }
}
