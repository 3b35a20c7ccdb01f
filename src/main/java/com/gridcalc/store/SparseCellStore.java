package com.gridcalc.store;

import com.gridcalc.api.Coordinate;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Hash-backed store keyed by linear index. Memory is proportional to the
 * number of cells actually addressed, which keeps the largest declared sheets
 * (close to 18M positions) cheap.
 */
public final class SparseCellStore implements CellStore {
    private final int rows, cols;
    private final Map<Integer, Cell> cells = new HashMap<>(1024);

    public SparseCellStore(int rows, int cols) {
        CellStores.checkDimensions(rows, cols);
        this.rows = rows;
        this.cols = cols;
    }

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int cols() {
        return cols;
    }

    @Override
    public Cell get(Coordinate c) {
        if (!contains(c))
            return null;
        return cells.get(c.linear(cols));
    }

    @Override
    public Cell getOrCreate(Coordinate c) {
        return cells.computeIfAbsent(index(c), k -> new Cell());
    }

    @Override
    public void evict(Coordinate c) {
        int idx = index(c);
        Cell cell = cells.get(idx);
        if (cell == null)
            return;
        if (!cell.isBlank())
            throw new IllegalStateException("Cannot evict non-blank cell " + c);
        cells.remove(idx);
    }

    @Override
    public int size() {
        return cells.size();
    }

    @Override
    public void forEach(BiConsumer<Coordinate, Cell> visitor) {
        for (var entry : cells.entrySet())
            visitor.accept(Coordinate.fromLinear(entry.getKey(), cols), entry.getValue());
    }

    @Override
    public boolean isSparse() {
        return true;
    }

    private int index(Coordinate c) {
        if (!contains(c))
            throw new IllegalArgumentException("Coordinate " + c + " outside " + rows + "x" + cols + " sheet");
        return c.linear(cols);
    }
}
