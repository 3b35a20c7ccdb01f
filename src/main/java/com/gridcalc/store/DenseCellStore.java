package com.gridcalc.store;

import com.gridcalc.api.Coordinate;

import java.util.function.BiConsumer;

/**
 * Array-backed store, one slot per addressable position, filled on demand.
 *
 * Lookups are a single array access. Memory is proportional to the declared
 * dimensions, so {@link CellStores} only picks this layout for sheets below
 * the configured dense limit.
 */
public final class DenseCellStore implements CellStore {
    private final int rows, cols;
    private final Cell[] cells;
    private int size;

    public DenseCellStore(int rows, int cols) {
        CellStores.checkDimensions(rows, cols);
        this.rows = rows;
        this.cols = cols;
        this.cells = new Cell[rows * cols];
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
        return cells[c.linear(cols)];
    }

    @Override
    public Cell getOrCreate(Coordinate c) {
        int idx = index(c);
        Cell cell = cells[idx];
        if (cell == null) {
            cell = new Cell();
            cells[idx] = cell;
            size++;
        }
        return cell;
    }

    @Override
    public void evict(Coordinate c) {
        int idx = index(c);
        Cell cell = cells[idx];
        if (cell == null)
            return;
        if (!cell.isBlank())
            throw new IllegalStateException("Cannot evict non-blank cell " + c);
        cells[idx] = null;
        size--;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public void forEach(BiConsumer<Coordinate, Cell> visitor) {
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] != null)
                visitor.accept(Coordinate.fromLinear(i, cols), cells[i]);
        }
    }

    private int index(Coordinate c) {
        if (!contains(c))
            throw new IllegalArgumentException("Coordinate " + c + " outside " + rows + "x" + cols + " sheet");
        return c.linear(cols);
    }
}
