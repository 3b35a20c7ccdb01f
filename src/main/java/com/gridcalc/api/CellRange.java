package com.gridcalc.api;

/**
 * Inclusive rectangle of cells read by a range aggregate.
 */
public record CellRange(Coordinate start, Coordinate end) {

    public boolean contains(Coordinate c) {
        return contains(c.row(), c.col());
    }

    public boolean contains(int row, int col) {
        return start.row() <= row && row <= end.row()
                && start.col() <= col && col <= end.col();
    }

    /** True when start is after end on either axis. */
    public boolean isInverted() {
        return start.row() > end.row() || start.col() > end.col();
    }

    public boolean isWithin(int rows, int cols) {
        return start.isWithin(rows, cols) && end.isWithin(rows, cols);
    }

    public int height() {
        return end.row() - start.row() + 1;
    }

    public int width() {
        return end.col() - start.col() + 1;
    }

    public long area() {
        return (long) height() * width();
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
