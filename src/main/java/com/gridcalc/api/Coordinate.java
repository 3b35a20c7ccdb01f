package com.gridcalc.api;

/**
 * A zero-based (row, col) position in a sheet.
 *
 * Coordinates are plain values and carry no knowledge of sheet dimensions.
 * Bounds are checked by the engine against the store that owns the cell, so a
 * coordinate decoded from text may still lie outside a given sheet.
 */
public record Coordinate(int row, int col) {

    /** Placeholder for a reference that matched the grammar but cannot address a cell. */
    public static final Coordinate UNADDRESSABLE = new Coordinate(-1, -1);

    public static Coordinate of(int row, int col) {
        return new Coordinate(row, col);
    }

    /** Inverse of {@link #linear(int)}. */
    public static Coordinate fromLinear(int index, int cols) {
        return new Coordinate(index / cols, index % cols);
    }

    /** Row-major linear index for a sheet with {@code cols} columns. */
    public int linear(int cols) {
        return row * cols + col;
    }

    public boolean isWithin(int rows, int cols) {
        return row >= 0 && col >= 0 && row < rows && col < cols;
    }

    @Override
    public String toString() {
        if (row < 0 || col < 0)
            return "#REF";
        return columnLabel(col) + (row + 1);
    }

    /** Bijective base-26 label of a zero-based column: 0 -> A, 25 -> Z, 26 -> AA. */
    public static String columnLabel(int col) {
        StringBuilder sb = new StringBuilder(4);
        int n = col + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }
}
