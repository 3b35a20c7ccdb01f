package com.gridcalc.formula;

import com.gridcalc.api.Coordinate;

import java.util.Optional;

/**
 * Converts textual cell references ("A1", "AB12") to zero-based coordinates
 * and back.
 *
 * The letter prefix is bijective base-26 (A=1 .. Z=26, AA=27), not positional
 * base-26, so there is no zero digit. The digit suffix is the 1-based row.
 */
public final class CellRefCodec {
    // Anything wider cannot address a sheet and would overflow the arithmetic.
    private static final int MAX_LETTERS = 6;
    private static final int MAX_DIGITS = 9;

    private CellRefCodec() {
        // Utility class
    }

    /**
     * Decodes a reference.
     *
     * @return the zero-based coordinate, or empty when the text is not a
     *         reference or decodes to column 0 or row 0.
     */
    public static Optional<Coordinate> toCoordinate(String ref) {
        if (ref == null || ref.isEmpty())
            return Optional.empty();
        int split = 0;
        while (split < ref.length() && !isDigit(ref.charAt(split)))
            split++;
        if (split > MAX_LETTERS || ref.length() - split > MAX_DIGITS)
            return Optional.empty();

        int col = 0;
        for (int i = 0; i < split; i++) {
            char c = ref.charAt(i);
            if (c < 'A' || c > 'Z')
                return Optional.empty();
            col = col * 26 + (c - 'A' + 1);
        }
        int row = 0;
        for (int i = split; i < ref.length(); i++) {
            char c = ref.charAt(i);
            if (!isDigit(c))
                return Optional.empty();
            row = row * 10 + (c - '0');
        }
        if (row == 0 || col == 0)
            return Optional.empty();
        return Optional.of(new Coordinate(row - 1, col - 1));
    }

    /** Inverse of {@link #toCoordinate(String)} for zero-based indices. */
    public static String toText(int row, int col) {
        return columnLabel(col) + (row + 1);
    }

    public static String toText(Coordinate c) {
        return toText(c.row(), c.col());
    }

    public static String columnLabel(int col) {
        return Coordinate.columnLabel(col);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
