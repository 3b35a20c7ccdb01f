package com.gridcalc.api;

/**
 * The stored value of a cell: an integer, or a text sentinel.
 *
 * Text only ever carries the {@link #ERROR_TEXT} sentinel produced by a soft
 * evaluation error. Callers branch with {@code instanceof Value.Int} rather
 * than comparing strings.
 */
public interface Value {

    String ERROR_TEXT = "ERR";

    Value ZERO = new Int(0);
    Value ERROR = new Text(ERROR_TEXT);

    static Value of(int v) {
        return v == 0 ? ZERO : new Int(v);
    }

    boolean isError();

    /** Integer view; text values read as 0, as the range scan of an empty cell does. */
    int intValue();

    /** Display form: the decimal integer, or the sentinel text. */
    String display();

    record Int(int value) implements Value {
        @Override
        public boolean isError() {
            return false;
        }

        @Override
        public int intValue() {
            return value;
        }

        @Override
        public String display() {
            return Integer.toString(value);
        }
    }

    record Text(String text) implements Value {
        @Override
        public boolean isError() {
            return ERROR_TEXT.equals(text);
        }

        @Override
        public int intValue() {
            return 0;
        }

        @Override
        public String display() {
            return text;
        }
    }
}
