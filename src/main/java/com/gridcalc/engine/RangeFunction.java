package com.gridcalc.engine;

/**
 * Aggregates accepted in {@code NAME(A1:B2)} formulas.
 */
public enum RangeFunction {
    MAX,
    MIN,
    SUM,
    AVG,
    STDEV;

    /** @return the function, or null if the name is not one of the supported aggregates. */
    public static RangeFunction fromName(String name) {
        if (name == null)
            return null;
        for (RangeFunction f : values()) {
            if (f.name().equals(name))
                return f;
        }
        return null;
    }
}
