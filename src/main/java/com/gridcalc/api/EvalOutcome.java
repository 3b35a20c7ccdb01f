package com.gridcalc.api;

/**
 * Cell-level result of evaluating one shape. Anything other than {@link #OK}
 * is advisory: the commit still succeeds and the rest of the closure is
 * recomputed.
 */
public enum EvalOutcome {
    OK(false),
    /** Divisor was 0; value is the error sentinel. */
    DIVISION_BY_ZERO(true),
    /** An operand already held the error sentinel; value is the error sentinel. */
    ERROR_OPERAND(true),
    /** Result does not fit in 32 bits; value is the error sentinel. */
    ARITHMETIC_OVERFLOW(true),
    /** Operator symbol outside {@code + - * /}; value is 0. */
    UNKNOWN_OPERATOR(false),
    /** Aggregate name outside MAX, MIN, SUM, AVG, STDEV; value is 0. */
    UNKNOWN_RANGE_FUNCTION(false);

    private final boolean errorValue;

    EvalOutcome(boolean errorValue) {
        this.errorValue = errorValue;
    }

    /** True when this outcome stores the error sentinel rather than an integer. */
    public boolean producesErrorValue() {
        return errorValue;
    }
}
