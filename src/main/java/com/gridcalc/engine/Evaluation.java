package com.gridcalc.engine;

import com.gridcalc.api.EvalOutcome;
import com.gridcalc.api.Value;

/**
 * Value produced for one cell together with its advisory outcome.
 */
public record Evaluation(Value value, EvalOutcome outcome) {

    static final Evaluation DIVISION_BY_ZERO = new Evaluation(Value.ERROR, EvalOutcome.DIVISION_BY_ZERO);
    static final Evaluation ERROR_OPERAND = new Evaluation(Value.ERROR, EvalOutcome.ERROR_OPERAND);
    static final Evaluation OVERFLOW = new Evaluation(Value.ERROR, EvalOutcome.ARITHMETIC_OVERFLOW);
    static final Evaluation UNKNOWN_OPERATOR = new Evaluation(Value.ZERO, EvalOutcome.UNKNOWN_OPERATOR);
    static final Evaluation UNKNOWN_FUNCTION = new Evaluation(Value.ZERO, EvalOutcome.UNKNOWN_RANGE_FUNCTION);

    public static Evaluation ok(int v) {
        return new Evaluation(Value.of(v), EvalOutcome.OK);
    }

    /** Narrows an exact result to 32 bits, or reports overflow. */
    static Evaluation ofExact(long v) {
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE)
            return OVERFLOW;
        return ok((int) v);
    }

    public boolean isOk() {
        return outcome == EvalOutcome.OK;
    }
}
