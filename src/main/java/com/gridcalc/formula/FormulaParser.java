package com.gridcalc.formula;

import com.gridcalc.api.Coordinate;
import com.gridcalc.api.Operation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies formula text into one of the fixed operation shapes.
 *
 * <p>
 * The grammar is flat: a formula is a SLEEP call, a lone integer or reference,
 * one binary operation between integers and references, or a range function
 * {@code NAME(A1:B2)}. Shapes are tried in a fixed priority order and the
 * first match wins.
 *
 * <p>
 * Unmatched input never throws; it yields {@link Operation#INVALID}, so callers
 * must inspect the returned shape.
 */
public final class FormulaParser {
    private static final String INT = "(-?[0-9]+)";
    private static final String REF = "([A-Z]+[0-9]+)";
    private static final String OP = "([-+*/])";

    private static final Pattern SLEEP_CONSTANT = Pattern.compile("SLEEP\\(" + INT + "\\)");
    private static final Pattern SLEEP_REFERENCE = Pattern.compile("SLEEP\\(" + REF + "\\)");
    private static final Pattern CONSTANT = Pattern.compile(INT);
    private static final Pattern REFERENCE = Pattern.compile(REF);
    private static final Pattern CONSTANT_OP_CONSTANT = Pattern.compile(INT + OP + INT);
    private static final Pattern CONSTANT_OP_REFERENCE = Pattern.compile(INT + OP + REF);
    private static final Pattern REFERENCE_OP_CONSTANT = Pattern.compile(REF + OP + INT);
    private static final Pattern REFERENCE_OP_REFERENCE = Pattern.compile(REF + OP + REF);
    private static final Pattern RANGE_FUNCTION = Pattern.compile("([A-Z]+)\\(" + REF + ":" + REF + "\\)");

    private FormulaParser() {
        // Utility class
    }

    /**
     * Parses formula text. Surrounding whitespace is ignored.
     *
     * @return the matching shape, or {@link Operation#INVALID}.
     */
    public static Operation parse(String text) {
        if (text == null)
            return Operation.INVALID;
        String s = text.trim();
        if (s.isEmpty())
            return Operation.INVALID;

        Matcher m;
        if ((m = SLEEP_CONSTANT.matcher(s)).matches()) {
            Integer v = parseInt(m.group(1));
            return v == null ? Operation.INVALID : new Operation.SleepConstant(v);
        }
        if ((m = SLEEP_REFERENCE.matcher(s)).matches())
            return new Operation.SleepReference(ref(m.group(1)));
        if ((m = CONSTANT.matcher(s)).matches()) {
            Integer v = parseInt(m.group(1));
            return v == null ? Operation.INVALID : new Operation.Constant(v);
        }
        if ((m = REFERENCE.matcher(s)).matches())
            return new Operation.CellReference(ref(m.group(1)));
        if ((m = CONSTANT_OP_CONSTANT.matcher(s)).matches()) {
            Integer a = parseInt(m.group(1)), b = parseInt(m.group(3));
            return a == null || b == null ? Operation.INVALID
                    : new Operation.ConstantOpConstant(a, m.group(2).charAt(0), b);
        }
        if ((m = CONSTANT_OP_REFERENCE.matcher(s)).matches()) {
            Integer a = parseInt(m.group(1));
            return a == null ? Operation.INVALID
                    : new Operation.ConstantOpReference(a, m.group(2).charAt(0), ref(m.group(3)));
        }
        if ((m = REFERENCE_OP_CONSTANT.matcher(s)).matches()) {
            Integer b = parseInt(m.group(3));
            return b == null ? Operation.INVALID
                    : new Operation.ReferenceOpConstant(ref(m.group(1)), m.group(2).charAt(0), b);
        }
        if ((m = REFERENCE_OP_REFERENCE.matcher(s)).matches())
            return new Operation.ReferenceOpReference(ref(m.group(1)), m.group(2).charAt(0), ref(m.group(3)));
        if ((m = RANGE_FUNCTION.matcher(s)).matches())
            return new Operation.RangeAggregate(m.group(1), ref(m.group(2)), ref(m.group(3)));
        return Operation.INVALID;
    }

    // A token that fits the reference grammar but names row 0 (or is too wide
    // to decode) stays in the shape so the bounds check can reject it.
    private static Coordinate ref(String token) {
        return CellRefCodec.toCoordinate(token).orElse(Coordinate.UNADDRESSABLE);
    }

    private static Integer parseInt(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
