package com.gridcalc.api;

import java.util.List;

/**
 * How a cell's value is derived.
 *
 * The set of shapes is closed: the formula grammar is flat, one operator at
 * most, and no shape nests another. Each shape stores every operand it was
 * parsed from, so {@link #toFormula()} never has to reconstruct a literal from
 * the cell's current value.
 *
 * Dependency edges are derived from {@link #operands()} (single-cell operands,
 * recorded as forward edges on the operand cells) and {@link #ranges()}
 * (rectangles, recorded only in the range registry).
 */
public interface Operation {

    Operation EMPTY = new Empty();
    Operation INVALID = new Invalid();

    enum Kind {
        EMPTY,
        CONSTANT,
        CELL_REFERENCE,
        CONSTANT_OP_CONSTANT,
        CONSTANT_OP_REFERENCE,
        REFERENCE_OP_CONSTANT,
        REFERENCE_OP_REFERENCE,
        RANGE_AGGREGATE,
        SLEEP_CONSTANT,
        SLEEP_REFERENCE,
        INVALID
    }

    Kind kind();

    /** Cells this shape reads directly. May contain the same coordinate twice. */
    default List<Coordinate> operands() {
        return List.of();
    }

    /** Rectangles this shape reads through the range registry. */
    default List<CellRange> ranges() {
        return List.of();
    }

    /** Canonical formula text; parsing it yields an equal shape. */
    String toFormula();

    record Empty() implements Operation {
        @Override
        public Kind kind() {
            return Kind.EMPTY;
        }

        @Override
        public String toFormula() {
            return "";
        }
    }

    record Invalid() implements Operation {
        @Override
        public Kind kind() {
            return Kind.INVALID;
        }

        @Override
        public String toFormula() {
            return "";
        }
    }

    record Constant(int value) implements Operation {
        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        public String toFormula() {
            return Integer.toString(value);
        }
    }

    record CellReference(Coordinate ref) implements Operation {
        @Override
        public Kind kind() {
            return Kind.CELL_REFERENCE;
        }

        @Override
        public List<Coordinate> operands() {
            return List.of(ref);
        }

        @Override
        public String toFormula() {
            return ref.toString();
        }
    }

    record ConstantOpConstant(int left, char op, int right) implements Operation {
        @Override
        public Kind kind() {
            return Kind.CONSTANT_OP_CONSTANT;
        }

        @Override
        public String toFormula() {
            return "" + left + op + right;
        }
    }

    record ConstantOpReference(int left, char op, Coordinate right) implements Operation {
        @Override
        public Kind kind() {
            return Kind.CONSTANT_OP_REFERENCE;
        }

        @Override
        public List<Coordinate> operands() {
            return List.of(right);
        }

        @Override
        public String toFormula() {
            return "" + left + op + right;
        }
    }

    record ReferenceOpConstant(Coordinate left, char op, int right) implements Operation {
        @Override
        public Kind kind() {
            return Kind.REFERENCE_OP_CONSTANT;
        }

        @Override
        public List<Coordinate> operands() {
            return List.of(left);
        }

        @Override
        public String toFormula() {
            return "" + left + op + right;
        }
    }

    record ReferenceOpReference(Coordinate left, char op, Coordinate right) implements Operation {
        @Override
        public Kind kind() {
            return Kind.REFERENCE_OP_REFERENCE;
        }

        @Override
        public List<Coordinate> operands() {
            return List.of(left, right);
        }

        @Override
        public String toFormula() {
            return "" + left + op + right;
        }
    }

    /**
     * Aggregate over an inclusive rectangle. The function name is kept as typed;
     * whether it is one of MAX, MIN, SUM, AVG or STDEV is decided when evaluating.
     */
    record RangeAggregate(String function, Coordinate start, Coordinate end) implements Operation {
        @Override
        public Kind kind() {
            return Kind.RANGE_AGGREGATE;
        }

        @Override
        public List<CellRange> ranges() {
            return List.of(range());
        }

        public CellRange range() {
            return new CellRange(start, end);
        }

        @Override
        public String toFormula() {
            return function + "(" + start + ":" + end + ")";
        }
    }

    record SleepConstant(int seconds) implements Operation {
        @Override
        public Kind kind() {
            return Kind.SLEEP_CONSTANT;
        }

        @Override
        public String toFormula() {
            return "SLEEP(" + seconds + ")";
        }
    }

    record SleepReference(Coordinate ref) implements Operation {
        @Override
        public Kind kind() {
            return Kind.SLEEP_REFERENCE;
        }

        @Override
        public List<Coordinate> operands() {
            return List.of(ref);
        }

        @Override
        public String toFormula() {
            return "SLEEP(" + ref + ")";
        }
    }
}
