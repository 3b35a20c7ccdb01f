package com.gridcalc.engine;

import com.gridcalc.api.CellRange;
import com.gridcalc.api.Coordinate;
import com.gridcalc.api.Operation;
import com.gridcalc.api.SleepPolicy;
import com.gridcalc.api.Value;
import com.gridcalc.store.Cell;
import com.gridcalc.store.CellStore;

import java.util.function.Consumer;

/**
 * Computes a cell's value from its operation shape and the current values of
 * its operands.
 *
 * The evaluator reads the store but never writes it; the engine stores the
 * result. It relies on the engine's ordering: every operand must already hold
 * its final value for the current commit.
 *
 * Soft failures (division by zero, an operand holding the error sentinel,
 * 32-bit overflow, unknown operator or aggregate name) come back as an
 * {@link Evaluation} with an advisory outcome. Only a shape that can never be
 * committed (Empty, Invalid) or a range the engine failed to validate raises
 * an exception.
 */
public final class Evaluator {
    private final SleepPolicy sleepPolicy;

    public Evaluator(SleepPolicy sleepPolicy) {
        this.sleepPolicy = sleepPolicy == null ? SleepPolicy.NONE : sleepPolicy;
    }

    /**
     * Evaluates the operation stored at {@code target}.
     *
     * @throws IllegalStateException if the cell is not materialized or holds a
     *                               shape that is never evaluated.
     */
    public Evaluation evaluate(Coordinate target, CellStore store) {
        Cell cell = store.get(target);
        if (cell == null)
            throw new IllegalStateException("No cell materialized at " + target);
        return evaluate(cell.operation(), store);
    }

    public Evaluation evaluate(Operation op, CellStore store) {
        if (op instanceof Operation.Constant c)
            return Evaluation.ok(c.value());
        if (op instanceof Operation.CellReference r) {
            Value v = store.valueAt(r.ref());
            return v instanceof Value.Int i ? Evaluation.ok(i.value()) : Evaluation.ERROR_OPERAND;
        }
        if (op instanceof Operation.ConstantOpConstant b)
            return apply(b.left(), b.op(), b.right());
        if (op instanceof Operation.ConstantOpReference b) {
            Value right = store.valueAt(b.right());
            if (!(right instanceof Value.Int ri))
                return Evaluation.ERROR_OPERAND;
            return apply(b.left(), b.op(), ri.value());
        }
        if (op instanceof Operation.ReferenceOpConstant b) {
            Value left = store.valueAt(b.left());
            if (!(left instanceof Value.Int li))
                return Evaluation.ERROR_OPERAND;
            return apply(li.value(), b.op(), b.right());
        }
        if (op instanceof Operation.ReferenceOpReference b) {
            Value left = store.valueAt(b.left());
            Value right = store.valueAt(b.right());
            if (!(left instanceof Value.Int li) || !(right instanceof Value.Int ri))
                return Evaluation.ERROR_OPERAND;
            return apply(li.value(), b.op(), ri.value());
        }
        if (op instanceof Operation.RangeAggregate agg)
            return aggregate(agg, store);
        if (op instanceof Operation.SleepConstant s)
            return sleep(s.seconds());
        if (op instanceof Operation.SleepReference s) {
            Value v = store.valueAt(s.ref());
            return v instanceof Value.Int i ? sleep(i.value()) : Evaluation.ERROR_OPERAND;
        }
        throw new IllegalStateException("Operation " + op.kind() + " is never evaluated");
    }

    /** Integer arithmetic on two resolved operands. */
    static Evaluation apply(int a, char op, int b) {
        return switch (op) {
            case '+' -> Evaluation.ofExact((long) a + b);
            case '-' -> Evaluation.ofExact((long) a - b);
            case '*' -> Evaluation.ofExact((long) a * b);
            case '/' -> {
                if (b == 0)
                    yield Evaluation.DIVISION_BY_ZERO;
                // MIN_VALUE / -1 does not fit either
                yield Evaluation.ofExact((long) a / b);
            }
            default -> Evaluation.UNKNOWN_OPERATOR;
        };
    }

    private Evaluation sleep(int seconds) {
        if (seconds > 0)
            sleepPolicy.pause(seconds);
        return Evaluation.ok(seconds);
    }

    private Evaluation aggregate(Operation.RangeAggregate agg, CellStore store) {
        RangeFunction fn = RangeFunction.fromName(agg.function());
        if (fn == null)
            return Evaluation.UNKNOWN_FUNCTION;
        CellRange range = agg.range();
        if (range.isInverted() || !range.isWithin(store.rows(), store.cols()))
            throw new IllegalStateException("Range " + range + " was not validated against the sheet");

        final long area = range.area();
        // On a sparse store holding fewer cells than the range covers, walk the
        // stored cells and account for the never-written ones as zeros.
        final boolean sparseScan = store.isSparse() && store.size() < area;
        RangeAccumulator acc = new RangeAccumulator();
        visit(range, store, sparseScan, acc);
        if (acc.error)
            return Evaluation.ERROR_OPERAND;
        final long zeros = area - acc.visited;

        return switch (fn) {
            case MAX -> Evaluation.ok(zeros > 0 ? Math.max(acc.max, 0) : acc.max);
            case MIN -> Evaluation.ok(zeros > 0 ? Math.min(acc.min, 0) : acc.min);
            case SUM -> Evaluation.ofExact(acc.sum);
            case AVG -> Evaluation.ofExact(acc.sum / area);
            case STDEV -> {
                final double mean = (double) acc.sum / area;
                double[] variance = { zeros * mean * mean };
                visit(range, store, sparseScan, v -> {
                    double d = v.intValue() - mean;
                    variance[0] += d * d;
                });
                yield Evaluation.ok((int) Math.round(Math.sqrt(variance[0] / area)));
            }
        };
    }

    private static void visit(CellRange range, CellStore store, boolean sparseScan, Consumer<Value> sink) {
        if (sparseScan) {
            store.forEach((c, cell) -> {
                if (range.contains(c))
                    sink.accept(cell.value());
            });
            return;
        }
        for (int r = range.start().row(); r <= range.end().row(); r++)
            for (int c = range.start().col(); c <= range.end().col(); c++)
                sink.accept(store.valueAt(Coordinate.of(r, c)));
    }

    /** Single-pass MAX/MIN/SUM accumulation over the visited values. */
    private static final class RangeAccumulator implements Consumer<Value> {
        long sum;
        long visited;
        int max = Integer.MIN_VALUE;
        int min = Integer.MAX_VALUE;
        boolean error;

        @Override
        public void accept(Value v) {
            visited++;
            if (!(v instanceof Value.Int i)) {
                error = true;
                return;
            }
            int x = i.value();
            sum += x;
            if (x > max)
                max = x;
            if (x < min)
                min = x;
        }
    }
}
