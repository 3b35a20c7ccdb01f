package com.gridcalc.engine;

import com.gridcalc.api.Coordinate;
import com.gridcalc.api.EvalOutcome;
import com.gridcalc.api.Operation;
import com.gridcalc.api.Value;
import com.gridcalc.formula.CellRefCodec;
import com.gridcalc.store.Cell;
import com.gridcalc.store.CellStore;
import com.gridcalc.store.DenseCellStore;
import com.gridcalc.store.SparseCellStore;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

import static org.junit.Assert.*;

public class EvaluatorTest {

    private static final Coordinate A1 = Coordinate.of(0, 0);
    private static final Coordinate B1 = Coordinate.of(0, 1);

    private CellStore store;
    private List<Integer> pauses;
    private Evaluator evaluator;

    @Before
    public void setUp() {
        store = new DenseCellStore(4, 4);
        pauses = new ArrayList<>();
        evaluator = new Evaluator(pauses::add);
    }

    private void put(Coordinate c, Value v) {
        store.getOrCreate(c).setValue(v);
    }

    // Writes 1..16 row-major into the 4x4 store
    private void fillOneToSixteen(CellStore target) {
        for (int r = 0; r < 4; r++)
            for (int c = 0; c < 4; c++)
                target.getOrCreate(Coordinate.of(r, c)).setValue(Value.of(r * 4 + c + 1));
    }

    private Evaluation aggregate(String fn, CellStore s, String from, String to) {
        return evaluator.evaluate(new Operation.RangeAggregate(fn, ref(from), ref(to)), s);
    }

    private static Coordinate ref(String text) {
        return CellRefCodec.toCoordinate(text).orElseThrow();
    }

    @Test
    public void testArithmetic() {
        assertEquals(Evaluation.ok(7), Evaluator.apply(3, '+', 4));
        assertEquals(Evaluation.ok(-1), Evaluator.apply(3, '-', 4));
        assertEquals(Evaluation.ok(12), Evaluator.apply(3, '*', 4));
        assertEquals(Evaluation.ok(2), Evaluator.apply(7, '/', 3));
        assertEquals(Evaluation.ok(-2), Evaluator.apply(-7, '/', 3));
    }

    @Test
    public void testDivisionByZeroIsSoft() {
        Evaluation e = Evaluator.apply(5, '/', 0);
        assertFalse(e.isOk());
        assertEquals(Value.ERROR, e.value());
        assertEquals(EvalOutcome.DIVISION_BY_ZERO, e.outcome());
    }

    @Test
    public void testOverflowYieldsError() {
        assertEquals(EvalOutcome.ARITHMETIC_OVERFLOW, Evaluator.apply(Integer.MAX_VALUE, '+', 1).outcome());
        assertEquals(EvalOutcome.ARITHMETIC_OVERFLOW, Evaluator.apply(Integer.MIN_VALUE, '-', 1).outcome());
        assertEquals(EvalOutcome.ARITHMETIC_OVERFLOW, Evaluator.apply(65536, '*', 65536).outcome());
        assertEquals(EvalOutcome.ARITHMETIC_OVERFLOW, Evaluator.apply(Integer.MIN_VALUE, '/', -1).outcome());
        assertEquals(Value.ERROR, Evaluator.apply(Integer.MAX_VALUE, '+', 1).value());
    }

    @Test
    public void testUnknownOperatorYieldsZero() {
        Evaluation e = Evaluator.apply(5, '%', 2);
        assertEquals(Value.ZERO, e.value());
        assertEquals(EvalOutcome.UNKNOWN_OPERATOR, e.outcome());
    }

    @Test
    public void testReferenceShapes() {
        put(A1, Value.of(10));
        put(B1, Value.of(4));
        assertEquals(Evaluation.ok(10), evaluator.evaluate(new Operation.CellReference(A1), store));
        assertEquals(Evaluation.ok(14), evaluator.evaluate(new Operation.ReferenceOpReference(A1, '+', B1), store));
        assertEquals(Evaluation.ok(6), evaluator.evaluate(new Operation.ConstantOpReference(10, '-', B1), store));
        assertEquals(Evaluation.ok(5), evaluator.evaluate(new Operation.ReferenceOpConstant(A1, '/', 2), store));
        // Never written cells read as 0
        assertEquals(Evaluation.ok(0), evaluator.evaluate(new Operation.CellReference(Coordinate.of(3, 3)), store));
    }

    @Test
    public void testErrorOperandPropagates() {
        put(A1, Value.ERROR);
        put(B1, Value.of(1));
        assertEquals(EvalOutcome.ERROR_OPERAND, evaluator.evaluate(new Operation.CellReference(A1), store).outcome());
        assertEquals(EvalOutcome.ERROR_OPERAND,
                evaluator.evaluate(new Operation.ReferenceOpReference(B1, '+', A1), store).outcome());
        assertEquals(EvalOutcome.ERROR_OPERAND,
                evaluator.evaluate(new Operation.ConstantOpReference(1, '*', A1), store).outcome());
        assertEquals(EvalOutcome.ERROR_OPERAND,
                evaluator.evaluate(new Operation.ReferenceOpConstant(A1, '*', 1), store).outcome());
        assertEquals(EvalOutcome.ERROR_OPERAND,
                evaluator.evaluate(new Operation.SleepReference(A1), store).outcome());
        assertTrue(pauses.isEmpty());
    }

    @Test
    public void testRangeAggregatesOnDenseScan() {
        fillOneToSixteen(store);
        assertEquals(Evaluation.ok(6), aggregate("MAX", store, "A1", "B2"));
        assertEquals(Evaluation.ok(1), aggregate("MIN", store, "A1", "B2"));
        assertEquals(Evaluation.ok(14), aggregate("SUM", store, "A1", "B2"));
        assertEquals(Evaluation.ok(3), aggregate("AVG", store, "A1", "B2"));
        assertEquals(Evaluation.ok(2), aggregate("STDEV", store, "A1", "B2"));
        assertEquals(Evaluation.ok(136), aggregate("SUM", store, "A1", "D4"));
    }

    @Test
    public void testSparseScanCountsUnwrittenCellsAsZero() {
        CellStore sparse = new SparseCellStore(100, 100);
        sparse.getOrCreate(A1).setValue(Value.of(-8));
        sparse.getOrCreate(B1).setValue(Value.of(4));
        // A1:B2 covers four cells, two of them never written
        assertEquals(Evaluation.ok(4), aggregate("MAX", sparse, "A1", "B2"));
        assertEquals(Evaluation.ok(-8), aggregate("MIN", sparse, "A1", "B2"));
        assertEquals(Evaluation.ok(-4), aggregate("SUM", sparse, "A1", "B2"));
        assertEquals(Evaluation.ok(-1), aggregate("AVG", sparse, "A1", "B2"));
        // mean -1, squared deviations 49 + 25 + 1 + 1 = 76, sqrt(19) = 4.36
        assertEquals(Evaluation.ok(4), aggregate("STDEV", sparse, "A1", "B2"));
    }

    @Test
    public void testDenseStoreWalksRectangleInsteadOfBackingArray() {
        ScanCountingStore dense = new ScanCountingStore(new DenseCellStore(999, 1000));
        dense.getOrCreate(A1).setValue(Value.of(3));
        dense.getOrCreate(B1).setValue(Value.of(5));
        assertEquals(Evaluation.ok(8), aggregate("SUM", dense, "A1", "B2"));
        assertEquals(Evaluation.ok(0), aggregate("MIN", dense, "A1", "B2"));
        assertEquals(0, dense.scans);

        ScanCountingStore sparse = new ScanCountingStore(new SparseCellStore(999, 1000));
        sparse.getOrCreate(A1).setValue(Value.of(3));
        sparse.getOrCreate(B1).setValue(Value.of(5));
        assertEquals(Evaluation.ok(8), aggregate("SUM", sparse, "A1", "B2"));
        assertEquals(1, sparse.scans);
    }

    /** Delegating store that counts full iterations. */
    private static final class ScanCountingStore implements CellStore {
        private final CellStore delegate;
        int scans;

        ScanCountingStore(CellStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public int rows() {
            return delegate.rows();
        }

        @Override
        public int cols() {
            return delegate.cols();
        }

        @Override
        public Cell get(Coordinate c) {
            return delegate.get(c);
        }

        @Override
        public Cell getOrCreate(Coordinate c) {
            return delegate.getOrCreate(c);
        }

        @Override
        public void evict(Coordinate c) {
            delegate.evict(c);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public void forEach(BiConsumer<Coordinate, Cell> visitor) {
            scans++;
            delegate.forEach(visitor);
        }

        @Override
        public boolean isSparse() {
            return delegate.isSparse();
        }
    }

    @Test
    public void testAllNegativeRangeWithoutGaps() {
        put(A1, Value.of(-5));
        put(B1, Value.of(-3));
        assertEquals(Evaluation.ok(-3), aggregate("MAX", store, "A1", "B1"));
        assertEquals(Evaluation.ok(-5), aggregate("MIN", store, "A1", "B1"));
    }

    @Test
    public void testSingleCellRange() {
        put(A1, Value.of(9));
        assertEquals(Evaluation.ok(9), aggregate("AVG", store, "A1", "A1"));
        assertEquals(Evaluation.ok(0), aggregate("STDEV", store, "A1", "A1"));
    }

    @Test
    public void testErrorInsideRange() {
        fillOneToSixteen(store);
        put(B1, Value.ERROR);
        Evaluation e = aggregate("SUM", store, "A1", "B2");
        assertEquals(Value.ERROR, e.value());
        assertEquals(EvalOutcome.ERROR_OPERAND, e.outcome());
    }

    @Test
    public void testSumOverflowYieldsError() {
        put(A1, Value.of(Integer.MAX_VALUE));
        put(B1, Value.of(Integer.MAX_VALUE));
        assertEquals(EvalOutcome.ARITHMETIC_OVERFLOW, aggregate("SUM", store, "A1", "B1").outcome());
        // The average of the same cells fits
        assertEquals(Evaluation.ok(Integer.MAX_VALUE), aggregate("AVG", store, "A1", "B1"));
    }

    @Test
    public void testUnknownRangeFunction() {
        fillOneToSixteen(store);
        Evaluation e = aggregate("MEDIAN", store, "A1", "B2");
        assertEquals(Value.ZERO, e.value());
        assertEquals(EvalOutcome.UNKNOWN_RANGE_FUNCTION, e.outcome());
    }

    @Test(expected = IllegalStateException.class)
    public void testUnvalidatedRangeIsAProgrammingError() {
        aggregate("SUM", store, "B2", "A1");
    }

    @Test
    public void testSleepPausesOnlyForPositiveSeconds() {
        put(A1, Value.of(3));
        assertEquals(Evaluation.ok(2), evaluator.evaluate(new Operation.SleepConstant(2), store));
        assertEquals(Evaluation.ok(3), evaluator.evaluate(new Operation.SleepReference(A1), store));
        assertEquals(Evaluation.ok(0), evaluator.evaluate(new Operation.SleepConstant(0), store));
        assertEquals(Evaluation.ok(-4), evaluator.evaluate(new Operation.SleepConstant(-4), store));
        assertEquals(List.of(2, 3), pauses);
    }

    @Test
    public void testNullSleepPolicyNeverPauses() {
        Evaluator noSleep = new Evaluator(null);
        assertEquals(Evaluation.ok(5), noSleep.evaluate(new Operation.SleepConstant(5), store));
    }

    @Test(expected = IllegalStateException.class)
    public void testEmptyShapeIsNeverEvaluated() {
        evaluator.evaluate(Operation.EMPTY, store);
    }

    @Test(expected = IllegalStateException.class)
    public void testUnmaterializedTarget() {
        evaluator.evaluate(Coordinate.of(2, 2), store);
    }

    @Test
    public void testRangeFunctionNames() {
        assertEquals(RangeFunction.STDEV, RangeFunction.fromName("STDEV"));
        assertNull(RangeFunction.fromName("sum"));
        assertNull(RangeFunction.fromName(null));
    }
}
