package com.gridcalc.wiring;

import com.gridcalc.Spreadsheet;
import com.gridcalc.api.CommitResult;
import com.gridcalc.api.Coordinate;
import com.gridcalc.api.EngineError;
import com.gridcalc.api.Value;
import com.gridcalc.io.SheetConfig;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class SheetWriteGateTest {

    private Spreadsheet sheet;
    private SheetWriteGate gate;

    @Before
    public void setUp() {
        SheetConfig config = SheetConfig.of(10, 10);
        config.setSleep(SheetConfig.SleepMode.NONE);
        sheet = new Spreadsheet(config);
        gate = new SheetWriteGate(sheet, 64);
    }

    @After
    public void tearDown() {
        gate.close();
    }

    @Test
    public void testSubmitCompletesWithCommitResult() {
        CommitResult r = gate.submit("A1", "41+1").join();
        assertTrue(r.isAccepted());
        assertEquals(Value.of(42), sheet.getValue("A1"));
    }

    @Test
    public void testEditsApplyInSubmissionOrder() {
        gate.submit("A1", "1");
        gate.submit("B1", "A1*10");
        gate.submit("A1", "2");
        CommitResult last = gate.submit("C1", "B1+1").join();
        assertTrue(last.isAccepted());
        assertEquals(Value.of(20), sheet.getValue("B1"));
        assertEquals(Value.of(21), sheet.getValue("C1"));
        assertEquals(4, last.epoch());
    }

    @Test
    public void testRejectionsComeBackAsResults() {
        assertEquals(EngineError.UNPARSABLE_FORMULA, gate.submit("A1", "1+").join().error());
        assertEquals(EngineError.REFERENCE_OUT_OF_BOUNDS, gate.submit("A1", "Z99").join().error());
        assertEquals(EngineError.REFERENCE_OUT_OF_BOUNDS, gate.submit("a1", "1").join().error());
    }

    @Test
    public void testSubmitClear() {
        gate.submit("A1", "5");
        gate.submit("B1", "A1+1");
        CommitResult r = gate.submitClear(Coordinate.of(0, 0)).join();
        assertTrue(r.isAccepted());
        assertEquals(Value.of(1), sheet.getValue("B1"));
        assertEquals("", sheet.getFormulaText("A1"));
    }

    @Test
    public void testHandlerFailureCompletesExceptionallyAndConsumerSurvives() {
        // A null formula target reaches the engine and blows up there
        CompletableFuture<CommitResult> broken = gate.submit((Coordinate) null, "1");
        try {
            broken.join();
            fail("Expected the edit to fail");
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof NullPointerException);
        }
        assertTrue(gate.submit("A1", "3").join().isAccepted());
        assertEquals(Value.of(3), sheet.getValue("A1"));
    }

    @Test
    public void testConcurrentProducers() throws Exception {
        final int producers = 4;
        final int edits = 200;
        AtomicInteger accepted = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(producers);
        // Each producer owns one row; column B sums the whole column A
        gate.submit("B1", "SUM(A1:A4)").join();
        for (int p = 0; p < producers; p++) {
            final String ref = "A" + (p + 1);
            Thread t = new Thread(() -> {
                try {
                    for (int i = 1; i <= edits; i++) {
                        if (gate.submit(ref, Integer.toString(i)).join().isAccepted())
                            accepted.incrementAndGet();
                    }
                } finally {
                    done.countDown();
                }
            });
            t.start();
        }
        assertTrue(done.await(30, TimeUnit.SECONDS));
        assertEquals(producers * edits, accepted.get());
        assertEquals(Value.of(producers * edits), sheet.getValue("B1"));
        assertEquals(producers * edits + 1, sheet.engine().epoch());
    }

    @Test
    public void testPostCommitCallbackRunsForEveryEdit() {
        AtomicInteger seen = new AtomicInteger();
        gate.setPostCommitCallback((result, endOfBatch) -> seen.incrementAndGet());
        gate.submit("A1", "1");
        gate.submit("A1", "A1").join();
        assertEquals(2, seen.get());
    }

    @Test(expected = IllegalStateException.class)
    public void testSubmitAfterClose() {
        gate.close();
        assertTrue(gate.isClosed());
        gate.submit("A1", "1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRingSizeMustBePowerOfTwo() {
        new SheetWriteGate(sheet, 100);
    }
}
