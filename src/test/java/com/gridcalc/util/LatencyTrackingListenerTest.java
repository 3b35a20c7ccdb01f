package com.gridcalc.util;

import com.gridcalc.api.Coordinate;
import com.gridcalc.api.EngineError;
import org.junit.Test;

import static org.junit.Assert.*;

public class LatencyTrackingListenerTest {

    @Test
    public void testStartsEmpty() {
        LatencyTrackingListener listener = new LatencyTrackingListener();
        assertEquals(0, listener.totalCommits());
        assertEquals(0, listener.minLatencyNanos());
        assertEquals(0, listener.maxLatencyNanos());
        assertEquals(0.0, listener.avgLatencyNanos(), 0.0);
    }

    @Test
    public void testAccumulatesCommits() {
        LatencyTrackingListener listener = new LatencyTrackingListener();
        Coordinate a1 = Coordinate.of(0, 0);

        listener.onRecalcStart(1, a1);
        listener.onRecalcEnd(1, 3);
        listener.onRecalcStart(2, a1);
        listener.onRecalcEnd(2, 5);
        listener.onCommitRejected(3, a1, EngineError.CYCLE_DETECTED);

        assertEquals(2, listener.totalCommits());
        assertEquals(1, listener.totalRejected());
        assertEquals(8, listener.totalCellsRecomputed());
        assertEquals(5, listener.lastCellsRecomputed());
        assertTrue(listener.minLatencyNanos() <= listener.maxLatencyNanos());
        assertTrue(listener.lastLatencyNanos() >= 0);

        String dump = listener.dump();
        assertTrue(dump.contains("Total Commits"));
        assertTrue(dump.contains("Cells Recomputed"));

        listener.reset();
        assertEquals(0, listener.totalCommits());
        assertEquals(0, listener.totalRejected());
        assertEquals(0, listener.maxLatencyNanos());
    }
}
