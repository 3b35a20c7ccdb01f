package com.gridcalc.engine;

import com.gridcalc.api.CellRange;
import com.gridcalc.api.Coordinate;
import com.gridcalc.store.CellStore;
import com.gridcalc.store.SparseCellStore;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class AffectedClosureTest {

    private static final Coordinate A = Coordinate.of(0, 0);
    private static final Coordinate B = Coordinate.of(0, 1);
    private static final Coordinate C = Coordinate.of(0, 2);
    private static final Coordinate D = Coordinate.of(0, 3);

    private CellStore store;
    private RangeRegistry registry;

    @Before
    public void setUp() {
        store = new SparseCellStore(10, 10);
        registry = new RangeRegistry();
    }

    // Records that {@code reader} reads {@code source} directly
    private void edge(Coordinate source, Coordinate reader) {
        store.getOrCreate(source).addDependent(reader);
        store.getOrCreate(reader);
    }

    @Test
    public void testIsolatedCell() {
        AffectedClosure closure = AffectedClosure.discover(A, store, registry);
        assertFalse(closure.hasCycle());
        assertEquals(1, closure.size());
        assertEquals(A, closure.cell(0));
        assertEquals(List.of(A), closure.order());
        assertEquals(0, closure.childCount(0));
        assertEquals(0, closure.parentCount(0));
    }

    @Test
    public void testLinearChain() {
        // A -> B -> C
        edge(A, B);
        edge(B, C);

        AffectedClosure closure = AffectedClosure.discover(A, store, registry);
        assertFalse(closure.hasCycle());
        assertEquals(3, closure.size());
        assertEquals(List.of(A, B, C), closure.order());

        // Check CSR Edge structures
        assertEquals(1, closure.childCount(0));
        assertEquals(1, closure.child(0, 0));
        assertEquals(1, closure.childCount(1));
        assertEquals(2, closure.child(1, 0));
        assertEquals(0, closure.childCount(2));

        assertEquals(0, closure.parentCount(0));
        assertEquals(1, closure.parentCount(1));
        assertEquals(1, closure.parentCount(2));
    }

    @Test
    public void testClosureStartsAtTarget() {
        // A -> B -> C, editing B does not pull in A
        edge(A, B);
        edge(B, C);

        AffectedClosure closure = AffectedClosure.discover(B, store, registry);
        assertEquals(List.of(B, C), closure.order());
        assertEquals(-1, closure.indexOf(A));
    }

    @Test
    public void testDiamond() {
        // A
        // / \
        // B C
        // \ /
        // D
        edge(A, B);
        edge(A, C);
        edge(B, D);
        edge(C, D);

        AffectedClosure closure = AffectedClosure.discover(A, store, registry);
        assertFalse(closure.hasCycle());
        assertEquals(4, closure.size());

        List<Coordinate> order = closure.order();
        assertEquals(A, order.get(0));
        assertEquals(D, order.get(3));

        int idxD = closure.indexOf(D);
        assertEquals(2, closure.parentCount(idxD));
        assertEquals(0, closure.childCount(idxD));
        assertEquals(2, closure.childCount(0));
    }

    @Test
    public void testDiamondWithLongArm() {
        // A -> B -> C -> D and A -> D: D must still come last
        edge(A, B);
        edge(B, C);
        edge(C, D);
        edge(A, D);

        List<Coordinate> order = AffectedClosure.discover(A, store, registry).order();
        assertEquals(List.of(A, B, C, D), order);
    }

    @Test
    public void testRangeMembershipIsAnEdge() {
        // D = SUM(A1:B1), C = D
        registry.register(D, new CellRange(A, B));
        store.getOrCreate(D);
        edge(D, C);

        AffectedClosure closure = AffectedClosure.discover(B, store, registry);
        assertFalse(closure.hasCycle());
        assertEquals(List.of(B, D, C), closure.order());
    }

    @Test
    public void testCycleDetection() {
        // A -> B -> C -> A
        edge(A, B);
        edge(B, C);
        edge(C, A);

        AffectedClosure closure = AffectedClosure.discover(A, store, registry);
        assertTrue(closure.hasCycle());
        assertEquals(1, closure.parentCount(0));
    }

    @Test(expected = IllegalStateException.class)
    public void testOrderOfCyclicClosureThrows() {
        edge(A, B);
        edge(B, A);
        AffectedClosure.discover(A, store, registry).order();
    }

    @Test
    public void testSelfLoopDetection() {
        edge(A, A);
        assertTrue(AffectedClosure.discover(A, store, registry).hasCycle());
    }

    @Test
    public void testRangeCoveringItsOwnerIsACycle() {
        registry.register(B, new CellRange(A, C));
        store.getOrCreate(B);
        assertTrue(AffectedClosure.discover(B, store, registry).hasCycle());
    }

    @Test
    public void testLongChainIsIterative() {
        // 999-cell chain down column A
        CellStore tall = new SparseCellStore(999, 1);
        for (int r = 0; r < 998; r++)
            tall.getOrCreate(Coordinate.of(r, 0)).addDependent(Coordinate.of(r + 1, 0));
        tall.getOrCreate(Coordinate.of(998, 0));

        AffectedClosure closure = AffectedClosure.discover(Coordinate.of(0, 0), tall, new RangeRegistry());
        assertFalse(closure.hasCycle());
        List<Coordinate> order = closure.order();
        assertEquals(999, order.size());
        for (int r = 0; r < 999; r++)
            assertEquals(Coordinate.of(r, 0), order.get(r));
    }
}
