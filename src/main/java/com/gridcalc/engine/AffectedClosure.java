package com.gridcalc.engine;

import com.gridcalc.api.Coordinate;
import com.gridcalc.store.Cell;
import com.gridcalc.store.CellStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The set of cells reachable from an edited cell, indexed once and ordered
 * topologically.
 *
 * Closure discovery is a breadth-first walk from the target. A cell's
 * successors are its dependents (direct readers) plus every aggregate whose
 * registered rectangle covers it. Each visited coordinate gets a dense arena
 * index in discovery order, so the target is always index 0.
 *
 * Data layout (Compressed Sparse Row, as the walk produces it):
 * - cells: arena index -> coordinate.
 * - childrenList: the arena indices of all successors, flattened.
 * - childrenOffset: successors of node i live in
 * childrenList[childrenOffset[i]] inclusive to childrenList[childrenOffset[i+1]]
 * exclusive.
 *
 * Cycle check and ordering are one Kahn pass over this arena using in-degrees
 * counted inside the closure. The drain order is the recomputation order, so
 * the order that gets evaluated is exactly the order proven acyclic. The walk
 * is iterative; closure size never turns into recursion depth.
 */
public final class AffectedClosure {
    private final Coordinate[] cells;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    // Arena indices in drain order; shorter than cells when a cycle exists.
    private final int[] drainOrder;
    private final boolean cyclic;

    private AffectedClosure(Coordinate[] cells, int[] childrenOffset, int[] childrenList, int[] parentCount,
            int[] drainOrder, boolean cyclic) {
        this.cells = cells;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.drainOrder = drainOrder;
        this.cyclic = cyclic;
    }

    /**
     * Walks the sheet from {@code target} and orders the closure.
     *
     * @param target   The edited cell; its new edges must already be installed.
     * @param store    Cell storage, read only.
     * @param registry Range registry, read only.
     */
    public static AffectedClosure discover(Coordinate target, CellStore store, RangeRegistry registry) {
        List<Coordinate> arena = new ArrayList<>();
        Map<Coordinate, Integer> index = new HashMap<>();
        int[] offsets = new int[16];
        int[] flat = new int[16];
        int edges = 0;

        arena.add(target);
        index.put(target, 0);

        // 1. Breadth-first discovery; the arena list doubles as the queue.
        for (int head = 0; head < arena.size(); head++) {
            Coordinate current = arena.get(head);
            Set<Coordinate> successors = successors(current, store, registry);
            if (edges + successors.size() > flat.length)
                flat = Arrays.copyOf(flat, Math.max(flat.length * 2, edges + successors.size()));
            for (Coordinate next : successors) {
                Integer idx = index.get(next);
                if (idx == null) {
                    idx = arena.size();
                    arena.add(next);
                    index.put(next, idx);
                }
                flat[edges++] = idx;
            }
            if (head + 2 > offsets.length)
                offsets = Arrays.copyOf(offsets, offsets.length * 2);
            offsets[head + 1] = edges;
        }

        int n = arena.size();
        int[] childrenOffset = Arrays.copyOf(offsets, n + 1);
        int[] childrenList = Arrays.copyOf(flat, edges);

        // 2. In-degrees restricted to the closure
        int[] inDegree = new int[n];
        for (int e = 0; e < edges; e++)
            inDegree[childrenList[e]]++;
        int[] parentCount = inDegree.clone();

        // 3. Kahn reduction. Any edge into the target means it reads one of its
        // own descendants.
        int[] queue = new int[n];
        int head = 0, tail = 0;
        if (inDegree[0] == 0) {
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;
            while (head < tail) {
                int curr = queue[head++];
                for (int e = childrenOffset[curr]; e < childrenOffset[curr + 1]; e++)
                    if (--inDegree[childrenList[e]] == 0)
                        queue[tail++] = childrenList[e];
            }
        }
        boolean cyclic = tail != n;
        return new AffectedClosure(arena.toArray(new Coordinate[0]), childrenOffset, childrenList, parentCount,
                Arrays.copyOf(queue, tail), cyclic);
    }

    private static Set<Coordinate> successors(Coordinate c, CellStore store, RangeRegistry registry) {
        Set<Coordinate> out = new LinkedHashSet<>();
        Cell cell = store.get(c);
        if (cell != null)
            out.addAll(cell.dependents());
        out.addAll(registry.containing(c));
        return out;
    }

    public boolean hasCycle() {
        return cyclic;
    }

    /** Number of cells in the closure, the target included. */
    public int size() {
        return cells.length;
    }

    /** Coordinate at the given arena index (discovery order, target first). */
    public Coordinate cell(int i) {
        return cells[i];
    }

    /** Arena index of {@code c}, or -1 if it is not in the closure. */
    public int indexOf(Coordinate c) {
        for (int i = 0; i < cells.length; i++)
            if (cells[i].equals(c))
                return i;
        return -1;
    }

    public int childCount(int i) {
        return childrenOffset[i + 1] - childrenOffset[i];
    }

    public int child(int i, int k) {
        return childrenList[childrenOffset[i] + k];
    }

    public int parentCount(int i) {
        return parentCount[i];
    }

    /**
     * Recomputation order.
     *
     * @throws IllegalStateException if the closure contains a cycle.
     */
    public List<Coordinate> order() {
        if (cyclic)
            throw new IllegalStateException("Cycle detected! Drained " + drainOrder.length + " of " + cells.length);
        List<Coordinate> out = new ArrayList<>(drainOrder.length);
        for (int i : drainOrder)
            out.add(cells[i]);
        return out;
    }
}
