package com.gridcalc.util;

import com.gridcalc.api.CellRange;
import com.gridcalc.api.CommitResult;
import com.gridcalc.api.Coordinate;
import com.gridcalc.engine.DependencyEngine;
import com.gridcalc.engine.RangeRegistry;
import com.gridcalc.store.Cell;
import com.gridcalc.store.CellStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting sheet state and dependency edges.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error reports.
 * Do <b>not</b> call it per edit: it walks every materialized cell.
 */
public final class SheetExplain {
    private static final Comparator<Coordinate> ROW_MAJOR = Comparator.comparingInt(Coordinate::row)
            .thenComparingInt(Coordinate::col);

    private final DependencyEngine engine;
    private final CellStore store;
    private final RangeRegistry registry;

    public SheetExplain(DependencyEngine engine) {
        this.engine = engine;
        this.store = engine.store();
        this.registry = engine.registry();
    }

    /**
     * Dumps detailed state of a single cell.
     */
    public String explainCell(Coordinate c) {
        Cell cell = store.get(c);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Cell: ").append(c).append('\n');
        if (cell == null)
            return sb.append("  (never written)\n").toString();
        sb.append("  Kind: ").append(cell.operation().kind()).append('\n')
                .append("  Formula: ").append(cell.operation().toFormula()).append('\n')
                .append("  Value: ").append(cell.value().display()).append('\n');
        List<Coordinate> readers = sorted(new ArrayList<>(cell.dependents()));
        sb.append("  Dependents (").append(readers.size()).append("): ").append(join(readers)).append('\n');
        List<Coordinate> aggregates = registry.containing(c);
        if (!aggregates.isEmpty())
            sb.append("  Read by ranges: ").append(join(sorted(new ArrayList<>(aggregates)))).append('\n');
        List<CellRange> owned = registry.ranges(c);
        if (!owned.isEmpty())
            sb.append("  Reads ranges: ").append(owned).append('\n');
        return sb.toString();
    }

    /**
     * Summary of the last call on the engine.
     */
    public String explainLastCommit() {
        CommitResult last = engine.lastCommit();
        if (last == null)
            return "Epoch: " + engine.epoch() + ", no commits";
        return "Epoch: " + last.epoch() + ", Target: " + last.target() + ", Status: " + last.status().message()
                + ", Recomputed: " + last.affected().size() + ", Issues: " + last.issues().size();
    }

    /**
     * Dumps forward edges and registered ranges in a dot-like text format.
     */
    public String dumpDependencies() {
        StringBuilder sb = new StringBuilder(1024);
        List<Coordinate> coords = materialized();
        sb.append("Sheet (").append(store.rows()).append('x').append(store.cols()).append(", ")
                .append(coords.size()).append(" cells):\n");
        for (Coordinate c : coords) {
            Cell cell = store.get(c);
            sb.append("  ").append(c).append(" = ").append(cell.value().display());
            String formula = cell.operation().toFormula();
            if (!formula.isEmpty())
                sb.append(" [").append(formula).append(']');
            if (!cell.dependents().isEmpty())
                sb.append(" -> ").append(join(sorted(new ArrayList<>(cell.dependents()))));
            sb.append('\n');
        }
        Map<Coordinate, List<CellRange>> ranges = registry.snapshot();
        if (!ranges.isEmpty()) {
            sb.append("Ranges:\n");
            for (var entry : ranges.entrySet())
                sb.append("  ").append(entry.getKey()).append(" <= ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph of materialized cells. Single-cell edges
     * are solid, range reads are dotted and labelled with the rectangle.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        List<Coordinate> coords = materialized();
        for (Coordinate c : coords) {
            Cell cell = store.get(c);
            sb.append("  ").append(c).append("[\"").append(c).append("<br/>")
                    .append(cell.value().display()).append("\"];\n");
        }
        for (Coordinate c : coords) {
            for (Coordinate reader : sorted(new ArrayList<>(store.get(c).dependents())))
                sb.append("  ").append(c).append(" --> ").append(reader).append(";\n");
        }
        for (var entry : registry.snapshot().entrySet()) {
            for (CellRange range : entry.getValue())
                sb.append("  ").append(range.start()).append(" -. \"").append(range).append("\" .-> ")
                        .append(entry.getKey()).append(";\n");
        }
        return sb.toString();
    }

    private List<Coordinate> materialized() {
        List<Coordinate> coords = new ArrayList<>(store.size());
        store.forEach((c, cell) -> {
            if (!cell.isBlank())
                coords.add(c);
        });
        return sorted(coords);
    }

    private static List<Coordinate> sorted(List<Coordinate> coords) {
        coords.sort(ROW_MAJOR);
        return coords;
    }

    private static String join(List<Coordinate> coords) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < coords.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(coords.get(i));
        }
        return sb.toString();
    }
}
