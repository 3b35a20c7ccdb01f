package com.gridcalc;

import com.gridcalc.api.CommitResult;
import com.gridcalc.api.Coordinate;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;
import com.gridcalc.engine.DependencyEngine;
import com.gridcalc.engine.Evaluator;
import com.gridcalc.formula.CellRefCodec;
import com.gridcalc.io.SheetConfig;
import com.gridcalc.store.CellStore;
import com.gridcalc.store.CellStores;
import com.gridcalc.util.CompositeRecalcListener;
import com.gridcalc.util.LatencyTrackingListener;
import com.gridcalc.util.SheetExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A high-level wrapper around the {@link DependencyEngine} that addresses
 * cells by their A1-style names.
 * <p>
 * This class handles:
 * <ul>
 * <li>Choosing a dense or sparse {@link CellStore} from the configuration</li>
 * <li>Wiring the evaluator with the configured sleep behaviour</li>
 * <li>Registering listeners through a {@link CompositeRecalcListener}</li>
 * <li>Decoding cell names for edits and reads</li>
 * </ul>
 * Not thread-safe. Use {@link com.gridcalc.wiring.SheetWriteGate} to feed edits
 * from several threads.
 */
public class Spreadsheet {
    private static final Logger log = LogManager.getLogger(Spreadsheet.class);

    private final DependencyEngine engine;
    private final CompositeRecalcListener compositeListener = new CompositeRecalcListener();
    private LatencyTrackingListener latencyListener;

    /**
     * Creates a sheet with real SLEEP pauses and automatic storage selection.
     *
     * @throws IllegalArgumentException on dimensions outside 1..999 x 1..18278.
     */
    public Spreadsheet(int rows, int cols) {
        this(SheetConfig.of(rows, cols));
    }

    /**
     * @throws IllegalArgumentException if the configuration does not validate.
     */
    public Spreadsheet(SheetConfig config) {
        config.validate();
        CellStore store = CellStores.create(config.getRows(), config.getCols(), config.getStorage(),
                config.getDenseCellLimit());
        this.engine = new DependencyEngine(store, new Evaluator(config.getSleep().policy()));
        this.engine.setListener(compositeListener);
        if (config.isLatencyTracking())
            enableLatencyTracking();
        log.info("Created {}x{} sheet ({} storage)", config.getRows(), config.getCols(),
                store.getClass().getSimpleName());
    }

    /**
     * Installs {@code text} at the cell named {@code ref}. A name that does not
     * decode is reported as out of bounds.
     */
    public CommitResult setFormula(String ref, String text) {
        return engine.setFormula(decode(ref), text);
    }

    public CommitResult setFormula(Coordinate target, String text) {
        return engine.setFormula(target, text);
    }

    public CommitResult clear(String ref) {
        return engine.clear(decode(ref));
    }

    public CommitResult clear(Coordinate target) {
        return engine.clear(target);
    }

    /**
     * @throws IllegalArgumentException if {@code ref} is not a cell inside the
     *                                  sheet.
     */
    public Value getValue(String ref) {
        return getValue(require(ref));
    }

    public Value getValue(Coordinate c) {
        return engine.valueAt(c);
    }

    /** Canonical text of the stored formula; empty for a blank cell. */
    public String getFormulaText(String ref) {
        return getFormulaText(require(ref));
    }

    public String getFormulaText(Coordinate c) {
        return engine.operationAt(c).toFormula();
    }

    public int rows() {
        return engine.store().rows();
    }

    public int cols() {
        return engine.store().cols();
    }

    /**
     * Registers a listener to monitor recalculation events.
     * Note: This adds to the composite listener rather than replacing existing
     * listeners.
     */
    public void addListener(RecalcListener listener) {
        compositeListener.addForComposite(listener);
    }

    /**
     * Enables latency tracking.
     * If already enabled, returns the existing listener.
     */
    public LatencyTrackingListener enableLatencyTracking() {
        if (latencyListener == null) {
            latencyListener = new LatencyTrackingListener();
            compositeListener.addForComposite(latencyListener);
        }
        return latencyListener;
    }

    public SheetExplain explain() {
        return new SheetExplain(engine);
    }

    public DependencyEngine engine() {
        return engine;
    }

    private Coordinate decode(String ref) {
        return CellRefCodec.toCoordinate(ref).orElse(Coordinate.UNADDRESSABLE);
    }

    private Coordinate require(String ref) {
        Coordinate c = decode(ref);
        if (!c.isWithin(rows(), cols()))
            throw new IllegalArgumentException("Not a cell of this " + rows() + "x" + cols() + " sheet: " + ref);
        return c;
    }
}
