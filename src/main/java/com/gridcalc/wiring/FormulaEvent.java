package com.gridcalc.wiring;

import com.gridcalc.api.CommitResult;
import com.gridcalc.api.Coordinate;

import java.util.concurrent.CompletableFuture;

/**
 * A mutable data holder for sheet edits, used within the LMAX Disruptor
 * RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every edit. Only the caller's future is allocated per edit.
 *
 * Fields:
 * - target: The cell being written.
 * - text: Formula text, ignored for a clear.
 * - clear: Reset the cell to Empty instead of parsing {@code text}.
 * - result: Completed by the consumer once the commit returns.
 */
public final class FormulaEvent {
    private Coordinate target;
    private String text;
    private boolean clear;
    private CompletableFuture<CommitResult> result;

    /**
     * Configures the event for a formula edit.
     *
     * @param target Cell to write.
     * @param text   Formula text as typed.
     * @param result Future handed back to the producer.
     */
    public void setFormula(Coordinate target, String text, CompletableFuture<CommitResult> result) {
        this.target = target;
        this.text = text;
        this.clear = false;
        this.result = result;
    }

    /**
     * Configures the event to reset {@code target} to Empty.
     */
    public void setClear(Coordinate target, CompletableFuture<CommitResult> result) {
        this.target = target;
        this.text = null;
        this.clear = true;
        this.result = result;
    }

    public Coordinate target() {
        return target;
    }

    public String text() {
        return text;
    }

    public boolean isClear() {
        return clear;
    }

    public CompletableFuture<CommitResult> result() {
        return result;
    }

    public void clear() {
        target = null;
        text = null;
        clear = false;
        result = null;
    }
}
