package com.gridcalc.util;

import com.gridcalc.api.Coordinate;
import com.gridcalc.api.EngineError;
import com.gridcalc.api.EvalOutcome;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link RecalcListener} instances without
 * allocating per callback.
 */
public class CompositeRecalcListener implements RecalcListener {
    private RecalcListener[] listeners = new RecalcListener[0];

    public void addForComposite(RecalcListener listener) {
        RecalcListener[] old = listeners;
        RecalcListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRecalcStart(long epoch, Coordinate target) {
        for (RecalcListener l : listeners)
            l.onRecalcStart(epoch, target);
    }

    @Override
    public void onCellRecomputed(long epoch, Coordinate cell, Value value, long durationNanos) {
        for (RecalcListener l : listeners)
            l.onCellRecomputed(epoch, cell, value, durationNanos);
    }

    @Override
    public void onCellIssue(long epoch, Coordinate cell, EvalOutcome outcome) {
        for (RecalcListener l : listeners)
            l.onCellIssue(epoch, cell, outcome);
    }

    @Override
    public void onCommitRejected(long epoch, Coordinate target, EngineError error) {
        for (RecalcListener l : listeners)
            l.onCommitRejected(epoch, target, error);
    }

    @Override
    public void onRecalcEnd(long epoch, int cellsRecomputed) {
        for (RecalcListener l : listeners)
            l.onRecalcEnd(epoch, cellsRecomputed);
    }
}
