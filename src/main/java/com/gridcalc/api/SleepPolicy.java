package com.gridcalc.api;

import java.util.concurrent.TimeUnit;

/**
 * Delay performed when a SLEEP formula is evaluated.
 *
 * The delay blocks the whole recalculation pass, so it is injected rather
 * than hard-wired: {@link #REAL} for interactive use, {@link #NONE} for tests
 * and batch loads.
 */
@FunctionalInterface
public interface SleepPolicy {

    /** Blocks the calling thread for the given number of seconds. Interruption ends the wait early. */
    SleepPolicy REAL = seconds -> {
        try {
            TimeUnit.SECONDS.sleep(seconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    };

    SleepPolicy NONE = seconds -> {
    };

    /**
     * Called only with positive values.
     *
     * @param seconds The delay requested by the formula.
     */
    void pause(int seconds);
}
