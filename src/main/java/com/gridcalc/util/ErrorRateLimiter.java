package com.gridcalc.util;

import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of warning output.
 * Useful when one edit fans out to thousands of cells that all raise the same
 * advisory outcome, such as a division by zero feeding a wide range.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was written, false if it was throttled. */
    public boolean warn(String message) {
        if (!acquire())
            return false;
        write(message);
        return true;
    }

    /**
     * Same as {@link #warn(String)} with a log4j {@code {}} pattern. The
     * message is only formatted when it is actually written.
     */
    public boolean warn(String pattern, Object... params) {
        if (!acquire())
            return false;
        write(new ParameterizedMessage(pattern, params).getFormattedMessage());
        return true;
    }

    private void write(String message) {
        long dropped = suppressed.getAndSet(0);
        if (dropped > 0)
            logger.warn("{} ({} similar messages suppressed)", message, dropped);
        else
            logger.warn(message);
    }

    private boolean acquire() {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // Check-and-set so only one thread logs per interval
            if (lastLogTime.compareAndSet(last, now))
                return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
