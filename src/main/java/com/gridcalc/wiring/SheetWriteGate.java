package com.gridcalc.wiring;

import com.gridcalc.Spreadsheet;
import com.gridcalc.api.CommitResult;
import com.gridcalc.api.Coordinate;
import com.gridcalc.formula.CellRefCodec;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-writer gate in front of a {@link Spreadsheet}.
 * <p>
 * Any number of producer threads may call {@link #submit}. Edits are claimed
 * on an LMAX Disruptor ring buffer and applied in sequence order by one
 * daemon consumer thread running a {@link SheetPublisher}. The returned
 * future completes on that thread once the commit has returned, so values
 * read after {@code join()} reflect the edit.
 */
public final class SheetWriteGate implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(SheetWriteGate.class);
    private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000;

    private final Disruptor<FormulaEvent> disruptor;
    private final RingBuffer<FormulaEvent> ringBuffer;
    private final SheetPublisher publisher;
    private volatile boolean closed;

    /**
     * Creates and starts the gate.
     *
     * @param bufferSize ring size, a power of two.
     * @throws IllegalArgumentException if {@code bufferSize} is not a power of
     *                                  two.
     */
    public SheetWriteGate(Spreadsheet sheet, int bufferSize) {
        if (bufferSize < 1 || Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of two, got " + bufferSize);
        this.publisher = new SheetPublisher(sheet);
        this.disruptor = new Disruptor<>(
                FormulaEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
        this.ringBuffer = disruptor.start();
        log.info("Sheet write gate started (ring size {})", bufferSize);
    }

    /**
     * Queues an edit of the cell named {@code ref}. A name that does not decode
     * completes with an out-of-bounds rejection.
     */
    public CompletableFuture<CommitResult> submit(String ref, String text) {
        return submit(CellRefCodec.toCoordinate(ref).orElse(Coordinate.UNADDRESSABLE), text);
    }

    /**
     * Queues an edit. Blocks while the ring is full.
     *
     * @throws IllegalStateException if the gate is closed.
     */
    public CompletableFuture<CommitResult> submit(Coordinate target, String text) {
        ensureOpen();
        CompletableFuture<CommitResult> future = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setFormula(target, text, future);
        } finally {
            ringBuffer.publish(sequence);
        }
        return future;
    }

    /** Queues a reset of {@code target} to Empty. */
    public CompletableFuture<CommitResult> submitClear(Coordinate target) {
        ensureOpen();
        CompletableFuture<CommitResult> future = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setClear(target, future);
        } finally {
            ringBuffer.publish(sequence);
        }
        return future;
    }

    /** Registers a consumer-thread callback. Call before the first submit. */
    public void setPostCommitCallback(SheetPublisher.PostCommitCallback cb) {
        publisher.setPostCommitCallback(cb);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Drains queued edits and stops the consumer thread. Edits still queued
     * after the timeout are abandoned.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
            log.info("Sheet write gate stopped");
        } catch (TimeoutException e) {
            log.warn("Sheet write gate did not drain within {} ms, halting", SHUTDOWN_TIMEOUT_MILLIS, e);
            disruptor.halt();
        }
    }

    private void ensureOpen() {
        if (closed)
            throw new IllegalStateException("Sheet write gate is closed");
    }
}
