package com.gridcalc.wiring;

import com.gridcalc.Spreadsheet;
import com.gridcalc.api.CommitResult;

import com.lmax.disruptor.EventHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;

/**
 * Disruptor EventHandler that consumes FormulaEvents and applies them to the
 * sheet.
 *
 * This class is the bridge between the ring buffer and the
 * {@link Spreadsheet}. It runs on a single dedicated consumer thread, so the
 * engine only ever sees one writer.
 *
 * Every event is committed on its own: unlike market ticks, two edits cannot
 * be coalesced because each caller waits for its own {@link CommitResult}.
 *
 * A failure while applying an event completes that caller's future
 * exceptionally and is logged. It is not rethrown, to keep the consumer
 * thread alive for the next producer.
 */
public final class SheetPublisher implements EventHandler<FormulaEvent> {
    private static final Logger log = LogManager.getLogger(SheetPublisher.class);

    private final Spreadsheet sheet;
    private PostCommitCallback postCommit;
    private long processed;

    public SheetPublisher(Spreadsheet sheet) {
        this.sheet = sheet;
    }

    /**
     * Sets a callback invoked on the consumer thread after every commit,
     * accepted or rejected.
     */
    public void setPostCommitCallback(PostCommitCallback cb) {
        this.postCommit = cb;
    }

    /**
     * Process a single event from the ring buffer.
     *
     * @param event      The event carried by the ring buffer.
     * @param sequence   The sequence ID of the event.
     * @param endOfBatch Flag indicating if this is the last event in the current
     *                   batch.
     */
    @Override
    public void onEvent(FormulaEvent event, long sequence, boolean endOfBatch) {
        final CompletableFuture<CommitResult> future = event.result();
        try {
            CommitResult result = event.isClear()
                    ? sheet.clear(event.target())
                    : sheet.setFormula(event.target(), event.text());
            processed++;
            if (postCommit != null)
                postCommit.onCommitted(result, endOfBatch);
            if (future != null)
                future.complete(result);
        } catch (RuntimeException e) {
            log.error("Error applying edit #{} to {}: {}", sequence, event.target(), e.getMessage(), e);
            if (future != null)
                future.completeExceptionally(e);
        } finally {
            event.clear();
        }
    }

    /** Events applied without an exception since start. Consumer thread only. */
    public long processed() {
        return processed;
    }

    /**
     * Callback interface for post-commit actions.
     */
    @FunctionalInterface
    public interface PostCommitCallback {
        /**
         * @param result     Outcome of the edit.
         * @param endOfBatch True when no further edit is waiting in the ring.
         */
        void onCommitted(CommitResult result, boolean endOfBatch);
    }
}
