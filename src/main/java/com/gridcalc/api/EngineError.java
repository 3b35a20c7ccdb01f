package com.gridcalc.api;

/**
 * Commit-level failures. A call that returns one of these left the sheet
 * exactly as it found it.
 */
public enum EngineError {
    /** A named coordinate lies outside the sheet, or a range is inverted. */
    REFERENCE_OUT_OF_BOUNDS(CommitStatus.INVALID_RANGE),
    /** The text matches no formula shape. */
    UNPARSABLE_FORMULA(CommitStatus.UNRECOGNIZED_FORMULA),
    /** Installing the formula would close a dependency cycle. */
    CYCLE_DETECTED(CommitStatus.CYCLE_DETECTED);

    private final CommitStatus status;

    EngineError(CommitStatus status) {
        this.status = status;
    }

    public CommitStatus status() {
        return status;
    }
}
