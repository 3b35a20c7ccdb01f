package com.gridcalc.api;

/**
 * The four status codes a front end shows after an edit.
 */
public enum CommitStatus {
    OK("ok"),
    INVALID_RANGE("Invalid range"),
    UNRECOGNIZED_FORMULA("unrecognized cmd"),
    CYCLE_DETECTED("cycle detected");

    private final String message;

    CommitStatus(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
