package com.enterprise.textpipe.core;

/**
 * Represents the status of a task in the queue.
 * UNKNOWN is never stored; it is the answer when no record exists.
 */
public enum TaskStatus {
    UNKNOWN(404),
    PENDING(202),
    STARTED(202),
    DONE(200),
    ERROR(500);

    private final int httpStatus;

    TaskStatus(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    /**
     * Response code used for this status on the wire
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    /**
     * Whether a result or error may be stored for a task in this status
     */
    public boolean acceptsOutcome() {
        return this == STARTED || this == DONE || this == ERROR;
    }
}
