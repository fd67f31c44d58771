package com.enterprise.textpipe.exception;

import java.time.Duration;

/**
 * Exception thrown when inline processing does not finish before its deadline
 */
public class QueueTimeoutException extends TextPipeException {

    private final String taskId;

    public QueueTimeoutException(String module, String taskId, Duration timeout) {
        super(String.format("Task %s/%s did not finish within %d ms", module, taskId, timeout.toMillis()));
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
