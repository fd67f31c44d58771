package com.enterprise.textpipe.exception;

/**
 * Exception thrown when the result of a failed task is requested.
 * Carries the error text stored by the worker.
 */
public class ProcessingFailedException extends TextPipeException {

    private final String taskId;
    private final String errorText;

    public ProcessingFailedException(String taskId, String errorText) {
        super("Processing failed for task " + taskId + ": " + errorText);
        this.taskId = taskId;
        this.errorText = errorText;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getErrorText() {
        return errorText;
    }
}
