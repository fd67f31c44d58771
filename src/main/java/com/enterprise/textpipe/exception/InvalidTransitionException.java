package com.enterprise.textpipe.exception;

import com.enterprise.textpipe.core.TaskStatus;

/**
 * Exception thrown when a result or error is stored for a task that was never claimed
 */
public class InvalidTransitionException extends TextPipeException {

    private final String taskId;
    private final TaskStatus status;

    public InvalidTransitionException(String module, String taskId, TaskStatus status) {
        super(String.format("Cannot store outcome for task %s/%s with status %s", module, taskId, status));
        this.taskId = taskId;
        this.status = status;
    }

    public InvalidTransitionException(String message) {
        super(message);
        this.taskId = null;
        this.status = null;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }
}
