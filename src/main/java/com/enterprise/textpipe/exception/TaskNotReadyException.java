package com.enterprise.textpipe.exception;

import com.enterprise.textpipe.core.TaskStatus;

/**
 * Exception thrown when a result is requested for a task that has not finished
 */
public class TaskNotReadyException extends TextPipeException {

    private final String taskId;
    private final TaskStatus status;

    public TaskNotReadyException(String taskId, TaskStatus status) {
        super("Status of " + taskId + " is " + status);
        this.taskId = taskId;
        this.status = status;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }
}
