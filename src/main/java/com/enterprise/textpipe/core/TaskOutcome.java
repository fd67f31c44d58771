package com.enterprise.textpipe.core;

import com.enterprise.textpipe.exception.ProcessingFailedException;
import com.enterprise.textpipe.exception.TaskNotFoundException;
import com.enterprise.textpipe.exception.TaskNotReadyException;

/**
 * Answer to a result lookup. Expected conditions (unknown id, not finished, failed)
 * are values rather than exceptions so callers can branch on {@link #getKind()}.
 */
public interface TaskOutcome {

    enum Kind {
        READY,
        NOT_FOUND,
        NOT_READY,
        FAILED
    }

    Kind getKind();

    /**
     * Id of the task this outcome describes
     */
    String getTaskId();

    /**
     * Status of the task at lookup time
     */
    TaskStatus getStatus();

    /**
     * Result text for READY outcomes, null otherwise
     */
    String getResult();

    /**
     * Stored error text for FAILED outcomes, null otherwise
     */
    String getError();

    default boolean isReady() {
        return getKind() == Kind.READY;
    }

    /**
     * Result text, or the exception matching the outcome kind
     */
    default String orElseThrow() {
        switch (getKind()) {
            case READY:
                return getResult();
            case FAILED:
                throw new ProcessingFailedException(getTaskId(), getError());
            case NOT_FOUND:
                throw new TaskNotFoundException(getTaskId());
            default:
                throw new TaskNotReadyException(getTaskId(), getStatus());
        }
    }

    static TaskOutcome ready(String id, String result) {
        return new TaskOutcomeImpl(Kind.READY, id, TaskStatus.DONE, result, null);
    }

    static TaskOutcome failed(String id, String error) {
        return new TaskOutcomeImpl(Kind.FAILED, id, TaskStatus.ERROR, null, error);
    }

    static TaskOutcome notFound(String id) {
        return new TaskOutcomeImpl(Kind.NOT_FOUND, id, TaskStatus.UNKNOWN, null, null);
    }

    static TaskOutcome notReady(String id, TaskStatus status) {
        return new TaskOutcomeImpl(Kind.NOT_READY, id, status, null, null);
    }

    /**
     * Default implementation of TaskOutcome
     */
    final class TaskOutcomeImpl implements TaskOutcome {
        private final Kind kind;
        private final String taskId;
        private final TaskStatus status;
        private final String result;
        private final String error;

        private TaskOutcomeImpl(Kind kind, String taskId, TaskStatus status, String result, String error) {
            this.kind = kind;
            this.taskId = taskId;
            this.status = status;
            this.result = result;
            this.error = error;
        }

        @Override
        public Kind getKind() { return kind; }

        @Override
        public String getTaskId() { return taskId; }

        @Override
        public TaskStatus getStatus() { return status; }

        @Override
        public String getResult() { return result; }

        @Override
        public String getError() { return error; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TaskOutcomeImpl)) return false;
            TaskOutcomeImpl that = (TaskOutcomeImpl) o;
            return kind == that.kind && status == that.status
                && java.util.Objects.equals(taskId, that.taskId)
                && java.util.Objects.equals(result, that.result)
                && java.util.Objects.equals(error, that.error);
        }

        @Override
        public int hashCode() {
            return java.util.Objects.hash(kind, taskId, status, result, error);
        }

        @Override
        public String toString() {
            return "TaskOutcome{" + kind + ", id=" + taskId + ", status=" + status + "}";
        }
    }
}
