package com.enterprise.textpipe.core;

import com.enterprise.textpipe.exception.QueueTimeoutException;
import com.enterprise.textpipe.exception.TextPipeException;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Shared job queue between document producers and text-processing workers.
 * Tasks live in a module namespace and are keyed by content hash or explicit id.
 * Both backends (direct storage and remote service) behave identically through this interface.
 */
public interface TaskQueue {

    /**
     * Polling cadence of {@link #processInline(String, String)}
     */
    Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    /**
     * Longest timeout {@link #processInline} enforces; anything longer waits without a deadline
     */
    Duration MAX_DEADLINE = Duration.ofNanos(Long.MAX_VALUE / 2);

    /**
     * Submit a document for processing with the module, keyed by its content id
     * @return the task id
     */
    default String submit(String module, String doc) {
        return submit(module, doc, null);
    }

    /**
     * Submit a document for processing. Creates a PENDING record when the task is unknown,
     * otherwise leaves the existing record untouched.
     * @param id explicit task id, or null to derive it from the content
     * @return the task id
     */
    String submit(String module, String doc, String id);

    /**
     * Current status of a task; UNKNOWN when no record exists
     */
    TaskStatus status(String module, String id);

    /**
     * Look up the outcome of a task, converting DONE results with the module when a format is given
     * @param format target format, or null for the raw result
     */
    TaskOutcome lookupResult(String module, String id, String format);

    default String result(String module, String id) {
        return result(module, id, null);
    }

    /**
     * Result text of a DONE task.
     * @throws com.enterprise.textpipe.exception.ProcessingFailedException if the task failed
     * @throws com.enterprise.textpipe.exception.TaskNotFoundException if the task is unknown
     * @throws com.enterprise.textpipe.exception.TaskNotReadyException if the task is pending or started
     */
    default String result(String module, String id, String format) {
        return lookupResult(module, id, format).orElseThrow();
    }

    /**
     * Atomically take the oldest pending task of a module and mark it STARTED.
     * Concurrent callers never receive the same task.
     * @return the claimed task, or empty when nothing is pending
     */
    Optional<ClaimedTask> claim(String module);

    /**
     * Lazily claim up to {@code n} tasks; stops early once the queue is drained
     */
    default Stream<ClaimedTask> claimMany(String module, int n) {
        return Stream.generate(() -> claim(module))
            .limit(n)
            .takeWhile(Optional::isPresent)
            .map(Optional::get);
    }

    /**
     * Store the result of a claimed task, replacing any earlier outcome
     * @throws com.enterprise.textpipe.exception.InvalidTransitionException if the task is pending or unknown
     */
    void storeResult(String module, String id, String result);

    /**
     * Store an error description for a claimed task, replacing any earlier outcome
     * @throws com.enterprise.textpipe.exception.InvalidTransitionException if the task is pending or unknown
     */
    void storeError(String module, String id, String error);

    /**
     * Number of records per stored state of a module
     */
    Map<TaskStatus, Long> statistics(String module);

    Map<String, TaskStatus> bulkStatus(String module, Collection<String> ids);

    Map<String, TaskOutcome> bulkResult(String module, Collection<String> ids, String format);

    default List<String> bulkSubmit(String module, List<String> docs) {
        return bulkSubmit(module, docs, null, false, false);
    }

    /**
     * Submit many documents
     * @param ids explicit ids in the same order as docs, or null to derive them
     * @param resetError requeue tasks currently in ERROR
     * @param resetPending requeue tasks currently PENDING with a fresh submission time
     * @return ids in the same order as docs
     */
    List<String> bulkSubmit(String module, List<String> docs, List<String> ids,
                            boolean resetError, boolean resetPending);

    /**
     * Process a document and wait for its result without a deadline
     */
    default String processInline(String module, String doc) {
        return processInline(module, doc, DEFAULT_POLL_INTERVAL, null);
    }

    default String processInline(String module, String doc, Duration timeout) {
        return processInline(module, doc, DEFAULT_POLL_INTERVAL, timeout);
    }

    /**
     * Submit the document if it is unknown, then poll until the task is DONE or ERROR.
     * Interrupting the calling thread aborts the wait.
     * @param timeout deadline for the whole call, or null to wait indefinitely
     * @throws QueueTimeoutException when the deadline passes first
     */
    default String processInline(String module, String doc, Duration pollInterval, Duration timeout) {
        String id = TaskIds.identity(doc);
        if (status(module, id) == TaskStatus.UNKNOWN) {
            submit(module, doc);
        }
        Long deadline = deadlineAfter(timeout);
        while (true) {
            if (status(module, id).isTerminal()) {
                return result(module, id);
            }
            if (deadline != null && System.nanoTime() - deadline >= 0) {
                throw new QueueTimeoutException(module, id, timeout);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TextPipeException("Interrupted while waiting for task " + module + "/" + id, e);
            }
        }
    }

    /**
     * nanoTime deadline, or null when there is none. Timeouts too long to measure in nanoseconds
     * count as no deadline.
     */
    private static Long deadlineAfter(Duration timeout) {
        // beyond half the nanoTime range, nanoTime() - deadline could overflow
        if (timeout == null || timeout.compareTo(MAX_DEADLINE) > 0) {
            return null;
        }
        return System.nanoTime() + timeout.toNanos();
    }
}
