package com.enterprise.textpipe.core;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bulk lookups composed from the single-task operations, plus configurable defaults for inline processing.
 * Backends with a cheaper batch path override the bulk operations.
 */
public abstract class AbstractTaskQueue implements TaskQueue {

    private volatile Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private volatile Duration inlineTimeout;

    /**
     * Defaults used by the inline processing overloads that take no interval
     * @param timeout deadline for inline processing, null to wait indefinitely
     */
    public void setInlineDefaults(Duration pollInterval, Duration timeout) {
        this.pollInterval = pollInterval;
        this.inlineTimeout = timeout;
    }

    @Override
    public String processInline(String module, String doc) {
        return processInline(module, doc, pollInterval, inlineTimeout);
    }

    @Override
    public String processInline(String module, String doc, Duration timeout) {
        return processInline(module, doc, pollInterval, timeout);
    }

    @Override
    public Map<String, TaskStatus> bulkStatus(String module, Collection<String> ids) {
        Map<String, TaskStatus> statuses = new LinkedHashMap<>();
        for (String id : ids) {
            statuses.put(id, status(module, id));
        }
        return statuses;
    }

    @Override
    public Map<String, TaskOutcome> bulkResult(String module, Collection<String> ids, String format) {
        Map<String, TaskOutcome> results = new LinkedHashMap<>();
        for (String id : ids) {
            results.put(id, lookupResult(module, id, format));
        }
        return results;
    }

    protected static void checkBulkIds(List<String> docs, List<String> ids) {
        if (ids != null && ids.size() != docs.size()) {
            throw new IllegalArgumentException(
                "Got " + ids.size() + " ids for " + docs.size() + " documents");
        }
    }
}
