package com.enterprise.textpipe.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Collects and exposes metrics for queue operations, tagged by module
 */
public class QueueMetrics {

    private static final Logger logger = LoggerFactory.getLogger(QueueMetrics.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    public QueueMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        logger.debug("QueueMetrics initialized on {}", meterRegistry.getClass().getSimpleName());
    }

    /**
     * Metrics backed by a private in-memory registry
     */
    public static QueueMetrics inMemory() {
        return new QueueMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public void recordSubmitted(String module) {
        counter("textpipe.tasks.submitted", "Tasks submitted", module).increment();
    }

    public void recordClaimed(String module) {
        counter("textpipe.tasks.claimed", "Tasks claimed by a worker", module).increment();
    }

    /**
     * Record a claim attempt lost to another worker
     */
    public void recordClaimContention(String module) {
        counter("textpipe.tasks.claim.contention", "Claim attempts lost to a concurrent worker", module).increment();
    }

    public void recordDone(String module) {
        counter("textpipe.tasks.done", "Results stored", module).increment();
    }

    public void recordError(String module) {
        counter("textpipe.tasks.error", "Errors stored", module).increment();
    }

    public void recordRequeued(String module) {
        counter("textpipe.tasks.requeued", "Tasks forced back to pending", module).increment();
    }

    /**
     * Record the time a worker spent processing one task
     */
    public void recordProcessingTime(String module, long millis) {
        timers.computeIfAbsent(module, m ->
            Timer.builder("textpipe.task.processing.time")
                .tag("module", m)
                .description("Time spent processing a claimed task")
                .register(meterRegistry)
        ).record(millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Current value of a module counter, 0 when it was never incremented
     */
    public double count(String name, String module) {
        Counter counter = counters.get(name + "." + module);
        return counter == null ? 0 : counter.count();
    }

    /**
     * All counters as a map keyed by "name.module"
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();
        counters.forEach((key, counter) -> metrics.put(key, counter.count()));
        timers.forEach((module, timer) ->
            metrics.put("textpipe.task.processing.time.mean." + module, timer.mean(TimeUnit.MILLISECONDS)));
        return metrics;
    }

    private Counter counter(String name, String description, String module) {
        return counters.computeIfAbsent(name + "." + module, k ->
            Counter.builder(name)
                .tag("module", module)
                .description(description)
                .register(meterRegistry)
        );
    }
}
