package com.enterprise.textpipe.worker;

import com.enterprise.textpipe.config.TextPipeConfig;
import com.enterprise.textpipe.core.ClaimedTask;
import com.enterprise.textpipe.core.TaskQueue;
import com.enterprise.textpipe.module.TextModule;
import com.enterprise.textpipe.monitoring.QueueMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Claims tasks of one module, processes them and stores the result or the error.
 * Only talks to the queue through claim, storeResult and storeError, so it runs against either backend.
 */
public class QueueWorker {

    private static final Logger logger = LoggerFactory.getLogger(QueueWorker.class);

    private final TaskQueue queue;
    private final TextModule module;
    private final TextPipeConfig.WorkerConfig config;
    private final QueueMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong tasksProcessed = new AtomicLong(0);
    private final AtomicLong tasksFailed = new AtomicLong(0);

    private ScheduledExecutorService scheduler;

    public QueueWorker(TaskQueue queue, TextModule module, TextPipeConfig.WorkerConfig config, QueueMetrics metrics) {
        this.queue = queue;
        this.module = module;
        this.config = config;
        this.metrics = metrics;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.info("Starting {} worker thread(s) for module {}", config.getThreads(), module.getName());
            scheduler = Executors.newScheduledThreadPool(config.getThreads(), new WorkerThreadFactory(module.getName()));
            for (int i = 0; i < config.getThreads(); i++) {
                scheduler.scheduleWithFixedDelay(this::drain, 0, config.getPollDelay().toMillis(),
                    TimeUnit.MILLISECONDS);
            }
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("Stopping worker for module {}...", module.getName());
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Worker did not terminate gracefully, forcing shutdown");
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.error("Interrupted during shutdown", e);
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            logger.info("Worker for module {} stopped", module.getName());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Claim and process at most one task on the calling thread
     * @return whether a task was processed
     */
    public boolean runOnce() {
        Optional<ClaimedTask> claimed = queue.claim(module.getName());
        if (claimed.isEmpty()) {
            return false;
        }
        process(claimed.get());
        return true;
    }

    public long getTasksProcessed() {
        return tasksProcessed.get();
    }

    public long getTasksFailed() {
        return tasksFailed.get();
    }

    private void drain() {
        try {
            int handled = 0;
            while (running.get() && handled < config.getBatchSize() && runOnce()) {
                handled++;
            }
        } catch (Exception e) {
            // keep the scheduled loop alive; the next poll retries
            logger.error("Error polling queue for module {}", module.getName(), e);
        }
    }

    private void process(ClaimedTask task) {
        String name = module.getName();
        long startTime = System.currentTimeMillis();
        String result;
        try {
            logger.debug("Processing task {}/{}", name, task.getId());
            result = module.process(task.getDocument());
        } catch (Exception e) {
            long executionTime = System.currentTimeMillis() - startTime;
            metrics.recordProcessingTime(name, executionTime);
            tasksFailed.incrementAndGet();
            logger.warn("Task {}/{} failed after {}ms: {}", name, task.getId(), executionTime, e.toString());
            queue.storeError(name, task.getId(), describe(e));
            return;
        }
        long executionTime = System.currentTimeMillis() - startTime;
        metrics.recordProcessingTime(name, executionTime);
        queue.storeResult(name, task.getId(), result);
        tasksProcessed.incrementAndGet();
        logger.debug("Task {}/{} completed in {}ms", name, task.getId(), executionTime);
    }

    static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getName() : e.getClass().getName() + ": " + e.getMessage();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix;

        WorkerThreadFactory(String module) {
            this.namePrefix = "worker-" + module + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }
}
