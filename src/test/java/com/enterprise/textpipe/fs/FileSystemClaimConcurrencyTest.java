package com.enterprise.textpipe.fs;

import com.enterprise.textpipe.core.ClaimedTask;
import com.enterprise.textpipe.core.TaskStatus;
import com.enterprise.textpipe.module.ModuleRegistry;
import com.enterprise.textpipe.monitoring.QueueMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Claims racing on one directory, from one queue instance and from several
 */
class FileSystemClaimConcurrencyTest {

    private static final int TASK_COUNT = 200;
    private static final int THREAD_COUNT = 8;

    @TempDir
    Path tempDir;

    @Test
    @Timeout(60)
    void testConcurrentClaimsAreExclusive() throws Exception {
        FileSystemTaskQueue queue = new FileSystemTaskQueue(tempDir);
        submitAll(queue);

        List<String> claimed = claimConcurrently(List.of(queue));

        assertExclusive(claimed);
        assertEquals((long) TASK_COUNT, queue.statistics("echo").get(TaskStatus.STARTED));
    }

    @Test
    @Timeout(60)
    void testConcurrentClaimsAcrossInstancesAreExclusive() throws Exception {
        List<FileSystemTaskQueue> queues = new ArrayList<>();
        QueueMetrics metrics = QueueMetrics.inMemory();
        for (int i = 0; i < THREAD_COUNT; i++) {
            queues.add(new FileSystemTaskQueue(tempDir, ModuleRegistry.defaults(), metrics));
        }
        submitAll(queues.get(0));

        List<String> claimed = claimConcurrently(queues);

        assertExclusive(claimed);
        assertEquals((double) TASK_COUNT, metrics.count("textpipe.tasks.claimed", "echo"));
    }

    private void submitAll(FileSystemTaskQueue queue) {
        List<String> docs = new ArrayList<>();
        for (int i = 0; i < TASK_COUNT; i++) {
            docs.add("document " + i);
        }
        queue.bulkSubmit("echo", docs);
    }

    private List<String> claimConcurrently(List<FileSystemTaskQueue> queues) throws InterruptedException {
        ConcurrentLinkedQueue<String> claimed = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();
        CountDownLatch startLatch = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);

        for (int t = 0; t < THREAD_COUNT; t++) {
            FileSystemTaskQueue queue = queues.get(t % queues.size());
            executor.submit(() -> {
                try {
                    startLatch.await();
                    Optional<ClaimedTask> task;
                    while ((task = queue.claim("echo")).isPresent()) {
                        claimed.add(task.get().getId());
                    }
                } catch (Throwable e) {
                    failures.add(e);
                }
            });
        }

        startLatch.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        assertTrue(failures.isEmpty(), "Claim failures: " + failures);
        return new ArrayList<>(claimed);
    }

    private static void assertExclusive(List<String> claimed) {
        assertEquals(TASK_COUNT, claimed.size());
        assertEquals(TASK_COUNT, new HashSet<>(claimed).size());
    }
}
