package com.enterprise.textpipe.fs;

import com.enterprise.textpipe.core.AbstractTaskQueue;
import com.enterprise.textpipe.core.ClaimedTask;
import com.enterprise.textpipe.core.TaskIds;
import com.enterprise.textpipe.core.TaskOutcome;
import com.enterprise.textpipe.core.TaskStatus;
import com.enterprise.textpipe.exception.InvalidTransitionException;
import com.enterprise.textpipe.exception.StorageException;
import com.enterprise.textpipe.module.ModuleRegistry;
import com.enterprise.textpipe.monitoring.QueueMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Task queue on a shared directory tree, usable from several processes and hosts (e.g. over NFS).
 * <p>
 * Each module has one directory per stored state: {@code queue} (PENDING), {@code inprogress} (STARTED),
 * {@code results} (DONE) and {@code errors} (ERROR). A task is a file named by its id in exactly one of them.
 * Claiming is a single atomic rename from {@code queue} to {@code inprogress}; a rename that fails because
 * the source is gone means another worker won the task.
 * <p>
 * FIFO order uses the last-modified time of the pending file, which is set when the document is written
 * at submission and survives the rename. Storage layers that rewrite timestamps on rename weaken that order.
 */
public class FileSystemTaskQueue extends AbstractTaskQueue {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemTaskQueue.class);

    private static final Map<TaskStatus, String> CONTAINERS = new EnumMap<>(TaskStatus.class);

    static {
        // lifecycle order; status() relies on it to see a task that moves forward mid-lookup
        CONTAINERS.put(TaskStatus.PENDING, "queue");
        CONTAINERS.put(TaskStatus.STARTED, "inprogress");
        CONTAINERS.put(TaskStatus.DONE, "results");
        CONTAINERS.put(TaskStatus.ERROR, "errors");
    }

    private final Path root;
    private final ModuleRegistry registry;
    private final QueueMetrics metrics;
    private final Set<String> preparedModules = ConcurrentHashMap.newKeySet();

    public FileSystemTaskQueue(Path root) {
        this(root, ModuleRegistry.defaults(), QueueMetrics.inMemory());
    }

    public FileSystemTaskQueue(Path root, ModuleRegistry registry, QueueMetrics metrics) {
        this.root = root.toAbsolutePath();
        this.registry = registry;
        this.metrics = metrics;
        logger.info("FileSystemTaskQueue initialized at: {}", this.root);
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public String submit(String module, String doc, String id) {
        checkModule(module);
        String taskId = checkId(TaskIds.resolve(doc, id));
        if (status(module, taskId) == TaskStatus.UNKNOWN) {
            write(module, TaskStatus.PENDING, taskId, doc);
            metrics.recordSubmitted(module);
            logger.debug("Task {}/{} submitted", module, taskId);
        }
        return taskId;
    }

    @Override
    public TaskStatus status(String module, String id) {
        checkModule(module);
        checkId(id);
        for (TaskStatus status : CONTAINERS.keySet()) {
            if (Files.exists(path(module, status, id))) {
                return status;
            }
        }
        return TaskStatus.UNKNOWN;
    }

    @Override
    public TaskOutcome lookupResult(String module, String id, String format) {
        TaskStatus status = status(module, id);
        try {
            switch (status) {
                case DONE:
                    String result = read(module, TaskStatus.DONE, id);
                    if (format != null) {
                        result = registry.get(module).convert(id, result, format);
                    }
                    return TaskOutcome.ready(id, result);
                case ERROR:
                    return TaskOutcome.failed(id, read(module, TaskStatus.ERROR, id));
                case UNKNOWN:
                    return TaskOutcome.notFound(id);
                default:
                    return TaskOutcome.notReady(id, status);
            }
        } catch (NoSuchFileException e) {
            // outcome overwritten between lookup and read
            logger.debug("Task {}/{} moved while reading its {} record, retrying", module, id, status);
            return lookupResult(module, id, format);
        } catch (IOException e) {
            logger.error("Failed to read result of task {}/{}", module, id, e);
            throw new StorageException("Failed to read result of task " + module + "/" + id, e);
        }
    }

    @Override
    public Optional<ClaimedTask> claim(String module) {
        checkModule(module);
        Path pending = container(module, TaskStatus.PENDING);
        if (!Files.isDirectory(pending)) {
            return Optional.empty();
        }
        prepare(module);
        for (String id : pendingByAge(pending)) {
            Path target = path(module, TaskStatus.STARTED, id);
            try {
                Files.move(pending.resolve(id), target, StandardCopyOption.ATOMIC_MOVE);
            } catch (NoSuchFileException e) {
                metrics.recordClaimContention(module);
                logger.debug("Task {}/{} already claimed by another worker", module, id);
                continue;
            } catch (IOException e) {
                logger.error("Failed to claim task {}/{}", module, id, e);
                throw new StorageException("Failed to claim task " + module + "/" + id, e);
            }
            try {
                String doc = Files.readString(target, StandardCharsets.UTF_8);
                metrics.recordClaimed(module);
                logger.debug("Task {}/{} claimed", module, id);
                return Optional.of(new ClaimedTask(id, doc));
            } catch (IOException e) {
                logger.error("Failed to read claimed task {}/{}", module, id, e);
                throw new StorageException("Failed to read claimed task " + module + "/" + id, e);
            }
        }
        return Optional.empty();
    }

    @Override
    public void storeResult(String module, String id, String result) {
        storeOutcome(module, id, TaskStatus.DONE, result);
        metrics.recordDone(module);
    }

    @Override
    public void storeError(String module, String id, String error) {
        storeOutcome(module, id, TaskStatus.ERROR, error);
        metrics.recordError(module);
    }

    @Override
    public List<String> bulkSubmit(String module, List<String> docs, List<String> ids,
                                   boolean resetError, boolean resetPending) {
        checkModule(module);
        checkBulkIds(docs, ids);
        List<String> submitted = new ArrayList<>(docs.size());
        for (int i = 0; i < docs.size(); i++) {
            String doc = docs.get(i);
            String id = checkId(TaskIds.resolve(doc, ids == null ? null : ids.get(i)));
            TaskStatus current = status(module, id);
            if ((resetError && current == TaskStatus.ERROR) || (resetPending && current == TaskStatus.PENDING)) {
                requeue(module, id, doc, current);
            } else {
                submit(module, doc, id);
            }
            submitted.add(id);
        }
        return submitted;
    }

    /**
     * Replace the task's record with a fresh PENDING one, which also moves it to the back of the queue
     */
    private void requeue(String module, String id, String doc, TaskStatus current) {
        logger.debug("Requeueing task {}/{} from {}", module, id, current);
        write(module, TaskStatus.PENDING, id, doc);
        clearExcept(module, id, TaskStatus.PENDING);
        metrics.recordRequeued(module);
    }

    @Override
    public Map<TaskStatus, Long> statistics(String module) {
        checkModule(module);
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : CONTAINERS.keySet()) {
            counts.put(status, (long) list(container(module, status)).size());
        }
        return counts;
    }

    private void storeOutcome(String module, String id, TaskStatus target, String text) {
        TaskStatus current = status(module, id);
        if (!current.acceptsOutcome()) {
            throw new InvalidTransitionException(module, id, current);
        }
        // write first so a crash never leaves the task without a record
        write(module, target, id, text);
        clearExcept(module, id, target);
        logger.debug("Task {}/{} moved from {} to {}", module, id, current, target);
    }

    private void clearExcept(String module, String id, TaskStatus keep) {
        for (TaskStatus status : CONTAINERS.keySet()) {
            if (status == keep) {
                continue;
            }
            try {
                Files.deleteIfExists(path(module, status, id));
            } catch (IOException e) {
                logger.error("Failed to clear {} record of task {}/{}", status, module, id, e);
                throw new StorageException("Failed to clear " + status + " record of task " + module + "/" + id, e);
            }
        }
    }

    /**
     * Pending ids, oldest first; ties are broken by id so a single process always picks the same one
     */
    private List<String> pendingByAge(Path pending) {
        List<PendingEntry> entries = new ArrayList<>();
        for (Path file : list(pending)) {
            try {
                entries.add(new PendingEntry(file.getFileName().toString(),
                    Files.getLastModifiedTime(file).toMillis()));
            } catch (NoSuchFileException e) {
                logger.trace("Pending task {} claimed while listing", file.getFileName());
            } catch (IOException e) {
                throw new StorageException("Failed to inspect pending task " + file, e);
            }
        }
        return entries.stream()
            .sorted(Comparator.comparingLong(PendingEntry::getModified).thenComparing(PendingEntry::getId))
            .map(PendingEntry::getId)
            .collect(Collectors.toList());
    }

    private List<Path> list(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(file -> !file.getFileName().toString().startsWith("."))
                .collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            logger.error("Failed to list {}", dir, e);
            throw new StorageException("Failed to list " + dir, e);
        }
    }

    /**
     * Write a record through a temporary file so readers never see partial content
     */
    private void write(String module, TaskStatus status, String id, String text) {
        prepare(module);
        Path target = path(module, status, id);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(root.resolve(module), ".", ".part");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            logger.error("Failed to write {} record of task {}/{}", status, module, id, e);
            throw new StorageException("Failed to write " + status + " record of task " + module + "/" + id, e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}", tmp, e);
        }
    }

    private String read(String module, TaskStatus status, String id) throws IOException {
        return Files.readString(path(module, status, id), StandardCharsets.UTF_8);
    }

    private void prepare(String module) {
        if (preparedModules.contains(module)) {
            return;
        }
        try {
            for (TaskStatus status : CONTAINERS.keySet()) {
                Files.createDirectories(container(module, status));
            }
        } catch (IOException e) {
            logger.error("Failed to create directories for module {}", module, e);
            throw new StorageException("Failed to create directories for module " + module, e);
        }
        preparedModules.add(module);
    }

    private Path container(String module, TaskStatus status) {
        return root.resolve(module).resolve(CONTAINERS.get(status));
    }

    private Path path(String module, TaskStatus status, String id) {
        return container(module, status).resolve(id);
    }

    private static void checkModule(String module) {
        TaskIds.requireSafeName(module, "module name");
    }

    private static String checkId(String id) {
        return TaskIds.requireSafeName(id, "task id");
    }

    private static final class PendingEntry {
        private final String id;
        private final long modified;

        PendingEntry(String id, long modified) {
            this.id = id;
            this.modified = modified;
        }

        String getId() { return id; }
        long getModified() { return modified; }
    }
}
