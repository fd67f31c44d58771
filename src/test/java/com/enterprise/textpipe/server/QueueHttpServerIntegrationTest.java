package com.enterprise.textpipe.server;

import com.enterprise.textpipe.config.TextPipeConfig;
import com.enterprise.textpipe.core.ClaimedTask;
import com.enterprise.textpipe.core.TaskIds;
import com.enterprise.textpipe.core.TaskOutcome;
import com.enterprise.textpipe.core.TaskStatus;
import com.enterprise.textpipe.exception.InvalidTransitionException;
import com.enterprise.textpipe.exception.ProcessingFailedException;
import com.enterprise.textpipe.exception.TaskNotFoundException;
import com.enterprise.textpipe.exception.UnknownModuleException;
import com.enterprise.textpipe.fs.FileSystemTaskQueue;
import com.enterprise.textpipe.module.ModuleRegistry;
import com.enterprise.textpipe.module.TokenizeModule;
import com.enterprise.textpipe.monitoring.QueueMetrics;
import com.enterprise.textpipe.remote.RemoteTaskQueue;
import com.enterprise.textpipe.worker.QueueWorker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Remote client against a live queue service backed by a directory queue
 */
class QueueHttpServerIntegrationTest {

    @TempDir
    Path tempDir;

    private FileSystemTaskQueue storage;
    private QueueHttpServer server;
    private RemoteTaskQueue remote;

    @BeforeEach
    void setUp() {
        storage = new FileSystemTaskQueue(tempDir);
        server = new QueueHttpServer(new QueueHttpService(storage, ModuleRegistry.defaults()), "localhost", 0, 4);
        server.start();
        remote = new RemoteTaskQueue(server.getBaseUrl(), Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void testServerBindsEphemeralPort() {
        assertTrue(server.isRunning());
        assertTrue(server.getPort() > 0);
    }

    @Test
    void testLifecycleOverHttp() {
        String id = remote.submit("echo", "hello");
        assertEquals(TaskIds.identity("hello"), id);
        assertEquals(TaskStatus.PENDING, remote.status("echo", id));

        Optional<ClaimedTask> task = remote.claim("echo");
        assertTrue(task.isPresent());
        assertEquals(id, task.get().getId());
        assertEquals("hello", task.get().getDocument());
        assertEquals(TaskStatus.STARTED, remote.status("echo", id));

        remote.storeResult("echo", id, "HELLO");

        assertEquals(TaskStatus.DONE, remote.status("echo", id));
        assertEquals("HELLO", remote.result("echo", id));
        assertEquals("HELLO", storage.result("echo", id));
        assertTrue(remote.claim("echo").isEmpty());
    }

    @Test
    void testNonAsciiDocumentsSurviveTheWire() {
        String doc = "Één zin met ümlauts en 日本語.";
        String id = remote.submit("echo", doc);

        assertEquals(TaskIds.identity(doc), id);
        assertEquals(doc, remote.claim("echo").get().getDocument());
    }

    @Test
    void testErrorsOverHttp() {
        String id = remote.submit("echo", "hello");
        remote.claim("echo");
        remote.storeError("echo", id, "boom");

        assertEquals(TaskStatus.ERROR, remote.status("echo", id));
        ProcessingFailedException e = assertThrows(ProcessingFailedException.class, () -> remote.result("echo", id));
        assertEquals("boom", e.getErrorText());
    }

    @Test
    void testUnknownTaskAndModule() {
        assertEquals(TaskStatus.UNKNOWN, remote.status("echo", "missing"));
        assertThrows(TaskNotFoundException.class, () -> remote.result("echo", "missing"));
        assertThrows(UnknownModuleException.class, () -> remote.submit("parse", "hello"));
        assertThrows(UnknownModuleException.class, () -> remote.bulkSubmit("parse", List.of("hello")));
    }

    @Test
    void testStoreOnPendingTaskRejected() {
        String id = remote.submit("echo", "hello");

        assertThrows(InvalidTransitionException.class, () -> remote.storeResult("echo", id, "HELLO"));
    }

    @Test
    void testBulkOperationsOverHttp() {
        List<String> ids = remote.bulkSubmit("echo", List.of("a", "b", "c"));
        ClaimedTask first = remote.claim("echo").get();
        remote.storeResult("echo", first.getId(), first.getDocument().toUpperCase());

        Map<String, TaskStatus> statuses = remote.bulkStatus("echo", ids);
        Map<String, TaskOutcome> results = remote.bulkResult("echo", ids, null);

        assertEquals(ids, List.copyOf(statuses.keySet()));
        assertEquals(TaskStatus.DONE, statuses.get(first.getId()));
        assertEquals(first.getDocument().toUpperCase(), results.get(first.getId()).getResult());
        assertEquals(2, results.values().stream().filter(outcome -> !outcome.isReady()).count());
        assertEquals(2L, remote.statistics("echo").get(TaskStatus.PENDING));
        assertEquals(1L, remote.statistics("echo").get(TaskStatus.DONE));
    }

    @Test
    void testBulkSubmitWithIdsAndResetOverHttp() {
        remote.bulkSubmit("echo", List.of("first", "second"), List.of("a", "b"), false, false);
        remote.claimMany("echo", 2).forEach(task -> remote.storeError("echo", task.getId(), "boom"));

        remote.bulkSubmit("echo", List.of("first"), List.of("a"), true, false);

        assertEquals(TaskStatus.PENDING, remote.status("echo", "a"));
        assertEquals(TaskStatus.ERROR, remote.status("echo", "b"));
        assertEquals("first", remote.claim("echo").get().getDocument());
    }

    @Test
    void testFormatForUnregisteredModuleFailsLikeLocalQueue() {
        String id = storage.submit("custom", "hello");
        storage.claim("custom");
        storage.storeResult("custom", id, "HELLO");

        assertThrows(UnknownModuleException.class, () -> storage.lookupResult("custom", id, "csv"));
        UnknownModuleException e = assertThrows(UnknownModuleException.class,
            () -> remote.lookupResult("custom", id, "csv"));
        assertEquals("custom", e.getModule());
        assertEquals(TaskStatus.DONE, remote.status("custom", id));
        assertEquals("HELLO", remote.result("custom", id));
    }

    @Test
    void testResetPendingOverHttp() throws Exception {
        String id = remote.submit("echo", "waiting");
        Path pending = tempDir.resolve("echo").resolve("queue").resolve(id);
        Files.setLastModifiedTime(pending, FileTime.fromMillis(1000));

        remote.bulkSubmit("echo", List.of("waiting"), null, false, true);

        assertEquals(TaskStatus.PENDING, remote.status("echo", id));
        assertTrue(Files.getLastModifiedTime(pending).toMillis() > 1000);
    }

    @Test
    void testFormatConversionOverHttp() throws Exception {
        String id = remote.submit("tokenize", "Hello world.");
        ClaimedTask task = remote.claim("tokenize").get();
        remote.storeResult("tokenize", id, new TokenizeModule().process(task.getDocument()));

        JsonNode rows = new ObjectMapper().readTree(remote.result("tokenize", id, "json"));

        assertEquals("Hello", rows.get(0).get("word").asText());
        assertThrows(IllegalArgumentException.class, () -> storage.result("tokenize", id, "xml"));
    }

    @Test
    @Timeout(30)
    void testInlineProcessingWithRemoteWorker() {
        QueueWorker worker = new QueueWorker(new RemoteTaskQueue(server.getBaseUrl()), new TokenizeModule(),
            new TextPipeConfig.WorkerConfig(1, Duration.ofMillis(20), 10, Duration.ofSeconds(5)),
            QueueMetrics.inMemory());
        worker.start();
        try {
            String result = remote.processInline("tokenize", "One. Two.", Duration.ofMillis(20), Duration.ofSeconds(20));

            assertEquals("sentence,offset,word\n1,0,One\n2,3,Two\n", result);
        } finally {
            worker.stop();
        }
    }

    @Test
    void testParseQuery() {
        Map<String, String> params = QueueHttpServer.parseQuery("id=a%2Fb&format=json&flag&id=second");

        assertEquals("a/b", params.get("id"));
        assertEquals("json", params.get("format"));
        assertEquals("", params.get("flag"));
        assertTrue(QueueHttpServer.parseQuery(null).isEmpty());
    }
}
