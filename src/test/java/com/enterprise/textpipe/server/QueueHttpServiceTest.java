package com.enterprise.textpipe.server;

import com.enterprise.textpipe.core.TaskIds;
import com.enterprise.textpipe.core.TaskStatus;
import com.enterprise.textpipe.fs.FileSystemTaskQueue;
import com.enterprise.textpipe.module.ModuleRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Routing and status mapping of the queue service, without a socket in between
 */
class QueueHttpServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FileSystemTaskQueue queue;
    private QueueHttpService service;

    @BeforeEach
    void setUp() {
        queue = new FileSystemTaskQueue(tempDir);
        service = new QueueHttpService(queue, ModuleRegistry.defaults());
    }

    @Test
    void testSubmit() {
        QueueHttpResponse response = handle("POST", "/modules/echo/", Map.of(), null, "hello");

        String id = TaskIds.identity("hello");
        assertEquals(202, response.getStatus());
        assertEquals(id, response.header("ID"));
        assertEquals("/modules/echo/" + id, response.header("Location"));
        assertEquals(TaskStatus.PENDING, queue.status("echo", id));
    }

    @Test
    void testSubmitWithExplicitId() {
        QueueHttpResponse response = handle("POST", "/modules/echo/", Map.of("id", "doc-1"), null, "hello");

        assertEquals("doc-1", response.header("ID"));
        assertEquals(TaskStatus.PENDING, queue.status("echo", "doc-1"));
    }

    @Test
    void testSubmitToUnknownModule() {
        QueueHttpResponse response = handle("POST", "/modules/parse/", Map.of(), null, "hello");

        assertEquals(404, response.getStatus());
        assertEquals("UnknownModule", response.header("Error"));
        assertEquals(0L, queue.statistics("parse").get(TaskStatus.PENDING));
    }

    @Test
    void testSubmitWithUnsafeId() {
        QueueHttpResponse response = handle("POST", "/modules/echo/", Map.of("id", "..x"), null, "hello");

        assertEquals(400, response.getStatus());
    }

    @Test
    void testStatusCodes() {
        String id = queue.submit("echo", "hello");

        QueueHttpResponse pending = handle("HEAD", "/modules/echo/" + id, Map.of(), null, null);
        QueueHttpResponse unknown = handle("HEAD", "/modules/echo/missing", Map.of(), null, null);

        assertEquals(202, pending.getStatus());
        assertEquals("PENDING", pending.header("Status"));
        assertEquals(404, unknown.getStatus());
        assertEquals("UNKNOWN", unknown.header("Status"));

        queue.claim("echo");
        queue.storeError("echo", id, "boom");
        QueueHttpResponse error = handle("HEAD", "/modules/echo/" + id, Map.of(), null, null);
        assertEquals(500, error.getStatus());
        assertEquals("ERROR", error.header("Status"));
    }

    @Test
    void testClaimAndStore() {
        String id = queue.submit("echo", "hello");

        QueueHttpResponse claimed = handle("GET", "/modules/echo/", Map.of(), null, null);
        assertEquals(200, claimed.getStatus());
        assertEquals(id, claimed.header("ID"));
        assertEquals("hello", claimed.getBody());

        QueueHttpResponse stored = handle("PUT", "/modules/echo/" + id, Map.of(), "text/plain", "HELLO");
        assertEquals(204, stored.getStatus());

        QueueHttpResponse result = handle("GET", "/modules/echo/" + id, Map.of(), null, null);
        assertEquals(200, result.getStatus());
        assertEquals("HELLO", result.getBody());
    }

    @Test
    void testClaimOnEmptyQueue() {
        QueueHttpResponse response = handle("GET", "/modules/echo/", Map.of(), null, null);

        assertEquals(404, response.getStatus());
        assertNull(response.header("Error"));
        assertTrue(response.getBody().contains("Queue echo empty!"));
    }

    @Test
    void testStoreErrorByContentType() throws Exception {
        String id = queue.submit("echo", "hello");
        queue.claim("echo");

        handle("PUT", "/modules/echo/" + id, Map.of(), "application/prs.error+text; charset=utf-8", "boom");

        assertEquals(TaskStatus.ERROR, queue.status("echo", id));
        QueueHttpResponse result = handle("GET", "/modules/echo/" + id, Map.of(), null, null);
        assertEquals(500, result.getStatus());
        JsonNode descriptor = objectMapper.readTree(result.getBody());
        assertEquals("ProcessingFailed", descriptor.get("exception_class").asText());
        assertEquals("boom", descriptor.get("message").asText());
        assertEquals("ERROR", descriptor.get("status").asText());
    }

    @Test
    void testStoreOnPendingTaskConflicts() {
        String id = queue.submit("echo", "hello");

        QueueHttpResponse response = handle("PUT", "/modules/echo/" + id, Map.of(), "text/plain", "HELLO");

        assertEquals(409, response.getStatus());
        assertEquals(TaskStatus.PENDING, queue.status("echo", id));
    }

    @Test
    void testResultOfUnknownAndPendingTasks() throws Exception {
        String id = queue.submit("echo", "hello");

        QueueHttpResponse unknown = handle("GET", "/modules/echo/missing", Map.of(), null, null);
        QueueHttpResponse pending = handle("GET", "/modules/echo/" + id, Map.of(), null, null);

        assertEquals(404, unknown.getStatus());
        assertEquals("Error: Unknown document: echo/missing\n", unknown.getBody());
        assertEquals(500, pending.getStatus());
        assertEquals("PENDING", objectMapper.readTree(pending.getBody()).get("status").asText());
    }

    @Test
    void testResultWithUnsupportedFormat() {
        String id = queue.submit("echo", "hello");
        queue.claim("echo");
        queue.storeResult("echo", id, "hello");

        QueueHttpResponse response = handle("GET", "/modules/echo/" + id, Map.of("format", "json"), null, null);

        assertEquals(400, response.getStatus());
    }

    @Test
    void testBulkProcessWithFlags() throws Exception {
        String id = queue.submit("echo", "hello");
        queue.claim("echo");
        queue.storeError("echo", id, "boom");

        QueueHttpResponse plain = handle("POST", "/modules/echo/bulk/process", Map.of(), "application/json",
            "[\"hello\",\"world\"]");
        assertEquals(200, plain.getStatus());
        JsonNode ids = objectMapper.readTree(plain.getBody());
        assertEquals(id, ids.get(0).asText());
        assertEquals(TaskIds.identity("world"), ids.get(1).asText());
        assertEquals(TaskStatus.ERROR, queue.status("echo", id));

        handle("POST", "/modules/echo/bulk/process", Map.of("reset_error", "True"), "application/json",
            "[\"hello\"]");
        assertEquals(TaskStatus.PENDING, queue.status("echo", id));
    }

    @Test
    void testBulkProcessFlagValues() {
        String id = queue.submit("echo", "hello");
        queue.claim("echo");
        queue.storeError("echo", id, "boom");

        handle("POST", "/modules/echo/bulk/process", Map.of("reset_error", "yes"), "application/json", "[\"hello\"]");
        assertEquals(TaskStatus.ERROR, queue.status("echo", id));

        handle("POST", "/modules/echo/bulk/process", Map.of("reset_error", "Y"), "application/json", "[\"hello\"]");
        assertEquals(TaskStatus.PENDING, queue.status("echo", id));
    }

    @Test
    void testBulkProcessWithIdMap() throws Exception {
        QueueHttpResponse response = handle("POST", "/modules/echo/bulk/process", Map.of(), "application/json",
            "{\"a\":\"first\",\"b\":\"second\"}");

        assertEquals("[\"a\",\"b\"]", response.getBody());
        assertEquals("second", queue.claimMany("echo", 2)
            .filter(task -> task.getId().equals("b")).findFirst().get().getDocument());
    }

    @Test
    void testBulkRequestsRejectBadBodies() {
        assertEquals(400, handle("POST", "/modules/echo/bulk/process", Map.of(), null, "[]").getStatus());
        assertEquals(400, handle("POST", "/modules/echo/bulk/process", Map.of(), null, "\"doc\"").getStatus());
        assertEquals(400, handle("POST", "/modules/echo/bulk/status", Map.of(), null, "{bad json").getStatus());
        assertEquals(400, handle("POST", "/modules/echo/bulk/result", Map.of(), null, "{\"a\":\"b\"}").getStatus());
        assertEquals(400, handle("POST", "/modules/echo/bulk/status", Map.of(), null, "").getStatus());
    }

    @Test
    void testBulkRequestsRejectNonTextElements() {
        assertEquals(400, handle("POST", "/modules/echo/bulk/process", Map.of(), null, "[{\"a\":1}]").getStatus());
        assertEquals(400, handle("POST", "/modules/echo/bulk/process", Map.of(), null, "[\"ok\", 42]").getStatus());
        assertEquals(400, handle("POST", "/modules/echo/bulk/process", Map.of(), null, "{\"a\":[\"doc\"]}").getStatus());
        assertEquals(400, handle("POST", "/modules/echo/bulk/status", Map.of(), null, "[[\"a\"]]").getStatus());
        assertEquals(400, handle("POST", "/modules/echo/bulk/result", Map.of(), null, "[null]").getStatus());
        assertEquals(0L, queue.statistics("echo").get(TaskStatus.PENDING));
    }

    @Test
    void testBulkStatusAndResult() throws Exception {
        String done = queue.submit("echo", "done");
        queue.claim("echo");
        queue.storeResult("echo", done, "DONE");

        JsonNode statuses = objectMapper.readTree(handle("POST", "/modules/echo/bulk/status", Map.of(), null,
            "[\"" + done + "\",\"missing\"]").getBody());
        JsonNode results = objectMapper.readTree(handle("POST", "/modules/echo/bulk/result", Map.of(), null,
            "[\"" + done + "\",\"missing\"]").getBody());

        assertEquals("DONE", statuses.get(done).asText());
        assertEquals("UNKNOWN", statuses.get("missing").asText());
        assertEquals("DONE", results.get(done).asText());
        assertEquals("NotFound", results.get("missing").get("exception_class").asText());
    }

    @Test
    void testStatistics() throws Exception {
        queue.bulkSubmit("echo", List.of("a", "b"));
        queue.claim("echo");

        QueueHttpResponse response = handle("GET", "/modules/echo/bulk/statistics", Map.of(), null, null);

        JsonNode stats = objectMapper.readTree(response.getBody());
        assertEquals(200, response.getStatus());
        assertEquals(1, stats.get("PENDING").asInt());
        assertEquals(1, stats.get("STARTED").asInt());
        assertEquals(0, stats.get("DONE").asInt());
    }

    @Test
    void testUnroutablePaths() {
        assertEquals(404, handle("GET", "/other", Map.of(), null, null).getStatus());
        assertEquals(404, handle("POST", "/modules/echo/bulk/unknown", Map.of(), null, "[]").getStatus());
        assertEquals(405, handle("DELETE", "/modules/echo/abc", Map.of(), null, null).getStatus());
        assertEquals(405, handle("PUT", "/modules/echo/", Map.of(), null, "x").getStatus());
    }

    private QueueHttpResponse handle(String method, String path, Map<String, String> query,
                                     String contentType, String body) {
        return service.handle(new QueueHttpRequest(method, path, query, contentType, body));
    }
}
