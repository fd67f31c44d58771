package com.enterprise.textpipe.remote;

import com.enterprise.textpipe.core.AbstractTaskQueue;
import com.enterprise.textpipe.core.ClaimedTask;
import com.enterprise.textpipe.core.TaskIds;
import com.enterprise.textpipe.core.TaskOutcome;
import com.enterprise.textpipe.core.TaskStatus;
import com.enterprise.textpipe.exception.InvalidTransitionException;
import com.enterprise.textpipe.exception.RemoteQueueException;
import com.enterprise.textpipe.exception.TextPipeException;
import com.enterprise.textpipe.exception.UnknownModuleException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task queue client for a remote queue service.
 * <p>
 * Every operation is one synchronous HTTP round trip; nothing is retried. Unexpected status codes surface
 * as {@link RemoteQueueException} carrying the code and the response body.
 */
public class RemoteTaskQueue extends AbstractTaskQueue {

    private static final Logger logger = LoggerFactory.getLogger(RemoteTaskQueue.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RemoteTaskQueue(String baseUrl) {
        this(baseUrl, DEFAULT_TIMEOUT);
    }

    public RemoteTaskQueue(String baseUrl, Duration timeout) {
        this(baseUrl, timeout, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(timeout)
            .build(), new ObjectMapper());
    }

    public RemoteTaskQueue(String baseUrl, Duration timeout, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        logger.debug("Connecting to queue service at {}", this.baseUrl);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public String submit(String module, String doc, String id) {
        checkModule(module);
        String query = id == null ? "" : "?" + QueueProtocol.PARAM_ID + "=" + encode(checkId(id));
        HttpRequest request = request(QueueProtocol.modulePath(module) + query)
            .header(QueueProtocol.HEADER_CONTENT_TYPE, QueueProtocol.TEXT_MIME)
            .POST(HttpRequest.BodyPublishers.ofString(doc, StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != QueueProtocol.SUBMITTED) {
            throw unexpected("processing doc with " + module, response);
        }
        String taskId = response.headers().firstValue(QueueProtocol.HEADER_ID)
            .orElseThrow(() -> unexpected("processing doc with " + module + " (no ID header)", response));
        logger.debug("Task {}/{} submitted", module, taskId);
        return taskId;
    }

    @Override
    public TaskStatus status(String module, String id) {
        checkModule(module);
        checkId(id);
        HttpRequest request = request(QueueProtocol.taskPath(module, id))
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<String> response = send(request);
        Optional<String> status = response.headers().firstValue(QueueProtocol.HEADER_STATUS);
        if (status.isEmpty()) {
            throw unexpected("determining status for " + module + "/" + id, response);
        }
        try {
            return TaskStatus.valueOf(status.get().trim());
        } catch (IllegalArgumentException e) {
            throw unexpected("determining status for " + module + "/" + id + " (status " + status.get() + ")",
                response);
        }
    }

    @Override
    public TaskOutcome lookupResult(String module, String id, String format) {
        checkModule(module);
        checkId(id);
        String query = format == null ? "" : "?" + QueueProtocol.PARAM_FORMAT + "=" + encode(format);
        HttpRequest request = request(QueueProtocol.taskPath(module, id) + query).GET().build();
        HttpResponse<String> response = send(request);
        switch (response.statusCode()) {
            case QueueProtocol.OK:
                return TaskOutcome.ready(id, response.body());
            case QueueProtocol.NOT_FOUND:
                if (isUnknownModule(response)) {
                    throw unexpected("getting result for " + module + "/" + id, response);
                }
                return TaskOutcome.notFound(id);
            case QueueProtocol.FAILED:
                return outcomeFromDescriptor(id, parseDescriptor(module, id, response));
            default:
                throw unexpected("getting result for " + module + "/" + id, response);
        }
    }

    @Override
    public Optional<ClaimedTask> claim(String module) {
        checkModule(module);
        HttpRequest request = request(QueueProtocol.modulePath(module)).GET().build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() == QueueProtocol.NOT_FOUND) {
            return Optional.empty();
        }
        if (response.statusCode() != QueueProtocol.OK) {
            throw unexpected("getting a task for " + module, response);
        }
        String id = response.headers().firstValue(QueueProtocol.HEADER_ID)
            .orElseThrow(() -> unexpected("getting a task for " + module + " (no ID header)", response));
        logger.debug("Task {}/{} claimed", module, id);
        return Optional.of(new ClaimedTask(id, response.body()));
    }

    @Override
    public void storeResult(String module, String id, String result) {
        store(module, id, result, QueueProtocol.TEXT_MIME);
    }

    @Override
    public void storeError(String module, String id, String error) {
        store(module, id, error, QueueProtocol.ERROR_MIME);
    }

    @Override
    public Map<TaskStatus, Long> statistics(String module) {
        checkModule(module);
        HttpRequest request = request(QueueProtocol.MODULES + module + "/" + QueueProtocol.BULK_STATISTICS)
            .GET().build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != QueueProtocol.OK) {
            throw unexpected("getting statistics for " + module, response);
        }
        Map<String, Long> raw = readJson(response, new TypeReference<Map<String, Long>>() {});
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        raw.forEach((status, count) -> counts.put(TaskStatus.valueOf(status), count));
        return counts;
    }

    @Override
    public Map<String, TaskStatus> bulkStatus(String module, Collection<String> ids) {
        checkModule(module);
        if (ids.isEmpty()) {
            return new LinkedHashMap<>();
        }
        HttpResponse<String> response = postJson(module, QueueProtocol.BULK_STATUS, "", ids);
        Map<String, String> raw = readJson(response, new TypeReference<LinkedHashMap<String, String>>() {});
        Map<String, TaskStatus> statuses = new LinkedHashMap<>();
        raw.forEach((id, status) -> statuses.put(id, TaskStatus.valueOf(status)));
        return statuses;
    }

    @Override
    public Map<String, TaskOutcome> bulkResult(String module, Collection<String> ids, String format) {
        checkModule(module);
        if (ids.isEmpty()) {
            return new LinkedHashMap<>();
        }
        String query = format == null ? "" : "?" + QueueProtocol.PARAM_FORMAT + "=" + encode(format);
        HttpResponse<String> response = postJson(module, QueueProtocol.BULK_RESULT, query, ids);
        JsonNode root = readTree(response);
        Map<String, TaskOutcome> results = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            results.put(field.getKey(), value.isTextual()
                ? TaskOutcome.ready(field.getKey(), value.asText())
                : outcomeFromDescriptor(field.getKey(), value));
        }
        return results;
    }

    @Override
    public List<String> bulkSubmit(String module, List<String> docs, List<String> ids,
                                   boolean resetError, boolean resetPending) {
        checkModule(module);
        checkBulkIds(docs, ids);
        if (docs.isEmpty()) {
            return new ArrayList<>();
        }
        Object body = docs;
        if (ids != null) {
            Map<String, String> byId = new LinkedHashMap<>();
            for (int i = 0; i < docs.size(); i++) {
                byId.put(checkId(ids.get(i)), docs.get(i));
            }
            body = byId;
        }
        String query = "?" + QueueProtocol.PARAM_RESET_ERROR + "=" + (resetError ? "1" : "0")
            + "&" + QueueProtocol.PARAM_RESET_PENDING + "=" + (resetPending ? "1" : "0");
        HttpResponse<String> response = postJson(module, QueueProtocol.BULK_PROCESS, query, body);
        List<String> submitted = readJson(response, new TypeReference<List<String>>() {});
        logger.debug("Submitted {} documents to {}", submitted.size(), module);
        // explicit ids are honored verbatim; duplicates collapse in the request map
        return ids != null ? new ArrayList<>(ids) : submitted;
    }

    private void store(String module, String id, String text, String contentType) {
        checkModule(module);
        checkId(id);
        HttpRequest request = request(QueueProtocol.taskPath(module, id))
            .header(QueueProtocol.HEADER_CONTENT_TYPE, contentType)
            .PUT(HttpRequest.BodyPublishers.ofString(text, StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() == QueueProtocol.CONFLICT) {
            throw new InvalidTransitionException(response.body().trim());
        }
        if (response.statusCode() != QueueProtocol.STORED) {
            throw unexpected("storing outcome for " + module + "/" + id, response);
        }
        logger.debug("Stored {} for task {}/{}", contentType, module, id);
    }

    private HttpResponse<String> postJson(String module, String endpoint, String query, Object body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TextPipeException("Cannot serialize bulk request for " + module, e);
        }
        HttpRequest request = request(QueueProtocol.MODULES + module + "/" + endpoint + query)
            .header(QueueProtocol.HEADER_CONTENT_TYPE, QueueProtocol.JSON_MIME)
            .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != QueueProtocol.OK) {
            throw unexpected(endpoint + " for " + module, response);
        }
        return response;
    }

    private TaskOutcome outcomeFromDescriptor(String id, JsonNode descriptor) {
        String message = descriptor.path(QueueProtocol.FIELD_MESSAGE).isNull()
            ? null : descriptor.path(QueueProtocol.FIELD_MESSAGE).asText(null);
        String status = descriptor.path(QueueProtocol.FIELD_STATUS).asText(TaskStatus.ERROR.name());
        switch (TaskStatus.valueOf(status)) {
            case UNKNOWN:
                return TaskOutcome.notFound(id);
            case PENDING:
            case STARTED:
                return TaskOutcome.notReady(id, TaskStatus.valueOf(status));
            case DONE:
                return TaskOutcome.ready(id, message);
            default:
                return TaskOutcome.failed(id, message);
        }
    }

    private JsonNode parseDescriptor(String module, String id, HttpResponse<String> response) {
        try {
            JsonNode node = objectMapper.readTree(response.body());
            if (node == null || !node.isObject()) {
                throw unexpected("getting result for " + module + "/" + id, response);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw unexpected("getting result for " + module + "/" + id, response);
        }
    }

    private JsonNode readTree(HttpResponse<String> response) {
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RemoteQueueException("Malformed JSON from " + response.uri(), e);
        }
    }

    private <T> T readJson(HttpResponse<String> response, TypeReference<T> type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new RemoteQueueException("Malformed JSON from " + response.uri(), e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).timeout(timeout);
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            logger.trace("{} {} -> {}", request.method(), request.uri(), response.statusCode());
            return response;
        } catch (IOException e) {
            logger.error("Request {} {} failed", request.method(), request.uri(), e);
            throw new RemoteQueueException("Cannot reach queue service at " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextPipeException("Interrupted while calling " + request.uri(), e);
        }
    }

    private static boolean isUnknownModule(HttpResponse<String> response) {
        return response.statusCode() == QueueProtocol.NOT_FOUND
            && response.headers().firstValue(QueueProtocol.HEADER_ERROR)
                .map(QueueProtocol.ERROR_UNKNOWN_MODULE::equals).orElse(false);
    }

    private static RuntimeException unexpected(String operation, HttpResponse<String> response) {
        if (isUnknownModule(response)) {
            String path = response.uri().getPath();
            String afterModules = path.substring(path.indexOf(QueueProtocol.MODULES) + QueueProtocol.MODULES.length());
            return new UnknownModuleException(afterModules.split("/")[0]);
        }
        String body = response.body() == null ? "" : response.body();
        return new RemoteQueueException(operation, response.statusCode(), body);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static void checkModule(String module) {
        TaskIds.requireSafeName(module, "module name");
    }

    private static String checkId(String id) {
        return TaskIds.requireSafeName(id, "task id");
    }
}
