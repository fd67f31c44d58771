package com.enterprise.textpipe.server;

import com.enterprise.textpipe.core.ClaimedTask;
import com.enterprise.textpipe.core.TaskOutcome;
import com.enterprise.textpipe.core.TaskQueue;
import com.enterprise.textpipe.core.TaskStatus;
import com.enterprise.textpipe.exception.InvalidTransitionException;
import com.enterprise.textpipe.exception.UnknownModuleException;
import com.enterprise.textpipe.module.ModuleRegistry;
import com.enterprise.textpipe.remote.QueueProtocol;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Queue service protocol on top of any {@link TaskQueue}, independent of the HTTP server that carries it.
 * <pre>
 * POST /modules/{module}/             submit (202, ID and Location headers; ?id= for an explicit id)
 * GET  /modules/{module}/             claim (200 with document, 404 when the queue is empty)
 * HEAD /modules/{module}/{id}         status (code per status, Status header)
 * GET  /modules/{module}/{id}         result (?format=; 500 with a JSON descriptor when not DONE)
 * PUT  /modules/{module}/{id}         store result, or error with Content-Type application/prs.error+text
 * POST /modules/{module}/bulk/status  JSON list of ids to JSON map of statuses
 * POST /modules/{module}/bulk/result  JSON list of ids to JSON map of results
 * POST /modules/{module}/bulk/process JSON list of docs or map of id to doc; ?reset_error, ?reset_pending
 * GET  /modules/{module}/bulk/statistics
 * </pre>
 */
public class QueueHttpService {

    private static final Logger logger = LoggerFactory.getLogger(QueueHttpService.class);

    private final TaskQueue queue;
    private final ModuleRegistry registry;
    private final ObjectMapper objectMapper;

    public QueueHttpService(TaskQueue queue, ModuleRegistry registry) {
        this(queue, registry, new ObjectMapper());
    }

    public QueueHttpService(TaskQueue queue, ModuleRegistry registry, ObjectMapper objectMapper) {
        this.queue = queue;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    public QueueHttpResponse handle(QueueHttpRequest request) {
        try {
            return dispatch(request);
        } catch (BadRequestException e) {
            return QueueHttpResponse.of(QueueProtocol.BAD_REQUEST, "Error: " + e.getMessage() + "\n");
        } catch (UnknownModuleException e) {
            return QueueHttpResponse.of(QueueProtocol.NOT_FOUND, e.getMessage() + "\n")
                .withHeader(QueueProtocol.HEADER_ERROR, QueueProtocol.ERROR_UNKNOWN_MODULE);
        } catch (InvalidTransitionException e) {
            return QueueHttpResponse.of(QueueProtocol.CONFLICT, e.getMessage() + "\n");
        } catch (IllegalArgumentException e) {
            return QueueHttpResponse.of(QueueProtocol.BAD_REQUEST, "Error: " + e.getMessage() + "\n");
        } catch (RuntimeException e) {
            logger.error("Request {} {} failed", request.getMethod(), request.getPath(), e);
            return QueueHttpResponse.of(QueueProtocol.FAILED, "Internal error: " + e.getMessage() + "\n");
        }
    }

    private QueueHttpResponse dispatch(QueueHttpRequest request) {
        String path = request.getPath();
        if (!path.startsWith(QueueProtocol.MODULES)) {
            return notFound(path);
        }
        String[] segments = path.substring(QueueProtocol.MODULES.length()).split("/", -1);
        String method = request.getMethod().toUpperCase(Locale.ROOT);
        if (segments.length == 2 && !segments[0].isEmpty()) {
            String module = segments[0];
            String id = segments[1];
            if (id.isEmpty()) {
                switch (method) {
                    case "POST": return submit(module, request);
                    case "GET": return claim(module);
                    default: return notAllowed(method, path);
                }
            }
            switch (method) {
                case "HEAD": return status(module, id);
                case "GET": return result(module, id, request.param(QueueProtocol.PARAM_FORMAT));
                case "PUT": return store(module, id, request);
                default: return notAllowed(method, path);
            }
        }
        if (segments.length == 3 && !segments[0].isEmpty() && "bulk".equals(segments[1])) {
            String module = segments[0];
            String endpoint = "bulk/" + segments[2];
            if ("GET".equals(method) && QueueProtocol.BULK_STATISTICS.equals(endpoint)) {
                return statistics(module);
            }
            if (!"POST".equals(method)) {
                return notAllowed(method, path);
            }
            switch (endpoint) {
                case QueueProtocol.BULK_STATUS: return bulkStatus(module, request);
                case QueueProtocol.BULK_RESULT: return bulkResult(module, request);
                case QueueProtocol.BULK_PROCESS: return bulkProcess(module, request);
                default: return notFound(path);
            }
        }
        return notFound(path);
    }

    private QueueHttpResponse submit(String module, QueueHttpRequest request) {
        registry.get(module);
        String id = queue.submit(module, request.getBody(), request.param(QueueProtocol.PARAM_ID));
        return QueueHttpResponse.of(QueueProtocol.SUBMITTED, id + "\n")
            .withHeader(QueueProtocol.HEADER_LOCATION, QueueProtocol.taskPath(module, id))
            .withHeader(QueueProtocol.HEADER_ID, id);
    }

    private QueueHttpResponse claim(String module) {
        Optional<ClaimedTask> task = queue.claim(module);
        if (task.isEmpty()) {
            return QueueHttpResponse.of(QueueProtocol.NOT_FOUND, "Queue " + module + " empty!\n");
        }
        String id = task.get().getId();
        return QueueHttpResponse.of(QueueProtocol.OK, task.get().getDocument())
            .withHeader(QueueProtocol.HEADER_CONTENT_TYPE, QueueProtocol.TEXT_MIME)
            .withHeader(QueueProtocol.HEADER_LOCATION, QueueProtocol.taskPath(module, id))
            .withHeader(QueueProtocol.HEADER_ID, id);
    }

    private QueueHttpResponse status(String module, String id) {
        TaskStatus status = queue.status(module, id);
        return QueueHttpResponse.empty(status.getHttpStatus())
            .withHeader(QueueProtocol.HEADER_STATUS, status.name());
    }

    private QueueHttpResponse result(String module, String id, String format) {
        TaskOutcome outcome = queue.lookupResult(module, id, format);
        switch (outcome.getKind()) {
            case READY:
                return QueueHttpResponse.of(QueueProtocol.OK, outcome.getResult())
                    .withHeader(QueueProtocol.HEADER_CONTENT_TYPE, QueueProtocol.TEXT_MIME);
            case NOT_FOUND:
                return QueueHttpResponse.of(QueueProtocol.NOT_FOUND,
                    "Error: Unknown document: " + module + "/" + id + "\n");
            default:
                return QueueHttpResponse.of(QueueProtocol.FAILED, json(descriptor(outcome)))
                    .withHeader(QueueProtocol.HEADER_CONTENT_TYPE, QueueProtocol.JSON_MIME);
        }
    }

    private QueueHttpResponse store(String module, String id, QueueHttpRequest request) {
        if (isErrorPayload(request.getContentType())) {
            queue.storeError(module, id, request.getBody());
        } else {
            queue.storeResult(module, id, request.getBody());
        }
        return QueueHttpResponse.empty(QueueProtocol.STORED);
    }

    private QueueHttpResponse statistics(String module) {
        Map<String, Long> counts = new LinkedHashMap<>();
        queue.statistics(module).forEach((status, count) -> counts.put(status.name(), count));
        return jsonResponse(counts);
    }

    private QueueHttpResponse bulkStatus(String module, QueueHttpRequest request) {
        List<String> ids = readIds(request, "Please provide bulk IDs as a json list");
        Map<String, String> statuses = new LinkedHashMap<>();
        queue.bulkStatus(module, ids).forEach((id, status) -> statuses.put(id, status.name()));
        return jsonResponse(statuses);
    }

    private QueueHttpResponse bulkResult(String module, QueueHttpRequest request) {
        List<String> ids = readIds(request, "Please provide bulk IDs as a json list");
        ObjectNode results = objectMapper.createObjectNode();
        queue.bulkResult(module, ids, request.param(QueueProtocol.PARAM_FORMAT)).forEach((id, outcome) -> {
            if (outcome.isReady()) {
                results.put(id, outcome.getResult());
            } else {
                results.set(id, descriptor(outcome));
            }
        });
        return jsonResponse(results);
    }

    private QueueHttpResponse bulkProcess(String module, QueueHttpRequest request) {
        registry.get(module);
        boolean resetError = QueueProtocol.isFlagSet(request.param(QueueProtocol.PARAM_RESET_ERROR));
        boolean resetPending = QueueProtocol.isFlagSet(request.param(QueueProtocol.PARAM_RESET_PENDING));
        String usage = "Please provide bulk docs as a json list or {id: doc} dict";
        JsonNode root = readBody(request, usage);
        List<String> docs = new ArrayList<>();
        List<String> ids = null;
        if (root.isArray()) {
            root.forEach(doc -> docs.add(text(doc, usage)));
        } else if (root.isObject()) {
            ids = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                ids.add(field.getKey());
                docs.add(text(field.getValue(), usage));
            }
        } else {
            throw new BadRequestException(usage);
        }
        List<String> submitted = queue.bulkSubmit(module, docs, ids, resetError, resetPending);
        logger.debug("Bulk submitted {} documents to {}", submitted.size(), module);
        return jsonResponse(submitted);
    }

    private ObjectNode descriptor(TaskOutcome outcome) {
        ObjectNode node = objectMapper.createObjectNode();
        switch (outcome.getKind()) {
            case FAILED:
                node.put(QueueProtocol.FIELD_EXCEPTION_CLASS, "ProcessingFailed");
                node.put(QueueProtocol.FIELD_MESSAGE, outcome.getError());
                break;
            case NOT_FOUND:
                node.put(QueueProtocol.FIELD_EXCEPTION_CLASS, "NotFound");
                node.put(QueueProtocol.FIELD_MESSAGE, "Unknown document: " + outcome.getTaskId());
                break;
            default:
                node.put(QueueProtocol.FIELD_EXCEPTION_CLASS, "NotReady");
                node.put(QueueProtocol.FIELD_MESSAGE, "Status of " + outcome.getTaskId() + " is " + outcome.getStatus());
                break;
        }
        node.put(QueueProtocol.FIELD_STATUS, outcome.getStatus().name());
        return node;
    }

    private List<String> readIds(QueueHttpRequest request, String usage) {
        JsonNode root = readBody(request, usage);
        if (!root.isArray()) {
            throw new BadRequestException(usage);
        }
        List<String> ids = new ArrayList<>();
        root.forEach(id -> ids.add(text(id, usage)));
        return ids;
    }

    private static String text(JsonNode node, String usage) {
        if (!node.isTextual()) {
            throw new BadRequestException(usage);
        }
        return node.asText();
    }

    private JsonNode readBody(QueueHttpRequest request, String usage) {
        JsonNode root;
        try {
            root = objectMapper.readTree(request.getBody());
        } catch (JsonProcessingException e) {
            logger.warn("Malformed bulk request: {}", abbreviate(request.getBody()));
            throw new BadRequestException(usage);
        }
        if (root == null || root.isEmpty()) {
            throw new BadRequestException(usage);
        }
        return root;
    }

    private QueueHttpResponse jsonResponse(Object value) {
        return QueueHttpResponse.of(QueueProtocol.OK, json(value))
            .withHeader(QueueProtocol.HEADER_CONTENT_TYPE, QueueProtocol.JSON_MIME);
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render response", e);
        }
    }

    private static boolean isErrorPayload(String contentType) {
        if (contentType == null) {
            return false;
        }
        String mime = contentType.split(";", 2)[0].trim();
        return QueueProtocol.ERROR_MIME.equalsIgnoreCase(mime);
    }

    private static QueueHttpResponse notFound(String path) {
        return QueueHttpResponse.of(QueueProtocol.NOT_FOUND, "Not found: " + path + "\n");
    }

    private static QueueHttpResponse notAllowed(String method, String path) {
        return QueueHttpResponse.of(405, "Method " + method + " not allowed on " + path + "\n");
    }

    private static String abbreviate(String body) {
        return body.length() <= 20 ? body : body.substring(0, 20) + "...";
    }

    private static final class BadRequestException extends RuntimeException {
        BadRequestException(String message) {
            super(message);
        }
    }
}
