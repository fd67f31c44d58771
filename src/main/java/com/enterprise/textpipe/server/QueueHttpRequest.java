package com.enterprise.textpipe.server;

import java.util.Collections;
import java.util.Map;

/**
 * Transport-neutral view of a request to the queue service
 */
public final class QueueHttpRequest {

    private final String method;
    private final String path;
    private final Map<String, String> query;
    private final String contentType;
    private final String body;

    public QueueHttpRequest(String method, String path, Map<String, String> query, String contentType, String body) {
        this.method = method;
        this.path = path;
        this.query = query == null ? Collections.emptyMap() : query;
        this.contentType = contentType;
        this.body = body == null ? "" : body;
    }

    public String getMethod() { return method; }
    public String getPath() { return path; }
    public Map<String, String> getQuery() { return query; }
    public String getContentType() { return contentType; }
    public String getBody() { return body; }

    public String param(String name) {
        return query.get(name);
    }
}
