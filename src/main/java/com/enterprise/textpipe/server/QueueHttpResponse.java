package com.enterprise.textpipe.server;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport-neutral response of the queue service
 */
public final class QueueHttpResponse {

    private final int status;
    private final Map<String, String> headers;
    private final String body;

    private QueueHttpResponse(int status, Map<String, String> headers, String body) {
        this.status = status;
        this.headers = Collections.unmodifiableMap(headers);
        this.body = body;
    }

    public static QueueHttpResponse of(int status, String body) {
        return new QueueHttpResponse(status, new LinkedHashMap<>(), body);
    }

    public static QueueHttpResponse empty(int status) {
        return of(status, "");
    }

    /**
     * Copy of this response with one more header
     */
    public QueueHttpResponse withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new QueueHttpResponse(status, copy, body);
    }

    public int getStatus() { return status; }
    public Map<String, String> getHeaders() { return headers; }
    public String getBody() { return body; }

    public String header(String name) {
        return headers.get(name);
    }

    @Override
    public String toString() {
        return "QueueHttpResponse{status=" + status + ", headers=" + headers + "}";
    }
}
