package com.enterprise.textpipe.exception;

/**
 * Exception thrown when the remote queue service answers with an unexpected status code
 */
public class RemoteQueueException extends TextPipeException {

    private final int statusCode;
    private final String responseBody;

    public RemoteQueueException(String operation, int statusCode, String responseBody) {
        super(String.format("Error on %s; return code: %d:%n%s", operation, statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public RemoteQueueException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    /**
     * HTTP status code, or -1 when the request never got a response
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
