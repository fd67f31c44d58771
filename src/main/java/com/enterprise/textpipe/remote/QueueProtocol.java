package com.enterprise.textpipe.remote;

/**
 * Wire constants shared by the remote client and the queue service.
 * All paths are relative to the service base URL.
 */
public final class QueueProtocol {

    public static final String MODULES = "/modules/";

    public static final String HEADER_ID = "ID";
    public static final String HEADER_STATUS = "Status";
    public static final String HEADER_LOCATION = "Location";
    public static final String HEADER_CONTENT_TYPE = "Content-Type";

    /**
     * Set on 404 responses caused by an unknown module rather than an unknown task
     */
    public static final String HEADER_ERROR = "Error";
    public static final String ERROR_UNKNOWN_MODULE = "UnknownModule";

    /**
     * Content type marking a stored outcome as error text
     */
    public static final String ERROR_MIME = "application/prs.error+text";
    public static final String TEXT_MIME = "text/plain; charset=utf-8";
    public static final String JSON_MIME = "application/json";

    public static final String PARAM_ID = "id";
    public static final String PARAM_FORMAT = "format";
    public static final String PARAM_RESET_ERROR = "reset_error";
    public static final String PARAM_RESET_PENDING = "reset_pending";

    public static final String BULK_STATUS = "bulk/status";
    public static final String BULK_RESULT = "bulk/result";
    public static final String BULK_PROCESS = "bulk/process";
    public static final String BULK_STATISTICS = "bulk/statistics";

    /**
     * Fields of the JSON error descriptor
     */
    public static final String FIELD_EXCEPTION_CLASS = "exception_class";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_STATUS = "status";

    public static final int SUBMITTED = 202;
    public static final int OK = 200;
    public static final int STORED = 204;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int FAILED = 500;

    private QueueProtocol() {
    }

    public static String modulePath(String module) {
        return MODULES + module + "/";
    }

    public static String taskPath(String module, String id) {
        return MODULES + module + "/" + id;
    }

    /**
     * Boolean query flag; only "1", "Y" and "True" switch it on
     */
    public static boolean isFlagSet(String value) {
        return "1".equals(value) || "Y".equals(value) || "True".equals(value);
    }
}
