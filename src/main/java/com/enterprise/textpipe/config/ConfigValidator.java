package com.enterprise.textpipe.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates text pipe configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(TextPipeConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateQueueConfig(config.getQueueConfig(), errors);
        validateWorkerConfig(config.getWorkerConfig(), errors);
        validateServerConfig(config.getServerConfig(), errors);

        return errors;
    }

    private void validateQueueConfig(TextPipeConfig.QueueConfig config, List<ValidationError> errors) {
        if (config.getAddress() == null || config.getAddress().trim().isEmpty()) {
            errors.add(new ValidationError("queue.address",
                "Queue address (directory or URL) is required"));
        }

        if (config.getPollInterval() == null || config.getPollInterval().isNegative()
                || config.getPollInterval().isZero()) {
            errors.add(new ValidationError("queue.pollInterval",
                "Poll interval must be positive"));
        }

        if (config.getInlineTimeout() != null && config.getInlineTimeout().isNegative()) {
            errors.add(new ValidationError("queue.inlineTimeout",
                "Inline timeout cannot be negative"));
        }

        if (config.getHttpTimeout() == null || config.getHttpTimeout().isNegative()
                || config.getHttpTimeout().isZero()) {
            errors.add(new ValidationError("queue.httpTimeout",
                "HTTP timeout must be positive"));
        }
    }

    private void validateWorkerConfig(TextPipeConfig.WorkerConfig config, List<ValidationError> errors) {
        if (config.getThreads() <= 0) {
            errors.add(new ValidationError("worker.threads",
                "Worker threads must be greater than 0"));
        }

        if (config.getPollDelay().isNegative() || config.getPollDelay().isZero()) {
            errors.add(new ValidationError("worker.pollDelay",
                "Poll delay must be positive"));
        }

        if (config.getBatchSize() <= 0) {
            errors.add(new ValidationError("worker.batchSize",
                "Batch size must be greater than 0"));
        }

        if (config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("worker.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }

    private void validateServerConfig(TextPipeConfig.ServerConfig config, List<ValidationError> errors) {
        if (config.getHost() == null || config.getHost().trim().isEmpty()) {
            errors.add(new ValidationError("server.host",
                "Host is required"));
        }

        if (config.getPort() < 0 || config.getPort() > 65535) {
            errors.add(new ValidationError("server.port",
                "Port must be between 0 and 65535"));
        }

        if (config.getThreads() <= 0) {
            errors.add(new ValidationError("server.threads",
                "Server threads must be greater than 0"));
        }
    }

    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
