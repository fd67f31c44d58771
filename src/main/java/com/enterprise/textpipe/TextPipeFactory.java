package com.enterprise.textpipe;

import com.enterprise.textpipe.config.ConfigValidator;
import com.enterprise.textpipe.config.TextPipeConfig;
import com.enterprise.textpipe.core.AbstractTaskQueue;
import com.enterprise.textpipe.core.TaskQueue;
import com.enterprise.textpipe.fs.FileSystemTaskQueue;
import com.enterprise.textpipe.module.ModuleRegistry;
import com.enterprise.textpipe.module.TextModule;
import com.enterprise.textpipe.monitoring.QueueMetrics;
import com.enterprise.textpipe.remote.RemoteTaskQueue;
import com.enterprise.textpipe.server.QueueHttpServer;
import com.enterprise.textpipe.server.QueueHttpService;
import com.enterprise.textpipe.worker.QueueWorker;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Factory for queues, workers and the queue service
 */
public class TextPipeFactory {

    private static final Logger logger = LoggerFactory.getLogger(TextPipeFactory.class);

    /**
     * Open the queue at a directory or service URL with default settings and modules
     */
    public static TaskQueue open(String address) {
        return create(TextPipeConfig.builder().address(address).build(), ModuleRegistry.defaults());
    }

    /**
     * Create a queue client for the configured address
     */
    public static TaskQueue create(TextPipeConfig config, ModuleRegistry registry) {
        return create(config, registry, createMetrics(config));
    }

    public static TaskQueue create(TextPipeConfig config, ModuleRegistry registry, QueueMetrics metrics) {
        validate(config);
        TextPipeConfig.QueueConfig queueConfig = config.getQueueConfig();
        QueueAddress address = QueueAddress.parse(queueConfig.getAddress());

        AbstractTaskQueue queue;
        switch (address.getKind()) {
            case HTTP:
                logger.debug("Connecting to queue service at {}", address.getValue());
                queue = new RemoteTaskQueue(address.getValue(), queueConfig.getHttpTimeout());
                break;
            case FILESYSTEM:
            default:
                logger.debug("Connecting to local repository {}", address.getValue());
                queue = new FileSystemTaskQueue(address.toPath(), registry, metrics);
                break;
        }
        queue.setInlineDefaults(queueConfig.getPollInterval(), queueConfig.getInlineTimeout());
        return queue;
    }

    public static QueueWorker createWorker(TextPipeConfig config, TaskQueue queue, TextModule module) {
        validate(config);
        return new QueueWorker(queue, module, config.getWorkerConfig(), createMetrics(config));
    }

    public static QueueHttpServer createServer(TextPipeConfig config, TaskQueue queue, ModuleRegistry registry) {
        validate(config);
        TextPipeConfig.ServerConfig serverConfig = config.getServerConfig();
        return new QueueHttpServer(new QueueHttpService(queue, registry),
            serverConfig.getHost(), serverConfig.getPort(), serverConfig.getThreads());
    }

    static QueueMetrics createMetrics(TextPipeConfig config) {
        if (config.getMonitoringConfig().isEnableMetrics()) {
            return new QueueMetrics(new SimpleMeterRegistry());
        }
        // a composite without children records nothing
        return new QueueMetrics(new CompositeMeterRegistry());
    }

    private static void validate(TextPipeConfig config) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
    }
}
