package com.enterprise.textpipe.config;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for queue clients, workers and the queue service
 */
public class TextPipeConfig {

    public static final String ENV_DIR = "TEXTPIPE_DIR";
    public static final String ENV_SERVER = "TEXTPIPE_SERVER";
    public static final String ENV_HOST = "TEXTPIPE_HOST";
    public static final String ENV_PORT = "TEXTPIPE_PORT";

    private final QueueConfig queueConfig;
    private final WorkerConfig workerConfig;
    private final ServerConfig serverConfig;
    private final MonitoringConfig monitoringConfig;

    public TextPipeConfig(QueueConfig queueConfig, WorkerConfig workerConfig,
                          ServerConfig serverConfig, MonitoringConfig monitoringConfig) {
        this.queueConfig = queueConfig;
        this.workerConfig = workerConfig;
        this.serverConfig = serverConfig;
        this.monitoringConfig = monitoringConfig;
    }

    public QueueConfig getQueueConfig() { return queueConfig; }
    public WorkerConfig getWorkerConfig() { return workerConfig; }
    public ServerConfig getServerConfig() { return serverConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }

    @Override
    public String toString() {
        return "TextPipeConfig{address=" + queueConfig.getAddress()
            + ", workerThreads=" + workerConfig.getThreads()
            + ", server=" + serverConfig.getHost() + ":" + serverConfig.getPort() + "}";
    }

    /**
     * Queue client configuration
     */
    public static class QueueConfig {
        private final String address;
        private final Duration pollInterval;
        private final Duration inlineTimeout;
        private final Duration httpTimeout;

        /**
         * @param address directory path or http(s) URL of the queue
         * @param inlineTimeout deadline of inline processing, null for none
         */
        public QueueConfig(String address, Duration pollInterval, Duration inlineTimeout, Duration httpTimeout) {
            this.address = address;
            this.pollInterval = pollInterval;
            this.inlineTimeout = inlineTimeout;
            this.httpTimeout = httpTimeout;
        }

        public String getAddress() { return address; }
        public Duration getPollInterval() { return pollInterval; }
        public Duration getInlineTimeout() { return inlineTimeout; }
        public Duration getHttpTimeout() { return httpTimeout; }
    }

    /**
     * Worker configuration
     */
    public static class WorkerConfig {
        private final int threads;
        private final Duration pollDelay;
        private final int batchSize;
        private final Duration shutdownTimeout;

        public WorkerConfig(int threads, Duration pollDelay, int batchSize, Duration shutdownTimeout) {
            this.threads = threads;
            this.pollDelay = pollDelay;
            this.batchSize = batchSize;
            this.shutdownTimeout = shutdownTimeout;
        }

        public int getThreads() { return threads; }
        public Duration getPollDelay() { return pollDelay; }
        public int getBatchSize() { return batchSize; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
    }

    /**
     * Queue service configuration
     */
    public static class ServerConfig {
        private final String host;
        private final int port;
        private final int threads;

        public ServerConfig(String host, int port, int threads) {
            this.host = host;
            this.port = port;
            this.threads = threads;
        }

        public String getHost() { return host; }
        public int getPort() { return port; }
        public int getThreads() { return threads; }
    }

    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;

        public MonitoringConfig(boolean enableMetrics) {
            this.enableMetrics = enableMetrics;
        }

        public boolean isEnableMetrics() { return enableMetrics; }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private QueueConfig queueConfig = Defaults.defaultQueueConfig();
        private WorkerConfig workerConfig = Defaults.defaultWorkerConfig();
        private ServerConfig serverConfig = Defaults.defaultServerConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();

        public Builder queueConfig(QueueConfig queueConfig) {
            this.queueConfig = queueConfig;
            return this;
        }

        public Builder address(String address) {
            this.queueConfig = new QueueConfig(address, queueConfig.getPollInterval(),
                queueConfig.getInlineTimeout(), queueConfig.getHttpTimeout());
            return this;
        }

        public Builder workerConfig(WorkerConfig workerConfig) {
            this.workerConfig = workerConfig;
            return this;
        }

        public Builder serverConfig(ServerConfig serverConfig) {
            this.serverConfig = serverConfig;
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }

        /**
         * Override settings from environment variables. {@value #ENV_SERVER} wins over {@value #ENV_DIR}.
         */
        public Builder fromEnvironment(Map<String, String> env) {
            String dir = env.get(ENV_DIR);
            String server = env.get(ENV_SERVER);
            if (server != null && !server.isBlank()) {
                address(server);
            } else if (dir != null && !dir.isBlank()) {
                address(dir);
            }
            String host = env.getOrDefault(ENV_HOST, serverConfig.getHost());
            int port = serverConfig.getPort();
            String rawPort = env.get(ENV_PORT);
            if (rawPort != null && !rawPort.isBlank()) {
                try {
                    port = Integer.parseInt(rawPort.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(ENV_PORT + " is not a number: " + rawPort, e);
                }
            }
            this.serverConfig = new ServerConfig(host, port, serverConfig.getThreads());
            return this;
        }

        public TextPipeConfig build() {
            return new TextPipeConfig(queueConfig, workerConfig, serverConfig, monitoringConfig);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configurations
     */
    public static class Defaults {
        public static QueueConfig defaultQueueConfig() {
            String tmpDir = System.getProperty("java.io.tmpdir");
            String path = tmpDir.endsWith("/") ? (tmpDir + "textpipe") : (tmpDir + "/textpipe");
            return new QueueConfig(
                path, Duration.ofMillis(100), Duration.ofMinutes(10), Duration.ofSeconds(30)
            );
        }

        public static WorkerConfig defaultWorkerConfig() {
            return new WorkerConfig(
                1, Duration.ofMillis(500), 100, Duration.ofSeconds(30)
            );
        }

        public static ServerConfig defaultServerConfig() {
            return new ServerConfig("localhost", 5001, 8);
        }

        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true);
        }
    }
}
