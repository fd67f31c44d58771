package com.enterprise.textpipe.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves a {@link QueueHttpService} with the JDK's built-in HTTP server
 */
public class QueueHttpServer {

    private static final Logger logger = LoggerFactory.getLogger(QueueHttpServer.class);

    private final QueueHttpService service;
    private final String host;
    private final int requestedPort;
    private final int threads;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param port port to listen on, 0 for an ephemeral port
     */
    public QueueHttpServer(QueueHttpService service, String host, int port, int threads) {
        this.service = service;
        this.host = host;
        this.requestedPort = port;
        this.threads = threads;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(host, requestedPort), 0);
        } catch (IOException e) {
            running.set(false);
            throw new UncheckedIOException("Cannot listen on " + host + ":" + requestedPort, e);
        }
        executor = Executors.newFixedThreadPool(threads, new ServerThreadFactory());
        server.setExecutor(executor);
        server.createContext("/", this::handle);
        server.start();
        logger.info("Queue service listening on http://{}:{}", host, getPort());
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("Stopping queue service...");
            server.stop(0);
            executor.shutdown();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            logger.info("Queue service stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Bound port; differs from the requested one when that was 0
     */
    public int getPort() {
        return server == null ? requestedPort : server.getAddress().getPort();
    }

    public String getBaseUrl() {
        return "http://" + host + ":" + getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String body;
            try (InputStream in = exchange.getRequestBody()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            QueueHttpRequest request = new QueueHttpRequest(
                exchange.getRequestMethod(),
                exchange.getRequestURI().getPath(),
                parseQuery(exchange.getRequestURI().getRawQuery()),
                exchange.getRequestHeaders().getFirst("Content-Type"),
                body);
            QueueHttpResponse response = service.handle(request);
            logger.debug("{} {} -> {}", request.getMethod(), request.getPath(), response.getStatus());

            response.getHeaders().forEach((name, value) -> exchange.getResponseHeaders().set(name, value));
            byte[] bytes = response.getBody().getBytes(StandardCharsets.UTF_8);
            boolean noBody = bytes.length == 0 || "HEAD".equalsIgnoreCase(request.getMethod())
                || response.getStatus() == 204;
            exchange.sendResponseHeaders(response.getStatus(), noBody ? -1 : bytes.length);
            if (!noBody) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(bytes);
                }
            }
        } finally {
            exchange.close();
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(name, value);
        }
        return params;
    }

    private static class ServerThreadFactory implements ThreadFactory {
        private final AtomicInteger threadNumber = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "queue-http-" + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
