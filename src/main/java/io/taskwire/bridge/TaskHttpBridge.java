package io.taskwire.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.taskwire.correlation.DuplicateTaskException;
import io.taskwire.correlation.TaskCorrelator;
import io.taskwire.correlation.TaskTimeoutException;
import io.taskwire.envelope.ValidationException;
import io.taskwire.model.TaskRequest;
import io.taskwire.model.TaskResponse;
import io.taskwire.model.TaskStatus;
import io.taskwire.observability.CounterRegistry;
import io.taskwire.transport.QueueFullException;
import io.taskwire.util.Jsons;
import io.taskwire.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP front door for legacy clients. {@code POST /api/tasks} runs one task call through the
 * correlator and answers with the task response; it adds no transport logic of its own.
 */
public final class TaskHttpBridge implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskHttpBridge.class);

    private final TaskCorrelator correlator;
    private final String senderId;
    private final long defaultTimeoutMs;
    private final CounterRegistry counters;
    private HttpServer server;
    private ExecutorService executor;

    public TaskHttpBridge(TaskCorrelator correlator, String senderId, long defaultTimeoutMs, CounterRegistry counters) {
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.senderId = senderId;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.counters = counters;
    }

    public static int httpStatus(TaskStatus status) {
        return switch (status) {
            case COMPLETED -> 200;
            case FAILED -> 500;
            case TIMEOUT -> 408;
            case CANCELLED -> 499;
        };
    }

    /**
     * Binds {@code port} on all interfaces; 0 picks a free port.
     */
    public synchronized void start(int port) throws IOException {
        if (server != null) {
            return;
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/api/tasks", this::handleTask);
        server.createContext("/health", exchange -> {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                return;
            }
            writeJson(exchange, Map.of("status", "ok", "pendingTasks", correlator.pendingCount()), 200);
        });
        if (counters != null) {
            server.createContext("/metrics", exchange -> {
                byte[] bytes = counters.prometheusText().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            });
        }
        executor = Executors.newCachedThreadPool(Threads.daemon("taskwire-bridge"));
        server.setExecutor(executor);
        server.start();
        log.info("Task bridge listening port={} sender={}", port(), senderId);
    }

    public int port() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
        server = null;
        log.info("Task bridge stopped");
    }

    private void handleTask(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
            return;
        }
        BridgeRequest body;
        try (InputStream in = exchange.getRequestBody()) {
            body = Jsons.mapper().readValue(in, BridgeRequest.class);
        } catch (IOException e) {
            writeJson(exchange, Map.of("error", "invalid_json", "message", String.valueOf(e.getMessage())), 400);
            return;
        }
        if (body == null || isBlank(body.taskType()) || isBlank(body.recipient())) {
            writeJson(exchange, Map.of("error", "missing_field", "required", "taskType, recipient"), 400);
            return;
        }
        long timeoutMs = body.timeoutMs() == null || body.timeoutMs() <= 0 ? defaultTimeoutMs : body.timeoutMs();
        TaskRequest request = new TaskRequest(
                isBlank(body.taskId()) ? UUID.randomUUID().toString() : body.taskId(),
                body.taskType(),
                body.parameters(),
                body.metadata(),
                body.priority()
        );

        CompletableFuture<TaskResponse> future = correlator.sendTaskRequest(request, body.recipient(), senderId, timeoutMs);
        TaskResponse response;
        try {
            response = future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            response = TaskResponse.cancelled(request.taskId(), "bridge interrupted");
        } catch (CancellationException e) {
            response = TaskResponse.cancelled(request.taskId(), "task cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TaskTimeoutException timeout) {
                response = TaskResponse.timeout(request.taskId(), timeout.timeoutMs());
            } else if (cause instanceof QueueFullException) {
                writeJson(exchange, Map.of("error", "queue_full", "message", cause.getMessage()), 503);
                return;
            } else if (cause instanceof ValidationException invalid) {
                writeJson(exchange, Map.of("error", "invalid_message", "details", invalid.fields()), 400);
                return;
            } else if (cause instanceof DuplicateTaskException) {
                writeJson(exchange, Map.of("error", "task_conflict", "message", cause.getMessage()), 409);
                return;
            } else {
                log.warn("Task call failed taskId={} recipient={}", request.taskId(), body.recipient(), cause);
                writeJson(exchange, Map.of("error", "transport_error", "message", String.valueOf(cause.getMessage())), 502);
                return;
            }
        }
        writeJson(exchange, response, httpStatus(response.status()));
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record BridgeRequest(
            String taskId,
            String taskType,
            JsonNode parameters,
            Map<String, String> metadata,
            Integer priority,
            String recipient,
            Long timeoutMs
    ) {
    }
}
