package io.taskwire.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskwire.agent.AgentHost;
import io.taskwire.agent.AgentRegistry;
import io.taskwire.config.TaskWireConfig;
import io.taskwire.correlation.TaskCorrelator;
import io.taskwire.model.TaskRequest;
import io.taskwire.model.TaskStatus;
import io.taskwire.observability.CounterRegistry;
import io.taskwire.observability.TransportMetrics;
import io.taskwire.transport.local.InProcessTransport;
import io.taskwire.transport.socket.UnixSocketClient;
import io.taskwire.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

final class TaskHttpBridgeTest {
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @Test
    void mapsTaskStatusesToHttpCodes() {
        Assertions.assertEquals(200, TaskHttpBridge.httpStatus(TaskStatus.COMPLETED));
        Assertions.assertEquals(500, TaskHttpBridge.httpStatus(TaskStatus.FAILED));
        Assertions.assertEquals(408, TaskHttpBridge.httpStatus(TaskStatus.TIMEOUT));
        Assertions.assertEquals(499, TaskHttpBridge.httpStatus(TaskStatus.CANCELLED));
    }

    @Test
    void servesTasksOverHttp() throws Exception {
        TaskWireConfig config = TaskWireConfig.defaults();
        CounterRegistry counters = new CounterRegistry();
        try (InProcessTransport transport = new InProcessTransport(config, counters);
             AgentHost host = new AgentHost(AgentRegistry.withBuiltins(), transport);
             TaskCorrelator correlator = new TaskCorrelator(transport, config, counters);
             TaskHttpBridge bridge = new TaskHttpBridge(correlator, "http-bridge", 2_000L, counters)) {
            host.start();
            bridge.start(0);
            transport.subscribe("void", envelope -> {
            });

            HttpResponse<String> echo = post(bridge, """
                    {"taskId":"t-1","taskType":"echo","recipient":"echo","parameters":{"value":42}}
                    """);
            Assertions.assertEquals(200, echo.statusCode());
            JsonNode echoBody = Jsons.mapper().readTree(echo.body());
            Assertions.assertEquals("t-1", echoBody.path("taskId").asText());
            Assertions.assertEquals(42, echoBody.path("result").path("value").asInt());

            HttpResponse<String> failed = post(bridge, """
                    {"taskType":"fail","recipient":"fail"}
                    """);
            Assertions.assertEquals(500, failed.statusCode());
            Assertions.assertEquals("FAILED", Jsons.mapper().readTree(failed.body()).path("status").asText());

            HttpResponse<String> timedOut = post(bridge, """
                    {"taskType":"noop","recipient":"void","timeoutMs":100}
                    """);
            Assertions.assertEquals(408, timedOut.statusCode());
            Assertions.assertEquals("task_timeout", Jsons.mapper().readTree(timedOut.body()).path("errorCode").asText());

            HttpResponse<String> missing = post(bridge, """
                    {"parameters":{}}
                    """);
            Assertions.assertEquals(400, missing.statusCode());

            HttpResponse<String> health = http.send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + bridge.port() + "/health")).GET().build(),
                    HttpResponse.BodyHandlers.ofString()
            );
            Assertions.assertEquals(200, health.statusCode());

            HttpResponse<String> metrics = http.send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + bridge.port() + "/metrics")).GET().build(),
                    HttpResponse.BodyHandlers.ofString()
            );
            Assertions.assertTrue(metrics.body().contains("taskwire_task_timeout_total 1"), metrics.body());
        }
    }

    @Test
    void duplicateTaskIdIsConflictAndTransportFailureIsBadGateway() throws Exception {
        TaskWireConfig config = TaskWireConfig.defaults();
        try (InProcessTransport transport = new InProcessTransport(config, TransportMetrics.noop());
             TaskCorrelator correlator = new TaskCorrelator(transport, config, TransportMetrics.noop());
             TaskHttpBridge bridge = new TaskHttpBridge(correlator, "http-bridge", 2_000L, null)) {
            bridge.start(0);
            transport.subscribe("void", envelope -> {
            });
            correlator.sendTaskRequest(new TaskRequest("t-dup", "noop", null, null, null), "void", "router", 60_000L);

            HttpResponse<String> duplicate = post(bridge, """
                    {"taskId":"t-dup","taskType":"noop","recipient":"void"}
                    """);
            Assertions.assertEquals(409, duplicate.statusCode());
            Assertions.assertEquals("task_conflict", Jsons.mapper().readTree(duplicate.body()).path("error").asText());

            transport.dispose();
            HttpResponse<String> disposed = post(bridge, """
                    {"taskType":"noop","recipient":"void"}
                    """);
            Assertions.assertEquals(502, disposed.statusCode());
        }
    }

    @Test
    void disconnectedSocketClientIsBadGateway() throws Exception {
        TaskWireConfig config = TaskWireConfig.defaults();
        try (UnixSocketClient client = new UnixSocketClient(config, "http-bridge", TransportMetrics.noop());
             TaskCorrelator correlator = new TaskCorrelator(client, config, TransportMetrics.noop());
             TaskHttpBridge bridge = new TaskHttpBridge(correlator, "http-bridge", 2_000L, null)) {
            bridge.start(0);

            HttpResponse<String> response = post(bridge, """
                    {"taskType":"echo","recipient":"echo"}
                    """);

            Assertions.assertEquals(502, response.statusCode());
            Assertions.assertEquals("transport_error", Jsons.mapper().readTree(response.body()).path("error").asText());
            Assertions.assertEquals(0, correlator.pendingCount());
        }
    }

    private HttpResponse<String> post(TaskHttpBridge bridge, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + bridge.port() + "/api/tasks"))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
