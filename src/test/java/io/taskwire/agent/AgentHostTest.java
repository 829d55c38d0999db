package io.taskwire.agent;

import io.taskwire.config.TaskWireConfig;
import io.taskwire.envelope.Envelopes;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.model.MessageType;
import io.taskwire.model.TaskRequest;
import io.taskwire.model.TaskResponse;
import io.taskwire.model.TaskStatus;
import io.taskwire.observability.TraceContext;
import io.taskwire.observability.TransportMetrics;
import io.taskwire.transport.local.InProcessTransport;
import io.taskwire.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class AgentHostTest {

    @Test
    void agentExceptionBecomesFailedResponse() throws Exception {
        AgentRegistry registry = new AgentRegistry();
        registry.register(new Agent() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public AgentResult execute(AgentContext context) {
                throw new IllegalArgumentException("cannot handle " + context.taskType());
            }
        });
        try (InProcessTransport transport = new InProcessTransport(TaskWireConfig.defaults(), TransportMetrics.noop());
             AgentHost host = new AgentHost(registry, transport)) {
            host.start();
            List<MessageEnvelope> replies = new CopyOnWriteArrayList<>();
            transport.subscribe("router", replies::add);

            TaskRequest request = TaskRequest.of("resize", null);
            MessageEnvelope envelope = Envelopes.taskRequest(request, "router", "broken", 1_000L);
            transport.publish(envelope);

            MessageEnvelope reply = awaitFirst(replies);
            Assertions.assertEquals(MessageType.TASK_RESPONSE, reply.messageType());
            Assertions.assertEquals(request.taskId(), reply.correlationId());
            TaskResponse response = Jsons.fromTree(reply.payload(), TaskResponse.class);
            Assertions.assertEquals(TaskStatus.FAILED, response.status());
            Assertions.assertEquals("agent_exception", response.errorCode());
            Assertions.assertEquals("cannot handle resize", response.errorMessage());
        }
    }

    @Test
    void agentRunsInsideTheRequestTrace() throws Exception {
        AtomicReference<String> seenTrace = new AtomicReference<>();
        CountDownLatch ran = new CountDownLatch(1);
        AgentRegistry registry = new AgentRegistry();
        registry.register(new Agent() {
            @Override
            public String id() {
                return "tracer";
            }

            @Override
            public AgentResult execute(AgentContext context) {
                seenTrace.set(context.traceId());
                ran.countDown();
                return AgentResult.ok(null);
            }
        });
        try (InProcessTransport transport = new InProcessTransport(TaskWireConfig.defaults(), TransportMetrics.noop());
             AgentHost host = new AgentHost(registry, transport)) {
            host.start();
            transport.subscribe("router", envelope -> {
            });
            TraceContext root = TraceContext.newRoot();
            try (TraceContext.Scope ignored = root.activate()) {
                transport.publish(Envelopes.taskRequest(TaskRequest.of("trace", null), "router", "tracer", 1_000L));
            }

            Assertions.assertTrue(ran.await(5, TimeUnit.SECONDS));
            Assertions.assertEquals(root.traceId(), seenTrace.get());
        }
    }

    @Test
    void nonRequestMessagesAreIgnored() {
        try (InProcessTransport transport = new InProcessTransport(TaskWireConfig.defaults(), TransportMetrics.noop());
             AgentHost host = new AgentHost(AgentRegistry.withBuiltins(), transport)) {
            host.start();
            List<MessageEnvelope> replies = new CopyOnWriteArrayList<>();
            transport.subscribe("router", replies::add);

            transport.publish(Envelopes.create(MessageType.TASK_RESPONSE, "router", "echo", null));

            Assertions.assertTrue(replies.isEmpty());
        }
    }

    private static MessageEnvelope awaitFirst(List<MessageEnvelope> replies) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (replies.isEmpty()) {
            if (System.currentTimeMillis() > deadline) {
                Assertions.fail("no reply within 5s");
            }
            Thread.sleep(10L);
        }
        return replies.get(0);
    }
}
