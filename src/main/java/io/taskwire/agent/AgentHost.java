package io.taskwire.agent;

import io.taskwire.envelope.Envelopes;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.model.MessageType;
import io.taskwire.model.TaskMetrics;
import io.taskwire.model.TaskRequest;
import io.taskwire.model.TaskResponse;
import io.taskwire.observability.TraceContext;
import io.taskwire.transport.Subscription;
import io.taskwire.transport.Transport;
import io.taskwire.util.Jsons;
import io.taskwire.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Serves the agents of a registry on a transport. Each agent receives the task requests
 * addressed to its id and answers every one of them with a single task response. Agents run on
 * the host's worker pool, never on the transport thread that delivered the request, so a slow
 * agent does not hold up delivery to other handlers.
 */
public final class AgentHost implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentHost.class);

    private final AgentRegistry registry;
    private final Transport transport;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final ExecutorService workers;

    public AgentHost(AgentRegistry registry, Transport transport) {
        this(registry, transport, Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    public AgentHost(AgentRegistry registry, Transport transport, int workerThreads) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0: " + workerThreads);
        }
        this.registry = Objects.requireNonNull(registry, "registry");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.workers = Executors.newFixedThreadPool(workerThreads, Threads.daemon("taskwire-agent"));
    }

    public synchronized void start() {
        if (!subscriptions.isEmpty()) {
            return;
        }
        for (Agent agent : registry.agents()) {
            subscriptions.add(transport.subscribe(agent.id(), envelope -> handle(agent, envelope)));
            log.info("Agent registered agentId={}", agent.id());
        }
    }

    @Override
    public synchronized void close() {
        for (Subscription subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
        workers.shutdown();
    }

    void handle(Agent agent, MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.TASK_REQUEST) {
            log.debug("Ignored message agentId={} type={}", agent.id(), envelope.messageType());
            return;
        }
        TraceContext.Captured captured = TraceContext.capture();
        try {
            workers.execute(() -> {
                try (TraceContext.Scope ignored = captured.activate()) {
                    respond(agent, envelope);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Agent host closed; dropped request agentId={} message={}", agent.id(), envelope.id());
        }
    }

    private void respond(Agent agent, MessageEnvelope envelope) {
        TaskResponse response = execute(agent, envelope);
        try {
            transport.send(Envelopes.taskResponse(envelope, agent.id(), response));
        } catch (RuntimeException e) {
            log.warn("Failed to send task response agentId={} taskId={}", agent.id(), response.taskId(), e);
        }
    }

    private TaskResponse execute(Agent agent, MessageEnvelope envelope) {
        String fallbackTaskId = envelope.correlationId() == null ? envelope.id() : envelope.correlationId();
        TaskRequest request;
        try {
            request = Jsons.fromTree(envelope.payload(), TaskRequest.class);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed task request agentId={} message={}", agent.id(), envelope.id());
            return TaskResponse.failed(fallbackTaskId, "invalid_request", e.getMessage(), TaskMetrics.none());
        }
        String taskId = request.taskId() == null ? fallbackTaskId : request.taskId();
        TraceContext trace = TraceContext.current().orElseGet(TraceContext::newRoot);
        AgentContext context = new AgentContext(
                taskId,
                request.taskType(),
                request.parameters(),
                trace.traceId(),
                trace.spanId(),
                TraceContext.toTraceParent(trace.traceId(), trace.spanId()),
                request.metadata()
        );

        long startedNs = System.nanoTime();
        AgentResult result;
        try {
            result = agent.execute(context);
        } catch (Exception e) {
            log.warn("Agent failed agentId={} taskId={}", agent.id(), taskId, e);
            result = AgentResult.fail("agent_exception", e.getMessage() == null ? e.toString() : e.getMessage());
        }
        TaskMetrics metrics = TaskMetrics.elapsed((System.nanoTime() - startedNs) / 1_000_000L);
        if (result == null) {
            return TaskResponse.failed(taskId, "agent_exception", "agent returned no result", metrics);
        }
        if (result.success()) {
            log.debug("Task completed agentId={} taskId={}", agent.id(), taskId);
            return TaskResponse.completed(taskId, result.output(), metrics);
        }
        log.info("Task failed agentId={} taskId={} errorCode={}", agent.id(), taskId, result.errorCode());
        return TaskResponse.failed(taskId, result.errorCode(), result.error(), metrics);
    }
}
