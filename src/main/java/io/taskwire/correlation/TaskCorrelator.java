package io.taskwire.correlation;

import io.taskwire.config.TaskWireConfig;
import io.taskwire.envelope.Envelopes;
import io.taskwire.model.MessageEnvelope;
import io.taskwire.model.MessageType;
import io.taskwire.model.TaskRequest;
import io.taskwire.model.TaskResponse;
import io.taskwire.observability.TransportMetrics;
import io.taskwire.transport.Subscription;
import io.taskwire.transport.Transport;
import io.taskwire.transport.TransportException;
import io.taskwire.util.Jsons;
import io.taskwire.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Turns one-way delivery into an awaitable task call. Each request is parked in a pending
 * table under its task id; the matching {@code TASK_RESPONSE} and the timeout timer race to
 * remove it, and only the one that removes it completes the future.
 */
public final class TaskCorrelator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskCorrelator.class);

    private final Transport transport;
    private final TransportMetrics metrics;
    private final long defaultTimeoutMs;
    private final ConcurrentMap<String, PendingTask> pending = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Subscription> inboxes = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timers;
    private volatile boolean closed;

    public TaskCorrelator(Transport transport, TaskWireConfig config, TransportMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.defaultTimeoutMs = config.taskTimeoutMs();
        this.timers = Executors.newSingleThreadScheduledExecutor(Threads.daemon("taskwire-task-timeout"));
    }

    public CompletableFuture<TaskResponse> sendTaskRequest(TaskRequest request, String recipientId, String senderId) {
        return sendTaskRequest(request, recipientId, senderId, defaultTimeoutMs);
    }

    /**
     * Sends {@code request} and returns a future for its response. The future fails with
     * {@link TaskTimeoutException} after {@code timeoutMs}, and immediately when the transport
     * rejects the envelope. Cancelling it abandons the request.
     */
    public CompletableFuture<TaskResponse> sendTaskRequest(
            TaskRequest request,
            String recipientId,
            String senderId,
            long timeoutMs
    ) {
        Objects.requireNonNull(request, "request");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0: " + timeoutMs);
        }
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Correlator is closed"));
        }
        String taskId = request.taskId();
        if (taskId == null || taskId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("taskId cannot be empty"));
        }

        MessageEnvelope envelope;
        try {
            envelope = Envelopes.taskRequest(request, senderId, recipientId, timeoutMs);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        PendingTask task = new PendingTask(taskId, new CompletableFuture<>());
        if (pending.putIfAbsent(taskId, task) != null) {
            return CompletableFuture.failedFuture(new DuplicateTaskException(taskId));
        }
        task.future().whenComplete((response, error) -> {
            pending.remove(taskId, task);
            task.cancelTimer();
        });

        try {
            ensureInbox(senderId);
            task.timer(timers.schedule(() -> expire(task, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS));
            transport.send(envelope);
        } catch (RejectedExecutionException e) {
            task.future().completeExceptionally(new IllegalStateException("Correlator is closed", e));
            return task.future();
        } catch (RuntimeException e) {
            task.future().completeExceptionally(e);
            return task.future();
        }
        log.debug("Task request sent taskId={} taskType={} recipient={} timeoutMs={}",
                taskId, request.taskType(), recipientId, timeoutMs);
        return task.future();
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Fails every pending future and removes the inbox subscriptions.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (PendingTask task : pending.values()) {
            if (pending.remove(task.taskId(), task)) {
                task.future().completeExceptionally(new IllegalStateException("Correlator is closed"));
            }
        }
        for (Subscription subscription : inboxes.values()) {
            subscription.unsubscribe();
        }
        inboxes.clear();
        timers.shutdownNow();
    }

    private void ensureInbox(String senderId) {
        inboxes.computeIfAbsent(senderId, sender -> transport.subscribe(sender, this::onInbox));
    }

    private void onInbox(MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.TASK_RESPONSE) {
            return;
        }
        String correlationId = envelope.correlationId();
        PendingTask task = correlationId == null ? null : pending.remove(correlationId);
        if (task == null) {
            metrics.dropped("late_response");
            log.debug("Dropped response without pending request correlationId={}", correlationId);
            return;
        }
        task.cancelTimer();
        TaskResponse response;
        try {
            response = Jsons.fromTree(envelope.payload(), TaskResponse.class);
        } catch (IllegalArgumentException e) {
            task.future().completeExceptionally(
                    new TransportException("Malformed task response for " + correlationId, e));
            return;
        }
        task.future().complete(response);
    }

    private void expire(PendingTask task, long timeoutMs) {
        if (!pending.remove(task.taskId(), task)) {
            return;
        }
        metrics.increment(TransportMetrics.TASK_TIMEOUT, Map.of());
        log.warn("Task request timed out taskId={} timeoutMs={}", task.taskId(), timeoutMs);
        task.future().completeExceptionally(new TaskTimeoutException(task.taskId(), timeoutMs));
    }

    private static final class PendingTask {
        private final String taskId;
        private final CompletableFuture<TaskResponse> future;
        private volatile ScheduledFuture<?> timer;

        private PendingTask(String taskId, CompletableFuture<TaskResponse> future) {
            this.taskId = taskId;
            this.future = future;
        }

        String taskId() {
            return taskId;
        }

        CompletableFuture<TaskResponse> future() {
            return future;
        }

        void timer(ScheduledFuture<?> timer) {
            this.timer = timer;
            if (future.isDone()) {
                timer.cancel(false);
            }
        }

        void cancelTimer() {
            ScheduledFuture<?> current = timer;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
