package io.taskwire.transport.local;

import io.taskwire.model.MessageEnvelope;
import io.taskwire.observability.TraceContext;
import io.taskwire.transport.MessageHandler;
import io.taskwire.transport.QueueFullException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handler set and bounded FIFO queue for one recipient. At most one thread drains the queue at
 * a time, which is what keeps per-recipient delivery in publish order.
 */
final class RecipientChannel {
    private final String recipient;
    private final int maxQueueSize;
    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Deque<Pending> queue = new ArrayDeque<>();
    private final Object lock = new Object();
    private boolean draining;

    RecipientChannel(String recipient, int maxQueueSize) {
        this.recipient = recipient;
        this.maxQueueSize = maxQueueSize;
    }

    String recipient() {
        return recipient;
    }

    Registration add(MessageHandler handler) {
        Registration registration = new Registration(handler);
        registrations.add(registration);
        return registration;
    }

    boolean remove(Registration registration) {
        return registrations.remove(registration);
    }

    boolean hasHandlers() {
        return !registrations.isEmpty();
    }

    List<Registration> handlers() {
        return List.copyOf(registrations);
    }

    void offer(MessageEnvelope envelope, TraceContext.Captured captured) {
        synchronized (lock) {
            // The envelope being delivered is still counted until every handler has run.
            if (queue.size() >= maxQueueSize) {
                throw new QueueFullException(recipient, maxQueueSize);
            }
            queue.addLast(new Pending(envelope, captured));
        }
    }

    int depth() {
        synchronized (lock) {
            return queue.size();
        }
    }

    /**
     * Delivers queued envelopes until the queue is empty. Returns immediately if another thread
     * is already draining this channel.
     */
    void drain(Deliverer deliverer) {
        synchronized (lock) {
            if (draining) {
                return;
            }
            draining = true;
        }
        boolean finished = false;
        try {
            while (true) {
                Pending next;
                synchronized (lock) {
                    next = queue.peekFirst();
                    if (next == null) {
                        draining = false;
                        finished = true;
                        return;
                    }
                }
                try {
                    deliverer.deliver(this, next.envelope(), next.captured());
                } finally {
                    synchronized (lock) {
                        queue.pollFirst();
                    }
                }
            }
        } finally {
            if (!finished) {
                synchronized (lock) {
                    draining = false;
                }
            }
        }
    }

    void clear() {
        registrations.clear();
        synchronized (lock) {
            queue.clear();
        }
    }

    @FunctionalInterface
    interface Deliverer {
        void deliver(RecipientChannel channel, MessageEnvelope envelope, TraceContext.Captured captured);
    }

    static final class Registration {
        private final MessageHandler handler;

        private Registration(MessageHandler handler) {
            this.handler = handler;
        }

        MessageHandler handler() {
            return handler;
        }
    }

    private record Pending(MessageEnvelope envelope, TraceContext.Captured captured) {
    }
}
