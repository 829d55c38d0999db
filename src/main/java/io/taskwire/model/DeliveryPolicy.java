package io.taskwire.model;

/**
 * Declared reliability policy of an envelope. Transports carry it but do not enforce it;
 * senders use it to decide whether and how often to retry.
 */
public record DeliveryPolicy(
        DeliveryGuarantee guarantee,
        int retryCount,
        long retryDelayMs,
        boolean requireAck,
        int priority
) {
    public static final int DEFAULT_PRIORITY = 5;

    public DeliveryPolicy {
        guarantee = guarantee == null ? DeliveryGuarantee.AT_LEAST_ONCE : guarantee;
    }

    public static DeliveryPolicy defaults() {
        return new DeliveryPolicy(DeliveryGuarantee.AT_LEAST_ONCE, 0, 0L, false, DEFAULT_PRIORITY);
    }

    public static DeliveryPolicy forTaskRequest(Integer priority) {
        return new DeliveryPolicy(
                DeliveryGuarantee.AT_LEAST_ONCE,
                3,
                1_000L,
                true,
                priority == null ? DEFAULT_PRIORITY : priority
        );
    }
}
