package io.taskwire.model;

public enum DeliveryGuarantee {
    AT_MOST_ONCE,
    AT_LEAST_ONCE,
    EXACTLY_ONCE;

    public static DeliveryGuarantee fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AT_LEAST_ONCE;
        }
        for (DeliveryGuarantee value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown delivery guarantee: " + raw);
    }
}
