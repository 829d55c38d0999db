package io.taskwire.config;

import io.taskwire.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Construction-time settings for the transports and the correlation layer. Supplied by the
 * composition root; nothing reads configuration from global state.
 */
public record TaskWireConfig(
        String socketPath,
        long heartbeatIntervalMs,
        long handshakeTimeoutMs,
        int maxQueueSize,
        int maxFrameSize,
        long dedupWindowMs,
        int dedupMaxEntries,
        long taskTimeoutMs,
        String protocolVersion
) {
    public static final String DEFAULT_SOCKET_PATH = "/tmp/taskwire.sock";
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 3_000L;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 1_000;
    public static final int DEFAULT_MAX_FRAME_SIZE = 10 * 1024 * 1024;
    public static final long DEFAULT_DEDUP_WINDOW_MS = 60_000L;
    public static final int DEFAULT_DEDUP_MAX_ENTRIES = 10_000;
    public static final long DEFAULT_TASK_TIMEOUT_MS = 30_000L;
    public static final String PROTOCOL_VERSION = "1.0";
    /** Largest body whose 4-byte length prefix still fits in one Java array. */
    public static final int MAX_FRAME_SIZE_LIMIT = Integer.MAX_VALUE - 4;

    public TaskWireConfig {
        if (socketPath == null || socketPath.isBlank()) {
            throw new IllegalArgumentException("socketPath cannot be empty");
        }
        requirePositive("heartbeatIntervalMs", heartbeatIntervalMs);
        requirePositive("handshakeTimeoutMs", handshakeTimeoutMs);
        requirePositive("maxQueueSize", maxQueueSize);
        requirePositive("maxFrameSize", maxFrameSize);
        if (maxFrameSize > MAX_FRAME_SIZE_LIMIT) {
            throw new IllegalArgumentException("maxFrameSize must be <= " + MAX_FRAME_SIZE_LIMIT + ": " + maxFrameSize);
        }
        requirePositive("dedupWindowMs", dedupWindowMs);
        requirePositive("dedupMaxEntries", dedupMaxEntries);
        requirePositive("taskTimeoutMs", taskTimeoutMs);
        protocolVersion = protocolVersion == null || protocolVersion.isBlank() ? PROTOCOL_VERSION : protocolVersion;
    }

    public static TaskWireConfig defaults() {
        return new TaskWireConfig(
                DEFAULT_SOCKET_PATH,
                DEFAULT_HEARTBEAT_INTERVAL_MS,
                DEFAULT_HANDSHAKE_TIMEOUT_MS,
                DEFAULT_MAX_QUEUE_SIZE,
                DEFAULT_MAX_FRAME_SIZE,
                DEFAULT_DEDUP_WINDOW_MS,
                DEFAULT_DEDUP_MAX_ENTRIES,
                DEFAULT_TASK_TIMEOUT_MS,
                PROTOCOL_VERSION
        );
    }

    /**
     * Reads a JSON settings file. Absent fields, or a missing file, fall back to the defaults.
     */
    public static TaskWireConfig load(Path settingsFile) {
        TaskWireConfig defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        SettingsFile file;
        try {
            file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + settingsFile, e);
        }
        return new TaskWireConfig(
                file.socketPath() == null ? defaults.socketPath() : file.socketPath(),
                file.heartbeatIntervalMs() == null ? defaults.heartbeatIntervalMs() : file.heartbeatIntervalMs(),
                file.handshakeTimeoutMs() == null ? defaults.handshakeTimeoutMs() : file.handshakeTimeoutMs(),
                file.maxQueueSize() == null ? defaults.maxQueueSize() : file.maxQueueSize(),
                file.maxFrameSize() == null ? defaults.maxFrameSize() : file.maxFrameSize(),
                file.dedupWindowMs() == null ? defaults.dedupWindowMs() : file.dedupWindowMs(),
                file.dedupMaxEntries() == null ? defaults.dedupMaxEntries() : file.dedupMaxEntries(),
                file.taskTimeoutMs() == null ? defaults.taskTimeoutMs() : file.taskTimeoutMs(),
                defaults.protocolVersion()
        );
    }

    public TaskWireConfig withSocketPath(String value) {
        return new TaskWireConfig(value, heartbeatIntervalMs, handshakeTimeoutMs, maxQueueSize, maxFrameSize,
                dedupWindowMs, dedupMaxEntries, taskTimeoutMs, protocolVersion);
    }

    public TaskWireConfig withHeartbeatIntervalMs(long value) {
        return new TaskWireConfig(socketPath, value, handshakeTimeoutMs, maxQueueSize, maxFrameSize,
                dedupWindowMs, dedupMaxEntries, taskTimeoutMs, protocolVersion);
    }

    public TaskWireConfig withHandshakeTimeoutMs(long value) {
        return new TaskWireConfig(socketPath, heartbeatIntervalMs, value, maxQueueSize, maxFrameSize,
                dedupWindowMs, dedupMaxEntries, taskTimeoutMs, protocolVersion);
    }

    public TaskWireConfig withMaxQueueSize(int value) {
        return new TaskWireConfig(socketPath, heartbeatIntervalMs, handshakeTimeoutMs, value, maxFrameSize,
                dedupWindowMs, dedupMaxEntries, taskTimeoutMs, protocolVersion);
    }

    public TaskWireConfig withMaxFrameSize(int value) {
        return new TaskWireConfig(socketPath, heartbeatIntervalMs, handshakeTimeoutMs, maxQueueSize, value,
                dedupWindowMs, dedupMaxEntries, taskTimeoutMs, protocolVersion);
    }

    public TaskWireConfig withDedupWindowMs(long value) {
        return new TaskWireConfig(socketPath, heartbeatIntervalMs, handshakeTimeoutMs, maxQueueSize, maxFrameSize,
                value, dedupMaxEntries, taskTimeoutMs, protocolVersion);
    }

    public TaskWireConfig withTaskTimeoutMs(long value) {
        return new TaskWireConfig(socketPath, heartbeatIntervalMs, handshakeTimeoutMs, maxQueueSize, maxFrameSize,
                dedupWindowMs, dedupMaxEntries, value, protocolVersion);
    }

    private static void requirePositive(String field, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be > 0: " + value);
        }
    }

    private record SettingsFile(
            String socketPath,
            Long heartbeatIntervalMs,
            Long handshakeTimeoutMs,
            Integer maxQueueSize,
            Integer maxFrameSize,
            Long dedupWindowMs,
            Integer dedupMaxEntries,
            Long taskTimeoutMs
    ) {
    }
}
