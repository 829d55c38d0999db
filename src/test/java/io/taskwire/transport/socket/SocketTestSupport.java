package io.taskwire.transport.socket;

import io.taskwire.config.TaskWireConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class SocketTestSupport {
    private SocketTestSupport() {
    }

    /**
     * Temp dir under /tmp; socket paths must stay short.
     */
    static Path tempDir() throws IOException {
        return Files.createTempDirectory(Path.of("/tmp"), "tw-");
    }

    static TaskWireConfig config(Path dir) {
        return TaskWireConfig.defaults().withSocketPath(dir.resolve("s.sock").toString());
    }

    static <T> T within(long timeoutMs, Callable<T> action) throws Exception {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return action.call();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }).get(timeoutMs, TimeUnit.MILLISECONDS);
    }

    static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000L;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10L);
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
