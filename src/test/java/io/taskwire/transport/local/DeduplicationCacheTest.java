package io.taskwire.transport.local;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

final class DeduplicationCacheTest {

    @Test
    void repeatsInsideWindowAreDuplicates() {
        AtomicLong clock = new AtomicLong(1_000L);
        DeduplicationCache cache = new DeduplicationCache(5_000L, 100, clock::get);

        Assertions.assertTrue(cache.register("a"));
        clock.addAndGet(4_999L);
        Assertions.assertFalse(cache.register("a"));
        clock.addAndGet(1L);
        Assertions.assertTrue(cache.register("a"));
    }

    @Test
    void blankIdsAreNeverTracked() {
        DeduplicationCache cache = new DeduplicationCache(5_000L, 100, () -> 0L);

        Assertions.assertTrue(cache.register(""));
        Assertions.assertTrue(cache.register(""));
        Assertions.assertEquals(0, cache.size());
    }

    @Test
    void sweepEvictsExpiredThenSoonestToExpire() {
        AtomicLong clock = new AtomicLong(0L);
        DeduplicationCache cache = new DeduplicationCache(10_000L, 2, clock::get);
        cache.register("old");
        clock.set(1_000L);
        cache.register("b");
        clock.set(2_000L);
        cache.register("c");
        clock.set(3_000L);
        cache.register("d");
        clock.set(10_500L);

        int evicted = cache.sweep();

        Assertions.assertEquals(2, evicted);
        Assertions.assertEquals(2, cache.size());
        Assertions.assertFalse(cache.register("c"));
        Assertions.assertFalse(cache.register("d"));
        Assertions.assertTrue(cache.register("b"));
    }

    @Test
    void forgottenIdIsNewAgain() {
        DeduplicationCache cache = new DeduplicationCache(60_000L, 10, () -> 0L);
        cache.register("retry-me");
        cache.forget("retry-me");

        Assertions.assertTrue(cache.register("retry-me"));
    }
}
