package com.privatedocs.qa.service.resilience;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentLockRegistryTest {

    private final DocumentLockRegistry registry = new DocumentLockRegistry();

    @Test
    void sameKeyIsMutuallyExclusive() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int j = 0; j < 50; j++) {
                        registry.runWithLock(DocumentLockRegistry.documentKey("d1"), () -> {
                            int current = inside.incrementAndGet();
                            maxInside.accumulateAndGet(current, Math::max);
                            Thread.yield();
                            inside.decrementAndGet();
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside).hasValue(1);
    }

    @Test
    void differentKeysDoNotBlockEachOther() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = pool.submit(() -> registry.runWithLock(DocumentLockRegistry.documentKey("d1"), () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            String result = registry.withLock(DocumentLockRegistry.documentKey("d2"), () -> "done");

            assertThat(result).isEqualTo("done");
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void exclusiveSectionWaitsForKeyedWorkInFlight() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> events = new CopyOnWriteArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> keyed = pool.submit(() -> registry.runWithLock(DocumentLockRegistry.documentKey("d1"), () -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                events.add("keyed");
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            Future<String> exclusive = pool.submit(() -> registry.withExclusiveLock(() -> {
                events.add("exclusive");
                return "cleared";
            }));
            Thread.sleep(100);
            assertThat(exclusive.isDone()).isFalse();

            release.countDown();
            keyed.get(5, TimeUnit.SECONDS);
            assertThat(exclusive.get(5, TimeUnit.SECONDS)).isEqualTo("cleared");
        } finally {
            pool.shutdownNow();
        }

        assertThat(events).containsExactly("keyed", "exclusive");
    }

    @Test
    void keyedWorkWaitsForExclusiveSection() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> events = new CopyOnWriteArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> exclusive = pool.submit(() -> registry.withExclusiveLock(() -> {
                held.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                events.add("exclusive");
                return null;
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            Future<?> keyed = pool.submit(() -> registry.runWithLock(DocumentLockRegistry.documentKey("d1"),
                    () -> events.add("keyed")));
            Thread.sleep(100);
            assertThat(keyed.isDone()).isFalse();

            release.countDown();
            exclusive.get(5, TimeUnit.SECONDS);
            keyed.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(events).containsExactly("exclusive", "keyed");
    }

    @Test
    void lockIsReentrantAndKeysAreDistinct() {
        String result = registry.withLock("k", () -> registry.withLock("k", () -> "nested"));

        assertThat(result).isEqualTo("nested");
        assertThat(DocumentLockRegistry.documentKey("a")).isNotEqualTo(DocumentLockRegistry.contentKey("a", "h"));
    }
}
