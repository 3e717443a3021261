package com.privatedocs.qa.service.resilience;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Lazily created per-key locks. Values are weakly held, so a lock disappears once no thread references it.
 * <p>
 * Every keyed section also holds the shared side of an index-wide gate, so {@link #withExclusiveLock} waits for
 * in-flight keyed work and keeps new keyed work out until it returns.
 */
@Component
public class DocumentLockRegistry {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    private final ReentrantReadWriteLock indexGate = new ReentrantReadWriteLock();

    public <T> T withLock(String key, Supplier<T> action) {
        Lock shared = indexGate.readLock();
        shared.lock();
        try {
            ReentrantLock lock = locks.get(key);
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        } finally {
            shared.unlock();
        }
    }

    public void runWithLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public <T> T withExclusiveLock(Supplier<T> action) {
        Lock exclusive = indexGate.writeLock();
        exclusive.lock();
        try {
            return action.get();
        } finally {
            exclusive.unlock();
        }
    }

    public static String documentKey(String documentId) {
        return "doc:" + documentId;
    }

    public static String contentKey(String ownerId, String contentHash) {
        return "content:" + ownerId + ":" + contentHash;
    }
}
