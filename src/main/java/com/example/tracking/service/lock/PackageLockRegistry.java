package com.example.tracking.service.lock;

import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work per tracking number.
 *
 * Merges, deletes and snapshot reads for the same tracking number run one at a time;
 * different tracking numbers never wait on each other.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PackageLockRegistry {

    private final LoadingCache<String, ReentrantLock> packageLockCache;

    public <T> T withLock(String trackingNumber, Supplier<T> action) {
        ReentrantLock lock = packageLockCache.get(trackingNumber);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(String trackingNumber, Runnable action) {
        withLock(trackingNumber, () -> {
            action.run();
            return null;
        });
    }

    /**
     * True if another thread currently holds the lock for this tracking number.
     */
    public boolean isLocked(String trackingNumber) {
        ReentrantLock lock = packageLockCache.getIfPresent(trackingNumber);
        return lock != null && lock.isLocked();
    }

    /**
     * Get cache statistics for monitoring.
     */
    public LockStats getStats() {
        var stats = packageLockCache.stats();
        return new LockStats(packageLockCache.estimatedSize(), stats.loadCount());
    }

    /**
     * Lock cache statistics record.
     */
    public record LockStats(long activeLocks, long created) {}
}
