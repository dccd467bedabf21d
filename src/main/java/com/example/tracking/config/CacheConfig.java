package com.example.tracking.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Caffeine configuration.
 *
 * PACKAGE LOCK CACHE - one ReentrantLock per tracking number
 *    - weak values: a lock stays in the cache while any thread holds a reference to it
 *      and is reclaimed once idle
 *    - no size bound is applied; a bounded cache could evict a lock that is in use
 *      and hand a second thread a different lock for the same key
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.locks.initial-capacity:256}")
    private int lockInitialCapacity;

    @Bean
    public LoadingCache<String, ReentrantLock> packageLockCache() {
        log.info("Creating package lock cache: initialCapacity={}, weakValues=true", lockInitialCapacity);
        return newPackageLockCache(lockInitialCapacity);
    }

    public static LoadingCache<String, ReentrantLock> newPackageLockCache(int initialCapacity) {
        return Caffeine.newBuilder()
                .initialCapacity(initialCapacity)
                .weakValues()
                .recordStats()
                .build(key -> new ReentrantLock());
    }
}
