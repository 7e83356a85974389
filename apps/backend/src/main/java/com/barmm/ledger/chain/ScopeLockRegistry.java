package com.barmm.ledger.chain;

import com.barmm.ledger.error.StorageException;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 每个 scope 一把排它锁，覆盖“读链尾 -> 算 hash -> 写入”整个过程。
 * 弱引用 value：没有线程持有的锁可以被回收，项目再多也不会无限增长。
 */
@Slf4j
@Component
public class ScopeLockRegistry {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock(true));

    public <T> T withLock(ChainScope scope, Duration timeout, Supplier<T> action) {
        ReentrantLock lock = locks.get(scope.key());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for chain lock " + scope.key(), e);
        }
        if (!acquired) {
            log.warn("Chain lock wait timed out scope={} timeout={}", scope.key(), timeout);
            throw new StorageException("Timed out after " + timeout + " waiting for chain lock " + scope.key());
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
