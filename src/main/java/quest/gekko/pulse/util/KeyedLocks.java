package quest.gekko.pulse.util;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per key, held weakly so idle keys are collected.
 */
public class KeyedLocks<K> {
    private final LoadingCache<K, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(k -> new ReentrantLock());

    public <T> T withLock(K key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
