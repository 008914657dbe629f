package com.dedupstore.core.dedup;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-fingerprint mutual exclusion inside this process. Entries are dropped when the last
 * holder or waiter leaves, so the map only holds fingerprints currently in use.
 */
@Component
public class FingerprintLocks {
    
    private final ConcurrentHashMap<String, Holder> locks = new ConcurrentHashMap<>();
    
    public <T> T withLock(String fingerprint, Supplier<T> action) {
        Holder holder = locks.compute(fingerprint, (key, existing) -> {
            Holder h = existing != null ? existing : new Holder();
            h.users++;
            return h;
        });
        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(fingerprint, (key, h) -> --h.users == 0 ? null : h);
        }
    }
    
    int activeCount() {
        return locks.size();
    }
    
    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        private int users; // guarded by the map's per-key compute
    }
}
