package io.github.drompincen.restochat.runtime.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per conversation thread, held for a whole turn. Entries are dropped once no
 * caller holds or waits for them.
 */
public class ThreadLockService {

    private static final Logger log = LoggerFactory.getLogger(ThreadLockService.class);

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock(true);
        int users;
    }

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public boolean tryAcquire(String threadId, Duration timeout) {
        Entry entry = locks.compute(threadId, (k, v) -> {
            Entry e = v != null ? v : new Entry();
            e.users++;
            return e;
        });
        try {
            if (entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Timed out after {} waiting for thread {}", timeout, threadId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for thread {}", threadId);
        }
        leave(threadId);
        return false;
    }

    public void release(String threadId) {
        Entry entry = locks.get(threadId);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            log.warn("Release of thread {} by a caller that does not hold it", threadId);
            return;
        }
        entry.lock.unlock();
        leave(threadId);
    }

    public boolean isLocked(String threadId) {
        Entry entry = locks.get(threadId);
        return entry != null && entry.lock.isLocked();
    }

    int trackedThreads() {
        return locks.size();
    }

    private void leave(String threadId) {
        locks.computeIfPresent(threadId, (k, v) -> --v.users == 0 ? null : v);
    }
}
