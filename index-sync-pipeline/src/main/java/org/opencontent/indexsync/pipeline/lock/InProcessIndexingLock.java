package org.opencontent.indexsync.pipeline.lock;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import lombok.extern.slf4j.Slf4j;

/**
 * IndexingLock for a single process. One reentrant lock per index name, always taken in name
 * order so that callers locking overlapping sets cannot deadlock.
 */
@Slf4j
public class InProcessIndexingLock implements IndexingLock {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public Lease acquire(Collection<String> indexNames, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        Deque<ReentrantLock> held = new ArrayDeque<>();
        try {
            for (String indexName : new TreeSet<>(indexNames)) {
                ReentrantLock lock = locks.computeIfAbsent(indexName, k -> new ReentrantLock());
                long remaining = Math.max(0L, deadline - System.nanoTime());
                if (!lock.tryLock(remaining, TimeUnit.NANOSECONDS)) {
                    throw new LockTimeoutException("Timed out after " + timeout + " waiting for index " + indexName);
                }
                held.push(lock);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseAll(held);
            throw new LockTimeoutException("Interrupted while waiting for " + indexNames);
        } catch (RuntimeException e) {
            releaseAll(held);
            throw e;
        }
        log.debug("Acquired indexing lock for {}", indexNames);
        return () -> releaseAll(held);
    }

    /** True if some thread currently holds the lock of that index. */
    public boolean isLocked(String indexName) {
        ReentrantLock lock = locks.get(indexName);
        return lock != null && lock.isLocked();
    }

    private static void releaseAll(Deque<ReentrantLock> held) {
        while (!held.isEmpty()) {
            held.pop().unlock();
        }
    }
}
