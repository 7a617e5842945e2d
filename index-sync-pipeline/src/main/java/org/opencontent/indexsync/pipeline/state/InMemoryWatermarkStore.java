package org.opencontent.indexsync.pipeline.state;

import java.util.HashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

/**
 * Watermark store that keeps committed values in memory only. Pending values are visible to
 * {@link #get(String)} but are only reported by {@link #getCommitted(String)} after a commit.
 */
@Slf4j
public class InMemoryWatermarkStore implements WatermarkStore {

    private final Map<String, Long> committed = new HashMap<>();
    private final Map<String, Long> pending = new HashMap<>();
    private int commitCount;

    @Override
    public synchronized long get(String indexName) {
        Long value = pending.get(indexName);
        if (value == null) {
            value = committed.get(indexName);
        }
        return value == null ? 0L : value;
    }

    @Override
    public synchronized void set(String indexName, long lastTaskId) {
        if (lastTaskId < 0) {
            throw new IllegalArgumentException("Watermark must not be negative, was " + lastTaskId);
        }
        pending.put(indexName, lastTaskId);
    }

    @Override
    public synchronized void commit() {
        log.debug("Committing {} watermark(s)", pending.size());
        committed.putAll(pending);
        pending.clear();
        commitCount++;
    }

    public synchronized long getCommitted(String indexName) {
        return committed.getOrDefault(indexName, 0L);
    }

    public synchronized int getCommitCount() {
        return commitCount;
    }
}
