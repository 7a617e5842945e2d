package org.opencontent.indexsync.store;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.type.TypeReference;

import org.opencontent.indexsync.pipeline.state.WatermarkStore;

import lombok.extern.slf4j.Slf4j;

/**
 * WatermarkStore persisted as a JSON object mapping index names to their last applied task id.
 * The file is loaded once at construction and rewritten as a whole on every commit. A commit that
 * fails to write drops its pending values.
 */
@Slf4j
public class FileWatermarkStore implements WatermarkStore {

    public static final String DEFAULT_FILE_NAME = "indexing-state.json";

    private static final TypeReference<TreeMap<String, Long>> STATE_TYPE = new TypeReference<>() {};

    private final JsonStateFile<TreeMap<String, Long>> stateFile;
    private TreeMap<String, Long> committed;
    private final Map<String, Long> pending = new HashMap<>();

    public FileWatermarkStore(Path file) {
        this.stateFile = new JsonStateFile<>(file, STATE_TYPE);
        this.committed = stateFile.read(TreeMap::new);
        log.info("Loaded {} watermark(s) from {}", committed.size(), file);
    }

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
        if (pending.isEmpty()) {
            return;
        }
        var next = new TreeMap<>(committed);
        next.putAll(pending);
        // a failed write discards the pending values so readers fall back to the committed ones
        try {
            stateFile.write(next);
            committed = next;
        } finally {
            pending.clear();
        }
    }

    public Path getFile() {
        return stateFile.getFile();
    }
}
