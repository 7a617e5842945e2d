package org.opencontent.indexsync.pipeline;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.opencontent.indexsync.pipeline.ir.IndexDefinition;
import org.opencontent.indexsync.pipeline.ir.SyncResult;
import org.opencontent.indexsync.pipeline.lock.IndexingLock;
import org.opencontent.indexsync.pipeline.sink.IndexEngine;
import org.opencontent.indexsync.pipeline.state.IndexRegistry;
import org.opencontent.indexsync.pipeline.state.WatermarkStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point for managing indices and keeping them current.
 *
 * <p>Every operation holds the {@link IndexingLock} of the indices it touches for its whole
 * duration. Pass {@link IndexingLock#NONE} when callers already serialize access.
 */
@Slf4j
public class IndexingService {

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(30);

    private final IndexSynchronizer synchronizer;
    private final IndexRegistry indexRegistry;
    private final WatermarkStore watermarkStore;
    private final IndexEngine indexEngine;
    private final IndexingLock lock;
    private final Duration lockTimeout;

    public IndexingService(IndexSynchronizer synchronizer,
                           IndexRegistry indexRegistry,
                           WatermarkStore watermarkStore,
                           IndexEngine indexEngine,
                           IndexingLock lock,
                           Duration lockTimeout) {
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
        this.indexRegistry = Objects.requireNonNull(indexRegistry, "indexRegistry");
        this.watermarkStore = Objects.requireNonNull(watermarkStore, "watermarkStore");
        this.indexEngine = Objects.requireNonNull(indexEngine, "indexEngine");
        this.lock = Objects.requireNonNull(lock, "lock");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    }

    public IndexingService(IndexSynchronizer synchronizer,
                           IndexRegistry indexRegistry,
                           WatermarkStore watermarkStore,
                           IndexEngine indexEngine,
                           IndexingLock lock) {
        this(synchronizer, indexRegistry, watermarkStore, indexEngine, lock, DEFAULT_LOCK_TIMEOUT);
    }

    /** Synchronize all indices, or only the named one when present. */
    public SyncResult synchronize(Optional<String> indexName) {
        if (indexName.isPresent()) {
            try (var lease = lock.acquire(List.of(indexName.get()), lockTimeout)) {
                return synchronizer.synchronize(indexName);
            }
        }
        // indices created between listing and locking are picked up by locking again
        while (true) {
            Set<String> lockedNames = namesOf(indexRegistry.listDefinitions());
            try (var lease = lock.acquire(lockedNames, lockTimeout)) {
                List<IndexDefinition> workingSet = indexRegistry.listDefinitions();
                if (lockedNames.containsAll(namesOf(workingSet))) {
                    return synchronizer.synchronizeDefinitions(workingSet);
                }
                log.debug("Index definitions changed while locking {}, locking again", lockedNames);
            }
        }
    }

    public SyncResult synchronize() {
        return synchronize(Optional.empty());
    }

    /** Runs {@link #synchronize(Optional)} on a bounded elastic worker. */
    public Mono<SyncResult> synchronizeAsync(Optional<String> indexName) {
        return Mono.fromCallable(() -> synchronize(indexName))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /** Registers a new index and builds it from scratch. */
    public void createIndex(IndexDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        log.info("Creating index {} for types {}", definition.name(), definition.includedTypes());
        try (var lease = lock.acquire(List.of(definition.name()), lockTimeout)) {
            indexRegistry.createDefinition(definition);
            rebuildUnlocked(definition.name());
        }
    }

    /**
     * Stores the new definition. Documents already in the index are not revisited: a changed type
     * filter only applies to tasks after the index's watermark until the index is reset or rebuilt.
     */
    public void editIndex(IndexDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        log.info("Updating index {} to types {}", definition.name(), definition.includedTypes());
        try (var lease = lock.acquire(List.of(definition.name()), lockTimeout)) {
            indexRegistry.updateDefinition(definition);
        }
    }

    /** Drops the physical index and forgets its definition. */
    public void deleteIndex(IndexDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        log.info("Deleting index {}", definition.name());
        try (var lease = lock.acquire(List.of(definition.name()), lockTimeout)) {
            indexEngine.deleteIndex(definition.name());
            indexRegistry.deleteDefinition(definition);
        }
    }

    /**
     * Restarts synchronization of the index from the first task. Existing documents stay in the
     * index until a later task replaces or deletes them.
     */
    public void resetIndex(String indexName) {
        try (var lease = lock.acquire(List.of(indexName), lockTimeout)) {
            resetUnlocked(indexName);
        }
    }

    /** Drops and recreates the physical index, then restarts synchronization from the first task. */
    public void rebuildIndex(String indexName) {
        try (var lease = lock.acquire(List.of(indexName), lockTimeout)) {
            rebuildUnlocked(indexName);
        }
    }

    private static Set<String> namesOf(List<IndexDefinition> definitions) {
        Set<String> names = new LinkedHashSet<>();
        definitions.forEach(definition -> names.add(definition.name()));
        return names;
    }

    private void rebuildUnlocked(String indexName) {
        log.info("Rebuilding index {}", indexName);
        indexEngine.deleteIndex(indexName);
        indexEngine.createIndex(indexName);
        resetUnlocked(indexName);
    }

    private void resetUnlocked(String indexName) {
        log.info("Resetting watermark of index {}", indexName);
        watermarkStore.set(indexName, 0L);
        watermarkStore.commit();
    }
}
