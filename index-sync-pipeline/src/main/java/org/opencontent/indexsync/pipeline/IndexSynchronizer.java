package org.opencontent.indexsync.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.opencontent.indexsync.pipeline.ir.BatchCursor;
import org.opencontent.indexsync.pipeline.ir.ContentRecord;
import org.opencontent.indexsync.pipeline.ir.IndexDefinition;
import org.opencontent.indexsync.pipeline.ir.IndexDocument;
import org.opencontent.indexsync.pipeline.ir.IndexingTask;
import org.opencontent.indexsync.pipeline.ir.SyncResult;
import org.opencontent.indexsync.pipeline.scope.SyncScope;
import org.opencontent.indexsync.pipeline.scope.SyncScopeFactory;
import org.opencontent.indexsync.pipeline.sink.IndexEngine;
import org.opencontent.indexsync.pipeline.source.TaskLog;
import org.opencontent.indexsync.pipeline.state.IndexRegistry;
import org.opencontent.indexsync.pipeline.state.WatermarkStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Brings indices up to date with the task log.
 *
 * <p>A pass starts from the lowest watermark of the indices it covers and reads the task log
 * forward one page at a time. For each page, every index that includes the record's content type
 * and has not yet seen the task gets a delete of the record's document, followed by a store of a
 * freshly built document when the task is an update. Watermarks are committed once per page, after
 * the whole page has been applied.
 *
 * <p>Not safe for concurrent passes over overlapping indices; callers serialize passes with an
 * external lock such as {@link org.opencontent.indexsync.pipeline.lock.IndexingLock}.
 */
@Slf4j
public class IndexSynchronizer {

    private final TaskLog taskLog;
    private final IndexRegistry indexRegistry;
    private final WatermarkStore watermarkStore;
    private final IndexEngine indexEngine;
    private final SyncScopeFactory scopeFactory;
    private final SyncOptions options;

    public IndexSynchronizer(TaskLog taskLog,
                             IndexRegistry indexRegistry,
                             WatermarkStore watermarkStore,
                             IndexEngine indexEngine,
                             SyncScopeFactory scopeFactory,
                             SyncOptions options) {
        this.taskLog = Objects.requireNonNull(taskLog, "taskLog");
        this.indexRegistry = Objects.requireNonNull(indexRegistry, "indexRegistry");
        this.watermarkStore = Objects.requireNonNull(watermarkStore, "watermarkStore");
        this.indexEngine = Objects.requireNonNull(indexEngine, "indexEngine");
        this.scopeFactory = Objects.requireNonNull(scopeFactory, "scopeFactory");
        this.options = Objects.requireNonNull(options, "options");
        options.validate();
    }

    /** Synchronize every defined index. */
    public SyncResult synchronize() {
        return synchronize(Optional.empty());
    }

    /** Synchronize the named index only; unknown names are ignored. */
    public SyncResult synchronize(String indexName) {
        return synchronize(Optional.of(indexName));
    }

    public SyncResult synchronize(Optional<String> indexName) {
        return synchronizeDefinitions(selectWorkingSet(indexName));
    }

    /**
     * Synchronize exactly the given definitions, without consulting the registry. Callers that lock
     * indices read the definitions once under their lock and pass them here.
     */
    public SyncResult synchronizeDefinitions(List<IndexDefinition> workingSet) {
        if (workingSet.isEmpty()) {
            log.debug("No index to synchronize");
            return SyncResult.empty();
        }

        Map<String, Long> watermarks = new LinkedHashMap<>();
        for (IndexDefinition definition : workingSet) {
            watermarks.put(definition.name(), watermarkStore.get(definition.name()));
        }
        long cursor = watermarks.values().stream().mapToLong(Long::longValue).min().orElse(0L);
        var indexNames = List.copyOf(watermarks.keySet());
        log.info("Synchronizing {} starting after task {}", indexNames, cursor);

        List<BatchCursor> batches = new ArrayList<>();
        try {
            List<IndexingTask> batch = List.of();
            do {
                try (SyncScope scope = scopeFactory.open()) {
                    batch = taskLog.fetch(cursor, options.getPageSize());
                    if (batch.isEmpty()) {
                        break;
                    }
                    BatchCursor batchCursor = applyBatch(scope, workingSet, watermarks, cursor, batch);
                    cursor = batchCursor.lastTaskId();
                    batches.add(batchCursor);
                }
            } while (batch.size() == options.getPageSize());
        } catch (RuntimeException e) {
            log.atError().setMessage("Synchronization of {} aborted after {} committed batch(es)")
                .addArgument(indexNames)
                .addArgument(batches::size)
                .setCause(e)
                .log();
            throw e;
        }

        var result = new SyncResult(indexNames, batches);
        log.info("Synchronized {}: {} task(s) in {} batch(es), {} stored, {} deleted",
            indexNames, result.tasksProcessed(), batches.size(), result.documentsStored(), result.documentsDeleted());
        return result;
    }

    private List<IndexDefinition> selectWorkingSet(Optional<String> indexName) {
        if (indexName.isPresent()) {
            return indexRegistry.findDefinition(indexName.get()).map(List::of).orElse(List.of());
        }
        return indexRegistry.listDefinitions();
    }

    private BatchCursor applyBatch(SyncScope scope,
                                   List<IndexDefinition> workingSet,
                                   Map<String, Long> watermarks,
                                   long cursor,
                                   List<IndexingTask> batch) {
        long lastTaskId = batch.get(batch.size() - 1).id();
        if (lastTaskId <= cursor) {
            throw new IllegalStateException("Task log returned task " + lastTaskId + " when asked for tasks after " + cursor);
        }
        log.debug("Applying {} task(s) up to {}", batch.size(), lastTaskId);

        Set<String> recordIds = new LinkedHashSet<>();
        batch.forEach(task -> recordIds.add(task.recordId()));

        var counts = new BatchCounts();
        for (IndexDefinition definition : workingSet) {
            if (!definition.isActive()) {
                continue;
            }
            Map<String, ContentRecord> records = scope.recordStore()
                .resolveMany(recordIds, definition.indexLatestVersion());
            long watermark = watermarks.get(definition.name());

            for (IndexingTask task : batch) {
                ContentRecord record = records.get(task.recordId());
                if (record == null || !definition.includes(record.contentType()) || task.id() <= watermark) {
                    continue;
                }
                try {
                    applyTask(scope, definition, task, record, counts);
                } catch (RuntimeException e) {
                    handleFailure(definition, task, e);
                }
            }
        }

        for (Map.Entry<String, Long> entry : watermarks.entrySet()) {
            if (entry.getValue() < lastTaskId) {
                watermarkStore.set(entry.getKey(), lastTaskId);
                entry.setValue(lastTaskId);
            }
        }
        watermarkStore.commit();

        return new BatchCursor(lastTaskId, batch.size(), counts.deleted, counts.stored);
    }

    private void applyTask(SyncScope scope,
                           IndexDefinition definition,
                           IndexingTask task,
                           ContentRecord record,
                           BatchCounts counts) {
        indexEngine.deleteDocuments(definition.name(), List.of(task.recordId()));
        counts.deleted++;

        if (task.type() == IndexingTask.Type.UPDATE) {
            IndexDocument document = scope.documentBuilder().build(record, Set.of(record.contentType()));
            indexEngine.storeDocuments(definition.name(), List.of(document));
            counts.stored++;
        }
    }

    private void handleFailure(IndexDefinition definition, IndexingTask task, RuntimeException e) {
        if (options.getFailurePolicy() == SyncOptions.FailurePolicy.SKIP_RECORD) {
            log.atWarn().setMessage("Skipping record {} (task {}) on index {}")
                .addArgument(task.recordId())
                .addArgument(task.id())
                .addArgument(definition.name())
                .setCause(e)
                .log();
            return;
        }
        throw new SyncFailedException(definition.name(), task, e);
    }

    private static class BatchCounts {
        private int deleted;
        private int stored;
    }

    /**
     * A record could not be applied to an index; the pass stopped before committing its batch.
     */
    public static class SyncFailedException extends RuntimeException {
        private final String indexName;
        private final long taskId;

        public SyncFailedException(String indexName, IndexingTask task, Throwable cause) {
            super("Failed to apply task " + task.id() + " (record " + task.recordId() + ") to index " + indexName, cause);
            this.indexName = indexName;
            this.taskId = task.id();
        }

        public String getIndexName() {
            return indexName;
        }

        public long getTaskId() {
            return taskId;
        }
    }
}
