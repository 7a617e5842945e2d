package org.opencontent.indexsync.pipeline.ir;

import java.util.List;
import java.util.OptionalLong;

/**
 * Outcome of one synchronization pass: the batches that were committed, in order.
 */
public record SyncResult(
    List<String> indexNames,
    List<BatchCursor> batches
) {
    private static final SyncResult EMPTY = new SyncResult(List.of(), List.of());

    public SyncResult {
        indexNames = List.copyOf(indexNames);
        batches = List.copyOf(batches);
    }

    public static SyncResult empty() {
        return EMPTY;
    }

    public long tasksProcessed() {
        return batches.stream().mapToLong(BatchCursor::tasksInBatch).sum();
    }

    public long documentsStored() {
        return batches.stream().mapToLong(BatchCursor::documentsStored).sum();
    }

    public long documentsDeleted() {
        return batches.stream().mapToLong(BatchCursor::documentsDeleted).sum();
    }

    /** Last task id committed by this pass, or empty when nothing was fetched. */
    public OptionalLong lastTaskId() {
        return batches.isEmpty()
            ? OptionalLong.empty()
            : OptionalLong.of(batches.get(batches.size() - 1).lastTaskId());
    }
}
