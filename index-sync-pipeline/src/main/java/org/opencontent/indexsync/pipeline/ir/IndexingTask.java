package org.opencontent.indexsync.pipeline.ir;

import java.util.Objects;

/**
 * One entry of the task log: a record changed and every index that covers it may need to
 * re-index it. Task ids are globally ordered and never reused.
 */
public record IndexingTask(
    long id,
    String recordId,
    Type type
) {
    public IndexingTask {
        if (id < 1) {
            throw new IllegalArgumentException("Task id must be positive, was " + id);
        }
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(type, "type");
    }

    public static IndexingTask update(long id, String recordId) {
        return new IndexingTask(id, recordId, Type.UPDATE);
    }

    public static IndexingTask delete(long id, String recordId) {
        return new IndexingTask(id, recordId, Type.DELETE);
    }

    public enum Type {
        UPDATE,
        DELETE
    }
}
