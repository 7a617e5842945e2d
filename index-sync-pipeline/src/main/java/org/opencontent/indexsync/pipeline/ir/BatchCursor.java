package org.opencontent.indexsync.pipeline.ir;

/**
 * Progress cursor emitted after each batch of tasks has been applied and its watermarks committed.
 */
public record BatchCursor(
    long lastTaskId,
    int tasksInBatch,
    int documentsDeleted,
    int documentsStored
) {}
