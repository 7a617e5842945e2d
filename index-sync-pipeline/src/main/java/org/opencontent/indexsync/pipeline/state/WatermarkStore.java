package org.opencontent.indexsync.pipeline.state;

/**
 * Per-index record of the last task id fully applied to that index.
 *
 * <p>Calls to {@link #set(String, long)} are pending until {@link #commit()} persists all of them
 * as one unit. {@link #get(String)} sees pending values.
 */
public interface WatermarkStore {

    /** Last applied task id for the index, 0 if the index was never synchronized. */
    long get(String indexName);

    void set(String indexName, long lastTaskId);

    /**
     * Durably persist every pending {@link #set(String, long)}. If persisting fails the pending
     * values are dropped and {@link #get(String)} returns the committed ones.
     */
    void commit();
}
