package org.opencontent.indexsync.pipeline.scope;

import org.opencontent.indexsync.pipeline.build.DocumentBuilder;
import org.opencontent.indexsync.pipeline.source.RecordStore;

/**
 * Resources bound to one tenant for the duration of one batch. Closed when the batch ends,
 * whether it succeeded or not.
 */
public interface SyncScope extends AutoCloseable {

    RecordStore recordStore();

    DocumentBuilder documentBuilder();

    @Override
    default void close() {
        // Default no-op for scopes that don't hold resources
    }
}
