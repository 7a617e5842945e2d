package org.opencontent.indexsync.pipeline.scope;

import java.util.Objects;

import org.opencontent.indexsync.pipeline.build.DocumentBuilder;
import org.opencontent.indexsync.pipeline.source.RecordStore;

/**
 * Opens a fresh {@link SyncScope} for each batch.
 */
@FunctionalInterface
public interface SyncScopeFactory {

    SyncScope open();

    /** Factory whose scopes all share the same record store and builder and release nothing. */
    static SyncScopeFactory shared(RecordStore recordStore, DocumentBuilder documentBuilder) {
        Objects.requireNonNull(recordStore, "recordStore");
        Objects.requireNonNull(documentBuilder, "documentBuilder");
        SyncScope scope = new SyncScope() {
            @Override
            public RecordStore recordStore() {
                return recordStore;
            }

            @Override
            public DocumentBuilder documentBuilder() {
                return documentBuilder;
            }
        };
        return () -> scope;
    }
}
