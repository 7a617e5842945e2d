package org.opencontent.indexsync.pipeline.sink;

import java.util.Collection;

import org.opencontent.indexsync.pipeline.ir.IndexDocument;

/**
 * Port for writing to the physical full-text index. Deleting an absent index or document is a no-op.
 * Every call either completes or throws.
 */
public interface IndexEngine extends AutoCloseable {

    void createIndex(String indexName);

    void deleteIndex(String indexName);

    void storeDocuments(String indexName, Collection<IndexDocument> documents);

    void deleteDocuments(String indexName, Collection<String> recordIds);

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
