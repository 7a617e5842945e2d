package org.opencontent.indexsync.pipeline.build;

import java.util.Set;

import org.opencontent.indexsync.pipeline.ir.ContentRecord;
import org.opencontent.indexsync.pipeline.ir.IndexDocument;

/**
 * Builds the document to store for a record.
 */
public interface DocumentBuilder {

    /**
     * @param record the resolved record
     * @param applicableTypes content types the document is built for
     */
    IndexDocument build(ContentRecord record, Set<String> applicableTypes);
}
