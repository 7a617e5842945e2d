package org.opencontent.indexsync.pipeline.build;

import java.util.Set;

import org.opencontent.indexsync.pipeline.ir.ContentRecord;
import org.opencontent.indexsync.pipeline.ir.IndexDocument;

/**
 * Shared state handed to every handler while one document is being built.
 */
public record BuildIndexContext(
    IndexDocument document,
    ContentRecord record,
    Set<String> contentTypes
) {
    public BuildIndexContext {
        contentTypes = Set.copyOf(contentTypes);
    }
}
