package org.opencontent.indexsync.pipeline.build;

/**
 * Contributes entries to a document being built. Handlers run in registration order and
 * only ever append to {@link BuildIndexContext#document()}.
 */
@FunctionalInterface
public interface DocumentIndexHandler {

    void buildIndex(BuildIndexContext context);
}
