package org.opencontent.indexsync.pipeline.build;

import org.opencontent.indexsync.pipeline.ir.IndexDocument.EntryOption;

/**
 * Adds the record id and content type so documents can be filtered by type.
 */
public class ContentTypeIndexHandler implements DocumentIndexHandler {

    public static final String RECORD_ID_FIELD = "ContentItemId";
    public static final String CONTENT_TYPE_FIELD = "ContentType";

    @Override
    public void buildIndex(BuildIndexContext context) {
        context.document()
            .set(RECORD_ID_FIELD, context.record().recordId(), EntryOption.STORE)
            .set(CONTENT_TYPE_FIELD, context.record().contentType(), EntryOption.STORE);
    }
}
