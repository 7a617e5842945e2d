package org.opencontent.indexsync.pipeline.build;

import java.util.List;
import java.util.Set;

import org.opencontent.indexsync.pipeline.ir.ContentRecord;
import org.opencontent.indexsync.pipeline.ir.IndexDocument;

import lombok.extern.slf4j.Slf4j;

/**
 * DocumentBuilder that runs an ordered list of handlers against a fresh document.
 * A failing handler fails the whole build.
 */
@Slf4j
public class HandlerChainDocumentBuilder implements DocumentBuilder {

    private final List<DocumentIndexHandler> handlers;

    public HandlerChainDocumentBuilder(List<DocumentIndexHandler> handlers) {
        this.handlers = List.copyOf(handlers);
    }

    public HandlerChainDocumentBuilder(DocumentIndexHandler... handlers) {
        this(List.of(handlers));
    }

    /** Chain with the built-in content type and content field handlers. */
    public static HandlerChainDocumentBuilder withDefaultHandlers() {
        return new HandlerChainDocumentBuilder(new ContentTypeIndexHandler(), new ContentFieldsIndexHandler());
    }

    @Override
    public IndexDocument build(ContentRecord record, Set<String> applicableTypes) {
        var context = new BuildIndexContext(new IndexDocument(record.recordId()), record, applicableTypes);
        for (DocumentIndexHandler handler : handlers) {
            try {
                handler.buildIndex(context);
            } catch (RuntimeException e) {
                throw new DocumentBuildException(record.recordId(), handler, e);
            }
        }
        log.atDebug().setMessage("Built document for {} with {} entries")
            .addArgument(record::recordId)
            .addArgument(() -> context.document().getEntries().size())
            .log();
        return context.document();
    }

    public static class DocumentBuildException extends RuntimeException {
        public DocumentBuildException(String recordId, DocumentIndexHandler handler, Throwable cause) {
            super("Handler " + handler.getClass().getName() + " failed for record " + recordId, cause);
        }
    }
}
