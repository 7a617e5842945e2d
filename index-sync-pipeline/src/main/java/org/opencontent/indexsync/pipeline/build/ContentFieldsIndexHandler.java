package org.opencontent.indexsync.pipeline.build;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

import org.opencontent.indexsync.pipeline.ir.IndexDocument;
import org.opencontent.indexsync.pipeline.ir.IndexDocument.EntryOption;

import lombok.extern.slf4j.Slf4j;

/**
 * Copies record fields into the document, prefixed with the content type. Nested maps are
 * flattened with a dot separator and collections become multi-valued entries. Instants are indexed as dates.
 */
@Slf4j
public class ContentFieldsIndexHandler implements DocumentIndexHandler {

    @Override
    public void buildIndex(BuildIndexContext context) {
        String prefix = context.record().contentType();
        context.record().fields().forEach((name, value) -> append(context.document(), prefix + "." + name, value));
    }

    private void append(IndexDocument document, String name, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String text) {
            document.set(name, text, EntryOption.ANALYZE, EntryOption.SANITIZE);
        } else if (value instanceof Number number) {
            document.set(name, number, EntryOption.STORE);
        } else if (value instanceof Boolean flag) {
            document.set(name, flag.booleanValue(), EntryOption.STORE);
        } else if (value instanceof Instant instant) {
            document.set(name, instant, EntryOption.STORE);
        } else if (value instanceof Map<?, ?> nested) {
            nested.forEach((key, nestedValue) -> append(document, name + "." + key, nestedValue));
        } else if (value instanceof Collection<?> values) {
            values.forEach(item -> append(document, name, item));
        } else {
            log.debug("Indexing field {} of type {} as text", name, value.getClass().getSimpleName());
            document.set(name, value.toString(), EntryOption.ANALYZE);
        }
    }
}
