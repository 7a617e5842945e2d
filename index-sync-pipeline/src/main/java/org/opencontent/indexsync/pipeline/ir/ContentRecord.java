package org.opencontent.indexsync.pipeline.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A record as resolved from the record store, either its published or its latest version.
 * Field values are plain JSON-like values (strings, numbers, booleans, nested maps or lists);
 * null values are kept and ignored by the built-in handlers.
 */
public record ContentRecord(
    String recordId,
    String contentType,
    Map<String, Object> fields
) {
    public ContentRecord {
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(contentType, "contentType");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ContentRecord of(String recordId, String contentType) {
        return new ContentRecord(recordId, contentType, Map.of());
    }
}
