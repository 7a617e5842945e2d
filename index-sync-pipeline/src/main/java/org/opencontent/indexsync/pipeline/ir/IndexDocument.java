package org.opencontent.indexsync.pipeline.ir;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Field set built for one record and handed to the index engine. Handlers append entries;
 * several entries may share a name (multi-valued fields).
 */
@ToString
@EqualsAndHashCode
public class IndexDocument {

    @Getter
    private final String recordId;
    private final List<Entry> entries = new ArrayList<>();

    public IndexDocument(String recordId) {
        this.recordId = Objects.requireNonNull(recordId, "recordId");
    }

    public IndexDocument set(String name, String value, EntryOption... options) {
        return add(new Entry(name, value, EntryType.TEXT, toSet(options)));
    }

    public IndexDocument set(String name, Number value, EntryOption... options) {
        EntryType type = (value instanceof Double || value instanceof Float || value instanceof BigDecimal)
            ? EntryType.NUMBER
            : EntryType.INTEGER;
        return add(new Entry(name, value, type, toSet(options)));
    }

    public IndexDocument set(String name, boolean value, EntryOption... options) {
        return add(new Entry(name, value, EntryType.BOOLEAN, toSet(options)));
    }

    public IndexDocument set(String name, Instant value, EntryOption... options) {
        return add(new Entry(name, value, EntryType.DATE, toSet(options)));
    }

    public IndexDocument add(Entry entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
        return this;
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /** First entry with the given name, if any. */
    public Optional<Entry> getEntry(String name) {
        return entries.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    private static Set<EntryOption> toSet(EntryOption[] options) {
        if (options == null || options.length == 0) {
            return EnumSet.noneOf(EntryOption.class);
        }
        return EnumSet.copyOf(List.of(options));
    }

    public record Entry(
        String name,
        Object value,
        EntryType type,
        Set<EntryOption> options
    ) {
        public Entry {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Entry name must not be blank");
            }
            Objects.requireNonNull(type, "type");
            options = options == null || options.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(options));
        }
    }

    public enum EntryType {
        TEXT,
        INTEGER,
        NUMBER,
        BOOLEAN,
        DATE
    }

    public enum EntryOption {
        STORE,
        ANALYZE,
        SANITIZE
    }
}
