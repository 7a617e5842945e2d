package org.opencontent.indexsync.store;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;

import org.opencontent.indexsync.pipeline.ir.IndexDefinition;
import org.opencontent.indexsync.pipeline.state.IndexRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * IndexRegistry persisted as a JSON array of definitions. Every change rewrites the file.
 */
@Slf4j
public class FileIndexRegistry implements IndexRegistry {

    public static final String DEFAULT_FILE_NAME = "index-definitions.json";

    private static final TypeReference<List<IndexDefinition>> DEFINITIONS_TYPE = new TypeReference<>() {};

    private final JsonStateFile<List<IndexDefinition>> stateFile;
    private Map<String, IndexDefinition> definitions = new LinkedHashMap<>();

    public FileIndexRegistry(Path file) {
        this.stateFile = new JsonStateFile<>(file, DEFINITIONS_TYPE);
        for (IndexDefinition definition : stateFile.read(List::of)) {
            definitions.put(definition.name(), definition);
        }
        log.info("Loaded {} index definition(s) from {}", definitions.size(), file);
    }

    @Override
    public synchronized List<IndexDefinition> listDefinitions() {
        return new ArrayList<>(definitions.values());
    }

    @Override
    public synchronized Optional<IndexDefinition> findDefinition(String indexName) {
        return Optional.ofNullable(definitions.get(indexName));
    }

    @Override
    public synchronized void createDefinition(IndexDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        if (definitions.containsKey(definition.name())) {
            throw new IllegalStateException("Index already defined: " + definition.name());
        }
        var next = new LinkedHashMap<>(definitions);
        next.put(definition.name(), definition);
        save(next);
    }

    @Override
    public synchronized void updateDefinition(IndexDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        if (!definitions.containsKey(definition.name())) {
            throw new IllegalStateException("Index not defined: " + definition.name());
        }
        var next = new LinkedHashMap<>(definitions);
        next.put(definition.name(), definition);
        save(next);
    }

    @Override
    public synchronized void deleteDefinition(IndexDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        if (definitions.containsKey(definition.name())) {
            var next = new LinkedHashMap<>(definitions);
            next.remove(definition.name());
            save(next);
        }
    }

    /** Writes the given definitions and only then makes them visible. */
    private void save(Map<String, IndexDefinition> next) {
        stateFile.write(new ArrayList<>(next.values()));
        definitions = next;
    }
}
