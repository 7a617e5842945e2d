package org.opencontent.indexsync.pipeline.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.opencontent.indexsync.pipeline.ir.IndexDefinition;

/**
 * IndexRegistry held in memory, listing definitions in creation order.
 */
public class InMemoryIndexRegistry implements IndexRegistry {

    private final Map<String, IndexDefinition> definitions = new LinkedHashMap<>();

    public InMemoryIndexRegistry(IndexDefinition... initial) {
        for (IndexDefinition definition : initial) {
            createDefinition(definition);
        }
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
        if (definitions.putIfAbsent(definition.name(), definition) != null) {
            throw new IllegalStateException("Index already defined: " + definition.name());
        }
    }

    @Override
    public synchronized void updateDefinition(IndexDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        if (definitions.replace(definition.name(), definition) == null) {
            throw new IllegalStateException("Index not defined: " + definition.name());
        }
    }

    @Override
    public synchronized void deleteDefinition(IndexDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        definitions.remove(definition.name());
    }
}
