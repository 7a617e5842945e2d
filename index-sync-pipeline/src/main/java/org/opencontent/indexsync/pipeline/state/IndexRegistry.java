package org.opencontent.indexsync.pipeline.state;

import java.util.List;
import java.util.Optional;

import org.opencontent.indexsync.pipeline.ir.IndexDefinition;

/**
 * Durable list of index definitions, unique by name.
 */
public interface IndexRegistry {

    List<IndexDefinition> listDefinitions();

    Optional<IndexDefinition> findDefinition(String indexName);

    /** @throws IllegalStateException if a definition with the same name exists */
    void createDefinition(IndexDefinition definition);

    /** @throws IllegalStateException if no definition with that name exists */
    void updateDefinition(IndexDefinition definition);

    /** Removes the definition with the same name; absent definitions are ignored. */
    void deleteDefinition(IndexDefinition definition);
}
