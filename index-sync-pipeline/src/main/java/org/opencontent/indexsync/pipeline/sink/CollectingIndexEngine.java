package org.opencontent.indexsync.pipeline.sink;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.opencontent.indexsync.pipeline.ir.IndexDocument;

/**
 * An in-memory IndexEngine that keeps the current documents of every index and records each
 * command it receives, in order. Used for tests and for embedding without a real index.
 */
public class CollectingIndexEngine implements IndexEngine {

    private final Map<String, Map<String, IndexDocument>> indices = new ConcurrentHashMap<>();
    private final List<Command> commands = new CopyOnWriteArrayList<>();

    @Override
    public void createIndex(String indexName) {
        commands.add(new Command(CommandType.CREATE_INDEX, indexName, List.of()));
        indices.putIfAbsent(indexName, Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    @Override
    public void deleteIndex(String indexName) {
        commands.add(new Command(CommandType.DELETE_INDEX, indexName, List.of()));
        indices.remove(indexName);
    }

    @Override
    public void storeDocuments(String indexName, Collection<IndexDocument> documents) {
        commands.add(new Command(
            CommandType.STORE_DOCUMENTS,
            indexName,
            documents.stream().map(IndexDocument::getRecordId).toList()
        ));
        var index = indices.computeIfAbsent(indexName, k -> Collections.synchronizedMap(new LinkedHashMap<>()));
        documents.forEach(doc -> index.put(doc.getRecordId(), doc));
    }

    @Override
    public void deleteDocuments(String indexName, Collection<String> recordIds) {
        commands.add(new Command(CommandType.DELETE_DOCUMENTS, indexName, List.copyOf(recordIds)));
        var index = indices.get(indexName);
        if (index != null) {
            recordIds.forEach(index::remove);
        }
    }

    public boolean indexExists(String indexName) {
        return indices.containsKey(indexName);
    }

    public Optional<IndexDocument> getDocument(String indexName, String recordId) {
        var index = indices.get(indexName);
        return index == null ? Optional.empty() : Optional.ofNullable(index.get(recordId));
    }

    public int documentCount(String indexName) {
        var index = indices.get(indexName);
        return index == null ? 0 : index.size();
    }

    public List<Command> getCommands() {
        return Collections.unmodifiableList(commands);
    }

    public List<Command> getCommands(String indexName) {
        return commands.stream().filter(c -> c.indexName().equals(indexName)).toList();
    }

    /** Forget recorded commands, keeping index contents. */
    public void clearCommands() {
        commands.clear();
    }

    public record Command(
        CommandType type,
        String indexName,
        List<String> recordIds
    ) {}

    public enum CommandType {
        CREATE_INDEX,
        DELETE_INDEX,
        STORE_DOCUMENTS,
        DELETE_DOCUMENTS
    }
}
