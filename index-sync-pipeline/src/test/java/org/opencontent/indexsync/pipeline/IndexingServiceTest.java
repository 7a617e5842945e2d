package org.opencontent.indexsync.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.opencontent.indexsync.pipeline.build.HandlerChainDocumentBuilder;
import org.opencontent.indexsync.pipeline.ir.ContentRecord;
import org.opencontent.indexsync.pipeline.ir.IndexDefinition;
import org.opencontent.indexsync.pipeline.ir.IndexDocument;
import org.opencontent.indexsync.pipeline.lock.InProcessIndexingLock;
import org.opencontent.indexsync.pipeline.lock.IndexingLock;
import org.opencontent.indexsync.pipeline.scope.SyncScopeFactory;
import org.opencontent.indexsync.pipeline.sink.CollectingIndexEngine;
import org.opencontent.indexsync.pipeline.sink.CollectingIndexEngine.CommandType;
import org.opencontent.indexsync.pipeline.source.InMemoryRecordStore;
import org.opencontent.indexsync.pipeline.source.InMemoryTaskLog;
import org.opencontent.indexsync.pipeline.state.InMemoryIndexRegistry;
import org.opencontent.indexsync.pipeline.state.InMemoryWatermarkStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests index lifecycle operations and their interplay with synchronization passes.
 */
class IndexingServiceTest {

    private InMemoryTaskLog taskLog;
    private InMemoryRecordStore recordStore;
    private InMemoryIndexRegistry registry;
    private InMemoryWatermarkStore watermarks;
    private CollectingIndexEngine engine;
    private InProcessIndexingLock lock;
    private IndexingService service;

    @BeforeEach
    void setUp() {
        taskLog = new InMemoryTaskLog();
        recordStore = new InMemoryRecordStore();
        registry = new InMemoryIndexRegistry();
        watermarks = new InMemoryWatermarkStore();
        engine = new CollectingIndexEngine();
        lock = new InProcessIndexingLock();
        var synchronizer = new IndexSynchronizer(taskLog, registry, watermarks, engine,
            SyncScopeFactory.shared(recordStore, HandlerChainDocumentBuilder.withDefaultHandlers()),
            SyncOptions.defaults());
        service = new IndexingService(synchronizer, registry, watermarks, engine, lock, Duration.ofMillis(200));
    }

    private void publishPages(String... ids) {
        for (String id : ids) {
            recordStore.publish(ContentRecord.of(id, "page"));
            taskLog.appendUpdate(id);
        }
    }

    @Test
    void createIndexRegistersAndBuildsFromScratch() {
        var definition = IndexDefinition.of("idx1", Set.of("page"), false);

        service.createIndex(definition);

        assertEquals(Optional.of(definition), registry.findDefinition("idx1"));
        assertEquals(List.of(CommandType.DELETE_INDEX, CommandType.CREATE_INDEX),
            engine.getCommands().stream().map(CollectingIndexEngine.Command::type).toList());
        assertTrue(engine.indexExists("idx1"));
        assertEquals(0, watermarks.getCommitted("idx1"));
        assertEquals(1, watermarks.getCommitCount());
    }

    @Test
    void createIndexRejectsDuplicateName() {
        service.createIndex(IndexDefinition.of("idx1", Set.of("page"), false));

        assertThrows(IllegalStateException.class,
            () -> service.createIndex(IndexDefinition.of("idx1", Set.of("article"), false)));
    }

    @Test
    void newIndexCatchesUpWithHistory() {
        publishPages("A", "B", "C");

        service.createIndex(IndexDefinition.of("idx1", Set.of("page"), false));
        var result = service.synchronize();

        assertEquals(3, result.tasksProcessed());
        assertEquals(3, engine.documentCount("idx1"));
        assertEquals(3, watermarks.getCommitted("idx1"));
    }

    @Test
    void resetReprocessesHistoryWithoutTouchingPhysicalIndex() {
        publishPages("A", "B", "C");
        service.createIndex(IndexDefinition.of("idx1", Set.of("page"), false));
        service.synchronize(Optional.of("idx1"));
        engine.clearCommands();

        service.resetIndex("idx1");
        assertEquals(0, watermarks.getCommitted("idx1"));
        service.synchronize(Optional.of("idx1"));

        var types = engine.getCommands().stream().map(CollectingIndexEngine.Command::type).toList();
        assertFalse(types.contains(CommandType.DELETE_INDEX));
        assertFalse(types.contains(CommandType.CREATE_INDEX));
        assertEquals(3, types.stream().filter(t -> t == CommandType.STORE_DOCUMENTS).count());
        assertEquals(3, watermarks.getCommitted("idx1"));
    }

    @Test
    void rebuildDropsDocumentsAndRepopulates() {
        publishPages("A", "B");
        service.createIndex(IndexDefinition.of("idx1", Set.of("page"), false));
        service.synchronize();
        recordStore.remove("B");

        service.rebuildIndex("idx1");
        assertEquals(0, engine.documentCount("idx1"));
        service.synchronize();

        assertTrue(engine.getDocument("idx1", "A").isPresent());
        assertFalse(engine.getDocument("idx1", "B").isPresent());
    }

    @Test
    void editedTypeFilterDoesNotRevisitPassedTasksUntilReset() {
        recordStore.publish(ContentRecord.of("A", "page")).publish(ContentRecord.of("B", "article"));
        taskLog.appendUpdate("A");
        taskLog.appendUpdate("B");
        service.createIndex(IndexDefinition.of("idx1", Set.of("page"), false));
        service.synchronize();

        service.editIndex(IndexDefinition.of("idx1", Set.of("page", "article"), false));
        service.synchronize();

        // known staleness: task 2 was already passed while articles were excluded
        assertFalse(engine.getDocument("idx1", "B").isPresent());
        assertEquals(Set.of("page", "article"), registry.findDefinition("idx1").orElseThrow().includedTypes());

        service.resetIndex("idx1");
        service.synchronize();

        assertTrue(engine.getDocument("idx1", "B").isPresent());
    }

    @Test
    void editUnknownIndexFails() {
        assertThrows(IllegalStateException.class,
            () -> service.editIndex(IndexDefinition.of("missing", Set.of("page"), false)));
    }

    @Test
    void deleteIndexDropsPhysicalIndexThenDefinition() {
        var definition = IndexDefinition.of("idx1", Set.of("page"), false);
        service.createIndex(definition);
        engine.clearCommands();

        service.deleteIndex(definition);

        assertEquals(List.of(new CollectingIndexEngine.Command(CommandType.DELETE_INDEX, "idx1", List.of())),
            engine.getCommands());
        assertTrue(registry.findDefinition("idx1").isEmpty());
        assertFalse(engine.indexExists("idx1"));
    }

    @Test
    void synchronizeAsyncEmitsResult() {
        publishPages("A");
        service.createIndex(IndexDefinition.of("idx1", Set.of("page"), false));

        StepVerifier.create(service.synchronizeAsync(Optional.empty()))
            .assertNext(result -> {
                assertEquals(List.of("idx1"), result.indexNames());
                assertEquals(1, result.tasksProcessed());
            })
            .verifyComplete();
    }

    @Test
    void passTimesOutWhileAnotherCallerHoldsTheIndex() throws Exception {
        service.createIndex(IndexDefinition.of("idx1", Set.of("page"), false));
        var held = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var holder = CompletableFuture.runAsync(() -> {
            try (var lease = lock.acquire(List.of("idx1"), Duration.ofSeconds(1))) {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(held.await(5, TimeUnit.SECONDS));

        try {
            assertThrows(IndexingLock.LockTimeoutException.class, () -> service.synchronize());
            assertThrows(IndexingLock.LockTimeoutException.class, () -> service.resetIndex("idx1"));
        } finally {
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        }

        assertFalse(lock.isLocked("idx1"));
        service.synchronize();
    }

    @Test
    void indexCreatedWhileLockingIsLockedBeforeItIsSynchronized() {
        var idx2 = IndexDefinition.of("idx2", Set.of("page"), false);
        var lockStates = new ArrayList<Boolean>();
        var racingRegistry = new InMemoryIndexRegistry(IndexDefinition.of("idx1", Set.of("page"), false)) {
            private boolean raced;

            @Override
            public synchronized List<IndexDefinition> listDefinitions() {
                List<IndexDefinition> listed = super.listDefinitions();
                if (!raced) {
                    raced = true;
                    createDefinition(idx2);
                }
                return listed;
            }
        };
        var lockCheckingEngine = new CollectingIndexEngine() {
            @Override
            public void storeDocuments(String indexName, Collection<IndexDocument> documents) {
                if (indexName.equals("idx2")) {
                    lockStates.add(lock.isLocked("idx2"));
                }
                super.storeDocuments(indexName, documents);
            }
        };
        var synchronizer = new IndexSynchronizer(taskLog, racingRegistry, watermarks, lockCheckingEngine,
            SyncScopeFactory.shared(recordStore, HandlerChainDocumentBuilder.withDefaultHandlers()),
            SyncOptions.defaults());
        var racingService = new IndexingService(synchronizer, racingRegistry, watermarks, lockCheckingEngine,
            lock, Duration.ofMillis(200));
        publishPages("A");

        var result = racingService.synchronize();

        assertEquals(List.of("idx1", "idx2"), result.indexNames());
        assertEquals(List.of(true), lockStates);
        assertTrue(lockCheckingEngine.getDocument("idx2", "A").isPresent());
        assertFalse(lock.isLocked("idx2"));
    }
}
