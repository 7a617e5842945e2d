package org.opencontent.indexsync.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class FileWatermarkStoreTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("state/indexing-state.json");
    }

    @Test
    void missingFileMeansEveryIndexStartsAtZero() {
        var store = new FileWatermarkStore(file);

        assertEquals(0, store.get("idx1"));
        assertFalse(Files.exists(file));
    }

    @Test
    void pendingValuesAreVisibleButOnlyCommitPersistsThem() {
        var store = new FileWatermarkStore(file);
        store.set("idx1", 100);

        assertEquals(100, store.get("idx1"));
        assertEquals(0, new FileWatermarkStore(file).get("idx1"));

        store.commit();

        assertEquals(100, new FileWatermarkStore(file).get("idx1"));
    }

    @Test
    void commitWritesAllPendingValuesAsOneDocument() throws IOException {
        var store = new FileWatermarkStore(file);
        store.set("idx1", 100);
        store.commit();
        store.set("idx2", 40);
        store.set("idx1", 140);
        store.commit();

        Map<String, Long> written = JsonStateFile.OBJECT_MAPPER.readValue(file.toFile(), new TypeReference<Map<String, Long>>() {});
        assertEquals(Map.of("idx1", 140L, "idx2", 40L), written);
        assertFalse(Files.exists(file.resolveSibling("indexing-state.json.tmp")));
    }

    @Test
    void resetToZeroIsPersisted() {
        var store = new FileWatermarkStore(file);
        store.set("idx1", 100);
        store.commit();
        store.set("idx1", 0);
        store.commit();

        assertEquals(0, new FileWatermarkStore(file).get("idx1"));
    }

    @Test
    void negativeWatermarkIsRejected() {
        var store = new FileWatermarkStore(file);
        assertThrows(IllegalArgumentException.class, () -> store.set("idx1", -1));
    }

    @Test
    void corruptFileIsReported() throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        var failure = assertThrows(StateStoreException.class, () -> new FileWatermarkStore(file));
        assertTrue(failure.getMessage().contains(file.toString()));
    }

    @Test
    void failedCommitFallsBackToCommittedValues() throws IOException {
        var store = new FileWatermarkStore(file);
        store.set("idx1", 100);
        store.commit();
        Path blockedTemp = Files.createDirectory(file.resolveSibling("indexing-state.json.tmp"));

        store.set("idx1", 200);
        assertThrows(StateStoreException.class, store::commit);

        assertEquals(100, store.get("idx1"));
        Files.delete(blockedTemp);
        store.commit();
        assertEquals(100, new FileWatermarkStore(file).get("idx1"));
    }
}
