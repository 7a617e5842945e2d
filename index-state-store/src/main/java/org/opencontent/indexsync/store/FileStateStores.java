package org.opencontent.indexsync.store;

import java.nio.file.Path;

import lombok.Getter;

/**
 * The durable state of a deployment: index definitions and watermarks, kept side by side in
 * one directory.
 */
@Getter
public class FileStateStores {

    private final Path directory;
    private final FileIndexRegistry indexRegistry;
    private final FileWatermarkStore watermarkStore;

    private FileStateStores(Path directory) {
        this.directory = directory;
        this.indexRegistry = new FileIndexRegistry(directory.resolve(FileIndexRegistry.DEFAULT_FILE_NAME));
        this.watermarkStore = new FileWatermarkStore(directory.resolve(FileWatermarkStore.DEFAULT_FILE_NAME));
    }

    public static FileStateStores inDirectory(Path directory) {
        return new FileStateStores(directory);
    }
}
