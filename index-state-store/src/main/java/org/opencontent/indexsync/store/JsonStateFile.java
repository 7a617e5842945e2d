package org.opencontent.indexsync.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A JSON document kept in one file. Writes go to a sibling temporary file which then replaces
 * the target, so readers never observe a partially written file.
 */
@Slf4j
class JsonStateFile<T> {

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Getter
    private final Path file;
    private final TypeReference<T> type;

    JsonStateFile(Path file, TypeReference<T> type) {
        this.file = file;
        this.type = type;
    }

    /** Contents of the file, or {@code whenMissing} if it does not exist yet. */
    T read(Supplier<T> whenMissing) {
        if (!Files.exists(file)) {
            log.debug("State file {} does not exist yet", file);
            return whenMissing.get();
        }
        try (InputStream stream = Files.newInputStream(file)) {
            T value = OBJECT_MAPPER.readValue(stream, type);
            log.debug("Read state file {}", file);
            return value == null ? whenMissing.get() : value;
        } catch (IOException e) {
            log.error("Failed to read state file {}: {}", file, e.getMessage());
            throw new StateStoreException("Failed to read state file", file, e);
        }
    }

    void write(T value) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream stream = Files.newOutputStream(temp)) {
                OBJECT_MAPPER.writeValue(stream, value);
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing in place", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote state file {}", file);
        } catch (IOException e) {
            log.error("Failed to write state file {}: {}", file, e.getMessage());
            throw new StateStoreException("Failed to write state file", file, e);
        }
    }
}
