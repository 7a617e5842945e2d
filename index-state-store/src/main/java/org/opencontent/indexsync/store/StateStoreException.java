package org.opencontent.indexsync.store;

import java.nio.file.Path;

/**
 * Reading or writing a state file failed.
 */
public class StateStoreException extends RuntimeException {
    public StateStoreException(String message, Path file, Throwable cause) {
        super(message + ": " + file, cause);
    }
}
