package org.opencontent.indexsync.pipeline.lock;

import java.time.Duration;
import java.util.Collection;

/**
 * Mutual exclusion for passes and lifecycle operations touching the same indices.
 */
public interface IndexingLock {

    /** A lock that never blocks, for deployments that serialize callers some other way. */
    IndexingLock NONE = (indexNames, timeout) -> () -> { };

    /**
     * Acquire the lock for every named index.
     *
     * @throws LockTimeoutException if the lock could not be obtained in time
     */
    Lease acquire(Collection<String> indexNames, Duration timeout);

    /** Held lock; closing it releases every index it covers. */
    @FunctionalInterface
    interface Lease extends AutoCloseable {
        @Override
        void close();
    }

    class LockTimeoutException extends RuntimeException {
        public LockTimeoutException(String message) {
            super(message);
        }
    }
}
