package org.opencontent.indexsync.pipeline;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tuning for synchronization passes.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class SyncOptions {

    public static final int DEFAULT_PAGE_SIZE = 100;

    /** Maximum number of tasks fetched and committed together. */
    @Builder.Default
    private final int pageSize = DEFAULT_PAGE_SIZE;

    @Builder.Default
    private final FailurePolicy failurePolicy = FailurePolicy.ABORT_PASS;

    public static SyncOptions defaults() {
        return SyncOptions.builder().build();
    }

    void validate() {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, was " + pageSize);
        }
        if (failurePolicy == null) {
            throw new IllegalArgumentException("failurePolicy must be set");
        }
    }

    public enum FailurePolicy {
        /** Stop the pass and leave the failing batch's watermarks uncommitted. */
        ABORT_PASS,
        /** Log the failing record and carry on; the batch still commits, so the record is not retried. */
        SKIP_RECORD
    }
}
