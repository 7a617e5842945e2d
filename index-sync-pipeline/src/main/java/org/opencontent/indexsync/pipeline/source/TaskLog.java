package org.opencontent.indexsync.pipeline.source;

import java.util.List;

import org.opencontent.indexsync.pipeline.ir.IndexingTask;

/**
 * Port for reading the append-only task log. The synchronizer only ever reads forward.
 */
public interface TaskLog {

    /**
     * Read up to {@code limit} tasks whose id is strictly greater than {@code afterId},
     * ordered by ascending id.
     */
    List<IndexingTask> fetch(long afterId, int limit);
}
