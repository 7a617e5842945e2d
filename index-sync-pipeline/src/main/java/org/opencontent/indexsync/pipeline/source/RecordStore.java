package org.opencontent.indexsync.pipeline.source;

import java.util.Map;
import java.util.Set;

import org.opencontent.indexsync.pipeline.ir.ContentRecord;

/**
 * Port for resolving records by id. Ids that no longer resolve (deleted, not yet published,
 * not accessible) are omitted from the result.
 */
public interface RecordStore {

    /**
     * Resolve many records in one lookup.
     *
     * @param recordIds ids to resolve
     * @param latestVersion true to read the latest working version, false for the published one
     * @return resolved records keyed by record id
     */
    Map<String, ContentRecord> resolveMany(Set<String> recordIds, boolean latestVersion);
}
