package com.mediacache.domain.repository;

import com.mediacache.domain.model.CacheStatistics;
import com.mediacache.domain.model.CachedFileRecord;
import com.mediacache.domain.model.CachedFilesFilter;
import com.mediacache.domain.model.RecordState;
import com.mediacache.domain.model.UserContext;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for cached-file records.
 *
 * <p>Implementations must enforce:
 * <ul>
 *   <li>An authorization check as the first step of every method, before a pool checkout</li>
 *   <li>Parameterized queries only</li>
 *   <li>One immediate-mode transaction around every multi-statement write</li>
 *   <li>Checksum recomputation on every state transition</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface CacheRepository {

    /**
     * Insert a new PENDING record.
     *
     * @param record record in state PENDING, checksum not yet set
     * @param context caller, needs WRITE
     * @return the stored record with its checksum
     * @throws com.mediacache.application.exceptions.ConflictException if a live record
     *         already exists for the original path
     */
    CachedFileRecord insert(CachedFileRecord record, UserContext context);

    /**
     * PENDING to COMMITTED, deleting any stale FAILED rows for the same original path in
     * the same transaction.
     *
     * @param id record id
     * @param sizeBytes size of the relocated payload
     * @param context caller, needs WRITE
     */
    CachedFileRecord markCommitted(String id, long sizeBytes, UserContext context);

    /**
     * PENDING to FAILED.
     *
     * @param id record id
     * @param reason short failure reason stored with the record
     * @param context caller, needs WRITE
     */
    CachedFileRecord markFailed(String id, String reason, UserContext context);

    /**
     * COMMITTED to REMOVED. Rejected with a conflict when the record is still PENDING.
     *
     * @param id record id
     * @param context caller, needs DELETE
     */
    CachedFileRecord remove(String id, UserContext context);

    /**
     * Delete REMOVED records whose last update is older than {@code olderThan}.
     *
     * @param context caller, needs ADMIN
     * @return number of rows deleted
     */
    int purgeRemoved(Duration olderThan, UserContext context);

    List<CachedFileRecord> listByState(RecordState state, UserContext context);

    /**
     * The live record for a path if there is one, otherwise the most recent terminal one.
     */
    Optional<CachedFileRecord> findByOriginalPath(Path originalPath, UserContext context);

    Optional<CachedFileRecord> findById(String id, UserContext context);

    List<CachedFileRecord> search(CachedFilesFilter filter, UserContext context);

    CacheStatistics statistics(UserContext context);

    /**
     * Recompute and compare checksums for a batch of records and stamp
     * {@code lastVerifiedAt} on the rows that were read.
     *
     * @param ids record ids
     * @param context caller, needs ADMIN
     * @return record id to checksum-match flag, for every id that exists
     */
    Map<String, Boolean> verifyIntegrity(Collection<String> ids, UserContext context);
}
