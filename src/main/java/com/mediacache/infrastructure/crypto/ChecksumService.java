package com.mediacache.infrastructure.crypto;

import com.mediacache.domain.model.CachedFileRecord;

/**
 * Keyed tamper-evidence for cached-file records.
 *
 * @since 1.0.0
 */
public interface ChecksumService {

    /**
     * Compute the checksum over the record's canonical fields. The stored
     * {@code checksum} and {@code lastVerifiedAt} are not inputs.
     *
     * @param record record to sign
     * @return lower-case hex digest
     */
    String compute(CachedFileRecord record);

    /**
     * Recompute and compare against the stored checksum in constant time.
     *
     * @return false when the stored checksum is missing or differs
     */
    boolean verify(CachedFileRecord record);
}
