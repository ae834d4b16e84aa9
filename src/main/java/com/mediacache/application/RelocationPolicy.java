package com.mediacache.application;

import com.mediacache.domain.model.RelocationMethod;
import com.mediacache.domain.model.TriggerReason;
import lombok.RequiredArgsConstructor;

/**
 * Chooses the physical strategy for a relocation.
 *
 * <ol>
 *   <li>A file being streamed right now is copied securely, never re-linked.</li>
 *   <li>Mount preservation forces a symlink at the original path.</li>
 *   <li>Hardlink when enabled and both ends share a file store.</li>
 *   <li>Symlink when enabled.</li>
 *   <li>Plain copy otherwise.</li>
 * </ol>
 */
@RequiredArgsConstructor
public class RelocationPolicy {

    private final RelocationSettings settings;

    public RelocationMethod choose(TriggerReason reason, boolean sameFileStore) {
        if (reason != null && reason.requiresSecureCopy()) {
            return RelocationMethod.SECURE_COPY;
        }
        if (settings.isMountPreservation()) {
            return RelocationMethod.SYMLINK;
        }
        if (settings.isHardlinkEnabled() && sameFileStore) {
            return RelocationMethod.HARDLINK;
        }
        if (settings.isSymlinkEnabled()) {
            return RelocationMethod.SYMLINK;
        }
        return RelocationMethod.COPY;
    }
}
