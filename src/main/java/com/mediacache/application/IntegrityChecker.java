package com.mediacache.application;

import com.mediacache.application.exceptions.CacheEngineException;
import com.mediacache.application.exceptions.FilesystemException;
import com.mediacache.domain.model.CachedFileRecord;
import com.mediacache.domain.model.Permission;
import com.mediacache.domain.model.RecordState;
import com.mediacache.domain.model.UserContext;
import com.mediacache.domain.repository.CacheRepository;
import com.mediacache.infrastructure.audit.AuditEventTypes;
import com.mediacache.infrastructure.audit.AuditLogger;
import com.mediacache.infrastructure.filesystem.CacheLayout;
import com.mediacache.infrastructure.filesystem.FilesystemOperations;
import com.mediacache.infrastructure.filesystem.PathLockManager;
import com.mediacache.infrastructure.security.AuthorizationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reconciles metadata rows with their checksums and with the filesystem.
 *
 * <p>{@link #verify} only reports. Repairs are the separate, explicit
 * {@link #cleanupOrphans} operation.
 */
@RequiredArgsConstructor
@Slf4j
public class IntegrityChecker {

    static final String STALE_PENDING_REASON = "Recovered stale pending record";

    private final CacheRepository repository;
    private final AuthorizationManager authorization;
    private final FilesystemOperations filesystem;
    private final PathLockManager locks;
    private final CacheLayout layout;
    private final AuditLogger auditLogger;
    private final RelocationMetrics metrics;
    private final Clock clock;
    private final int batchSize;
    private final Duration lockTimeout;

    public IntegrityReport verify(UserContext context) {
        authorization.authorize(context, Permission.ADMIN, "integrity.verify");
        Instant started = Instant.now(clock);

        List<IntegrityFinding> findings = new ArrayList<>();
        for (RecordState state : RecordState.values()) {
            List<CachedFileRecord> records = repository.listByState(state, context);
            for (int from = 0; from < records.size(); from += batchSize) {
                List<CachedFileRecord> batch = records.subList(from, Math.min(records.size(), from + batchSize));
                Map<String, Boolean> checksums = repository.verifyIntegrity(
                    batch.stream().map(CachedFileRecord::getId).collect(Collectors.toList()), context);
                for (CachedFileRecord record : batch) {
                    boolean checksumValid = checksums.getOrDefault(record.getId(), false);
                    findings.add(new IntegrityFinding(record.getId(), record.getOriginalPath(), record.getState(),
                        checksumValid, pathStatus(record)));
                }
            }
        }

        IntegrityReport report = new IntegrityReport(started, List.copyOf(findings));
        for (IntegrityFinding finding : report.getInconsistencies()) {
            metrics.recordIntegrityMismatch(finding.isChecksumValid() ? finding.getPathStatus().name() : "CHECKSUM");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("recordId", finding.getRecordId());
            details.put("state", finding.getState().name());
            details.put("checksumValid", finding.isChecksumValid());
            details.put("pathStatus", finding.getPathStatus().name());
            auditLogger.failure(AuditEventTypes.INTEGRITY_FAILURE, context, finding.getOriginalPath().toString(),
                "integrity.verify", details);
            log.warn("Integrity mismatch: record={}, path={}, checksumValid={}, pathStatus={}",
                finding.getRecordId(), Encode.forJava(finding.getOriginalPath().toString()),
                finding.isChecksumValid(), finding.getPathStatus());
        }
        auditLogger.record(AuditEventTypes.INTEGRITY_VERIFICATION, context, "cache", "integrity.verify",
            report.isClean(), Map.of("checked", report.getChecked(),
                "inconsistent", report.getInconsistencies().size()));
        log.info("Integrity pass complete: checked={}, inconsistent={}",
            report.getChecked(), report.getInconsistencies().size());
        return report;
    }

    /**
     * Repair what interrupted relocations and vanished cache artifacts left behind:
     * <ul>
     *   <li>COMMITTED records whose cache artifact is gone are retired, restoring a dangling
     *       symlinked original from its backup first;</li>
     *   <li>PENDING records no relocation holds a lock for are rolled back on disk and marked
     *       FAILED;</li>
     *   <li>backups whose original is a regular file again are deleted.</li>
     * </ul>
     *
     * @return number of records retired or recovered
     */
    public int cleanupOrphans(UserContext context) {
        authorization.authorize(context, Permission.ADMIN, "integrity.cleanupOrphans");
        List<String> failed = new ArrayList<>();
        int retired = retireOrphans(context, failed);
        int recovered = recoverStalePending(context, failed);
        int backupsDeleted = deleteOrphanedBackups(failed);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cleaned", retired);
        details.put("recovered", recovered);
        details.put("backupsDeleted", backupsDeleted);
        details.put("failed", failed.size());
        auditLogger.record(AuditEventTypes.ORPHAN_CLEANUP, context, "cache", "integrity.cleanupOrphans",
            failed.isEmpty(), details);
        log.info("Orphan cleanup complete: retired={}, recovered={}, backupsDeleted={}, failed={}",
            retired, recovered, backupsDeleted, failed.size());
        return retired + recovered;
    }

    private int retireOrphans(UserContext context, List<String> failed) {
        int retired = 0;
        for (CachedFileRecord record : repository.listByState(RecordState.COMMITTED, context)) {
            if (filesystem.exists(record.getCachedPath())) {
                continue;
            }
            try (PathLockManager.Lease lease = locks.acquire(
                List.of(record.getOriginalPath(), record.getCachedPath()), lockTimeout)) {
                if (!filesystem.exists(record.getCachedPath())) {
                    restoreFromBackup(record.getOriginalPath());
                }
                repository.remove(record.getId(), context);
                retired++;
                log.info("Orphaned record retired: id={}, path={}", record.getId(),
                    Encode.forJava(record.getOriginalPath().toString()));
            } catch (IOException | CacheEngineException e) {
                failed.add(record.getId());
                log.warn("Could not clean orphaned record {}: {}", record.getId(), e.getMessage());
            }
        }
        return retired;
    }

    private int recoverStalePending(UserContext context, List<String> failed) {
        int recovered = 0;
        for (CachedFileRecord record : repository.listByState(RecordState.PENDING, context)) {
            Path original = record.getOriginalPath();
            Path cached = record.getCachedPath();
            if (locks.isLocked(original) || locks.isLocked(cached)) {
                continue;
            }
            try (PathLockManager.Lease lease = locks.acquire(List.of(original, cached), lockTimeout)) {
                boolean stillPending = repository.findById(record.getId(), context)
                    .map(current -> current.getState() == RecordState.PENDING)
                    .orElse(false);
                if (!stillPending) {
                    continue;
                }
                undoPendingArtifacts(record);
                repository.markFailed(record.getId(), STALE_PENDING_REASON, context);
                recovered++;
                log.info("Stale pending record recovered: id={}, path={}", record.getId(),
                    Encode.forJava(original.toString()));
            } catch (IOException | CacheEngineException e) {
                failed.add(record.getId());
                log.warn("Could not recover pending record {}: {}", record.getId(), e.getMessage());
            }
        }
        return recovered;
    }

    private void undoPendingArtifacts(CachedFileRecord record) throws IOException {
        Path original = record.getOriginalPath();
        Path cached = record.getCachedPath();
        if (filesystem.isSymbolicLink(original)) {
            if (!restoreFromBackup(original)) {
                throw new FilesystemException("Original is a symlink without a backup; cached payload kept");
            }
        }
        filesystem.deleteTemporarySiblings(original);
        filesystem.deleteTemporarySiblings(cached);
        if (filesystem.exists(original)) {
            filesystem.deleteIfExists(cached);
        } else {
            log.warn("Original {} is missing; cached payload kept", Encode.forJava(original.toString()));
        }
    }

    private int deleteOrphanedBackups(List<String> failed) {
        int deleted = 0;
        for (Path root : layout.getOriginRoots()) {
            List<Path> backups;
            try {
                backups = filesystem.findFiles(root, layout::isBackupName);
            } catch (IOException e) {
                failed.add(root.toString());
                log.warn("Could not scan {} for backups: {}", Encode.forJava(root.toString()), e.getMessage());
                continue;
            }
            for (Path backup : backups) {
                Path original = layout.originalForBackup(backup);
                try (PathLockManager.Lease lease = locks.acquire(List.of(original), lockTimeout)) {
                    if (filesystem.isRegularFile(original) && filesystem.deleteIfExists(backup)) {
                        deleted++;
                        log.info("Orphaned backup deleted: {}", Encode.forJava(backup.toString()));
                    }
                } catch (IOException | CacheEngineException e) {
                    failed.add(backup.toString());
                    log.warn("Could not delete backup {}: {}", Encode.forJava(backup.toString()), e.getMessage());
                }
            }
        }
        return deleted;
    }

    /**
     * Swap a symlinked original back to its backup.
     *
     * @return false when the original is a symlink and no backup exists
     */
    private boolean restoreFromBackup(Path original) throws IOException {
        if (!filesystem.isSymbolicLink(original)) {
            return true;
        }
        Path backup = layout.backupPathFor(original);
        if (!filesystem.exists(backup)) {
            log.warn("Original {} is a symlink and has no backup", Encode.forJava(original.toString()));
            return false;
        }
        Path staged = filesystem.temporarySibling(original);
        try {
            filesystem.createHardLink(staged, backup);
            filesystem.moveAtomically(staged, original);
        } catch (IOException e) {
            filesystem.deleteIfExists(staged);
            throw e;
        }
        filesystem.deleteIfExists(backup);
        return true;
    }

    PathStatus pathStatus(CachedFileRecord record) {
        if (record.getState() == RecordState.PENDING) {
            return locks.isLocked(record.getOriginalPath()) ? PathStatus.OK : PathStatus.STALE_PENDING;
        }
        if (record.getState() != RecordState.COMMITTED) {
            return PathStatus.NOT_CHECKED;
        }

        Path original = record.getOriginalPath();
        Path cached = record.getCachedPath();
        try {
            if (!filesystem.exists(cached)) {
                return PathStatus.CACHE_MISSING;
            }
            if (!filesystem.exists(original)) {
                return PathStatus.ORIGIN_MISSING;
            }
            switch (record.getMethod()) {
                case SYMLINK:
                    if (!filesystem.isSymbolicLink(original)) {
                        return PathStatus.DIVERGED;
                    }
                    return filesystem.readSymbolicLink(original).equals(cached)
                        ? PathStatus.OK : PathStatus.LINK_BROKEN;
                case HARDLINK:
                    return filesystem.isSameFile(original, cached) ? PathStatus.OK : PathStatus.DIVERGED;
                default:
                    return filesystem.size(cached) == record.getSizeBytes()
                        ? PathStatus.OK : PathStatus.SIZE_MISMATCH;
            }
        } catch (IOException e) {
            log.debug("Cannot inspect {}: {}", Encode.forJava(original.toString()), e.getMessage());
            return PathStatus.DIVERGED;
        }
    }
}
