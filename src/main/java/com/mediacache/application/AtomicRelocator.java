package com.mediacache.application;

import com.mediacache.application.exceptions.CacheEngineException;
import com.mediacache.application.exceptions.ConflictException;
import com.mediacache.application.exceptions.FilesystemException;
import com.mediacache.application.exceptions.ResourceExhaustedException;
import com.mediacache.application.exceptions.ValidationException;
import com.mediacache.domain.model.CachedFileRecord;
import com.mediacache.domain.model.Permission;
import com.mediacache.domain.model.RecordState;
import com.mediacache.domain.model.RelocationMethod;
import com.mediacache.domain.model.TriggerReason;
import com.mediacache.domain.model.UserContext;
import com.mediacache.domain.repository.CacheRepository;
import com.mediacache.infrastructure.audit.AuditEventTypes;
import com.mediacache.infrastructure.audit.AuditLogger;
import com.mediacache.infrastructure.filesystem.CacheLayout;
import com.mediacache.infrastructure.filesystem.Deadline;
import com.mediacache.infrastructure.filesystem.FilesystemOperations;
import com.mediacache.infrastructure.filesystem.PathExistenceOracle;
import com.mediacache.infrastructure.filesystem.PathLockManager;
import com.mediacache.infrastructure.filesystem.RollbackJournal;
import com.mediacache.infrastructure.security.AuthorizationManager;
import com.mediacache.infrastructure.security.PathValidator;
import com.mediacache.infrastructure.security.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Moves media payloads between origin and cache storage without ever exposing a broken
 * consumer-visible path.
 *
 * <p>Every request runs on the bounded relocation pool and holds the per-path locks for the
 * original and cached paths from the first check until the database commit. Physical steps
 * write to a temporary name and are renamed into place atomically; each step registers its
 * compensating action in a {@link RollbackJournal}. Any failure undoes the journal, marks the
 * record FAILED and writes one audit event.
 *
 * <p>Authorization is checked and paths are validated on the caller's thread before the
 * request is queued, so rejected requests never touch the pool, the database or the
 * filesystem.
 */
@RequiredArgsConstructor
@Slf4j
public class AtomicRelocator {

    private final CacheRepository repository;
    private final AuthorizationManager authorization;
    private final PathValidator validator;
    private final CacheLayout layout;
    private final FilesystemOperations filesystem;
    private final PathLockManager locks;
    private final PathExistenceOracle existence;
    private final RelocationPolicy policy;
    private final RelocationSettings settings;
    private final AuditLogger auditLogger;
    private final RelocationMetrics metrics;
    private final TaskExecutor executor;
    private final Clock clock;

    /**
     * Cache a file and wait for the outcome, bounded by the operation timeout.
     */
    public RelocationOutcome cache(String rawPath, TriggerReason reason, UserContext context) {
        return submitCache(rawPath, reason, context).await(settings.getOperationTimeout());
    }

    /**
     * Release a cached file and wait for the outcome, bounded by the operation timeout.
     */
    public RelocationOutcome release(String rawPath, UserContext context) {
        return submitRelease(rawPath, context).await(settings.getOperationTimeout());
    }

    public RelocationHandle submitCache(String rawPath, TriggerReason reason, UserContext context) {
        authorization.authorize(context, Permission.WRITE, "relocation.cache");
        TriggerReason effectiveReason = reason != null ? reason : TriggerReason.MANUAL;
        Path original = validateOriginal(rawPath, context, "relocation.cache");
        Path cached = validate(layout.cachedPathFor(original).toString(), context, "relocation.cache");

        RelocationHandle handle = new RelocationHandle(UUID.randomUUID(), RelocationOutcome.Kind.CACHE, original);
        return dispatch(handle, () -> runCache(handle, original, cached, effectiveReason, context));
    }

    public RelocationHandle submitRelease(String rawPath, UserContext context) {
        authorization.authorize(context, Permission.DELETE, "relocation.release");
        Path original = validateOriginal(rawPath, context, "relocation.release");

        RelocationHandle handle = new RelocationHandle(UUID.randomUUID(), RelocationOutcome.Kind.RELEASE, original);
        return dispatch(handle, () -> runRelease(handle, original, context));
    }

    /**
     * Validate a caller-supplied original path: allow-listed, inside an origin root, safe
     * filename. Rejections are audited.
     *
     * @throws ValidationException when the path is rejected
     */
    public Path validateOriginal(String rawPath, UserContext context, String operation) {
        Path original = validate(rawPath, context, operation);
        try {
            layout.originRootOf(original);
        } catch (ValidationException e) {
            auditValidationFailure(context, rawPath, operation, e.getMessage());
            throw e;
        }
        ValidationResult<String> filename = validator.validateFilename(original.getFileName().toString());
        if (!filename.isValid()) {
            auditValidationFailure(context, rawPath, operation, filename.getReason());
            throw new ValidationException(filename.getReason());
        }
        return original;
    }

    private Path validate(String rawPath, UserContext context, String operation) {
        ValidationResult<Path> result = validator.validate(rawPath, layout.getAllowedBases());
        if (!result.isValid()) {
            auditValidationFailure(context, rawPath, operation, result.getReason());
            throw new ValidationException(result.getReason());
        }
        return result.getValue();
    }

    private RelocationHandle dispatch(RelocationHandle handle, Supplier<RelocationOutcome> work) {
        try {
            executor.execute(() -> {
                if (handle.isDone()) {
                    return;
                }
                try {
                    handle.complete(work.get());
                } catch (RuntimeException e) {
                    handle.fail(e, handle.getPhase().isTerminal() ? handle.getPhase() : RelocationPhase.FAILED);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Relocation queue full, rejecting request {}", handle.getRequestId());
            throw new ResourceExhaustedException("Relocation queue is full", e);
        }
        return handle;
    }

    private PathLockManager.Lease lock(List<Path> paths, UserContext context, String operation, Path original) {
        try {
            return locks.acquire(paths, settings.getLockTimeout());
        } catch (ConflictException e) {
            auditLogger.failure(AuditEventTypes.OPERATION_FAILURE, context, original.toString(), operation,
                Map.of("reason", e.getMessage(), "code", e.getCode().name()));
            throw e;
        }
    }

    // ---------------------------------------------------------------- cache

    private RelocationOutcome runCache(RelocationHandle handle, Path original, Path cached,
                                       TriggerReason reason, UserContext context) {
        Deadline deadline = Deadline.after(settings.getOperationTimeout(), clock);
        try (PathLockManager.Lease lease = lock(List.of(original, cached), context, "relocation.cache", original)) {
            if (!handle.beginStaging()) {
                auditLogger.success(AuditEventTypes.RELOCATION_CANCELLED, context, original.toString(),
                    "relocation.cache", Map.of("phase", RelocationPhase.IDLE.name()));
                return RelocationOutcome.cancelled(RelocationOutcome.Kind.CACHE, original);
            }

            RollbackJournal journal = new RollbackJournal();
            CachedFileRecord pending = null;
            RelocationMethod method = null;
            try {
                Optional<CachedFileRecord> existing = repository.findByOriginalPath(original, context);
                if (existing.isPresent() && existing.get().getState() == RecordState.COMMITTED) {
                    return alreadyCached(existing.get(), context);
                }
                if (existing.isPresent() && existing.get().getState() == RecordState.PENDING) {
                    throw new ConflictException("A relocation record is still pending for this path");
                }
                if (filesystem.isSymbolicLink(original)) {
                    throw new ConflictException("Original path is already a symbolic link");
                }
                if (!existence.exists(original) || !filesystem.isRegularFile(original)) {
                    throw new ValidationException("Source file does not exist");
                }
                if (filesystem.exists(cached)) {
                    throw new ConflictException("Cache destination is already occupied");
                }

                method = policy.choose(reason, filesystem.sameFileStore(original.getParent(), cached.getParent()));
                pending = repository.insert(CachedFileRecord.builder()
                    .originalPath(original)
                    .cachedPath(cached)
                    .filename(original.getFileName().toString())
                    .method(method)
                    .sizeBytes(filesystem.size(original))
                    .state(RecordState.PENDING)
                    .triggerReason(reason)
                    .build(), context);

                filesystem.requireWritableDirectory(cached.getParent());
                if (method == RelocationMethod.SYMLINK) {
                    filesystem.requireWritableDirectory(original.getParent());
                }
                if (!existence.exists(original)) {
                    throw new FilesystemException("Source vanished before relocation");
                }

                long size = stage(method, original, cached, journal, handle, deadline);
                requireSourceAtCommit(original, method);
                CachedFileRecord committed = repository.markCommitted(pending.getId(), size, context);
                journal.commit();

                metrics.recordCommitted(method);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("method", method.getDbValue());
                details.put("sizeBytes", size);
                details.put("triggerReason", reason.getDbValue());
                details.put("cachedPath", cached.toString());
                auditLogger.success(AuditEventTypes.RELOCATION_COMMITTED, context, original.toString(),
                    "relocation.cache", details);
                log.info("Relocation committed: path={}, method={}, bytes={}",
                    Encode.forJava(original.toString()), method.getDbValue(), size);
                return RelocationOutcome.builder()
                    .kind(RelocationOutcome.Kind.CACHE)
                    .originalPath(original)
                    .phase(RelocationPhase.COMMITTED)
                    .record(committed)
                    .build();
            } catch (RuntimeException | IOException | TimeoutException e) {
                throw rollbackCache(handle, e, pending, method, journal, original, context);
            }
        }
    }

    private RelocationOutcome alreadyCached(CachedFileRecord record, UserContext context) {
        auditLogger.success(AuditEventTypes.RELOCATION_NOOP, context, record.getOriginalPath().toString(),
            "relocation.cache", Map.of("recordId", record.getId(), "method", record.getMethod().getDbValue()));
        log.debug("Already cached: {}", Encode.forJava(record.getOriginalPath().toString()));
        return RelocationOutcome.builder()
            .kind(RelocationOutcome.Kind.CACHE)
            .originalPath(record.getOriginalPath())
            .phase(RelocationPhase.COMMITTED)
            .record(record)
            .noop(true)
            .build();
    }

    /**
     * Physical steps for one method. Returns the payload size.
     */
    private long stage(RelocationMethod method, Path original, Path cached, RollbackJournal journal,
                       RelocationHandle handle, Deadline deadline) throws IOException, TimeoutException {
        List<Path> createdDirectories = filesystem.createDirectories(cached.getParent());
        if (!createdDirectories.isEmpty()) {
            journal.record("remove created cache directories",
                () -> filesystem.deleteEmptyDirectories(createdDirectories));
        }

        Path staged = filesystem.temporarySibling(cached);
        journal.record("delete staged cache file", () -> filesystem.deleteIfExists(staged));
        long size;
        if (method == RelocationMethod.HARDLINK) {
            filesystem.createHardLink(staged, original);
            size = filesystem.size(staged);
        } else {
            size = filesystem.copyVerified(original, staged, method == RelocationMethod.SECURE_COPY,
                settings.getCopyBufferSize(), deadline);
        }
        deadline.check("staging");

        handle.advance(RelocationPhase.COMMITTING);
        filesystem.moveAtomically(staged, cached);
        journal.record("delete cache artifact", () -> filesystem.deleteIfExists(cached));

        if (method == RelocationMethod.SYMLINK) {
            replaceWithSymlink(original, cached, journal, deadline);
        }
        return size;
    }

    private void replaceWithSymlink(Path original, Path cached, RollbackJournal journal, Deadline deadline)
        throws IOException, TimeoutException {
        Path backup = layout.backupPathFor(original);
        if (filesystem.exists(backup)) {
            throw new ConflictException("A stale backup exists next to the original");
        }
        journal.record("delete original backup", () -> filesystem.deleteIfExists(backup));
        linkOrCopy(original, backup, deadline);

        Path link = filesystem.temporarySibling(original);
        journal.record("delete staged symlink", () -> filesystem.deleteIfExists(link));
        filesystem.createSymbolicLink(link, cached);
        deadline.check("symlink swap");
        filesystem.moveAtomically(link, original);
        journal.record("restore original from backup", () -> restoreFrom(backup, original));
    }

    /**
     * The consumer-visible original must still be there when the record commits: the file
     * itself for link and copy methods, the swapped-in symlink for the symlink method.
     */
    private void requireSourceAtCommit(Path original, RelocationMethod method) {
        boolean present = method == RelocationMethod.SYMLINK
            ? filesystem.isSymbolicLink(original)
            : existence.exists(original) && filesystem.isRegularFile(original);
        if (!present) {
            throw new FilesystemException("Source vanished before commit");
        }
    }

    private RuntimeException rollbackCache(RelocationHandle handle, Exception cause, CachedFileRecord pending,
                                           RelocationMethod method, RollbackJournal journal, Path original,
                                           UserContext context) {
        RuntimeException failure = toEngineException(cause);
        handle.advance(RelocationPhase.FAILED);
        List<String> notUndone = journal.rollback();
        boolean restored = notUndone.isEmpty();

        if (pending != null) {
            try {
                repository.markFailed(pending.getId(), failure.getMessage(), context);
            } catch (RuntimeException markError) {
                log.error("Could not mark record {} FAILED: {}", pending.getId(), markError.getMessage(), markError);
            }
        }

        metrics.recordFailed(method);
        if (pending != null) {
            metrics.recordRolledBack(method, restored);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", String.valueOf(failure.getMessage()));
        details.put("code", codeOf(failure));
        details.put("method", method == null ? "none" : method.getDbValue());
        details.put("rollbackComplete", restored);
        if (!restored) {
            details.put("notUndone", notUndone);
        }
        auditLogger.failure(AuditEventTypes.RELOCATION_FAILED, context, original.toString(),
            "relocation.cache", details);

        if (restored) {
            handle.advance(RelocationPhase.ROLLED_BACK);
            log.warn("Relocation failed and rolled back: path={}, reason={}",
                Encode.forJava(original.toString()), Encode.forJava(String.valueOf(failure.getMessage())));
        } else {
            log.error("Relocation failed and rollback is incomplete: path={}, steps={}",
                Encode.forJava(original.toString()), notUndone);
        }
        return failure;
    }

    // ---------------------------------------------------------------- release

    private RelocationOutcome runRelease(RelocationHandle handle, Path original, UserContext context) {
        Path cachedGuess = repository.findByOriginalPath(original, context)
            .map(CachedFileRecord::getCachedPath)
            .orElseGet(() -> layout.cachedPathFor(original));
        Deadline deadline = Deadline.after(settings.getOperationTimeout(), clock);

        try (PathLockManager.Lease lease = lock(List.of(original, cachedGuess), context, "relocation.release",
            original)) {
            if (!handle.beginStaging()) {
                auditLogger.success(AuditEventTypes.RELOCATION_CANCELLED, context, original.toString(),
                    "relocation.release", Map.of("phase", RelocationPhase.IDLE.name()));
                return RelocationOutcome.cancelled(RelocationOutcome.Kind.RELEASE, original);
            }

            RollbackJournal journal = new RollbackJournal();
            CachedFileRecord record = null;
            try {
                Optional<CachedFileRecord> current = repository.findByOriginalPath(original, context);
                if (current.isPresent() && current.get().getState() == RecordState.PENDING) {
                    throw new ConflictException("A relocation is still pending for this path");
                }
                record = current.filter(r -> r.getState() == RecordState.COMMITTED)
                    .orElseThrow(() -> new ValidationException("Path is not cached"));
                if (!record.getCachedPath().equals(cachedGuess)) {
                    throw new ConflictException("Record changed while waiting for the path lock");
                }

                restoreOriginal(record, journal, deadline);
                handle.advance(RelocationPhase.COMMITTING);
                CachedFileRecord removed = repository.remove(record.getId(), context);
                journal.commit();

                boolean cleanupComplete = cleanupAfterRelease(record);
                metrics.recordReleased(record.getMethod());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("method", record.getMethod().getDbValue());
                details.put("cleanupComplete", cleanupComplete);
                auditLogger.success(AuditEventTypes.RELEASE_COMPLETED, context, original.toString(),
                    "relocation.release", details);
                log.info("Release committed: path={}, method={}", Encode.forJava(original.toString()),
                    record.getMethod().getDbValue());
                return RelocationOutcome.builder()
                    .kind(RelocationOutcome.Kind.RELEASE)
                    .originalPath(original)
                    .phase(RelocationPhase.COMMITTED)
                    .record(removed)
                    .build();
            } catch (RuntimeException | IOException | TimeoutException e) {
                RuntimeException failure = toEngineException(e);
                handle.advance(RelocationPhase.FAILED);
                List<String> notUndone = journal.rollback();
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("reason", String.valueOf(failure.getMessage()));
                details.put("code", codeOf(failure));
                details.put("rollbackComplete", notUndone.isEmpty());
                auditLogger.failure(AuditEventTypes.RELEASE_FAILED, context, original.toString(),
                    "relocation.release", details);
                if (notUndone.isEmpty()) {
                    handle.advance(RelocationPhase.ROLLED_BACK);
                } else {
                    log.error("Release failed and rollback is incomplete: path={}, steps={}",
                        Encode.forJava(original.toString()), notUndone);
                }
                if (record != null) {
                    metrics.recordFailed(record.getMethod());
                }
                throw failure;
            }
        }
    }

    /**
     * Put the original payload back at the original path. Hardlinked and copied originals are
     * normally untouched; a symlinked original is swapped back to its backup.
     */
    private void restoreOriginal(CachedFileRecord record, RollbackJournal journal, Deadline deadline)
        throws IOException, TimeoutException {
        Path original = record.getOriginalPath();
        Path cached = record.getCachedPath();

        if (filesystem.isSymbolicLink(original)) {
            Path backup = layout.backupPathFor(original);
            Path source = filesystem.exists(backup) ? backup : cached;
            if (!filesystem.exists(source)) {
                throw new FilesystemException("Neither the backup nor the cached payload exists");
            }
            Path linkTarget = filesystem.readSymbolicLink(original);
            Path staged = filesystem.temporarySibling(original);
            journal.record("delete staged restore", () -> filesystem.deleteIfExists(staged));
            linkOrCopy(source, staged, deadline);
            deadline.check("restore swap");
            filesystem.moveAtomically(staged, original);
            journal.record("re-link original to cache", () -> relink(original, linkTarget));
        } else if (!filesystem.exists(original)) {
            if (!filesystem.exists(cached)) {
                throw new FilesystemException("Cached payload is missing; cannot restore the original");
            }
            Path staged = filesystem.temporarySibling(original);
            journal.record("delete staged restore", () -> filesystem.deleteIfExists(staged));
            linkOrCopy(cached, staged, deadline);
            filesystem.moveAtomically(staged, original);
            journal.record("delete restored original", () -> filesystem.deleteIfExists(original));
        }
    }

    private boolean cleanupAfterRelease(CachedFileRecord record) {
        boolean complete = true;
        try {
            filesystem.deleteIfExists(record.getCachedPath());
        } catch (IOException e) {
            complete = false;
            log.warn("Could not delete cache artifact {}: {}",
                Encode.forJava(record.getCachedPath().toString()), e.getMessage());
        }
        if (record.getMethod() == RelocationMethod.SYMLINK) {
            Path backup = layout.backupPathFor(record.getOriginalPath());
            try {
                filesystem.deleteIfExists(backup);
            } catch (IOException e) {
                complete = false;
                log.warn("Could not delete backup {}: {}", Encode.forJava(backup.toString()), e.getMessage());
            }
        }
        return complete;
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Replace {@code original} with a fresh link to, or copy of, {@code source}.
     */
    void restoreFrom(Path source, Path original) throws IOException {
        Path staged = filesystem.temporarySibling(original);
        try {
            linkOrCopy(source, staged, Deadline.none());
            filesystem.moveAtomically(staged, original);
        } catch (IOException | RuntimeException e) {
            filesystem.deleteIfExists(staged);
            throw e;
        } catch (TimeoutException e) {
            filesystem.deleteIfExists(staged);
            throw new IOException("Restore interrupted", e);
        }
    }

    private void relink(Path original, Path linkTarget) throws IOException {
        Path link = filesystem.temporarySibling(original);
        filesystem.createSymbolicLink(link, linkTarget);
        try {
            filesystem.moveAtomically(link, original);
        } catch (IOException e) {
            filesystem.deleteIfExists(link);
            throw e;
        }
    }

    /**
     * Hardlink {@code target} to {@code source} when possible, otherwise copy it.
     */
    private void linkOrCopy(Path source, Path target, Deadline deadline) throws IOException, TimeoutException {
        try {
            filesystem.createHardLink(target, source);
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("Hardlink of {} unavailable, copying: {}", source.getFileName(), e.getMessage());
            filesystem.deleteIfExists(target);
            filesystem.copyVerified(source, target, false, settings.getCopyBufferSize(), deadline);
        }
    }

    private static RuntimeException toEngineException(Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        if (e instanceof TimeoutException) {
            return new ResourceExhaustedException("Relocation exceeded its deadline", e);
        }
        if (e instanceof NoSuchFileException) {
            return new FilesystemException("Source vanished during relocation", e);
        }
        return new FilesystemException("Filesystem operation failed: " + e.getMessage(), e);
    }

    private static String codeOf(RuntimeException failure) {
        return failure instanceof CacheEngineException
            ? ((CacheEngineException) failure).getCode().name()
            : "INTERNAL";
    }

    private void auditValidationFailure(UserContext context, String rawPath, String operation, String reason) {
        auditLogger.failure(AuditEventTypes.VALIDATION_FAILURE, context, String.valueOf(rawPath), operation,
            Map.of("reason", reason));
    }
}
