package com.mediacache.application;

import com.mediacache.application.exceptions.CacheEngineException;
import com.mediacache.application.exceptions.OperationCancelledException;
import com.mediacache.application.exceptions.ResourceExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caller's view of a submitted relocation or release.
 *
 * <p>Cancellation only succeeds while the request is still IDLE. Once staging has begun
 * the request runs to COMMITTED or ROLLED_BACK.
 */
@Slf4j
public final class RelocationHandle {

    private final UUID requestId;
    private final RelocationOutcome.Kind kind;
    private final Path originalPath;
    private final AtomicReference<RelocationPhase> phase = new AtomicReference<>(RelocationPhase.IDLE);
    private final CompletableFuture<RelocationOutcome> result = new CompletableFuture<>();

    RelocationHandle(UUID requestId, RelocationOutcome.Kind kind, Path originalPath) {
        this.requestId = requestId;
        this.kind = kind;
        this.originalPath = originalPath;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public RelocationOutcome.Kind getKind() {
        return kind;
    }

    public Path getOriginalPath() {
        return originalPath;
    }

    public RelocationPhase getPhase() {
        return phase.get();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * @return true when the request was cancelled without side effects
     */
    public boolean cancel() {
        if (phase.compareAndSet(RelocationPhase.IDLE, RelocationPhase.CANCELLED)) {
            result.complete(RelocationOutcome.cancelled(kind, originalPath));
            log.info("Relocation {} cancelled before staging", requestId);
            return true;
        }
        return phase.get() == RelocationPhase.CANCELLED;
    }

    /**
     * Wait for the terminal outcome.
     *
     * @throws CacheEngineException the failure that ended the request
     * @throws ResourceExhaustedException when the request is still running after the timeout
     * @throws OperationCancelledException when the waiting thread is interrupted
     */
    public RelocationOutcome await(Duration timeout) {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CacheEngineException) {
                throw (CacheEngineException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Relocation failed", cause);
        } catch (TimeoutException e) {
            throw new ResourceExhaustedException(
                "Relocation still running after " + timeout.toSeconds() + "s; it will finish in the background", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting for relocation " + requestId);
        }
    }

    boolean beginStaging() {
        return phase.compareAndSet(RelocationPhase.IDLE, RelocationPhase.STAGING);
    }

    void advance(RelocationPhase next) {
        phase.set(next);
    }

    void complete(RelocationOutcome outcome) {
        if (result.isDone()) {
            return;
        }
        phase.set(outcome.getPhase());
        result.complete(outcome);
    }

    void fail(RuntimeException failure, RelocationPhase terminal) {
        if (result.isDone()) {
            return;
        }
        phase.set(terminal);
        result.completeExceptionally(failure);
    }
}
