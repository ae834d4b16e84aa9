package com.mediacache.infrastructure.filesystem;

import com.mediacache.application.exceptions.ConflictException;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-path exclusive locks for the physical relocation window.
 *
 * <p>Locks are reference counted and dropped from the map when the last holder or waiter
 * leaves, so the map only holds paths that are in use. Multiple paths are always acquired
 * in sorted order, which rules out lock-order deadlocks between relocations that share a
 * path.
 */
@Slf4j
public class PathLockManager {

    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int references;
    }

    private final ConcurrentHashMap<Path, CountedLock> locks = new ConcurrentHashMap<>();

    /**
     * Held locks, released together by {@link #close()}.
     */
    public final class Lease implements AutoCloseable {
        private final List<Path> paths;
        private boolean released;

        private Lease(List<Path> paths) {
            this.paths = paths;
        }

        public List<Path> getPaths() {
            return paths;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            for (int i = paths.size() - 1; i >= 0; i--) {
                unlock(paths.get(i));
            }
        }
    }

    /**
     * Acquire every path, waiting at most {@code timeout} per path.
     *
     * @throws ConflictException when a path stays locked past the timeout
     */
    public Lease acquire(Collection<Path> paths, Duration timeout) {
        List<Path> ordered = new ArrayList<>(new TreeSet<>(paths));
        List<Path> held = new ArrayList<>(ordered.size());
        try {
            for (Path path : ordered) {
                if (!tryLock(path, timeout)) {
                    throw new ConflictException("Path is locked by another operation: " + path.getFileName());
                }
                held.add(path);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseAll(held);
            throw new ConflictException("Interrupted while waiting for path lock", e);
        } catch (RuntimeException e) {
            releaseAll(held);
            throw e;
        }
        return new Lease(held);
    }

    public boolean isLocked(Path path) {
        CountedLock counted = locks.get(path);
        return counted != null && counted.lock.isLocked();
    }

    int queuedWaiters(Path path) {
        CountedLock counted = locks.get(path);
        return counted == null ? 0 : counted.lock.getQueueLength();
    }

    int trackedPaths() {
        return locks.size();
    }

    private boolean tryLock(Path path, Duration timeout) throws InterruptedException {
        CountedLock counted = locks.compute(path, (key, existing) -> {
            CountedLock value = existing != null ? existing : new CountedLock();
            value.references++;
            return value;
        });
        boolean acquired = false;
        try {
            acquired = counted.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return acquired;
        } finally {
            if (!acquired) {
                dereference(path);
            }
        }
    }

    private void unlock(Path path) {
        CountedLock counted = locks.get(path);
        if (counted == null) {
            log.warn("Unlock of untracked path {}", path);
            return;
        }
        counted.lock.unlock();
        dereference(path);
    }

    private void dereference(Path path) {
        locks.computeIfPresent(path, (key, value) -> --value.references == 0 ? null : value);
    }

    private void releaseAll(List<Path> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            unlock(held.get(i));
        }
    }
}
