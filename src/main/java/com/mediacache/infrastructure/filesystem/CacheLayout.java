package com.mediacache.infrastructure.filesystem;

import com.mediacache.application.exceptions.ValidationException;
import com.mediacache.infrastructure.security.PathCanonicalizer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps an original path to its place in the cache. The cache mirrors the directory
 * structure below the origin root that contains the file.
 */
public class CacheLayout {

    public static final String BACKUP_SUFFIX = ".mediacache-backup";

    private final List<Path> originRoots;
    private final Path cacheRoot;
    private final List<Path> allowedBases;

    public CacheLayout(Collection<Path> originRoots, Path cacheRoot, Collection<Path> additionalAllowedBases,
                       PathCanonicalizer canonicalizer) {
        if (originRoots == null || originRoots.isEmpty()) {
            throw new IllegalArgumentException("At least one origin root is required");
        }
        this.cacheRoot = canonical(cacheRoot, canonicalizer);
        List<Path> roots = new ArrayList<>();
        for (Path root : originRoots) {
            Path canonicalRoot = canonical(root, canonicalizer);
            if (canonicalRoot.startsWith(this.cacheRoot) || this.cacheRoot.startsWith(canonicalRoot)) {
                throw new IllegalArgumentException(
                    "Cache root " + this.cacheRoot + " overlaps origin root " + canonicalRoot);
            }
            roots.add(canonicalRoot);
        }
        this.originRoots = List.copyOf(roots);

        Set<Path> bases = new LinkedHashSet<>(this.originRoots);
        bases.add(this.cacheRoot);
        if (additionalAllowedBases != null) {
            for (Path extra : additionalAllowedBases) {
                bases.add(canonical(extra, canonicalizer));
            }
        }
        this.allowedBases = List.copyOf(bases);
    }

    public List<Path> getOriginRoots() {
        return originRoots;
    }

    public Path getCacheRoot() {
        return cacheRoot;
    }

    public List<Path> getAllowedBases() {
        return allowedBases;
    }

    /**
     * @throws ValidationException when the path lies under no origin root
     */
    public Path cachedPathFor(Path originalPath) {
        return cacheRoot.resolve(originRootOf(originalPath).relativize(originalPath));
    }

    public Path originRootOf(Path originalPath) {
        for (Path root : originRoots) {
            if (originalPath.startsWith(root) && !originalPath.equals(root)) {
                return root;
            }
        }
        throw new ValidationException("Path is not within a configured origin root");
    }

    public boolean isInCache(Path path) {
        return path.startsWith(cacheRoot);
    }

    /**
     * Hidden sibling that keeps the original payload while the original path is a symlink.
     */
    public Path backupPathFor(Path originalPath) {
        return originalPath.resolveSibling("." + originalPath.getFileName() + BACKUP_SUFFIX);
    }

    public boolean isBackupName(String fileName) {
        return fileName.length() > BACKUP_SUFFIX.length() + 1
            && fileName.startsWith(".") && fileName.endsWith(BACKUP_SUFFIX);
    }

    /**
     * Inverse of {@link #backupPathFor}.
     */
    public Path originalForBackup(Path backup) {
        String name = backup.getFileName().toString();
        if (!isBackupName(name)) {
            throw new ValidationException("Not a backup file name");
        }
        return backup.resolveSibling(name.substring(1, name.length() - BACKUP_SUFFIX.length()));
    }

    private static Path canonical(Path path, PathCanonicalizer canonicalizer) {
        try {
            return canonicalizer.resolve(path.toAbsolutePath().normalize());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve configured path " + path, e);
        }
    }
}
