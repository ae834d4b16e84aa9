package com.mediacache.infrastructure.filesystem;

import java.nio.file.Path;

/**
 * Answers whether a media path is currently present. Injected so callers can substitute a
 * fake when the configured media mounts are absent.
 */
@FunctionalInterface
public interface PathExistenceOracle {

    boolean exists(Path path);
}
