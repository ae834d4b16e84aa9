package com.mediacache.infrastructure.filesystem;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks the real filesystem. A symlink counts as present only when its target exists.
 */
public class FilesystemPathExistenceOracle implements PathExistenceOracle {

    @Override
    public boolean exists(Path path) {
        return path != null && Files.exists(path);
    }
}
