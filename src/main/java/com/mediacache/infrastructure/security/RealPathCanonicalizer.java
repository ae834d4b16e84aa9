package com.mediacache.infrastructure.security;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link PathCanonicalizer} over the default filesystem. Reads only; never mutates.
 */
public class RealPathCanonicalizer implements PathCanonicalizer {

    private static final int MAX_LINK_DEPTH = 40;

    @Override
    public Path resolve(Path path) throws IOException {
        return resolve(path.toAbsolutePath().normalize(), 0);
    }

    private Path resolve(Path path, int depth) throws IOException {
        if (depth > MAX_LINK_DEPTH) {
            throw new IOException("Too many levels of symbolic links: " + path);
        }
        if (Files.exists(path)) {
            return path.toRealPath();
        }
        // dangling link: follow the target lexically so it cannot hide an escape
        if (Files.isSymbolicLink(path)) {
            Path target = Files.readSymbolicLink(path);
            Path parent = path.getParent();
            Path absolute = parent == null ? target : parent.resolve(target);
            return resolve(absolute.normalize(), depth + 1);
        }
        Path parent = path.getParent();
        if (parent == null) {
            return path;
        }
        return resolve(parent, depth).resolve(path.getFileName());
    }
}
