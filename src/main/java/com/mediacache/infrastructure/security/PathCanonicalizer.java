package com.mediacache.infrastructure.security;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Resolves an absolute, lexically normalized path to its real location, following
 * symbolic links in every existing component. Components that do not exist yet are
 * appended unchanged.
 */
@FunctionalInterface
public interface PathCanonicalizer {

    Path resolve(Path path) throws IOException;
}
