package com.mediacache.infrastructure.security;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes and authorizes filesystem paths against an allow-list.
 *
 * <p>Checks run cheapest first. Lexical checks (length, NUL, traversal segments, encoded
 * traversal) never touch the filesystem. Only a path that passes them is canonicalized.
 *
 * <p>The canonical path returned for a file has every symlink in its <em>parent</em>
 * resolved but keeps its own name, so the consumer-visible path stays the key even after
 * the engine has replaced the file with a symlink. The fully resolved target must also
 * lie under the allow-list, which closes symlink-based escapes.
 */
public class PathValidator {

    public static final int MAX_PATH_LENGTH = 4096;
    public static final int MAX_FILENAME_LENGTH = 255;

    private static final Pattern SAFE_FILENAME = Pattern.compile("[A-Za-z0-9._\\- ()\\[\\]]+");
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[/\\\\]");
    private static final List<String> ENCODED_TRAVERSAL = List.of(
        "%2e", "%2f", "%5c", "%00", "%25", "%c0%ae", "%c0%af", "%c1%9c", "%e0%80%ae");
    private static final Set<String> RESERVED_NAMES = reservedNames();

    private final PathCanonicalizer canonicalizer;

    public PathValidator() {
        this(new RealPathCanonicalizer());
    }

    public PathValidator(PathCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    /**
     * Validate a raw path against the allowed bases.
     *
     * @param rawPath caller-supplied path
     * @param allowedBases subtrees every accepted path must canonicalize under
     * @return canonical path or the rejection reason
     */
    public ValidationResult<Path> validate(String rawPath, Collection<Path> allowedBases) {
        String lexicalProblem = lexicalProblem(rawPath);
        if (lexicalProblem != null) {
            return ValidationResult.rejected(lexicalProblem);
        }

        Path candidate;
        try {
            candidate = Path.of(rawPath);
        } catch (InvalidPathException e) {
            return ValidationResult.rejected("Invalid path: " + e.getReason());
        }
        if (!candidate.isAbsolute()) {
            return ValidationResult.rejected("Path must be absolute");
        }
        if (allowedBases == null || allowedBases.isEmpty()) {
            return ValidationResult.rejected("No allowed base paths configured");
        }

        candidate = candidate.normalize();
        Path key;
        Path target;
        List<Path> bases = new ArrayList<>(allowedBases.size());
        try {
            Path parent = candidate.getParent();
            key = parent == null ? candidate : canonicalizer.resolve(parent).resolve(candidate.getFileName());
            target = canonicalizer.resolve(candidate);
            for (Path base : allowedBases) {
                bases.add(canonicalizer.resolve(base));
            }
        } catch (IOException e) {
            return ValidationResult.rejected("Cannot canonicalize path: " + e.getMessage());
        }

        if (!isUnderAny(key, bases)) {
            return ValidationResult.rejected("Path not within allowed directories");
        }
        if (!isUnderAny(target, bases)) {
            return ValidationResult.rejected("Path resolves outside allowed directories");
        }
        return ValidationResult.valid(key);
    }

    /**
     * Validate a bare filename against the safe character set and reserved names.
     */
    public ValidationResult<String> validateFilename(String filename) {
        if (filename == null || filename.isEmpty()) {
            return ValidationResult.rejected("Filename must be a non-empty string");
        }
        if (filename.length() > MAX_FILENAME_LENGTH) {
            return ValidationResult.rejected("Filename too long (max " + MAX_FILENAME_LENGTH + " characters)");
        }
        if (!SAFE_FILENAME.matcher(filename).matches()) {
            return ValidationResult.rejected("Filename contains invalid characters");
        }
        if (".".equals(filename) || "..".equals(filename)) {
            return ValidationResult.rejected("Filename is a directory reference");
        }
        String stem = filename.split("\\.", 2)[0].toUpperCase(Locale.ROOT);
        if (RESERVED_NAMES.contains(stem)) {
            return ValidationResult.rejected("Filename uses reserved name");
        }
        return ValidationResult.valid(filename);
    }

    /**
     * Checks that need no filesystem access. Returns null when the path passes.
     */
    String lexicalProblem(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return "Path must be a non-empty string";
        }
        if (rawPath.length() > MAX_PATH_LENGTH) {
            return "Path too long (max " + MAX_PATH_LENGTH + " characters)";
        }
        if (rawPath.indexOf('\0') >= 0) {
            return "Path contains NUL byte";
        }
        String lower = rawPath.toLowerCase(Locale.ROOT);
        for (String encoded : ENCODED_TRAVERSAL) {
            if (lower.contains(encoded)) {
                return "Path contains encoded traversal sequence";
            }
        }
        for (String segment : SEGMENT_SEPARATOR.split(rawPath)) {
            if ("..".equals(segment) || ".".equals(segment)) {
                return "Path contains traversal segment";
            }
        }
        return null;
    }

    private static boolean isUnderAny(Path path, List<Path> bases) {
        for (Path base : bases) {
            if (path.startsWith(base)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> reservedNames() {
        List<String> names = new ArrayList<>(List.of("CON", "PRN", "AUX", "NUL"));
        for (int i = 1; i <= 9; i++) {
            names.add("COM" + i);
            names.add("LPT" + i);
        }
        return Set.copyOf(names);
    }
}
