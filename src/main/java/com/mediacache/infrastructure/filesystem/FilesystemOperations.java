package com.mediacache.infrastructure.filesystem;

import com.mediacache.application.exceptions.IntegrityException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem primitives used by relocation. Each method does one thing and reports
 * failure as an {@link IOException}; sequencing and compensation live in the caller.
 *
 * <p>Not final: tests subclass it to inject failures at a chosen step.
 */
@Slf4j
public class FilesystemOperations {

    public static final String TEMP_MARKER = ".mediacache-";
    private static final String DIGEST_ALGORITHM = "SHA-256";

    /**
     * Fails when new entries cannot be created in {@code directory}, or in its nearest
     * existing ancestor when it does not exist yet. Creates nothing.
     */
    public void requireWritableDirectory(Path directory) throws IOException {
        Path existing = nearestExisting(directory);
        if (existing == null || !Files.isDirectory(existing)) {
            throw new IOException("No existing directory above " + directory);
        }
        if (!Files.isWritable(existing) || !Files.isExecutable(existing)) {
            throw new AccessDeniedException(existing.toString(), null, "directory is not writable");
        }
    }

    /**
     * Hidden, unique name next to {@code target}, on the same filesystem.
     */
    public Path temporarySibling(Path target) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return target.resolveSibling("." + target.getFileName() + TEMP_MARKER + suffix + ".tmp");
    }

    /**
     * Create every missing directory up to {@code directory}.
     *
     * @return the directories that were created, outermost first
     */
    public List<Path> createDirectories(Path directory) throws IOException {
        List<Path> missing = new ArrayList<>();
        Path current = directory;
        while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
            missing.add(current);
            current = current.getParent();
        }
        Collections.reverse(missing);
        List<Path> created = new ArrayList<>(missing.size());
        for (Path dir : missing) {
            try {
                Files.createDirectory(dir);
                created.add(dir);
            } catch (FileAlreadyExistsException e) {
                // a concurrent relocation created it first
                if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
                    throw e;
                }
            }
        }
        return created;
    }

    /**
     * Remove directories created by {@link #createDirectories}, innermost first, stopping at
     * the first one that is no longer empty.
     */
    public void deleteEmptyDirectories(List<Path> created) throws IOException {
        for (int i = created.size() - 1; i >= 0; i--) {
            Path dir = created.get(i);
            if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            try (var entries = Files.list(dir)) {
                if (entries.findAny().isPresent()) {
                    return;
                }
            }
            try {
                Files.deleteIfExists(dir);
            } catch (DirectoryNotEmptyException e) {
                return;
            }
        }
    }

    public void createHardLink(Path link, Path existing) throws IOException {
        Files.createLink(link, existing);
    }

    public void createSymbolicLink(Path link, Path target) throws IOException {
        Files.createSymbolicLink(link, target);
    }

    /**
     * Rename {@code source} onto {@code target} in one step. An existing {@code target} is
     * replaced.
     */
    public void moveAtomically(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    public boolean deleteIfExists(Path path) throws IOException {
        return Files.deleteIfExists(path);
    }

    public boolean exists(Path path) {
        return Files.exists(path, LinkOption.NOFOLLOW_LINKS);
    }

    public boolean isSymbolicLink(Path path) {
        return Files.isSymbolicLink(path);
    }

    public boolean isRegularFile(Path path) {
        return Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS);
    }

    public Path readSymbolicLink(Path link) throws IOException {
        return Files.readSymbolicLink(link);
    }

    public long size(Path path) throws IOException {
        return Files.size(path);
    }

    /**
     * Regular files under {@code root} whose name satisfies {@code nameMatcher}. Symlinks are
     * not followed. A missing root yields an empty list.
     */
    public List<Path> findFiles(Path root, Predicate<String> nameMatcher) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(path -> nameMatcher.test(path.getFileName().toString()))
                .filter(path -> Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS))
                .collect(Collectors.toList());
        }
    }

    /**
     * Delete the leftovers of {@link #temporarySibling} calls for {@code target}.
     *
     * @return number of files deleted
     */
    public int deleteTemporarySiblings(Path target) throws IOException {
        Path parent = target.getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            return 0;
        }
        String prefix = "." + target.getFileName() + TEMP_MARKER;
        int deleted = 0;
        try (DirectoryStream<Path> siblings = Files.newDirectoryStream(parent,
            entry -> entry.getFileName().toString().startsWith(prefix))) {
            for (Path sibling : siblings) {
                if (Files.deleteIfExists(sibling)) {
                    deleted++;
                }
            }
        }
        return deleted;
    }

    public boolean isSameFile(Path a, Path b) throws IOException {
        return Files.isSameFile(a, b);
    }

    /**
     * Whether both paths (or their nearest existing ancestors) live on the same file store,
     * which is the precondition for hardlinking between them.
     */
    public boolean sameFileStore(Path a, Path b) {
        try {
            Path existingA = nearestExisting(a);
            Path existingB = nearestExisting(b);
            if (existingA == null || existingB == null) {
                return false;
            }
            return Files.getFileStore(existingA).equals(Files.getFileStore(existingB));
        } catch (IOException e) {
            log.debug("Cannot compare file stores of {} and {}: {}", a, b, e.getMessage());
            return false;
        }
    }

    /**
     * Copy {@code source} into a new file at {@code target} in chunks, checking the deadline
     * between chunks, then compare sizes. In secure mode the copy is forced to disk and the
     * SHA-256 digests of both files must match.
     *
     * @return number of bytes copied
     * @throws IntegrityException when the copy does not match the source
     */
    public long copyVerified(Path source, Path target, boolean secure, int bufferSize, Deadline deadline)
        throws IOException, TimeoutException {
        long expected = Files.size(source);
        MessageDigest sourceDigest = secure ? newDigest() : null;
        long copied = 0;
        ByteBuffer buffer = ByteBuffer.allocate(bufferSize);
        try (FileChannel in = FileChannel.open(source, StandardOpenOption.READ);
             FileChannel out = FileChannel.open(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            while (in.read(buffer) != -1) {
                deadline.check("copy of " + source.getFileName());
                buffer.flip();
                if (sourceDigest != null) {
                    sourceDigest.update(buffer.duplicate());
                }
                while (buffer.hasRemaining()) {
                    copied += out.write(buffer);
                }
                buffer.clear();
            }
            if (secure) {
                out.force(true);
            }
        }
        Files.setLastModifiedTime(target, Files.getLastModifiedTime(source));

        long actual = Files.size(target);
        if (actual != expected || copied != expected) {
            throw new IntegrityException("Size mismatch after copy: expected " + expected + " bytes, got " + actual);
        }
        if (sourceDigest != null) {
            byte[] targetDigest = digest(target, bufferSize, deadline);
            if (!MessageDigest.isEqual(sourceDigest.digest(), targetDigest)) {
                throw new IntegrityException("Checksum mismatch after secure copy of " + source.getFileName());
            }
        }
        return copied;
    }

    private byte[] digest(Path file, int bufferSize, Deadline deadline) throws IOException, TimeoutException {
        MessageDigest digest = newDigest();
        ByteBuffer buffer = ByteBuffer.allocate(bufferSize);
        try (FileChannel in = FileChannel.open(file, StandardOpenOption.READ)) {
            while (in.read(buffer) != -1) {
                deadline.check("verification of " + file.getFileName());
                buffer.flip();
                digest.update(buffer);
                buffer.clear();
            }
        }
        return digest.digest();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " unavailable", e);
        }
    }

    private static Path nearestExisting(Path path) {
        Path current = path;
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current;
    }
}
