package com.mediacache.infrastructure.filesystem;

import com.mediacache.application.exceptions.ValidationException;
import com.mediacache.infrastructure.security.RealPathCanonicalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class FilesystemOperationsTest {

    @TempDir
    Path tempDir;

    final FilesystemOperations filesystem = new FilesystemOperations();

    @Test
    void verified_copy_matches_source() throws Exception {
        Path source = Files.write(tempDir.resolve("source.mkv"), new byte[100_000]);
        Path target = tempDir.resolve("target.mkv");

        long copied = filesystem.copyVerified(source, target, true, 4096, Deadline.none());

        assertEquals(100_000, copied);
        assertEquals(Files.size(source), Files.size(target));
        assertEquals(Files.getLastModifiedTime(source), Files.getLastModifiedTime(target));
    }

    @Test
    void copy_never_overwrites_an_existing_target() throws IOException {
        Path source = Files.writeString(tempDir.resolve("source.mkv"), "payload");
        Path target = Files.writeString(tempDir.resolve("target.mkv"), "other");

        assertThrows(IOException.class, () -> filesystem.copyVerified(source, target, false, 4096, Deadline.none()));
        assertEquals("other", Files.readString(target));
    }

    @Test
    void expired_deadline_stops_the_copy() throws IOException {
        Path source = Files.write(tempDir.resolve("source.mkv"), new byte[10_000]);
        Clock frozen = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        Deadline expired = Deadline.after(Duration.ofSeconds(-1), frozen);

        assertThrows(TimeoutException.class,
            () -> filesystem.copyVerified(source, tempDir.resolve("target.mkv"), false, 1024, expired));
    }

    @Test
    void created_directories_are_reported_and_removable() throws IOException {
        Path nested = tempDir.resolve("a/b/c");

        List<Path> created = filesystem.createDirectories(nested);

        assertEquals(List.of(tempDir.resolve("a"), tempDir.resolve("a/b"), nested), created);
        filesystem.deleteEmptyDirectories(created);
        assertFalse(Files.exists(tempDir.resolve("a")));
    }

    @Test
    void non_empty_directory_survives_cleanup() throws IOException {
        List<Path> created = filesystem.createDirectories(tempDir.resolve("a/b"));
        Files.writeString(tempDir.resolve("a/keep.txt"), "x");

        filesystem.deleteEmptyDirectories(created);

        assertFalse(Files.exists(tempDir.resolve("a/b")));
        assertTrue(Files.exists(tempDir.resolve("a/keep.txt")));
    }

    @Test
    void temporary_sibling_is_hidden_and_unique() {
        Path target = tempDir.resolve("movie.mkv");

        Path first = filesystem.temporarySibling(target);
        Path second = filesystem.temporarySibling(target);

        assertEquals(tempDir, first.getParent());
        assertTrue(first.getFileName().toString().startsWith(".movie.mkv" + FilesystemOperations.TEMP_MARKER));
        assertNotEquals(first, second);
    }

    @Test
    void atomic_move_replaces_target() throws IOException {
        Path staged = Files.writeString(tempDir.resolve("staged"), "new");
        Path target = Files.writeString(tempDir.resolve("target"), "old");

        filesystem.moveAtomically(staged, target);

        assertEquals("new", Files.readString(target));
        assertFalse(Files.exists(staged));
    }

    @Test
    void layout_mirrors_origin_structure() throws IOException {
        Path origin = Files.createDirectories(tempDir.resolve("media"));
        Path cache = Files.createDirectories(tempDir.resolve("cache"));
        CacheLayout layout = new CacheLayout(List.of(origin), cache, List.of(), new RealPathCanonicalizer());
        Path root = tempDir.toRealPath();

        assertEquals(root.resolve("cache/shows/s01/e01.mkv"),
            layout.cachedPathFor(root.resolve("media/shows/s01/e01.mkv")));
        assertEquals(root.resolve("media/.e01.mkv" + CacheLayout.BACKUP_SUFFIX),
            layout.backupPathFor(root.resolve("media/e01.mkv")));
        assertThrows(ValidationException.class, () -> layout.cachedPathFor(root.resolve("elsewhere/a.mkv")));
    }

    @Test
    void backup_name_maps_back_to_its_original() throws IOException {
        Path origin = Files.createDirectories(tempDir.resolve("media"));
        Path cache = Files.createDirectories(tempDir.resolve("cache"));
        CacheLayout layout = new CacheLayout(List.of(origin), cache, List.of(), new RealPathCanonicalizer());
        Path original = origin.resolve("Show.S01E01.mkv");

        Path backup = layout.backupPathFor(original);

        assertTrue(layout.isBackupName(backup.getFileName().toString()));
        assertEquals(original, layout.originalForBackup(backup));
        assertFalse(layout.isBackupName(CacheLayout.BACKUP_SUFFIX));
        assertFalse(layout.isBackupName("Show.S01E01.mkv"));
        assertThrows(ValidationException.class, () -> layout.originalForBackup(original));
    }

    @Test
    void finds_matching_files_without_following_symlinks() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("media/shows"));
        Path match = Files.writeString(root.resolve("a.keep"), "x");
        Files.writeString(root.resolve("b.other"), "x");
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("c.keep"), "x");
        Files.createSymbolicLink(root.resolve("link"), outside);
        Files.createSymbolicLink(root.resolve("d.keep"), match);

        List<Path> found = filesystem.findFiles(tempDir.resolve("media"), name -> name.endsWith(".keep"));

        assertEquals(List.of(match), found);
        assertEquals(List.of(), filesystem.findFiles(tempDir.resolve("absent"), name -> true));
    }

    @Test
    void leftover_temporaries_of_a_target_are_deleted() throws IOException {
        Path target = tempDir.resolve("a.mkv");
        Files.writeString(filesystem.temporarySibling(target), "partial");
        Files.writeString(filesystem.temporarySibling(target), "partial");
        Path unrelated = Files.writeString(filesystem.temporarySibling(tempDir.resolve("b.mkv")), "partial");

        assertEquals(2, filesystem.deleteTemporarySiblings(target));
        assertTrue(Files.exists(unrelated));
    }

    @Test
    void overlapping_cache_and_origin_roots_are_rejected() throws IOException {
        Path origin = Files.createDirectories(tempDir.resolve("media"));

        assertThrows(IllegalArgumentException.class,
            () -> new CacheLayout(List.of(origin), origin.resolve("cache"), List.of(), new RealPathCanonicalizer()));
    }
}
