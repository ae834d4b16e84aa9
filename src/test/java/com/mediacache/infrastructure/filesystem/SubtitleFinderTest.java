package com.mediacache.infrastructure.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubtitleFinderTest {

    @TempDir
    Path tempDir;

    final SubtitleFinder finder = new SubtitleFinder();

    @Test
    void sidecars_sharing_the_base_name_are_found() throws IOException {
        Path media = Files.writeString(tempDir.resolve("Movie (2020).mkv"), "video");
        Path english = Files.writeString(tempDir.resolve("Movie (2020).en.srt"), "1");
        Path forced = Files.writeString(tempDir.resolve("Movie (2020).de.forced.ASS"), "1");
        Path idx = Files.writeString(tempDir.resolve("Movie (2020).idx"), "1");
        Files.writeString(tempDir.resolve("Movie (2020).nfo"), "metadata");
        Files.writeString(tempDir.resolve("Other.srt"), "1");
        Files.createDirectory(tempDir.resolve("Movie (2020).vtt"));

        assertEquals(List.of(forced, english, idx), finder.findSubtitles(media));
    }

    @Test
    void symlinked_sidecar_is_found() throws IOException {
        Path media = Files.writeString(tempDir.resolve("a.mkv"), "video");
        Path target = Files.writeString(tempDir.resolve("elsewhere.bin"), "1");
        Path link = Files.createSymbolicLink(tempDir.resolve("a.vtt"), target);

        assertEquals(List.of(link), finder.findSubtitles(media));
    }

    @Test
    void missing_directory_yields_nothing() {
        assertEquals(List.of(), finder.findSubtitles(tempDir.resolve("gone/a.mkv")));
    }

    @Test
    void extension_match_ignores_case() {
        assertTrue(SubtitleFinder.isSubtitle("a.SUP"));
        assertTrue(SubtitleFinder.isSubtitle("a.en.pgs"));
        assertFalse(SubtitleFinder.isSubtitle("srt"));
        assertFalse(SubtitleFinder.isSubtitle("a.srt.tmp"));
    }
}
