package com.mediacache.infrastructure.filesystem;

import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds subtitle sidecars of a media file: entries in the same directory whose base name
 * starts with the media's base name, e.g. {@code Movie.en.srt} for {@code Movie.mkv}.
 *
 * <p>Symlinked sidecars count, so sidecars already relocated with mount preservation are
 * still found.
 */
@Slf4j
public class SubtitleFinder {

    public static final Set<String> SUBTITLE_EXTENSIONS =
        Set.of("srt", "ass", "ssa", "sub", "idx", "vtt", "pgs", "sup");

    /**
     * @return sidecars sorted by name; empty when the directory cannot be read
     */
    public List<Path> findSubtitles(Path media) {
        Path directory = media.getParent();
        if (directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }
        String stem = stem(media.getFileName().toString());
        List<Path> subtitles = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (!entry.equals(media) && isSubtitle(name) && stem(name).startsWith(stem)
                    && (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS) || Files.isSymbolicLink(entry))) {
                    subtitles.add(entry);
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list {} for subtitles: {}", Encode.forJava(directory.toString()), e.getMessage());
            return List.of();
        }
        subtitles.sort(null);
        return subtitles;
    }

    static boolean isSubtitle(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && SUBTITLE_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
