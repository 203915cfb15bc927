package one.nothere.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads line-oriented list files (seed URLs, extra blocked domains).
 * Blank lines and lines starting with {@code #} are skipped; entries are trimmed.
 */
public final class ListFileReader {

    private ListFileReader() {
    }

    public static List<String> readEntries(Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read list file " + file, e);
        }
    }
}
