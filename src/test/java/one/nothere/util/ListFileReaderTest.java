package one.nothere.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ListFileReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void should_SkipBlankLinesAndComments() throws IOException {
        Path file = tempDir.resolve("seeds.txt");
        Files.writeString(file, """
            # starting points
            https://example.com

              https://example.org/about \s
            #https://skipped.example
            """);

        assertThat(ListFileReader.readEntries(file))
            .containsExactly("https://example.com", "https://example.org/about");
    }
}
