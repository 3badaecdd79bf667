package org.resourcefinder.search;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentMatchExtractorTest {

    @TempDir
    Path tempDir;

    private final ContentMatchExtractor extractor = new ContentMatchExtractor(400, 1024 * 1024);

    @Test
    void extract_returnsLineNumberContextAndOffsets() throws IOException {
        Path file = write("line1\nline2 Hello\nline3\nline4\n");

        List<ContentMatch> matches = extractor.extract(file, StreamingContentSearcher.compile("hello", false), 1, 5);

        assertThat(matches).hasSize(1);
        ContentMatch match = matches.get(0);
        assertThat(match.lineNumber()).isEqualTo(2);
        assertThat(match.content()).isEqualTo("line2 Hello");
        assertThat(match.contextBefore()).containsExactly("line1");
        assertThat(match.contextAfter()).containsExactly("line3");
        assertThat(match.content().substring(match.matchStart(), match.matchEnd())).isEqualTo("Hello");
    }

    @Test
    void extract_stopsAtMaxMatches() throws IOException {
        Path file = write("hit\nhit hit\nmiss\nhit\n");

        List<ContentMatch> matches = extractor.extract(file, StreamingContentSearcher.compile("hit", true), 0, 2);

        assertThat(matches).extracting(ContentMatch::lineNumber).containsExactly(1, 2);
        assertThat(matches.get(0).contextBefore()).isEmpty();
    }

    @Test
    void extract_multiLinePatternReportsStartLine() throws IOException {
        Path file = write("first\r\nStart here\r\nEnd here\r\nlast");

        List<ContentMatch> matches = extractor.extract(file, StreamingContentSearcher.compile("start here\\r?\\nend", false), 1, 5);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).lineNumber()).isEqualTo(2);
        assertThat(matches.get(0).content()).isEqualTo("Start here");
        assertThat(matches.get(0).contextBefore()).containsExactly("first");
        assertThat(matches.get(0).contextAfter()).containsExactly("End here");
    }

    @Test
    void extract_skipsFilesAboveByteLimit() throws IOException {
        Path file = write("Hello ".repeat(100));

        List<ContentMatch> matches = new ContentMatchExtractor(400, 10).extract(file, StreamingContentSearcher.compile("hello", false), 2, 5);

        assertThat(matches).isEmpty();
    }

    @Test
    void buildExcerpt_keepsMatchVisibleInLongLine() {
        String line = "a".repeat(500) + "XYZ" + "b".repeat(500);

        ContentMatchExtractor.Excerpt excerpt = ContentMatchExtractor.buildExcerpt(line, 500, 503, 50);

        assertThat(excerpt.text().length()).isLessThanOrEqualTo(50);
        assertThat(excerpt.text()).startsWith("…").endsWith("…");
        assertThat(excerpt.text().substring(excerpt.matchStart(), excerpt.matchEnd())).isEqualTo("XYZ");
    }

    private Path write(String content) throws IOException {
        Path file = Files.createTempFile(tempDir, "extract", ".txt");
        Files.writeString(file, content);
        return file;
    }
}
