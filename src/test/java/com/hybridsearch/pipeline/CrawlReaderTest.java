package com.hybridsearch.pipeline;

import com.hybridsearch.model.RawDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlReaderTest {

    private final CrawlReader reader = new CrawlReader();

    @TempDir
    Path crawlDir;

    @Test
    @DisplayName("Should split a file on every doctype declaration")
    void shouldSplitConcatenatedDocuments() throws Exception {
        Files.writeString(crawlDir.resolve("part-0.html"),
            "<!DOCTYPE html><p>one</p>\n<!doctype HTML><p>two</p>\n<!DOCTYPE html><p>three</p>");

        List<RawDocument> documents = reader.read(crawlDir);

        assertThat(documents).hasSize(3);
        assertThat(documents).extracting(RawDocument::ordinal).containsExactly(0, 1, 2);
        assertThat(documents.get(1).markup()).startsWith("<!doctype HTML>").contains("two").doesNotContain("three");
    }

    @Test
    @DisplayName("Should read files in path order and treat a file without doctype as one document")
    void shouldReadFilesInOrder() throws Exception {
        Files.writeString(crawlDir.resolve("b.html"), "<p>second</p>");
        Files.writeString(crawlDir.resolve("a.html"), "<!DOCTYPE html><p>first</p>");
        Files.writeString(crawlDir.resolve("empty.html"), "   ");

        List<RawDocument> documents = reader.read(crawlDir);

        assertThat(documents).extracting(RawDocument::source).containsExactly("a.html", "b.html");
        assertThat(documents.get(1).markup()).isEqualTo("<p>second</p>");
    }

    @Test
    @DisplayName("Should drop undecodable bytes instead of failing")
    void shouldIgnoreMalformedBytes() throws Exception {
        byte[] prefix = "<!DOCTYPE html><p>ok".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[prefix.length + 2];
        System.arraycopy(prefix, 0, bytes, 0, prefix.length);
        bytes[prefix.length] = (byte) 0xC3;
        bytes[prefix.length + 1] = (byte) 0x28;
        Files.write(crawlDir.resolve("bad.html"), bytes);

        List<RawDocument> documents = reader.read(crawlDir);

        assertThat(documents).hasSize(1);
        assertThat(documents.get(0).markup()).isEqualTo("<!DOCTYPE html><p>ok(");
    }

    @Test
    void shouldFailWhenDirectoryIsMissing() {
        assertThatThrownBy(() -> reader.read(crawlDir.resolve("missing")))
            .isInstanceOf(NoSuchFileException.class);
    }
}
