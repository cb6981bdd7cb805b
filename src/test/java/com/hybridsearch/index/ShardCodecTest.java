package com.hybridsearch.index;

import com.hybridsearch.TestIndexes;
import com.hybridsearch.exception.ShardFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShardCodecTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should read back exactly the shard that was written")
    void shouldReadWhatWasWritten() throws Exception {
        IndexSnapshot snapshot = TestIndexes.snapshot(
            Map.of(1, "cat dog", 2, "cat", 3, "dog dog", 4, "bird cat"), 2, PageRankTable.empty());

        for (InvertedIndexShard shard : snapshot.shards()) {
            Path file = dir.resolve(ShardCodec.fileName(shard.shardId()));
            ShardCodec.write(file, shard);

            assertThat(ShardCodec.read(file, shard.shardId())).isEqualTo(shard);
        }
    }

    @Test
    @DisplayName("Should write one sorted line per term with postings ordered by doc id")
    void shouldWriteDocumentedLineFormat() throws Exception {
        IndexSnapshot snapshot = TestIndexes.snapshot(Map.of(2, "zebra apple", 4, "apple"), 2, PageRankTable.empty());
        Path file = dir.resolve(ShardCodec.fileName(0));

        ShardCodec.write(file, snapshot.shards().get(0));

        double idf = Math.log10(2.0);
        assertThat(Files.readAllLines(file)).containsExactly(
            "apple 0.0 2 1 0.0 " + idf + " 4 1 0.0 0.0",
            "zebra " + idf + " 2 1 " + idf + " " + idf);
    }

    @Test
    @DisplayName("Should report the line of a malformed entry")
    void shouldRejectMalformedLine() throws Exception {
        Path file = dir.resolve("broken.txt");
        Files.writeString(file, "cat 0.5 1 1 0.5 0.5\ndog 0.5 2 1 0.5\n");

        assertThatThrownBy(() -> ShardCodec.read(file, 0))
            .isInstanceOf(ShardFormatException.class)
            .hasMessageContaining("line 2");
    }

    @Test
    void shouldRejectNonNumericFields() throws Exception {
        Path file = dir.resolve("broken.txt");
        Files.writeString(file, "cat high 1 1 0.5 0.5\n");

        assertThatThrownBy(() -> ShardCodec.read(file, 0))
            .isInstanceOf(ShardFormatException.class)
            .hasMessageContaining("line 1");
    }
}
