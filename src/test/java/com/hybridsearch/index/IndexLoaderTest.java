package com.hybridsearch.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridsearch.TestIndexes;
import com.hybridsearch.config.IndexProperties;
import com.hybridsearch.model.ParsedDocument;
import com.hybridsearch.text.Tokenizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexLoaderTest {

    @TempDir
    Path root;

    private ExecutorService pool;
    private IndexProperties properties;
    private IndexPublisher publisher;
    private IndexSnapshot built;

    @BeforeEach
    void setUp() throws Exception {
        pool = Executors.newFixedThreadPool(2);
        Path pageRank = root.resolve("pagerank.out");
        Files.writeString(pageRank, "1,0.4\n3,0.6\n");
        properties = new IndexProperties(root.resolve("index"), 3, pageRank, 2);
        publisher = new IndexPublisher(properties, new ObjectMapper());
        built = TestIndexes.snapshot(Map.of(1, "cat dog", 2, "cat", 3, "dog dog"), 3, PageRankTable.empty());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private IndexLoader loader(Tokenizer tokenizer) {
        return new IndexLoader(publisher, properties, tokenizer, pool);
    }

    private String publish(boolean stemming) throws Exception {
        String version = publisher.nextVersion();
        IndexManifest manifest = new IndexManifest(version, 3, 3, 2, stemming);
        List<ParsedDocument> documents = List.of(
            new ParsedDocument(1, "", List.of("cat", "dog"), new TreeSet<>(List.of(3))),
            new ParsedDocument(2, "", List.of("cat"), new TreeSet<>()),
            new ParsedDocument(3, "", List.of("dog", "dog"), new TreeSet<>(List.of(1, 2))));
        publisher.publish(manifest, built.shards(), documents);
        return version;
    }

    @Test
    @DisplayName("Should load every shard of the current version with PageRank")
    void shouldLoadCurrentVersion() throws Exception {
        String version = publish(false);

        Optional<IndexSnapshot> loaded = loader(TestIndexes.tokenizer()).loadCurrent();

        assertThat(loaded).isPresent();
        IndexSnapshot snapshot = loaded.get();
        assertThat(snapshot.version()).isEqualTo(version);
        assertThat(snapshot.loadedShards()).containsExactly(0, 1, 2);
        assertThat(snapshot.missingShards()).isEmpty();
        assertThat(snapshot.shards()).isEqualTo(built.shards());
        assertThat(snapshot.idf("cat")).hasValue(Math.log10(3.0 / 2.0));
        assertThat(snapshot.idf("bird")).isEmpty();
        assertThat(snapshot.pageRank().score(3)).isEqualTo(0.6);
    }

    @Test
    @DisplayName("Should write the link table next to the shards")
    void shouldWriteLinkTable() throws Exception {
        String version = publish(false);

        assertThat(Files.readAllLines(publisher.versionDirectory(version).resolve(IndexPublisher.LINKS)))
            .containsExactly("1 3", "2", "3 1 2");
    }

    @Test
    @DisplayName("Should serve the remaining shards when one shard file is unreadable")
    void shouldRecordMissingShard() throws Exception {
        String version = publish(false);
        Files.writeString(publisher.versionDirectory(version).resolve(ShardCodec.fileName(1)), "cat broken\n");

        IndexSnapshot snapshot = loader(TestIndexes.tokenizer()).loadCurrent().orElseThrow();

        assertThat(snapshot.loadedShards()).containsExactly(0, 2);
        assertThat(snapshot.missingShards()).containsExactly(1);
    }

    @Test
    @DisplayName("Should return empty when nothing was published")
    void shouldReturnEmptyWithoutPointer() throws Exception {
        assertThat(loader(TestIndexes.tokenizer()).loadCurrent()).isEmpty();
    }

    @Test
    @DisplayName("Should refuse an index built with a different stemming setting")
    void shouldRejectStemmingMismatch() throws Exception {
        publish(true);

        assertThatThrownBy(() -> loader(TestIndexes.tokenizer()).loadCurrent())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("stemming");
    }
}
