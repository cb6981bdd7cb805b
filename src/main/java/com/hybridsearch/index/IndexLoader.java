package com.hybridsearch.index;

import com.hybridsearch.config.IndexProperties;
import com.hybridsearch.text.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Slf4j
@Component
public class IndexLoader {

    private final IndexPublisher publisher;
    private final IndexProperties properties;
    private final Tokenizer tokenizer;
    private final ExecutorService executor;

    public IndexLoader(
        IndexPublisher publisher,
        IndexProperties properties,
        Tokenizer tokenizer,
        @Qualifier("pipelineExecutor") ExecutorService executor
    ) {
        this.publisher = publisher;
        this.properties = properties;
        this.tokenizer = tokenizer;
        this.executor = executor;
    }

    /**
     * Loads the version named by {@code CURRENT}. Returns empty when nothing was published yet
     * or when no shard of the version could be read.
     */
    public Optional<IndexSnapshot> loadCurrent() throws IOException {
        Optional<String> version = publisher.currentVersion();
        if (version.isEmpty()) {
            log.info("No published index under {}", publisher.indexDirectory());
            return Optional.empty();
        }
        return load(version.get());
    }

    public Optional<IndexSnapshot> load(String version) throws IOException {
        IndexManifest manifest = publisher.readManifest(version);
        if (manifest.stemming() != tokenizer.isStemming()) {
            throw new IllegalStateException("Index " + version + " was built with stemming="
                + manifest.stemming() + " but the tokenizer runs with stemming=" + tokenizer.isStemming());
        }

        Path directory = publisher.versionDirectory(version);
        List<CompletableFuture<InvertedIndexShard>> reads = new ArrayList<>(manifest.shards());
        for (int shardId = 0; shardId < manifest.shards(); shardId++) {
            int id = shardId;
            reads.add(CompletableFuture.supplyAsync(() -> readShard(directory, id), executor));
        }

        List<InvertedIndexShard> shards = new ArrayList<>();
        List<Integer> missing = new ArrayList<>();
        for (int shardId = 0; shardId < reads.size(); shardId++) {
            try {
                shards.add(reads.get(shardId).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Shard {} of index {} could not be loaded: {}", shardId, version, cause.getMessage());
                missing.add(shardId);
            }
        }

        if (shards.isEmpty()) {
            log.error("No shard of index {} could be loaded", version);
            return Optional.empty();
        }

        PageRankTable pageRank = PageRankTable.load(properties.pagerankFile());
        log.info("Loaded index {}: {} shards ({} missing), {} documents",
            version, shards.size(), missing.size(), manifest.documentCount());
        return Optional.of(new IndexSnapshot(manifest, shards, missing, pageRank));
    }

    private InvertedIndexShard readShard(Path directory, int shardId) {
        try {
            return ShardCodec.read(directory.resolve(ShardCodec.fileName(shardId)), shardId);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
