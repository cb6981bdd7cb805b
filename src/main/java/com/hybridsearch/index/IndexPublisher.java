package com.hybridsearch.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridsearch.config.IndexProperties;
import com.hybridsearch.model.ParsedDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes shard sets into versioned directories and flips the {@code CURRENT} pointer.
 * <p>
 * Layout under the index directory:
 * <pre>
 * CURRENT                       name of the live version
 * versions/&lt;version&gt;/inverted_index_&lt;i&gt;.txt
 * versions/&lt;version&gt;/manifest.json
 * versions/&lt;version&gt;/links.txt
 * </pre>
 * A version directory is complete before it becomes visible, and the pointer is replaced with
 * an atomic move, so readers never see a partially written index.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexPublisher {

    public static final String CURRENT = "CURRENT";
    public static final String MANIFEST = "manifest.json";
    public static final String LINKS = "links.txt";

    private static final String VERSIONS = "versions";
    private static final DateTimeFormatter VERSION_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private final IndexProperties properties;
    private final ObjectMapper objectMapper;

    public Path indexDirectory() {
        return properties.directory();
    }

    public Path versionDirectory(String version) {
        return properties.directory().resolve(VERSIONS).resolve(version);
    }

    public synchronized String nextVersion() {
        String base = LocalDateTime.now(ZoneOffset.UTC).format(VERSION_FORMAT);
        String version = base;
        for (int i = 1; Files.exists(versionDirectory(version)); i++) {
            version = base + "-" + i;
        }
        return version;
    }

    public Optional<String> currentVersion() throws IOException {
        Path pointer = properties.directory().resolve(CURRENT);
        if (!Files.isRegularFile(pointer)) {
            return Optional.empty();
        }
        String version = Files.readString(pointer, StandardCharsets.UTF_8).trim();
        return version.isEmpty() ? Optional.empty() : Optional.of(version);
    }

    public Path publish(
        IndexManifest manifest,
        List<InvertedIndexShard> shards,
        List<ParsedDocument> documents
    ) throws IOException {
        Path versions = properties.directory().resolve(VERSIONS);
        Path target = versionDirectory(manifest.version());
        Path staging = versions.resolve("." + manifest.version() + ".tmp");

        Files.createDirectories(staging);
        try {
            for (InvertedIndexShard shard : shards) {
                Path file = staging.resolve(ShardCodec.fileName(shard.shardId()));
                ShardCodec.write(file, shard);
                fsync(file);
            }

            Path manifestFile = staging.resolve(MANIFEST);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(manifestFile.toFile(), manifest);
            fsync(manifestFile);

            Path linksFile = staging.resolve(LINKS);
            Files.write(linksFile, linkLines(documents), StandardCharsets.UTF_8);
            fsync(linksFile);

            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            try {
                deleteRecursively(staging);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        Path pointerTmp = properties.directory().resolve(CURRENT + ".tmp");
        Files.writeString(pointerTmp, manifest.version() + "\n", StandardCharsets.UTF_8);
        fsync(pointerTmp);
        Files.move(pointerTmp, properties.directory().resolve(CURRENT),
            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);

        log.info("Published index version {} ({} shards, {} documents)",
            manifest.version(), manifest.shards(), manifest.documentCount());

        prune(manifest.version());
        return target;
    }

    public IndexManifest readManifest(String version) throws IOException {
        return objectMapper.readValue(versionDirectory(version).resolve(MANIFEST).toFile(), IndexManifest.class);
    }

    private void prune(String current) {
        Path versions = properties.directory().resolve(VERSIONS);
        try (Stream<Path> dirs = Files.list(versions)) {
            List<Path> published = dirs
                .filter(Files::isDirectory)
                .filter(dir -> !dir.getFileName().toString().startsWith("."))
                .sorted(Comparator.comparing(dir -> dir.getFileName().toString()))
                .collect(Collectors.toList());

            int excess = published.size() - properties.retainedVersions();
            for (int i = 0; i < excess; i++) {
                Path dir = published.get(i);
                if (!dir.getFileName().toString().equals(current)) {
                    deleteRecursively(dir);
                    log.info("Removed old index version {}", dir.getFileName());
                }
            }
        } catch (IOException e) {
            log.warn("Could not prune old index versions: {}", e.getMessage());
        }
    }

    private static List<String> linkLines(List<ParsedDocument> documents) {
        return documents.stream()
            .map(doc -> Stream.concat(Stream.of(doc.docId()), doc.outlinks().stream())
                .map(String::valueOf)
                .collect(Collectors.joining(" ")))
            .toList();
    }

    private static void fsync(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.force(true);
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
