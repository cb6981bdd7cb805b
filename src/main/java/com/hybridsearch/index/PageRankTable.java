package com.hybridsearch.index;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only doc id to PageRank lookup. Unknown documents score 0.
 */
@Slf4j
public final class PageRankTable {

    private static final PageRankTable EMPTY = new PageRankTable(Map.of());

    private final Map<Integer, Double> scores;

    private PageRankTable(Map<Integer, Double> scores) {
        this.scores = Map.copyOf(scores);
    }

    public static PageRankTable empty() {
        return EMPTY;
    }

    public static PageRankTable of(Map<Integer, Double> scores) {
        return new PageRankTable(scores);
    }

    /**
     * Reads {@code docId,score} lines. Malformed lines are skipped; a missing file yields an
     * empty table.
     */
    public static PageRankTable load(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            log.warn("PageRank file {} not found, every PageRank value will be 0", file);
            return EMPTY;
        }

        Map<Integer, Double> scores = new HashMap<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] parts = line.trim().split("\\s*,\\s*");
                if (parts.length != 2) {
                    skipped++;
                    continue;
                }
                try {
                    double score = Double.parseDouble(parts[1]);
                    if (!Double.isFinite(score)) {
                        skipped++;
                        continue;
                    }
                    scores.put(Integer.parseInt(parts[0]), score);
                } catch (NumberFormatException e) {
                    skipped++;
                }
            }
        }

        if (skipped > 0) {
            log.warn("Skipped {} malformed lines in PageRank file {}", skipped, file);
        }
        log.info("Loaded {} PageRank values from {}", scores.size(), file);
        return new PageRankTable(scores);
    }

    public double score(int docId) {
        return scores.getOrDefault(docId, 0.0);
    }

    public int size() {
        return scores.size();
    }
}
