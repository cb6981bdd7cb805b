package com.hybridsearch.index;

import com.hybridsearch.exception.ShardFormatException;
import com.hybridsearch.model.Posting;
import com.hybridsearch.model.TermPostings;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Text form of a shard, one line per term:
 * <pre>term idf docId tf weight norm [docId tf weight norm]...</pre>
 * Lines are sorted by term and postings by doc id. Doubles use {@link Double#toString(double)},
 * so identical shards encode to identical bytes.
 */
public final class ShardCodec {

    private static final int POSTING_FIELDS = 4;

    private ShardCodec() {
    }

    public static String fileName(int shardId) {
        return "inverted_index_" + shardId + ".txt";
    }

    public static void write(Path file, InvertedIndexShard shard) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            StringBuilder line = new StringBuilder();
            for (TermPostings term : shard.entries().values()) {
                line.setLength(0);
                line.append(term.term()).append(' ').append(term.idf());
                for (Posting posting : term.postings()) {
                    line.append(' ').append(posting.docId())
                        .append(' ').append(posting.tf())
                        .append(' ').append(posting.weight())
                        .append(' ').append(shard.norm(posting.docId()));
                }
                writer.write(line.toString());
                writer.write('\n');
            }
        }
    }

    public static InvertedIndexShard read(Path file, int shardId) throws IOException {
        SortedMap<String, TermPostings> entries = new TreeMap<>();
        SortedMap<Integer, Double> norms = new TreeMap<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                TermPostings term = parseLine(file, lineNumber, line, norms);
                if (entries.put(term.term(), term) != null) {
                    throw new ShardFormatException(file, lineNumber, "duplicate term '" + term.term() + "'");
                }
            }
        }
        return new InvertedIndexShard(shardId, entries, norms);
    }

    private static TermPostings parseLine(Path file, int lineNumber, String line, SortedMap<Integer, Double> norms) {
        String[] fields = line.trim().split(" ");
        if (fields.length < 2 + POSTING_FIELDS || (fields.length - 2) % POSTING_FIELDS != 0) {
            throw new ShardFormatException(file, lineNumber, "expected term, idf and groups of "
                + POSTING_FIELDS + " posting fields, got " + fields.length + " fields");
        }

        try {
            String term = fields[0];
            double idf = Double.parseDouble(fields[1]);
            List<Posting> postings = new ArrayList<>((fields.length - 2) / POSTING_FIELDS);
            for (int i = 2; i < fields.length; i += POSTING_FIELDS) {
                int docId = Integer.parseInt(fields[i]);
                int tf = Integer.parseInt(fields[i + 1]);
                double weight = Double.parseDouble(fields[i + 2]);
                double norm = Double.parseDouble(fields[i + 3]);
                postings.add(new Posting(docId, tf, idf, weight));
                norms.put(docId, norm);
            }
            return new TermPostings(term, idf, postings);
        } catch (NumberFormatException e) {
            throw new ShardFormatException(file, lineNumber, e.getMessage());
        }
    }
}
