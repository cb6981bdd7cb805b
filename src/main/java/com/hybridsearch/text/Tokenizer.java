package com.hybridsearch.text;

import opennlp.tools.stemmer.PorterStemmer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps raw text to normalized terms. The same instance serves indexing and querying, so any
 * change here requires a full rebuild.
 */
public class Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9 ]+");

    // PorterStemmer keeps per-call state
    private static final ThreadLocal<PorterStemmer> STEMMER = ThreadLocal.withInitial(PorterStemmer::new);

    private final Set<String> stopWords;
    private final boolean stemming;

    public Tokenizer(Set<String> stopWords, boolean stemming) {
        this.stopWords = Collections.unmodifiableSet(new HashSet<>(stopWords));
        this.stemming = stemming;
    }

    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String lowered = text.toLowerCase(Locale.ROOT);
        String spaced = WHITESPACE.matcher(lowered).replaceAll(" ");
        String cleaned = NON_ALPHANUMERIC.matcher(spaced).replaceAll("");

        List<String> terms = new ArrayList<>();
        for (String token : cleaned.split(" ")) {
            if (token.isEmpty() || stopWords.contains(token)) {
                continue;
            }
            terms.add(stemming ? STEMMER.get().stem(token) : token);
        }
        return terms;
    }

    public boolean isStemming() {
        return stemming;
    }

    public boolean isStopWord(String word) {
        return stopWords.contains(word);
    }

    public static Set<String> readStopWords(InputStream in) {
        Set<String> words = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim().toLowerCase(Locale.ROOT);
                if (!word.isEmpty() && !word.startsWith("#")) {
                    words.add(word);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stop words", e);
        }
        return words;
    }
}
