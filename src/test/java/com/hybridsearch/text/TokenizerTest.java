package com.hybridsearch.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer(Set.of("the", "and", "of"), false);

    @Test
    @DisplayName("Should lowercase, strip punctuation and drop stop words")
    void shouldNormalizeText() {
        assertThat(tokenizer.tokenize("The Cat, and the DOG!  Of course..."))
            .containsExactly("cat", "dog", "course");
    }

    @Test
    @DisplayName("Should keep digits and join words split by punctuation")
    void shouldKeepDigits() {
        assertThat(tokenizer.tokenize("COVID-19 in 2020\tyear")).containsExactly("covid19", "in", "2020", "year");
    }

    @Test
    @DisplayName("Should keep term order and duplicates")
    void shouldKeepOrderAndDuplicates() {
        assertThat(tokenizer.tokenize("dog cat dog")).containsExactly("dog", "cat", "dog");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\n\t", "the and of", "!!! ???"})
    @DisplayName("Should return no terms for empty, blank or stop-word-only input")
    void shouldReturnEmptyForEmptyInput(String input) {
        assertThat(tokenizer.tokenize(input)).isEmpty();
    }

    @Test
    @DisplayName("Should drop non-ASCII letters instead of failing")
    void shouldDropNonAsciiCharacters() {
        assertThat(tokenizer.tokenize("café naïve")).containsExactly("caf", "nave");
    }

    @Nested
    @DisplayName("Stemming")
    class StemmingTests {

        private final Tokenizer stemming = new Tokenizer(Set.of("the"), true);

        @Test
        void shouldStemWhenEnabled() {
            assertThat(stemming.tokenize("the running dogs")).containsExactly("run", "dog");
            assertThat(stemming.isStemming()).isTrue();
        }

        @Test
        void shouldNotStemByDefault() {
            assertThat(tokenizer.tokenize("running dogs")).containsExactly("running", "dogs");
            assertThat(tokenizer.isStemming()).isFalse();
        }
    }

    @Nested
    @DisplayName("Stop word file")
    class StopWordFileTests {

        @Test
        void shouldSkipCommentsAndBlankLines() {
            String content = "# comment\nThe\n\n  and  \nof\n";
            Set<String> words = Tokenizer.readStopWords(
                new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));

            assertThat(words).containsExactlyInAnyOrder("the", "and", "of");
        }

        @Test
        void shouldLoadBundledStopWords() throws Exception {
            try (var in = getClass().getResourceAsStream("/stopwords.txt")) {
                Set<String> words = Tokenizer.readStopWords(in);
                assertThat(words).contains("the", "and", "of").doesNotContain("cat", "dog");
            }
        }
    }
}
