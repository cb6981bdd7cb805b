package com.hybridsearch.pipeline;

import com.hybridsearch.exception.PipelineStageException;
import com.hybridsearch.model.DocumentCount;
import com.hybridsearch.model.DocumentNorms;
import com.hybridsearch.model.DocumentTermCounts;
import com.hybridsearch.model.ParsedCorpus;
import com.hybridsearch.model.ParsedDocument;
import com.hybridsearch.model.Posting;
import com.hybridsearch.model.TermFrequencies;
import com.hybridsearch.model.TermPostings;
import com.hybridsearch.model.WeightedPostings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Term frequency, idf and norm stages over the collection {1: "cat dog", 2: "cat", 3: "dog dog", 4: ""}.
 */
class TermStatisticsTest {

    private static final double IDF_TWO_OF_FOUR = Math.log10(4.0 / 2.0);

    private ExecutorService pool;
    private MapReduceExecutor mapReduce;
    private TermFrequencies termFrequencies;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        mapReduce = new MapReduceExecutor(pool, 2);
        ParsedCorpus corpus = new ParsedCorpus(List.of(
            document(1, "cat", "dog"),
            document(2, "cat"),
            document(3, "dog", "dog"),
            document(4)), 0);
        termFrequencies = new TermFrequencyAggregator(mapReduce).aggregate(corpus);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static ParsedDocument document(int docId, String... terms) {
        return new ParsedDocument(docId, "", List.of(terms), new TreeSet<>());
    }

    @Nested
    @DisplayName("Term frequency aggregation")
    class TermFrequencyTests {

        @Test
        void shouldCountTermsPerDocumentOrderedByDocId() {
            assertThat(termFrequencies.documents()).extracting(DocumentTermCounts::docId).containsExactly(1, 2, 3, 4);
            assertThat(termFrequencies.documents().get(2).termCounts()).containsEntry("dog", 2).hasSize(1);
        }

        @Test
        void shouldKeepDocumentsWithoutTerms() {
            assertThat(termFrequencies.documents().get(3).isEmpty()).isTrue();
        }

        @Test
        void shouldRequireParsedDocuments() {
            assertThatThrownBy(() -> new TermFrequencyAggregator(mapReduce).aggregate(null))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("DOCUMENT_PARSER");
        }
    }

    @Nested
    @DisplayName("IDF join")
    class IdfJoinTests {

        @Test
        @DisplayName("Should compute idf = log10(N / df) and weight = tf * idf")
        void shouldWeighPostings() {
            WeightedPostings weighted = new IdfJoiner(mapReduce).join(new DocumentCount(4), termFrequencies);

            assertThat(weighted.terms()).extracting(TermPostings::term).containsExactly("cat", "dog");
            TermPostings dog = weighted.terms().get(1);
            assertThat(dog.idf()).isCloseTo(IDF_TWO_OF_FOUR, within(1e-12));
            assertThat(dog.postings()).extracting(Posting::docId).containsExactly(1, 3);
            assertThat(dog.postings().get(1).tf()).isEqualTo(2);
            assertThat(dog.postings().get(1).weight()).isCloseTo(2 * IDF_TWO_OF_FOUR, within(1e-12));
            assertThat(weighted.postingCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should give idf 0 to a term present in every document")
        void shouldGiveZeroIdfToUbiquitousTerm() {
            TermFrequencies everywhere = new TermFrequencyAggregator(mapReduce).aggregate(new ParsedCorpus(
                List.of(document(1, "web"), document(2, "web", "page")), 0));

            WeightedPostings weighted = new IdfJoiner(mapReduce).join(new DocumentCount(2), everywhere);

            TermPostings web = weighted.terms().get(1);
            assertThat(web.term()).isEqualTo("web");
            assertThat(web.idf()).isZero();
            assertThat(web.postings()).allMatch(p -> p.weight() == 0.0);
        }

        @Test
        @DisplayName("Should fail naming the counter stage when N is missing")
        void shouldRequireDocumentCount() {
            assertThatThrownBy(() -> new IdfJoiner(mapReduce).join(null, termFrequencies))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("IDF_JOINER")
                .hasMessageContaining("DOCUMENT_COUNTER");
        }

        @Test
        void shouldRequireTermFrequencies() {
            assertThatThrownBy(() -> new IdfJoiner(mapReduce).join(new DocumentCount(4), null))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("TERM_FREQUENCY");
        }
    }

    @Nested
    @DisplayName("Document normalization")
    class NormalizationTests {

        @Test
        @DisplayName("Should compute the L2 norm of each document's weights")
        void shouldComputeNorms() {
            WeightedPostings weighted = new IdfJoiner(mapReduce).join(new DocumentCount(4), termFrequencies);

            DocumentNorms norms = new DocumentNormalizer(mapReduce).normalize(termFrequencies, weighted);

            assertThat(norms.normOf(1)).isCloseTo(Math.sqrt(2) * IDF_TWO_OF_FOUR, within(1e-12));
            assertThat(norms.normOf(2)).isCloseTo(IDF_TWO_OF_FOUR, within(1e-12));
            assertThat(norms.normOf(3)).isCloseTo(2 * IDF_TWO_OF_FOUR, within(1e-12));
        }

        @Test
        @DisplayName("Should give norm 0 to a document without terms")
        void shouldGiveZeroNormToEmptyDocument() {
            WeightedPostings weighted = new IdfJoiner(mapReduce).join(new DocumentCount(4), termFrequencies);

            DocumentNorms norms = new DocumentNormalizer(mapReduce).normalize(termFrequencies, weighted);

            assertThat(norms.norms()).containsEntry(4, 0.0).hasSize(4);
        }

        @Test
        void shouldRequireWeightedPostings() {
            assertThatThrownBy(() -> new DocumentNormalizer(mapReduce).normalize(termFrequencies, null))
                .isInstanceOf(PipelineStageException.class)
                .hasMessageContaining("IDF_JOINER");
        }
    }
}
