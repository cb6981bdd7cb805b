package com.hybridsearch.repository;

import com.hybridsearch.model.DocumentMetadata;
import com.hybridsearch.model.SimilarDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class JdbcDocumentEmbeddingRepositoryTest extends BaseIntegrationTest {

    private static final int DIMENSION = 768;

    @Autowired
    private DocumentEmbeddingRepository embeddingRepository;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("TRUNCATE documents CASCADE").update();
        insertDocuments(
            new DocumentMetadata(1, "Cats", "http://example.com/1", ""),
            new DocumentMetadata(2, "Dogs", "http://example.com/2", ""),
            new DocumentMetadata(3, "Birds", "http://example.com/3", ""),
            new DocumentMetadata(4, "Fish", "http://example.com/4", ""));
    }

    private static float[] axis(int... dimensions) {
        float[] vector = new float[DIMENSION];
        for (int dimension : dimensions) {
            vector[dimension] = 1f;
        }
        return vector;
    }

    @Test
    @DisplayName("Should store vectors and read them back by doc id")
    void shouldSaveAndFindByDocIds() {
        embeddingRepository.saveAll(Map.of(1, axis(0), 2, axis(1)));

        Map<Integer, float[]> found = embeddingRepository.findByDocIds(List.of(1, 2, 3));

        assertThat(found).containsOnlyKeys(1, 2);
        assertThat(found.get(1)).isEqualTo(axis(0));
        assertThat(embeddingRepository.count()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should order nearest neighbours by cosine similarity")
    void shouldFindNearest() {
        embeddingRepository.saveAll(Map.of(1, axis(0), 2, axis(0, 1), 3, axis(1)));

        List<SimilarDocument> nearest = embeddingRepository.findNearest(axis(0), 2);

        assertThat(nearest).extracting(SimilarDocument::docId).containsExactly(1, 2);
        assertThat(nearest.get(0).similarity()).isCloseTo(1.0, within(1e-6));
        assertThat(nearest.get(1).similarity()).isCloseTo(1.0 / Math.sqrt(2.0), within(1e-6));
    }

    @Test
    @DisplayName("Should page through documents that still lack a vector")
    void shouldFindDocumentsWithoutEmbedding() {
        embeddingRepository.saveAll(Map.of(2, axis(0)));

        List<DocumentMetadata> firstPage = embeddingRepository.findDocumentsWithoutEmbedding(Integer.MIN_VALUE, 2);
        List<DocumentMetadata> secondPage = embeddingRepository.findDocumentsWithoutEmbedding(3, 2);

        assertThat(firstPage).extracting(DocumentMetadata::docId).containsExactly(1, 3);
        assertThat(secondPage).extracting(DocumentMetadata::docId).containsExactly(4);
    }

    @Test
    @DisplayName("Constraint: Fail when the vector belongs to an unknown document (FK)")
    void shouldRejectVectorForUnknownDocument() {
        assertThatThrownBy(() -> embeddingRepository.saveAll(Map.of(99, axis(0))))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void shouldDropVectorsWithTheirDocument() {
        embeddingRepository.saveAll(Map.of(1, axis(0)));

        jdbcClient.sql("DELETE FROM documents WHERE docid = 1").update();

        assertThat(embeddingRepository.count()).isZero();
    }
}
