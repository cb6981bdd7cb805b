package com.hybridsearch.repository;

import com.hybridsearch.model.DocumentMetadata;
import com.hybridsearch.model.SimilarDocument;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentEmbeddingRepository implements DocumentEmbeddingRepository {

    private record StoredEmbedding(int docId, float[] vector) {}

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public long count() {
        return jdbcClient.sql("SELECT COUNT(*) FROM document_embeddings")
            .query(Long.class)
            .single();
    }

    @Override
    public Map<Integer, float[]> findByDocIds(Collection<Integer> docIds) {
        if (docIds == null || docIds.isEmpty()) {
            return Map.of();
        }

        String sql = """
            SELECT docid, embedding::text AS embedding
            FROM document_embeddings
            WHERE docid IN (:ids)
            """;

        List<StoredEmbedding> rows = jdbcClient.sql(sql)
            .param("ids", docIds)
            .query((rs, rowNum) -> {
                PGvector vector = new PGvector();
                vector.setValue(rs.getString("embedding"));
                return new StoredEmbedding(rs.getInt("docid"), vector.toArray());
            })
            .list();

        Map<Integer, float[]> result = new HashMap<>();
        rows.forEach(row -> result.put(row.docId(), row.vector()));
        return result;
    }

    @Override
    public List<SimilarDocument> findNearest(float[] vector, int limit) {
        // <=> is cosine distance, so 1 - distance is the cosine similarity
        String sql = """
            SELECT docid, 1 - (embedding <=> :vector) AS similarity
            FROM document_embeddings
            ORDER BY embedding <=> :vector ASC, docid ASC
            LIMIT :limit
            """;

        return jdbcClient.sql(sql)
            .param("vector", new PGvector(vector))
            .param("limit", limit)
            .query((rs, rowNum) -> new SimilarDocument(rs.getInt("docid"), rs.getDouble("similarity")))
            .list();
    }

    @Override
    public void saveAll(Map<Integer, float[]> embeddings) {
        if (embeddings == null || embeddings.isEmpty()) {
            return;
        }

        String sql = """
            INSERT INTO document_embeddings (docid, embedding)
            VALUES (?, ?)
            ON CONFLICT (docid) DO UPDATE SET embedding = EXCLUDED.embedding
            """;

        List<Map.Entry<Integer, float[]>> rows = new ArrayList<>(new TreeMap<>(embeddings).entrySet());
        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                ps.setInt(1, rows.get(i).getKey());
                ps.setObject(2, new PGvector(rows.get(i).getValue()));
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
    }

    @Override
    public List<DocumentMetadata> findDocumentsWithoutEmbedding(int afterDocId, int limit) {
        String sql = """
            SELECT d.docid, d.title, d.url, d.summary
            FROM documents d
            LEFT JOIN document_embeddings e ON e.docid = d.docid
            WHERE e.docid IS NULL AND d.docid > :after
            ORDER BY d.docid ASC
            LIMIT :limit
            """;

        return jdbcClient.sql(sql)
            .param("after", afterDocId)
            .param("limit", limit)
            .query((rs, rowNum) -> new DocumentMetadata(
                rs.getInt("docid"),
                rs.getString("title") == null ? "" : rs.getString("title"),
                rs.getString("url") == null ? "" : rs.getString("url"),
                rs.getString("summary") == null ? "" : rs.getString("summary")
            ))
            .list();
    }
}
