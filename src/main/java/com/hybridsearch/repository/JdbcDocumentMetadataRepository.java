package com.hybridsearch.repository;

import com.hybridsearch.model.DocumentMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentMetadataRepository implements DocumentMetadataRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<DocumentMetadata> metadataMapper = (rs, rowNum) -> new DocumentMetadata(
        rs.getInt("docid"),
        nullToEmpty(rs.getString("title")),
        nullToEmpty(rs.getString("url")),
        nullToEmpty(rs.getString("summary"))
    );

    @Override
    public Map<Integer, DocumentMetadata> findByIds(Collection<Integer> docIds) {
        if (docIds == null || docIds.isEmpty()) {
            return Map.of();
        }

        String sql = """
            SELECT docid, title, url, summary
            FROM documents
            WHERE docid IN (:ids)
            """;

        Map<Integer, DocumentMetadata> result = new HashMap<>();
        jdbcClient.sql(sql)
            .param("ids", docIds)
            .query(metadataMapper)
            .list()
            .forEach(doc -> result.put(doc.docId(), doc));
        return result;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
