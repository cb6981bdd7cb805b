package com.hybridsearch.repository;

import com.hybridsearch.model.DocumentMetadata;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.annotation.DirtiesContext;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest(properties = {
    "app.gemini.api-key=",
    "app.index.directory=${java.io.tmpdir}/hybrid-search-it/index",
    "app.index.pagerank-file=${java.io.tmpdir}/hybrid-search-it/pagerank.out",
    "app.pipeline.crawl-directory=${java.io.tmpdir}/hybrid-search-it/crawl",
    "app.pipeline.work-directory=${java.io.tmpdir}/hybrid-search-it/work",
    "spring.datasource.hikari.initialization-fail-timeout=0"
})
@Testcontainers(disabledWithoutDocker = true)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public abstract class BaseIntegrationTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("pgvector/pgvector:pg16");

    @Autowired
    protected JdbcClient jdbcClient;

    /** The documents table is written by an external process, so tests seed it directly. */
    protected void insertDocuments(DocumentMetadata... documents) {
        for (DocumentMetadata doc : documents) {
            jdbcClient.sql("INSERT INTO documents (docid, title, url, summary) VALUES (:docid, :title, :url, :summary)")
                .param("docid", doc.docId())
                .param("title", doc.title())
                .param("url", doc.url())
                .param("summary", doc.summary())
                .update();
        }
    }
}
