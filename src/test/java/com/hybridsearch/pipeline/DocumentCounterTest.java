package com.hybridsearch.pipeline;

import com.hybridsearch.TestIndexes;
import com.hybridsearch.exception.PipelineStageException;
import com.hybridsearch.model.RawDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentCounterTest {

    private ExecutorService pool;
    private DocumentCounter counter;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(3);
        counter = new DocumentCounter(new MapReduceExecutor(pool, 3));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldCountEveryRawDocumentIncludingUnparseableOnes() {
        List<RawDocument> crawl = new ArrayList<>(TestIndexes.crawl(Map.of(1, "a", 2, "b", 3, "c")));
        crawl.add(new RawDocument("x.html", 0, "<p>no doc id</p>"));

        assertThat(counter.count(crawl).value()).isEqualTo(4);
    }

    @Test
    void shouldCountEmptyCrawlAsZero() {
        assertThat(counter.count(List.of()).value()).isZero();
    }

    @Test
    void shouldRejectMissingCrawl() {
        assertThatThrownBy(() -> counter.count(null))
            .isInstanceOf(PipelineStageException.class)
            .satisfies(e -> assertThat(((PipelineStageException) e).getStage()).isEqualTo(PipelineStage.DOCUMENT_COUNTER));
    }
}
