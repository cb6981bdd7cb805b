package com.hybridsearch.pipeline;

import com.hybridsearch.exception.PipelineStageException;
import com.hybridsearch.model.DocumentCount;
import com.hybridsearch.model.RawDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.BiConsumer;

@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentCounter {

    private static final String TOTAL = "total";

    private final MapReduceExecutor mapReduce;

    public DocumentCount count(List<RawDocument> crawl) {
        if (crawl == null) {
            throw new PipelineStageException(PipelineStage.DOCUMENT_COUNTER, "crawl input is missing");
        }

        List<Long> totals = mapReduce.run("document-counter", crawl, this::emitOne, this::sum);
        long n = totals.isEmpty() ? 0 : totals.get(0);

        log.info("Counted {} documents", n);
        return new DocumentCount(n);
    }

    private void emitOne(RawDocument document, BiConsumer<String, Long> emit) {
        emit.accept(TOTAL, 1L);
    }

    private Long sum(String key, List<Long> ones) {
        return ones.stream().mapToLong(Long::longValue).sum();
    }
}
