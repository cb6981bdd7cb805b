package com.hybridsearch.pipeline;

import com.hybridsearch.model.DocumentTermCounts;
import com.hybridsearch.model.ParsedCorpus;
import com.hybridsearch.model.ParsedDocument;
import com.hybridsearch.model.TermFrequencies;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;

@Slf4j
@Component
@RequiredArgsConstructor
public class TermFrequencyAggregator {

    private final MapReduceExecutor mapReduce;

    public TermFrequencies aggregate(ParsedCorpus corpus) {
        PipelineStage.TERM_FREQUENCY.requireOutputOf(PipelineStage.DOCUMENT_PARSER, corpus);

        List<DocumentTermCounts> documents =
            mapReduce.run("term-frequency", corpus.documents(), this::emitTerms, this::countTerms);

        log.info("Aggregated term counts for {} documents", documents.size());
        return new TermFrequencies(documents);
    }

    private void emitTerms(ParsedDocument document, BiConsumer<Integer, List<String>> emit) {
        emit.accept(document.docId(), document.terms());
    }

    private DocumentTermCounts countTerms(Integer docId, List<List<String>> termLists) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        for (List<String> terms : termLists) {
            for (String term : terms) {
                counts.merge(term, 1, Integer::sum);
            }
        }
        return new DocumentTermCounts(docId, counts);
    }
}
