package com.hybridsearch.pipeline;

import com.hybridsearch.exception.PipelineStageException;
import com.hybridsearch.model.DocumentCount;
import com.hybridsearch.model.DocumentTermCounts;
import com.hybridsearch.model.Posting;
import com.hybridsearch.model.TermFrequencies;
import com.hybridsearch.model.TermPostings;
import com.hybridsearch.model.WeightedPostings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Joins term counts with the collection size: {@code idf = log10(N / df)} and one weighted
 * posting per (term, document), ordered by term and then doc id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdfJoiner {

    private record TermOccurrence(int docId, int tf) {}

    private final MapReduceExecutor mapReduce;

    public WeightedPostings join(DocumentCount documentCount, TermFrequencies termFrequencies) {
        PipelineStage.IDF_JOINER.requireOutputOf(PipelineStage.DOCUMENT_COUNTER, documentCount);
        PipelineStage.IDF_JOINER.requireOutputOf(PipelineStage.TERM_FREQUENCY, termFrequencies);

        long n = documentCount.value();
        List<TermPostings> terms = mapReduce.run("idf-joiner", termFrequencies.documents(),
            this::emitOccurrences,
            (String term, List<TermOccurrence> occurrences) -> weigh(term, occurrences, n));

        WeightedPostings weighted = new WeightedPostings(n, terms);
        log.info("Joined {} terms into {} postings (N={})", terms.size(), weighted.postingCount(), n);
        return weighted;
    }

    private void emitOccurrences(DocumentTermCounts document, BiConsumer<String, TermOccurrence> emit) {
        for (Map.Entry<String, Integer> entry : document.termCounts().entrySet()) {
            emit.accept(entry.getKey(), new TermOccurrence(document.docId(), entry.getValue()));
        }
    }

    private TermPostings weigh(String term, List<TermOccurrence> occurrences, long n) {
        long df = occurrences.stream().mapToInt(TermOccurrence::docId).distinct().count();
        if (df > n) {
            throw new PipelineStageException(PipelineStage.IDF_JOINER,
                "term '" + term + "' occurs in " + df + " documents but N is " + n);
        }
        double idf = Math.log10((double) n / df);

        List<Posting> postings = new ArrayList<>(occurrences.size());
        for (TermOccurrence occurrence : occurrences) {
            postings.add(Posting.of(occurrence.docId(), occurrence.tf(), idf));
        }
        postings.sort(Comparator.comparingInt(Posting::docId));
        return new TermPostings(term, idf, postings);
    }
}
