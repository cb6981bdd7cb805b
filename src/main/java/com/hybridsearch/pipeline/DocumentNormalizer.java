package com.hybridsearch.pipeline;

import com.hybridsearch.model.DocumentNorms;
import com.hybridsearch.model.DocumentTermCounts;
import com.hybridsearch.model.Posting;
import com.hybridsearch.model.TermFrequencies;
import com.hybridsearch.model.TermPostings;
import com.hybridsearch.model.WeightedPostings;
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
public class DocumentNormalizer {

    private record DocumentNorm(int docId, double norm) {}

    private final MapReduceExecutor mapReduce;

    public DocumentNorms normalize(TermFrequencies termFrequencies, WeightedPostings weighted) {
        PipelineStage.DOCUMENT_NORMALIZER.requireOutputOf(PipelineStage.TERM_FREQUENCY, termFrequencies);
        PipelineStage.DOCUMENT_NORMALIZER.requireOutputOf(PipelineStage.IDF_JOINER, weighted);

        List<DocumentNorm> computed =
            mapReduce.run("document-normalizer", weighted.terms(), this::emitWeights, this::norm);

        SortedMap<Integer, Double> norms = new TreeMap<>();
        for (DocumentTermCounts document : termFrequencies.documents()) {
            norms.put(document.docId(), 0.0);
        }
        for (DocumentNorm norm : computed) {
            norms.put(norm.docId(), norm.norm());
        }

        log.info("Computed norms for {} documents", norms.size());
        return new DocumentNorms(norms);
    }

    private void emitWeights(TermPostings term, BiConsumer<Integer, Double> emit) {
        for (Posting posting : term.postings()) {
            emit.accept(posting.docId(), posting.weight());
        }
    }

    private DocumentNorm norm(Integer docId, List<Double> weights) {
        double sumOfSquares = 0.0;
        for (double weight : weights) {
            sumOfSquares += weight * weight;
        }
        return new DocumentNorm(docId, Math.sqrt(sumOfSquares));
    }
}
