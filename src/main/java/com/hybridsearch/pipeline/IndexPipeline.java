package com.hybridsearch.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridsearch.config.IndexProperties;
import com.hybridsearch.config.PipelineProperties;
import com.hybridsearch.event.IndexPublishedEvent;
import com.hybridsearch.exception.PipelineAlreadyRunningException;
import com.hybridsearch.exception.PipelineStageException;
import com.hybridsearch.index.IndexManifest;
import com.hybridsearch.index.IndexPublisher;
import com.hybridsearch.index.InvertedIndexShard;
import com.hybridsearch.model.DocumentCount;
import com.hybridsearch.model.DocumentNorms;
import com.hybridsearch.model.ParsedCorpus;
import com.hybridsearch.model.PipelineReport;
import com.hybridsearch.model.RawDocument;
import com.hybridsearch.model.TermFrequencies;
import com.hybridsearch.model.WeightedPostings;
import com.hybridsearch.text.Tokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Full rebuild: crawl to published shard set. Stages run strictly in order, each stage's output
 * is checkpointed before the next one starts, and nothing is published unless every stage
 * succeeded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexPipeline {

    private final CrawlReader crawlReader;
    private final DocumentCounter documentCounter;
    private final DocumentParser documentParser;
    private final TermFrequencyAggregator termFrequencyAggregator;
    private final IdfJoiner idfJoiner;
    private final DocumentNormalizer documentNormalizer;
    private final IndexSharder indexSharder;
    private final IndexPublisher publisher;
    private final Tokenizer tokenizer;
    private final PipelineProperties pipelineProperties;
    private final IndexProperties indexProperties;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;

    private final ReentrantLock rebuildLock = new ReentrantLock();

    public boolean isRunning() {
        return rebuildLock.isLocked();
    }

    public PipelineReport rebuild() {
        if (!rebuildLock.tryLock()) {
            throw new PipelineAlreadyRunningException();
        }
        try {
            return runPipeline();
        } finally {
            rebuildLock.unlock();
        }
    }

    private PipelineReport runPipeline() {
        long started = System.currentTimeMillis();
        String version = publisher.nextVersion();
        StageCheckpoints checkpoints = new StageCheckpoints(
            pipelineProperties.workDirectory().resolve(version), objectMapper);

        log.info("Rebuilding index version {} from {}", version, pipelineProperties.crawlDirectory());

        List<RawDocument> crawl;
        try {
            crawl = crawlReader.read(pipelineProperties.crawlDirectory());
        } catch (IOException e) {
            throw new PipelineStageException(PipelineStage.DOCUMENT_COUNTER,
                "cannot read crawl directory " + pipelineProperties.crawlDirectory(), e);
        }

        DocumentCount count = runStage(PipelineStage.DOCUMENT_COUNTER, checkpoints,
            () -> documentCounter.count(crawl), c -> List.of(c));
        ParsedCorpus corpus = runStage(PipelineStage.DOCUMENT_PARSER, checkpoints,
            () -> documentParser.parse(crawl), ParsedCorpus::documents);
        TermFrequencies termFrequencies = runStage(PipelineStage.TERM_FREQUENCY, checkpoints,
            () -> termFrequencyAggregator.aggregate(corpus), TermFrequencies::documents);
        WeightedPostings weighted = runStage(PipelineStage.IDF_JOINER, checkpoints,
            () -> idfJoiner.join(count, termFrequencies), WeightedPostings::terms);
        DocumentNorms norms = runStage(PipelineStage.DOCUMENT_NORMALIZER, checkpoints,
            () -> documentNormalizer.normalize(termFrequencies, weighted), n -> n.norms().entrySet());
        List<InvertedIndexShard> shards = runStage(PipelineStage.INDEX_SHARDER, checkpoints,
            () -> indexSharder.shard(weighted, norms, indexProperties.shards()), s -> List.of());

        IndexManifest manifest = new IndexManifest(
            version, shards.size(), count.value(), weighted.terms().size(), tokenizer.isStemming());
        try {
            publisher.publish(manifest, shards, corpus.documents());
        } catch (IOException e) {
            log.error("Publishing index version {} failed: {}", version, e.getMessage());
            throw new PipelineStageException(PipelineStage.INDEX_SHARDER, "publish failed: " + e.getMessage(), e);
        }

        cleanUp(checkpoints);
        eventPublisher.publishEvent(new IndexPublishedEvent(version));

        PipelineReport report = new PipelineReport(
            version,
            count.value(),
            corpus.documents().size(),
            corpus.skippedDocuments(),
            weighted.terms().size(),
            weighted.postingCount(),
            shards.size(),
            System.currentTimeMillis() - started
        );
        log.info("Rebuild finished: {}", report);
        return report;
    }

    private <T> T runStage(
        PipelineStage stage,
        StageCheckpoints checkpoints,
        Supplier<T> work,
        Function<T, Collection<?>> checkpointRecords
    ) {
        long started = System.currentTimeMillis();
        log.info("Stage {} started", stage);

        T output;
        try {
            output = work.get();
        } catch (PipelineStageException e) {
            log.error("{}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Stage {} failed: {}", stage, e.getMessage(), e);
            throw new PipelineStageException(stage, e.getMessage(), e);
        }

        Collection<?> records = checkpointRecords.apply(output);
        if (!records.isEmpty()) {
            try {
                checkpoints.write(stage, records);
            } catch (IOException e) {
                throw new PipelineStageException(stage, "cannot write checkpoint: " + e.getMessage(), e);
            }
        }

        log.info("Stage {} finished in {} ms", stage, System.currentTimeMillis() - started);
        return output;
    }

    private void cleanUp(StageCheckpoints checkpoints) {
        if (pipelineProperties.keepWorkFiles()) {
            return;
        }
        try {
            checkpoints.deleteAll();
        } catch (IOException e) {
            log.warn("Could not delete work files under {}: {}", checkpoints.runDirectory(), e.getMessage());
        }
    }
}
