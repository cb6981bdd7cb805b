package com.hybridsearch.pipeline;

import com.hybridsearch.exception.PipelineStageException;

public enum PipelineStage {
    DOCUMENT_COUNTER("00-document-count"),
    DOCUMENT_PARSER("01-parsed-documents"),
    TERM_FREQUENCY("02-term-frequencies"),
    IDF_JOINER("03-weighted-postings"),
    DOCUMENT_NORMALIZER("04-document-norms"),
    INDEX_SHARDER("05-shards");

    private final String checkpointName;

    PipelineStage(String checkpointName) {
        this.checkpointName = checkpointName;
    }

    public String checkpointName() {
        return checkpointName;
    }

    /**
     * Fails this stage when the output of {@code predecessor} was not handed in.
     */
    public <T> T requireOutputOf(PipelineStage predecessor, T output) {
        if (output == null) {
            throw PipelineStageException.missingPredecessor(this, predecessor);
        }
        return output;
    }
}
