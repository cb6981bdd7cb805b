package com.hybridsearch.service;

import com.hybridsearch.model.IndexStatus;
import com.hybridsearch.model.PipelineReport;

public interface IndexService {
    PipelineReport rebuild();
    IndexStatus status();
}
