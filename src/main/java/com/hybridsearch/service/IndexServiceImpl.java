package com.hybridsearch.service;

import com.hybridsearch.index.IndexHolder;
import com.hybridsearch.index.IndexSnapshot;
import com.hybridsearch.model.IndexStatus;
import com.hybridsearch.model.PipelineReport;
import com.hybridsearch.model.SemanticCapability;
import com.hybridsearch.pipeline.IndexPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class IndexServiceImpl implements IndexService {

    private final IndexPipeline pipeline;
    private final IndexHolder indexHolder;
    private final SemanticCapabilityProvider capabilityProvider;

    @Override
    public PipelineReport rebuild() {
        return pipeline.rebuild();
    }

    @Override
    public IndexStatus status() {
        SemanticCapability capability = capabilityProvider.current();
        Optional<IndexSnapshot> snapshot = indexHolder.currentIfLoaded();
        if (snapshot.isEmpty()) {
            return new IndexStatus(false, null, 0, List.of(), List.of(),
                capability.available(), capability.reason());
        }
        IndexSnapshot index = snapshot.get();
        return new IndexStatus(true, index.version(), index.documentCount(), index.loadedShards(),
            index.missingShards(), capability.available(), capability.reason());
    }
}
