package com.hybridsearch.worker;

import com.hybridsearch.index.IndexHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Picks up versions published by another process sharing the index directory.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexReloadWorker {

    private final IndexHolder indexHolder;

    @Scheduled(
        initialDelayString = "${app.index.reload-check-interval-ms:30000}",
        fixedDelayString = "${app.index.reload-check-interval-ms:30000}"
    )
    public void checkForNewVersion() {
        log.debug("Checking for a newly published index version");
        if (indexHolder.reloadIfChanged()) {
            log.info("Reload worker switched to a new index version");
        }
    }
}
