package com.hybridsearch.index;

import com.hybridsearch.exception.IndexNotLoadedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Component
@RequiredArgsConstructor
public class IndexHolder {

    private final IndexLoader loader;
    private final IndexPublisher publisher;
    private final AtomicReference<IndexSnapshot> snapshot = new AtomicReference<>();

    public IndexSnapshot current() {
        IndexSnapshot current = snapshot.get();
        if (current == null) {
            throw new IndexNotLoadedException();
        }
        return current;
    }

    public Optional<IndexSnapshot> currentIfLoaded() {
        return Optional.ofNullable(snapshot.get());
    }

    /**
     * Loads the published version and swaps it in. A failed load keeps serving the previous
     * snapshot.
     */
    public synchronized boolean reload() {
        try {
            Optional<IndexSnapshot> loaded = loader.loadCurrent();
            if (loaded.isEmpty()) {
                return false;
            }
            IndexSnapshot previous = snapshot.getAndSet(loaded.get());
            log.info("Serving index version {} (was {})", loaded.get().version(),
                previous == null ? "none" : previous.version());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Index reload failed, keeping the current snapshot: {}", e.getMessage(), e);
            return false;
        }
    }

    public synchronized boolean reloadIfChanged() {
        Optional<String> published;
        try {
            published = publisher.currentVersion();
        } catch (IOException e) {
            log.warn("Cannot read the current index pointer: {}", e.getMessage());
            return false;
        }
        if (published.isEmpty()) {
            return false;
        }
        String loaded = currentIfLoaded().map(IndexSnapshot::version).orElse(null);
        if (Objects.equals(published.get(), loaded)) {
            return false;
        }
        log.info("Index version {} was published, reloading", published.get());
        return reload();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!reloadIfChanged() && snapshot.get() == null) {
            log.warn("Started without an index, queries will fail until one is built");
        }
    }
}
