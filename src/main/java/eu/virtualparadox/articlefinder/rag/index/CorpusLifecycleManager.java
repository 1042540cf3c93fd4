package eu.virtualparadox.articlefinder.rag.index;

import eu.virtualparadox.articlefinder.application.config.ApplicationConfig;
import eu.virtualparadox.articlefinder.ingest.loader.CorpusLoader;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Loads the configured corpus, builds its snapshot and publishes it.
 * <p>
 * Runs once when the application has started (before any runner) and again on {@link #reload()}. A failure at
 * startup stops the application; a failed reload keeps serving the previous snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusLifecycleManager {

    private final ApplicationConfig config;
    private final CorpusLoader corpusLoader;
    private final ReindexService reindexService;
    private final IndexSnapshotRegistry registry;

    @EventListener(ApplicationStartedEvent.class)
    public synchronized void loadOnStartup() {
        load();
    }

    /**
     * Rebuilds the snapshot from the corpus file and swaps it in. Safe to call while queries are running.
     *
     * @return the published snapshot
     */
    public synchronized IndexSnapshot reload() {
        try {
            final IndexSnapshot snapshot = load();
            log.info("Reload completed");
            return snapshot;
        } catch (RuntimeException e) {
            log.error("Reload of {} failed, keeping previous index", config.getCorpus(), e);
            throw e;
        }
    }

    private IndexSnapshot load() {
        final Corpus corpus = corpusLoader.load(config.getCorpus());
        final IndexSnapshot snapshot = reindexService.rebuild(corpus);
        registry.publish(snapshot);
        return snapshot;
    }
}
