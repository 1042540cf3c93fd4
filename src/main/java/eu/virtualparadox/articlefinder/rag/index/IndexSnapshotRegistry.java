package eu.virtualparadox.articlefinder.rag.index;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the snapshot queries run against.
 * <p>
 * A query reads {@link #current()} once and keeps that snapshot for its whole execution; {@link #publish(IndexSnapshot)}
 * swaps the reference atomically, so in-flight queries never see a half-built corpus. Replaced snapshots are heap-only
 * and are left to the garbage collector once their last query finishes.
 */
@Slf4j
@Component
public class IndexSnapshotRegistry {

    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>();

    /**
     * @return the published snapshot
     * @throws IllegalStateException if nothing was published yet
     */
    public IndexSnapshot current() {
        final IndexSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("No index loaded");
        }
        return snapshot;
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    /**
     * @param snapshot fully built snapshot
     * @return the snapshot it replaced, or {@code null}
     */
    public IndexSnapshot publish(final IndexSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        final IndexSnapshot previous = current.getAndSet(snapshot);
        log.info("Published index snapshot: {} chunks, vector dimension {}",
                snapshot.corpus().size(), snapshot.vectorIndex().dimension());
        return previous;
    }

    @PreDestroy
    public void close() {
        final IndexSnapshot snapshot = current.getAndSet(null);
        if (snapshot == null) {
            return;
        }
        try {
            snapshot.close();
        } catch (Exception e) {
            log.error("Unable to close index snapshot", e);
        }
    }
}
