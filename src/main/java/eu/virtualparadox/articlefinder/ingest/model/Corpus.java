package eu.virtualparadox.articlefinder.ingest.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable collection of chunks.
 * <p>Invariant: {@code get(i).id() == i} for every chunk, so a chunk id doubles as its index in
 * every per-query score array.</p>
 */
public final class Corpus {

    private static final Corpus EMPTY = new Corpus(List.of());

    private final List<Chunk> chunks;

    private Corpus(final List<Chunk> chunks) {
        this.chunks = chunks;
    }

    /**
     * @param chunks chunks in corpus order
     * @return a corpus over a defensive copy of {@code chunks}
     * @throws IllegalArgumentException if a chunk id does not match its position
     */
    public static Corpus of(final List<Chunk> chunks) {
        Objects.requireNonNull(chunks, "chunks must not be null");
        final List<Chunk> copy = List.copyOf(chunks);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).id() != i) {
                throw new IllegalArgumentException(
                        "Chunk at position " + i + " has id " + copy.get(i).id());
            }
        }
        return new Corpus(copy);
    }

    public static Corpus empty() {
        return EMPTY;
    }

    public Chunk get(final int id) {
        return chunks.get(id);
    }

    public int size() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public List<Chunk> chunks() {
        return chunks;
    }
}
