package eu.virtualparadox.articlefinder.ingest.model;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable retrieval unit produced by ingestion.
 * <p>{@code id} is the chunk's position in its {@link Corpus}; every score array is indexed by it.
 * {@code normText} is computed once at ingestion and never changes.</p>
 *
 * @param id        stable position in the corpus
 * @param docId     source document identifier
 * @param articleNo optional article/section label, may be {@code null}
 * @param pageStart first page of the chunk
 * @param pageEnd   last page of the chunk, {@code >= pageStart}
 * @param text      original excerpt text
 * @param normText  normalized text used for matching
 * @param roles     non-empty set of roles allowed to see the chunk
 */
public record Chunk(int id,
                    String docId,
                    String articleNo,
                    int pageStart,
                    int pageEnd,
                    String text,
                    String normText,
                    Set<Role> roles) {

    public Chunk {
        Objects.requireNonNull(docId, "docId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(normText, "normText must not be null");
        Objects.requireNonNull(roles, "roles must not be null");
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0");
        }
        if (pageStart > pageEnd) {
            throw new IllegalArgumentException("pageStart (" + pageStart + ") > pageEnd (" + pageEnd + ")");
        }
        if (roles.isEmpty()) {
            throw new IllegalArgumentException("Chunk " + id + " must carry at least one role");
        }
        roles = Set.copyOf(roles);
    }
}
