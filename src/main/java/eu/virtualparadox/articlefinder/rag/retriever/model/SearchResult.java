package eu.virtualparadox.articlefinder.rag.retriever.model;

import eu.virtualparadox.articlefinder.ingest.model.Chunk;

/**
 * @param chunk   the matched chunk
 * @param score   fused score (ranking key, not a probability); fallback hits score {@code 1.0}
 * @param excerpt bounded window of the chunk text around the best query match
 * @param source  how the chunk was found
 */
public record SearchResult(Chunk chunk, double score, String excerpt, MatchSource source) {

    public String docId() {
        return chunk.docId();
    }

    public String articleNo() {
        return chunk.articleNo();
    }

    public int fromPage() {
        return chunk.pageStart();
    }

    public int toPage() {
        return chunk.pageEnd();
    }
}
