package eu.virtualparadox.articlefinder.rag.embed;

import eu.virtualparadox.articlefinder.ingest.model.Chunk;

import java.util.List;

/**
 * Computes dense vector embeddings for chunks and queries.
 * <p>Both sides must be embedded from normalized text so that they share one vector space.</p>
 */
public interface EmbeddingService {

    /**
     * Embeds the normalized text of the given chunks.
     *
     * @param chunks list of chunks
     * @return one vector per chunk, same order
     * @throws eu.virtualparadox.articlefinder.error.CapabilityUnavailableException if the model cannot be used
     */
    List<float[]> embed(List<Chunk> chunks);

    /**
     * Embeds a single normalized query string.
     *
     * @param text the normalized query
     * @return a dense vector representation of the query
     * @throws eu.virtualparadox.articlefinder.error.CapabilityUnavailableException if the model cannot be used
     */
    float[] embedQuery(final String text);
}
