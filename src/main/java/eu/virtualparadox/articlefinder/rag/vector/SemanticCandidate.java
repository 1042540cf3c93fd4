package eu.virtualparadox.articlefinder.rag.vector;

/**
 * One hit of a vector search.
 *
 * @param id         chunk id (corpus position)
 * @param similarity cosine similarity in {@code [-1, 1]}
 */
public record SemanticCandidate(int id, double similarity) {
}
