package eu.virtualparadox.articlefinder.rag.vector;

import java.util.List;

/**
 * Abstraction over the approximate nearest neighbor (ANN) search used for the semantic signal.
 * <p>
 * Only the returned candidates receive a semantic score; every other chunk implicitly scores 0, which keeps the
 * semantic side of a query at O(k) instead of O(corpus).
 */
public interface VectorIndex {

    /**
     * @param queryVector query embedding; must have {@link #dimension()} components
     * @param k           maximum number of candidates
     * @return at most {@code k} candidates in descending similarity order
     * @throws eu.virtualparadox.articlefinder.error.IndexCorruptException          on dimension mismatch
     * @throws eu.virtualparadox.articlefinder.error.CapabilityUnavailableException if the backend cannot be read
     */
    List<SemanticCandidate> search(float[] queryVector, int k);

    /**
     * @return vector dimension, {@code 0} for an index without vectors
     */
    int dimension();

    /**
     * @return number of indexed vectors
     */
    int size();
}
