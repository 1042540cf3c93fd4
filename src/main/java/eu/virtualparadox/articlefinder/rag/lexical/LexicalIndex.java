package eu.virtualparadox.articlefinder.rag.lexical;

import eu.virtualparadox.articlefinder.rag.fusion.ScoreVector;

import java.util.List;

/**
 * Term-statistics relevance scoring over the whole corpus.
 */
public interface LexicalIndex {

    /**
     * Scores every corpus chunk against the query tokens.
     *
     * @param tokens tokens of the normalized query; may be empty
     * @return one non-negative score per chunk, in corpus order; all zero for an empty token list
     * @throws eu.virtualparadox.articlefinder.error.CapabilityUnavailableException if the backend cannot be read
     */
    ScoreVector score(List<String> tokens);

    /**
     * @return number of chunks covered by the index
     */
    int size();
}
