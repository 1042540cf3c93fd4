package eu.virtualparadox.articlefinder.rag.retriever.model;

public enum MatchSource {
    /** Ranked by the fused lexical + semantic score. */
    FUSED,
    /** Found by the literal substring fallback. */
    FALLBACK
}
