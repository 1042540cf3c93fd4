package eu.virtualparadox.articlefinder.rag.fusion;

/**
 * Tunables of {@link ScoreFusion}. Defaults come from {@code articlefinder.retrieval.*}.
 *
 * @param alpha              weight of the semantic signal, {@code 1 - alpha} goes to the lexical one
 * @param semanticThreshold  candidates below this similarity are ignored
 * @param overlapPenalty     subtracted when a chunk shares no query token
 * @param exactMatchBonus    added when the whole normalized query occurs in the chunk
 */
public record FusionSettings(double alpha,
                             double semanticThreshold,
                             double overlapPenalty,
                             double exactMatchBonus) {

    public static final FusionSettings DEFAULTS = new FusionSettings(0.4, 0.0, 0.2, 0.2);

    public FusionSettings {
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be in [0, 1], got " + alpha);
        }
        if (Double.isNaN(semanticThreshold)) {
            throw new IllegalArgumentException("semanticThreshold must be a number");
        }
        if (!(overlapPenalty >= 0.0) || !(exactMatchBonus >= 0.0)) {
            throw new IllegalArgumentException("overlapPenalty and exactMatchBonus must be >= 0");
        }
    }

    /**
     * Same settings with the semantic signal switched off, used when the embedding capability is down.
     */
    public FusionSettings lexicalOnly() {
        return new FusionSettings(0.0, semanticThreshold, overlapPenalty, exactMatchBonus);
    }
}
