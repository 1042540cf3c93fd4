package eu.virtualparadox.articlefinder.rag.fusion;

import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.rag.vector.SemanticCandidate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Reconciles the lexical (BM25) and semantic (cosine) signals into one ranking key per chunk.
 * <p>
 * Steps:
 * <ol>
 *   <li>Scatter the sparse semantic candidates into a dense vector; everything else scores 0</li>
 *   <li>Scale each signal by its own maximum so both land in {@code [0, 1]}</li>
 *   <li>Blend: {@code alpha * semantic + (1 - alpha) * lexical}</li>
 *   <li>Penalize chunks sharing no query token; reward chunks containing the whole query verbatim</li>
 * </ol>
 * The result is not clamped; it is a ranking key, not a probability.
 */
@Component
public class ScoreFusion {

    /**
     * @param bm25Raw            raw lexical scores, one per corpus chunk
     * @param semanticCandidates sparse semantic hits from the vector index
     * @param queryTokens        tokens of the normalized query
     * @param queryNorm          normalized query
     * @param corpus             corpus the scores refer to
     * @param settings           fusion tunables
     * @return fused scores, index-aligned with {@code corpus}
     * @throws IllegalArgumentException if {@code bm25Raw} does not match the corpus size
     */
    public ScoreVector fuse(final ScoreVector bm25Raw,
                            final List<SemanticCandidate> semanticCandidates,
                            final List<String> queryTokens,
                            final String queryNorm,
                            final Corpus corpus,
                            final FusionSettings settings) {
        Objects.requireNonNull(bm25Raw, "bm25Raw must not be null");
        Objects.requireNonNull(semanticCandidates, "semanticCandidates must not be null");
        Objects.requireNonNull(queryTokens, "queryTokens must not be null");
        Objects.requireNonNull(corpus, "corpus must not be null");
        Objects.requireNonNull(settings, "settings must not be null");

        final int n = corpus.size();
        if (bm25Raw.size() != n) {
            throw new IllegalArgumentException(
                    "Lexical score vector size " + bm25Raw.size() + " != corpus size " + n);
        }

        final ScoreVector vecNorm = scatter(semanticCandidates, n, settings.semanticThreshold()).normalizedByMax();
        final ScoreVector bm25Norm = bm25Raw.normalizedByMax();

        final double alpha = settings.alpha();
        final double[] fused = new double[n];
        for (int i = 0; i < n; i++) {
            fused[i] = alpha * vecNorm.get(i) + (1.0 - alpha) * bm25Norm.get(i);
        }

        final boolean hasPhrase = queryNorm != null && !queryNorm.isEmpty();
        for (int i = 0; i < n; i++) {
            final String normText = corpus.get(i).normText();
            if (countOverlap(queryTokens, normText) == 0) {
                fused[i] -= settings.overlapPenalty();
            }
            if (hasPhrase && normText.contains(queryNorm)) {
                fused[i] += settings.exactMatchBonus();
            }
        }

        return ScoreVector.of(fused);
    }

    /**
     * Number of query tokens occurring as substrings of the chunk text.
     */
    int countOverlap(final List<String> queryTokens, final String normText) {
        int overlap = 0;
        for (final String token : queryTokens) {
            if (!token.isEmpty() && normText.contains(token)) {
                overlap++;
            }
        }
        return overlap;
    }

    private ScoreVector scatter(final List<SemanticCandidate> candidates, final int size, final double threshold) {
        final double[] dense = new double[size];
        for (final SemanticCandidate c : candidates) {
            if (c.id() < 0 || c.id() >= size) {
                throw new IndexCorruptException("Semantic candidate id " + c.id() + " outside corpus of size " + size);
            }
            if (c.similarity() >= threshold) {
                dense[c.id()] = c.similarity();
            }
        }
        return ScoreVector.of(dense);
    }
}
