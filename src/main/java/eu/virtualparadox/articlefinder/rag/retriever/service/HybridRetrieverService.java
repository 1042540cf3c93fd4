package eu.virtualparadox.articlefinder.rag.retriever.service;

import eu.virtualparadox.articlefinder.application.config.RetrievalProperties;
import eu.virtualparadox.articlefinder.application.executor.CapabilityExecutor;
import eu.virtualparadox.articlefinder.error.CapabilityUnavailableException;
import eu.virtualparadox.articlefinder.error.InvalidRequestException;
import eu.virtualparadox.articlefinder.error.RetrievalTimeoutException;
import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.ingest.model.Role;
import eu.virtualparadox.articlefinder.ingest.normalizer.TextNormalizer;
import eu.virtualparadox.articlefinder.rag.embed.EmbeddingService;
import eu.virtualparadox.articlefinder.rag.fusion.FusionSettings;
import eu.virtualparadox.articlefinder.rag.fusion.ScoreFusion;
import eu.virtualparadox.articlefinder.rag.fusion.ScoreVector;
import eu.virtualparadox.articlefinder.rag.index.IndexSnapshot;
import eu.virtualparadox.articlefinder.rag.index.IndexSnapshotRegistry;
import eu.virtualparadox.articlefinder.rag.retriever.model.MatchSource;
import eu.virtualparadox.articlefinder.rag.retriever.model.SearchResult;
import eu.virtualparadox.articlefinder.rag.vector.SemanticCandidate;
import eu.virtualparadox.articlefinder.security.AccessController;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hybrid retriever: fuses BM25 keyword scores with ANN semantic similarity and enforces role visibility.
 * <p>
 * Steps:
 * <ol>
 *   <li>Normalize and tokenize the query</li>
 *   <li>Score the corpus lexically and run the embedded query against the vector index, concurrently and
 *   under one deadline</li>
 *   <li>Fuse both signals ({@link ScoreFusion})</li>
 *   <li>Rank every chunk by fused score, ties by ascending chunk id</li>
 *   <li>Drop chunks the caller may not see, keep the first {@code k} scoring above {@code minScore}</li>
 *   <li>If nothing is left, fall back to a literal substring search over the visible chunks</li>
 *   <li>Attach an excerpt to each result</li>
 * </ol>
 * An unavailable capability removes its signal instead of failing the query; a missing embedding forces
 * {@code alpha = 0}, and with neither signal the query goes straight to the literal fallback. Timeouts and index
 * corruption fail the query.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class HybridRetrieverService implements RetrieverService {

    static final double FALLBACK_SCORE = 1.0;

    private final IndexSnapshotRegistry registry;
    private final EmbeddingService embeddingService;
    private final TextNormalizer textNormalizer;
    private final ScoreFusion scoreFusion;
    private final AccessController accessController;
    private final ExcerptBuilder excerptBuilder;
    private final CapabilityExecutor capabilityExecutor;
    private final RetrievalProperties props;

    @Override
    public List<SearchResult> search(final String query, final Set<Role> roles, final int k) {
        validate(query, roles, k);
        final long t0 = System.nanoTime();

        final IndexSnapshot snapshot = registry.current();
        final Corpus corpus = snapshot.corpus();

        final String qNorm = textNormalizer.normalize(query);
        final List<String> tokens = Arrays.asList(textNormalizer.tokenize(qNorm));

        final Signals signals = gatherSignals(snapshot, qNorm, tokens);
        if (!signals.lexicalAvailable() && !signals.semanticAvailable()) {
            log.warn("No ranking signal available, answering with literal matches only");
            return Collections.unmodifiableList(fallback(corpus, query, roles, k));
        }
        final FusionSettings settings = signals.semanticAvailable()
                ? props.toFusionSettings()
                : props.toFusionSettings().lexicalOnly();

        final ScoreVector fused = scoreFusion.fuse(
                signals.bm25Raw(), signals.candidates(), tokens, qNorm, corpus, settings);

        final List<Chunk> visible = accessController.filter(rank(corpus, fused), roles);

        final List<SearchResult> results = new ArrayList<>(Math.min(k, visible.size()));
        for (final Chunk chunk : visible) {
            if (results.size() == k) {
                break;
            }
            final double score = fused.get(chunk.id());
            if (score <= props.getMinScore()) {
                // ranked descending, nothing after this scores higher
                break;
            }
            results.add(new SearchResult(chunk, score, excerpt(chunk, tokens), MatchSource.FUSED));
        }

        if (results.isEmpty()) {
            results.addAll(fallback(corpus, query, roles, k));
        }

        log.debug("Query answered: tokens={} candidates={} visible={} results={} ms={}",
                tokens.size(), signals.candidates().size(), visible.size(), results.size(),
                (System.nanoTime() - t0) / 1_000_000);
        return Collections.unmodifiableList(results);
    }

    private void validate(final String query, final Set<Role> roles, final int k) {
        if (query == null) {
            throw new InvalidRequestException("query must not be null");
        }
        if (roles == null || roles.isEmpty()) {
            throw new InvalidRequestException("roles must not be empty");
        }
        if (k <= 0) {
            throw new InvalidRequestException("k must be > 0, got " + k);
        }
    }

    /**
     * Runs lexical scoring and embed + vector search concurrently, bounded by the capability timeout.
     */
    private Signals gatherSignals(final IndexSnapshot snapshot, final String qNorm, final List<String> tokens) {
        final int n = snapshot.corpus().size();
        if (tokens.isEmpty()) {
            return new Signals(ScoreVector.zeros(n), true, List.of(), true);
        }

        final CompletableFuture<ScoreVector> lexical = CompletableFuture.supplyAsync(
                () -> snapshot.lexicalIndex().score(tokens), capabilityExecutor);
        final CompletableFuture<List<SemanticCandidate>> semantic = CompletableFuture.supplyAsync(
                () -> snapshot.vectorIndex().search(embeddingService.embedQuery(qNorm), props.getSemanticTopK()),
                capabilityExecutor);

        final long deadline = System.nanoTime() + props.getCapabilityTimeout().toNanos();
        try {
            final ScoreVector bm25Raw = await(lexical, deadline, "lexical");
            final List<SemanticCandidate> candidates = await(semantic, deadline, "semantic");
            return new Signals(
                    bm25Raw == null ? ScoreVector.zeros(n) : bm25Raw, bm25Raw != null,
                    candidates == null ? List.of() : candidates, candidates != null);
        } catch (final RuntimeException e) {
            lexical.cancel(true);
            semantic.cancel(true);
            throw e;
        }
    }

    /**
     * @return the capability's value, or {@code null} if the capability reported itself unavailable
     */
    private <T> T await(final CompletableFuture<T> future, final long deadline, final String signal) {
        try {
            final long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            throw new RetrievalTimeoutException("The " + signal + " capability did not answer within "
                    + props.getCapabilityTimeout(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetrievalTimeoutException("Interrupted while waiting for the " + signal + " capability", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof CapabilityUnavailableException) {
                log.warn("The {} capability is unavailable, ranking without it: {}", signal, cause.getMessage());
                return null;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("The " + signal + " capability failed", cause);
        }
    }

    private List<Chunk> rank(final Corpus corpus, final ScoreVector fused) {
        final List<Chunk> ranked = new ArrayList<>(corpus.chunks());
        ranked.sort(Comparator
                .comparingDouble((Chunk c) -> fused.get(c.id())).reversed()
                .thenComparingInt(Chunk::id));
        return ranked;
    }

    /**
     * Literal, case-insensitive substring search of the raw query over the visible chunks, in corpus order.
     */
    private List<SearchResult> fallback(final Corpus corpus, final String query, final Set<Role> roles, final int k) {
        final String needle = query.toLowerCase(Locale.ROOT).trim();

        final List<SearchResult> out = new ArrayList<>();
        if (!needle.isEmpty()) {
            for (final Chunk chunk : accessController.filter(corpus.chunks(), roles)) {
                if (out.size() == k) {
                    break;
                }
                if (chunk.normText().contains(needle)) {
                    out.add(new SearchResult(chunk, FALLBACK_SCORE, excerpt(chunk, List.of(needle)), MatchSource.FALLBACK));
                }
            }
        }
        log.warn("Ranking produced no visible results, literal fallback found {}", out.size());
        return out;
    }

    private String excerpt(final Chunk chunk, final List<String> tokens) {
        return excerptBuilder.build(chunk.text(), tokens, props.getExcerptLength(), props.isHighlightMatches());
    }

    private record Signals(ScoreVector bm25Raw, boolean lexicalAvailable,
                           List<SemanticCandidate> candidates, boolean semanticAvailable) {
    }
}
