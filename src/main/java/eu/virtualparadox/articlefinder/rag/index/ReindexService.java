package eu.virtualparadox.articlefinder.rag.index;

import eu.virtualparadox.articlefinder.error.CapabilityUnavailableException;
import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.rag.embed.EmbeddingService;
import eu.virtualparadox.articlefinder.rag.lexical.LuceneLexicalIndex;
import eu.virtualparadox.articlefinder.rag.vector.LuceneVectorIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Builds an {@link IndexSnapshot} for a corpus:
 * <ol>
 *     <li>Index normalized chunk text into an in-memory Lucene BM25 index</li>
 *     <li>Embed normalized chunk text (ONNX Runtime)</li>
 *     <li>Index the vectors into an in-memory Lucene HNSW graph</li>
 * </ol>
 * <p>
 * If the embedding model is unavailable the snapshot gets an empty vector index and serves lexical-only rankings.
 * Inconsistent data fails the whole build.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReindexService {

    private final EmbeddingService embeddingService;

    /**
     * @param corpus corpus to index
     * @return a ready-to-publish snapshot
     * @throws IndexCorruptException if the corpus or its embeddings are inconsistent
     */
    public IndexSnapshot rebuild(final Corpus corpus) {
        final long t0 = System.nanoTime();

        final LuceneLexicalIndex lexicalIndex = LuceneLexicalIndex.build(corpus);
        final LuceneVectorIndex vectorIndex;
        try {
            vectorIndex = LuceneVectorIndex.build(embed(corpus));
        } catch (final RuntimeException e) {
            closeQuietly(lexicalIndex);
            throw e;
        }

        log.info("Built index snapshot of {} chunks in {} ms", corpus.size(), (System.nanoTime() - t0) / 1_000_000);
        return new IndexSnapshot(corpus, lexicalIndex, vectorIndex, Instant.now());
    }

    private List<float[]> embed(final Corpus corpus) {
        if (corpus.isEmpty()) {
            return List.of();
        }
        final List<float[]> vectors;
        try {
            vectors = embeddingService.embed(corpus.chunks());
        } catch (final CapabilityUnavailableException e) {
            log.warn("Embedding unavailable, building snapshot without vectors: {}", e.getMessage());
            return List.of();
        }
        if (vectors.size() != corpus.size()) {
            throw new IndexCorruptException("Embedding returned " + vectors.size()
                    + " vectors for " + corpus.size() + " chunks");
        }
        return vectors;
    }

    private void closeQuietly(final LuceneLexicalIndex index) {
        try {
            index.close();
        } catch (IOException e) {
            log.error("Unable to close lexical index", e);
        }
    }
}
