package eu.virtualparadox.articlefinder.rag.index;

import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.rag.lexical.LexicalIndex;
import eu.virtualparadox.articlefinder.rag.vector.VectorIndex;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * A corpus together with the two indices built from it. Immutable; replaced as a whole on reload.
 *
 * @param corpus       chunks in id order
 * @param lexicalIndex BM25 scoring over {@code corpus}
 * @param vectorIndex  ANN search over {@code corpus} embeddings (may hold no vectors)
 * @param builtAt      build time
 */
public record IndexSnapshot(Corpus corpus,
                            LexicalIndex lexicalIndex,
                            VectorIndex vectorIndex,
                            Instant builtAt) implements Closeable {

    public IndexSnapshot {
        Objects.requireNonNull(corpus, "corpus must not be null");
        Objects.requireNonNull(lexicalIndex, "lexicalIndex must not be null");
        Objects.requireNonNull(vectorIndex, "vectorIndex must not be null");
        Objects.requireNonNull(builtAt, "builtAt must not be null");
        if (lexicalIndex.size() != corpus.size()) {
            throw new IndexCorruptException("Lexical index covers " + lexicalIndex.size()
                    + " chunks, corpus has " + corpus.size());
        }
        if (vectorIndex.size() != 0 && vectorIndex.size() != corpus.size()) {
            throw new IndexCorruptException("Vector index covers " + vectorIndex.size()
                    + " chunks, corpus has " + corpus.size());
        }
    }

    @Override
    public void close() throws IOException {
        try {
            if (lexicalIndex instanceof Closeable c) {
                c.close();
            }
        } finally {
            if (vectorIndex instanceof Closeable c) {
                c.close();
            }
        }
    }
}
