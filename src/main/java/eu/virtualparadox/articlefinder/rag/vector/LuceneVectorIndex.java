package eu.virtualparadox.articlefinder.rag.vector;

import eu.virtualparadox.articlefinder.error.CapabilityUnavailableException;
import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static eu.virtualparadox.articlefinder.util.LuceneConstants.FIELD_CHUNK_ID;
import static eu.virtualparadox.articlefinder.util.LuceneConstants.FIELD_VECTOR;

/**
 * In-memory Lucene HNSW index over chunk embeddings.
 * <p>
 * Vector {@code i} of the build input belongs to chunk id {@code i}. Vectors are indexed with
 * {@link VectorSimilarityFunction#COSINE}; Lucene reports {@code (1 + cos) / 2}, which is mapped back to the
 * cosine in {@code [-1, 1]}.
 *
 * <p><b>Vector dimensions:</b> one dimension per index. Build input with mixed dimensions, non-finite components
 * or zero vectors is rejected, and so is a query vector of another dimension.</p>
 */
public final class LuceneVectorIndex implements VectorIndex, Closeable {

    private static final LuceneVectorIndex EMPTY = new LuceneVectorIndex(null, null, new int[0], 0);

    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final int[] chunkIdByDoc;
    private final int dimension;

    private LuceneVectorIndex(final Directory directory,
                              final DirectoryReader reader,
                              final int[] chunkIdByDoc,
                              final int dimension) {
        this.directory = directory;
        this.reader = reader;
        this.searcher = reader == null ? null : new IndexSearcher(reader);
        this.chunkIdByDoc = chunkIdByDoc;
        this.dimension = dimension;
    }

    /**
     * @return an index without vectors; every search yields no candidates
     */
    public static LuceneVectorIndex empty() {
        return EMPTY;
    }

    /**
     * Indexes one vector per chunk.
     *
     * @param vectors chunk embeddings, position = chunk id
     * @return a read-only index
     * @throws IndexCorruptException if the vectors are inconsistent or Lucene rejects them
     */
    public static LuceneVectorIndex build(final List<float[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            return EMPTY;
        }

        final int dim = validate(vectors);

        final Directory directory = new ByteBuffersDirectory();
        try (final IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig()
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE))) {
            for (int id = 0; id < vectors.size(); id++) {
                writer.addDocument(buildLuceneDocument(id, vectors.get(id)));
            }
            writer.commit();
        } catch (final IOException | IllegalArgumentException e) {
            throw new IndexCorruptException("Failed to build vector index", e);
        }

        try {
            final DirectoryReader reader = DirectoryReader.open(directory);
            return new LuceneVectorIndex(directory, reader, resolveChunkIds(reader), dim);
        } catch (final IOException e) {
            throw new IndexCorruptException("Failed to open vector index", e);
        }
    }

    @Override
    public List<SemanticCandidate> search(final float[] queryVector, final int k) {
        if (searcher == null || k <= 0) {
            return Collections.emptyList();
        }
        if (queryVector == null || queryVector.length != dimension) {
            throw new IndexCorruptException("Query vector dimension " + (queryVector == null ? "null" : queryVector.length)
                    + " does not match index dimension " + dimension);
        }
        if (isZero(queryVector)) {
            return Collections.emptyList();
        }

        final int limit = Math.min(k, chunkIdByDoc.length);
        try {
            final TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(FIELD_VECTOR, queryVector, limit), limit);
            final List<SemanticCandidate> out = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                out.add(new SemanticCandidate(chunkIdByDoc[sd.doc], toCosine(sd.score)));
            }
            return out;
        } catch (final IOException e) {
            throw new CapabilityUnavailableException("Vector index could not be searched", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public int size() {
        return chunkIdByDoc.length;
    }

    private static double toCosine(final float luceneScore) {
        final double cos = 2.0 * luceneScore - 1.0;
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    private static int validate(final List<float[]> vectors) {
        final float[] first = vectors.get(0);
        if (first == null || first.length == 0) {
            throw new IndexCorruptException("Vector 0 is empty");
        }
        final int dim = first.length;
        for (int id = 0; id < vectors.size(); id++) {
            final float[] v = vectors.get(id);
            if (v == null || v.length != dim) {
                throw new IndexCorruptException("Vector dimension mismatch at chunk " + id + ": expected " + dim
                        + ", got " + (v == null ? "null" : v.length));
            }
            for (final float f : v) {
                if (!Float.isFinite(f)) {
                    throw new IndexCorruptException("Vector of chunk " + id + " has a non-finite component");
                }
            }
            if (isZero(v)) {
                throw new IndexCorruptException("Vector of chunk " + id + " is all zero");
            }
        }
        return dim;
    }

    private static boolean isZero(final float[] v) {
        for (final float f : v) {
            if (f != 0.0f) {
                return false;
            }
        }
        return true;
    }

    private static Document buildLuceneDocument(final int chunkId, final float[] vec) {
        final Document d = new Document();
        d.add(new StoredField(FIELD_CHUNK_ID, chunkId));
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));
        return d;
    }

    private static int[] resolveChunkIds(final DirectoryReader reader) throws IOException {
        final int[] ids = new int[reader.maxDoc()];
        final StoredFields storedFields = reader.storedFields();
        for (int doc = 0; doc < ids.length; doc++) {
            ids[doc] = storedFields.document(doc).getField(FIELD_CHUNK_ID).numericValue().intValue();
        }
        return ids;
    }

    @Override
    public void close() throws IOException {
        if (reader != null) {
            reader.close();
        }
        if (directory != null) {
            directory.close();
        }
    }
}
