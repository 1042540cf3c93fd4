package eu.virtualparadox.articlefinder.rag.lexical;

import eu.virtualparadox.articlefinder.error.CapabilityUnavailableException;
import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.rag.fusion.ScoreVector;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;

import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static eu.virtualparadox.articlefinder.util.LuceneConstants.FIELD_CHUNK_ID;
import static eu.virtualparadox.articlefinder.util.LuceneConstants.FIELD_NORM_TEXT;

/**
 * In-memory Lucene BM25 index over the chunks' normalized text.
 * <p>
 * The field is analyzed with a {@link WhitespaceAnalyzer} so indexed terms are exactly the whitespace tokens of
 * {@code normText}, the same tokens the query side produces. Each Lucene document stores its chunk id; the
 * Lucene-doc to chunk-id mapping is resolved once at build time.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code chunkId} – {@link StoredField}: corpus position of the chunk</li>
 *   <li>{@code normText} – {@link TextField}: normalized chunk text, indexed only</li>
 * </ul>
 */
@Slf4j
public final class LuceneLexicalIndex implements LexicalIndex, Closeable {

    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final int[] chunkIdByDoc;
    private final int size;

    private LuceneLexicalIndex(final Directory directory,
                               final DirectoryReader reader,
                               final int[] chunkIdByDoc,
                               final int size) {
        this.directory = directory;
        this.reader = reader;
        this.searcher = new IndexSearcher(reader);
        this.searcher.setSimilarity(new BM25Similarity());
        this.chunkIdByDoc = chunkIdByDoc;
        this.size = size;
    }

    /**
     * Indexes every chunk of the corpus.
     *
     * @param corpus corpus to index
     * @return a read-only index
     * @throws IndexCorruptException if Lucene cannot build the index
     */
    public static LuceneLexicalIndex build(final Corpus corpus) {
        final Directory directory = new ByteBuffersDirectory();
        try (final Analyzer analyzer = new WhitespaceAnalyzer();
             final IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(analyzer)
                     .setOpenMode(IndexWriterConfig.OpenMode.CREATE)
                     .setSimilarity(new BM25Similarity()))) {

            for (final Chunk chunk : corpus.chunks()) {
                writer.addDocument(buildLuceneDocument(chunk));
            }
            writer.commit();
        } catch (final IOException | IllegalArgumentException e) {
            throw new IndexCorruptException("Failed to build lexical index", e);
        }

        try {
            final DirectoryReader reader = DirectoryReader.open(directory);
            return new LuceneLexicalIndex(directory, reader, resolveChunkIds(reader), corpus.size());
        } catch (final IOException e) {
            throw new IndexCorruptException("Failed to open lexical index", e);
        }
    }

    @Override
    public ScoreVector score(final List<String> tokens) {
        final double[] scores = new double[size];
        final Query query = buildQuery(tokens);
        if (query == null || size == 0) {
            return ScoreVector.of(scores);
        }

        try {
            final TopDocs topDocs = searcher.search(query, size);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                scores[chunkIdByDoc[sd.doc]] = sd.score;
            }
            return ScoreVector.of(scores);
        } catch (final IOException e) {
            throw new CapabilityUnavailableException("Lexical index could not be searched", e);
        }
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * Disjunction of one term query per distinct token; a token given n times is boosted n times so that its
     * contribution matches scoring each occurrence separately.
     */
    private Query buildQuery(final List<String> tokens) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final String token : tokens) {
            if (token != null && !token.isEmpty()) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return null;
        }

        final int maxClauses = IndexSearcher.getMaxClauseCount();
        if (counts.size() > maxClauses) {
            log.warn("Query has {} distinct tokens, only the first {} are scored", counts.size(), maxClauses);
        }

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        int added = 0;
        for (final Map.Entry<String, Integer> e : counts.entrySet()) {
            if (added == maxClauses) {
                break;
            }
            final Query term = new TermQuery(new Term(FIELD_NORM_TEXT, e.getKey()));
            final Query clause = e.getValue() == 1 ? term : new BoostQuery(term, e.getValue());
            builder.add(clause, BooleanClause.Occur.SHOULD);
            added++;
        }
        return builder.build();
    }

    private static Document buildLuceneDocument(final Chunk chunk) {
        final Document d = new Document();
        d.add(new StoredField(FIELD_CHUNK_ID, chunk.id()));
        d.add(new TextField(FIELD_NORM_TEXT, chunk.normText(), Field.Store.NO));
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
        reader.close();
        directory.close();
    }
}
