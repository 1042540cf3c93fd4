package eu.virtualparadox.articlefinder.rag.index;

import eu.virtualparadox.articlefinder.error.CapabilityUnavailableException;
import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.ingest.model.Role;
import eu.virtualparadox.articlefinder.rag.embed.EmbeddingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReindexServiceTest {

    private static final Corpus CORPUS = Corpus.of(List.of(
            new Chunk(0, "a.pdf", "1", 1, 1, "Liability limit", "liability limit", Role.setOf("staff")),
            new Chunk(1, "a.pdf", "2", 2, 2, "Working hours", "working hours", Role.setOf("public"))));

    @Test
    @DisplayName("Snapshot covers every chunk in both indices")
    void buildsBothIndices() throws Exception {
        ReindexService service = new ReindexService(embedder(3));

        try (IndexSnapshot snapshot = service.rebuild(CORPUS)) {
            assertThat(snapshot.corpus()).isSameAs(CORPUS);
            assertThat(snapshot.lexicalIndex().size()).isEqualTo(2);
            assertThat(snapshot.vectorIndex().size()).isEqualTo(2);
            assertThat(snapshot.vectorIndex().dimension()).isEqualTo(3);
            assertThat(snapshot.builtAt()).isNotNull();
        }
    }

    @Test
    @DisplayName("Unavailable embedder yields a lexical-only snapshot")
    void embedderUnavailable() throws Exception {
        ReindexService service = new ReindexService(new EmbeddingService() {
            @Override
            public List<float[]> embed(List<Chunk> chunks) {
                throw new CapabilityUnavailableException("model missing");
            }

            @Override
            public float[] embedQuery(String text) {
                throw new CapabilityUnavailableException("model missing");
            }
        });

        try (IndexSnapshot snapshot = service.rebuild(CORPUS)) {
            assertThat(snapshot.lexicalIndex().size()).isEqualTo(2);
            assertThat(snapshot.vectorIndex().size()).isZero();
        }
    }

    @Test
    @DisplayName("Wrong number of embeddings fails the build")
    void embeddingCountMismatch() {
        ReindexService service = new ReindexService(new EmbeddingService() {
            @Override
            public List<float[]> embed(List<Chunk> chunks) {
                return List.of(new float[]{1f, 0f});
            }

            @Override
            public float[] embedQuery(String text) {
                return new float[]{1f, 0f};
            }
        });

        assertThatThrownBy(() -> service.rebuild(CORPUS)).isInstanceOf(IndexCorruptException.class);
    }

    @Test
    @DisplayName("Empty corpus builds an empty snapshot")
    void emptyCorpus() throws Exception {
        try (IndexSnapshot snapshot = new ReindexService(embedder(3)).rebuild(Corpus.empty())) {
            assertThat(snapshot.corpus().isEmpty()).isTrue();
            assertThat(snapshot.vectorIndex().size()).isZero();
        }
    }

    private static EmbeddingService embedder(int dim) {
        return new EmbeddingService() {
            @Override
            public List<float[]> embed(List<Chunk> chunks) {
                List<float[]> out = new ArrayList<>();
                for (Chunk c : chunks) {
                    float[] v = new float[dim];
                    v[c.id() % dim] = 1f;
                    out.add(v);
                }
                return out;
            }

            @Override
            public float[] embedQuery(String text) {
                float[] v = new float[dim];
                v[0] = 1f;
                return v;
            }
        };
    }
}
