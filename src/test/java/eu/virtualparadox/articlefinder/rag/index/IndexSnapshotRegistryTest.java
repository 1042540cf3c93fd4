package eu.virtualparadox.articlefinder.rag.index;

import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.ingest.model.Role;
import eu.virtualparadox.articlefinder.rag.lexical.LuceneLexicalIndex;
import eu.virtualparadox.articlefinder.rag.vector.LuceneVectorIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexSnapshotRegistryTest {

    @Test
    @DisplayName("Nothing published means no index")
    void emptyRegistry() {
        IndexSnapshotRegistry registry = new IndexSnapshotRegistry();

        assertThat(registry.isLoaded()).isFalse();
        assertThatThrownBy(registry::current)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No index loaded");
    }

    @Test
    @DisplayName("Publishing swaps the current snapshot and returns the previous one")
    void publishSwaps() {
        IndexSnapshotRegistry registry = new IndexSnapshotRegistry();
        IndexSnapshot first = snapshot(corpus("first"));
        IndexSnapshot second = snapshot(corpus("second", "third"));

        assertThat(registry.publish(first)).isNull();
        assertThat(registry.current()).isSameAs(first);
        assertThat(registry.publish(second)).isSameAs(first);
        assertThat(registry.current().corpus().size()).isEqualTo(2);

        registry.close();
        assertThat(registry.isLoaded()).isFalse();
    }

    @Test
    @DisplayName("Snapshot rejects indices of another corpus")
    void snapshotConsistency() {
        Corpus one = corpus("a");
        Corpus two = corpus("a", "b");

        assertThatThrownBy(() -> new IndexSnapshot(two, LuceneLexicalIndex.build(one), LuceneVectorIndex.empty(),
                Instant.now()))
                .isInstanceOf(IndexCorruptException.class);
        assertThatThrownBy(() -> new IndexSnapshot(two, LuceneLexicalIndex.build(two),
                LuceneVectorIndex.build(List.of(new float[]{1f})), Instant.now()))
                .isInstanceOf(IndexCorruptException.class);
    }

    private static IndexSnapshot snapshot(Corpus corpus) {
        return new IndexSnapshot(corpus, LuceneLexicalIndex.build(corpus), LuceneVectorIndex.empty(), Instant.now());
    }

    private static Corpus corpus(String... texts) {
        Chunk[] chunks = new Chunk[texts.length];
        for (int i = 0; i < texts.length; i++) {
            chunks[i] = new Chunk(i, "doc.pdf", null, 1, 1, texts[i], texts[i], Role.setOf("staff"));
        }
        return Corpus.of(List.of(chunks));
    }
}
