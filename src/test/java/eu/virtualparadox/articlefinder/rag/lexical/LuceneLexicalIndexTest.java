package eu.virtualparadox.articlefinder.rag.lexical;

import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.ingest.model.Role;
import eu.virtualparadox.articlefinder.rag.fusion.ScoreVector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LuceneLexicalIndexTest {

    private LuceneLexicalIndex index;

    @BeforeEach
    void setUp() {
        index = LuceneLexicalIndex.build(corpus(
                "article 12. the liability limit of the contractor shall not exceed the contract price.",
                "each employee bears liability for equipment.",
                "working hours are from 8 to 16 on weekdays.",
                "the limit of liability is agreed per contract. liability limit applies."));
    }

    @AfterEach
    void tearDown() throws IOException {
        index.close();
    }

    @Test
    @DisplayName("One score per chunk, zero for chunks without query terms")
    void scoresAlignedWithCorpus() {
        ScoreVector scores = index.score(List.of("liability", "limit"));

        assertThat(scores.size()).isEqualTo(4);
        assertThat(index.size()).isEqualTo(4);
        assertThat(scores.get(2)).isZero();
        assertThat(scores.get(0)).isPositive();
        assertThat(scores.get(1)).isPositive();
        assertThat(scores.get(3)).isPositive();
    }

    @Test
    @DisplayName("Chunks matching more query terms score higher")
    void moreTermsScoreHigher() {
        ScoreVector scores = index.score(List.of("liability", "limit"));

        assertThat(scores.get(0)).isGreaterThan(scores.get(1));
    }

    @Test
    @DisplayName("A repeated query token counts once per occurrence")
    void repeatedTokens() {
        ScoreVector once = index.score(List.of("hours"));
        ScoreVector twice = index.score(List.of("hours", "hours"));

        assertThat(twice.get(2)).isCloseTo(2 * once.get(2), within(1e-4));
    }

    @Test
    @DisplayName("Terms match whole whitespace tokens only")
    void wholeTokens() {
        assertThat(index.score(List.of("liab")).max()).isZero();
    }

    @Test
    @DisplayName("No tokens give all-zero scores")
    void noTokens() {
        assertThat(index.score(List.of()).toArray()).containsOnly(0.0);
    }

    @Test
    @DisplayName("Empty corpus builds an empty index")
    void emptyCorpus() throws IOException {
        try (LuceneLexicalIndex empty = LuceneLexicalIndex.build(Corpus.empty())) {
            assertThat(empty.size()).isZero();
            assertThat(empty.score(List.of("liability")).size()).isZero();
        }
    }

    private static Corpus corpus(String... normTexts) {
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < normTexts.length; i++) {
            chunks.add(new Chunk(i, "doc.pdf", null, 1, 1, normTexts[i], normTexts[i], Role.setOf("staff")));
        }
        return Corpus.of(chunks);
    }
}
