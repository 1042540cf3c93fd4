package eu.virtualparadox.articlefinder.rag.fusion;

import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.ingest.model.Role;
import eu.virtualparadox.articlefinder.rag.vector.SemanticCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoreFusionTest {

    private static final double EPS = 1e-9;

    private ScoreFusion fusion;
    private Corpus corpus;
    private List<String> tokens;

    @BeforeEach
    void setUp() {
        fusion = new ScoreFusion();
        corpus = corpus(
                "the liability limit applies",
                "liability of employees",
                "working hours");
        tokens = List.of("liability", "limit");
    }

    @Test
    @DisplayName("No signal at all leaves only penalty and bonus")
    void zeroSignals() {
        ScoreVector fused = fusion.fuse(ScoreVector.zeros(3), List.of(), tokens, "liability limit", corpus,
                FusionSettings.DEFAULTS);

        assertThat(fused.get(0)).isCloseTo(0.2, within(EPS));
        assertThat(fused.get(1)).isCloseTo(0.0, within(EPS));
        assertThat(fused.get(2)).isCloseTo(-0.2, within(EPS));
    }

    @Test
    @DisplayName("alpha = 0 ranks by lexical signal only")
    void lexicalOnly() {
        FusionSettings settings = new FusionSettings(0.0, 0.0, 0.0, 0.0);
        ScoreVector fused = fusion.fuse(ScoreVector.of(4.0, 2.0, 0.0),
                List.of(new SemanticCandidate(2, 0.99)), tokens, "liability limit", corpus, settings);

        assertThat(fused.toArray()).containsExactly(new double[]{1.0, 0.5, 0.0}, within(EPS));
    }

    @Test
    @DisplayName("alpha = 1 ranks by semantic signal only")
    void semanticOnly() {
        FusionSettings settings = new FusionSettings(1.0, 0.0, 0.0, 0.0);
        ScoreVector fused = fusion.fuse(ScoreVector.of(4.0, 2.0, 0.0),
                List.of(new SemanticCandidate(2, 0.8), new SemanticCandidate(1, 0.4)),
                tokens, "liability limit", corpus, settings);

        assertThat(fused.toArray()).containsExactly(new double[]{0.0, 0.5, 1.0}, within(EPS));
    }

    @Test
    @DisplayName("Default weights blend both normalized signals")
    void blend() {
        FusionSettings settings = new FusionSettings(0.4, 0.0, 0.0, 0.0);
        ScoreVector fused = fusion.fuse(ScoreVector.of(2.0, 1.0, 0.0),
                List.of(new SemanticCandidate(1, 0.5)), tokens, "", corpus, settings);

        assertThat(fused.get(0)).isCloseTo(0.6, within(EPS));
        assertThat(fused.get(1)).isCloseTo(0.4 + 0.3, within(EPS));
        assertThat(fused.get(2)).isCloseTo(0.0, within(EPS));
    }

    @Test
    @DisplayName("Candidates below the threshold are ignored")
    void threshold() {
        FusionSettings settings = new FusionSettings(1.0, 0.5, 0.0, 0.0);
        ScoreVector fused = fusion.fuse(ScoreVector.zeros(3),
                List.of(new SemanticCandidate(0, 0.9), new SemanticCandidate(1, 0.3)),
                tokens, "", corpus, settings);

        assertThat(fused.get(0)).isCloseTo(1.0, within(EPS));
        assertThat(fused.get(1)).isCloseTo(0.0, within(EPS));
    }

    @Test
    @DisplayName("Negative similarities do not produce positive scores")
    void negativeSimilarities() {
        FusionSettings settings = new FusionSettings(1.0, -1.0, 0.0, 0.0);
        ScoreVector fused = fusion.fuse(ScoreVector.zeros(3),
                List.of(new SemanticCandidate(0, -0.2), new SemanticCandidate(1, -0.7)),
                tokens, "", corpus, settings);

        assertThat(fused.toArray()).containsExactly(new double[]{0.0, 0.0, 0.0}, within(EPS));
    }

    @Test
    @DisplayName("Overlap is counted by substring containment")
    void overlapBySubstring() {
        assertThat(fusion.countOverlap(List.of("liab", "xyz"), "the liability limit")).isEqualTo(1);
        assertThat(fusion.countOverlap(List.of(), "anything")).isZero();
    }

    @Test
    @DisplayName("Candidate outside the corpus is corruption")
    void candidateOutOfRange() {
        assertThatThrownBy(() -> fusion.fuse(ScoreVector.zeros(3), List.of(new SemanticCandidate(7, 0.9)),
                tokens, "", corpus, FusionSettings.DEFAULTS))
                .isInstanceOf(IndexCorruptException.class);
    }

    @Test
    @DisplayName("Lexical vector must match the corpus size")
    void sizeMismatch() {
        assertThatThrownBy(() -> fusion.fuse(ScoreVector.zeros(2), List.of(), tokens, "", corpus,
                FusionSettings.DEFAULTS))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void invalidSettings() {
        assertThatThrownBy(() -> new FusionSettings(1.5, 0.0, 0.2, 0.2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FusionSettings(0.4, 0.0, -0.1, 0.2)).isInstanceOf(IllegalArgumentException.class);
        assertThat(FusionSettings.DEFAULTS.lexicalOnly().alpha()).isZero();
    }

    static Corpus corpus(String... normTexts) {
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < normTexts.length; i++) {
            chunks.add(new Chunk(i, "doc.pdf", String.valueOf(i + 1), 1, 1, normTexts[i], normTexts[i],
                    Role.setOf("staff")));
        }
        return Corpus.of(chunks);
    }
}
