package eu.virtualparadox.articlefinder.rag.fusion;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreVectorTest {

    @Test
    void testNormalizedByMaxScalesToUnitMaximum() {
        ScoreVector v = ScoreVector.of(2.0, 4.0, 0.0, 1.0);

        assertThat(v.normalizedByMax().toArray()).containsExactly(0.5, 1.0, 0.0, 0.25);
    }

    @Test
    void testAllZeroVectorStaysZero() {
        assertThat(ScoreVector.zeros(3).normalizedByMax().toArray()).containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    void testNonPositiveMaximumYieldsZeros() {
        assertThat(ScoreVector.of(-1.0, -0.5).normalizedByMax().toArray()).containsExactly(0.0, 0.0);
    }

    @Test
    void testEmptyVectorHasZeroMax() {
        assertThat(ScoreVector.zeros(0).max()).isEqualTo(0.0);
        assertThat(ScoreVector.zeros(0).normalizedByMax().size()).isZero();
    }

    @Test
    void testInputArrayIsCopied() {
        double[] raw = {1.0, 2.0};
        ScoreVector v = ScoreVector.of(raw);
        raw[0] = 99.0;

        assertThat(v.get(0)).isEqualTo(1.0);
    }
}
