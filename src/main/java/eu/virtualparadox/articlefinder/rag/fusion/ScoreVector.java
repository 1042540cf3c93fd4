package eu.virtualparadox.articlefinder.rag.fusion;

import java.util.Arrays;

/**
 * Dense per-chunk scores, index-aligned with corpus order (entry {@code i} belongs to chunk id {@code i}).
 * <p>Instances are created per query and never shared; the backing array is copied on the way in and out.</p>
 */
public final class ScoreVector {

    private final double[] scores;

    private ScoreVector(final double[] scores) {
        this.scores = scores;
    }

    public static ScoreVector zeros(final int size) {
        return new ScoreVector(new double[size]);
    }

    public static ScoreVector of(final double... scores) {
        return new ScoreVector(scores.clone());
    }

    public int size() {
        return scores.length;
    }

    public double get(final int id) {
        return scores[id];
    }

    /**
     * @return the largest entry, or {@code 0} for an empty vector
     */
    public double max() {
        double max = 0.0;
        boolean first = true;
        for (final double s : scores) {
            if (first || s > max) {
                max = s;
                first = false;
            }
        }
        return max;
    }

    /**
     * Divides every entry by this vector's own maximum.
     * <p>A maximum of {@code 0} or less means there is no evidence at all: the result is all zero.</p>
     *
     * @return a new vector scaled to {@code [0, 1]} for non-negative input
     */
    public ScoreVector normalizedByMax() {
        final double max = max();
        final double[] out = new double[scores.length];
        if (max <= 0.0 || Double.isNaN(max)) {
            return new ScoreVector(out);
        }
        for (int i = 0; i < scores.length; i++) {
            out[i] = scores[i] / max;
        }
        return new ScoreVector(out);
    }

    public double[] toArray() {
        return scores.clone();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof ScoreVector other && Arrays.equals(scores, other.scores);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(scores);
    }

    @Override
    public String toString() {
        return Arrays.toString(scores);
    }
}
