package com.deporacle.engine.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Per-dimension scores in [0, 100]. A dimension without a score is
 * unavailable, which is distinct from a score of 0.
 *
 * @author Naveed Gung
 */
public final class TrustMetrics {

    private final Map<TrustDimension, Integer> scores;

    private TrustMetrics(Map<TrustDimension, Integer> scores) {
        this.scores = Collections.unmodifiableMap(scores);
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalInt score(TrustDimension dimension) {
        Integer score = scores.get(dimension);
        return score == null ? OptionalInt.empty() : OptionalInt.of(score);
    }

    /** Score for display, 0 when unavailable. */
    public int scoreOrZero(TrustDimension dimension) {
        return scores.getOrDefault(dimension, 0);
    }

    public boolean isAvailable(TrustDimension dimension) {
        return scores.containsKey(dimension);
    }

    public Set<TrustDimension> unavailable() {
        Set<TrustDimension> missing = EnumSet.allOf(TrustDimension.class);
        missing.removeAll(scores.keySet());
        return missing;
    }

    public Map<TrustDimension, Integer> asMap() {
        return scores;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TrustMetrics other && scores.equals(other.scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return "TrustMetrics" + scores;
    }

    public static final class Builder {
        private final Map<TrustDimension, Integer> scores = new EnumMap<>(TrustDimension.class);

        private Builder() {
        }

        /** Record a score, clamped to [0, 100]. A null score leaves the dimension unavailable. */
        public Builder score(TrustDimension dimension, Integer score) {
            if (score != null) {
                scores.put(dimension, TrustScoreEngine.clamp(score));
            }
            return this;
        }

        public TrustMetrics build() {
            return new TrustMetrics(new EnumMap<>(scores));
        }
    }
}
