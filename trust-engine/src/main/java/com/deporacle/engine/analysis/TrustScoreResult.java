package com.deporacle.engine.analysis;

import java.util.Set;

/**
 * Aggregate trust score.
 *
 * @param trustScore            weighted score in [0, 100]
 * @param metrics               per-dimension scores
 * @param insufficientData      true when two or more dimensions are unavailable
 * @param unavailableDimensions dimensions that had no data
 *
 * @author Naveed Gung
 */
public record TrustScoreResult(int trustScore, TrustMetrics metrics, boolean insufficientData,
        Set<TrustDimension> unavailableDimensions) {

    public TrustScoreResult {
        unavailableDimensions = Set.copyOf(unavailableDimensions);
    }

    /** Result used when a package could not be analyzed at all. */
    public static TrustScoreResult unavailable() {
        TrustMetrics empty = TrustMetrics.builder().build();
        return new TrustScoreResult(0, empty, true, empty.unavailable());
    }
}
