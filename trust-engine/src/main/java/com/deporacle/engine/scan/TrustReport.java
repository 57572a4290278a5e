package com.deporacle.engine.scan;

import com.deporacle.engine.analysis.TrendResult;
import com.deporacle.engine.analysis.TrustScoreResult;
import com.deporacle.engine.analysis.TyposquatResult;
import com.deporacle.engine.analysis.ZombieResult;
import com.deporacle.engine.blast.BlastRadiusResult;
import com.deporacle.engine.collector.CollectorSource;
import com.deporacle.engine.collector.CollectorStatus;

import java.util.Map;

/**
 * Everything known about one package.
 *
 * @param dependency     the package analyzed
 * @param score          trust score and per-dimension metrics
 * @param zombie         abandonment verdict
 * @param typosquat      name-similarity verdict
 * @param typosquatRisk  probability in [0, 1] that the name is a typosquat
 * @param blastRadius    files of the consuming project that import the package
 * @param trend          projected trajectory
 * @param sourceStatuses outcome of each collector
 * @param belowThreshold true when the score is below the configured minimum
 *
 * @author Naveed Gung
 */
public record TrustReport(
        Dependency dependency,
        TrustScoreResult score,
        ZombieResult zombie,
        TyposquatResult typosquat,
        double typosquatRisk,
        BlastRadiusResult blastRadius,
        TrendResult trend,
        Map<CollectorSource, CollectorStatus> sourceStatuses,
        boolean belowThreshold) {

    public TrustReport {
        sourceStatuses = Map.copyOf(sourceStatuses);
    }

    public int trustScore() {
        return score.trustScore();
    }

    /** Report for a package whose analysis failed outright. */
    public static TrustReport fallback(Dependency dependency, String reason) {
        return new TrustReport(
                dependency,
                TrustScoreResult.unavailable(),
                new ZombieResult(false, ZombieResult.Severity.NONE, null, reason),
                TyposquatResult.safe(),
                0.0,
                BlastRadiusResult.empty(),
                TrendResult.unknown(),
                Map.of(),
                true);
    }
}
