package com.deporacle.engine.analysis;

import com.deporacle.engine.collector.CollectedData;
import com.deporacle.engine.model.FundingData;
import com.deporacle.engine.model.LicenseData;
import com.deporacle.engine.model.PopularityData;
import com.deporacle.engine.model.RegistryData;
import com.deporacle.engine.model.RepositoryData;
import com.deporacle.engine.model.SecurityData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Set;

/**
 * Reduces collected signals to a 0-100 trust score.
 *
 * <p>
 * Each dimension is scored independently; a dimension whose source produced
 * no data is unavailable. The aggregate is the weighted average over the
 * available dimensions, with their weights rescaled to sum to one, then
 * pulled toward 50 in proportion to the weight that was missing.
 * </p>
 *
 * @author Naveed Gung
 */
public class TrustScoreEngine {

    private static final Logger log = LoggerFactory.getLogger(TrustScoreEngine.class);

    private final TrustWeights weights;
    private final Clock clock;

    public TrustScoreEngine(TrustWeights weights, Clock clock) {
        this.weights = weights;
        this.clock = clock;
    }

    public TrustWeights getWeights() {
        return weights;
    }

    public TrustScoreResult calculate(CollectedData data) {
        RegistryData registry = data.registry().data();
        RepositoryData repository = data.repository().data();

        TrustMetrics metrics = TrustMetrics.builder()
                .score(TrustDimension.SECURITY, securityScore(data.security().data()))
                .score(TrustDimension.MAINTAINER, maintainerScore(repository))
                .score(TrustDimension.ACTIVITY, activityScore(registry, repository))
                .score(TrustDimension.POPULARITY, popularityScore(data.popularity().data()))
                .score(TrustDimension.FUNDING, fundingScore(data.funding().data()))
                .score(TrustDimension.LICENSE, licenseScore(data.license().data()))
                .build();

        int score = weightedScore(metrics);
        Set<TrustDimension> unavailable = metrics.unavailable();
        if (!unavailable.isEmpty()) {
            log.debug("Trust score {} computed without {}", score, unavailable);
        }
        return new TrustScoreResult(score, metrics, unavailable.size() >= 2, unavailable);
    }

    Integer securityScore(SecurityData data) {
        if (data == null) {
            return null;
        }
        int vulns = data.totalVulnerabilities();
        int score = switch (vulns) {
            case 0 -> 100;
            case 1 -> 85;
            case 2 -> 72;
            case 3 -> 60;
            case 4 -> 50;
            default -> Math.max(20, 100 - vulns * 12);
        };

        Integer patchDays = data.averagePatchDays();
        if (vulns > 0 && patchDays != null && patchDays > 0) {
            if (patchDays <= 7) {
                score = Math.min(100, score + 10);
            } else if (patchDays <= 30) {
                score = Math.min(100, score + 5);
            }
        }
        return clamp(score);
    }

    Integer maintainerScore(RepositoryData data) {
        if (data == null) {
            return null;
        }
        int ceiling;
        if (data.contributorCount() <= 1) {
            ceiling = 60;
        } else if (data.contributorCount() <= 5) {
            ceiling = 80;
        } else {
            ceiling = 100;
        }

        int score = ceiling;
        int commits = data.recentCommitCount();
        if (commits == 0) {
            score -= 20;
        } else if (commits < 5) {
            score -= 10;
        } else if (commits >= 20) {
            score = Math.min(ceiling, score + 5);
        }
        return clamp(score);
    }

    /** Publish recency blended 60/40 with commit volume; either alone is used as-is. */
    Integer activityScore(RegistryData registry, RepositoryData repository) {
        if (registry == null && repository == null) {
            return null;
        }

        int publishScore = 50;
        if (registry != null && registry.lastPublishDate() != null) {
            double months = Months.between(registry.lastPublishDate(), clock.instant());
            if (months < 3) {
                publishScore = 100;
            } else if (months < 6) {
                publishScore = 80;
            } else if (months < 12) {
                publishScore = 50;
            } else if (months < 24) {
                publishScore = 20;
            } else {
                publishScore = 0;
            }
        }

        int commitScore = 50;
        if (repository != null) {
            int commits = repository.recentCommitCount();
            if (commits >= 30) {
                commitScore = 100;
            } else if (commits >= 15) {
                commitScore = 80;
            } else if (commits >= 5) {
                commitScore = 60;
            } else if (commits >= 1) {
                commitScore = 40;
            } else {
                commitScore = 10;
            }
        }

        if (registry != null && repository != null) {
            return clamp((int) Math.round(publishScore * 0.6 + commitScore * 0.4));
        }
        return clamp(registry != null ? publishScore : commitScore);
    }

    Integer popularityScore(PopularityData data) {
        if (data == null) {
            return null;
        }
        long dl = data.weeklyDownloads();
        if (dl >= 10_000_000) {
            return 100;
        }
        if (dl >= 1_000_000) {
            return 90;
        }
        if (dl >= 100_000) {
            return 75;
        }
        if (dl >= 10_000) {
            return 60;
        }
        if (dl >= 1_000) {
            return 40;
        }
        if (dl >= 100) {
            return 25;
        }
        return 10;
    }

    Integer fundingScore(FundingData data) {
        if (data == null) {
            return null;
        }
        if (data.estimatedAnnualFunding() >= 50_000) {
            return 90;
        }
        if (data.hasOpenCollective()) {
            return 70;
        }
        if (data.hasSponsors()) {
            return 60;
        }
        if (data.hasRegistryFunding()) {
            return 65;
        }
        return 30;
    }

    Integer licenseScore(LicenseData data) {
        if (data == null) {
            return null;
        }
        return switch (data.risk()) {
            case SAFE -> 100;
            case CAUTIOUS -> 60;
            case RISKY -> 30;
            case UNKNOWN -> 10;
        };
    }

    int weightedScore(TrustMetrics metrics) {
        double availableWeight = 0;
        double missingWeight = 0;
        for (TrustDimension dimension : TrustDimension.values()) {
            if (metrics.isAvailable(dimension)) {
                availableWeight += weights.weightOf(dimension);
            } else {
                missingWeight += weights.weightOf(dimension);
            }
        }
        if (availableWeight <= 0) {
            return 0;
        }

        double score = 0;
        for (TrustDimension dimension : TrustDimension.values()) {
            if (metrics.isAvailable(dimension)) {
                score += metrics.scoreOrZero(dimension) * (weights.weightOf(dimension) / availableWeight);
            }
        }
        if (missingWeight > 0) {
            score -= (score - 50) * missingWeight;
        }
        return clamp((int) Math.round(score));
    }

    static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
