package com.deporacle.engine.analysis;

import com.deporacle.engine.model.PopularityData;
import com.deporacle.engine.model.RegistryData;
import com.deporacle.engine.model.RepositoryData;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies a package as rising, stable or declining by weighted vote over
 * download trend, commit volume, release recency, version count, deprecation
 * and fork ratio.
 *
 * @author Naveed Gung
 */
public class TrendPredictor {

    private static final int HIGH_CONFIDENCE_SIGNALS = 3;

    private record Signal(TrendResult.Direction direction, double weight) {
    }

    private final Clock clock;

    public TrendPredictor(Clock clock) {
        this.clock = clock;
    }

    public TrendResult predict(RegistryData registry, PopularityData popularity, RepositoryData repository) {
        List<Signal> signals = new ArrayList<>();
        List<String> reasons = new ArrayList<>();

        if (popularity != null && popularity.trend() != null) {
            switch (popularity.trend()) {
                case RISING -> add(signals, reasons, TrendResult.Direction.RISING, 0.4,
                        "Downloads are trending upward");
                case DECLINING -> add(signals, reasons, TrendResult.Direction.DECLINING, 0.4,
                        "Downloads are trending downward");
                case STABLE -> add(signals, reasons, TrendResult.Direction.STABLE, 0.3,
                        "Downloads are stable");
            }
        }

        if (repository != null) {
            int commits = repository.recentCommitCount();
            if (commits >= 30) {
                add(signals, reasons, TrendResult.Direction.RISING, 0.3,
                        "High commit activity (" + commits + " commits in 30 days)");
            } else if (commits >= 10) {
                add(signals, reasons, TrendResult.Direction.STABLE, 0.2,
                        "Moderate commit activity (" + commits + " commits in 30 days)");
            } else if (commits >= 1) {
                add(signals, reasons, TrendResult.Direction.STABLE, 0.15,
                        "Low commit activity (" + commits + " commits in 30 days)");
            } else {
                add(signals, reasons, TrendResult.Direction.DECLINING, 0.3, "No commits in the last 30 days");
            }
        }

        if (registry != null) {
            if (registry.lastPublishDate() != null) {
                double months = Months.between(registry.lastPublishDate(), clock.instant());
                long rounded = Math.round(months);
                if (months < 2) {
                    add(signals, reasons, TrendResult.Direction.RISING, 0.2,
                            "Recent version published within last 2 months");
                } else if (months < 6) {
                    add(signals, reasons, TrendResult.Direction.STABLE, 0.15,
                            "Last publish " + rounded + " months ago");
                } else if (months < 12) {
                    add(signals, reasons, TrendResult.Direction.DECLINING, 0.2,
                            "No new version in " + rounded + " months");
                } else {
                    add(signals, reasons, TrendResult.Direction.DECLINING, 0.3,
                            "No new version in " + rounded + " months, possibly abandoned");
                }
            }
            if (registry.versionCount() > 50) {
                add(signals, reasons, TrendResult.Direction.STABLE, 0.1,
                        "Mature package with " + registry.versionCount() + " versions");
            }
            if (registry.hasDeprecation()) {
                add(signals, reasons, TrendResult.Direction.DECLINING, 0.5, "Package is marked as deprecated");
            }
        }

        if (repository != null && repository.stars() > 0
                && (double) repository.forks() / repository.stars() > 0.3) {
            add(signals, reasons, TrendResult.Direction.RISING, 0.1,
                    "High fork-to-star ratio indicates active community");
        }

        if (signals.isEmpty()) {
            return TrendResult.unknown();
        }

        Map<TrendResult.Direction, Double> votes = new EnumMap<>(TrendResult.Direction.class);
        double totalWeight = 0;
        for (Signal signal : signals) {
            votes.merge(signal.direction(), signal.weight(), Double::sum);
            totalWeight += signal.weight();
        }

        // Ties go to the earlier direction: rising, then stable, then declining.
        TrendResult.Direction trend = TrendResult.Direction.STABLE;
        double maxVote = 0;
        for (TrendResult.Direction direction : List.of(TrendResult.Direction.RISING,
                TrendResult.Direction.STABLE, TrendResult.Direction.DECLINING)) {
            double vote = votes.getOrDefault(direction, 0.0);
            if (vote > maxVote) {
                maxVote = vote;
                trend = direction;
            }
        }

        double dominance = totalWeight > 0 ? maxVote / totalWeight : 0;
        double signalFactor = Math.min((double) signals.size() / HIGH_CONFIDENCE_SIGNALS, 1.0);
        double confidence = Math.min(dominance * signalFactor, 1.0);

        double base = switch (trend) {
            case RISING -> 5;
            case DECLINING -> -10;
            default -> 0;
        };
        double projection = base * confidence;
        double decliningWeight = votes.getOrDefault(TrendResult.Direction.DECLINING, 0.0);
        if (decliningWeight > 0.5) {
            projection -= Math.round(decliningWeight * 5);
        }
        projection = Math.max(-20, Math.min(10, projection));

        return new TrendResult(trend, Math.round(confidence * 100) / 100.0, (int) Math.round(projection),
                String.join(". ", reasons) + ".");
    }

    private static void add(List<Signal> signals, List<String> reasons, TrendResult.Direction direction,
            double weight, String reason) {
        signals.add(new Signal(direction, weight));
        reasons.add(reason);
    }
}
