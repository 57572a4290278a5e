package com.deporacle.engine.analysis;

import com.deporacle.engine.model.RegistryData;
import com.deporacle.engine.model.RepositoryData;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Rule-based abandonment classifier. Rules are evaluated in order and the
 * first match wins:
 * <ol>
 * <li>deprecated on the registry: critical</li>
 * <li>zero contributors: critical</li>
 * <li>no commits for 24 months or more: critical</li>
 * <li>no commits and no publish for 12 months or more: warning</li>
 * <li>only one of the two signals known and it is 12 months stale: warning</li>
 * </ol>
 *
 * @author Naveed Gung
 */
public class ZombieDetector {

    private static final int STALE_MONTHS = 12;
    private static final int DEAD_MONTHS = 24;
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final Clock clock;

    public ZombieDetector(Clock clock) {
        this.clock = clock;
    }

    public ZombieResult detect(RegistryData registry, RepositoryData repository) {
        Instant now = clock.instant();

        Instant lastPublish = registry != null ? registry.lastPublishDate() : null;
        Instant lastCommit = repository != null ? repository.lastCommitDate() : null;
        Double monthsSincePublish = lastPublish != null ? Months.between(lastPublish, now) : null;
        Double monthsSinceCommit = lastCommit != null ? Months.between(lastCommit, now) : null;
        Instant lastActivity = later(lastPublish, lastCommit);

        if (registry != null && registry.hasDeprecation()) {
            return critical(lastActivity, "Package is marked as deprecated");
        }
        if (repository != null && repository.contributorCount() == 0) {
            return critical(lastActivity, "0 active maintainers/contributors");
        }
        if (monthsSinceCommit != null && monthsSinceCommit >= DEAD_MONTHS) {
            return critical(lastActivity, "No commits in " + Math.round(monthsSinceCommit)
                    + " months, last commit " + DAY.format(lastCommit));
        }

        boolean commitStale = monthsSinceCommit != null && monthsSinceCommit >= STALE_MONTHS;
        boolean publishStale = monthsSincePublish != null && monthsSincePublish >= STALE_MONTHS;

        if (commitStale && publishStale) {
            return warning(lastActivity, "No commits in " + Math.round(monthsSinceCommit)
                    + " months, last publish " + DAY.format(lastPublish));
        }
        if (commitStale && monthsSincePublish == null) {
            return warning(lastActivity, "No commits in " + Math.round(monthsSinceCommit)
                    + " months (registry data unavailable)");
        }
        if (publishStale && monthsSinceCommit == null) {
            return warning(lastActivity, "No publish in " + Math.round(monthsSincePublish)
                    + " months (GitHub data unavailable)");
        }
        return new ZombieResult(false, ZombieResult.Severity.NONE, lastActivity, "Package is actively maintained");
    }

    private static ZombieResult critical(Instant lastActivity, String reason) {
        return new ZombieResult(true, ZombieResult.Severity.CRITICAL, lastActivity, reason);
    }

    private static ZombieResult warning(Instant lastActivity, String reason) {
        return new ZombieResult(true, ZombieResult.Severity.WARNING, lastActivity, reason);
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
