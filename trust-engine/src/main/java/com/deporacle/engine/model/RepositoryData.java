package com.deporacle.engine.model;

import java.time.Instant;

/**
 * Source-repository activity signals.
 *
 * @param recentCommitCount commits on the default branch in the last 30 days
 * @param lastCommitDate    time of the most recent commit, null when unknown
 * @param hasFundingFile    whether {@code .github/FUNDING.yml} exists
 *
 * @author Naveed Gung
 */
public record RepositoryData(
        String owner,
        String repo,
        int stars,
        int forks,
        int openIssues,
        Instant updatedAt,
        boolean archived,
        String defaultBranch,
        int contributorCount,
        int recentCommitCount,
        Instant lastCommitDate,
        String lastCommitSha,
        boolean hasFundingFile) {
}
