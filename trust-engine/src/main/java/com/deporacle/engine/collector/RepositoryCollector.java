package com.deporacle.engine.collector;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.RepositoryData;
import com.deporacle.engine.upstream.GitHubClient;
import com.deporacle.engine.upstream.GitHubCommit;
import com.deporacle.engine.upstream.GitHubSlug;
import com.deporacle.engine.upstream.JsonValues;
import com.deporacle.engine.upstream.RepositoryLocator;
import com.deporacle.engine.upstream.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Source-repository activity from GitHub.
 *
 * <p>
 * After the repository is located, five requests run in parallel: repository
 * info, contributor count, commits in the last 30 days, latest commit and
 * FUNDING.yml presence. Only the repository-info request is mandatory; the
 * others degrade to zero, null or false.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class RepositoryCollector extends AbstractCachingCollector<RepositoryData> {

    private static final Logger log = LoggerFactory.getLogger(RepositoryCollector.class);

    static final Duration RECENT_WINDOW = Duration.ofDays(30);

    private final GitHubClient gitHubClient;
    private final RepositoryLocator repositoryLocator;

    public RepositoryCollector(GitHubClient gitHubClient, RepositoryLocator repositoryLocator,
            ResultCache cache, Clock clock) {
        super(cache, clock, RepositoryData.class);
        this.gitHubClient = gitHubClient;
        this.repositoryLocator = repositoryLocator;
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.REPOSITORY;
    }

    @Override
    protected Mono<RepositoryData> fetch(String packageName, String version, Ecosystem ecosystem) {
        return repositoryLocator.locate(packageName, ecosystem)
                .switchIfEmpty(Mono.error(() -> new UpstreamException("No GitHub repository found")))
                .flatMap(this::fetchActivity);
    }

    Mono<RepositoryData> fetchActivity(GitHubSlug slug) {
        Instant since = clock.instant().minus(RECENT_WINDOW);

        Mono<Integer> contributors = gitHubClient.countContributors(slug)
                .onErrorResume(e -> degraded(slug, "contributors", e, 0));
        Mono<Integer> recentCommits = gitHubClient.countCommitsSince(slug, since)
                .onErrorResume(e -> degraded(slug, "recent commits", e, 0));
        Mono<Optional<GitHubCommit>> latest = gitHubClient.fetchLatestCommit(slug)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(e -> degraded(slug, "latest commit", e, Optional.<GitHubCommit>empty()));
        Mono<Boolean> fundingFile = gitHubClient.fetchFundingFile(slug)
                .map(content -> true)
                .defaultIfEmpty(false)
                .onErrorResume(e -> degraded(slug, "FUNDING.yml", e, false));

        return Mono.zip(gitHubClient.fetchRepository(slug), contributors, recentCommits, latest, fundingFile)
                .map(t -> toRepositoryData(slug, t.getT1(), t.getT2(), t.getT3(), t.getT4(), t.getT5()));
    }

    static RepositoryData toRepositoryData(GitHubSlug slug, JsonNode repo, int contributors, int recentCommits,
            Optional<GitHubCommit> latest, boolean hasFundingFile) {
        return new RepositoryData(
                slug.owner(),
                slug.repo(),
                repo.path("stargazers_count").asInt(0),
                repo.path("forks_count").asInt(0),
                repo.path("open_issues_count").asInt(0),
                JsonValues.instantOrNull(repo.path("updated_at")),
                repo.path("archived").asBoolean(false),
                repo.path("default_branch").asText("main"),
                contributors,
                recentCommits,
                latest.map(GitHubCommit::date).orElse(null),
                latest.map(GitHubCommit::sha).orElse(null),
                hasFundingFile);
    }

    private <V> Mono<V> degraded(GitHubSlug slug, String what, Throwable e, V fallback) {
        log.debug("GitHub {} lookup for {} failed, using fallback: {}", what, slug, e.getMessage());
        return Mono.just(fallback);
    }
}
