package com.deporacle.engine.upstream;

import com.deporacle.engine.config.EngineConfig;
import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.ratelimit.Upstream;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST API client.
 *
 * <p>
 * Counts are obtained cheaply by requesting one item per page and reading the
 * page number of the {@code rel="last"} link, so contributor and commit
 * totals cost one request each regardless of repository size. A token is
 * optional and only raises the rate ceiling.
 * </p>
 *
 * @see <a href="https://docs.github.com/en/rest">GitHub REST API</a>
 *
 * @author Naveed Gung
 */
@Component
public class GitHubClient extends UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private static final Pattern LAST_PAGE = Pattern.compile("[?&]page=(\\d+)[^>]*>;\\s*rel=\"last\"");
    private static final String API_VERSION = "2022-11-28";

    private final WebClient api;

    public GitHubClient(UpstreamConfig upstreamConfig, EngineConfig engineConfig,
            UpstreamRateLimiters limiters, ObjectMapper objectMapper) {
        super(upstreamConfig.getGithub(), limiters.get(Upstream.GITHUB), objectMapper);
        String token = engineConfig.getGithubToken();
        this.api = webClient.mutate()
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", API_VERSION)
                .defaultHeaders(h -> {
                    if (token != null && !token.isBlank()) {
                        h.setBearerAuth(token);
                    }
                })
                .build();
        if (token == null || token.isBlank()) {
            log.info("No GitHub token configured, using the anonymous rate limit");
        }
    }

    /** Repository metadata. Failures propagate: without it there is no repository signal. */
    public Mono<JsonNode> fetchRepository(GitHubSlug slug) {
        log.debug("GitHub: repo info {}", slug);
        return limiter.acquire()
                .then(api.get()
                        .uri("/repos/{owner}/{repo}", slug.owner(), slug.repo())
                        .retrieve()
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .timeout(timeout))
                .map(this::readTree);
    }

    public Mono<Integer> countContributors(GitHubSlug slug) {
        log.debug("GitHub: contributor count {}", slug);
        return countPaged(api.get()
                .uri("/repos/{owner}/{repo}/contributors?per_page=1&anon=true", slug.owner(), slug.repo()));
    }

    public Mono<Integer> countCommitsSince(GitHubSlug slug, Instant since) {
        log.debug("GitHub: commits since {} for {}", since, slug);
        return countPaged(api.get()
                .uri("/repos/{owner}/{repo}/commits?since={since}&per_page=1",
                        slug.owner(), slug.repo(), since.toString()));
    }

    /** Most recent commit on the default branch, empty for an empty repository. */
    public Mono<GitHubCommit> fetchLatestCommit(GitHubSlug slug) {
        log.debug("GitHub: latest commit {}", slug);
        return limiter.acquire()
                .then(api.get()
                        .uri("/repos/{owner}/{repo}/commits?per_page=1", slug.owner(), slug.repo())
                        .retrieve()
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .timeout(timeout))
                .map(this::readTree)
                .flatMap(body -> {
                    JsonNode first = body.path(0);
                    if (first.isMissingNode()) {
                        return Mono.empty();
                    }
                    String sha = JsonValues.textOrNull(first.path("sha"));
                    Instant date = JsonValues.instantOrNull(first.path("commit").path("committer").path("date"));
                    return Mono.just(new GitHubCommit(sha, date));
                });
    }

    /**
     * Raw content of {@code .github/FUNDING.yml}; empty when the file does not
     * exist.
     */
    public Mono<String> fetchFundingFile(GitHubSlug slug) {
        log.debug("GitHub: FUNDING.yml {}", slug);
        return limiter.acquire()
                .then(api.get()
                        .uri("/repos/{owner}/{repo}/contents/.github/FUNDING.yml", slug.owner(), slug.repo())
                        .header(HttpHeaders.ACCEPT, "application/vnd.github.raw+json")
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(timeout))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }

    private Mono<Integer> countPaged(WebClient.RequestHeadersSpec<?> request) {
        return limiter.acquire()
                .then(request.retrieve()
                        .toEntity(String.class)
                        .timeout(timeout))
                .map(this::countFromEntity);
    }

    private int countFromEntity(ResponseEntity<String> entity) {
        Integer lastPage = lastPage(entity.getHeaders().getFirst(HttpHeaders.LINK));
        if (lastPage != null) {
            return lastPage;
        }
        String body = entity.getBody();
        return body == null || body.isBlank() ? 0 : readTree(body).size();
    }

    /** Page number of the {@code rel="last"} link, or null when the header has none. */
    static Integer lastPage(String linkHeader) {
        if (linkHeader == null) {
            return null;
        }
        Matcher m = LAST_PAGE.matcher(linkHeader);
        return m.find() ? Integer.valueOf(m.group(1)) : null;
    }
}
