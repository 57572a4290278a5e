package com.deporacle.engine.collector;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.FundingData;
import com.deporacle.engine.upstream.GitHubClient;
import com.deporacle.engine.upstream.JsonValues;
import com.deporacle.engine.upstream.NpmPackument;
import com.deporacle.engine.upstream.NpmRegistryClient;
import com.deporacle.engine.upstream.OpenCollectiveClient;
import com.deporacle.engine.upstream.RepositoryLocator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Funding channels: the registry {@code funding} field, the repository's
 * FUNDING.yml, and an OpenCollective profile named after the package.
 *
 * <p>
 * Most packages have no funding at all, so a lookup that fails or finds
 * nothing is reported as a successful all-false result rather than an error.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class FundingCollector extends AbstractCachingCollector<FundingData> {

    private static final Logger log = LoggerFactory.getLogger(FundingCollector.class);

    private static final Pattern GITHUB_SPONSORS = Pattern.compile("(?im)^\\s*github:\\s*(.+)$");
    private static final Pattern OPEN_COLLECTIVE = Pattern.compile("(?im)^\\s*open_collective:\\s*(\\S+)");
    private static final Pattern KO_FI = Pattern.compile("(?im)^\\s*ko_fi:\\s*(\\S+)");
    private static final Pattern PATREON = Pattern.compile("(?im)^\\s*patreon:\\s*(\\S+)");
    private static final Pattern GITHUB_USERNAME = Pattern.compile("^[a-zA-Z0-9]([a-zA-Z0-9-]{0,37}[a-zA-Z0-9])?$");

    /** Budgets above this are reported by OpenCollective in cents. */
    private static final double CENTS_THRESHOLD = 1_000_000;

    private final NpmRegistryClient npmRegistryClient;
    private final RepositoryLocator repositoryLocator;
    private final GitHubClient gitHubClient;
    private final OpenCollectiveClient openCollectiveClient;

    public FundingCollector(
            NpmRegistryClient npmRegistryClient,
            RepositoryLocator repositoryLocator,
            GitHubClient gitHubClient,
            OpenCollectiveClient openCollectiveClient,
            ResultCache cache,
            Clock clock) {
        super(cache, clock, FundingData.class);
        this.npmRegistryClient = npmRegistryClient;
        this.repositoryLocator = repositoryLocator;
        this.gitHubClient = gitHubClient;
        this.openCollectiveClient = openCollectiveClient;
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.FUNDING;
    }

    @Override
    protected Mono<FundingData> fetch(String packageName, String version, Ecosystem ecosystem) {
        Mono<List<String>> registryFunding = ecosystem == Ecosystem.NPM
                ? npmRegistryClient.fetchPackument(packageName)
                        .map(NpmPackument::fundingUrls)
                        .onErrorResume(e -> quiet(packageName, "registry funding", e, List.<String>of()))
                : Mono.just(List.of());

        Mono<String> fundingFile = repositoryLocator.locate(packageName, ecosystem)
                .flatMap(gitHubClient::fetchFundingFile)
                .defaultIfEmpty("")
                .onErrorResume(e -> quiet(packageName, "FUNDING.yml", e, ""));

        Mono<JsonNode> collective = openCollectiveClient.fetchProfile(OpenCollectiveClient.slugFor(packageName))
                .defaultIfEmpty(MissingNode.getInstance())
                .onErrorResume(e -> quiet(packageName, "OpenCollective", e, MissingNode.getInstance()));

        return Mono.zip(registryFunding, fundingFile, collective)
                .map(t -> toFundingData(packageName, t.getT1(), t.getT2(), t.getT3()));
    }

    @Override
    protected Mono<CollectorResult<FundingData>> recover(String packageName, String version, Ecosystem ecosystem,
            Throwable error) {
        log.warn("Funding lookup failed for {}@{}, reporting no funding: {}",
                packageName, version, describe(error));
        return Mono.just(CollectorResult.success(FundingData.none(packageName), clock.instant()));
    }

    static FundingData toFundingData(String packageName, List<String> registryUrls, String fundingFile,
            JsonNode collective) {
        boolean hasCollectiveProfile = collective.isObject();
        boolean activeCollective = hasCollectiveProfile && collective.path("isActive").asBoolean(false);
        String slug = hasCollectiveProfile ? JsonValues.textOrNull(collective.path("slug")) : null;

        double budget = collective.path("yearlyBudget").asDouble(0);
        double estimated = budget > CENTS_THRESHOLD ? Math.round(budget / 100) : budget;

        Set<String> urls = new LinkedHashSet<>(registryUrls);
        urls.addAll(parseFundingFile(fundingFile));
        if (slug != null) {
            urls.add("https://opencollective.com/" + slug);
        }

        return new FundingData(
                packageName,
                !fundingFile.isBlank(),
                activeCollective,
                !registryUrls.isEmpty(),
                slug,
                collective.path("backersCount").asInt(0),
                Math.max(0, estimated),
                List.copyOf(urls));
    }

    /** Funding links declared in a FUNDING.yml document. */
    static List<String> parseFundingFile(String content) {
        List<String> urls = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return urls;
        }
        Matcher gh = GITHUB_SPONSORS.matcher(content);
        if (gh.find()) {
            String value = gh.group(1).trim().replaceFirst("#.*$", "").trim()
                    .replaceFirst("^\\[", "").replaceFirst("]$", "");
            for (String sponsor : value.split(",")) {
                String name = sponsor.trim().replaceAll("['\"]", "");
                if (GITHUB_USERNAME.matcher(name).matches()) {
                    urls.add("https://github.com/sponsors/" + name);
                }
            }
        }
        addMatch(urls, OPEN_COLLECTIVE, content, "https://opencollective.com/");
        addMatch(urls, KO_FI, content, "https://ko-fi.com/");
        addMatch(urls, PATREON, content, "https://patreon.com/");
        return urls;
    }

    private static void addMatch(List<String> urls, Pattern pattern, String content, String prefix) {
        Matcher m = pattern.matcher(content);
        if (m.find()) {
            String value = m.group(1).replaceAll("['\"]", "");
            if (!value.startsWith("#") && !value.equals("~") && !value.equalsIgnoreCase("null")) {
                urls.add(prefix + value);
            }
        }
    }

    private <V> Mono<V> quiet(String packageName, String what, Throwable e, V fallback) {
        log.debug("{} lookup for {} failed: {}", what, packageName, e.getMessage());
        return Mono.just(fallback);
    }
}
