package com.deporacle.engine.analysis;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.config.TyposquatConfig;
import com.deporacle.engine.upstream.NpmRegistryClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches the most popular npm package names from the registry search API to
 * extend the typosquat reference list.
 *
 * <p>
 * Pages of 250 are requested one at a time with a pause between them. The
 * result is cached for {@code oracle.typosquat.popular-ttl-seconds}. Any
 * failure yields an empty list so the bundled list is used alone.
 * </p>
 *
 * @author Naveed Gung
 */
public class PopularPackageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PopularPackageFetcher.class);

    static final String CACHE_KEY = "typosquat:popular";
    static final int PAGE_SIZE = 250;

    private final NpmRegistryClient registryClient;
    private final ResultCache cache;
    private final TyposquatConfig config;

    public PopularPackageFetcher(NpmRegistryClient registryClient, ResultCache cache, TyposquatConfig config) {
        this.registryClient = registryClient;
        this.cache = cache;
        this.config = config;
    }

    public Mono<List<String>> fetch() {
        return Mono.fromCallable(this::cached)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(hit -> hit.map(Mono::just).orElseGet(this::fetchFromRegistry));
    }

    private Optional<List<String>> cached() {
        Optional<JsonNode> node = cache.get(CACHE_KEY);
        if (node.isEmpty() || !node.get().isArray() || node.get().isEmpty()) {
            return Optional.empty();
        }
        List<String> names = new ArrayList<>();
        node.get().forEach(n -> names.add(n.asText()));
        log.info("Using {} cached popular package names", names.size());
        return Optional.of(names);
    }

    private Mono<List<String>> fetchFromRegistry() {
        int count = config.getPopularCount();
        int pages = (count + PAGE_SIZE - 1) / PAGE_SIZE;
        Duration pause = Duration.ofMillis(config.getPageDelayMs());

        return Flux.range(0, pages)
                .concatMap(page -> {
                    Mono<Long> wait = page == 0 ? Mono.just(0L) : Mono.delay(pause);
                    log.info("Fetching popular packages from npm registry (page {}/{})", page + 1, pages);
                    return wait.then(registryClient.searchByPopularity(PAGE_SIZE, page * PAGE_SIZE))
                            .map(PopularPackageFetcher::namesOf);
                })
                .takeUntil(names -> names.size() < PAGE_SIZE)
                .flatMapIterable(names -> names)
                .distinct()
                .take(count)
                .collectList()
                .flatMap(names -> Mono.fromCallable(() -> {
                    if (!names.isEmpty()) {
                        cache.set(CACHE_KEY, names, config.getPopularTtlSeconds());
                    }
                    log.info("Fetched {} popular package names from npm registry", names.size());
                    return names;
                }).subscribeOn(Schedulers.boundedElastic()))
                .onErrorResume(e -> {
                    log.warn("Failed to fetch popular packages, using the bundled list only: {}", e.getMessage());
                    return Mono.just(List.of());
                });
    }

    static List<String> namesOf(JsonNode searchResult) {
        List<String> names = new ArrayList<>();
        for (JsonNode object : searchResult.path("objects")) {
            String name = object.path("package").path("name").asText("");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
