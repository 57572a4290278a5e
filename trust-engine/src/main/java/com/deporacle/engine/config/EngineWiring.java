package com.deporacle.engine.config;

import com.deporacle.engine.analysis.PopularPackageFetcher;
import com.deporacle.engine.analysis.ReferencePackageList;
import com.deporacle.engine.analysis.TrendPredictor;
import com.deporacle.engine.analysis.TrustScoreEngine;
import com.deporacle.engine.analysis.TrustWeights;
import com.deporacle.engine.analysis.TyposquatDetector;
import com.deporacle.engine.analysis.ZombieDetector;
import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import com.deporacle.engine.upstream.NpmRegistryClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Beans that need configuration values at construction time.
 *
 * <p>
 * Weight overrides are validated here: weights that do not sum to 1.0 make
 * {@link TrustWeights} throw and the application fails to start.
 * </p>
 *
 * @author Naveed Gung
 */
@Configuration
public class EngineWiring {

    private static final Logger log = LoggerFactory.getLogger(EngineWiring.class);

    private static final Duration POPULAR_FETCH_LIMIT = Duration.ofMinutes(2);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Timer source for rate-limit waits. Shared scheduler, never disposed here. */
    @Bean(destroyMethod = "")
    public Scheduler rateLimitScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public UpstreamRateLimiters upstreamRateLimiters(UpstreamConfig upstreamConfig, Scheduler rateLimitScheduler) {
        return new UpstreamRateLimiters(upstreamConfig, rateLimitScheduler);
    }

    @Bean
    public ResultCache resultCache(EngineConfig engineConfig, ObjectMapper objectMapper, Clock clock) {
        ResultCache cache = new ResultCache(Path.of(engineConfig.getCachePath()), objectMapper, clock,
                engineConfig.getCacheTtlSeconds());
        log.info("Result cache at {} ({} live entries)", cache.getFile(), cache.size());
        return cache;
    }

    @Bean
    public TrustScoreEngine trustScoreEngine(EngineConfig engineConfig, Clock clock) {
        return new TrustScoreEngine(TrustWeights.from(engineConfig.getWeights()), clock);
    }

    @Bean
    public ZombieDetector zombieDetector(Clock clock) {
        return new ZombieDetector(clock);
    }

    @Bean
    public TrendPredictor trendPredictor(Clock clock) {
        return new TrendPredictor(clock);
    }

    @Bean
    public PopularPackageFetcher popularPackageFetcher(NpmRegistryClient npmRegistryClient, ResultCache resultCache,
            TyposquatConfig typosquatConfig) {
        return new PopularPackageFetcher(npmRegistryClient, resultCache, typosquatConfig);
    }

    @Bean
    public TyposquatDetector typosquatDetector(TyposquatConfig typosquatConfig, EngineConfig engineConfig,
            PopularPackageFetcher popularPackageFetcher) {
        List<String> reference = new ArrayList<>(ReferencePackageList.load(typosquatConfig.getReferenceResource()));
        if (typosquatConfig.isFetchPopular() && !engineConfig.isOffline()) {
            List<String> popular = popularPackageFetcher.fetch()
                    .timeout(POPULAR_FETCH_LIMIT)
                    .onErrorResume(e -> {
                        log.warn("Popular package fetch did not finish: {}", e.getMessage());
                        return Mono.just(List.<String>of());
                    })
                    .block();
            if (popular != null) {
                reference.addAll(popular);
            }
        }
        return new TyposquatDetector(reference, typosquatConfig.getSuffixes());
    }
}
