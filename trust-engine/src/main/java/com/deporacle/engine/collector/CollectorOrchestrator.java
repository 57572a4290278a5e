package com.deporacle.engine.collector;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.config.EngineConfig;
import com.deporacle.engine.model.Ecosystem;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Runs all collectors for one package concurrently.
 *
 * <p>
 * At most {@code oracle.engine.concurrency} collectors are in flight. Each
 * invocation has its own timeout; a collector that times out or signals an
 * error yields an ERROR result without affecting the others. In offline mode
 * no collector runs and each source is answered from the cache alone.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class CollectorOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CollectorOrchestrator.class);

    private final List<Collector<?>> collectors;
    private final ResultCache cache;
    private final EngineConfig config;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public CollectorOrchestrator(
            List<Collector<?>> collectors,
            ResultCache cache,
            EngineConfig config,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.collectors = List.copyOf(collectors);
        this.cache = cache;
        this.config = config;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Collect all six signals for a package.
     *
     * @return always completes with a value; never signals an error
     */
    public Mono<CollectedData> collectAll(String packageName, String version, Ecosystem ecosystem) {
        if (config.isOffline()) {
            log.debug("Offline mode: answering {}@{} from cache", packageName, version);
            return Flux.fromIterable(collectors)
                    .flatMap(c -> Mono.fromCallable(() -> fromCacheOnly(c, packageName, version, ecosystem))
                            .subscribeOn(Schedulers.boundedElastic()))
                    .collectMap(SourcedResult::source, SourcedResult::result)
                    .map(results -> CollectedData.from(results, clock.instant()));
        }

        log.debug("Collecting {}@{} ({}) from {} sources", packageName, version, ecosystem.key(), collectors.size());
        return Flux.fromIterable(collectors)
                .flatMap(c -> invoke(c, packageName, version, ecosystem), config.getConcurrency())
                .collectMap(SourcedResult::source, SourcedResult::result)
                .map(results -> CollectedData.from(results, clock.instant()))
                .onErrorResume(e -> {
                    log.error("Collection for {}@{} failed: {}", packageName, version, e.getMessage(), e);
                    return Mono.just(CollectedData.failed(AbstractCachingCollector.describe(e), clock.instant()));
                });
    }

    public Mono<CollectedData> collectAll(String packageName, String version) {
        return collectAll(packageName, version, Ecosystem.NPM);
    }

    private Mono<SourcedResult> invoke(Collector<?> collector, String packageName, String version,
            Ecosystem ecosystem) {
        long timeoutMs = config.getCollectorTimeoutMs();
        CollectorSource source = collector.source();
        Timer.Sample sample = Timer.start(meterRegistry);

        return Mono.defer(() -> collector.collect(packageName, version, ecosystem))
                .<CollectorResult<?>>map(r -> r)
                .timeout(Duration.ofMillis(timeoutMs),
                        Mono.<CollectorResult<?>>fromSupplier(() -> CollectorResult.error("timeout after " + timeoutMs + "ms",
                                clock.instant())))
                .onErrorResume(e -> Mono.just(CollectorResult.error(AbstractCachingCollector.describe(e),
                        clock.instant())))
                .defaultIfEmpty(CollectorResult.error("collector returned no result", clock.instant()))
                .map(result -> {
                    sample.stop(Timer.builder("oracle.collector.latency")
                            .description("Collector invocation latency")
                            .tag("source", source.id())
                            .register(meterRegistry));
                    Counter.builder("oracle.collector.results")
                            .description("Collector outcomes by source and status")
                            .tag("source", source.id())
                            .tag("status", result.status().name().toLowerCase(Locale.ROOT))
                            .register(meterRegistry)
                            .increment();
                    if (result.error() != null) {
                        log.info("{} for {}@{}: {} ({})", source.id(), packageName, version,
                                result.status(), result.error());
                    } else {
                        log.info("{} for {}@{}: {}", source.id(), packageName, version, result.status());
                    }
                    return new SourcedResult(source, result);
                });
    }

    private SourcedResult fromCacheOnly(Collector<?> collector, String packageName, String version,
            Ecosystem ecosystem) {
        CollectorSource source = collector.source();
        String key = source.cacheKey(ecosystem, packageName, version);
        Optional<?> hit = cache.get(key, collector.dataType());
        CollectorResult<?> result = hit
                .<CollectorResult<?>>map(data -> CollectorResult.cached(data,
                        cache.createdAt(key).orElseGet(clock::instant)))
                .orElseGet(() -> CollectorResult.offline(clock.instant()));
        return new SourcedResult(source, result);
    }

    private record SourcedResult(CollectorSource source, CollectorResult<?> result) {
    }
}
