package com.deporacle.engine.collector;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.model.Ecosystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Cache-first collector skeleton.
 *
 * <p>
 * A cache hit is returned as CACHED with the time the entry was written. On a
 * miss the subclass fetches from upstream; the normalized result is written
 * through to the cache and returned as SUCCESS. Any error signal from the
 * fetch is turned into an ERROR result by {@link #recover}.
 * </p>
 *
 * @param <T> normalized data shape
 *
 * @author Naveed Gung
 */
public abstract class AbstractCachingCollector<T> implements Collector<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractCachingCollector.class);

    protected final ResultCache cache;
    protected final Clock clock;
    private final Class<T> dataType;

    protected AbstractCachingCollector(ResultCache cache, Clock clock, Class<T> dataType) {
        this.cache = cache;
        this.clock = clock;
        this.dataType = dataType;
    }

    @Override
    public Class<T> dataType() {
        return dataType;
    }

    @Override
    public final Mono<CollectorResult<T>> collect(String packageName, String version, Ecosystem ecosystem) {
        String key = source().cacheKey(ecosystem, packageName, version);
        return Mono.defer(() -> {
            Optional<T> hit = cache.get(key, dataType);
            if (hit.isPresent()) {
                log.debug("Cache hit for {}", key);
                return Mono.just(CollectorResult.cached(hit.get(), cache.createdAt(key).orElseGet(clock::instant)));
            }
            return fetch(packageName, version, ecosystem)
                    .flatMap(data -> store(key, data).thenReturn(CollectorResult.success(data, clock.instant())))
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException("no data returned")))
                    .onErrorResume(e -> recover(packageName, version, ecosystem, e));
        });
    }

    /** Fetch and normalize from upstream. May signal any error. */
    protected abstract Mono<T> fetch(String packageName, String version, Ecosystem ecosystem);

    /** Maps a fetch failure to the result returned to the orchestrator. */
    protected Mono<CollectorResult<T>> recover(String packageName, String version, Ecosystem ecosystem,
            Throwable error) {
        String message = describe(error);
        log.warn("{} collector failed for {}@{} ({}): {}",
                source().id(), packageName, version, ecosystem.key(), message);
        return Mono.just(CollectorResult.error(message, clock.instant()));
    }

    private Mono<ResultCache.WriteStatus> store(String key, T data) {
        return Mono.fromCallable(() -> cache.set(key, data))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(status -> {
                    if (status == ResultCache.WriteStatus.MEMORY_ONLY) {
                        log.debug("Cache entry {} kept in memory only", key);
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Cache write for {} failed: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    /** Short message for a failure, used as the ERROR result text. */
    public static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "upstream request timed out";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
