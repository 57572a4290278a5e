package com.deporacle.engine.collector;

import com.deporacle.engine.MutableClock;
import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.config.EngineConfig;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.LicenseData;
import com.deporacle.engine.model.LicenseRisk;
import com.deporacle.engine.model.RegistryData;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CollectorOrchestratorTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private ResultCache cache;
    private EngineConfig config;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-01T00:00:00Z");
        cache = new ResultCache(dir.resolve("cache.json"), new ObjectMapper().findAndRegisterModules(), clock, 3600);
        config = new EngineConfig();
        config.setCollectorTimeoutMs(200);
        meterRegistry = new SimpleMeterRegistry();
    }

    private static RegistryData registryData() {
        return new RegistryData("express", "4.18.2", "web framework", null, 270, null, 1000, "MIT",
                "https://github.com/expressjs/express");
    }

    private static LicenseData licenseData() {
        return new LicenseData("express", "4.18.2", "MIT", "MIT", LicenseRisk.SAFE, true);
    }

    private CollectorOrchestrator orchestrator(Collector<?>... collectors) {
        return new CollectorOrchestrator(List.of(collectors), cache, config, meterRegistry, clock);
    }

    @Test
    void shouldIsolateFailuresPerCollector() {
        CollectorOrchestrator orchestrator = orchestrator(
                StubCollector.of(CollectorSource.REGISTRY, RegistryData.class,
                        () -> Mono.just(CollectorResult.success(registryData(), clock.instant()))),
                StubCollector.of(CollectorSource.LICENSE, LicenseData.class,
                        () -> Mono.error(new IllegalStateException("license lookup exploded"))));

        CollectedData data = orchestrator.collectAll("express", "4.18.2", Ecosystem.NPM).block(Duration.ofSeconds(5));

        assertNotNull(data);
        assertEquals(CollectorStatus.SUCCESS, data.registry().status());
        assertEquals("express", data.registry().data().packageName());
        assertEquals(CollectorStatus.ERROR, data.license().status());
        assertEquals("license lookup exploded", data.license().error());
        assertEquals("no collector registered for security", data.security().error());
    }

    @Test
    void shouldTimeOutSlowCollector() {
        CollectorOrchestrator orchestrator = orchestrator(
                StubCollector.of(CollectorSource.REGISTRY, RegistryData.class, Mono::never),
                StubCollector.of(CollectorSource.LICENSE, LicenseData.class,
                        () -> Mono.just(CollectorResult.success(licenseData(), clock.instant()))));

        CollectedData data = orchestrator.collectAll("express", "4.18.2", Ecosystem.NPM).block(Duration.ofSeconds(5));

        assertNotNull(data);
        assertEquals(CollectorStatus.ERROR, data.registry().status());
        assertEquals("timeout after 200ms", data.registry().error());
        assertEquals(CollectorStatus.SUCCESS, data.license().status());
    }

    @Test
    void shouldTurnEmptyCompletionIntoError() {
        CollectorOrchestrator orchestrator = orchestrator(
                StubCollector.of(CollectorSource.REGISTRY, RegistryData.class, Mono::empty));

        CollectedData data = orchestrator.collectAll("express", "4.18.2").block(Duration.ofSeconds(5));

        assertNotNull(data);
        assertEquals("collector returned no result", data.registry().error());
    }

    @Test
    void shouldRecordMetersPerSourceAndStatus() {
        CollectorOrchestrator orchestrator = orchestrator(
                StubCollector.of(CollectorSource.REGISTRY, RegistryData.class,
                        () -> Mono.just(CollectorResult.success(registryData(), clock.instant()))),
                StubCollector.of(CollectorSource.LICENSE, LicenseData.class,
                        () -> Mono.just(CollectorResult.error("HTTP 503", clock.instant()))));

        orchestrator.collectAll("express", "4.18.2", Ecosystem.NPM).block(Duration.ofSeconds(5));

        assertEquals(1.0, meterRegistry.get("oracle.collector.results")
                .tag("source", "registry").tag("status", "success").counter().count());
        assertEquals(1.0, meterRegistry.get("oracle.collector.results")
                .tag("source", "license").tag("status", "error").counter().count());
        assertEquals(1, meterRegistry.get("oracle.collector.latency").tag("source", "registry").timer().count());
    }

    @Test
    void shouldAnswerFromCacheWhenOffline() {
        config.setOffline(true);
        cache.set(CollectorSource.REGISTRY.cacheKey(Ecosystem.NPM, "express", "4.18.2"), registryData());
        AtomicInteger calls = new AtomicInteger();
        CollectorOrchestrator orchestrator = orchestrator(
                StubCollector.of(CollectorSource.REGISTRY, RegistryData.class, () -> {
                    calls.incrementAndGet();
                    return Mono.just(CollectorResult.success(registryData(), clock.instant()));
                }),
                StubCollector.of(CollectorSource.LICENSE, LicenseData.class, () -> {
                    calls.incrementAndGet();
                    return Mono.just(CollectorResult.success(licenseData(), clock.instant()));
                }));

        CollectedData data = orchestrator.collectAll("express", "4.18.2", Ecosystem.NPM).block(Duration.ofSeconds(5));

        assertNotNull(data);
        assertEquals(0, calls.get());
        assertEquals(CollectorStatus.CACHED, data.registry().status());
        assertEquals(270, data.registry().data().versionCount());
        assertEquals(clock.instant(), data.registry().collectedAt());
        assertEquals(CollectorStatus.OFFLINE, data.license().status());
    }

    @Test
    void shouldKeepCacheKeysApartPerEcosystem() {
        config.setOffline(true);
        cache.set(CollectorSource.REGISTRY.cacheKey(Ecosystem.NPM, "requests", "2.31.0"), registryData());
        CollectorOrchestrator orchestrator = orchestrator(
                StubCollector.of(CollectorSource.REGISTRY, RegistryData.class, Mono::empty));

        CollectedData data = orchestrator.collectAll("requests", "2.31.0", Ecosystem.PYPI).block(Duration.ofSeconds(5));

        assertNotNull(data);
        assertEquals(CollectorStatus.OFFLINE, data.registry().status());
    }

    private List<Collector<?>> delayedCollectors(Duration delay, AtomicInteger inFlight, AtomicInteger peak) {
        List<Collector<?>> collectors = new ArrayList<>();
        for (CollectorSource source : CollectorSource.values()) {
            collectors.add(StubCollector.of(source, Object.class, () -> Mono.defer(() -> {
                peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return Mono.delay(delay)
                        .doOnNext(tick -> inFlight.decrementAndGet())
                        .then(Mono.fromSupplier(() -> CollectorResult.<Object>error("finished", clock.instant())));
            })));
        }
        return collectors;
    }

    @Test
    void shouldCapCollectorsInFlight() {
        config.setConcurrency(2);
        config.setCollectorTimeoutMs(10_000);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CollectorOrchestrator orchestrator = new CollectorOrchestrator(
                delayedCollectors(Duration.ofSeconds(1), inFlight, peak), cache, config, meterRegistry, clock);

        StepVerifier.withVirtualTime(() -> orchestrator.collectAll("express", "4.18.2", Ecosystem.NPM))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(2999))
                .thenAwait(Duration.ofMillis(1))
                .assertNext(data -> assertEquals(6, data.statuses().size()))
                .verifyComplete();

        assertEquals(2, peak.get());
        assertEquals(0, inFlight.get());
    }

    @Test
    void shouldTakeAboutAsLongAsSlowestCollector() {
        config.setConcurrency(6);
        config.setCollectorTimeoutMs(10_000);
        AtomicInteger peak = new AtomicInteger();
        CollectorOrchestrator orchestrator = new CollectorOrchestrator(
                delayedCollectors(Duration.ofSeconds(1), new AtomicInteger(), peak), cache, config, meterRegistry, clock);

        StepVerifier.withVirtualTime(() -> orchestrator.collectAll("express", "4.18.2", Ecosystem.NPM))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(999))
                .thenAwait(Duration.ofMillis(1))
                .assertNext(data -> {
                    assertEquals("finished", data.registry().error());
                    assertEquals("finished", data.repository().error());
                    assertEquals("finished", data.security().error());
                    assertEquals("finished", data.funding().error());
                    assertEquals("finished", data.popularity().error());
                    assertEquals("finished", data.license().error());
                })
                .verifyComplete();

        assertEquals(6, peak.get());
    }
}
