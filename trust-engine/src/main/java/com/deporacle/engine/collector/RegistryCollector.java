package com.deporacle.engine.collector;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.RegistryData;
import com.deporacle.engine.upstream.NpmDownloadsClient;
import com.deporacle.engine.upstream.NpmPackument;
import com.deporacle.engine.upstream.NpmRegistryClient;
import com.deporacle.engine.upstream.PypiClient;
import com.deporacle.engine.upstream.PypiProject;
import com.deporacle.engine.upstream.PypiStatsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Package-registry metadata: release history, deprecation, license and
 * repository link, plus last-week downloads.
 *
 * <p>
 * Metadata and download count are fetched in parallel. A failed download
 * lookup degrades to 0; a failed metadata lookup fails the collector.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class RegistryCollector extends AbstractCachingCollector<RegistryData> {

    private static final Logger log = LoggerFactory.getLogger(RegistryCollector.class);

    private final NpmRegistryClient npmRegistryClient;
    private final NpmDownloadsClient npmDownloadsClient;
    private final PypiClient pypiClient;
    private final PypiStatsClient pypiStatsClient;

    public RegistryCollector(
            NpmRegistryClient npmRegistryClient,
            NpmDownloadsClient npmDownloadsClient,
            PypiClient pypiClient,
            PypiStatsClient pypiStatsClient,
            ResultCache cache,
            Clock clock) {
        super(cache, clock, RegistryData.class);
        this.npmRegistryClient = npmRegistryClient;
        this.npmDownloadsClient = npmDownloadsClient;
        this.pypiClient = pypiClient;
        this.pypiStatsClient = pypiStatsClient;
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.REGISTRY;
    }

    @Override
    protected Mono<RegistryData> fetch(String packageName, String version, Ecosystem ecosystem) {
        return switch (ecosystem) {
            case NPM -> fetchNpm(packageName, version);
            case PYPI -> fetchPypi(packageName, version);
        };
    }

    private Mono<RegistryData> fetchNpm(String packageName, String version) {
        Mono<Long> weekly = npmDownloadsClient.fetchDownloads(packageName, NpmDownloadsClient.LAST_WEEK)
                .onErrorResume(e -> {
                    log.warn("Could not fetch download stats for {}: {}", packageName, e.getMessage());
                    return Mono.just(0L);
                });

        return Mono.zip(npmRegistryClient.fetchPackument(packageName), weekly)
                .map(t -> toRegistryData(packageName, version, t.getT1(), t.getT2()));
    }

    private Mono<RegistryData> fetchPypi(String packageName, String version) {
        Mono<Long> weekly = pypiStatsClient.fetchRecent(packageName)
                .map(data -> data.path("last_week").asLong(0))
                .onErrorResume(e -> {
                    log.warn("Could not fetch PyPI download stats for {}: {}", packageName, e.getMessage());
                    return Mono.just(0L);
                });

        return Mono.zip(pypiClient.fetchProject(packageName), weekly)
                .map(t -> toRegistryData(packageName, version, t.getT1(), t.getT2()));
    }

    static RegistryData toRegistryData(String packageName, String version, NpmPackument packument, long weekly) {
        return new RegistryData(
                packageName,
                version,
                packument.description(),
                packument.lastPublishDate(),
                packument.versionCount(),
                packument.deprecation(version),
                weekly,
                packument.license(version),
                packument.repositoryUrl());
    }

    static RegistryData toRegistryData(String packageName, String version, PypiProject project, long weekly) {
        return new RegistryData(
                packageName,
                project.resolveVersion(version),
                project.summary(),
                project.lastPublishDate(),
                project.releaseCount(),
                project.yankReason(version),
                weekly,
                project.license(),
                project.repositoryUrl());
    }
}
