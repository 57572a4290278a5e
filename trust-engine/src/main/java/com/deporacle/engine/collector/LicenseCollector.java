package com.deporacle.engine.collector;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.LicenseData;
import com.deporacle.engine.upstream.NpmRegistryClient;
import com.deporacle.engine.upstream.PypiClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;

/**
 * License risk of the requested version.
 *
 * @author Naveed Gung
 */
@Component
public class LicenseCollector extends AbstractCachingCollector<LicenseData> {

    private final NpmRegistryClient npmRegistryClient;
    private final PypiClient pypiClient;
    private final LicenseClassifier classifier;

    public LicenseCollector(NpmRegistryClient npmRegistryClient, PypiClient pypiClient,
            LicenseClassifier classifier, ResultCache cache, Clock clock) {
        super(cache, clock, LicenseData.class);
        this.npmRegistryClient = npmRegistryClient;
        this.pypiClient = pypiClient;
        this.classifier = classifier;
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.LICENSE;
    }

    @Override
    protected Mono<LicenseData> fetch(String packageName, String version, Ecosystem ecosystem) {
        Mono<Optional<String>> raw = switch (ecosystem) {
            case NPM -> npmRegistryClient.fetchPackument(packageName)
                    .map(p -> Optional.ofNullable(p.license(version)));
            case PYPI -> pypiClient.fetchProject(packageName)
                    .map(p -> Optional.ofNullable(p.license()));
        };
        return raw.map(license -> toLicenseData(packageName, version, license.orElse(null)));
    }

    LicenseData toLicenseData(String packageName, String version, String raw) {
        LicenseClassifier.Classification c = classifier.classify(raw);
        return new LicenseData(packageName, version, raw, c.spdx(), c.risk(), c.osiApproved());
    }
}
