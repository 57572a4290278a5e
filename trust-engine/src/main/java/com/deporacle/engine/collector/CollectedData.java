package com.deporacle.engine.collector;

import com.deporacle.engine.model.FundingData;
import com.deporacle.engine.model.LicenseData;
import com.deporacle.engine.model.PopularityData;
import com.deporacle.engine.model.RegistryData;
import com.deporacle.engine.model.RepositoryData;
import com.deporacle.engine.model.SecurityData;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * The six collector outcomes for one package. Every slot is always populated;
 * a source that produced nothing carries an ERROR result.
 *
 * @author Naveed Gung
 */
public record CollectedData(
        CollectorResult<RegistryData> registry,
        CollectorResult<RepositoryData> repository,
        CollectorResult<SecurityData> security,
        CollectorResult<FundingData> funding,
        CollectorResult<PopularityData> popularity,
        CollectorResult<LicenseData> license) {

    /**
     * Assemble from the orchestrator's per-source map. Missing sources and
     * results whose data does not match the source type become ERROR.
     */
    public static CollectedData from(Map<CollectorSource, CollectorResult<?>> results, Instant now) {
        return new CollectedData(
                slot(results, CollectorSource.REGISTRY, RegistryData.class, now),
                slot(results, CollectorSource.REPOSITORY, RepositoryData.class, now),
                slot(results, CollectorSource.SECURITY, SecurityData.class, now),
                slot(results, CollectorSource.FUNDING, FundingData.class, now),
                slot(results, CollectorSource.POPULARITY, PopularityData.class, now),
                slot(results, CollectorSource.LICENSE, LicenseData.class, now));
    }

    /** Every source failed with the same message. */
    public static CollectedData failed(String message, Instant now) {
        return new CollectedData(CollectorResult.error(message, now), CollectorResult.error(message, now),
                CollectorResult.error(message, now), CollectorResult.error(message, now),
                CollectorResult.error(message, now), CollectorResult.error(message, now));
    }

    public Map<CollectorSource, CollectorStatus> statuses() {
        Map<CollectorSource, CollectorStatus> statuses = new EnumMap<>(CollectorSource.class);
        statuses.put(CollectorSource.REGISTRY, registry.status());
        statuses.put(CollectorSource.REPOSITORY, repository.status());
        statuses.put(CollectorSource.SECURITY, security.status());
        statuses.put(CollectorSource.FUNDING, funding.status());
        statuses.put(CollectorSource.POPULARITY, popularity.status());
        statuses.put(CollectorSource.LICENSE, license.status());
        return statuses;
    }

    private static <T> CollectorResult<T> slot(Map<CollectorSource, CollectorResult<?>> results,
            CollectorSource source, Class<T> type, Instant now) {
        CollectorResult<?> result = results.get(source);
        if (result == null) {
            return CollectorResult.error("no collector registered for " + source.id(), now);
        }
        if (result.hasData() && !type.isInstance(result.data())) {
            return CollectorResult.error("unexpected data type from " + source.id(), now);
        }
        T data = result.hasData() ? type.cast(result.data()) : null;
        return new CollectorResult<>(result.status(), data, result.error(), result.collectedAt());
    }
}
