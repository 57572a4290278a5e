package com.deporacle.engine.collector;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.model.DownloadTrend;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.PopularityData;
import com.deporacle.engine.upstream.NpmDownloadsClient;
import com.deporacle.engine.upstream.PypiStatsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Download popularity and its short-term direction.
 *
 * <p>
 * The trend compares last week's downloads to the weekly average of the last
 * month: more than 10% above is rising, more than 10% below is declining.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class PopularityCollector extends AbstractCachingCollector<PopularityData> {

    private static final Logger log = LoggerFactory.getLogger(PopularityCollector.class);

    private final NpmDownloadsClient npmDownloadsClient;
    private final PypiStatsClient pypiStatsClient;

    public PopularityCollector(NpmDownloadsClient npmDownloadsClient, PypiStatsClient pypiStatsClient,
            ResultCache cache, Clock clock) {
        super(cache, clock, PopularityData.class);
        this.npmDownloadsClient = npmDownloadsClient;
        this.pypiStatsClient = pypiStatsClient;
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.POPULARITY;
    }

    @Override
    protected Mono<PopularityData> fetch(String packageName, String version, Ecosystem ecosystem) {
        return switch (ecosystem) {
            case NPM -> {
                Mono<Long> monthly = npmDownloadsClient.fetchDownloads(packageName, NpmDownloadsClient.LAST_MONTH)
                        .onErrorResume(e -> {
                            log.warn("Monthly downloads unavailable for {}: {}", packageName, e.getMessage());
                            return Mono.just(0L);
                        });
                yield Mono.zip(npmDownloadsClient.fetchDownloads(packageName, NpmDownloadsClient.LAST_WEEK), monthly)
                        .map(t -> toPopularityData(packageName, t.getT1(), t.getT2()));
            }
            case PYPI -> pypiStatsClient.fetchRecent(packageName)
                    .map(data -> toPopularityData(packageName,
                            data.path("last_week").asLong(0), data.path("last_month").asLong(0)));
        };
    }

    static PopularityData toPopularityData(String packageName, long weekly, long monthly) {
        return new PopularityData(packageName, weekly, monthly, trendOf(weekly, monthly));
    }

    static DownloadTrend trendOf(long weekly, long monthly) {
        double weeklyAverage = monthly / 4.0;
        if (weeklyAverage <= 0) {
            return DownloadTrend.STABLE;
        }
        double ratio = weekly / weeklyAverage;
        if (ratio > 1.1) {
            return DownloadTrend.RISING;
        }
        if (ratio < 0.9) {
            return DownloadTrend.DECLINING;
        }
        return DownloadTrend.STABLE;
    }
}
