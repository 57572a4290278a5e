package com.deporacle.engine.metrics;

import com.deporacle.engine.cache.ResultCache;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Engine-level metrics and cache maintenance.
 *
 * <p>
 * Registered here:
 * </p>
 * <ul>
 * <li>{@code oracle.cache.entries} - live entries in the result cache</li>
 * </ul>
 *
 * <p>
 * Collector outcome counters and latency timers are registered by
 * {@link com.deporacle.engine.collector.CollectorOrchestrator}; the scanned
 * package counter by {@link com.deporacle.engine.scan.ProjectScanService}.
 * Expired cache entries are purged every hour.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class EngineMetrics {

    private static final Logger log = LoggerFactory.getLogger(EngineMetrics.class);

    private final ResultCache cache;
    private final MeterRegistry meterRegistry;

    public EngineMetrics(ResultCache cache, MeterRegistry meterRegistry) {
        this.cache = cache;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("oracle.cache.entries", cache, ResultCache::size)
                .description("Live entries in the result cache")
                .register(meterRegistry);
        log.info("Engine metrics registered");
    }

    @Scheduled(fixedRate = 3_600_000, initialDelay = 3_600_000)
    public void purgeExpiredEntries() {
        log.debug("Purging expired cache entries");
        try {
            int removed = cache.cleanup();
            if (removed > 0) {
                log.info("Removed {} expired cache entries", removed);
            }
        } catch (Exception e) {
            log.error("Cache cleanup failed: {}", e.getMessage(), e);
        }
    }
}
