package com.deporacle.engine.ratelimit;

import com.deporacle.engine.config.UpstreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.util.EnumMap;
import java.util.Map;

/**
 * One {@link RateLimiter} per upstream host, shared by every collector and
 * every concurrent package analysis in the process.
 *
 * @author Naveed Gung
 */
public class UpstreamRateLimiters {

    private static final Logger log = LoggerFactory.getLogger(UpstreamRateLimiters.class);

    private final Map<Upstream, RateLimiter> limiters = new EnumMap<>(Upstream.class);

    public UpstreamRateLimiters(UpstreamConfig config, Scheduler scheduler) {
        register(Upstream.NPM_REGISTRY, config.getNpmRegistry(), scheduler);
        register(Upstream.NPM_DOWNLOADS, config.getNpmDownloads(), scheduler);
        register(Upstream.PYPI, config.getPypi(), scheduler);
        register(Upstream.PYPI_STATS, config.getPypiStats(), scheduler);
        register(Upstream.GITHUB, config.getGithub(), scheduler);
        register(Upstream.OSV, config.getOsv(), scheduler);
        register(Upstream.OPEN_COLLECTIVE, config.getOpenCollective(), scheduler);
    }

    public RateLimiter get(Upstream upstream) {
        return limiters.get(upstream);
    }

    private void register(Upstream upstream, UpstreamConfig.Endpoint endpoint, Scheduler scheduler) {
        limiters.put(upstream, new RateLimiter(
                upstream.name(), endpoint.getRateLimit(), endpoint.getRateWindowMs(), scheduler));
        log.debug("Rate limiter {}: {} requests per {} ms",
                upstream, endpoint.getRateLimit(), endpoint.getRateWindowMs());
    }
}
