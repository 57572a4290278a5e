package com.deporacle.engine.upstream;

import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.ratelimit.Upstream;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * npm download-counts API ({@code api.npmjs.org/downloads}).
 *
 * @author Naveed Gung
 */
@Component
public class NpmDownloadsClient extends UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(NpmDownloadsClient.class);

    public static final String LAST_WEEK = "last-week";
    public static final String LAST_MONTH = "last-month";

    public NpmDownloadsClient(UpstreamConfig upstreamConfig, UpstreamRateLimiters limiters, ObjectMapper objectMapper) {
        super(upstreamConfig.getNpmDownloads(), limiters.get(Upstream.NPM_DOWNLOADS), objectMapper);
    }

    /**
     * Total downloads over a named period.
     *
     * @param period {@link #LAST_WEEK} or {@link #LAST_MONTH}
     */
    public Mono<Long> fetchDownloads(String packageName, String period) {
        log.debug("Fetching {} downloads for {}", period, packageName);
        return getJson("/point/{period}/{name}", period, packageName)
                .map(body -> body.path("downloads").asLong(0));
    }
}
