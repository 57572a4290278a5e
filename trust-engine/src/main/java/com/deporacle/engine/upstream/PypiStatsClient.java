package com.deporacle.engine.upstream;

import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.ratelimit.Upstream;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * pypistats.org client for recent download counts.
 *
 * @author Naveed Gung
 */
@Component
public class PypiStatsClient extends UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(PypiStatsClient.class);

    public PypiStatsClient(UpstreamConfig upstreamConfig, UpstreamRateLimiters limiters, ObjectMapper objectMapper) {
        super(upstreamConfig.getPypiStats(), limiters.get(Upstream.PYPI_STATS), objectMapper);
    }

    /**
     * Recent downloads, as the {@code data} object holding {@code last_day},
     * {@code last_week} and {@code last_month}.
     */
    public Mono<JsonNode> fetchRecent(String packageName) {
        log.debug("Fetching PyPI download stats for {}", packageName);
        return getJson("/packages/{name}/recent", packageName).map(body -> body.path("data"));
    }
}
