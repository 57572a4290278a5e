package com.deporacle.engine.upstream;

import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.ratelimit.Upstream;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * PyPI JSON API client.
 *
 * @author Naveed Gung
 */
@Component
public class PypiClient extends UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(PypiClient.class);

    public PypiClient(UpstreamConfig upstreamConfig, UpstreamRateLimiters limiters, ObjectMapper objectMapper) {
        super(upstreamConfig.getPypi(), limiters.get(Upstream.PYPI), objectMapper);
    }

    /** Project metadata; an unknown project is reported as an {@link UpstreamException}. */
    public Mono<PypiProject> fetchProject(String packageName) {
        log.debug("Fetching PyPI project {}", packageName);
        return getJson("/{name}/json", packageName)
                .onErrorMap(WebClientResponseException.NotFound.class,
                        e -> new UpstreamException("PyPI registry returned no data for " + packageName, e))
                .map(PypiProject::new);
    }
}
