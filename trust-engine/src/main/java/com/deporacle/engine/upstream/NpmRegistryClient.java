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
 * npm registry client.
 *
 * @see <a href="https://github.com/npm/registry/blob/main/docs/REGISTRY-API.md">npm registry API</a>
 *
 * @author Naveed Gung
 */
@Component
public class NpmRegistryClient extends UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(NpmRegistryClient.class);

    public NpmRegistryClient(UpstreamConfig upstreamConfig, UpstreamRateLimiters limiters, ObjectMapper objectMapper) {
        super(upstreamConfig.getNpmRegistry(), limiters.get(Upstream.NPM_REGISTRY), objectMapper);
    }

    /** Fetch the full packument. Scoped names go out as {@code /@scope/name}, which the registry accepts. */
    public Mono<NpmPackument> fetchPackument(String packageName) {
        log.debug("Fetching packument for {}", packageName);
        return getJson("/{name}", packageName).map(NpmPackument::new);
    }

    /**
     * Search endpoint ordered purely by popularity.
     *
     * @param size page size, at most 250
     * @param from offset of the first result
     */
    public Mono<JsonNode> searchByPopularity(int size, int from) {
        return limiter.acquire()
                .then(webClient.get()
                        .uri(b -> b.path("/-/v1/search")
                                .queryParam("text", "boost-exact:false")
                                .queryParam("popularity", "1.0")
                                .queryParam("quality", "0.0")
                                .queryParam("maintenance", "0.0")
                                .queryParam("size", size)
                                .queryParam("from", from)
                                .build())
                        .retrieve()
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .timeout(timeout))
                .map(this::readTree);
    }
}
