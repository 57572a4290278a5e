package com.deporacle.engine.upstream;

import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.ratelimit.Upstream;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * OSV vulnerability database client.
 *
 * @see <a href="https://google.github.io/osv.dev/post-v1-query/">OSV query API</a>
 *
 * @author Naveed Gung
 */
@Component
public class OsvClient extends UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(OsvClient.class);

    public OsvClient(UpstreamConfig upstreamConfig, UpstreamRateLimiters limiters, ObjectMapper objectMapper) {
        super(upstreamConfig.getOsv(), limiters.get(Upstream.OSV), objectMapper);
    }

    /**
     * Query advisories for a package.
     *
     * @param version concrete version to narrow the query to, or null for all advisories
     * @return the {@code vulns} array, empty when there are none
     */
    public Mono<JsonNode> query(String packageName, String version, Ecosystem ecosystem) {
        ObjectNode request = objectMapper.createObjectNode();
        ObjectNode pkg = request.putObject("package");
        pkg.put("name", packageName);
        pkg.put("ecosystem", ecosystem.osvName());
        if (version != null) {
            request.put("version", version);
        }
        log.debug("OSV query: {}", request);

        return limiter.acquire()
                .then(webClient.post()
                        .uri("/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(request.toString())
                        .retrieve()
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .timeout(timeout))
                .map(this::readTree)
                .map(body -> body.path("vulns"));
    }
}
