package com.deporacle.engine.upstream;

import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.ratelimit.Upstream;
import com.deporacle.engine.ratelimit.UpstreamRateLimiters;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * OpenCollective public profile lookup ({@code opencollective.com/<slug>.json}).
 *
 * @author Naveed Gung
 */
@Component
public class OpenCollectiveClient extends UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(OpenCollectiveClient.class);

    public OpenCollectiveClient(UpstreamConfig upstreamConfig, UpstreamRateLimiters limiters,
            ObjectMapper objectMapper) {
        super(upstreamConfig.getOpenCollective(), limiters.get(Upstream.OPEN_COLLECTIVE), objectMapper);
    }

    /** Collective profile, or empty when no collective exists under that slug. */
    public Mono<JsonNode> fetchProfile(String slug) {
        log.debug("Fetching OpenCollective profile {}", slug);
        return getJson("/{slug}.json", slug)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }

    /** Collective slug guessed from a package name: the scope is dropped. */
    public static String slugFor(String packageName) {
        return packageName.replaceFirst("^@[^/]+/", "");
    }
}
