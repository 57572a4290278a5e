package com.deporacle.engine.upstream;

import com.deporacle.engine.config.UpstreamConfig;
import com.deporacle.engine.ratelimit.RateLimiter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared plumbing for the upstream HTTP clients: one {@link WebClient} per
 * host, the host's rate limiter and a per-request timeout.
 *
 * <p>
 * Every request acquires a token from the host's limiter before it is sent.
 * </p>
 *
 * @author Naveed Gung
 */
abstract class UpstreamClient {

    protected final WebClient webClient;
    protected final RateLimiter limiter;
    protected final Duration timeout;
    protected final ObjectMapper objectMapper;

    protected UpstreamClient(UpstreamConfig.Endpoint endpoint, RateLimiter limiter, ObjectMapper objectMapper) {
        this.webClient = WebClient.builder()
                .baseUrl(endpoint.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.USER_AGENT, "dep-oracle-trust-engine")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .build();
        this.limiter = limiter;
        this.timeout = Duration.ofMillis(endpoint.getTimeoutMs());
        this.objectMapper = objectMapper;
    }

    /** Rate-limited GET returning the parsed JSON body; an empty body parses to a missing node. */
    protected Mono<JsonNode> getJson(String uriTemplate, Object... uriVariables) {
        return limiter.acquire()
                .then(webClient.get()
                        .uri(uriTemplate, uriVariables)
                        .retrieve()
                        .bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .timeout(timeout))
                .map(this::readTree);
    }

    protected JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Malformed JSON from " + getClass().getSimpleName(), e);
        }
    }
}
