package com.deporacle.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for every upstream API the collectors talk to.
 *
 * <p>
 * Each endpoint carries its own request ceiling. The ceilings are enforced
 * per host by {@link com.deporacle.engine.ratelimit.UpstreamRateLimiters}, so
 * every analysis running in the process draws from the same budget.
 * </p>
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "oracle.upstream")
public class UpstreamConfig {

    @Valid
    private Endpoint npmRegistry = new Endpoint("https://registry.npmjs.org", 300, 60_000);
    @Valid
    private Endpoint npmDownloads = new Endpoint("https://api.npmjs.org/downloads", 300, 60_000);
    @Valid
    private Endpoint pypi = new Endpoint("https://pypi.org/pypi", 100, 60_000);
    @Valid
    private Endpoint pypiStats = new Endpoint("https://pypistats.org/api", 30, 60_000);
    @Valid
    private Endpoint github = new Endpoint("https://api.github.com", 5000, 3_600_000);
    @Valid
    private Endpoint osv = new Endpoint("https://api.osv.dev/v1", 300, 60_000);
    @Valid
    private Endpoint openCollective = new Endpoint("https://opencollective.com", 60, 60_000);

    public Endpoint getNpmRegistry() {
        return npmRegistry;
    }

    public void setNpmRegistry(Endpoint npmRegistry) {
        this.npmRegistry = npmRegistry;
    }

    public Endpoint getNpmDownloads() {
        return npmDownloads;
    }

    public void setNpmDownloads(Endpoint npmDownloads) {
        this.npmDownloads = npmDownloads;
    }

    public Endpoint getPypi() {
        return pypi;
    }

    public void setPypi(Endpoint pypi) {
        this.pypi = pypi;
    }

    public Endpoint getPypiStats() {
        return pypiStats;
    }

    public void setPypiStats(Endpoint pypiStats) {
        this.pypiStats = pypiStats;
    }

    public Endpoint getGithub() {
        return github;
    }

    public void setGithub(Endpoint github) {
        this.github = github;
    }

    public Endpoint getOsv() {
        return osv;
    }

    public void setOsv(Endpoint osv) {
        this.osv = osv;
    }

    public Endpoint getOpenCollective() {
        return openCollective;
    }

    public void setOpenCollective(Endpoint openCollective) {
        this.openCollective = openCollective;
    }

    /** A single upstream host. */
    public static class Endpoint {
        @NotBlank
        private String baseUrl;
        @Min(100)
        private int timeoutMs = 10_000;
        @Min(1)
        private int rateLimit;
        @Min(1)
        private long rateWindowMs;

        public Endpoint() {
        }

        public Endpoint(String baseUrl, int rateLimit, long rateWindowMs) {
            this.baseUrl = baseUrl;
            this.rateLimit = rateLimit;
            this.rateWindowMs = rateWindowMs;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(int rateLimit) {
            this.rateLimit = rateLimit;
        }

        public long getRateWindowMs() {
            return rateWindowMs;
        }

        public void setRateWindowMs(long rateWindowMs) {
            this.rateWindowMs = rateWindowMs;
        }
    }
}
