package com.deporacle.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Core engine settings: cache, collector fan-out, scoring and scan behaviour.
 *
 * <p>
 * The GitHub token is read from the {@code GITHUB_TOKEN} environment variable
 * by default. Without it the repository collector still works against the
 * anonymous rate limit.
 * </p>
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "oracle.engine")
public class EngineConfig {

    @NotBlank
    private String cachePath = System.getProperty("user.home") + "/.dep-oracle/cache.json";
    @Min(1)
    private long cacheTtlSeconds = 86_400;
    @Min(1)
    @Max(20)
    private int concurrency = 6;
    @Min(100)
    private long collectorTimeoutMs = 30_000;
    private boolean offline = false;
    private String githubToken = "";
    @Min(0)
    @Max(100)
    private int minTrustScore = 50;
    @Min(1)
    @Max(32)
    private int packageConcurrency = 4;
    private boolean includeTransitive = false;
    private List<String> ignore = new ArrayList<>();
    @Valid
    private Weights weights = new Weights();

    public String getCachePath() {
        return cachePath;
    }

    public void setCachePath(String cachePath) {
        this.cachePath = cachePath;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public long getCollectorTimeoutMs() {
        return collectorTimeoutMs;
    }

    public void setCollectorTimeoutMs(long collectorTimeoutMs) {
        this.collectorTimeoutMs = collectorTimeoutMs;
    }

    public boolean isOffline() {
        return offline;
    }

    public void setOffline(boolean offline) {
        this.offline = offline;
    }

    public String getGithubToken() {
        return githubToken;
    }

    public void setGithubToken(String githubToken) {
        this.githubToken = githubToken;
    }

    public int getMinTrustScore() {
        return minTrustScore;
    }

    public void setMinTrustScore(int minTrustScore) {
        this.minTrustScore = minTrustScore;
    }

    public int getPackageConcurrency() {
        return packageConcurrency;
    }

    public void setPackageConcurrency(int packageConcurrency) {
        this.packageConcurrency = packageConcurrency;
    }

    public boolean isIncludeTransitive() {
        return includeTransitive;
    }

    public void setIncludeTransitive(boolean includeTransitive) {
        this.includeTransitive = includeTransitive;
    }

    public List<String> getIgnore() {
        return ignore;
    }

    public void setIgnore(List<String> ignore) {
        this.ignore = ignore;
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights;
    }

    /**
     * Per-dimension weight overrides. Summation to 1.0 is checked when the
     * scoring engine is constructed, not here.
     */
    public static class Weights {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double security = 0.25;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maintainer = 0.25;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double activity = 0.20;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double popularity = 0.15;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double funding = 0.10;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double license = 0.05;

        public double getSecurity() {
            return security;
        }

        public void setSecurity(double security) {
            this.security = security;
        }

        public double getMaintainer() {
            return maintainer;
        }

        public void setMaintainer(double maintainer) {
            this.maintainer = maintainer;
        }

        public double getActivity() {
            return activity;
        }

        public void setActivity(double activity) {
            this.activity = activity;
        }

        public double getPopularity() {
            return popularity;
        }

        public void setPopularity(double popularity) {
            this.popularity = popularity;
        }

        public double getFunding() {
            return funding;
        }

        public void setFunding(double funding) {
            this.funding = funding;
        }

        public double getLicense() {
            return license;
        }

        public void setLicense(double license) {
            this.license = license;
        }
    }
}
