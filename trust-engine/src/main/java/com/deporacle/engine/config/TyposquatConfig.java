package com.deporacle.engine.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Typosquat detection settings.
 *
 * <p>
 * The suffix list drives the suffix/prefix-addition heuristic and can be
 * extended without touching the detector.
 * </p>
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "oracle.typosquat")
public class TyposquatConfig {

    private List<String> suffixes = new ArrayList<>(
            List.of("-js", "-node", "-lib", "-pkg", "-core", "js", "-new"));
    private String referenceResource = "typosquat/popular-packages.txt";
    private boolean fetchPopular = false;
    @Min(250)
    private int popularCount = 5000;
    @Min(60)
    private long popularTtlSeconds = 7 * 24 * 3600L;
    @Min(0)
    private long pageDelayMs = 500;

    public List<String> getSuffixes() {
        return suffixes;
    }

    public void setSuffixes(List<String> suffixes) {
        this.suffixes = suffixes;
    }

    public String getReferenceResource() {
        return referenceResource;
    }

    public void setReferenceResource(String referenceResource) {
        this.referenceResource = referenceResource;
    }

    public boolean isFetchPopular() {
        return fetchPopular;
    }

    public void setFetchPopular(boolean fetchPopular) {
        this.fetchPopular = fetchPopular;
    }

    public int getPopularCount() {
        return popularCount;
    }

    public void setPopularCount(int popularCount) {
        this.popularCount = popularCount;
    }

    public long getPopularTtlSeconds() {
        return popularTtlSeconds;
    }

    public void setPopularTtlSeconds(long popularTtlSeconds) {
        this.popularTtlSeconds = popularTtlSeconds;
    }

    public long getPageDelayMs() {
        return pageDelayMs;
    }

    public void setPageDelayMs(long pageDelayMs) {
        this.pageDelayMs = pageDelayMs;
    }
}
