package com.deporacle.engine.collector;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one collector invocation.
 *
 * <p>
 * {@code data} is present exactly when the status is {@link CollectorStatus#SUCCESS}
 * or {@link CollectorStatus#CACHED}; the constructor rejects any other
 * combination.
 * </p>
 *
 * @param status      outcome
 * @param data        normalized source data, null for ERROR and OFFLINE
 * @param error       failure description, null on success
 * @param collectedAt when the data was fetched (for CACHED: when it was cached)
 * @param <T>         source-specific data shape
 *
 * @author Naveed Gung
 */
public record CollectorResult<T>(CollectorStatus status, T data, String error, Instant collectedAt) {

    public CollectorResult {
        Objects.requireNonNull(status, "status");
        boolean carriesData = status == CollectorStatus.SUCCESS || status == CollectorStatus.CACHED;
        if (carriesData != (data != null)) {
            throw new IllegalArgumentException("Collector result " + status
                    + (carriesData ? " requires data" : " must not carry data"));
        }
    }

    public static <T> CollectorResult<T> success(T data, Instant collectedAt) {
        return new CollectorResult<>(CollectorStatus.SUCCESS, data, null, collectedAt);
    }

    public static <T> CollectorResult<T> cached(T data, Instant cachedAt) {
        return new CollectorResult<>(CollectorStatus.CACHED, data, null, cachedAt);
    }

    public static <T> CollectorResult<T> error(String message, Instant at) {
        return new CollectorResult<>(CollectorStatus.ERROR, null, message, at);
    }

    public static <T> CollectorResult<T> offline(Instant at) {
        return new CollectorResult<>(CollectorStatus.OFFLINE, null, "offline mode: no cached data", at);
    }

    public boolean hasData() {
        return data != null;
    }

    public Optional<T> dataOptional() {
        return Optional.ofNullable(data);
    }
}
