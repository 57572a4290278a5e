package com.deporacle.engine.collector;

import com.deporacle.engine.model.Ecosystem;
import reactor.core.publisher.Mono;

/**
 * One signal source. Implementations never signal an error: every failure
 * is delivered as a {@link CollectorResult} with status ERROR.
 *
 * @param <T> normalized data shape
 *
 * @author Naveed Gung
 */
public interface Collector<T> {

    CollectorSource source();

    Class<T> dataType();

    Mono<CollectorResult<T>> collect(String packageName, String version, Ecosystem ecosystem);

    default Mono<CollectorResult<T>> collect(String packageName, String version) {
        return collect(packageName, version, Ecosystem.NPM);
    }
}
