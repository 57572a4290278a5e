package com.deporacle.engine.collector;

import com.deporacle.engine.model.Ecosystem;
import reactor.core.publisher.Mono;

import java.util.function.Function;
import java.util.function.Supplier;

/** Collector whose behaviour is supplied by the test. */
public final class StubCollector<T> implements Collector<T> {

    private final CollectorSource source;
    private final Class<T> type;
    private final Function<String, Mono<CollectorResult<T>>> behaviour;

    public StubCollector(CollectorSource source, Class<T> type, Function<String, Mono<CollectorResult<T>>> behaviour) {
        this.source = source;
        this.type = type;
        this.behaviour = behaviour;
    }

    public static <T> StubCollector<T> of(CollectorSource source, Class<T> type,
            Supplier<Mono<CollectorResult<T>>> behaviour) {
        return new StubCollector<>(source, type, name -> behaviour.get());
    }

    @Override
    public CollectorSource source() {
        return source;
    }

    @Override
    public Class<T> dataType() {
        return type;
    }

    @Override
    public Mono<CollectorResult<T>> collect(String packageName, String version, Ecosystem ecosystem) {
        return behaviour.apply(packageName);
    }
}
