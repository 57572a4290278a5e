package com.deporacle.engine.blast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Scans a project once and records which files import which packages.
 *
 * @author Naveed Gung
 */
@Component
public class ImportGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ImportGraphBuilder.class);

    static final int BATCH_SIZE = 50;

    private record FileImports(String path, Set<String> packages) {
    }

    public Mono<ImportGraph> build(Path projectDir) {
        return Mono.fromCallable(() -> SourceFileWalker.walk(projectDir))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(files -> {
                    if (files.isEmpty()) {
                        return Mono.just(ImportGraph.empty());
                    }
                    return Flux.fromIterable(files)
                            .buffer(BATCH_SIZE)
                            .concatMap(batch -> Flux.fromIterable(batch)
                                    .flatMap(file -> read(projectDir, file)))
                            .collectList()
                            .map(imports -> toGraph(imports, files.size()));
                })
                .doOnNext(graph -> log.info("Import graph for {}: {} packages across {} files",
                        projectDir, graph.asMap().size(), graph.totalFiles()));
    }

    private Mono<FileImports> read(Path root, Path file) {
        return Mono.fromCallable(() -> {
            String content = SourceFileWalker.read(file);
            Set<String> packages = SourceFileWalker.isPython(file)
                    ? ImportSpecifiers.extractPython(content)
                    : ImportSpecifiers.extractScript(content);
            return new FileImports(SourceFileWalker.relative(root, file), packages);
        })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(IOException.class, e -> {
                    log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                    return Mono.empty();
                });
    }

    private static ImportGraph toGraph(List<FileImports> imports, int totalFiles) {
        Map<String, SortedSet<String>> importers = new HashMap<>();
        for (FileImports fileImports : imports) {
            for (String pkg : fileImports.packages()) {
                importers.computeIfAbsent(pkg, k -> new TreeSet<>()).add(fileImports.path());
            }
        }
        return new ImportGraph(importers, totalFiles);
    }
}
