package com.deporacle.engine.blast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Counts the source files of a project that import a given package.
 *
 * <p>
 * Matches static, bare, dynamic and CommonJS imports including sub-paths
 * ({@code lodash/fp}) but not names that merely share a prefix
 * ({@code chalk} does not match {@code chalk-animation}). Python files go
 * through the same module extraction as {@link ImportGraphBuilder}, so both
 * paths count the same files. Compiled patterns are kept per package name.
 * Files are decoded as UTF-8 with malformed bytes replaced.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class BlastRadiusCalculator {

    private static final Logger log = LoggerFactory.getLogger(BlastRadiusCalculator.class);

    private final Map<String, Pattern> scriptPatterns = new ConcurrentHashMap<>();

    public Mono<BlastRadiusResult> calculate(String packageName, Path projectDir) {
        return Mono.fromCallable(() -> SourceFileWalker.walk(projectDir))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(files -> {
                    if (files.isEmpty()) {
                        return Mono.just(BlastRadiusResult.empty());
                    }
                    Pattern pattern = scriptPatterns.computeIfAbsent(packageName, BlastRadiusCalculator::scriptPattern);
                    String module = ImportSpecifiers.pythonModuleOf(packageName);
                    Predicate<String> script = content -> pattern.matcher(content).find();
                    Predicate<String> python = content -> importsPython(content, module);
                    return Flux.fromIterable(files)
                            .buffer(ImportGraphBuilder.BATCH_SIZE)
                            .concatMap(batch -> Flux.fromIterable(batch)
                                    .flatMap(file -> matches(file, SourceFileWalker.isPython(file) ? python : script)
                                            .filter(Boolean::booleanValue)
                                            .map(hit -> SourceFileWalker.relative(projectDir, file))))
                            .collectList()
                            .map(affected -> BlastRadiusResult.of(affected, files.size()));
                })
                .doOnNext(r -> log.debug("Blast radius of {}: {} files ({}%)",
                        packageName, r.affectedFileCount(), r.percentage()))
                .onErrorResume(e -> {
                    log.warn("Blast radius scan of {} failed: {}", projectDir, e.getMessage());
                    return Mono.just(BlastRadiusResult.empty());
                });
    }

    /** Blast radius from an import graph built earlier in the same scan. */
    public BlastRadiusResult fromGraph(String packageName, ImportGraph graph) {
        return graph.blastRadius(packageName);
    }

    private Mono<Boolean> matches(Path file, Predicate<String> imports) {
        return Mono.fromCallable(() -> imports.test(SourceFileWalker.read(file)))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(IOException.class, e -> Mono.just(false));
    }

    static Pattern scriptPattern(String packageName) {
        String pkg = Pattern.quote(packageName) + "(?:/[^'\"]*)?";
        String quoted = "['\"]" + pkg + "['\"]";
        return Pattern.compile(String.join("|",
                "from\\s+" + quoted,
                "import\\s+" + quoted,
                "require\\s*\\(\\s*" + quoted + "\\s*\\)",
                "import\\s*\\(\\s*" + quoted + "\\s*\\)"));
    }

    static boolean importsPython(String content, String module) {
        return ImportSpecifiers.extractPython(content).contains(module);
    }
}
