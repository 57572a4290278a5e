package com.deporacle.engine.scan;

import com.deporacle.engine.blast.ImportGraphBuilder;
import com.deporacle.engine.collector.AbstractCachingCollector;
import com.deporacle.engine.config.EngineConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scans a whole project: resolves its dependencies, builds the import graph
 * once, analyzes each dependency with bounded concurrency and aggregates the
 * reports.
 *
 * <p>
 * Only direct dependencies are analyzed unless
 * {@code oracle.engine.include-transitive} is set. Names listed in
 * {@code oracle.engine.ignore} are skipped. A package whose analysis fails
 * gets a fallback report with score 0; the scan itself never fails for one
 * package.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class ProjectScanService {

    private static final Logger log = LoggerFactory.getLogger(ProjectScanService.class);

    private static final int CRITICAL_SCORE = 30;

    private final ObjectProvider<DependencySource> dependencySources;
    private final PackageAnalyzer analyzer;
    private final ImportGraphBuilder importGraphBuilder;
    private final EngineConfig config;
    private final Counter scannedPackages;

    public ProjectScanService(
            ObjectProvider<DependencySource> dependencySources,
            PackageAnalyzer analyzer,
            ImportGraphBuilder importGraphBuilder,
            EngineConfig config,
            MeterRegistry meterRegistry) {
        this.dependencySources = dependencySources;
        this.analyzer = analyzer;
        this.importGraphBuilder = importGraphBuilder;
        this.config = config;
        this.scannedPackages = Counter.builder("oracle.scan.packages")
                .description("Packages analyzed by project scans")
                .register(meterRegistry);
    }

    /** Scan using the first registered {@link DependencySource} that recognizes the project. */
    public Mono<ScanResult> scan(Path projectDir) {
        return Mono.fromCallable(() -> resolve(projectDir))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(deps -> deps.map(d -> analyzeAll(projectDir, d))
                        .orElseGet(() -> {
                            log.warn("No supported project format found in {}", projectDir);
                            return Mono.just(ScanResult.nothingToScan(projectDir));
                        }));
    }

    /** Scan with an explicit dependency source. */
    public Mono<ScanResult> scan(Path projectDir, DependencySource source) {
        return Mono.fromCallable(() -> source.resolve(projectDir))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(deps -> deps.map(d -> analyzeAll(projectDir, d))
                        .orElseGet(() -> Mono.just(ScanResult.nothingToScan(projectDir))));
    }

    private Optional<List<Dependency>> resolve(Path projectDir) {
        for (DependencySource source : dependencySources.orderedStream().toList()) {
            Optional<List<Dependency>> deps = source.resolve(projectDir);
            if (deps.isPresent()) {
                log.info("{} recognized {}", source.getClass().getSimpleName(), projectDir);
                return deps;
            }
        }
        return Optional.empty();
    }

    private Mono<ScanResult> analyzeAll(Path projectDir, List<Dependency> dependencies) {
        Set<String> ignored = new HashSet<>(config.getIgnore());
        List<Dependency> toScan = dependencies.stream()
                .filter(d -> d.isDirect() || config.isIncludeTransitive())
                .filter(d -> !ignored.contains(d.name()))
                .toList();
        long direct = dependencies.stream().filter(Dependency::isDirect).count();
        log.info("Found {} direct + {} transitive dependencies in {}, scanning {}",
                direct, dependencies.size() - direct, projectDir, toScan.size());

        if (toScan.isEmpty()) {
            return Mono.just(new ScanResult(ScanResult.Status.COMPLETED, projectDir, List.of(), 100,
                    "No dependencies to scan (all ignored or none found)."));
        }

        return importGraphBuilder.build(projectDir)
                .flatMap(graph -> Flux.fromIterable(toScan)
                        .flatMap(dep -> analyzer.analyze(dep, graph)
                                .onErrorResume(e -> {
                                    log.error("Failed to analyze {}@{}: {}", dep.name(), dep.version(),
                                            e.getMessage(), e);
                                    return Mono.just(TrustReport.fallback(dep,
                                            AbstractCachingCollector.describe(e)));
                                })
                                .doOnNext(r -> scannedPackages.increment()),
                                config.getPackageConcurrency())
                        .collectList())
                .map(reports -> {
                    List<TrustReport> sorted = new ArrayList<>(reports);
                    sorted.sort(Comparator.comparingInt(TrustReport::trustScore));
                    int overall = overallScore(sorted);
                    return new ScanResult(ScanResult.Status.COMPLETED, projectDir, sorted, overall,
                            summary(sorted, overall, config.getMinTrustScore()));
                });
    }

    static int overallScore(List<TrustReport> reports) {
        if (reports.isEmpty()) {
            return 100;
        }
        double total = reports.stream().mapToInt(TrustReport::trustScore).sum();
        return (int) Math.round(total / reports.size());
    }

    static String summary(List<TrustReport> reports, int overallScore, int minScore) {
        int total = reports.size();
        long critical = reports.stream().filter(r -> r.trustScore() < CRITICAL_SCORE).count();
        long warnings = reports.stream()
                .filter(r -> r.trustScore() >= CRITICAL_SCORE && r.trustScore() < minScore).count();
        long safe = reports.stream().filter(r -> r.trustScore() >= minScore).count();
        long zombies = reports.stream().filter(r -> r.zombie().isZombie()).count();
        long typosquats = reports.stream().filter(r -> r.typosquatRisk() > 0.5).count();

        List<String> parts = new ArrayList<>();
        parts.add("Scanned " + total + " dependencies. Overall trust score: " + overallScore + "/100.");
        if (critical > 0) {
            parts.add(critical + " critical (score < " + CRITICAL_SCORE + ").");
        }
        if (warnings > 0) {
            parts.add(warnings + " below threshold (score < " + minScore + ").");
        }
        if (zombies > 0) {
            parts.add(zombies + " zombie dependencies detected.");
        }
        if (typosquats > 0) {
            parts.add(typosquats + " potential typosquatting risks.");
        }
        if (safe == total) {
            parts.add("All dependencies are above the trust threshold.");
        }
        return String.join(" ", parts);
    }
}
