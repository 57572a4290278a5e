package com.deporacle.engine.scan;

import com.deporacle.engine.analysis.TrendPredictor;
import com.deporacle.engine.analysis.TrendResult;
import com.deporacle.engine.analysis.TrustScoreEngine;
import com.deporacle.engine.analysis.TrustScoreResult;
import com.deporacle.engine.analysis.TyposquatDetector;
import com.deporacle.engine.analysis.TyposquatResult;
import com.deporacle.engine.analysis.ZombieDetector;
import com.deporacle.engine.analysis.ZombieResult;
import com.deporacle.engine.blast.BlastRadiusCalculator;
import com.deporacle.engine.blast.BlastRadiusResult;
import com.deporacle.engine.blast.ImportGraph;
import com.deporacle.engine.collector.CollectedData;
import com.deporacle.engine.collector.CollectorOrchestrator;
import com.deporacle.engine.config.EngineConfig;
import com.deporacle.engine.model.Ecosystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * Produces the {@link TrustReport} of a single package: collects all signals,
 * then derives the trust score, abandonment, typosquat and trend verdicts.
 *
 * @author Naveed Gung
 */
@Service
public class PackageAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PackageAnalyzer.class);

    private final CollectorOrchestrator orchestrator;
    private final TrustScoreEngine trustScoreEngine;
    private final ZombieDetector zombieDetector;
    private final TyposquatDetector typosquatDetector;
    private final TrendPredictor trendPredictor;
    private final BlastRadiusCalculator blastRadiusCalculator;
    private final EngineConfig config;

    public PackageAnalyzer(
            CollectorOrchestrator orchestrator,
            TrustScoreEngine trustScoreEngine,
            ZombieDetector zombieDetector,
            TyposquatDetector typosquatDetector,
            TrendPredictor trendPredictor,
            BlastRadiusCalculator blastRadiusCalculator,
            EngineConfig config) {
        this.orchestrator = orchestrator;
        this.trustScoreEngine = trustScoreEngine;
        this.zombieDetector = zombieDetector;
        this.typosquatDetector = typosquatDetector;
        this.trendPredictor = trendPredictor;
        this.blastRadiusCalculator = blastRadiusCalculator;
        this.config = config;
    }

    /** Analyze one package, computing its blast radius against {@code projectDir}. */
    public Mono<TrustReport> analyze(String packageName, String version, Ecosystem ecosystem, Path projectDir) {
        Dependency dependency = new Dependency(packageName, version, true, ecosystem);
        return Mono.zip(orchestrator.collectAll(packageName, version, ecosystem),
                blastRadiusCalculator.calculate(packageName, projectDir))
                .map(t -> toReport(dependency, t.getT1(), t.getT2()));
    }

    /** Analyze one dependency of a project scan, using the scan's import graph. */
    public Mono<TrustReport> analyze(Dependency dependency, ImportGraph graph) {
        return orchestrator.collectAll(dependency.name(), dependency.version(), dependency.ecosystem())
                .map(data -> toReport(dependency, data, blastRadiusCalculator.fromGraph(dependency.name(), graph)));
    }

    TrustReport toReport(Dependency dependency, CollectedData data, BlastRadiusResult blastRadius) {
        TrustScoreResult score = trustScoreEngine.calculate(data);
        ZombieResult zombie = zombieDetector.detect(data.registry().data(), data.repository().data());
        // The reference list holds npm names only.
        TyposquatResult typosquat = dependency.ecosystem() == Ecosystem.NPM
                ? typosquatDetector.check(dependency.name())
                : TyposquatResult.safe();
        TrendResult trend = trendPredictor.predict(data.registry().data(), data.popularity().data(),
                data.repository().data());

        boolean belowThreshold = score.trustScore() < config.getMinTrustScore();
        log.info("{}@{}: trust score {}{}{}", dependency.name(), dependency.version(), score.trustScore(),
                zombie.isZombie() ? ", zombie (" + zombie.reason() + ")" : "",
                typosquat.isRisky() ? ", resembles " + typosquat.similarNames() : "");

        return new TrustReport(dependency, score, zombie, typosquat, typosquat.riskProbability(), blastRadius,
                trend, data.statuses(), belowThreshold);
    }
}
