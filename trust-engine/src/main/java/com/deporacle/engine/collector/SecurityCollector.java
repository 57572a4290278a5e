package com.deporacle.engine.collector;

import com.deporacle.engine.cache.ResultCache;
import com.deporacle.engine.model.Ecosystem;
import com.deporacle.engine.model.SecurityData;
import com.deporacle.engine.model.VulnerabilityEntry;
import com.deporacle.engine.model.VulnerabilitySeverity;
import com.deporacle.engine.upstream.JsonValues;
import com.deporacle.engine.upstream.OsvClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Known vulnerabilities from OSV.
 *
 * <p>
 * Severity is a heuristic: the first numeric CVSS base score wins, otherwise
 * the advisory database's own label. Patch speed is approximated by the gap
 * between an advisory's publication and its last modification.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class SecurityCollector extends AbstractCachingCollector<SecurityData> {

    private static final Pattern CONCRETE_VERSION = Pattern.compile("^v?\\d+(\\.\\d+)*([.+-][0-9A-Za-z.+-]+)?$");
    private static final double MAX_PATCH_DAYS = 3650;

    private final OsvClient osvClient;

    public SecurityCollector(OsvClient osvClient, ResultCache cache, Clock clock) {
        super(cache, clock, SecurityData.class);
        this.osvClient = osvClient;
    }

    @Override
    public CollectorSource source() {
        return CollectorSource.SECURITY;
    }

    @Override
    protected Mono<SecurityData> fetch(String packageName, String version, Ecosystem ecosystem) {
        String queryVersion = isConcrete(version) ? version.replaceFirst("^v", "") : null;
        return osvClient.query(packageName, queryVersion, ecosystem)
                .map(vulns -> summarize(packageName, version, vulns));
    }

    static boolean isConcrete(String version) {
        return version != null && CONCRETE_VERSION.matcher(version).matches();
    }

    static SecurityData summarize(String packageName, String version, JsonNode vulns) {
        Map<VulnerabilitySeverity, Integer> counts = new EnumMap<>(VulnerabilitySeverity.class);
        for (VulnerabilitySeverity s : VulnerabilitySeverity.values()) {
            counts.put(s, 0);
        }
        List<VulnerabilityEntry> entries = new ArrayList<>();
        Instant latest = null;
        double patchDaysTotal = 0;
        int patchSamples = 0;

        for (JsonNode vuln : vulns) {
            VulnerabilitySeverity severity = severityOf(vuln);
            counts.merge(severity, 1, Integer::sum);

            Instant published = JsonValues.instantOrNull(vuln.path("published"));
            Instant modified = JsonValues.instantOrNull(vuln.path("modified"));
            Instant disclosed = published != null ? published : modified;
            if (disclosed != null && (latest == null || disclosed.isAfter(latest))) {
                latest = disclosed;
            }
            if (published != null && modified != null && modified.isAfter(published)) {
                double days = Duration.between(published, modified).toMillis() / 86_400_000.0;
                if (days > 0 && days < MAX_PATCH_DAYS) {
                    patchDaysTotal += days;
                    patchSamples++;
                }
            }

            String summary = vuln.path("summary").isTextual() ? vuln.path("summary").asText() : null;
            entries.add(new VulnerabilityEntry(vuln.path("id").asText(), summary, severity, disclosed));
        }

        Integer averagePatchDays = patchSamples == 0 ? null : (int) Math.round(patchDaysTotal / patchSamples);
        return new SecurityData(packageName, version, entries.size(), counts, latest, averagePatchDays, entries);
    }

    static VulnerabilitySeverity severityOf(JsonNode vuln) {
        for (JsonNode s : vuln.path("severity")) {
            VulnerabilitySeverity level = fromCvssScore(s.path("score").asText(""));
            if (level != VulnerabilitySeverity.UNKNOWN) {
                return level;
            }
        }
        String label = vuln.path("database_specific").path("severity").asText("").trim().toLowerCase(Locale.ROOT);
        return switch (label) {
            case "critical" -> VulnerabilitySeverity.CRITICAL;
            case "high" -> VulnerabilitySeverity.HIGH;
            case "moderate", "medium" -> VulnerabilitySeverity.MEDIUM;
            case "low" -> VulnerabilitySeverity.LOW;
            default -> VulnerabilitySeverity.UNKNOWN;
        };
    }

    /** Numeric CVSS base score to a bucket. Vector strings are not scored. */
    static VulnerabilitySeverity fromCvssScore(String score) {
        if (score.isEmpty() || score.startsWith("CVSS:")) {
            return VulnerabilitySeverity.UNKNOWN;
        }
        double numeric;
        try {
            numeric = Double.parseDouble(score);
        } catch (NumberFormatException e) {
            return VulnerabilitySeverity.UNKNOWN;
        }
        if (numeric >= 9.0) {
            return VulnerabilitySeverity.CRITICAL;
        }
        if (numeric >= 7.0) {
            return VulnerabilitySeverity.HIGH;
        }
        if (numeric >= 4.0) {
            return VulnerabilitySeverity.MEDIUM;
        }
        return numeric > 0 ? VulnerabilitySeverity.LOW : VulnerabilitySeverity.UNKNOWN;
    }
}
