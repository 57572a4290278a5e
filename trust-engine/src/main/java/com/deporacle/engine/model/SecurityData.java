package com.deporacle.engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Known-vulnerability summary for one package version.
 *
 * @param severityCounts          count per severity bucket
 * @param latestVulnerabilityDate newest published or modified time among the advisories
 * @param averagePatchDays        mean days between disclosure and fix, null when unknown
 *
 * @author Naveed Gung
 */
public record SecurityData(
        String packageName,
        String version,
        int totalVulnerabilities,
        Map<VulnerabilitySeverity, Integer> severityCounts,
        Instant latestVulnerabilityDate,
        Integer averagePatchDays,
        List<VulnerabilityEntry> vulnerabilities) {
}
