package com.deporacle.engine.model;

import java.time.Instant;

/**
 * One advisory affecting a package.
 *
 * @author Naveed Gung
 */
public record VulnerabilityEntry(
        String id,
        String summary,
        VulnerabilitySeverity severity,
        Instant published) {
}
