package com.deporacle.engine.model;

import java.time.Instant;

/**
 * Normalized package-registry metadata.
 *
 * @param packageName     package name
 * @param version         analyzed version
 * @param description     registry description, may be null
 * @param lastPublishDate most recent release time, null when unknown
 * @param versionCount    number of published versions
 * @param deprecated      deprecation or yank message, null when not deprecated
 * @param weeklyDownloads downloads in the last seven days
 * @param license         raw license string, may be null
 * @param repositoryUrl   normalized https repository URL, may be null
 *
 * @author Naveed Gung
 */
public record RegistryData(
        String packageName,
        String version,
        String description,
        Instant lastPublishDate,
        int versionCount,
        String deprecated,
        long weeklyDownloads,
        String license,
        String repositoryUrl) {

    public boolean hasDeprecation() {
        return deprecated != null;
    }
}
