package com.deporacle.engine.model;

/**
 * License classification.
 *
 * @param raw  license string as published
 * @param spdx normalized SPDX identifier, the trimmed raw text when unrecognized, null when absent
 *
 * @author Naveed Gung
 */
public record LicenseData(
        String packageName,
        String version,
        String raw,
        String spdx,
        LicenseRisk risk,
        boolean osiApproved) {
}
