package com.deporacle.engine.scan;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of scanning one project.
 *
 * @param status       NOTHING_TO_SCAN when no dependency source recognized the project
 * @param projectDir   scanned directory
 * @param reports      per-package reports, lowest trust score first
 * @param overallScore rounded mean of the report scores, 100 when there are none
 * @param summary      one-paragraph description of the findings
 *
 * @author Naveed Gung
 */
public record ScanResult(Status status, Path projectDir, List<TrustReport> reports, int overallScore,
        String summary) {

    public enum Status {
        COMPLETED,
        NOTHING_TO_SCAN
    }

    public ScanResult {
        reports = List.copyOf(reports);
    }

    public static ScanResult nothingToScan(Path projectDir) {
        return new ScanResult(Status.NOTHING_TO_SCAN, projectDir, List.of(), 100,
                "No supported manifest file found in " + projectDir);
    }
}
