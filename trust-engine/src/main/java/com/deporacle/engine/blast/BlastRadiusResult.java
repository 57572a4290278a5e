package com.deporacle.engine.blast;

import java.util.List;

/**
 * Files in a consuming project that import a package.
 *
 * @param affectedFileCount number of importing source files
 * @param affectedFilePaths their paths relative to the project root, sorted
 * @param percentage        share of all scanned source files, rounded to two decimals
 *
 * @author Naveed Gung
 */
public record BlastRadiusResult(int affectedFileCount, List<String> affectedFilePaths, double percentage) {

    public BlastRadiusResult {
        affectedFilePaths = List.copyOf(affectedFilePaths);
    }

    public static BlastRadiusResult empty() {
        return new BlastRadiusResult(0, List.of(), 0.0);
    }

    static BlastRadiusResult of(List<String> affected, int totalFiles) {
        if (totalFiles == 0 || affected.isEmpty()) {
            return new BlastRadiusResult(affected.size(), affected.stream().sorted().toList(), 0.0);
        }
        double percentage = Math.round((double) affected.size() / totalFiles * 10000) / 100.0;
        return new BlastRadiusResult(affected.size(), affected.stream().sorted().toList(), percentage);
    }
}
