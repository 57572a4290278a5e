package com.deporacle.engine.model;

/**
 * Download counts for a package.
 *
 * @author Naveed Gung
 */
public record PopularityData(
        String packageName,
        long weeklyDownloads,
        long monthlyDownloads,
        DownloadTrend trend) {
}
