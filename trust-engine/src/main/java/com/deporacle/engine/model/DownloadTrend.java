package com.deporacle.engine.model;

/**
 * Direction of weekly downloads relative to the monthly average.
 *
 * @author Naveed Gung
 */
public enum DownloadTrend {
    RISING,
    STABLE,
    DECLINING
}
