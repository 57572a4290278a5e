package com.deporacle.engine.ratelimit;

/**
 * Upstream hosts that get their own request budget.
 *
 * @author Naveed Gung
 */
public enum Upstream {
    NPM_REGISTRY,
    NPM_DOWNLOADS,
    PYPI,
    PYPI_STATS,
    GITHUB,
    OSV,
    OPEN_COLLECTIVE
}
