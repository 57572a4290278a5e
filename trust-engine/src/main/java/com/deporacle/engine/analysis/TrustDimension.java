package com.deporacle.engine.analysis;

/**
 * The six scored dimensions of a trust score.
 *
 * @author Naveed Gung
 */
public enum TrustDimension {
    SECURITY,
    MAINTAINER,
    ACTIVITY,
    POPULARITY,
    FUNDING,
    LICENSE
}
