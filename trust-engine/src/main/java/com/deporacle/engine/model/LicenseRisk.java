package com.deporacle.engine.model;

/**
 * Compliance risk of a license.
 *
 * @author Naveed Gung
 */
public enum LicenseRisk {
    SAFE,
    CAUTIOUS,
    RISKY,
    UNKNOWN
}
