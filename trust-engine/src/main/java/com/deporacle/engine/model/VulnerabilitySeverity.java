package com.deporacle.engine.model;

/**
 * Advisory severity bucket.
 *
 * @author Naveed Gung
 */
public enum VulnerabilitySeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN
}
