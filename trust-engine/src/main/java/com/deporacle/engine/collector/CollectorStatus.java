package com.deporacle.engine.collector;

/**
 * How a collector result was obtained.
 *
 * @author Naveed Gung
 */
public enum CollectorStatus {
    SUCCESS,
    CACHED,
    ERROR,
    OFFLINE
}
