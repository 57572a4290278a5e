package com.deporacle.engine.analysis;

import java.time.Instant;

/**
 * Abandonment verdict.
 *
 * @param isZombie     true when the package appears abandoned
 * @param severity     NONE when not a zombie
 * @param lastActivity later of last publish and last commit, null when neither is known
 * @param reason       human-readable explanation
 *
 * @author Naveed Gung
 */
public record ZombieResult(boolean isZombie, Severity severity, Instant lastActivity, String reason) {

    public enum Severity {
        NONE,
        WARNING,
        CRITICAL
    }
}
