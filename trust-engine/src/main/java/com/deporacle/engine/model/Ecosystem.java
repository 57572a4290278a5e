package com.deporacle.engine.model;

import java.util.Locale;

/**
 * Package ecosystems the engine can analyze.
 *
 * @author Naveed Gung
 */
public enum Ecosystem {
    NPM("npm"),
    PYPI("PyPI");

    private final String osvName;

    Ecosystem(String osvName) {
        this.osvName = osvName;
    }

    /** Ecosystem identifier expected by the OSV query API. */
    public String osvName() {
        return osvName;
    }

    /** Lower-case token used in cache keys. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Ecosystem fromString(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "npm", "node", "javascript" -> NPM;
            case "pypi", "pip", "python" -> PYPI;
            default -> throw new IllegalArgumentException("Unsupported ecosystem: " + value);
        };
    }
}
