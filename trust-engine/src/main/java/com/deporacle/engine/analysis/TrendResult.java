package com.deporacle.engine.analysis;

/**
 * Projected trajectory of a package.
 *
 * @param trend            winning direction of the weighted vote
 * @param confidence       0..1, rounded to two decimals
 * @param riskProjection3m expected trust score change over three months, -20..10
 * @param reason           the contributing signals, as sentences
 *
 * @author Naveed Gung
 */
public record TrendResult(Direction trend, double confidence, int riskProjection3m, String reason) {

    public enum Direction {
        RISING,
        STABLE,
        DECLINING,
        UNKNOWN
    }

    public static TrendResult unknown() {
        return new TrendResult(Direction.UNKNOWN, 0.0, 0, "Insufficient data to determine trend");
    }
}
