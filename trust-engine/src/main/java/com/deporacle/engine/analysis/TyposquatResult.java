package com.deporacle.engine.analysis;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Typosquat verdict.
 *
 * @param isRisky      true when any reference name is suspiciously close
 * @param similarNames matching reference names, sorted
 * @param minDistance  smallest edit distance among matches, 0 when not risky
 *
 * @author Naveed Gung
 */
public record TyposquatResult(boolean isRisky, SortedSet<String> similarNames, int minDistance) {

    public TyposquatResult {
        similarNames = Collections.unmodifiableSortedSet(new TreeSet<>(similarNames));
    }

    public static TyposquatResult safe() {
        return new TyposquatResult(false, new TreeSet<>(), 0);
    }

    /** Probability that the name is a typosquat: at least 0.5 when risky, 0 otherwise. */
    public double riskProbability() {
        return isRisky ? Math.max(0.5, 1 - minDistance * 0.2) : 0.0;
    }
}
