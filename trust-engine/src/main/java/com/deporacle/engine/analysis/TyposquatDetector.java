package com.deporacle.engine.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags package names that look like a deliberate misspelling of a
 * well-known package.
 *
 * <p>
 * A name in the reference list is always safe. Any other name is compared
 * with every reference name by edit distance (1 or 2 is a match) and by five
 * structural patterns that each allow exactly one edit: an added or removed
 * suffix, a doubled letter, a missing letter, two swapped adjacent letters
 * and one look-alike character.
 * </p>
 *
 * @author Naveed Gung
 */
public class TyposquatDetector {

    private static final Logger log = LoggerFactory.getLogger(TyposquatDetector.class);

    /** Look-alikes keyed by the character they imitate. */
    private static final Map<Character, String> HOMOGLYPHS = Map.of(
            'l', "1i|",
            'o', "0",
            '0', "o",
            '1', "li",
            'i', "1l",
            'e', "3",
            's', "5",
            'a', "4@",
            'g', "9",
            'b', "6");

    private final List<String> reference;
    private final Set<String> referenceSet;
    private final List<String> suffixes;

    public TyposquatDetector(Collection<String> reference, List<String> suffixes) {
        this.referenceSet = new LinkedHashSet<>(reference);
        this.reference = List.copyOf(referenceSet);
        this.suffixes = List.copyOf(suffixes);
        log.info("Typosquat detector loaded with {} reference names", this.reference.size());
    }

    public int referenceSize() {
        return reference.size();
    }

    public TyposquatResult check(String packageName) {
        if (referenceSet.contains(packageName)) {
            return TyposquatResult.safe();
        }

        TreeSet<String> similar = new TreeSet<>();
        int minDistance = Integer.MAX_VALUE;

        for (String popular : reference) {
            int distance = levenshtein(packageName, popular);
            boolean match = (distance >= 1 && distance <= 2) || matchesPattern(packageName, popular);
            if (match) {
                similar.add(popular);
                minDistance = Math.min(minDistance, distance);
            }
        }

        if (similar.isEmpty()) {
            return TyposquatResult.safe();
        }
        log.debug("{} resembles {}", packageName, similar);
        return new TyposquatResult(true, similar, minDistance);
    }

    private boolean matchesPattern(String input, String popular) {
        if (input.equals(popular)) {
            return false;
        }
        return isSuffixed(input, popular)
                || isDoubledLetter(input, popular)
                || isMissingLetter(input, popular)
                || isTransposed(input, popular)
                || isHomoglyph(input, popular);
    }

    boolean isSuffixed(String input, String target) {
        for (String suffix : suffixes) {
            if (input.equals(target + suffix) || (input + suffix).equals(target)) {
                return true;
            }
        }
        return false;
    }

    /** {@code input} is {@code target} with one letter repeated, e.g. expresss. */
    static boolean isDoubledLetter(String input, String target) {
        if (input.length() != target.length() + 1) {
            return false;
        }
        boolean skipped = false;
        int j = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (j >= target.length()) {
                return !skipped && i > 0 && c == input.charAt(i - 1);
            }
            if (c == target.charAt(j)) {
                j++;
            } else if (!skipped && i > 0 && c == input.charAt(i - 1)) {
                skipped = true;
            } else {
                return false;
            }
        }
        return j == target.length();
    }

    /** {@code input} is {@code target} with one letter dropped, e.g. expres. */
    static boolean isMissingLetter(String input, String target) {
        if (input.length() != target.length() - 1) {
            return false;
        }
        boolean skipped = false;
        int j = 0;
        for (int i = 0; i < target.length(); i++) {
            if (j >= input.length()) {
                return !skipped;
            }
            if (input.charAt(j) == target.charAt(i)) {
                j++;
            } else if (!skipped) {
                skipped = true;
            } else {
                return false;
            }
        }
        return j == input.length();
    }

    /** Exactly one pair of adjacent letters swapped, e.g. exrpess. */
    static boolean isTransposed(String input, String target) {
        if (input.length() != target.length()) {
            return false;
        }
        int diffCount = 0;
        int firstDiff = -1;
        for (int i = 0; i < input.length(); i++) {
            if (input.charAt(i) == target.charAt(i)) {
                continue;
            }
            diffCount++;
            if (diffCount == 1) {
                firstDiff = i;
            } else if (diffCount == 2) {
                boolean swap = i == firstDiff + 1
                        && input.charAt(firstDiff) == target.charAt(i)
                        && input.charAt(i) == target.charAt(firstDiff);
                if (!swap) {
                    return false;
                }
            } else {
                return false;
            }
        }
        return diffCount == 2;
    }

    /** Exactly one character replaced by a look-alike, e.g. 1odash. */
    static boolean isHomoglyph(String input, String target) {
        if (input.length() != target.length()) {
            return false;
        }
        int substitutions = 0;
        for (int i = 0; i < input.length(); i++) {
            char actual = input.charAt(i);
            char expected = target.charAt(i);
            if (actual == expected) {
                continue;
            }
            String allowed = HOMOGLYPHS.get(expected);
            if (allowed == null || allowed.indexOf(actual) < 0 || ++substitutions > 1) {
                return false;
            }
        }
        return substitutions == 1;
    }

    /** Edit distance keeping two rows of the shorter string's length. */
    static int levenshtein(String a, String b) {
        if (a.length() > b.length()) {
            String tmp = a;
            a = b;
            b = tmp;
        }
        int m = a.length();
        int n = b.length();
        if (m == 0) {
            return n;
        }

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }
        for (int j = 1; j <= n; j++) {
            curr[0] = j;
            for (int i = 1; i <= m; i++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[i] = Math.min(Math.min(prev[i] + 1, curr[i - 1] + 1), prev[i - 1] + cost);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[m];
    }
}
