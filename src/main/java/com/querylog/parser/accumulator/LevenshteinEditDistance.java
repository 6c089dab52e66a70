package com.querylog.parser.accumulator;

import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Levenshtein distance backed by Apache Commons Text. The bounded variant only
 * fills the diagonal band of width {@code 2 * limit + 1}.
 */
public class LevenshteinEditDistance implements EditDistance {

    private static final LevenshteinDistance UNBOUNDED = LevenshteinDistance.getDefaultInstance();

    @Override
    public int distance(CharSequence left, CharSequence right) {
        return UNBOUNDED.apply(left, right);
    }

    @Override
    public int distance(CharSequence left, CharSequence right, int limit) {
        if (limit < 0) {
            return -1;
        }
        return new LevenshteinDistance(limit).apply(left, right);
    }
}
