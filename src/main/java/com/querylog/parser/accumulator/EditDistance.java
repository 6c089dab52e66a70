package com.querylog.parser.accumulator;

/**
 * Edit distance between two statements.
 */
public interface EditDistance {

    int distance(CharSequence left, CharSequence right);

    /**
     * Distance if it is at most {@code limit}, otherwise -1. Implementations may
     * stop early once the limit is exceeded.
     */
    default int distance(CharSequence left, CharSequence right, int limit) {
        if (limit < 0) {
            return -1;
        }
        int d = distance(left, right);
        return d <= limit ? d : -1;
    }
}
