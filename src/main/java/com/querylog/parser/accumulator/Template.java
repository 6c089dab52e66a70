package com.querylog.parser.accumulator;

/**
 * Representative mangled statement of a cluster and the number of statements
 * assigned to it.
 */
public class Template {

    private final String text;
    private long count;

    Template(String text) {
        this.text = text;
        this.count = 1;
    }

    void increment() {
        count++;
    }

    public String getText() {
        return text;
    }

    public long getCount() {
        return count;
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return count + " x " + text;
    }
}
