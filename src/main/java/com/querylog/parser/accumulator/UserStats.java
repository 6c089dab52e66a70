package com.querylog.parser.accumulator;

import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.querylog.parser.Verb;

/**
 * Counters for one user ({@code name@host}). The verb counters always add up to
 * the query count.
 */
public class UserStats {

    private static final int MAX_DISTANCE_SAMPLES = 10000;

    private final String user;
    private long connectionCount;
    private long queryCount;
    private final Map<Verb, Long> verbCounts = new EnumMap<>(Verb.class);

    // only touched by the clustering side
    private final TemplateSet templates = new TemplateSet();
    private final DescriptiveStatistics mergeDistanceStats = new DescriptiveStatistics();
    private long mergeCount;

    public UserStats(String user) {
        this.user = user;
        for (Verb verb : Verb.values()) {
            verbCounts.put(verb, 0L);
        }
    }

    public void addConnection() {
        connectionCount++;
    }

    public void addQuery(Verb verb) {
        queryCount++;
        verbCounts.merge(verb, 1L, Long::sum);
    }

    public void addMergeDistance(double normalizedDistance) {
        mergeCount++;
        if (mergeDistanceStats.getN() < MAX_DISTANCE_SAMPLES) {
            mergeDistanceStats.addValue(normalizedDistance);
        }
    }

    public String getUser() {
        return user;
    }

    public long getConnectionCount() {
        return connectionCount;
    }

    public long getQueryCount() {
        return queryCount;
    }

    public long getVerbCount(Verb verb) {
        return verbCounts.get(verb);
    }

    public TemplateSet getTemplates() {
        return templates;
    }

    public long getMergeCount() {
        return mergeCount;
    }

    public double getMeanMergeDistance() {
        return mergeDistanceStats.getN() > 0 ? mergeDistanceStats.getMean() : 0.0;
    }

    public double getMergeDistancePercentile95() {
        return mergeDistanceStats.getN() > 0 ? mergeDistanceStats.getPercentile(95) : 0.0;
    }

    /**
     * True for entries that never saw a connection or a query.
     */
    public boolean isEmpty() {
        return connectionCount == 0 && queryCount == 0;
    }

    public String toString() {
        return String.format("User %-60s (%10d queries, %7d connections)", user, queryCount, connectionCount);
    }
}
