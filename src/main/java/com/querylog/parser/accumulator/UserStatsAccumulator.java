package com.querylog.parser.accumulator;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.querylog.parser.Verb;

/**
 * Per-user statistics for the whole run. Entries are created on the first
 * connect of a user and never removed.
 */
public class UserStatsAccumulator {

    private final Map<String, UserStats> userStats = new LinkedHashMap<>();

    /**
     * Counts a connection for the user, creating the entry on first sight.
     */
    public UserStats registerConnection(String user) {
        UserStats stats = ensureUser(user);
        stats.addConnection();
        return stats;
    }

    public UserStats ensureUser(String user) {
        return userStats.computeIfAbsent(user, UserStats::new);
    }

    public UserStats get(String user) {
        return userStats.get(user);
    }

    public int getSize() {
        return userStats.size();
    }

    /**
     * Users with at least one connection or query, by descending query count.
     * Users with equal counts stay in order of first appearance.
     */
    public List<UserStats> getSortedUsers() {
        return userStats.values().stream()
                .filter(s -> !s.isEmpty())
                .sorted(Comparator.comparingLong(UserStats::getQueryCount).reversed())
                .collect(Collectors.toList());
    }

    public void report(PrintStream out, boolean coarse) {
        boolean addSeparator = false;
        for (UserStats stats : getSortedUsers()) {
            if (coarse) {
                out.println(coarseLine(stats));
                continue;
            }
            if (addSeparator) {
                out.print("\n\n\n");
            }
            addSeparator = true;
            out.println(String.format("User %s (%d queries, %d connections)", stats.getUser(),
                    stats.getQueryCount(), stats.getConnectionCount()));
            for (Template template : stats.getTemplates().byDescendingCount()) {
                out.println(String.format("%d occurrences:", template.getCount()));
                out.println(String.format("   %s", template.getText()));
            }
        }
    }

    static String coarseLine(UserStats stats) {
        StringBuilder sb = new StringBuilder(stats.toString());
        boolean first = true;
        for (Verb verb : Verb.values()) {
            long count = stats.getVerbCount(verb);
            if (count > 0) {
                sb.append(first ? " " : ", ");
                sb.append(String.format("%d %ss", count, verb.getType()));
                first = false;
            }
        }
        return sb.toString();
    }
}
