package com.querylog.parser.accumulator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querylog.parser.SqlMangler;

/**
 * Assigns statements to per-user templates by normalized edit distance.
 *
 * <p>The mangled statement is compared against the user's templates, most frequent
 * first. The first template whose distance divided by the mean of both lengths is
 * strictly below the threshold takes the statement. This is first match, not best
 * match: a later template could be closer. If none matches, the mangled statement
 * becomes a new template.
 */
public class ClusteringEngine {

    private static final Logger logger = LoggerFactory.getLogger(ClusteringEngine.class);

    public static final double DEFAULT_THRESHOLD = 0.15;

    private final SqlMangler mangler;
    private final EditDistance editDistance;
    private final double threshold;

    public ClusteringEngine(SqlMangler mangler, EditDistance editDistance, double threshold) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Clustering threshold must be in (0, 1], got " + threshold);
        }
        this.mangler = mangler;
        this.editDistance = editDistance;
        this.threshold = threshold;
    }

    public Template cluster(UserStats stats, String normalizedSql) {
        String mangled = mangler.mangle(normalizedSql);
        TemplateSet templates = stats.getTemplates();
        int mangledLength = mangled.length();

        for (int i = 0; i < templates.size(); i++) {
            Template candidate = templates.get(i);
            double meanLength = (mangledLength + candidate.length()) / 2.0;
            int limit = (int) Math.floor(threshold * meanLength);
            int distance = editDistance.distance(mangled, candidate.getText(), limit);
            if (distance < 0) {
                continue;
            }
            double normalized = distance / meanLength;
            if (normalized < threshold) {
                templates.increment(i);
                stats.addMergeDistance(normalized);
                if (logger.isDebugEnabled()) {
                    logger.debug("User {}: {} instances of {}", stats.getUser(), candidate.getCount(),
                            candidate.getText());
                }
                return candidate;
            }
        }

        Template fresh = templates.add(mangled);
        logger.debug("User {}: Fresh {}", stats.getUser(), mangled);
        return fresh;
    }

    public double getThreshold() {
        return threshold;
    }
}
