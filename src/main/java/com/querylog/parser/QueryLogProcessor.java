package com.querylog.parser;

import java.io.BufferedReader;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querylog.parser.StatementClassifier.Result;
import com.querylog.parser.accumulator.ClusterWorkerPool;
import com.querylog.parser.accumulator.ClusteringEngine;
import com.querylog.parser.accumulator.EditDistance;
import com.querylog.parser.accumulator.LevenshteinEditDistance;
import com.querylog.parser.accumulator.UserStats;
import com.querylog.parser.accumulator.UserStatsAccumulator;

/**
 * Single pass over a general query log. Lines are processed strictly one after
 * the other; a header line first terminates the statement being captured and
 * then updates sessions or opens the next capture.
 */
public class QueryLogProcessor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryLogProcessor.class);

    private static final long PROGRESS_INTERVAL_MS = 5000;

    private final ParserOptions options;
    private final LogLineClassifier lineClassifier = new LogLineClassifier();
    private final PendingStatement pending = new PendingStatement();
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final UserStatsAccumulator accumulator = new UserStatsAccumulator();
    private final StatementClassifier statementClassifier;
    private final ClusteringEngine clusteringEngine;
    private final ClusterWorkerPool clusterWorkerPool;

    private String when = ConnectionRegistry.EPOCH_TIMESTAMP;
    private String earliestTimestamp = null;
    private String latestTimestamp = null;
    private boolean halted = false;
    private long lastProgressTime = 0;

    private long lineNumber = 0;
    private long ignoredCount = 0;
    private long unparsedCount = 0;
    private long droppedCount = 0;
    private long capturedCount = 0;

    public QueryLogProcessor(ParserOptions options) {
        this(options, new LevenshteinEditDistance());
    }

    public QueryLogProcessor(ParserOptions options, EditDistance editDistance) {
        this.options = options;
        this.statementClassifier = new StatementClassifier(options.getFilterConfig());
        if (options.isCoarse()) {
            this.clusteringEngine = null;
            this.clusterWorkerPool = null;
        } else {
            this.clusteringEngine = new ClusteringEngine(new SqlMangler(options.getMangleRules()), editDistance,
                    options.getThreshold());
            this.clusterWorkerPool = options.getThreads() > 1
                    ? new ClusterWorkerPool(clusteringEngine, options.getThreads()) : null;
        }
        accumulator.ensureUser(ConnectionRegistry.BOOTSTRAP_USER);
    }

    /**
     * Reads lines until the end of the input or the breakoff date.
     *
     * @return false if the breakoff date was reached and no further input should be read
     */
    public boolean process(BufferedReader in) throws IOException, InterruptedException {
        String line;
        while ((line = in.readLine()) != null) {
            if (!processLine(line)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return false once the breakoff date has been reached
     */
    public boolean processLine(String rawLine) throws InterruptedException {
        if (halted) {
            return false;
        }
        // the statement captured on the cutoff date is left unflushed
        if (isBreakoffReached()) {
            halted = true;
            logger.info("Reached breakoff {} at {}, stopping", options.getBreakoff(), when);
            return false;
        }
        lineNumber++;
        try {
            handleLine(rawLine);
        } catch (ParserStateException e) {
            if (e.hasLocation()) {
                throw e;
            }
            throw new ParserStateException(e.getMessage() + " [at " + when + ", " + registry.size()
                    + " live connections]", lineNumber, rawLine, e);
        }
        return true;
    }

    private void handleLine(String rawLine) throws InterruptedException {
        LogLine line = lineClassifier.classify(rawLine);
        switch (line.getKind()) {
        case IGNORABLE:
            ignoredCount++;
            return;
        case FRAGMENT:
            if (!pending.append(line.getText())) {
                unparsedCount++;
                logger.warn("Could not process this line (at line start): '{}'", rawLine);
            }
            return;
        case HEADER:
        default:
            break;
        }

        terminatePending();

        if (line.getTimestamp() != null) {
            updateTimestamp(line.getTimestamp());
        }

        long connid = line.getConnectionId();
        SessionCommand command = line.getCommand();

        if (command.isConnectAttempt()) {
            handleConnectAttempt(line);
            return;
        }

        LiveConnection conn = registry.lookup(connid);
        if (conn == null) {
            droppedCount++;
            logger.warn("Unknown connection id {} at {} - dropping line '{}'", connid, when, rawLine);
            return;
        }

        switch (command) {
        case QUIT:
            registry.disconnect(connid);
            break;
        case INIT_DB:
            registry.setDatabase(connid, line.getArgument(0));
            break;
        case REFRESH:
        case CLOSE_STMT:
            break;
        default:
            if (command.opensCapture()) {
                pending.open(line.getArgument(0), conn.getUser(), command == SessionCommand.PREPARE);
            } else {
                unparsedCount++;
                logger.warn("Unknown: '{}'", rawLine);
            }
            break;
        }
    }

    private void handleConnectAttempt(LogLine line) {
        if (line.getCommand() == SessionCommand.ACCESS_DENIED) {
            logger.warn("Failed connection attempt by {} at {}", line.getArgument(0), when);
            return;
        }
        String user = line.getArgument(0);
        String db = line.getArgument(1);
        registry.connect(line.getConnectionId(), user, db == null || db.isEmpty() ? null : db, when);
        accumulator.registerConnection(user);
    }

    private void terminatePending() throws InterruptedException {
        CapturedStatement statement = pending.flush();
        if (statement == null) {
            return;
        }
        capturedCount++;
        String user = statement.getUser();
        logger.debug("Captured SQL: {}", statement.getSql());

        UserStats stats = accumulator.get(user);
        if (stats == null) {
            throw new ParserStateException("Statement attributed to user " + user + " who has no statistics entry");
        }

        Result result = statementClassifier.classify(statement.getSql(), statement.isPrepare());
        switch (result.getOutcome()) {
        case EMPTY:
        case UNINTERESTING:
            return;
        case PREPARE:
            logger.info("Prepared statement by {}: {}", user, statement.getSql());
            return;
        case COUNTED:
        default:
            break;
        }

        stats.addQuery(result.getVerb());
        if (result.getVerb() == Verb.OTHER) {
            logger.warn("Unknown query operation: {}", result.getNormalized());
        }

        if (options.isCoarse()) {
            return;
        }
        if (clusterWorkerPool != null) {
            clusterWorkerPool.submit(stats, result.getNormalized());
        } else {
            clusteringEngine.cluster(stats, result.getNormalized());
        }
    }

    private void updateTimestamp(String timestamp) {
        when = timestamp;
        if (earliestTimestamp == null) {
            earliestTimestamp = timestamp;
        }
        latestTimestamp = timestamp;

        long now = System.currentTimeMillis();
        if (now - lastProgressTime > PROGRESS_INTERVAL_MS) {
            logger.info("Now at: {}", when);
            lastProgressTime = now;
        }
    }

    private boolean isBreakoffReached() {
        String breakoff = options.getBreakoff();
        return breakoff != null && when.substring(0, breakoff.length()).compareTo(breakoff) >= 0;
    }

    /**
     * Terminates a statement still being captured at the end of the input, unless
     * the breakoff date stopped the run, and waits for clustering to finish.
     */
    public void finish() throws InterruptedException {
        // a last header on the cutoff date never gets another line to trip the check
        if (!halted && isBreakoffReached()) {
            halted = true;
            logger.info("Reached breakoff {} at {} at end of input", options.getBreakoff(), when);
        }
        if (!halted) {
            try {
                terminatePending();
            } catch (ParserStateException e) {
                throw new ParserStateException(e.getMessage(), lineNumber, "<end of input>", e);
            }
        }
        if (clusterWorkerPool != null) {
            clusterWorkerPool.awaitCompletion();
        }
        logger.info("Processing complete - Lines: {} read, {} ignored, {} unparsed, {} dropped for unknown connection"
                + " | Statements captured: {} | Users: {} | Live connections left: {}",
                lineNumber, ignoredCount, unparsedCount, droppedCount, capturedCount, accumulator.getSortedUsers().size(),
                registry.size());
    }

    @Override
    public void close() {
        if (clusterWorkerPool != null) {
            clusterWorkerPool.close();
        }
    }

    public ParserOptions getOptions() {
        return options;
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    public UserStatsAccumulator getAccumulator() {
        return accumulator;
    }

    public boolean isHalted() {
        return halted;
    }

    /**
     * Timestamp of the most recent timestamped header, or the epoch before the first one.
     */
    public String getCurrentTimestamp() {
        return when;
    }

    public String getEarliestTimestamp() {
        return earliestTimestamp;
    }

    public String getLatestTimestamp() {
        return latestTimestamp;
    }

    public long getLineCount() {
        return lineNumber;
    }

    public long getIgnoredCount() {
        return ignoredCount;
    }

    public long getUnparsedCount() {
        return unparsedCount;
    }

    public long getDroppedCount() {
        return droppedCount;
    }
}
