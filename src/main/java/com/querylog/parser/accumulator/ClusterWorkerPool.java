package com.querylog.parser.accumulator;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs clustering on a fixed set of single threaded workers. A user is always
 * served by the same worker, so each user's statements are clustered in log
 * order and the templates come out as in a sequential run. Template sets are
 * only touched by their worker until {@link #awaitCompletion()} returns.
 */
public class ClusterWorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ClusterWorkerPool.class);

    private static final int PENDING_PER_WORKER = 10000;

    private final ClusteringEngine engine;
    private final ExecutorService[] workers;
    private final Semaphore pending;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    public ClusterWorkerPool(ClusteringEngine engine, int numThreads) {
        if (numThreads < 1) {
            throw new IllegalArgumentException("Number of clustering threads must be positive, got " + numThreads);
        }
        this.engine = engine;
        this.workers = new ExecutorService[numThreads];
        for (int i = 0; i < numThreads; i++) {
            final int workerId = i;
            workers[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "cluster-worker-" + workerId);
                t.setDaemon(true);
                return t;
            });
        }
        this.pending = new Semaphore(PENDING_PER_WORKER * numThreads);
    }

    public void submit(UserStats stats, String normalizedSql) throws InterruptedException {
        if (failure.get() != null) {
            throw new IllegalStateException("Clustering worker failed", failure.get());
        }
        pending.acquire();
        workerFor(stats.getUser()).execute(() -> {
            try {
                engine.cluster(stats, normalizedSql);
            } catch (RuntimeException e) {
                logger.error("Clustering failed for user {}: {}", stats.getUser(), normalizedSql, e);
                failure.compareAndSet(null, e);
            } finally {
                pending.release();
            }
        });
    }

    private ExecutorService workerFor(String user) {
        return workers[Math.floorMod(user.hashCode(), workers.length)];
    }

    /**
     * Waits until every submitted statement has been clustered and stops the workers.
     */
    public void awaitCompletion() throws InterruptedException {
        for (ExecutorService worker : workers) {
            worker.shutdown();
        }
        for (ExecutorService worker : workers) {
            while (!worker.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.info("Still clustering, {} statements queued", PENDING_PER_WORKER * workers.length
                        - pending.availablePermits());
            }
        }
        if (failure.get() != null) {
            throw new IllegalStateException("Clustering worker failed", failure.get());
        }
    }

    @Override
    public void close() {
        for (ExecutorService worker : workers) {
            worker.shutdownNow();
        }
    }
}
