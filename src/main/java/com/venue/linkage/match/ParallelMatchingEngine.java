package com.venue.linkage.match;

import com.venue.linkage.core.model.MatchResult;
import com.venue.linkage.core.model.NormalizedVenue;
import com.venue.linkage.core.model.VenueRecord;
import com.venue.linkage.geo.CandidateIndex;
import com.venue.linkage.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Distributes the per-probe searches of a {@link MatchingEngine} over a fixed worker pool.
 *
 * <p>The candidate index is built once on the calling thread and then shared read-only.
 * Probes are split into contiguous chunks; each worker writes its results into the slots of
 * its own chunk, so the output is in probe order whatever the scheduling. Cancellation and
 * timeouts are observed between probes, never inside a single search.</p>
 */
public class ParallelMatchingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ParallelMatchingEngine.class);
    private static final int CHUNKS_PER_WORKER = 4;

    private final MatchingEngine engine;
    private final ExecutorService executor;
    private final int workerThreads;
    private final long timeoutMs;

    public ParallelMatchingEngine(MatchingEngine engine) {
        this(engine, engine.getOptions().getWorkerThreads(), engine.getOptions().getTimeoutMs());
    }

    public ParallelMatchingEngine(MatchingEngine engine, int workerThreads, long timeoutMs) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
        this.engine = engine;
        this.workerThreads = workerThreads;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
    }

    public MatchingEngine getEngine() {
        return engine;
    }

    /**
     * Matches all probes and waits for the result.
     *
     * @throws IllegalStateException if the run times out, fails or the caller is interrupted
     */
    public <P extends VenueRecord, C extends VenueRecord> List<MatchResult<P, C>> matchAll(
            List<P> probes, List<C> candidates) {
        CompletableFuture<List<MatchResult<P, C>>> future = matchAllAsync(probes, candidates);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException("Match run timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for match run", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Match run failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Starts matching all probes. Cancelling the returned future stops the workers at their
     * next probe boundary.
     */
    public <P extends VenueRecord, C extends VenueRecord> CompletableFuture<List<MatchResult<P, C>>> matchAllAsync(
            List<P> probes, List<C> candidates) {
        String runId = LogContext.generateRunId();
        List<P> probeSnapshot = List.copyOf(probes);

        CandidateIndex<C> index;
        try (LogContext ctx = LogContext.forMatchRun(runId)) {
            index = engine.prepare(candidates);
            log.info("match.parallel.started probes={} candidates={} workers={}",
                    probeSnapshot.size(), index.size(), workerThreads);
            engine.getMetrics().recordRunSize(probeSnapshot.size());
        }

        @SuppressWarnings("unchecked")
        MatchResult<P, C>[] slots = new MatchResult[probeSnapshot.size()];
        AtomicBoolean cancelled = new AtomicBoolean(false);
        AtomicInteger completed = new AtomicInteger();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        List<CompletableFuture<Void>> chunks = new ArrayList<>();
        int chunkSize = chunkSize(probeSnapshot.size());
        for (int from = 0; from < probeSnapshot.size(); from += chunkSize) {
            int to = Math.min(from + chunkSize, probeSnapshot.size());
            int first = from;
            chunks.add(CompletableFuture.runAsync(
                    () -> matchChunk(runId, probeSnapshot, first, to, index, slots, cancelled, completed, failure),
                    executor));
        }

        CompletableFuture<List<MatchResult<P, C>>> result = CompletableFuture
                .allOf(chunks.toArray(new CompletableFuture[0]))
                .handle((v, error) -> {
                    if (error != null) {
                        // Report the chunk that failed, not the siblings it cancelled
                        Throwable root = failure.get();
                        throw root != null ? new CompletionException(root) : asCompletionException(error);
                    }
                    log.info("match.parallel.completed runId={} total={}", runId, completed.get());
                    return Collections.unmodifiableList(Arrays.asList(slots));
                });

        result.whenComplete((value, error) -> {
            if (error != null) {
                cancelled.set(true);
            }
        });
        return result;
    }

    private <P extends VenueRecord, C extends VenueRecord> void matchChunk(
            String runId, List<P> probes, int from, int to, CandidateIndex<C> index,
            MatchResult<P, C>[] slots, AtomicBoolean cancelled, AtomicInteger completed,
            AtomicReference<Throwable> failure) {
        try (LogContext ctx = LogContext.forChunk(runId, from, to - 1)) {
            for (int i = from; i < to; i++) {
                if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                    log.debug("match.chunk.cancelled at={}", i);
                    throw new CancellationException("Match run cancelled at probe " + i);
                }
                NormalizedVenue<P> probe = engine.getNormalizer().normalize(probes.get(i));
                slots[i] = engine.match(probe, index);
                completed.incrementAndGet();
            }
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            failure.compareAndSet(null, e);
            cancelled.set(true);
            log.error("match.chunk.failed from={} to={} error={}", from, to, e.getMessage());
            throw new CompletionException(e);
        }
    }

    private static CompletionException asCompletionException(Throwable error) {
        return error instanceof CompletionException ce ? ce : new CompletionException(error);
    }

    private int chunkSize(int probes) {
        int chunks = Math.max(1, workerThreads * CHUNKS_PER_WORKER);
        return Math.max(1, (probes + chunks - 1) / chunks);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "venue-match-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
