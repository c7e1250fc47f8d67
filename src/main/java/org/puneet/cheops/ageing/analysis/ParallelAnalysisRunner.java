package org.puneet.cheops.ageing.analysis;

import org.puneet.cheops.ageing.exceptions.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs independent selections concurrently on a fixed thread pool.
 *
 * <p>Results are immutable and derived only from their selection, so no coordination between
 * tasks is needed. A failing selection yields a failed {@link Outcome} and does not affect its
 * siblings.</p>
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ParallelAnalysisRunner implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ParallelAnalysisRunner.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final SelectionAnalyzer analyzer;
    private final ExecutorService executorService;
    private final int threadPoolSize;

    /**
     * @param analyzer analyzer shared by all tasks
     * @param threadPoolSize number of worker threads
     * @throws IllegalArgumentException if the pool size is not positive
     */
    public ParallelAnalysisRunner(SelectionAnalyzer analyzer, int threadPoolSize) {
        if (threadPoolSize <= 0) {
            throw new IllegalArgumentException("Thread pool size must be positive");
        }
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer cannot be null");
        this.threadPoolSize = threadPoolSize;
        this.executorService = Executors.newFixedThreadPool(threadPoolSize);
    }

    /**
     * Computes one selection asynchronously.
     *
     * @return a future completing with the result, or exceptionally with the
     *         {@link AnalysisException} wrapped in a {@link CompletionException}
     */
    public CompletableFuture<AnalysisResult> submit(Selection selection) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return analyzer.compute(selection);
            } catch (AnalysisException e) {
                throw new CompletionException(e);
            }
        }, executorService);
    }

    /**
     * Computes a selection and hands the result to {@code consumer} only if no newer selection
     * was registered with the tracker in the meantime.
     */
    public CompletableFuture<Boolean> submitLatest(Selection selection, LatestSelectionTracker<AnalysisResult> tracker,
                                                   Consumer<AnalysisResult> consumer) {
        long ticket = tracker.nextTicket();
        return submit(selection).thenApply(result -> {
            if (tracker.publish(ticket, result)) {
                consumer.accept(result);
                return true;
            }
            logger.debug("Dropping superseded result for {}", selection);
            return false;
        });
    }

    /**
     * Computes all selections and waits for them.
     *
     * @param selections selections to run
     * @return one outcome per selection, in input order
     */
    public List<Outcome> runAll(List<Selection> selections) {
        if (selections == null) {
            throw new IllegalArgumentException("Selections list cannot be null");
        }

        AtomicInteger failed = new AtomicInteger();
        logger.info("Starting parallel analysis: {} selections, threads: {}", selections.size(), threadPoolSize);

        List<CompletableFuture<Outcome>> futures = new ArrayList<>();
        for (Selection selection : selections) {
            futures.add(submit(selection).handle((result, error) -> {
                if (error == null) {
                    return Outcome.success(selection, result);
                }
                failed.incrementAndGet();
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                logger.warn("Selection {} failed: {}", selection, cause.getMessage());
                return Outcome.failure(selection, cause);
            }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Outcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<Outcome> future : futures) {
            outcomes.add(future.join());
        }
        logger.info("Parallel analysis completed: {} succeeded, {} failed",
                outcomes.size() - failed.get(), failed.get());
        return outcomes;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /**
     * Shuts down the thread pool.
     */
    @Override
    public void close() {
        logger.debug("Shutting down analysis thread pool");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Result or failure of one selection.
     */
    public static final class Outcome {
        private final Selection selection;
        private final AnalysisResult result;
        private final Throwable error;

        private Outcome(Selection selection, AnalysisResult result, Throwable error) {
            this.selection = selection;
            this.result = result;
            this.error = error;
        }

        static Outcome success(Selection selection, AnalysisResult result) {
            return new Outcome(selection, result, null);
        }

        static Outcome failure(Selection selection, Throwable error) {
            return new Outcome(selection, null, error);
        }

        public Selection getSelection() {
            return selection;
        }

        public boolean isSuccess() {
            return error == null;
        }

        public Optional<AnalysisResult> getResult() {
            return Optional.ofNullable(result);
        }

        public Optional<Throwable> getError() {
            return Optional.ofNullable(error);
        }
    }
}
