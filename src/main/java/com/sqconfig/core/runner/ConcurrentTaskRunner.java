package com.sqconfig.core.runner;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.RateLimitedException;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.error.TransportException;
import com.sqconfig.core.logging.MdcContext;
import com.sqconfig.core.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs one operation over many items with bounded parallelism and a per-task timeout.
 *
 * <p>At most {@code threads} tasks hold a slot at a time. A task that exceeds the
 * timeout is reported as {@link OutcomeStatus#TIMEOUT}, gives its slot back and is
 * interrupted on a best-effort basis. A failing task never aborts the batch.
 * Outcomes are handed to the caller's callback on the calling thread, in
 * completion order.
 */
public class ConcurrentTaskRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentTaskRunner.class);

    public static final int DEFAULT_THREADS = 8;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final int threads;
    private final Duration taskTimeout;
    private final SyncMetrics metrics;
    private final ExecutorService executor;

    public ConcurrentTaskRunner(int threads, Duration taskTimeout, SyncMetrics metrics) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        this.threads = threads;
        this.taskTimeout = taskTimeout;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(workerThreads());
    }

    public int threads() {
        return threads;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    /**
     * @param operation name used in logs and metrics ("audit", "export"...)
     * @param items     items to process
     * @param labelOf   short description of an item for logs
     * @param op        operation applied to each item on a worker thread
     * @param onOutcome receives each outcome on the calling thread, in completion order
     */
    public <T, R> RunSummary run(String operation, List<T> items, Function<T, String> labelOf,
                                 Function<T, R> op, Consumer<TaskOutcome<T, R>> onOutcome) {
        var outcomes = new LinkedBlockingQueue<TaskOutcome<T, R>>();
        var slots = new Semaphore(threads);
        var progress = new Progress(operation, items.size());

        log.info("{}: processing {} items with {} threads", operation, items.size(), threads);
        try {
            for (T item : items) {
                while (!slots.tryAcquire(100, TimeUnit.MILLISECONDS)) {
                    drainAvailable(outcomes, progress, onOutcome);
                }
                submit(operation, item, labelOf.apply(item), op, slots, outcomes);
                drainAvailable(outcomes, progress, onOutcome);
            }
            while (progress.completed() < items.size()) {
                deliver(outcomes.take(), progress, onOutcome);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SqConfigException(ErrorCode.OS_ERROR, operation + " interrupted", e);
        }

        var summary = progress.summary();
        log.info("{}", summary);
        if (metrics != null) {
            metrics.recordRun(operation, summary.total(), summary.failed());
        }
        return summary;
    }

    private <T, R> void submit(String operation, T item, String label, Function<T, R> op,
                               Semaphore slots, BlockingQueue<TaskOutcome<T, R>> outcomes) {
        var promise = new CompletableFuture<R>();
        var released = new AtomicBoolean();
        long start = System.nanoTime();

        Future<?> task = executor.submit(() -> {
            MdcContext.setTask(operation, label);
            try {
                promise.complete(op.apply(item));
            } catch (Throwable t) {
                promise.completeExceptionally(t);
            } finally {
                MdcContext.clear();
            }
        });

        promise.orTimeout(taskTimeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((result, error) -> {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (error instanceof TimeoutException) {
                task.cancel(true);
            }
            var outcome = classify(item, label, result, error, elapsed);
            if (metrics != null) {
                metrics.recordTask(operation, outcome.status().name(), elapsed);
            }
            outcomes.add(outcome);
        });
    }

    private <T, R> TaskOutcome<T, R> classify(T item, String label, R result, Throwable error, long elapsed) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause == null) {
            return new TaskOutcome<>(item, label, OutcomeStatus.SUCCESS, result, null, null, elapsed);
        }
        if (cause instanceof TimeoutException) {
            return new TaskOutcome<>(item, label, OutcomeStatus.TIMEOUT, null, ErrorCode.REQUEST_TIMEOUT,
                    "timed out after " + taskTimeout.toSeconds() + "s", elapsed);
        }
        if (cause instanceof TransportException || cause instanceof RateLimitedException) {
            return new TaskOutcome<>(item, label, OutcomeStatus.TRANSPORT_ERROR, null,
                    ((SqConfigException) cause).errorCode(), cause.getMessage(), elapsed);
        }
        if (cause instanceof SqConfigException domain) {
            return new TaskOutcome<>(item, label, OutcomeStatus.DOMAIN_ERROR, null,
                    domain.errorCode(), domain.getMessage(), elapsed);
        }
        log.error("Unexpected error processing {}", label, cause);
        return new TaskOutcome<>(item, label, OutcomeStatus.UNEXPECTED_ERROR, null, null,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), elapsed);
    }

    private <T, R> void drainAvailable(BlockingQueue<TaskOutcome<T, R>> outcomes, Progress progress,
                                       Consumer<TaskOutcome<T, R>> onOutcome) {
        TaskOutcome<T, R> outcome;
        while ((outcome = outcomes.poll()) != null) {
            deliver(outcome, progress, onOutcome);
        }
    }

    private <T, R> void deliver(TaskOutcome<T, R> outcome, Progress progress, Consumer<TaskOutcome<T, R>> onOutcome) {
        if (!outcome.isSuccess()) {
            log.warn("{} {} failed: {} {}", progress.operation, outcome.label(), outcome.status(), outcome.message());
        }
        progress.record(outcome.status());
        onOutcome.accept(outcome);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "sqconfig-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Completion counters, touched only by the calling thread.
     */
    private static final class Progress {

        private final String operation;
        private final int total;
        private final int step;
        private final Map<OutcomeStatus, Integer> failures = new EnumMap<>(OutcomeStatus.class);
        private int completed;
        private int succeeded;

        Progress(String operation, int total) {
            this.operation = operation;
            this.total = total;
            this.step = Math.max(10, total / 10);
        }

        void record(OutcomeStatus status) {
            completed++;
            if (status == OutcomeStatus.SUCCESS) {
                succeeded++;
            } else {
                failures.merge(status, 1, Integer::sum);
            }
            if (completed % step == 0 || completed == total) {
                log.info("{}: {}/{} items done ({}%)", operation, completed, total, completed * 100 / total);
            }
        }

        int completed() {
            return completed;
        }

        RunSummary summary() {
            return new RunSummary(operation, total, succeeded, failures);
        }
    }
}
