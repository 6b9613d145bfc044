package com.sqconfig.core.writer;

import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Serializes records produced by many threads through a single consumer thread.
 *
 * <p>Producers {@link #submit} batches into a bounded queue; the consumer filters
 * and writes them in arrival order. {@link #finish} enqueues the end-of-stream
 * marker, waits for the consumer to write the closing syntax and close the sink,
 * and reports the number of records written. If the sink fails the consumer stops
 * writing but keeps draining so producers never block, and {@code finish} rethrows.
 */
public class StreamingResultWriter<T> {

    private static final Logger log = LoggerFactory.getLogger(StreamingResultWriter.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private final RecordFormat<T> format;
    private final Predicate<? super T> filter;
    private final BlockingQueue<Batch<T>> queue;
    private final ReadWriteLock acceptance = new ReentrantReadWriteLock();

    private volatile Thread consumer;
    private Writer sink;
    private volatile boolean finished;
    private volatile Exception failure;
    private volatile long written;

    private record Batch<T>(List<T> records, boolean end) {
    }

    public StreamingResultWriter(RecordFormat<T> format, Predicate<? super T> filter, int capacity) {
        this.format = format;
        this.filter = filter;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public StreamingResultWriter(RecordFormat<T> format) {
        this(format, r -> true, DEFAULT_CAPACITY);
    }

    /**
     * Starts the consumer thread. The writer takes ownership of {@code sink} and
     * closes it when the stream ends.
     */
    public void start(Writer sink, String name) {
        acceptance.writeLock().lock();
        try {
            startConsumer(sink, name);
        } finally {
            acceptance.writeLock().unlock();
        }
    }

    private void startConsumer(Writer sink, String name) {
        if (consumer != null) {
            throw new IllegalStateException("Writer already started");
        }
        this.sink = sink;
        consumer = new Thread(this::consume, "sqconfig-writer-" + name);
        consumer.setDaemon(true);
        consumer.start();
    }

    /**
     * Enqueues a batch, blocking while the queue is full.
     *
     * @throws IllegalStateException if the writer is not started or already finished
     */
    public void submit(List<T> records) {
        acceptance.readLock().lock();
        try {
            if (consumer == null || finished) {
                throw new IllegalStateException("Writer is not accepting records");
            }
            if (!records.isEmpty()) {
                put(new Batch<>(List.copyOf(records), false));
            }
        } finally {
            acceptance.readLock().unlock();
        }
    }

    public void submit(T record) {
        submit(List.of(record));
    }

    /**
     * Ends the stream and waits until every record submitted before this call has
     * been written and the sink closed.
     *
     * @return number of records written (after filtering)
     * @throws SqConfigException with {@link ErrorCode#OS_ERROR} if the sink failed
     */
    public long finish() {
        acceptance.writeLock().lock();
        try {
            if (consumer == null || finished) {
                throw new IllegalStateException("Writer not started or already finished");
            }
            finished = true;
        } finally {
            acceptance.writeLock().unlock();
        }
        put(new Batch<>(List.of(), true));
        try {
            consumer.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SqConfigException(ErrorCode.OS_ERROR, "Interrupted while finishing output", e);
        }
        if (failure != null) {
            throw new SqConfigException(ErrorCode.OS_ERROR, "Output failed: " + failure.getMessage(), failure);
        }
        log.debug("{} records written", written);
        return written;
    }

    public long written() {
        return written;
    }

    private void consume() {
        try {
            format.begin(sink);
        } catch (IOException | RuntimeException e) {
            fail(e);
        }
        while (true) {
            Batch<T> batch;
            try {
                batch = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(e);
                break;
            }
            if (batch.end()) {
                break;
            }
            if (failure != null) {
                continue;
            }
            try {
                for (T record : batch.records()) {
                    if (filter.test(record)) {
                        format.write(record);
                        written++;
                    }
                }
            } catch (IOException | RuntimeException e) {
                fail(e);
            }
        }
        try {
            if (failure == null) {
                format.end();
            }
        } catch (IOException | RuntimeException e) {
            fail(e);
        } finally {
            closeSink();
        }
    }

    private void closeSink() {
        try {
            sink.close();
        } catch (IOException e) {
            if (failure == null) {
                fail(e);
            }
        }
    }

    private void fail(Exception e) {
        if (failure == null) {
            log.error("Output stream failed, remaining records are discarded: {}", e.getMessage());
            failure = e;
        }
    }

    private void put(Batch<T> batch) {
        try {
            queue.put(batch);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SqConfigException(ErrorCode.OS_ERROR, "Interrupted while queuing output", e);
        }
    }
}
