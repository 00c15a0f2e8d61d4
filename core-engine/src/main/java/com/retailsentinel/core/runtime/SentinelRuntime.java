package com.retailsentinel.core.runtime;

import com.retailsentinel.core.emit.DashboardSnapshot;
import com.retailsentinel.core.emit.EventSink;
import com.retailsentinel.core.model.SensorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a {@link Correlator} on a dedicated processing thread fed by a
 * {@link RecordQueue}.
 *
 * <h3>Shutdown</h3>
 * <p>
 * {@link #shutdown(Duration)} stops intake, lets the processing thread drain
 * the queue, flushes every partial window and finally closes the sink. The
 * correlator is only ever touched by the processing thread. A record whose
 * processing throws is logged, counted and skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelRuntime {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelRuntime.class);

    private final Correlator correlator;
    private final RecordQueue queue;
    private final EventSink sink;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processingFailures = new AtomicLong();
    private volatile boolean stopping;
    private Thread processor;

    public SentinelRuntime(Correlator correlator, RecordQueue queue, EventSink sink) {
        this.correlator = Objects.requireNonNull(correlator, "correlator must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * Start the processing thread.
     *
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Runtime already started");
        }
        processor = new Thread(this::processLoop, "sentinel-processor");
        processor.start();
        LOG.info("Sentinel runtime started ({} queue)", queue.getPolicy());
    }

    /**
     * Hand a record to the processing thread.
     *
     * @param record record to process
     * @return {@code false} if the runtime no longer accepts records
     * @throws InterruptedException if interrupted while the queue is full
     */
    public boolean submit(SensorRecord record) throws InterruptedException {
        return queue.offer(record);
    }

    /**
     * Stop intake, drain, flush and close the sink.
     *
     * @param timeout how long to wait for the processing thread
     * @return {@code true} if the thread finished within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        queue.close();
        stopping = true;
        if (processor == null) {
            closeSink();
            return true;
        }
        processor.join(timeout.toMillis());
        boolean finished = !processor.isAlive();
        if (!finished) {
            LOG.warn("Processing thread did not finish within {}", timeout);
        }
        return finished;
    }

    public DashboardSnapshot snapshot() {
        return correlator.snapshot();
    }

    public RecordQueue getQueue() {
        return queue;
    }

    /**
     * @return records whose processing threw and was skipped
     */
    public long getProcessingFailures() {
        return processingFailures.get();
    }

    // ---------------------------------------------------------------
    // Processing thread
    // ---------------------------------------------------------------

    private void processLoop() {
        try {
            while (true) {
                SensorRecord record = queue.poll(100, TimeUnit.MILLISECONDS);
                if (record != null) {
                    process(record);
                } else if (stopping) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Processing thread interrupted; flushing open windows");
        } finally {
            try {
                correlator.flush();
                LOG.info("Sentinel runtime drained: accepted={}, rejected={}, droppedLate={}, emitted={}, "
                                + "queueDropped={}, processingFailures={}",
                        correlator.getWindows().getAccepted(), correlator.getWindows().getRejected(),
                        correlator.getWindows().getDroppedLate(), correlator.getEmitter().getEmittedCount(),
                        queue.getDropped(), processingFailures.get());
            } catch (RuntimeException e) {
                LOG.error("Failed to flush open windows: {}", e.getMessage(), e);
            } finally {
                closeSink();
                running.set(false);
            }
        }
    }

    private void process(SensorRecord record) {
        try {
            correlator.accept(record);
        } catch (RuntimeException e) {
            processingFailures.incrementAndGet();
            LOG.error("Failed to process record {}: {}", record, e.getMessage(), e);
        }
    }

    private void closeSink() {
        try {
            sink.close();
        } catch (IOException e) {
            LOG.error("Failed to close event sink: {}", e.getMessage(), e);
        }
    }
}
