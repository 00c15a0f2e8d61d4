package com.retailsentinel.core.runtime;

import com.retailsentinel.core.model.SensorRecord;

import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO between record adapters and the processing thread.
 *
 * <p>
 * Producers call {@link #offer(SensorRecord)} from any thread; the single
 * consumer calls {@link #poll(long, TimeUnit)}. After {@link #close()} new
 * records are refused, while records already queued can still be drained.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordQueue {

    private final LinkedBlockingDeque<SensorRecord> deque;
    private final OverflowPolicy policy;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    public RecordQueue(int capacity, OverflowPolicy policy) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.deque = new LinkedBlockingDeque<>(capacity);
        this.policy = policy;
    }

    /**
     * Enqueue a record according to the overflow policy.
     *
     * @param record record to enqueue
     * @return {@code false} if the queue is closed
     * @throws InterruptedException if interrupted while waiting for space
     */
    public boolean offer(SensorRecord record) throws InterruptedException {
        if (closed.get()) {
            return false;
        }
        if (policy == OverflowPolicy.BLOCK) {
            while (!deque.offerLast(record, 100, TimeUnit.MILLISECONDS)) {
                if (closed.get()) {
                    return false;
                }
            }
        } else {
            synchronized (deque) {
                while (!deque.offerLast(record)) {
                    if (deque.pollFirst() != null) {
                        dropped.incrementAndGet();
                    }
                }
            }
        }
        return !closedAfterEnqueue(record);
    }

    /**
     * @param timeout how long to wait
     * @param unit    unit of {@code timeout}
     * @return the oldest record, or {@code null} if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public SensorRecord poll(long timeout, TimeUnit unit) throws InterruptedException {
        return deque.pollFirst(timeout, unit);
    }

    /**
     * Close may have raced with the enqueue, and the consumer may already
     * have finished draining. Take the record back if it is still queued.
     */
    private boolean closedAfterEnqueue(SensorRecord record) {
        return closed.get() && deque.removeLastOccurrence(record);
    }

    /** Refuse further records. */
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int size() {
        return deque.size();
    }

    public OverflowPolicy getPolicy() {
        return policy;
    }

    /**
     * @return records discarded under {@link OverflowPolicy#DROP_OLDEST}
     */
    public long getDropped() {
        return dropped.get();
    }
}
