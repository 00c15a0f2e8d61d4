package com.retailsentinel.core.emit;

import com.retailsentinel.core.model.SentinelEvent;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Destination for emitted events.
 *
 * <p>
 * Receives each batch already numbered, deduplicated and in timestamp order.
 * Implementations may throw; the {@link EventEmitter} logs and counts the
 * failure and keeps going.
 * </p>
 */
public interface EventSink extends Closeable {

    /**
     * @param events one emission batch, never empty
     * @throws IOException if the events could not be written
     */
    void publish(List<SentinelEvent> events) throws IOException;

    @Override
    default void close() throws IOException {
        // nothing to release by default
    }
}
