package com.retailsentinel.core.window;

/**
 * Lifecycle of a {@link CorrelationWindow}:
 * {@code OPEN -> CLOSING -> CLOSED}, after which the window is discarded.
 *
 * @since 1.0.0
 */
public enum WindowState {

    /** Newest window of its scope; its end has not been reached. */
    OPEN,

    /** End reached (or superseded), still accepting late records within the grace period. */
    CLOSING,

    /** Evaluated; no further records are accepted. */
    CLOSED
}
