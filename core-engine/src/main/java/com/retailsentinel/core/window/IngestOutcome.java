package com.retailsentinel.core.window;

/**
 * Result of handing one record to {@link WindowManager#ingest}.
 *
 * @since 1.0.0
 */
public enum IngestOutcome {

    /** Buffered in its window. */
    ACCEPTED,

    /** Failed validation; never buffered. */
    REJECTED,

    /** Its window had already closed. */
    DROPPED_LATE,

    /** Repeated tag read collapsed into an earlier one. */
    DUPLICATE
}
