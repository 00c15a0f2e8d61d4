package com.retailsentinel.core.ingest;

/**
 * Thrown when raw input cannot be turned into records at all: unreadable
 * JSON, an unknown dataset, or a payload that is not an object.
 *
 * <p>
 * Records that parse but carry bad values are not reported this way; they
 * fail {@code isValid()} and are rejected at ingestion.
 * </p>
 *
 * @since 1.0.0
 */
public class MalformedRecordException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
