package com.retailsentinel.core.runtime;

import java.util.Locale;

/**
 * What {@link RecordQueue} does when it is full.
 *
 * @since 1.0.0
 */
public enum OverflowPolicy {

    /** The producer waits for space. */
    BLOCK,

    /** The oldest queued record is discarded and counted. */
    DROP_OLDEST;

    /**
     * @param raw policy name, case-insensitive ({@code block}, {@code drop_oldest})
     * @return the policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static OverflowPolicy parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Overflow policy must not be null");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (OverflowPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException(
                "Unknown overflow policy: '" + raw + "'. Supported: block, drop_oldest");
    }
}
