/**
 * Tumbling windows keyed by station plus a store-wide slice track, driven by
 * a logical clock with a bounded lateness grace period.
 *
 * @since 1.0.0
 */
package com.retailsentinel.core.window;
