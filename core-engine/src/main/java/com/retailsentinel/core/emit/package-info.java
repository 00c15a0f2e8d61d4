/**
 * Event emission: numbering, deduplication, ordering, sinks and the
 * dashboard view of emitted events.
 *
 * @since 1.0.0
 */
package com.retailsentinel.core.emit;
