/**
 * Record model and event types for Retail Sentinel.
 *
 * <p>
 * This package contains the immutable values that flow through the
 * correlator:
 * </p>
 * <ul>
 * <li>{@link com.retailsentinel.core.model.SensorRecord} and its five stream
 * types (tag reads, transactions, queue samples, recognition results,
 * inventory snapshots)</li>
 * <li>{@link com.retailsentinel.core.model.ReferenceCatalog} holding products
 * and customers</li>
 * <li>{@link com.retailsentinel.core.model.Station} and its normalised
 * {@link com.retailsentinel.core.model.StationStatus}</li>
 * <li>{@link com.retailsentinel.core.model.SentinelEvent}, the output envelope,
 * and its closed {@link com.retailsentinel.core.model.EventPayload}
 * hierarchy</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.retailsentinel.core.model;
