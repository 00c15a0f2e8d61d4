/**
 * Apache Flink streaming job for Retail Sentinel.
 *
 * <p>
 * This package wires the correlator into a Flink pipeline that consumes
 * sensor records from Kafka, correlates and evaluates them per store, and
 * publishes events back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.retailsentinel.flink.StreamSentinelJob}: main entry
 * point</li>
 * <li>{@link com.retailsentinel.flink.CorrelatorProcessFunction}: keyed process
 * function hosting the correlator</li>
 * <li>{@link com.retailsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.retailsentinel.flink;
