/**
 * Detection rules and the engine that runs them.
 *
 * <p>
 * Each {@link com.retailsentinel.core.detection.DetectionRule} reads one
 * {@link com.retailsentinel.core.context.CorrelationContext} and returns at most
 * one event. Station rules abstain on store contexts and vice versa.
 * </p>
 *
 * @since 1.0.0
 */
package com.retailsentinel.core.detection;
