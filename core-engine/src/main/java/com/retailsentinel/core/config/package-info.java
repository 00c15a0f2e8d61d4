/**
 * Configuration loading and validation for the correlator.
 *
 * <p>
 * Window sizing and every rule threshold are defined in YAML and loaded by
 * {@link com.retailsentinel.core.config.ConfigLoader} into a
 * {@link com.retailsentinel.core.config.SentinelConfig} instance, validated
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.retailsentinel.core.config;
