/**
 * Standalone runtime: the correlator facade, its processing thread and
 * bounded queue, batch replay, the TCP stream client and the dashboard
 * endpoint.
 *
 * @since 1.0.0
 */
package com.retailsentinel.core.runtime;
