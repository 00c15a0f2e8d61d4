/**
 * Parsing of raw record JSON and of the reference CSV files.
 *
 * @since 1.0.0
 */
package com.retailsentinel.core.ingest;
