/**
 * Joins the records of a closed window into an immutable correlation context:
 * tag/transaction matching, price and weight checks, queue peaks, inventory
 * variances and store occupancy.
 *
 * @since 1.0.0
 */
package com.retailsentinel.core.context;
