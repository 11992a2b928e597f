/**
 * Bucket aggregation for series too long to analyse point by point.
 *
 * @since 1.0.0
 */
package com.netpulse.core.aggregation;
