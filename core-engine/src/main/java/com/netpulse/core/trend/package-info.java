/**
 * Least-squares trend classification.
 *
 * @since 1.0.0
 */
package com.netpulse.core.trend;
