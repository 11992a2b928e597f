/**
 * Descriptive statistics shared by the trend, anomaly and orchestration
 * layers.
 *
 * @since 1.0.0
 */
package com.netpulse.core.statistics;
