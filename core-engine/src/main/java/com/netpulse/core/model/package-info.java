/**
 * Domain model of the analytics engine.
 *
 * <p>
 * Inputs ({@link com.netpulse.core.model.SamplePoint},
 * {@link com.netpulse.core.model.MetricSeries},
 * {@link com.netpulse.core.model.MetricsBatch}) and the per-component results
 * assembled into an {@link com.netpulse.core.model.AnalysisReport}. All types
 * except the builders are immutable.
 * </p>
 *
 * @since 1.0.0
 */
package com.netpulse.core.model;
