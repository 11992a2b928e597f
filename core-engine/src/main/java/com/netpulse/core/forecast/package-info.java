/**
 * Holt-Winters forecasting with one in-memory model per device metric.
 *
 * <p>
 * {@link com.netpulse.core.forecast.ForecastEngine} owns the keyed model
 * store; {@link com.netpulse.core.forecast.HoltWintersModel} holds the
 * smoothing state of a single key.
 * </p>
 *
 * @since 1.0.0
 */
package com.netpulse.core.forecast;
