/**
 * Configuration of the analytics engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.netpulse.core.config.AnalyticsConfigLoader} into an
 * {@link com.netpulse.core.config.AnalyticsConfig}, one nested bean per
 * component. Validation runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.netpulse.core.config;
