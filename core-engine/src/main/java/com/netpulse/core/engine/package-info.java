/**
 * Entry point that fans a device's metrics out across the analytics
 * components and assembles the report.
 *
 * @since 1.0.0
 */
package com.netpulse.core.engine;
