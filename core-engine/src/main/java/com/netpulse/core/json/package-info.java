/**
 * Jackson-based JSON codecs for inbound metrics batches and outbound
 * analysis reports.
 *
 * @since 1.0.0
 */
package com.netpulse.core.json;
