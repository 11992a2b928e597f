/**
 * Error taxonomy shared by all analytics components.
 *
 * @since 1.0.0
 */
package com.netpulse.core.error;
