/**
 * Classical (moving-average based) seasonal decomposition.
 *
 * @since 1.0.0
 */
package com.netpulse.core.seasonal;
