/**
 * Indicator-of-compromise store content and atom extraction.
 *
 * @since 1.0.0
 */
package com.quorum.core.intel;
