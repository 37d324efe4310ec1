/**
 * Versioned detector stores and the snapshot handle shared by detection and
 * updates.
 *
 * @since 1.0.0
 */
package com.quorum.core.store;
