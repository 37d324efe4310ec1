/**
 * Anomaly model content and the versioned featurizer contract.
 *
 * @since 1.0.0
 */
package com.quorum.core.anomaly;
