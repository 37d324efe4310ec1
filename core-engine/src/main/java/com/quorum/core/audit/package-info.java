/**
 * Append-only audit trail of update attempts and rollbacks.
 *
 * @since 1.0.0
 */
package com.quorum.core.audit;
