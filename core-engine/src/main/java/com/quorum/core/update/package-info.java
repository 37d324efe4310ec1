/**
 * Signed offline update packages.
 *
 * <p>
 * {@link com.quorum.core.update.PackageCodec} unpacks the container,
 * {@link com.quorum.core.update.SignatureScheme} and
 * {@link com.quorum.core.update.Checksums} authenticate it,
 * {@link com.quorum.core.update.PayloadDecoder} stages the payloads and
 * {@link com.quorum.core.update.UpdateManager} drives the attempt state machine
 * and rollbacks.
 * </p>
 *
 * @since 1.0.0
 */
package com.quorum.core.update;
