package com.quorum.core.update;

/**
 * Why an update attempt or rollback failed.
 *
 * @since 1.0.0
 */
public enum UpdateFailureReason {

    /** A payload's SHA-512 differs from its manifest entry. */
    CHECKSUM_MISMATCH("checksum_mismatch"),

    /** The manifest signature does not verify against the provisioned key. */
    SIGNATURE_INVALID("signature_invalid"),

    /** The container or a payload is malformed or fails validation. */
    PAYLOAD_INVALID("payload_invalid"),

    /** The package or one of its entries exceeds the size bound. */
    PAYLOAD_TOO_LARGE("payload_too_large"),

    /** The atomic swap itself failed; should be unreachable. */
    STORE_SWAP_FAILED("store_swap_failed"),

    /** Another attempt holds one of the touched store kinds. */
    CONCURRENT_UPDATE_REJECTED("concurrent_update_rejected"),

    /** No retained version to roll back to. */
    ROLLBACK_TARGET_UNAVAILABLE("rollback_target_unavailable");

    private final String code;

    UpdateFailureReason(String code) {
        this.code = code;
    }

    /**
     * @return stable lower-case code used in audit entries and results
     */
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
