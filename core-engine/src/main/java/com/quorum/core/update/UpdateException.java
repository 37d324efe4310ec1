package com.quorum.core.update;

import java.util.Objects;

/**
 * Raised inside the update pipeline when an attempt cannot proceed.
 *
 * <p>
 * Never escapes {@link UpdateManager}: the manager turns it into a
 * {@link UpdateResult} with state {@link UpdateState#FAILED}.
 * </p>
 *
 * @since 1.0.0
 */
public class UpdateException extends Exception {

    private static final long serialVersionUID = 1L;

    private final UpdateFailureReason reason;
    private final String detail;

    public UpdateException(UpdateFailureReason reason, String detail) {
        this(reason, detail, null);
    }

    public UpdateException(UpdateFailureReason reason, String detail, Throwable cause) {
        super(Objects.requireNonNull(reason, "reason must not be null").code() + ": " + detail, cause);
        this.reason = reason;
        this.detail = detail;
    }

    public UpdateFailureReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }
}
