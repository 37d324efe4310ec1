package com.quorum.core.update;

import com.quorum.core.store.StoreKind;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link UpdateManager#submit} or {@link UpdateManager#rollback}.
 *
 * <p>
 * {@code reason} and {@code detail} are set only when {@code finalState} is
 * {@link UpdateState#FAILED}, except for a no-op rollback which reports
 * {@link UpdateState#ROLLED_BACK} with a detail explaining why nothing
 * changed.
 * </p>
 *
 * @since 1.0.0
 */
public final class UpdateResult {

    private final String attemptId;
    private final String action;
    private final UpdateState finalState;
    private final UpdateFailureReason reason;
    private final String detail;
    private final String packageVersion;
    private final List<StoreKind> storeKinds;
    private final Instant completedAt;

    UpdateResult(String attemptId, String action, UpdateState finalState, UpdateFailureReason reason,
            String detail, String packageVersion, List<StoreKind> storeKinds, Instant completedAt) {
        this.attemptId = Objects.requireNonNull(attemptId, "attemptId must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.finalState = Objects.requireNonNull(finalState, "finalState must not be null");
        this.reason = reason;
        this.detail = detail;
        this.packageVersion = packageVersion;
        this.storeKinds = List.copyOf(storeKinds);
        this.completedAt = Objects.requireNonNull(completedAt, "completedAt must not be null");
    }

    public boolean isSuccess() {
        return finalState != UpdateState.FAILED;
    }

    public String getAttemptId() {
        return attemptId;
    }

    public String getAction() {
        return action;
    }

    public UpdateState getFinalState() {
        return finalState;
    }

    /**
     * @return failure reason, or {@code null} if the attempt did not fail
     */
    public UpdateFailureReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    public String getPackageVersion() {
        return packageVersion;
    }

    public List<StoreKind> getStoreKinds() {
        return storeKinds;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "UpdateResult{" +
                "attemptId='" + attemptId + '\'' +
                ", action='" + action + '\'' +
                ", finalState=" + finalState +
                (reason != null ? ", reason=" + reason : "") +
                (detail != null ? ", detail='" + detail + '\'' : "") +
                ", packageVersion='" + packageVersion + '\'' +
                ", storeKinds=" + storeKinds +
                '}';
    }
}
