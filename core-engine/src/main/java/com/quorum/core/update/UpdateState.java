package com.quorum.core.update;

/**
 * States of one update attempt.
 *
 * <pre>
 * RECEIVED -> VERIFIED -> STAGED -> COMMITTED
 *     \          \           \
 *      +----------+-----------+--> FAILED
 * </pre>
 *
 * {@link #ROLLED_BACK} is reached only through an operator rollback.
 *
 * @since 1.0.0
 */
public enum UpdateState {
    RECEIVED,
    VERIFIED,
    STAGED,
    COMMITTED,
    FAILED,
    ROLLED_BACK;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED || this == ROLLED_BACK;
    }
}
