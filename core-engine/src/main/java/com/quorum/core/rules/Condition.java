package com.quorum.core.rules;

import com.quorum.core.model.NormalizedLogRecord;

/**
 * Compiled node of a rule or pattern predicate.
 *
 * <p>
 * Trees are built once at staging time by {@link ConditionCompiler} and are
 * immutable afterwards, so the same tree is evaluated concurrently by every
 * detection thread.
 * </p>
 *
 * @since 1.0.0
 */
public interface Condition {

    /**
     * @param record record to test
     * @return {@code true} if the record satisfies this node
     */
    boolean matches(NormalizedLogRecord record);
}
