package com.quorum.core.detection;

import com.quorum.core.model.Verdict;

/**
 * Outbound port to the storage collaborator that persists verdicts.
 *
 * <p>
 * A verdict for a record id replaces any earlier one; implementations must be
 * safe for concurrent use.
 * </p>
 */
@FunctionalInterface
public interface VerdictSink {

    void accept(Verdict verdict);
}
