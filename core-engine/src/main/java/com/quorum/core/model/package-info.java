/**
 * Domain model shared by the detection engine and the update manager.
 *
 * <ul>
 * <li>{@link com.quorum.core.model.NormalizedLogRecord}: immutable input
 * record</li>
 * <li>{@link com.quorum.core.model.DetectionFinding}: one detector's positive
 * signal</li>
 * <li>{@link com.quorum.core.model.Verdict}: fused per-record conclusion</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.quorum.core.model;
