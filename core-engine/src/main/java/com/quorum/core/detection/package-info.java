/**
 * Detection techniques and severity fusion.
 *
 * <p>
 * {@link com.quorum.core.detection.DetectionEngine} runs the detectors
 * created by {@link com.quorum.core.detection.DetectorFactory} against one
 * store snapshot per record and fuses their findings with
 * {@link com.quorum.core.detection.SeverityFusion}.
 * </p>
 *
 * @since 1.0.0
 */
package com.quorum.core.detection;
