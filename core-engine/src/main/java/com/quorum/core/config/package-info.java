/**
 * Engine settings loading and validation.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.quorum.core.config.SettingsLoader} into an
 * {@link com.quorum.core.config.EngineSettings} instance. Validation runs
 * automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.quorum.core.config;
