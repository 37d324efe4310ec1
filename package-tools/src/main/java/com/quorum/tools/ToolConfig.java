package com.quorum.tools;

import com.quorum.core.config.EngineSettings;

import java.util.Objects;

/**
 * Typed, immutable configuration for the package authoring tools.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the tools can run from a shell on the authoring workstation without any
 * configuration file.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} from the command line, or the
 * {@link Builder} in tests. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ToolConfig {

    public static final String ENV_SIGNING_KEY = "QUORUM_SIGNING_KEY";
    public static final String ENV_KEY_SIZE = "QUORUM_KEY_SIZE";
    public static final String ENV_MAX_PACKAGE_BYTES = "QUORUM_MAX_PACKAGE_BYTES";

    public static final int DEFAULT_KEY_SIZE = 3072;
    public static final int MIN_KEY_SIZE = 2048;

    private final String signingKeyPath;
    private final int keySize;
    private final long maxPackageBytes;

    private ToolConfig(Builder b) {
        this.signingKeyPath = b.signingKeyPath;
        this.keySize = b.keySize;
        this.maxPackageBytes = b.maxPackageBytes;
    }

    // ---------------------------------------------------------------
    // Factory, resolved from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ToolConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ToolConfig fromEnvironment() {
        try {
            return new Builder()
                    .signingKeyPath(env(ENV_SIGNING_KEY, ""))
                    .keySize(parseIntEnv(ENV_KEY_SIZE, String.valueOf(DEFAULT_KEY_SIZE)))
                    .maxPackageBytes(parseLongEnv(ENV_MAX_PACKAGE_BYTES,
                            String.valueOf(EngineSettings.DEFAULT_MAX_PACKAGE_BYTES)))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return PKCS#8 PEM private key path, or an empty string if not configured
     */
    public String getSigningKeyPath() {
        return signingKeyPath;
    }

    public boolean hasSigningKey() {
        return !signingKeyPath.isBlank();
    }

    public int getKeySize() {
        return keySize;
    }

    public long getMaxPackageBytes() {
        return maxPackageBytes;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ToolConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the key size is at least
     * {@value ToolConfig#MIN_KEY_SIZE} bits and the package bound is positive.
     * </p>
     */
    public static class Builder {
        private String signingKeyPath = "";
        private int keySize = DEFAULT_KEY_SIZE;
        private long maxPackageBytes = EngineSettings.DEFAULT_MAX_PACKAGE_BYTES;

        public Builder signingKeyPath(String v) {
            this.signingKeyPath = v;
            return this;
        }

        public Builder keySize(int v) {
            this.keySize = v;
            return this;
        }

        public Builder maxPackageBytes(long v) {
            this.maxPackageBytes = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ToolConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ToolConfig build() {
            Objects.requireNonNull(signingKeyPath, "signingKeyPath required (may be empty)");
            if (keySize < MIN_KEY_SIZE) {
                throw new IllegalArgumentException(
                        "keySize must be >= " + MIN_KEY_SIZE + ", got: " + keySize);
            }
            if (maxPackageBytes < 1) {
                throw new IllegalArgumentException(
                        "maxPackageBytes must be >= 1, got: " + maxPackageBytes);
            }
            return new ToolConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ToolConfig{" +
                "signingKeyPath='" + signingKeyPath + '\'' +
                ", keySize=" + keySize +
                ", maxPackageBytes=" + maxPackageBytes +
                '}';
    }
}
