package com.quorum.core.store;

import java.time.Instant;
import java.util.Objects;

/**
 * One installed version of a detector store.
 *
 * <p>
 * Versions are immutable and never modified after staging. The checksum is
 * the SHA-512 of the payload the content was decoded from, which makes two
 * versions comparable byte-for-byte without keeping the payload itself.
 * </p>
 *
 * @param <T> decoded store content type
 * @since 1.0.0
 */
public final class StoreVersion<T> {

    private final StoreKind kind;
    private final String version;
    private final T content;
    private final Instant installedAt;
    private final String checksum;
    private final String packageVersion;

    public StoreVersion(StoreKind kind, String version, T content, Instant installedAt,
            String checksum, String packageVersion) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.content = Objects.requireNonNull(content, "content must not be null");
        this.installedAt = Objects.requireNonNull(installedAt, "installedAt must not be null");
        this.checksum = Objects.requireNonNull(checksum, "checksum must not be null");
        this.packageVersion = packageVersion;
    }

    public StoreKind getKind() {
        return kind;
    }

    public String getVersion() {
        return version;
    }

    public T getContent() {
        return content;
    }

    public Instant getInstalledAt() {
        return installedAt;
    }

    /**
     * @return lowercase hex SHA-512 of the source payload
     */
    public String getChecksum() {
        return checksum;
    }

    /**
     * @return version of the package this store version arrived in
     */
    public String getPackageVersion() {
        return packageVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StoreVersion<?> that))
            return false;
        return kind == that.kind
                && version.equals(that.version)
                && checksum.equals(that.checksum)
                && installedAt.equals(that.installedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, version, checksum, installedAt);
    }

    @Override
    public String toString() {
        return "StoreVersion{" +
                "kind=" + kind +
                ", version='" + version + '\'' +
                ", installedAt=" + installedAt +
                ", packageVersion='" + packageVersion + '\'' +
                '}';
    }
}
