package com.quorum.core.update;

import java.util.Objects;

/**
 * One store entry of a {@link PackageManifest}: the version the payload
 * installs and its SHA-512.
 *
 * @since 1.0.0
 */
public class ManifestEntry {

    private String version;
    private String sha512;

    /** No-arg constructor required by Jackson. */
    public ManifestEntry() {
    }

    public ManifestEntry(String version, String sha512) {
        this.version = version;
        this.sha512 = sha512;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getSha512() {
        return sha512;
    }

    public void setSha512(String sha512) {
        this.sha512 = sha512;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ManifestEntry that))
            return false;
        return Objects.equals(version, that.version) && Objects.equals(sha512, that.sha512);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, sha512);
    }

    @Override
    public String toString() {
        return "ManifestEntry{version='" + version + "', sha512='" + sha512 + "'}";
    }
}
