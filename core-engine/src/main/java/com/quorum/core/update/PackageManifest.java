package com.quorum.core.update;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.quorum.core.store.StoreKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Signed description of an update package.
 *
 * <pre>
 * {
 *   "formatVersion": 1,
 *   "packageVersion": "2024.06.1",
 *   "createdAt": "2024-06-01T00:00:00Z",
 *   "stores": {
 *     "indicator": {"version": "ioc-118", "sha512": "9b71d2..."}
 *   }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"formatVersion", "packageVersion", "createdAt", "stores"})
public class PackageManifest {

    public static final int FORMAT_VERSION = 1;

    private static final Pattern SHA512_HEX = Pattern.compile("[0-9a-f]{" + Checksums.HEX_LENGTH + "}");

    private int formatVersion;
    private String packageVersion;
    private Instant createdAt;
    private Map<String, ManifestEntry> stores = new LinkedHashMap<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the manifest, collecting all errors.
     *
     * @return entries keyed by store kind, in kind order
     * @throws IllegalStateException if the manifest is invalid
     */
    public Map<StoreKind, ManifestEntry> validate() {
        List<String> errors = new ArrayList<>();
        Map<StoreKind, ManifestEntry> byKind = new EnumMap<>(StoreKind.class);

        if (formatVersion != FORMAT_VERSION) {
            errors.add("Unsupported formatVersion " + formatVersion + " (expected " + FORMAT_VERSION + ")");
        }
        if (packageVersion == null || packageVersion.isBlank()) {
            errors.add("'packageVersion' is required");
        }
        if (createdAt == null) {
            errors.add("'createdAt' is required");
        }
        if (stores == null || stores.isEmpty()) {
            errors.add("'stores' must list at least one store");
        } else {
            stores.forEach((name, entry) -> {
                StoreKind kind;
                try {
                    kind = StoreKind.fromWireName(name);
                } catch (IllegalArgumentException e) {
                    errors.add("Unknown store kind: '" + name + "'");
                    return;
                }
                if (!kind.wireName().equals(name)) {
                    errors.add("Store kind must be written '" + kind.wireName() + "', got: '" + name + "'");
                    return;
                }
                if (entry == null) {
                    errors.add("Store '" + name + "' has no entry");
                    return;
                }
                if (entry.getVersion() == null || entry.getVersion().isBlank()) {
                    errors.add("Store '" + name + "' is missing 'version'");
                }
                if (entry.getSha512() == null || !SHA512_HEX.matcher(entry.getSha512()).matches()) {
                    errors.add("Store '" + name + "' has a malformed 'sha512'");
                }
                byKind.put(kind, entry);
            });
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid manifest: " + String.join("; ", errors));
        }
        return Collections.unmodifiableMap(byKind);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getFormatVersion() {
        return formatVersion;
    }

    public void setFormatVersion(int formatVersion) {
        this.formatVersion = formatVersion;
    }

    public String getPackageVersion() {
        return packageVersion;
    }

    public void setPackageVersion(String packageVersion) {
        this.packageVersion = packageVersion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Map<String, ManifestEntry> getStores() {
        return stores;
    }

    public void setStores(Map<String, ManifestEntry> stores) {
        this.stores = stores;
    }

    @Override
    public String toString() {
        return "PackageManifest{formatVersion=" + formatVersion + ", packageVersion='" + packageVersion
                + "', createdAt=" + createdAt + ", stores=" + stores + '}';
    }
}
