package com.quorum.core.update;

import com.quorum.core.store.StoreKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the stores and recent update attempts.
 *
 * @since 1.0.0
 */
public final class UpdateStatus {

    private final Map<StoreKind, String> activeVersions;
    private final Map<StoreKind, List<String>> retainedVersions;
    private final List<UpdateResult> history;

    UpdateStatus(Map<StoreKind, String> activeVersions, Map<StoreKind, List<String>> retainedVersions,
            List<UpdateResult> history) {
        this.activeVersions = Collections.unmodifiableMap(new EnumMap<>(activeVersions));
        this.retainedVersions = Collections.unmodifiableMap(new EnumMap<>(retainedVersions));
        this.history = List.copyOf(history);
    }

    /**
     * @return active version per kind; kinds with an empty store are absent
     */
    public Map<StoreKind, String> getActiveVersions() {
        return activeVersions;
    }

    /**
     * @return retained rollback targets per kind, newest first
     */
    public Map<StoreKind, List<String>> getRetainedVersions() {
        return retainedVersions;
    }

    /**
     * @return recent attempt results, oldest first
     */
    public List<UpdateResult> getHistory() {
        return history;
    }

    @Override
    public String toString() {
        return "UpdateStatus{active=" + activeVersions + ", retained=" + retainedVersions
                + ", history=" + history.size() + '}';
    }
}
