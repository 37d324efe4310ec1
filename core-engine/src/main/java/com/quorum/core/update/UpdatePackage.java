package com.quorum.core.update;

import com.quorum.core.store.StoreKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unpacked container: the exact manifest bytes, the signature over them and
 * the raw payload of every store kind present. Nothing here is trusted yet.
 *
 * @since 1.0.0
 */
public final class UpdatePackage {

    private final byte[] manifestBytes;
    private final Map<StoreKind, byte[]> payloads;
    private final byte[] signature;

    public UpdatePackage(byte[] manifestBytes, Map<StoreKind, byte[]> payloads, byte[] signature) {
        this.manifestBytes = Objects.requireNonNull(manifestBytes, "manifestBytes must not be null").clone();
        this.signature = Objects.requireNonNull(signature, "signature must not be null").clone();
        Map<StoreKind, byte[]> copy = new EnumMap<>(StoreKind.class);
        Objects.requireNonNull(payloads, "payloads must not be null")
                .forEach((kind, bytes) -> copy.put(kind, bytes.clone()));
        this.payloads = Collections.unmodifiableMap(copy);
    }

    public byte[] getManifestBytes() {
        return manifestBytes.clone();
    }

    /**
     * @return payload bytes per kind; arrays are shared, callers must not
     *         modify them
     */
    public Map<StoreKind, byte[]> getPayloads() {
        return payloads;
    }

    public byte[] getSignature() {
        return signature.clone();
    }

    @Override
    public String toString() {
        return "UpdatePackage{manifest=" + manifestBytes.length + "B, payloads=" + payloads.keySet()
                + ", signature=" + signature.length + "B}";
    }
}
