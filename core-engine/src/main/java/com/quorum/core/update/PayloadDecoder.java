package com.quorum.core.update;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quorum.core.anomaly.AnomalyModelDefinition;
import com.quorum.core.anomaly.AnomalyModels;
import com.quorum.core.intel.IndicatorDocument;
import com.quorum.core.intel.IndicatorSet;
import com.quorum.core.rules.PatternDocument;
import com.quorum.core.rules.PatternSet;
import com.quorum.core.rules.RuleDocument;
import com.quorum.core.rules.RuleSet;
import com.quorum.core.store.StoreKind;
import com.quorum.core.store.StoreVersion;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * Decodes a verified payload into a candidate {@link StoreVersion}.
 *
 * <p>
 * Decoding is strict: unknown JSON properties, duplicate keys and any
 * structural validation error reject the payload. Nothing decoded here is
 * visible to detection until the update manager commits it.
 * </p>
 *
 * @since 1.0.0
 */
public final class PayloadDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
            .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);

    private PayloadDecoder() {
        // utility class, not instantiable
    }

    /**
     * @param kind           store kind the payload was filed under
     * @param entry          manifest entry for the payload
     * @param payload        verified payload bytes
     * @param packageVersion version of the enclosing package
     * @param installedAt    install timestamp for the new version
     * @return staged version
     * @throws UpdateException {@code PAYLOAD_INVALID} with the decoding or
     *                         validation error as detail
     */
    public static StoreVersion<?> decode(StoreKind kind, ManifestEntry entry, byte[] payload,
            String packageVersion, Instant installedAt) throws UpdateException {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(entry, "entry must not be null");
        try {
            return switch (kind) {
                case INDICATOR -> version(kind, entry, packageVersion, installedAt,
                        IndicatorSet.fromDocument(read(payload, IndicatorDocument.class)));
                case RULE -> version(kind, entry, packageVersion, installedAt,
                        RuleSet.fromDocument(read(payload, RuleDocument.class)));
                case PATTERN -> version(kind, entry, packageVersion, installedAt,
                        PatternSet.fromDocument(read(payload, PatternDocument.class)));
                case ANOMALY_MODEL -> version(kind, entry, packageVersion, installedAt,
                        AnomalyModels.load(read(payload, AnomalyModelDefinition.class)));
            };
        } catch (IOException e) {
            throw new UpdateException(UpdateFailureReason.PAYLOAD_INVALID,
                    kind + " payload is not valid JSON for its schema: " + e.getMessage(), e);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new UpdateException(UpdateFailureReason.PAYLOAD_INVALID,
                    kind + " payload rejected: " + e.getMessage(), e);
        }
    }

    private static <T> T read(byte[] payload, Class<T> type) throws IOException {
        T document = MAPPER.readValue(payload, type);
        if (document == null) {
            throw new IllegalStateException("payload is empty");
        }
        return document;
    }

    private static <T> StoreVersion<T> version(StoreKind kind, ManifestEntry entry, String packageVersion,
            Instant installedAt, T content) {
        return new StoreVersion<>(kind, entry.getVersion(), content, installedAt, entry.getSha512(),
                packageVersion);
    }
}
