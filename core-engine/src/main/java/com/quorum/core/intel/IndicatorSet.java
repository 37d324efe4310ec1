package com.quorum.core.intel;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable indicator store content with O(1) membership lookup per type.
 *
 * @since 1.0.0
 */
public final class IndicatorSet {

    private final Map<IndicatorType, Map<String, Indicator>> byType;
    private final int size;

    private IndicatorSet(Map<IndicatorType, Map<String, Indicator>> byType, int size) {
        this.byType = byType;
        this.size = size;
    }

    /**
     * Build a set from canonical indicators. Later duplicates of the same
     * (type, value) pair are ignored.
     *
     * @param indicators indicators to index
     * @return new immutable set
     */
    public static IndicatorSet of(Collection<Indicator> indicators) {
        Objects.requireNonNull(indicators, "indicators must not be null");
        Map<IndicatorType, Map<String, Indicator>> index = new EnumMap<>(IndicatorType.class);
        for (IndicatorType type : IndicatorType.values()) {
            index.put(type, new HashMap<>());
        }
        int count = 0;
        for (Indicator indicator : indicators) {
            if (index.get(indicator.getType()).putIfAbsent(indicator.getValue(), indicator) == null) {
                count++;
            }
        }
        index.replaceAll((type, values) -> Collections.unmodifiableMap(values));
        return new IndicatorSet(Collections.unmodifiableMap(index), count);
    }

    /**
     * Decode a validated payload document.
     *
     * @param document parsed indicator payload
     * @return new immutable set
     * @throws IllegalStateException if the document is invalid
     */
    public static IndicatorSet fromDocument(IndicatorDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        document.validate();
        return of(document.toIndicators());
    }

    /**
     * @param type            indicator type
     * @param canonicalValue  value already canonicalized for {@code type}
     * @return the stored indicator, or empty if not present
     */
    public Optional<Indicator> lookup(IndicatorType type, String canonicalValue) {
        return Optional.ofNullable(byType.get(type).get(canonicalValue));
    }

    public int size() {
        return size;
    }

    public int size(IndicatorType type) {
        return byType.get(type).size();
    }

    @Override
    public String toString() {
        return "IndicatorSet{size=" + size + '}';
    }
}
