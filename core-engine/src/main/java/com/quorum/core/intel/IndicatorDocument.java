package com.quorum.core.intel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JSON payload of an indicator store update.
 *
 * <pre>
 * {"indicators": [
 *   {"type": "ip", "value": "203.0.113.7", "source": "feed-a"},
 *   {"type": "domain", "value": "evil.example"}
 * ]}
 * </pre>
 *
 * @since 1.0.0
 */
public class IndicatorDocument {

    private List<Entry> indicators = new ArrayList<>();

    public List<Entry> getIndicators() {
        return Collections.unmodifiableList(indicators);
    }

    public void setIndicators(List<Entry> indicators) {
        this.indicators = indicators != null ? new ArrayList<>(indicators) : new ArrayList<>();
    }

    /**
     * Validate every entry, collecting all errors.
     *
     * @throws IllegalStateException if any entry is malformed
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < indicators.size(); i++) {
            Entry entry = indicators.get(i);
            if (entry == null) {
                errors.add("Indicator at index " + i + " is null");
                continue;
            }
            try {
                entry.toIndicator();
            } catch (IllegalArgumentException e) {
                errors.add("Indicator at index " + i + ": " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid indicator payload: " + String.join("; ", errors));
        }
    }

    List<Indicator> toIndicators() {
        return indicators.stream().map(Entry::toIndicator).toList();
    }

    /**
     * One indicator as written in the payload.
     */
    public static class Entry {
        private String type;
        private String value;
        private String source;
        private String description;

        public Entry() {
        }

        public Entry(String type, String value) {
            this.type = type;
            this.value = value;
        }

        Indicator toIndicator() {
            return new Indicator(IndicatorType.fromWireName(type), value, source, description);
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }
}
