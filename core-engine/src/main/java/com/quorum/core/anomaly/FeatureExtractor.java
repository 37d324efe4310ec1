package com.quorum.core.anomaly;

import com.quorum.core.model.NormalizedLogRecord;

import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Featurizer {@value #VERSION}: the versioned contract between normalized
 * records and anomaly models.
 *
 * <p>
 * Produces a vector of {@value #DIMENSION} values, in this order:
 * </p>
 * <ol start="0">
 * <li>raw message length in characters</li>
 * <li>whitespace-separated token count</li>
 * <li>digit ratio</li>
 * <li>uppercase ratio</li>
 * <li>ratio of characters that are neither letters, digits nor whitespace</li>
 * <li>Shannon entropy of the message characters, in bits</li>
 * <li>number of structured fields</li>
 * <li>UTC hour of the record timestamp</li>
 * </ol>
 *
 * <p>
 * Ratios are 0 for an empty message. Changing any of the above requires a new
 * version string; models declare the version they were trained against.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureExtractor {

    public static final String VERSION = "quorum-features/1";
    public static final int DIMENSION = 8;

    private FeatureExtractor() {
        // utility class, not instantiable
    }

    /**
     * @param record record to featurize; must not be {@code null}
     * @return new feature vector of length {@value #DIMENSION}
     */
    public static double[] extract(NormalizedLogRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        String message = record.getRawMessage();
        int length = message.length();

        int digits = 0;
        int upper = 0;
        int symbols = 0;
        Map<Integer, Integer> counts = new HashMap<>();
        for (int i = 0; i < length; i++) {
            char c = message.charAt(i);
            if (Character.isDigit(c)) {
                digits++;
            } else if (Character.isUpperCase(c)) {
                upper++;
            }
            if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c)) {
                symbols++;
            }
            counts.merge((int) c, 1, Integer::sum);
        }

        String trimmed = message.trim();
        int tokens = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        double[] features = new double[DIMENSION];
        features[0] = length;
        features[1] = tokens;
        features[2] = ratio(digits, length);
        features[3] = ratio(upper, length);
        features[4] = ratio(symbols, length);
        features[5] = entropy(counts, length);
        features[6] = record.getStructuredFields().size();
        features[7] = record.getTimestamp().atZone(ZoneOffset.UTC).getHour();
        return features;
    }

    private static double ratio(int part, int total) {
        return total == 0 ? 0.0 : (double) part / total;
    }

    private static double entropy(Map<Integer, Integer> counts, int total) {
        if (total == 0) {
            return 0.0;
        }
        // summed in code-point order so the result is bit-for-bit reproducible
        double entropy = 0.0;
        int[] keys = counts.keySet().stream().mapToInt(Integer::intValue).sorted().toArray();
        for (int key : keys) {
            double p = (double) counts.get(key) / total;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }
}
