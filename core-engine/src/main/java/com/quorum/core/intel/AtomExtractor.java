package com.quorum.core.intel;

import com.quorum.core.model.NormalizedLogRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts candidate indicator atoms from a record with fixed rules.
 *
 * <p>
 * The raw message is scanned first, then every structured field value in key
 * order. Each extraction rule runs independently over the same text, so a
 * hash-like run inside a longer token and a domain covering the same
 * characters are both reported. Only repeats of the same (type, value) pair
 * are collapsed, keeping the first field they were seen in.
 * </p>
 *
 * <p>
 * The structured fields {@code process} and {@code process_name} are also
 * read as process names (base name, lowercase).
 * </p>
 *
 * @since 1.0.0
 */
public final class AtomExtractor {

    static final Set<String> PROCESS_FIELDS = Set.of("process", "process_name");

    private static final Pattern IPV4 = Pattern.compile(
            "(?<![0-9.])(?:(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}"
                    + "(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(?![0-9]|\\.[0-9])");

    private static final Pattern IPV6_CANDIDATE = Pattern.compile(
            "(?<![0-9A-Fa-f:])(?:[0-9A-Fa-f]{0,4}:){2,7}[0-9A-Fa-f]{0,4}(?![0-9A-Fa-f:])");

    private static final Pattern DOMAIN = Pattern.compile(
            "(?<![A-Za-z0-9-])(?:[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?\\.)+"
                    + "[A-Za-z]{2,63}(?![A-Za-z0-9-])");

    private static final Pattern HASH = Pattern.compile(
            "(?<![0-9A-Fa-f])(?:[0-9A-Fa-f]{64}|[0-9A-Fa-f]{40}|[0-9A-Fa-f]{32})(?![0-9A-Fa-f])");

    private static final Pattern IPV4_EXACT = Pattern.compile(
            "(?:(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)");

    private AtomExtractor() {
        // utility class, not instantiable
    }

    /**
     * Extract every candidate atom from the record.
     *
     * @param record the record to scan; must not be {@code null}
     * @return atoms in extraction order
     */
    public static List<Atom> extract(NormalizedLogRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        List<Atom> atoms = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        scan(record.getRawMessage(), NormalizedLogRecord.FIELD_RAW_MESSAGE, atoms, seen);
        for (Map.Entry<String, String> field : record.getStructuredFields().entrySet()) {
            scan(field.getValue(), field.getKey(), atoms, seen);
            if (PROCESS_FIELDS.contains(field.getKey()) && !field.getValue().isBlank()) {
                add(new Atom(IndicatorType.PROCESS, processBaseName(field.getValue()), field.getKey()),
                        atoms, seen);
            }
        }
        return atoms;
    }

    // ---------------------------------------------------------------
    // Validation helpers (shared with IndicatorType)
    // ---------------------------------------------------------------

    static boolean isIpv4(String value) {
        return IPV4_EXACT.matcher(value).matches();
    }

    /**
     * Structural IPv6 check: hex groups of at most four digits, at most one
     * {@code ::}, eight groups without it and fewer than eight with it.
     */
    static boolean isIpv6(String value) {
        if (value.indexOf(':') < 0) {
            return false;
        }
        int compressed = value.indexOf("::");
        if (compressed < 0) {
            return countGroups(value) == 8;
        }
        if (value.indexOf("::", compressed + 1) >= 0) {
            return false;
        }
        int head = countGroups(value.substring(0, compressed));
        int tail = countGroups(value.substring(compressed + 2));
        return head >= 0 && tail >= 0 && head + tail >= 1 && head + tail < 8;
    }

    /**
     * @return number of colon-separated hex groups, or -1 if any group is
     *         empty or not 1-4 hex digits
     */
    private static int countGroups(String part) {
        if (part.isEmpty()) {
            return 0;
        }
        String[] groups = part.split(":", -1);
        for (String group : groups) {
            if (group.isEmpty() || group.length() > 4
                    || !group.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
                return -1;
            }
        }
        return groups.length;
    }

    static String processBaseName(String process) {
        String trimmed = process.trim();
        int cut = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return trimmed.substring(cut + 1).toLowerCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void scan(String text, String field, List<Atom> atoms, Set<String> seen) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Matcher ipv4 = IPV4.matcher(text);
        while (ipv4.find()) {
            add(new Atom(IndicatorType.IP, ipv4.group(), field), atoms, seen);
        }
        Matcher ipv6 = IPV6_CANDIDATE.matcher(text);
        while (ipv6.find()) {
            String candidate = ipv6.group().toLowerCase(Locale.ROOT);
            if (isIpv6(candidate)) {
                add(new Atom(IndicatorType.IP, candidate, field), atoms, seen);
            }
        }
        Matcher domain = DOMAIN.matcher(text);
        while (domain.find()) {
            add(new Atom(IndicatorType.DOMAIN, domain.group().toLowerCase(Locale.ROOT), field), atoms, seen);
        }
        Matcher hash = HASH.matcher(text);
        while (hash.find()) {
            add(new Atom(IndicatorType.HASH, hash.group().toLowerCase(Locale.ROOT), field), atoms, seen);
        }
    }

    private static void add(Atom atom, List<Atom> atoms, Set<String> seen) {
        if (seen.add(atom.getType().wireName() + '\u0000' + atom.getValue())) {
            atoms.add(atom);
        }
    }
}
