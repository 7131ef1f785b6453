/* (C)2026 */
package com.ammann.dockerdashboard.parser;

import com.ammann.dockerdashboard.dto.MemoryUsage;
import com.ammann.dockerdashboard.dto.NetworkUsage;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between the unit-suffixed texts printed by the Docker CLI and numbers.
 *
 * <p>None of the parse methods throw for malformed input. Percentages and network counters
 * degrade to {@code 0}, sizes and memory figures degrade to {@code null}.
 */
public final class UnitConverter {

    private UnitConverter() {}

    private static final Pattern NUMBER_PATTERN = Pattern.compile("-?\\d+(\\.\\d+)?");

    private static final Pattern SIZE_PATTERN = Pattern.compile("^([\\d.]+)([a-zA-Z]+)?$");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, Integer> BINARY_EXPONENTS =
            Map.of("kib", 1, "mib", 2, "gib", 3, "tib", 4, "pib", 5, "eib", 6);

    private static final Map<String, Integer> DECIMAL_EXPONENTS =
            Map.of("kb", 1, "mb", 2, "gb", 3, "tb", 4, "pb", 5, "eb", 6);

    private static final String[] DISPLAY_UNITS = {"B", "KiB", "MiB", "GiB", "TiB"};

    /**
     * Extracts the first decimal number of a text, e.g. {@code 12.5} from {@code "12.5%"}.
     *
     * @param text the text to scan, may be {@code null}
     * @return the number, or {@code 0} if the text contains none
     */
    public static double parsePercent(String text) {
        if (text == null) {
            return 0;
        }
        Matcher matcher = NUMBER_PATTERN.matcher(text);
        if (!matcher.find()) {
            return 0;
        }
        return Double.parseDouble(matcher.group());
    }

    /**
     * Converts a size such as {@code "1.5GiB"}, {@code "512kB"} or {@code "42B"} to bytes.
     *
     * <p>Binary units ({@code KiB} to {@code EiB}) scale by powers of 1024, decimal units
     * ({@code KB} to {@code EB}) by powers of 1000. Units are case-insensitive; a bare number
     * is taken as bytes.
     *
     * @param text the size text, may be {@code null}
     * @return the number of bytes, or {@code null} for empty text, a malformed number, an
     *     unknown unit or a size too large for a {@code double}
     */
    public static Double parseSize(String text) {
        if (text == null) {
            return null;
        }
        String normalized = WHITESPACE.matcher(text).replaceAll("");
        if (normalized.isEmpty()) {
            return null;
        }

        Matcher matcher = SIZE_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            return null;
        }

        double value;
        try {
            value = Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            // "1.2.3" passes the character class but is not a number
            return null;
        }
        if (!Double.isFinite(value)) {
            return null;
        }

        String unit = matcher.group(2) == null ? "b" : matcher.group(2).toLowerCase(Locale.ROOT);
        double scaled;
        if ("b".equals(unit)) {
            scaled = value;
        } else if (BINARY_EXPONENTS.containsKey(unit)) {
            scaled = value * Math.pow(1024, BINARY_EXPONENTS.get(unit));
        } else if (DECIMAL_EXPONENTS.containsKey(unit)) {
            scaled = value * Math.pow(1000, DECIMAL_EXPONENTS.get(unit));
        } else {
            return null;
        }
        // huge digit runs can overflow once the unit is applied
        return Double.isFinite(scaled) ? scaled : null;
    }

    /**
     * Parses a {@code "<used> / <limit>"} memory text.
     *
     * @param text the memory text, may be {@code null}
     * @return the parsed usage; all fields are {@code null} if either side is missing, and the
     *     percentage is {@code null} unless both sides parse and the limit is positive
     */
    public static MemoryUsage parseMemoryUsage(String text) {
        if (text == null) {
            return MemoryUsage.unknown();
        }
        String[] parts = text.split("/");
        String usedRaw = parts.length > 0 ? parts[0].trim() : "";
        String limitRaw = parts.length > 1 ? parts[1].trim() : "";
        if (usedRaw.isEmpty() || limitRaw.isEmpty()) {
            return MemoryUsage.unknown();
        }

        Double used = parseSize(usedRaw);
        Double limit = parseSize(limitRaw);
        if (used == null || limit == null || limit <= 0) {
            return new MemoryUsage(used, limit, null);
        }
        return new MemoryUsage(used, limit, used / limit * 100);
    }

    /**
     * Parses a {@code "<rx> / <tx>"} network text. A side that does not parse counts as no
     * traffic.
     *
     * @param text the network text, may be {@code null}
     * @return the received and transmitted bytes, never {@code null}
     */
    public static NetworkUsage parseNetworkUsage(String text) {
        if (text == null) {
            return new NetworkUsage(0, 0);
        }
        String[] parts = text.split("/");
        Double rx = parts.length > 0 ? parseSize(parts[0]) : null;
        Double tx = parts.length > 1 ? parseSize(parts[1]) : null;
        return new NetworkUsage(rx == null ? 0 : rx, tx == null ? 0 : tx);
    }

    /**
     * Formats a byte count with binary units, e.g. {@code "1.50 KiB"} or {@code "200 MiB"}.
     *
     * <p>Values of 100 or more are printed without decimals, values of 10 or more with one,
     * smaller values with two.
     *
     * @param bytes the byte count
     * @return the humanized text, {@code "0 B"} for non-finite or non-positive input
     */
    public static String formatBytes(double bytes) {
        if (!Double.isFinite(bytes) || bytes <= 0) {
            return "0 B";
        }

        double value = bytes;
        int unitIndex = 0;
        while (value >= 1024 && unitIndex < DISPLAY_UNITS.length - 1) {
            value /= 1024;
            unitIndex++;
        }

        int digits = value >= 100 ? 0 : value >= 10 ? 1 : 2;
        return String.format(Locale.ROOT, "%." + digits + "f %s", value, DISPLAY_UNITS[unitIndex]);
    }
}
