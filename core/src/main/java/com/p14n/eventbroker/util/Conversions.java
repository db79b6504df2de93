package com.p14n.eventbroker.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Coercions used when reading configuration values.
 */
public final class Conversions {

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "on", "y", "t", "1");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "off", "n", "f", "0");

    private Conversions() {
    }

    /**
     * Parses an integer, passing {@code null} through.
     *
     * @param text the text to parse, may be null
     * @return the parsed value, or null
     * @throws NumberFormatException if the text is not an integer
     */
    public static Integer asInt(String text) {
        if (text == null) {
            return null;
        }
        return Integer.valueOf(text.trim());
    }

    /**
     * Interprets an object as a boolean.
     *
     * <p>
     * Strings are trimmed and compared case-insensitively against
     * {@code true/yes/on/y/t/1} and {@code false/no/off/n/f/0}. Numbers are true
     * when non-zero, {@code null} is false and any other object is true.
     * </p>
     *
     * @param obj the value to interpret
     * @return the boolean value
     * @throws IllegalArgumentException if a string matches neither list
     */
    public static boolean asBool(Object obj) {
        if (obj instanceof String) {
            String value = ((String) obj).trim().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(value)) {
                return true;
            }
            if (FALSE_VALUES.contains(value)) {
                return false;
            }
            throw new IllegalArgumentException("Unable to interpret value \"" + value + "\" as boolean");
        }
        if (obj instanceof Boolean) {
            return (Boolean) obj;
        }
        if (obj instanceof Number) {
            return ((Number) obj).doubleValue() != 0;
        }
        return obj != null;
    }

    /**
     * Selects the entries whose key starts with the prefix and strips the prefix
     * from their keys.
     *
     * @param config the full configuration
     * @param prefix the key prefix
     * @param <V>    the value type
     * @return the selected entries, in the iteration order of {@code config}
     */
    public static <V> Map<String, V> subconfig(Map<String, V> config, String prefix) {
        Map<String, V> subconf = new LinkedHashMap<>();
        for (Map.Entry<String, V> entry : config.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                subconf.put(entry.getKey().substring(prefix.length()), entry.getValue());
            }
        }
        return subconf;
    }
}
