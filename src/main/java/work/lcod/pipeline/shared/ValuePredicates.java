package work.lcod.pipeline.shared;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies loosely typed settings values (the shapes produced by the YAML loader).
 */
public final class ValuePredicates {
    public static final String UNDEFINED_NAME = "<undefined>";

    private static final Pattern POSIX_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private ValuePredicates() {}

    /**
     * True when the value reads as a human readable scalar: strings and numbers, never booleans,
     * lists, maps or null.
     */
    public static boolean isStringConvertible(Object value) {
        return value instanceof String || value instanceof Number;
    }

    /**
     * True for booleans and for the exact strings {@code true} and {@code false}.
     */
    public static boolean isBooleanConvertible(Object value) {
        if (value instanceof Boolean) {
            return true;
        }
        return value instanceof String str && ("true".equals(str) || "false".equals(str));
    }

    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String str) {
            var normalized = str.trim().toLowerCase(Locale.ROOT);
            return "true".equals(normalized) || "y".equals(normalized) || "1".equals(normalized);
        }
        if (value instanceof Number number) {
            return number.intValue() == 1;
        }
        return false;
    }

    public static boolean isPosixName(Object value) {
        return isStringConvertible(value) && POSIX_NAME.matcher(value.toString()).matches();
    }

    public static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String str) {
            return str.isBlank();
        }
        if (value instanceof List<?> list) {
            return list.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    /**
     * A declaration carrying a {@code choices} list is a choice parameter even without {@code type}.
     */
    public static boolean isProbablyChoice(Map<String, Object> item) {
        return item.containsKey("choices") && item.get("choices") instanceof List<?>;
    }

    /**
     * A declaration whose {@code default} is a boolean is a boolean parameter even without {@code type}.
     */
    public static boolean isProbablyBoolean(Map<String, Object> item) {
        return item.containsKey("default") && item.get("default") instanceof Boolean;
    }

    public static String printableKey(Map<String, Object> item, String key) {
        var value = item == null ? null : item.get(key);
        return isStringConvertible(value) ? value.toString() : UNDEFINED_NAME;
    }

    public static String printableName(Map<String, Object> item) {
        return printableKey(item, "name");
    }

    /**
     * Short lower-case type name used in diagnostics ({@code string}, {@code integer}, {@code list}...).
     */
    public static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Integer || value instanceof Long || value instanceof java.math.BigInteger) return "integer";
        if (value instanceof Number) return "float";
        if (value instanceof List<?>) return "list";
        if (value instanceof Map<?, ?>) return "map";
        return value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }
}
