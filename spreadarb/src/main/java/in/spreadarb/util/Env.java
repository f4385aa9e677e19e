package in.spreadarb.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Typed lookups of environment overrides. A JVM system property with the same key is used
 * when the variable is unset; unparsable values fall back to the default with a warning.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String raw = lookup(key);
        return raw != null ? raw : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::valueOf);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::valueOf);
    }

    /**
     * "true", "yes" and "1" are true; "false", "no" and "0" are false.
     */
    public static boolean getBool(String key, boolean defaultValue) {
        return parse(key, defaultValue, raw -> switch (raw.toLowerCase()) {
            case "true", "yes", "1" -> Boolean.TRUE;
            case "false", "no", "0" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException(raw);
        });
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String raw = lookup(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ Ignoring {}={}: not a valid value, using {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private static String lookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private Env() {}
}
