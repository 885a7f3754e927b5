package ca.gc.cra.ingest.config;

import ca.gc.cra.ingest.validation.Numbers;
import java.util.Locale;
import java.util.Map;

/**
 * Typed lookups over flattened configuration maps.
 */
final class ConfigValues {
  private ConfigValues() {}

  static long longValue(Map<String, String> values, String key, long defaultValue, long min, long max) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.trim().replace("_", ""));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
    return Numbers.requireRange(key, parsed, min, max);
  }

  static int intValue(Map<String, String> values, String key, int defaultValue, int min, int max) {
    return (int) longValue(values, key, defaultValue, min, max);
  }

  static boolean booleanValue(Map<String, String> values, String key, boolean defaultValue) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }
}
