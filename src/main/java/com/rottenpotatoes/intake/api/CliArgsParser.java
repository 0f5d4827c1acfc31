package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses {@code key=value} arguments into an ordered map and reads typed command options from it.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^-{0,2}[A-Za-z0-9._]+$");
  private static final Set<String> VERBATIM_KEYS = Set.of("text");

  private CliArgsParser() {}

  /**
   * Converts {@code key=value} tokens into a map; later duplicates win. Values are trimmed and may not
   * carry control characters, except for {@code text}, which is kept verbatim (multi-line, untrimmed, possibly
   * empty).
   *
   * @param args tokens; may be {@code null}
   * @return mutable ordered map
   * @throws IllegalArgumentException when a token is not {@code key=value} or carries control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.stripLeading();
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      String value = arg.substring(idx + 1);
      if (VERBATIM_KEYS.contains(key)) {
        map.put(key, value);
        continue;
      }
      value = value.trim();
      if (value.isEmpty()) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      if (containsControl(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, value);
    }
    return map;
  }

  /**
   * Removes and returns the YAML path given as {@code config=PATH} or {@code --config=PATH}.
   *
   * @param args parsed arguments; modified in place
   * @return configured path or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Reads a required positive integer option.
   *
   * @throws IllegalArgumentException if absent, not an integer, or not positive
   */
  static int requirePositiveInt(Map<String, String> args, String key) {
    String raw = args.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return Numbers.parseInt(key, raw, 1, 1, Integer.MAX_VALUE);
  }

  /**
   * Reads a required option verbatim.
   *
   * @throws IllegalArgumentException if absent
   */
  static String requireText(Map<String, String> args, String key) {
    String raw = args.get(key);
    if (raw == null) {
      throw new IllegalArgumentException(key + " is required");
    }
    return raw;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
