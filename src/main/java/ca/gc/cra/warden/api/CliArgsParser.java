package ca.gc.cra.warden.api;

import ca.gc.cra.warden.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} overrides into the map merged over {@code warden.yaml}.
 *
 * <p>Keys use the configuration names ({@code interface}, {@code dedupWindowSeconds}, {@code otel.endpoint}). A key
 * may appear once; values keep inner spaces so {@code bpf=tcp port 80} reaches the capture filter intact.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");
  static final int MAX_VALUE_LENGTH = 4_096;

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args {@code key=value} arguments; {@code null} returns an empty map
   * @return mutable map in argument order
   * @throws IllegalArgumentException if an argument is malformed, repeated, too long or carries control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      checkValue(key, value);
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  private static void checkValue(String key, String value) {
    Strings.requireNonBlank(key, value);
    if (value.length() > MAX_VALUE_LENGTH) {
      throw new IllegalArgumentException("argument " + key + " exceeds " + MAX_VALUE_LENGTH + " characters");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
  }
}
