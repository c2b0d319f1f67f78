package ca.gc.cra.warden.api;

import ca.gc.cra.warden.config.ConfigMerger;
import ca.gc.cra.warden.config.EngineConfig;
import ca.gc.cra.warden.config.YamlConfigLoader;
import ca.gc.cra.warden.infrastructure.metrics.TelemetrySettings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared helpers for mixing CLI {@code key=value} arguments with the YAML configuration file.
 *
 * @since 0.1.0
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Builds the effective flat configuration: CLI over the YAML file's {@code common} and mode sections over
   * defaults. Telemetry keys are split off into {@link TelemetrySettings}.
   *
   * @param cli CLI arguments; the {@code config} key is consumed
   * @param mode YAML section ({@code live} or {@code analyze})
   * @return engine values and telemetry settings
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file or a telemetry value is malformed
   */
  static Effective effectiveConfig(Map<String, String> cli, String mode) throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      yaml = YamlConfigLoader.load(EngineConfig.path("config", configPath), mode);
      if (yaml.isEmpty()) {
        throw new IllegalArgumentException("Config file not found: " + configPath);
      }
      log.info("Loaded {} configuration from {}", mode, configPath);
    }
    Map<String, String> merged = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
        yaml, cli, EngineConfig.defaultsAsMap(), log::warn));
    TelemetrySettings telemetry = TelemetrySettings.extract(merged, System.getenv());
    return new Effective(merged, telemetry);
  }

  /** Engine configuration values with the telemetry keys removed, plus the resolved telemetry settings. */
  record Effective(Map<String, String> values, TelemetrySettings telemetry) {}

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false");
    };
  }

  static Path requirePath(Map<String, String> map, String key) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return EngineConfig.path(key, value.trim());
  }
}
