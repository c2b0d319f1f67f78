package ca.gc.cra.warden.infrastructure.metrics;

import ca.gc.cra.warden.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Where WARDEN's counters and histograms go: an OTLP collector or nowhere.
 *
 * <p>Each value is read from the merged configuration first ({@code metricsExporter}, {@code otelEndpoint},
 * {@code otelResourceAttributes}, {@code metricsIntervalSeconds}, or their nested {@code otel.*} spellings in
 * {@code warden.yaml}), then from the standard {@code OTEL_*} environment variables. Configured values are strict;
 * an unsupported exporter inherited from the environment only logs a warning, since other processes on the host
 * may share it.</p>
 *
 * @param exporter exporter kind
 * @param endpoint OTLP gRPC endpoint
 * @param exportInterval period between exports
 * @param resourceAttributes extra resource attributes, in declaration order
 * @since 0.1.0
 */
public record TelemetrySettings(
    Exporter exporter, URI endpoint, Duration exportInterval, Map<String, String> resourceAttributes) {
  private static final Logger log = LoggerFactory.getLogger(TelemetrySettings.class);

  public static final String EXPORTER_KEY = "metricsExporter";
  public static final String ENDPOINT_KEY = "otelEndpoint";
  public static final String RESOURCE_ATTRIBUTES_KEY = "otelResourceAttributes";
  public static final String INTERVAL_KEY = "metricsIntervalSeconds";

  /** Every key consumed by {@link #extract(Map, Map)}, including the nested YAML spellings. */
  public static final List<String> KEYS = List.of(
      EXPORTER_KEY, "otel.exporter",
      ENDPOINT_KEY, "otel.endpoint",
      RESOURCE_ATTRIBUTES_KEY, "otel.resourceAttributes",
      INTERVAL_KEY, "otel.intervalSeconds");

  static final URI DEFAULT_ENDPOINT = URI.create("http://localhost:4317");
  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;
  private static final long MAX_INTERVAL_SECONDS = 3_600;

  /** Metrics destination. */
  public enum Exporter {
    OTLP,
    NONE;

    static Exporter parse(String raw) {
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException(EXPORTER_KEY + " must be 'otlp' or 'none'");
      };
    }
  }

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(exportInterval, "exportInterval");
    resourceAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(resourceAttributes));
  }

  /**
   * Settings that export nothing; used by tests and {@code metricsExporter=none}.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, DEFAULT_ENDPOINT, DEFAULT_INTERVAL, Map.of());
  }

  /**
   * Removes the telemetry keys from {@code config} and resolves them against {@code env}.
   *
   * @param config mutable merged configuration; telemetry keys are consumed
   * @param env environment variables, usually {@link System#getenv()}
   * @return validated settings
   * @throws IllegalArgumentException if a configured value is malformed
   */
  public static TelemetrySettings extract(Map<String, String> config, Map<String, String> env) {
    String exporter = take(config, EXPORTER_KEY, "otel.exporter");
    String endpoint = take(config, ENDPOINT_KEY, "otel.endpoint");
    String attributes = take(config, RESOURCE_ATTRIBUTES_KEY, "otel.resourceAttributes");
    String interval = take(config, INTERVAL_KEY, "otel.intervalSeconds");

    Exporter mode;
    if (exporter != null) {
      mode = Exporter.parse(exporter);
    } else {
      mode = fromEnvironment(env.get("OTEL_METRICS_EXPORTER"));
    }
    URI uri = endpoint != null
        ? parseEndpoint(endpoint)
        : envEndpoint(env.get("OTEL_EXPORTER_OTLP_ENDPOINT"));
    String rawAttributes = attributes != null ? attributes : blankToNull(env.get("OTEL_RESOURCE_ATTRIBUTES"));
    Map<String, String> parsed = rawAttributes == null ? Map.of() : parseResourceAttributes(rawAttributes);
    return new TelemetrySettings(mode, uri, parseInterval(interval), parsed);
  }

  public boolean enabled() {
    return exporter == Exporter.OTLP;
  }

  /**
   * One-line summary for the dry-run plan and startup log.
   *
   * @return {@code none} or {@code otlp -> endpoint every Ns}
   */
  public String describe() {
    if (!enabled()) {
      return "none";
    }
    return "otlp -> " + endpoint + " every " + exportInterval.toSeconds() + "s";
  }

  static Map<String, String> parseResourceAttributes(String raw) {
    Strings.requirePrintableAscii(RESOURCE_ATTRIBUTES_KEY, raw.trim(), MAX_RESOURCE_ATTRIBUTES_LENGTH);
    Map<String, String> out = new LinkedHashMap<>();
    for (String entry : Strings.splitList(raw)) {
      int idx = entry.indexOf('=');
      String key = idx > 0 ? entry.substring(0, idx).trim() : "";
      String value = idx > 0 ? entry.substring(idx + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute entry: {}", entry);
        continue;
      }
      out.put(key, value);
    }
    return out;
  }

  private static Exporter fromEnvironment(String raw) {
    if (raw == null || raw.isBlank()) {
      return Exporter.OTLP;
    }
    try {
      return Exporter.parse(raw);
    } catch (IllegalArgumentException ex) {
      log.warn("OTEL_METRICS_EXPORTER={} is not supported by WARDEN; exporting over otlp", raw);
      return Exporter.OTLP;
    }
  }

  private static URI envEndpoint(String raw) {
    if (raw == null || raw.isBlank()) {
      return DEFAULT_ENDPOINT;
    }
    return parseEndpoint(raw);
  }

  private static URI parseEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw.trim());
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(ENDPOINT_KEY + " must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException(ENDPOINT_KEY + " must use http or https");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(ENDPOINT_KEY + " must include a host");
    }
    return uri;
  }

  private static Duration parseInterval(String raw) {
    if (raw == null) {
      return DEFAULT_INTERVAL;
    }
    long seconds;
    try {
      seconds = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(INTERVAL_KEY + " must be a whole number of seconds", ex);
    }
    if (seconds < 1 || seconds > MAX_INTERVAL_SECONDS) {
      throw new IllegalArgumentException(INTERVAL_KEY + " must be between 1 and " + MAX_INTERVAL_SECONDS);
    }
    return Duration.ofSeconds(seconds);
  }

  // The flat key wins over its nested spelling; both are removed either way.
  private static String take(Map<String, String> config, String key, String alias) {
    String primary = blankToNull(config.remove(key));
    String nested = blankToNull(config.remove(alias));
    return primary != null ? primary : nested;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
