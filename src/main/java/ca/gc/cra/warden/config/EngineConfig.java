package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.detect.AnomalyScorer;
import ca.gc.cra.warden.application.detect.ConfidenceTransform;
import ca.gc.cra.warden.application.detect.ConnectionPatternAnalyzer;
import ca.gc.cra.warden.application.detect.TrafficWhitelist;
import ca.gc.cra.warden.application.pipeline.CaptureSupervisor;
import ca.gc.cra.warden.application.pipeline.LiveEngine;
import ca.gc.cra.warden.validation.Net;
import ca.gc.cra.warden.validation.Numbers;
import ca.gc.cra.warden.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated engine configuration shared by the live and analyze commands.
 * <p><strong>Why:</strong> Turns the flat {@code key=value} map produced by YAML and CLI merging into typed values once,
 * so wiring code never parses strings.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param iface capture interface name, or {@code auto}
 * @param captureTimeoutMillis capture handle read timeout
 * @param snaplen capture snap length in bytes
 * @param promiscuous whether to open the interface in promiscuous mode
 * @param bpf BPF filter; empty disables filtering
 * @param whitelistIps trusted addresses and CIDR blocks
 * @param whitelistPorts trusted ports
 * @param idleTimeout connection idle timeout
 * @param sweepInterval eviction sweep interval
 * @param dedupWindow alert dedup window
 * @param anomalyThreshold anomaly detection threshold
 * @param anomalyConfidence anomaly confidence transform name ({@code abs_clamp} or {@code tanh})
 * @param classificationThreshold classification detection threshold
 * @param minSamplesForTraining samples needed before the anomaly model trains
 * @param retrainInterval periodic anomaly retrain interval
 * @param connectionWindowPackets connection-pattern window size in packets
 * @param connectionWindow connection-pattern window duration
 * @param portScanThreshold unique destination ports that trigger {@code port_scan}
 * @param floodThreshold packets to one destination that trigger {@code dos_attack}
 * @param queueCapacity ingest queue capacity
 * @param statusCheckInterval capture liveness check interval
 * @param healthCheckInterval silence tolerated before health degrades
 * @param maxRetries capture restarts before capture is disabled
 * @param retryBase restart backoff base
 * @param retryCap restart backoff cap
 * @param pcapMaxPackets default batch packet budget
 * @param pcapMaxFileMiB largest capture file accepted by {@code analyze}
 * @param signatureFile signature rules overriding the built-in set; {@code null} for built-in
 * @param anomalyModelFile persisted anomaly model
 * @param classifierModelFile classifier model; {@code null} disables classification
 * @param alertLogFile NDJSON alert log; {@code null} keeps alerts in memory
 * @param sampleFile NDJSON sample output; {@code null} disables sample collection
 * @param cacheTtl report cache TTL
 * @since 0.1.0
 */
public record EngineConfig(
    String iface,
    int captureTimeoutMillis,
    int snaplen,
    boolean promiscuous,
    String bpf,
    List<String> whitelistIps,
    List<String> whitelistPorts,
    Duration idleTimeout,
    Duration sweepInterval,
    Duration dedupWindow,
    double anomalyThreshold,
    String anomalyConfidence,
    double classificationThreshold,
    int minSamplesForTraining,
    Duration retrainInterval,
    int connectionWindowPackets,
    Duration connectionWindow,
    int portScanThreshold,
    int floodThreshold,
    int queueCapacity,
    Duration statusCheckInterval,
    Duration healthCheckInterval,
    int maxRetries,
    Duration retryBase,
    Duration retryCap,
    int pcapMaxPackets,
    int pcapMaxFileMiB,
    Path signatureFile,
    Path anomalyModelFile,
    Path classifierModelFile,
    Path alertLogFile,
    Path sampleFile,
    Duration cacheTtl) {

  static final String DEFAULT_WHITELIST_IPS = "127.0.0.1,10.0.0.0/8,192.168.0.0/16";
  static final String DEFAULT_ANOMALY_MODEL_FILE = "~/.warden/models/anomaly-model.json";
  private static final int MAX_BPF_LENGTH = 1_024;
  private static final long MAX_SECONDS = 7L * 24 * 3_600;

  /**
   * Validates cross-field constraints and copies lists.
   */
  public EngineConfig {
    iface = Strings.requireNonBlank("interface", iface);
    bpf = bpf == null ? "" : bpf.trim();
    whitelistIps = List.copyOf(whitelistIps);
    whitelistPorts = List.copyOf(whitelistPorts);
    Objects.requireNonNull(anomalyModelFile, "anomalyModelFile");
    anomalyConfidence = anomalyConfidence == null ? "abs_clamp" : anomalyConfidence.trim().toLowerCase(Locale.ROOT);
    ConfidenceTransform.named(anomalyConfidence);
    if (retryCap.compareTo(retryBase) < 0) {
      throw new IllegalArgumentException("retryCapSeconds must be >= retryBaseSeconds");
    }
    TrafficWhitelist.of(whitelistIps, whitelistPorts);
  }

  /**
   * Returns the stock configuration.
   *
   * @return defaults
   */
  public static EngineConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Returns the default values as the flat map merged beneath YAML and CLI values.
   *
   * @return ordered key/value defaults
   */
  public static Map<String, String> defaultsAsMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("interface", "auto");
    map.put("captureTimeoutMillis", "1000");
    map.put("snaplen", "65535");
    map.put("promiscuous", "true");
    map.put("bpf", "");
    map.put("whitelistIps", DEFAULT_WHITELIST_IPS);
    map.put("whitelistPorts", "");
    map.put("idleTimeoutSeconds", "300");
    map.put("sweepIntervalSeconds", "30");
    map.put("dedupWindowSeconds", "300");
    map.put("anomalyThreshold", "0.5");
    map.put("anomalyConfidence", "abs_clamp");
    map.put("classificationThreshold", "0.7");
    map.put("minSamplesForTraining", "100");
    map.put("retrainIntervalSeconds", "3600");
    map.put("connectionWindowPackets", "1000");
    map.put("connectionWindowSeconds", "60");
    map.put("portScanThreshold", "10");
    map.put("floodThreshold", "100");
    map.put("queueCapacity", "10000");
    map.put("statusCheckIntervalSeconds", "30");
    map.put("healthCheckIntervalSeconds", "30");
    map.put("maxRetries", "10");
    map.put("retryBaseSeconds", "5");
    map.put("retryCapSeconds", "60");
    map.put("pcapMaxPackets", "2000");
    map.put("pcapMaxFileMiB", "100");
    map.put("signatureFile", "");
    map.put("anomalyModelFile", DEFAULT_ANOMALY_MODEL_FILE);
    map.put("classifierModelFile", "");
    map.put("alertLogFile", "");
    map.put("sampleFile", "");
    map.put("cacheTtlSeconds", "300");
    return map;
  }

  /**
   * Parses a flat configuration map; absent or blank keys take their defaults.
   *
   * @param values merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static EngineConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = defaultsAsMap();
    if (values != null) {
      values.forEach((key, value) -> {
        if (key != null && value != null && !value.isBlank()) {
          kv.put(key, value);
        }
      });
    }
    return new EngineConfig(
        kv.get("interface"),
        intIn(kv, "captureTimeoutMillis", 0, 60_000),
        intIn(kv, "snaplen", 64, 262_144),
        bool(kv, "promiscuous"),
        bpf(kv.get("bpf")),
        Strings.splitList(kv.get("whitelistIps")),
        ports(kv.get("whitelistPorts")),
        seconds(kv, "idleTimeoutSeconds", 1),
        seconds(kv, "sweepIntervalSeconds", 1),
        seconds(kv, "dedupWindowSeconds", 0),
        doubleIn(kv, "anomalyThreshold", 0d, 1d),
        kv.get("anomalyConfidence"),
        doubleIn(kv, "classificationThreshold", 0d, 1d),
        intIn(kv, "minSamplesForTraining", 2, AnomalyScorer.Settings.DEFAULT_BUFFER_CAPACITY),
        seconds(kv, "retrainIntervalSeconds", 1),
        intIn(kv, "connectionWindowPackets", 1, 1_000_000),
        seconds(kv, "connectionWindowSeconds", 1),
        intIn(kv, "portScanThreshold", 1, 65_535),
        intIn(kv, "floodThreshold", 1, 1_000_000),
        intIn(kv, "queueCapacity", 1, 10_000_000),
        seconds(kv, "statusCheckIntervalSeconds", 1),
        seconds(kv, "healthCheckIntervalSeconds", 1),
        intIn(kv, "maxRetries", 0, 1_000),
        seconds(kv, "retryBaseSeconds", 1),
        seconds(kv, "retryCapSeconds", 1),
        intIn(kv, "pcapMaxPackets", 1, 10_000_000),
        intIn(kv, "pcapMaxFileMiB", 1, 102_400),
        optionalPath("signatureFile", kv.get("signatureFile")),
        path("anomalyModelFile", kv.get("anomalyModelFile")),
        optionalPath("classifierModelFile", kv.get("classifierModelFile")),
        optionalPath("alertLogFile", kv.get("alertLogFile")),
        optionalPath("sampleFile", kv.get("sampleFile")),
        seconds(kv, "cacheTtlSeconds", 1));
  }

  /**
   * Builds the traffic whitelist.
   *
   * @return whitelist
   */
  public TrafficWhitelist whitelist() {
    return TrafficWhitelist.of(whitelistIps, whitelistPorts);
  }

  /**
   * Builds anomaly scorer settings.
   *
   * @return settings
   */
  public AnomalyScorer.Settings anomalySettings() {
    return new AnomalyScorer.Settings(
        AnomalyScorer.Settings.DEFAULT_BUFFER_CAPACITY, minSamplesForTraining, anomalyThreshold);
  }

  /**
   * Resolves the anomaly confidence transform.
   *
   * @return transform
   */
  public ConfidenceTransform confidenceTransform() {
    return ConfidenceTransform.named(anomalyConfidence);
  }

  /**
   * Builds connection-pattern settings.
   *
   * @return settings
   */
  public ConnectionPatternAnalyzer.Settings connectionSettings() {
    return new ConnectionPatternAnalyzer.Settings(
        connectionWindowPackets, connectionWindow, portScanThreshold, floodThreshold);
  }

  /**
   * Builds live engine settings.
   *
   * @return settings
   */
  public LiveEngine.Settings liveSettings() {
    return new LiveEngine.Settings(
        queueCapacity,
        sweepInterval,
        statusCheckInterval,
        healthCheckInterval,
        new CaptureSupervisor.Settings(maxRetries, retryBase, retryCap));
  }

  /**
   * Returns the largest accepted capture file in bytes.
   *
   * @return byte limit
   */
  public long pcapMaxFileBytes() {
    return pcapMaxFileMiB * 1_024L * 1_024L;
  }

  private static int intIn(Map<String, String> kv, String key, int min, int max) {
    return (int) Numbers.requireRange(key, Numbers.parseLong(key, kv.get(key)), min, max);
  }

  private static double doubleIn(Map<String, String> kv, String key, double min, double max) {
    return Numbers.requireRange(key, Numbers.parseDouble(key, kv.get(key)), min, max);
  }

  private static Duration seconds(Map<String, String> kv, String key, long min) {
    return Duration.ofSeconds(Numbers.requireRange(key, Numbers.parseLong(key, kv.get(key)), min, MAX_SECONDS));
  }

  private static boolean bool(Map<String, String> kv, String key) {
    String raw = kv.get(key).trim().toLowerCase(Locale.ROOT);
    return switch (raw) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
    };
  }

  private static String bpf(String raw) {
    if (raw == null || raw.isBlank()) {
      return "";
    }
    String filter = Strings.requirePrintableAscii("bpf", raw, MAX_BPF_LENGTH);
    if (filter.contains(";") || filter.contains("`")) {
      throw new IllegalArgumentException("bpf expression contains disallowed characters");
    }
    return filter;
  }

  private static List<String> ports(String raw) {
    List<String> ports = Strings.splitList(raw);
    for (String port : ports) {
      Net.parsePort(port);
    }
    return ports;
  }

  private static Path optionalPath(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    return path(name, raw);
  }

  /**
   * Resolves a configured path, expanding a leading {@code ~} to the user's home directory.
   *
   * @param name key name used in error messages
   * @param raw configured value
   * @return absolute normalized path
   * @throws IllegalArgumentException if the value is blank or not a valid path
   */
  public static Path path(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    if (value.equals("~") || value.startsWith("~/")) {
      value = System.getProperty("user.home", ".") + value.substring(1);
    }
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }
}
