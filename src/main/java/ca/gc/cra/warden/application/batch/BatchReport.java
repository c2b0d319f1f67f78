package ca.gc.cra.warden.application.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Structured result of one offline capture analysis.
 * <p><strong>Why:</strong> Gives the CLI and any caller a fixed document shape (metadata, summary, detections, risk
 * and evidence) that serializes to snake_case JSON without ad-hoc maps.</p>
 * <p><strong>Role:</strong> Application-layer value type produced by {@link BatchAnalyzer}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists and maps are copied on construction.</p>
 *
 * @param metadata processing counters and model metadata
 * @param summary traffic summary tables
 * @param detections deduplicated heuristic and per-packet findings
 * @param risk composite risk assessment
 * @param evidence timeline and endpoint matrix
 * @since 0.1.0
 */
public record BatchReport(
    Metadata metadata, Summary summary, List<Finding> detections, Risk risk, Evidence evidence) {

  /**
   * Validates and copies the report sections.
   */
  public BatchReport {
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(risk, "risk");
    Objects.requireNonNull(evidence, "evidence");
    detections = List.copyOf(detections);
  }

  /**
   * Returns a copy of this report flagged as served from the cache.
   *
   * @param cached cache flag
   * @return report copy
   */
  public BatchReport withCached(boolean cached) {
    return new BatchReport(metadata.withCached(cached), summary, detections, risk, evidence);
  }

  /**
   * Processing metadata.
   *
   * @param packetsProcessed frames decoded and summarized
   * @param bytesProcessed captured bytes across those frames
   * @param processingTimeMs wall time spent analyzing
   * @param durationSeconds span between the first and last packet timestamps
   * @param captureWindow ISO-8601 timestamps of the first and last packet
   * @param cached whether the report was served from the cache
   * @param modelMetadata detector status and per-type detection counts
   */
  public record Metadata(
      long packetsProcessed,
      long bytesProcessed,
      long processingTimeMs,
      double durationSeconds,
      CaptureWindow captureWindow,
      boolean cached,
      ModelMetadata modelMetadata) {

    Metadata withCached(boolean flag) {
      return new Metadata(
          packetsProcessed, bytesProcessed, processingTimeMs, durationSeconds, captureWindow, flag, modelMetadata);
    }
  }

  /**
   * First and last packet timestamps.
   *
   * @param start first packet, ISO-8601 UTC; {@code null} without packets
   * @param end last packet, ISO-8601 UTC; {@code null} without packets
   */
  public record CaptureWindow(String start, String end) {}

  /**
   * Detector status recorded while replaying the capture.
   *
   * @param mlEnabled whether per-packet detectors ran
   * @param anomalyTrained whether the anomaly model was trained for the run
   * @param classificationEnabled whether a classifier is configured
   * @param classificationTrained whether the classifier has a model
   * @param classificationModelType classifier model type, or {@code none}
   * @param detectionCounts detections per type label
   * @param confidenceScores classifier malicious probabilities, one per classified packet
   * @param averageConfidence mean confidence across per-packet detections; 0 without any
   * @param packetsAnalyzed packets passed through the detectors
   */
  public record ModelMetadata(
      boolean mlEnabled,
      boolean anomalyTrained,
      boolean classificationEnabled,
      boolean classificationTrained,
      String classificationModelType,
      Map<String, Long> detectionCounts,
      List<Double> confidenceScores,
      double averageConfidence,
      long packetsAnalyzed) {

    /**
     * Copies collections.
     */
    public ModelMetadata {
      classificationModelType = Objects.requireNonNullElse(classificationModelType, "none");
      detectionCounts = Collections.unmodifiableMap(new LinkedHashMap<>(detectionCounts));
      confidenceScores = List.copyOf(confidenceScores);
    }

    /**
     * Metadata for a run without per-packet detectors.
     *
     * @return disabled metadata
     */
    public static ModelMetadata disabled() {
      Map<String, Long> counts = new LinkedHashMap<>();
      counts.put("signature", 0L);
      counts.put("anomaly", 0L);
      counts.put("classification", 0L);
      return new ModelMetadata(false, false, false, false, "none", counts, List.of(), 0d, 0L);
    }
  }

  /**
   * Traffic summary tables.
   *
   * @param topProtocols most frequent protocols
   * @param topTalkers most active addresses (as source or destination)
   * @param topPorts most frequent destination ports
   * @param dnsQueries first DNS query names seen
   * @param tlsHandshakes first TLS connection attempts seen
   * @param httpHosts most frequent HTTP Host header values
   * @param flowSamples most active (source, destination, protocol, port) flows
   * @param timeline per-minute packet and byte counts, newest first
   */
  public record Summary(
      List<ProtocolCount> topProtocols,
      List<Talker> topTalkers,
      List<PortCount> topPorts,
      List<String> dnsQueries,
      List<TlsHandshake> tlsHandshakes,
      List<String> httpHosts,
      List<FlowSample> flowSamples,
      List<TimelinePoint> timeline) {

    /**
     * Copies the tables.
     */
    public Summary {
      topProtocols = List.copyOf(topProtocols);
      topTalkers = List.copyOf(topTalkers);
      topPorts = List.copyOf(topPorts);
      dnsQueries = List.copyOf(dnsQueries);
      tlsHandshakes = List.copyOf(tlsHandshakes);
      httpHosts = List.copyOf(httpHosts);
      flowSamples = List.copyOf(flowSamples);
      timeline = List.copyOf(timeline);
    }
  }

  /** Protocol count with its share of all packets. */
  public record ProtocolCount(String name, long count, double percentage) {}

  /** Address and the packets it sent or received. */
  public record Talker(String ip, long packets) {}

  /** Destination port and its packet count. */
  public record PortCount(int port, long packets) {}

  /** TLS connection attempt. */
  public record TlsHandshake(String server, int port) {}

  /** Flow and its packet count. */
  public record FlowSample(String src, String dst, String proto, int dport, long packets) {}

  /** One-minute timeline bucket. */
  public record TimelinePoint(String bucket, long packets, long bytes) {}

  /** Source and destination pair with its packet count. */
  public record Endpoint(String src, String dst, long packets) {}

  /**
   * MITRE ATT&amp;CK reference.
   *
   * @param technique technique id such as {@code T1046}
   * @param tactic tactic name
   */
  public record Mitre(String technique, String tactic) {}

  /**
   * One reported finding.
   *
   * @param id stable finding id, e.g. {@code port_scan} or {@code ml_signature_0}
   * @param title short title
   * @param severity severity label
   * @param confidence confidence in [0, 1]
   * @param description human-readable description
   * @param evidence supporting values, in insertion order
   * @param mitre ATT&amp;CK mapping; {@code null} when none applies
   * @param mlSource detection type for per-packet findings; {@code null} for flow heuristics
   */
  public record Finding(
      String id,
      String title,
      String severity,
      double confidence,
      String description,
      Map<String, Object> evidence,
      Mitre mitre,
      String mlSource) {

    /**
     * Copies evidence preserving order.
     */
    public Finding {
      Objects.requireNonNull(id, "id");
      title = Objects.requireNonNullElse(title, "");
      severity = Objects.requireNonNullElse(severity, "low");
      evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    String evidenceText(String primary, String secondary) {
      Object value = evidence.get(primary);
      if (value == null) {
        value = evidence.get(secondary);
      }
      return value == null ? "" : value.toString();
    }
  }

  /**
   * Composite risk assessment.
   *
   * @param score score in [0, 100]
   * @param level {@code low}, {@code medium}, {@code high} or {@code critical}
   * @param rationale at most six explanatory lines
   * @param riskSource {@code classification}, {@code detections} or {@code unavailable}
   * @param classificationModelType classifier type consulted; {@code null} when unavailable
   */
  public record Risk(
      int score, String level, List<String> rationale, String riskSource, String classificationModelType) {

    /**
     * Copies rationale.
     */
    public Risk {
      rationale = List.copyOf(rationale);
    }
  }

  /**
   * Evidence tables.
   *
   * @param timeline per-minute buckets, newest first
   * @param endpointMatrix most active source and destination pairs
   */
  public record Evidence(List<TimelinePoint> timeline, List<Endpoint> endpointMatrix) {

    /**
     * Copies the tables.
     */
    public Evidence {
      timeline = List.copyOf(timeline);
      endpointMatrix = List.copyOf(endpointMatrix);
    }
  }
}
