package ca.gc.cra.warden.application.batch;

import ca.gc.cra.warden.application.batch.BatchReport.CaptureWindow;
import ca.gc.cra.warden.application.batch.BatchReport.Endpoint;
import ca.gc.cra.warden.application.batch.BatchReport.Evidence;
import ca.gc.cra.warden.application.batch.BatchReport.FlowSample;
import ca.gc.cra.warden.application.batch.BatchReport.PortCount;
import ca.gc.cra.warden.application.batch.BatchReport.ProtocolCount;
import ca.gc.cra.warden.application.batch.BatchReport.Summary;
import ca.gc.cra.warden.application.batch.BatchReport.Talker;
import ca.gc.cra.warden.application.batch.BatchReport.TimelinePoint;
import ca.gc.cra.warden.application.batch.BatchReport.TlsHandshake;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.domain.net.Protocol;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * <strong>What:</strong> Single-pass traffic counters for one offline capture.
 * <p><strong>Why:</strong> The summary tables and the flow heuristics both read the same aggregates, so they are
 * built once while the frames stream past.</p>
 * <p><strong>Role:</strong> Batch-side accumulator owned by one {@link BatchAnalyzer} run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Count protocols, talkers, destination ports, flows and endpoint pairs.</li>
 *   <li>Record DNS names, TLS connection attempts, HTTP hosts and payload entropy observations.</li>
 *   <li>Bucket packets and bytes per UTC minute.</li>
 * </ul>
 * <p>Every ranking sorts by count descending; equal counts keep first-appearance order.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per run.</p>
 *
 * @since 0.1.0
 */
final class FlowAggregates {
  static final int TOP_LIMIT = 6;
  static final int DNS_LIMIT = 20;
  static final int TLS_LIMIT = 10;
  static final int HTTP_HOST_LIMIT = 10;
  static final int TIMELINE_LIMIT = 60;
  static final int ENDPOINT_LIMIT = 12;
  static final int TLS_PORT = 443;

  private static final DateTimeFormatter ISO_SECONDS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter ISO_MICROS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSXXX").withZone(ZoneOffset.UTC);

  private final Map<String, Long> protocols = new LinkedHashMap<>();
  private final Map<String, Long> sources = new LinkedHashMap<>();
  private final Map<String, Long> destinations = new LinkedHashMap<>();
  private final Map<Integer, Long> ports = new LinkedHashMap<>();
  private final Map<FlowId, Long> flows = new LinkedHashMap<>();
  private final Map<String, Set<Integer>> portsBySource = new LinkedHashMap<>();
  private final Map<Pair, Long> synOnly = new LinkedHashMap<>();
  private final Map<Pair, Long> endpoints = new LinkedHashMap<>();
  private final Map<String, Long> httpHosts = new LinkedHashMap<>();
  private final Map<String, long[]> timeline = new LinkedHashMap<>();
  private final List<String> dnsQueries = new ArrayList<>();
  private final List<TlsHandshake> tlsHandshakes = new ArrayList<>();
  private final List<EntropyObservation> entropy = new ArrayList<>();

  private long packets;
  private long bytes;
  private long firstMicros = Long.MAX_VALUE;
  private long lastMicros = Long.MIN_VALUE;

  /**
   * Folds one decoded packet into the aggregates.
   *
   * @param packet decoded packet
   */
  void accept(PacketRecord packet) {
    packets++;
    bytes += packet.rawSize();
    long ts = packet.timestampMicros();
    firstMicros = Math.min(firstMicros, ts);
    lastMicros = Math.max(lastMicros, ts);

    long[] bucket = timeline.computeIfAbsent(minuteBucket(ts), k -> new long[2]);
    bucket[0]++;
    bucket[1] += packet.rawSize();

    protocols.merge(packet.protocol().label(), 1L, Long::sum);

    String src = packet.srcIp();
    String dst = packet.dstIp();
    if (packet.hasAddresses()) {
      sources.merge(src, 1L, Long::sum);
      destinations.merge(dst, 1L, Long::sum);
      endpoints.merge(new Pair(src, dst), 1L, Long::sum);
    }

    Protocol.Kind kind = packet.protocol().kind();
    if (kind == Protocol.Kind.TCP || kind == Protocol.Kind.UDP) {
      int dport = packet.dstPort();
      ports.merge(dport, 1L, Long::sum);
      flows.merge(new FlowId(src, dst, packet.protocol().label(), dport), 1L, Long::sum);
      portsBySource.computeIfAbsent(src, k -> new LinkedHashSet<>()).add(dport);
      if (packet.payloadSize() > 0) {
        entropy.add(new EntropyObservation(dport, packet.payloadEntropy()));
      }
    }
    if (kind == Protocol.Kind.TCP) {
      if (packet.flags().synOnly()) {
        synOnly.merge(new Pair(src, dst), 1L, Long::sum);
      }
      if (packet.dstPort() == TLS_PORT && tlsHandshakes.size() < TLS_LIMIT) {
        tlsHandshakes.add(new TlsHandshake(dst, TLS_PORT));
      }
    }

    if (!packet.dnsQuery().isEmpty()) {
      dnsQueries.add(packet.dnsQuery());
    }
    String host = packet.http().host();
    if (host != null && !host.isBlank()) {
      httpHosts.merge(host.trim(), 1L, Long::sum);
    }
  }

  long packets() {
    return packets;
  }

  long bytes() {
    return bytes;
  }

  double durationSeconds() {
    return packets == 0 ? 0d : (lastMicros - firstMicros) / 1_000_000d;
  }

  CaptureWindow captureWindow() {
    if (packets == 0) {
      return new CaptureWindow(null, null);
    }
    return new CaptureWindow(iso(firstMicros), iso(lastMicros));
  }

  Map<String, Set<Integer>> portsBySource() {
    return portsBySource;
  }

  Map<Pair, Long> synOnlyByPair() {
    return synOnly;
  }

  List<String> dnsQueries() {
    return dnsQueries;
  }

  List<EntropyObservation> entropyObservations() {
    return entropy;
  }

  boolean sawPort(int port) {
    return ports.getOrDefault(port, 0L) > 0;
  }

  Summary summary() {
    List<ProtocolCount> topProtocols = top(protocols, TOP_LIMIT, e -> new ProtocolCount(
        e.getKey(), e.getValue(), percentage(e.getValue())));

    Map<String, Long> talkers = new LinkedHashMap<>(sources);
    destinations.forEach((ip, count) -> talkers.merge(ip, count, Long::sum));
    List<Talker> topTalkers = top(talkers, TOP_LIMIT, e -> new Talker(e.getKey(), e.getValue()));

    List<PortCount> topPorts = top(ports, TOP_LIMIT, e -> new PortCount(e.getKey(), e.getValue()));
    List<String> hosts = top(httpHosts, HTTP_HOST_LIMIT, Map.Entry::getKey);
    List<FlowSample> flowSamples = top(flows, TOP_LIMIT, e -> new FlowSample(
        e.getKey().src(), e.getKey().dst(), e.getKey().proto(), e.getKey().dport(), e.getValue()));

    return new Summary(
        topProtocols,
        topTalkers,
        topPorts,
        dnsQueries.subList(0, Math.min(DNS_LIMIT, dnsQueries.size())),
        tlsHandshakes,
        hosts,
        flowSamples,
        timeline());
  }

  Evidence evidence() {
    List<Endpoint> matrix = top(endpoints, ENDPOINT_LIMIT, e -> new Endpoint(
        e.getKey().src(), e.getKey().dst(), e.getValue()));
    return new Evidence(timeline(), matrix);
  }

  private List<TimelinePoint> timeline() {
    List<TimelinePoint> points = new ArrayList<>(timeline.size());
    timeline.forEach((bucket, counts) -> points.add(new TimelinePoint(bucket, counts[0], counts[1])));
    points.sort(Comparator.comparing(TimelinePoint::bucket).reversed());
    return points.subList(0, Math.min(TIMELINE_LIMIT, points.size()));
  }

  private double percentage(long count) {
    if (packets == 0) {
      return 0d;
    }
    return Math.round(count * 10_000d / packets) / 100d;
  }

  // List.sort is stable, so ties stay in insertion order.
  private static <K, R> List<R> top(Map<K, Long> counts, int limit, Function<Map.Entry<K, Long>, R> mapper) {
    List<Map.Entry<K, Long>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(Map.Entry.<K, Long>comparingByValue().reversed());
    List<R> out = new ArrayList<>(Math.min(limit, entries.size()));
    for (int i = 0; i < entries.size() && i < limit; i++) {
      out.add(mapper.apply(entries.get(i)));
    }
    return out;
  }

  static String minuteBucket(long micros) {
    Instant instant = Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L)).truncatedTo(ChronoUnit.MINUTES);
    return ISO_SECONDS.format(instant);
  }

  static String iso(long micros) {
    Instant instant = Instant.ofEpochSecond(
        Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
    return ISO_MICROS.format(instant);
  }

  /** Directed address pair. */
  record Pair(String src, String dst) {}

  /** Flow identity used for flow samples. */
  record FlowId(String src, String dst, String proto, int dport) {}

  /** Entropy of one payload and the destination port it was sent to. */
  record EntropyObservation(int port, double entropy) {}
}
