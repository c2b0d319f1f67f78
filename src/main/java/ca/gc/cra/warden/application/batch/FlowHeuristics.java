package ca.gc.cra.warden.application.batch;

import ca.gc.cra.warden.application.batch.BatchReport.Finding;
import ca.gc.cra.warden.application.batch.BatchReport.Mitre;
import ca.gc.cra.warden.application.batch.FlowAggregates.EntropyObservation;
import ca.gc.cra.warden.application.batch.FlowAggregates.Pair;
import ca.gc.cra.warden.domain.detect.Severity;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flow-level heuristics evaluated once over a capture's {@link FlowAggregates}.
 *
 * <p>Port scan and SYN flood report only the first qualifying source or pair in first-appearance order.</p>
 *
 * @since 0.1.0
 */
final class FlowHeuristics {
  static final int PORT_SCAN_UNIQUE_PORTS = 25;
  static final int SYN_FLOOD_PACKETS = 400;
  static final int DNS_TUNNEL_MIN_QUERIES = 10;
  static final int DNS_TUNNEL_MIN_LONG_QUERIES = 2;
  static final int DNS_LONG_QUERY_LENGTH = 50;
  static final double HIGH_ENTROPY = 7.5;
  static final Set<Integer> STANDARD_PORTS = Set.of(80, 443, 53);
  static final int HTTP_PORT = 80;
  static final List<Integer> ALTERNATE_HTTP_PORTS = List.of(8080, 8000, 8888);

  static final Mitre PORT_SCAN_MITRE = new Mitre("T1046", "Discovery");
  static final Mitre DOS_MITRE = new Mitre("T1499", "Impact");
  static final Mitre DNS_TUNNEL_MITRE = new Mitre("T1071.004", "Command and Control");
  static final Mitre EXFIL_MITRE = new Mitre("T1048", "Exfiltration");
  static final Mitre HTTP_MITRE = new Mitre("T1190", "Initial Access");

  private FlowHeuristics() {}

  /**
   * Evaluates every heuristic.
   *
   * @param aggregates counters from one capture
   * @return findings in heuristic order
   */
  static List<Finding> evaluate(FlowAggregates aggregates) {
    List<Finding> findings = new ArrayList<>(5);
    portScan(aggregates, findings);
    synFlood(aggregates, findings);
    dnsTunnel(aggregates, findings);
    highEntropy(aggregates, findings);
    alternateHttp(aggregates, findings);
    return findings;
  }

  private static void portScan(FlowAggregates aggregates, List<Finding> out) {
    for (Map.Entry<String, Set<Integer>> entry : aggregates.portsBySource().entrySet()) {
      int unique = entry.getValue().size();
      if (unique >= PORT_SCAN_UNIQUE_PORTS) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("source", entry.getKey());
        evidence.put("unique_ports", unique);
        out.add(new Finding(
            "port_scan",
            "Port scanning behavior",
            Severity.MEDIUM.label(),
            0.7,
            entry.getKey() + " contacted " + unique
                + " unique destination ports; pattern consistent with scanning.",
            evidence,
            PORT_SCAN_MITRE,
            null));
        return;
      }
    }
  }

  private static void synFlood(FlowAggregates aggregates, List<Finding> out) {
    for (Map.Entry<Pair, Long> entry : aggregates.synOnlyByPair().entrySet()) {
      long count = entry.getValue();
      if (count >= SYN_FLOOD_PACKETS) {
        Pair pair = entry.getKey();
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("source", pair.src());
        evidence.put("destination", pair.dst());
        evidence.put("syn_packets", count);
        out.add(new Finding(
            "dos_syn",
            "SYN flood pattern",
            Severity.HIGH.label(),
            0.68,
            count + " SYN packets from " + pair.src() + " to " + pair.dst()
                + " without corresponding ACK visibility.",
            evidence,
            DOS_MITRE,
            null));
        return;
      }
    }
  }

  private static void dnsTunnel(FlowAggregates aggregates, List<Finding> out) {
    List<String> queries = aggregates.dnsQueries();
    if (queries.size() <= DNS_TUNNEL_MIN_QUERIES) {
      return;
    }
    int longQueries = 0;
    long totalLength = 0;
    for (String query : queries) {
      if (query.length() > DNS_LONG_QUERY_LENGTH) {
        longQueries++;
        totalLength += query.length();
      }
    }
    if (longQueries < DNS_TUNNEL_MIN_LONG_QUERIES) {
      return;
    }
    Map<String, Object> evidence = new LinkedHashMap<>();
    evidence.put("long_queries", longQueries);
    evidence.put("avg_length", round2((double) totalLength / longQueries));
    out.add(new Finding(
        "dns_tunnel",
        "Possible DNS tunneling",
        Severity.HIGH.label(),
        0.7,
        "Long or numerous DNS queries observed; may indicate tunneling or covert channels.",
        evidence,
        DNS_TUNNEL_MITRE,
        null));
  }

  private static void highEntropy(FlowAggregates aggregates, List<Finding> out) {
    for (EntropyObservation observation : aggregates.entropyObservations()) {
      if (observation.entropy() > HIGH_ENTROPY && !STANDARD_PORTS.contains(observation.port())) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("sample_port", observation.port());
        evidence.put("entropy", round2(observation.entropy()));
        out.add(new Finding(
            "exfil_high_entropy",
            "High-entropy payload on uncommon port",
            Severity.HIGH.label(),
            0.64,
            "Payload entropy >7.5 detected on non-standard ports; could indicate encrypted exfiltration or custom C2.",
            evidence,
            EXFIL_MITRE,
            null));
        return;
      }
    }
  }

  private static void alternateHttp(FlowAggregates aggregates, List<Finding> out) {
    if (!aggregates.sawPort(HTTP_PORT)) {
      return;
    }
    List<Integer> seen = new ArrayList<>();
    for (int port : ALTERNATE_HTTP_PORTS) {
      if (aggregates.sawPort(port)) {
        seen.add(port);
      }
    }
    if (seen.isEmpty()) {
      return;
    }
    Map<String, Object> evidence = new LinkedHashMap<>();
    evidence.put("ports_seen", List.copyOf(seen));
    out.add(new Finding(
        "http_suspicious",
        "HTTP traffic on uncommon ports",
        Severity.MEDIUM.label(),
        0.55,
        "HTTP-like traffic detected on uncommon ports (8080/8000/8888); may indicate proxy evasion or admin "
            + "interfaces exposed.",
        evidence,
        HTTP_MITRE,
        null));
  }

  /**
   * Drops findings repeating an earlier (title, severity, source, destination) combination.
   *
   * @param findings heuristic findings followed by per-packet findings
   * @return deduplicated findings in input order
   */
  static List<Finding> deduplicate(List<Finding> findings) {
    Set<List<String>> seen = new HashSet<>();
    List<Finding> out = new ArrayList<>(findings.size());
    for (Finding finding : findings) {
      List<String> key = List.of(
          finding.title(),
          finding.severity(),
          finding.evidenceText("source_ip", "source"),
          finding.evidenceText("dest_ip", "destination"));
      if (seen.add(key)) {
        out.add(finding);
      }
    }
    return out;
  }

  static double round2(double value) {
    return Math.round(value * 100d) / 100d;
  }
}
