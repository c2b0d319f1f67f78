package ca.gc.cra.warden.infrastructure.persistence;

import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.net.PacketRecord;
import java.time.Instant;

/**
 * Stored form of an alert: the detection flattened together with its packet context.
 *
 * @param alertId identifier assigned by the store
 * @param timestamp ISO-8601 creation time
 * @param createdAtMillis creation time in epoch milliseconds
 * @param type detection type label
 * @param ruleId signature or rule identifier
 * @param severity severity label
 * @param confidence confidence in {@code [0,1]}
 * @param description human-readable description
 * @param source detector source tag
 * @param matchedPattern pattern or model that matched
 * @param sourceIp packet source address
 * @param destIp packet destination address
 * @param sourcePort packet source port
 * @param destPort packet destination port
 * @param protocol protocol label
 * @param payloadHex hex of the payload sample
 * @since 0.1.0
 */
public record AlertRecord(
    String alertId,
    String timestamp,
    long createdAtMillis,
    String type,
    String ruleId,
    String severity,
    double confidence,
    String description,
    String source,
    String matchedPattern,
    String sourceIp,
    String destIp,
    int sourcePort,
    int destPort,
    String protocol,
    String payloadHex) {

  /**
   * Flattens a detection and its packet.
   *
   * @param alertId identifier to assign
   * @param detection detection
   * @param context packet that produced it
   * @return stored form
   */
  public static AlertRecord of(String alertId, Detection detection, PacketRecord context) {
    return new AlertRecord(
        alertId,
        Instant.ofEpochMilli(detection.createdAtMillis()).toString(),
        detection.createdAtMillis(),
        detection.type().label(),
        detection.ruleId(),
        detection.severity().label(),
        detection.confidence(),
        detection.description(),
        detection.source(),
        detection.matchedPattern(),
        context.srcIp(),
        context.dstIp(),
        context.srcPort(),
        context.dstPort(),
        context.protocol().label(),
        context.payloadHex());
  }

  /**
   * Tests whether this alert shares the dedup key and was created after {@code sinceMillis}.
   *
   * @param ip source address
   * @param rule rule identifier
   * @param port destination port
   * @param sinceMillis exclusive lower bound
   * @return {@code true} on a match
   */
  boolean matches(String ip, String rule, int port, long sinceMillis) {
    return createdAtMillis > sinceMillis && destPort == port && ruleId.equals(rule) && sourceIp.equals(ip);
  }
}
