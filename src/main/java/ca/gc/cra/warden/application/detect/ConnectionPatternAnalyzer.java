package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.DetectionType;
import ca.gc.cra.warden.domain.detect.Severity;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.validation.Numbers;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Sliding-window behavioral rules over recent packets: port scans and floods.
 * <p><strong>Why:</strong> Content signatures cannot see reconnaissance or volumetric attacks that only show up
 * across many packets from one source.</p>
 * <p><strong>Role:</strong> Second rule class of the {@link SignatureMatcher}.</p>
 * <p><strong>Thread-safety:</strong> A single {@link ReentrantLock} guards the ring buffer; it is held only for
 * the append and the per-source tally, never for detection construction.</p>
 * <p><strong>Performance:</strong> O(window) per packet; the window is bounded by
 * {@link Settings#windowPackets()}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionPatternAnalyzer {
  /** Signature id for port scans. */
  public static final String PORT_SCAN = "port_scan";
  /** Signature id for floods. */
  public static final String DOS_ATTACK = "dos_attack";
  /** Source tag attached to connection-pattern detections. */
  public static final String SOURCE = "connection_pattern_analysis";

  private static final double PORT_SCAN_CONFIDENCE = 0.8;
  private static final double DOS_CONFIDENCE = 0.9;

  private final Settings settings;
  private final ArrayDeque<Observation> window;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Creates an analyzer with default settings.
   */
  public ConnectionPatternAnalyzer() {
    this(Settings.defaults());
  }

  /**
   * Creates an analyzer.
   *
   * @param settings window and thresholds
   */
  public ConnectionPatternAnalyzer(Settings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.window = new ArrayDeque<>(settings.windowPackets());
  }

  /**
   * Records the packet in the window and evaluates both rules for its source. Port scan wins when both fire.
   *
   * <p>Every packet occupies the window and counts toward its source's volume, port-less ones (ICMP) included.
   * Only packets with both addresses and a destination port are evaluated, and only ported packets count as
   * distinct ports.</p>
   *
   * @param packet decoded packet
   * @return at most one detection
   */
  public Optional<Detection> analyze(PacketRecord packet) {
    long now = packet.timestampMillis();
    long cutoff = now - settings.window().toMillis();
    String source = packet.srcIp();
    boolean evaluate = packet.hasAddresses() && packet.dstPort() > 0;

    int packets = 0;
    Set<Integer> ports = new HashSet<>();
    lock.lock();
    try {
      if (window.size() >= settings.windowPackets()) {
        window.pollFirst();
      }
      window.addLast(new Observation(source, packet.dstPort(), now));
      if (!evaluate) {
        return Optional.empty();
      }
      for (Observation observation : window) {
        if (observation.timestampMillis() >= cutoff && observation.srcIp().equals(source)) {
          packets++;
          if (observation.dstPort() > 0) {
            ports.add(observation.dstPort());
          }
        }
      }
    } finally {
      lock.unlock();
    }

    if (ports.size() > settings.portScanThreshold()) {
      return Optional.of(new Detection(
          DetectionType.SIGNATURE,
          PORT_SCAN,
          Severity.MEDIUM,
          PORT_SCAN_CONFIDENCE,
          "Port scanning detected from " + source + " to " + ports.size() + " ports",
          SOURCE,
          "unique_ports>" + settings.portScanThreshold(),
          now));
    }
    if (packets > settings.floodThreshold()) {
      return Optional.of(new Detection(
          DetectionType.SIGNATURE,
          DOS_ATTACK,
          Severity.HIGH,
          DOS_CONFIDENCE,
          "Potential DoS attack from " + source + " (" + packets + " packets in "
              + settings.window().toSeconds() + "s)",
          SOURCE,
          "packets>" + settings.floodThreshold(),
          now));
    }
    return Optional.empty();
  }

  /**
   * Returns the number of packets currently held in the window.
   *
   * @return window occupancy
   */
  public int windowSize() {
    lock.lock();
    try {
      return window.size();
    } finally {
      lock.unlock();
    }
  }

  private record Observation(String srcIp, int dstPort, long timestampMillis) {}

  /**
   * Window and threshold configuration.
   *
   * @param windowPackets maximum packets retained
   * @param window maximum packet age considered
   * @param portScanThreshold unique destination ports above which a scan is reported
   * @param floodThreshold packet count above which a flood is reported
   */
  public record Settings(int windowPackets, Duration window, int portScanThreshold, int floodThreshold) {
    /**
     * Validates bounds.
     */
    public Settings {
      Numbers.requireRange("connectionWindowPackets", windowPackets, 1, 1_000_000);
      Objects.requireNonNull(window, "window");
      if (window.isNegative() || window.isZero()) {
        throw new IllegalArgumentException("connectionWindow must be positive");
      }
      Numbers.requireRange("portScanThreshold", portScanThreshold, 1, 65_535);
      Numbers.requireRange("floodThreshold", floodThreshold, 1, Integer.MAX_VALUE);
    }

    /**
     * Returns the stock settings: 1000 packets, 60 s, more than 10 ports, more than 100 packets.
     *
     * @return defaults
     */
    public static Settings defaults() {
      return new Settings(1_000, Duration.ofSeconds(60), 10, 100);
    }
  }
}
