package ca.gc.cra.warden.infrastructure.capture;

import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PacketSource;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.domain.net.LinkType;
import ca.gc.cra.warden.domain.net.RawFrame;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;
import org.pcap4j.core.BpfProgram;
import org.pcap4j.core.NotOpenException;
import org.pcap4j.core.PcapHandle;
import org.pcap4j.core.PcapNativeException;
import org.pcap4j.core.PcapNetworkInterface;
import org.pcap4j.core.PcapNetworkInterface.PromiscuousMode;
import org.pcap4j.core.PcapStat;
import org.pcap4j.core.Pcaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live {@link PacketSource} on a network interface, through pcap4j.
 *
 * <p>Frames are read raw; WARDEN's own decoder parses them, so pcap4j's packet factories never run on the capture
 * thread. The handle's datalink type travels with every frame. Kernel drop counters are logged when the handle
 * closes, since they explain gaps the engine's own queue counters cannot.</p>
 *
 * <p>Metrics: {@code capture.frames}, {@code capture.frame.bytes}, {@code capture.open.failed} and
 * {@code capture.read.failed}.</p>
 */
public final class Pcap4jPacketSource implements PacketSource {
  private static final Logger log = LoggerFactory.getLogger(Pcap4jPacketSource.class);

  private final String requestedInterface;
  private final int snaplen;
  private final boolean promiscuous;
  private final int readTimeoutMillis;
  private final String bpf;
  private final MetricsPort metrics;

  private volatile PcapHandle handle;
  private String device;
  private LinkType linkType = LinkType.ETHERNET;
  private long frames;

  /**
   * Creates a live capture source; nothing is opened until {@link #start()}.
   *
   * @param requestedInterface interface name, or {@code auto}
   * @param snaplen bytes kept per frame
   * @param promiscuous whether to capture traffic not addressed to this host
   * @param readTimeoutMillis native read timeout; bounds how long a stop request waits
   * @param bpf capture filter, or {@code null}/blank for none
   * @param metrics capture counters
   */
  public Pcap4jPacketSource(String requestedInterface, int snaplen, boolean promiscuous, int readTimeoutMillis,
      String bpf, MetricsPort metrics) {
    this.requestedInterface = requestedInterface == null ? InterfaceSelector.AUTO : requestedInterface;
    this.snaplen = snaplen;
    this.promiscuous = promiscuous;
    this.readTimeoutMillis = Math.max(0, readTimeoutMillis);
    this.bpf = bpf == null || bpf.isBlank() ? null : bpf.trim();
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void start() throws CaptureException {
    if (handle != null) {
      return;
    }
    device = InterfaceSelector.resolve(requestedInterface);
    PcapHandle opened;
    try {
      opened = open(device);
    } catch (PcapNativeException ex) {
      metrics.increment("capture.open.failed");
      throw InterfaceSelector.classify("Opening " + device + " failed", ex);
    } catch (CaptureException ex) {
      metrics.increment("capture.open.failed");
      throw ex;
    }
    Integer dlt = opened.getDlt().value();
    linkType = dlt == null ? LinkType.ETHERNET : LinkType.fromCode(dlt);
    frames = 0L;
    handle = opened;
    log.info("Capturing on {} (snaplen={}, promiscuous={}, link={}, filter={})",
        device, snaplen, promiscuous, linkType, bpf == null ? "none" : bpf.length() + " bytes");
  }

  private PcapHandle open(String name) throws PcapNativeException, CaptureException {
    PcapNetworkInterface nif = Pcaps.getDevByName(name);
    if (nif == null) {
      throw new CaptureException(WardenFailure.Kind.INTERFACE_NOT_FOUND, "Interface not found: " + name,
          "Set interface= to an existing device or auto", null);
    }
    PromiscuousMode mode = promiscuous ? PromiscuousMode.PROMISCUOUS : PromiscuousMode.NONPROMISCUOUS;
    PcapHandle opened = nif.openLive(snaplen, mode, readTimeoutMillis);
    if (bpf == null) {
      return opened;
    }
    try {
      opened.setFilter(bpf, BpfProgram.BpfCompileMode.OPTIMIZE);
      return opened;
    } catch (PcapNativeException | NotOpenException ex) {
      opened.close();
      throw new CaptureException(WardenFailure.Kind.CAPTURE_IO,
          "Capture filter rejected by libpcap: " + ex.getMessage(), "Correct the bpf= expression", ex);
    }
  }

  @Override
  public Optional<RawFrame> poll() throws CaptureException {
    PcapHandle current = handle;
    if (current == null) {
      return Optional.empty();
    }
    byte[] data;
    try {
      data = current.getNextRawPacket();
    } catch (NotOpenException ex) {
      metrics.increment("capture.read.failed");
      throw new CaptureException(WardenFailure.Kind.CAPTURE_IO, "Capture handle on " + device + " is closed",
          "Capture restarts automatically", ex);
    }
    if (data == null) {
      return Optional.empty();
    }
    frames++;
    metrics.increment("capture.frames");
    metrics.observe("capture.frame.bytes", data.length);
    return Optional.of(new RawFrame(data, toMicros(current.getTimestamp()), linkType));
  }

  @Override
  public String describe() {
    return device == null ? requestedInterface : device;
  }

  @Override
  public synchronized void close() {
    PcapHandle current = handle;
    if (current == null) {
      return;
    }
    handle = null;
    String drops = kernelDrops(current);
    try {
      current.breakLoop();
    } catch (NotOpenException ex) {
      log.debug("Handle on {} already closed", device, ex);
    }
    current.close();
    log.info("Capture on {} closed after {} frames ({})", device, frames, drops);
  }

  private String kernelDrops(PcapHandle current) {
    try {
      PcapStat stat = current.getStats();
      return "kernel dropped " + stat.getNumPacketsDropped() + ", interface dropped "
          + stat.getNumPacketsDroppedByIf();
    } catch (PcapNativeException | NotOpenException | UnsupportedOperationException ex) {
      log.debug("Kernel statistics unavailable on {}", device, ex);
      return "kernel drops unknown";
    }
  }

  static long toMicros(Timestamp ts) {
    if (ts == null) {
      return System.currentTimeMillis() * 1_000L;
    }
    // Timestamp.getTime() already includes the millisecond part of getNanos().
    return Math.floorDiv(ts.getTime(), 1_000L) * 1_000_000L + ts.getNanos() / 1_000L;
  }
}
