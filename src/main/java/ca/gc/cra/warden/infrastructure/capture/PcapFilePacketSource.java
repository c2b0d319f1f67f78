package ca.gc.cra.warden.infrastructure.capture;

import ca.gc.cra.warden.application.port.PacketSource;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.domain.net.RawFrame;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PacketSource} adapter that replays frames from an on-disk pcap/pcapng trace.
 * <p><strong>Why:</strong> Lets the batch analyzer and replay-driven tests operate on captured traffic without a
 * live interface or native libpcap.</p>
 * <p><strong>Role:</strong> Infrastructure adapter on the capture side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the path and open it through {@link PcapFileReader}.</li>
 *   <li>Stream frames as {@link RawFrame} instances in file order.</li>
 *   <li>Surface exhaustion when the file has been fully consumed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers must poll from a single thread.</p>
 * <p><strong>Performance:</strong> Sequential buffered reads; one copy per frame.</p>
 *
 * @since 0.1.0
 */
public final class PcapFilePacketSource implements PacketSource {
  private static final Logger log = LoggerFactory.getLogger(PcapFilePacketSource.class);

  private final Path pcapPath;

  private PcapFileReader reader;
  private Path canonicalPath;
  private long delivered;
  private volatile boolean exhausted;

  /**
   * Creates an offline packet source.
   *
   * @param pcapPath path to an existing pcap/pcapng file; must be readable
   */
  public PcapFilePacketSource(Path pcapPath) {
    this.pcapPath = Objects.requireNonNull(pcapPath, "pcapPath").toAbsolutePath().normalize();
  }

  /**
   * Opens the capture file and reads its header.
   *
   * @throws PcapFormatException if the file is missing, empty or has a malformed header
   * @throws IOException if the file cannot be read
   */
  @Override
  public void start() throws IOException {
    if (reader != null) {
      return;
    }
    if (!Files.isRegularFile(pcapPath)) {
      throw new PcapFormatException(
          WardenFailure.Kind.PCAP_INVALID,
          "Capture file not found: " + pcapPath,
          "Pass pcap= with the path of an existing pcap or pcapng file");
    }
    if (!Files.isReadable(pcapPath)) {
      throw new PcapFormatException(
          WardenFailure.Kind.PCAP_INVALID,
          "Capture file is not readable: " + pcapPath,
          "Check file permissions");
    }
    canonicalPath = pcapPath.toRealPath();
    reader = new PcapFileReader(Files.newInputStream(canonicalPath), canonicalPath.toString());
    exhausted = false;
    delivered = 0L;
    log.info("Offline capture opened for {} (format={})", canonicalPath, reader.format());
  }

  @Override
  public Optional<RawFrame> poll() throws IOException {
    if (reader == null) {
      return Optional.empty();
    }
    Optional<RawFrame> frame = reader.next();
    if (frame.isEmpty()) {
      exhausted = true;
      close();
      return Optional.empty();
    }
    delivered++;
    return frame;
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public String describe() {
    return effectivePath().toString();
  }

  @Override
  public void close() throws IOException {
    if (reader == null) {
      return;
    }
    try {
      reader.close();
    } finally {
      reader = null;
      log.info("Offline capture closed for {} after {} packets", effectivePath(), delivered);
    }
  }

  private Path effectivePath() {
    return canonicalPath != null ? canonicalPath : pcapPath;
  }
}
