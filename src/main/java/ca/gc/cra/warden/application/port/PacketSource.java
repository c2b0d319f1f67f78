package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.net.RawFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that supplies captured frames to the ingest pipeline.
 * <p><strong>Why:</strong> Abstracts live capture and file replay so the pipeline stays agnostic to capture
 * mechanics.</p>
 * <p><strong>Role:</strong> Implemented by {@code Pcap4jPacketSource} (live) and {@code PcapFilePacketSource}
 * (offline).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and close capture resources safely.</li>
 *   <li>Poll for new frames with bounded blocking semantics.</li>
 *   <li>Signal exhaustion so the capture worker can finish normally.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations expect single-threaded polling from the capture worker.</p>
 * <p><strong>Performance:</strong> Hot capture path; adapters should avoid extra copies.</p>
 *
 * @implNote Callers must invoke {@link #start()} before polling and always call {@link #close()}. A blocking
 *     {@link #poll()} may run to its read timeout before a stop request is observed.
 * @since 0.1.0
 */
public interface PacketSource extends AutoCloseable {
  /**
   * Starts capture or prepares the underlying source.
   *
   * @throws Exception if the source cannot be opened; capture adapters throw
   *     {@code CaptureException} with a structured failure
   */
  void start() throws Exception;

  /**
   * Retrieves the next frame when available.
   *
   * @return frame, or empty when no data arrived within the read timeout or the source is exhausted
   * @throws Exception if capture fails or the device errors
   */
  Optional<RawFrame> poll() throws Exception;

  /**
   * Indicates whether the source has been fully drained and will not deliver more frames.
   *
   * @return {@code true} when the source is exhausted
   */
  default boolean isExhausted() {
    return false;
  }

  /**
   * Describes the source for logs and health output.
   *
   * @return interface name or file path
   */
  default String describe() {
    return getClass().getSimpleName();
  }

  /**
   * Closes the underlying capture resources.
   *
   * @throws Exception if native resources cannot be released
   */
  @Override
  void close() throws Exception;
}
