package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.domain.net.RawFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that converts captured link-layer frames into {@link PacketRecord}s.
 * <p><strong>Why:</strong> Separates frame parsing from tracking and detection so decoders can be swapped.</p>
 * <p><strong>Role:</strong> Implemented by {@link ca.gc.cra.warden.infrastructure.net.PacketDecoder}.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be stateless.</p>
 * <p><strong>Performance:</strong> Hot-path operation; header parsing should be O(1) apart from the payload
 * entropy pass.</p>
 *
 * @implNote Callers assume {@link #decode(RawFrame)} never returns {@code null} and never throws; unparseable
 *     frames yield {@link Optional#empty()} and are counted as drops.
 * @since 0.1.0
 */
public interface FrameDecoder {
  /**
   * Attempts to decode a raw frame.
   *
   * @param frame raw frame captured from the network; must not be {@code null}
   * @return decoded packet, or empty when the frame is unparseable
   */
  Optional<PacketRecord> decode(RawFrame frame);
}
