package ca.gc.cra.warden.infrastructure.capture;

import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.domain.net.LinkType;
import ca.gc.cra.warden.domain.net.RawFrame;
import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streaming reader for legacy pcap and pcapng capture files.
 * <p><strong>Why:</strong> Offline analysis must work on hosts without libpcap, so the container formats are parsed
 * in Java.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Detect the container from its magic bytes: {@code d4 c3 b2 a1}/{@code a1 b2 c3 d4} (microseconds),
 *       {@code 4d 3c b2 a1}/{@code a1 b2 3c 4d} (nanoseconds) or {@code 0a 0d 0d 0a} (pcapng).</li>
 *   <li>Honour the file's byte order and timestamp resolution.</li>
 *   <li>For pcapng, track the link type of each interface description block and read enhanced and simple
 *       packet blocks, skipping everything else.</li>
 * </ul>
 * <p>An unknown magic logs a warning and the file is parsed as little-endian legacy pcap anyway.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class PcapFileReader implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(PcapFileReader.class);

  static final int MAGIC_MICROS = 0xa1b2c3d4;
  static final int MAGIC_NANOS = 0xa1b23c4d;
  static final int PCAPNG_SHB = 0x0a0d0d0a;
  static final int PCAPNG_BYTE_ORDER_MAGIC = 0x1a2b3c4d;
  static final int PCAPNG_IDB = 0x00000001;
  static final int PCAPNG_SPB = 0x00000003;
  static final int PCAPNG_EPB = 0x00000006;
  private static final int OPT_IF_TSRESOL = 9;
  private static final int MAX_RECORD_BYTES = 256 * 1024 * 1024;

  /** Container detected from the leading magic bytes. */
  public enum Format {
    PCAP,
    PCAP_NANO,
    PCAPNG,
    UNKNOWN
  }

  private final InputStream in;
  private final String origin;
  private final Format format;
  private ByteOrder order = ByteOrder.LITTLE_ENDIAN;
  private LinkType legacyLinkType = LinkType.ETHERNET;
  private final List<Interface> interfaces = new ArrayList<>();

  /**
   * Reads the file header and prepares for iteration.
   *
   * @param stream capture bytes; closed by {@link #close()}
   * @param origin name used in messages
   * @throws PcapFormatException if the header is missing or malformed
   * @throws IOException if reading fails
   */
  public PcapFileReader(InputStream stream, String origin) throws IOException {
    this.in = new BufferedInputStream(Objects.requireNonNull(stream, "stream"));
    this.origin = Objects.requireNonNullElse(origin, "pcap");
    byte[] magic = readFully(4, true);
    if (magic == null) {
      throw new PcapFormatException(
          WardenFailure.Kind.PCAP_EMPTY, "Capture file is empty: " + this.origin, "Provide a non-empty capture");
    }
    this.format = detect(magic);
    switch (format) {
      case PCAP, PCAP_NANO, UNKNOWN -> readLegacyHeader(magic);
      case PCAPNG -> readSectionHeader();
      default -> throw new IllegalStateException("Unhandled format " + format);
    }
  }

  /**
   * Classifies magic bytes.
   *
   * @param magic first four bytes of the file
   * @return detected format
   */
  public static Format detect(byte[] magic) {
    if (magic == null || magic.length < 4) {
      return Format.UNKNOWN;
    }
    int be = ByteBuffer.wrap(magic, 0, 4).order(ByteOrder.BIG_ENDIAN).getInt();
    int le = ByteBuffer.wrap(magic, 0, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
    if (be == PCAPNG_SHB) {
      return Format.PCAPNG;
    }
    if (be == MAGIC_MICROS || le == MAGIC_MICROS) {
      return Format.PCAP;
    }
    if (be == MAGIC_NANOS || le == MAGIC_NANOS) {
      return Format.PCAP_NANO;
    }
    return Format.UNKNOWN;
  }

  /**
   * Returns the detected container format.
   *
   * @return format
   */
  public Format format() {
    return format;
  }

  /**
   * Reads the next frame.
   *
   * @return frame, or empty at end of file
   * @throws PcapFormatException if a record is malformed
   * @throws IOException if reading fails
   */
  public Optional<RawFrame> next() throws IOException {
    return format == Format.PCAPNG ? nextBlock() : nextLegacyRecord();
  }

  @Override
  public void close() throws IOException {
    in.close();
  }

  private void readLegacyHeader(byte[] magic) throws IOException {
    if (format == Format.UNKNOWN) {
      log.warn("Unrecognised capture magic {} in {}; attempting legacy pcap parse",
          String.format("%02x %02x %02x %02x", magic[0], magic[1], magic[2], magic[3]), origin);
      order = ByteOrder.LITTLE_ENDIAN;
    } else {
      int le = ByteBuffer.wrap(magic).order(ByteOrder.LITTLE_ENDIAN).getInt();
      order = (le == MAGIC_MICROS || le == MAGIC_NANOS) ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
    }
    byte[] rest = readFully(20, false);
    ByteBuffer header = ByteBuffer.wrap(rest).order(order);
    header.position(16);
    int network = header.getInt();
    // Upper bits carry FCS flags in newer files.
    legacyLinkType = LinkType.fromCode(network & 0x0FFFFFFF);
    if (legacyLinkType == LinkType.UNSUPPORTED) {
      log.warn("Capture {} uses unsupported link type {}; frames will be skipped by the decoder", origin, network);
    }
  }

  private Optional<RawFrame> nextLegacyRecord() throws IOException {
    byte[] head = readFully(16, true);
    if (head == null) {
      return Optional.empty();
    }
    ByteBuffer buf = ByteBuffer.wrap(head).order(order);
    long seconds = buf.getInt() & 0xFFFFFFFFL;
    long fraction = buf.getInt() & 0xFFFFFFFFL;
    int included = buf.getInt();
    buf.getInt();
    if (included < 0 || included > MAX_RECORD_BYTES) {
      throw malformed("record length " + Integer.toUnsignedString(included));
    }
    byte[] data = readFully(included, false);
    long micros = format == Format.PCAP_NANO
        ? seconds * 1_000_000L + fraction / 1_000L
        : seconds * 1_000_000L + fraction;
    return Optional.of(new RawFrame(data, micros, legacyLinkType));
  }

  private void readSectionHeader() throws IOException {
    byte[] lengthAndOrder = readFully(8, false);
    int bom = ByteBuffer.wrap(lengthAndOrder, 4, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
    if (bom == PCAPNG_BYTE_ORDER_MAGIC) {
      order = ByteOrder.LITTLE_ENDIAN;
    } else if (Integer.reverseBytes(bom) == PCAPNG_BYTE_ORDER_MAGIC) {
      order = ByteOrder.BIG_ENDIAN;
    } else {
      throw malformed("pcapng byte-order magic " + Integer.toHexString(bom));
    }
    int total = ByteBuffer.wrap(lengthAndOrder, 0, 4).order(order).getInt();
    if (total < 28 || total > MAX_RECORD_BYTES) {
      throw malformed("section header length " + total);
    }
    readFully(total - 12, false);
    interfaces.clear();
  }

  private Optional<RawFrame> nextBlock() throws IOException {
    while (true) {
      byte[] head = readFully(8, true);
      if (head == null) {
        return Optional.empty();
      }
      int rawType = ByteBuffer.wrap(head, 0, 4).order(ByteOrder.BIG_ENDIAN).getInt();
      if (rawType == PCAPNG_SHB) {
        // A new section may switch byte order; re-read its header in place.
        byte[] bomBytes = readFully(4, false);
        int bom = ByteBuffer.wrap(bomBytes).order(ByteOrder.LITTLE_ENDIAN).getInt();
        order = bom == PCAPNG_BYTE_ORDER_MAGIC ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
        int total = ByteBuffer.wrap(head, 4, 4).order(order).getInt();
        if (total < 28 || total > MAX_RECORD_BYTES) {
          throw malformed("section header length " + total);
        }
        readFully(total - 12, false);
        interfaces.clear();
        continue;
      }
      ByteBuffer headBuf = ByteBuffer.wrap(head).order(order);
      int type = headBuf.getInt();
      int total = headBuf.getInt();
      if (total < 12 || total % 4 != 0 || total > MAX_RECORD_BYTES) {
        throw malformed("block length " + total);
      }
      ByteBuffer body = ByteBuffer.wrap(readFully(total - 8, false)).order(order);
      switch (type) {
        case PCAPNG_IDB -> interfaces.add(readInterface(body, total - 12));
        case PCAPNG_EPB -> {
          return Optional.of(readEnhanced(body));
        }
        case PCAPNG_SPB -> {
          return Optional.of(readSimple(body, total - 12));
        }
        default -> log.debug("Skipping pcapng block type {} in {}", Integer.toHexString(type), origin);
      }
    }
  }

  private Interface readInterface(ByteBuffer body, int bodyLength) throws PcapFormatException {
    if (bodyLength < 8) {
      throw malformed("interface description block");
    }
    int linkCode = body.getShort() & 0xFFFF;
    body.getShort();
    body.getInt();
    long unitsPerSecond = 1_000_000L;
    int optionsEnd = bodyLength;
    while (body.position() + 4 <= optionsEnd) {
      int code = body.getShort() & 0xFFFF;
      int length = body.getShort() & 0xFFFF;
      if (code == 0) {
        break;
      }
      int padded = (length + 3) & ~3;
      if (body.position() + padded > optionsEnd) {
        break;
      }
      if (code == OPT_IF_TSRESOL && length >= 1) {
        int resolution = body.get(body.position()) & 0xFF;
        unitsPerSecond = resolutionUnits(resolution);
      }
      body.position(body.position() + padded);
    }
    LinkType linkType = LinkType.fromCode(linkCode);
    if (linkType == LinkType.UNSUPPORTED) {
      log.warn("Interface {} in {} uses unsupported link type {}", interfaces.size(), origin, linkCode);
    }
    return new Interface(linkType, unitsPerSecond);
  }

  private RawFrame readEnhanced(ByteBuffer body) throws PcapFormatException {
    if (body.remaining() < 24) {
      throw malformed("enhanced packet block");
    }
    int interfaceId = body.getInt();
    long high = body.getInt() & 0xFFFFFFFFL;
    long low = body.getInt() & 0xFFFFFFFFL;
    int captured = body.getInt();
    body.getInt();
    if (captured < 0 || captured > body.remaining() - 4) {
      throw malformed("enhanced packet captured length " + captured);
    }
    byte[] data = new byte[captured];
    body.get(data);
    Interface iface = interfaceFor(interfaceId);
    long ticks = (high << 32) | low;
    return new RawFrame(data, iface.toMicros(ticks), iface.linkType());
  }

  private RawFrame readSimple(ByteBuffer body, int bodyLength) throws PcapFormatException {
    if (bodyLength < 4) {
      throw malformed("simple packet block");
    }
    int original = body.getInt();
    int captured = Math.min(Math.max(0, original), bodyLength - 4);
    byte[] data = new byte[captured];
    body.get(data);
    // Simple packet blocks carry no timestamp.
    return new RawFrame(data, 0L, interfaceFor(0).linkType());
  }

  private Interface interfaceFor(int id) throws PcapFormatException {
    if (id < 0 || id >= interfaces.size()) {
      throw malformed("packet references undeclared interface " + id);
    }
    return interfaces.get(id);
  }

  private static long resolutionUnits(int resolution) {
    int exponent = resolution & 0x7F;
    if ((resolution & 0x80) != 0) {
      return exponent >= 62 ? Long.MAX_VALUE : 1L << exponent;
    }
    long units = 1L;
    for (int i = 0; i < exponent && units < 1_000_000_000_000_000L; i++) {
      units *= 10L;
    }
    return units;
  }

  private byte[] readFully(int length, boolean eofAllowed) throws IOException {
    byte[] buffer = new byte[length];
    int read = 0;
    while (read < length) {
      int n = in.read(buffer, read, length - read);
      if (n < 0) {
        if (read == 0 && eofAllowed) {
          return null;
        }
        throw new PcapFormatException(
            WardenFailure.Kind.PCAP_INVALID,
            "Capture file " + origin + " is truncated",
            "Re-export the capture or analyze a complete file",
            new EOFException("needed " + length + " bytes, got " + read));
      }
      read += n;
    }
    return buffer;
  }

  private PcapFormatException malformed(String what) {
    return new PcapFormatException(
        WardenFailure.Kind.PCAP_INVALID,
        "Malformed " + what + " in " + origin,
        "Verify the file is a pcap or pcapng capture");
  }

  private record Interface(LinkType linkType, long unitsPerSecond) {
    long toMicros(long ticks) {
      if (unitsPerSecond == 1_000_000L) {
        return ticks;
      }
      if (unitsPerSecond > 1_000_000L && unitsPerSecond % 1_000_000L == 0) {
        return ticks / (unitsPerSecond / 1_000_000L);
      }
      if (unitsPerSecond < 1_000_000L && 1_000_000L % unitsPerSecond == 0) {
        return ticks * (1_000_000L / unitsPerSecond);
      }
      long seconds = ticks / unitsPerSecond;
      long remainder = ticks % unitsPerSecond;
      return seconds * 1_000_000L + (long) (remainder * (1_000_000.0d / unitsPerSecond));
    }
  }
}
