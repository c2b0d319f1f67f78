package ca.gc.cra.warden.infrastructure.capture;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.domain.net.LinkType;
import ca.gc.cra.warden.domain.net.RawFrame;
import ca.gc.cra.warden.testutil.Frames;
import ca.gc.cra.warden.testutil.PcapFixtures;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PcapFileReaderTest {
  @TempDir Path tempDir;

  @Test
  void readsLegacyPcapRecordsInOrder() throws Exception {
    byte[] first = Frames.tcp("10.0.0.1", "10.0.0.2", 40000, 80, "GET / HTTP/1.1\r\n\r\n");
    byte[] second = Frames.tcp("10.0.0.2", "10.0.0.1", 80, 40000, "HTTP/1.1 200 OK\r\n\r\n");
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("two.pcap"), List.of(first, second));

    try (PcapFileReader reader = open(pcap)) {
      assertEquals(PcapFileReader.Format.PCAP, reader.format());

      RawFrame a = reader.next().orElseThrow();
      RawFrame b = reader.next().orElseThrow();
      assertArrayEquals(first, a.data());
      assertEquals(PcapFixtures.BASE_MICROS, a.timestampMicros());
      assertEquals(LinkType.ETHERNET, a.linkType());
      assertArrayEquals(second, b.data());
      assertEquals(PcapFixtures.BASE_MICROS + 1_000_000L, b.timestampMicros());
      assertTrue(reader.next().isEmpty());
    }
  }

  @Test
  void readsPcapngEnhancedPacketBlocks() throws Exception {
    byte[] frame = Frames.tcp("10.0.0.1", "10.0.0.2", 40000, 443, "hello");
    Path pcapng = PcapFixtures.writePcapng(tempDir.resolve("one.pcapng"), List.of(frame, frame));

    try (PcapFileReader reader = open(pcapng)) {
      assertEquals(PcapFileReader.Format.PCAPNG, reader.format());
      RawFrame first = reader.next().orElseThrow();
      assertArrayEquals(frame, first.data());
      assertEquals(PcapFixtures.BASE_MICROS, first.timestampMicros());
      assertEquals(PcapFixtures.BASE_MICROS + 1_000_000L, reader.next().orElseThrow().timestampMicros());
      assertTrue(reader.next().isEmpty());
    }
  }

  @Test
  void convertsBigEndianNanosecondTimestamps() throws Exception {
    byte[] frame = Frames.tcp("10.0.0.1", "10.0.0.2", 40000, 80, "x");
    ByteBuffer buf = ByteBuffer.allocate(24 + 16 + frame.length).order(ByteOrder.BIG_ENDIAN);
    buf.putInt(0xa1b23c4d).putShort((short) 2).putShort((short) 4).putInt(0).putInt(0).putInt(65535).putInt(1);
    buf.putInt(1).putInt(500_000_000).putInt(frame.length).putInt(frame.length).put(frame);

    try (PcapFileReader reader = new PcapFileReader(new ByteArrayInputStream(buf.array()), "nano")) {
      assertEquals(PcapFileReader.Format.PCAP_NANO, reader.format());
      assertEquals(1_500_000L, reader.next().orElseThrow().timestampMicros());
    }
  }

  @Test
  void detectRecognisesMagicInEitherByteOrder() {
    byte[] littleEndian = {(byte) 0xd4, (byte) 0xc3, (byte) 0xb2, (byte) 0xa1};
    byte[] bigEndian = {(byte) 0xa1, (byte) 0xb2, (byte) 0xc3, (byte) 0xd4};
    assertEquals(PcapFileReader.Format.PCAP, PcapFileReader.detect(littleEndian));
    assertEquals(PcapFileReader.Format.PCAP, PcapFileReader.detect(bigEndian));
    assertEquals(PcapFileReader.Format.PCAPNG, PcapFileReader.detect(new byte[] {0x0a, 0x0d, 0x0d, 0x0a}));
    assertEquals(PcapFileReader.Format.UNKNOWN, PcapFileReader.detect(new byte[] {1, 2}));
    assertEquals(PcapFileReader.Format.UNKNOWN, PcapFileReader.detect(null));
  }

  @Test
  void emptyStreamIsReportedAsEmptyCapture() {
    PcapFormatException ex = assertThrows(
        PcapFormatException.class, () -> new PcapFileReader(new ByteArrayInputStream(new byte[0]), "empty"));
    assertEquals(WardenFailure.Kind.PCAP_EMPTY, ex.failure().kind());
  }

  @Test
  void truncatedRecordIsInvalid() throws Exception {
    byte[] frame = Frames.tcp("10.0.0.1", "10.0.0.2", 40000, 80, "payload");
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("cut.pcap"), List.of(frame));
    byte[] bytes = Files.readAllBytes(pcap);
    byte[] cut = Arrays.copyOf(bytes, bytes.length - 5);

    try (PcapFileReader reader = new PcapFileReader(new ByteArrayInputStream(cut), "cut")) {
      PcapFormatException ex = assertThrows(PcapFormatException.class, reader::next);
      assertEquals(WardenFailure.Kind.PCAP_INVALID, ex.failure().kind());
      assertTrue(ex.getMessage().contains("truncated"));
    }
  }

  @Test
  void unknownMagicIsStillParsedAsLegacyPcap() throws Exception {
    byte[] frame = Frames.tcp("10.0.0.1", "10.0.0.2", 40000, 80, "GET / HTTP/1.1\r\n\r\n");
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("mangled.pcap"), List.of(frame));
    byte[] bytes = Files.readAllBytes(pcap);
    bytes[0] = 0x00;
    bytes[3] = 0x00;
    Files.write(pcap, bytes);

    try (PcapFileReader reader = open(pcap)) {
      assertEquals(PcapFileReader.Format.UNKNOWN, reader.format());
      RawFrame read = reader.next().orElseThrow();
      assertArrayEquals(frame, read.data());
      assertEquals(PcapFixtures.BASE_MICROS, read.timestampMicros());
      assertTrue(reader.next().isEmpty());
    }
  }

  @Test
  void headerOnlyCaptureYieldsNoFrames() throws Exception {
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("header.pcap"), List.of());
    try (PcapFileReader reader = open(pcap)) {
      Optional<RawFrame> frame = reader.next();
      assertTrue(frame.isEmpty());
    }
  }

  private static PcapFileReader open(Path file) throws Exception {
    InputStream in = Files.newInputStream(file);
    return new PcapFileReader(in, file.toString());
  }
}
