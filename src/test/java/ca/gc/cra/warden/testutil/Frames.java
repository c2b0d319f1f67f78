package ca.gc.cra.warden.testutil;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/** Builds Ethernet frames by hand for decoder and pipeline tests. */
public final class Frames {
  public static final int FIN = 0x01;
  public static final int SYN = 0x02;
  public static final int RST = 0x04;
  public static final int PSH = 0x08;
  public static final int ACK = 0x10;

  private Frames() {}

  /** Ethernet + IPv4 + TCP (20-byte header) carrying {@code payload}. */
  public static byte[] tcp(String src, String dst, int srcPort, int dstPort, int flags, byte[] payload) {
    ByteBuffer tcp = ByteBuffer.allocate(20 + payload.length);
    tcp.putShort((short) srcPort);
    tcp.putShort((short) dstPort);
    tcp.putInt(1);
    tcp.putInt(0);
    tcp.put((byte) 0x50);
    tcp.put((byte) flags);
    tcp.putShort((short) 65535);
    tcp.putShort((short) 0);
    tcp.putShort((short) 0);
    tcp.put(payload);
    return ethernetIpv4(src, dst, 6, tcp.array());
  }

  /** TCP frame with an ASCII payload and PSH|ACK flags. */
  public static byte[] tcp(String src, String dst, int srcPort, int dstPort, String payload) {
    return tcp(src, dst, srcPort, dstPort, PSH | ACK, payload.getBytes(StandardCharsets.ISO_8859_1));
  }

  /** Ethernet + IPv4 + UDP carrying {@code payload}. */
  public static byte[] udp(String src, String dst, int srcPort, int dstPort, byte[] payload) {
    ByteBuffer udp = ByteBuffer.allocate(8 + payload.length);
    udp.putShort((short) srcPort);
    udp.putShort((short) dstPort);
    udp.putShort((short) (8 + payload.length));
    udp.putShort((short) 0);
    udp.put(payload);
    return ethernetIpv4(src, dst, 17, udp.array());
  }

  /** UDP frame to port 53 carrying a standard query for {@code name}. */
  public static byte[] dnsQuery(String src, String dst, String name) {
    return udp(src, dst, 53000, 53, dnsQuestion(name));
  }

  /** DNS message with one question for {@code name} (type A, class IN). */
  public static byte[] dnsQuestion(String name) {
    ByteBuffer buf = ByteBuffer.allocate(12 + name.length() + 2 + 4);
    buf.putShort((short) 0x1234);
    buf.putShort((short) 0x0100);
    buf.putShort((short) 1);
    buf.putShort((short) 0);
    buf.putShort((short) 0);
    buf.putShort((short) 0);
    for (String label : name.split("\\.")) {
      buf.put((byte) label.length());
      buf.put(label.getBytes(StandardCharsets.US_ASCII));
    }
    buf.put((byte) 0);
    buf.putShort((short) 1);
    buf.putShort((short) 1);
    return buf.array();
  }

  /** Ethernet + IPv4 header around an already built transport segment. */
  public static byte[] ethernetIpv4(String src, String dst, int protocol, byte[] transport) {
    ByteBuffer frame = ByteBuffer.allocate(14 + 20 + transport.length);
    frame.put(new byte[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11});
    frame.putShort((short) 0x0800);
    frame.put((byte) 0x45);
    frame.put((byte) 0);
    frame.putShort((short) (20 + transport.length));
    frame.putShort((short) 0);
    frame.putShort((short) 0x4000);
    frame.put((byte) 64);
    frame.put((byte) protocol);
    frame.putShort((short) 0);
    frame.put(ipv4(src));
    frame.put(ipv4(dst));
    frame.put(transport);
    return frame.array();
  }

  /** Ethernet + IPv6 + TCP with no payload. */
  public static byte[] tcpIpv6(int srcPort, int dstPort, int flags) {
    ByteBuffer frame = ByteBuffer.allocate(14 + 40 + 20);
    frame.put(new byte[12]);
    frame.putShort((short) 0x86DD);
    frame.putInt(0x60000000);
    frame.putShort((short) 20);
    frame.put((byte) 6);
    frame.put((byte) 64);
    byte[] src = new byte[16];
    src[15] = 1;
    byte[] dst = new byte[16];
    dst[0] = (byte) 0x20;
    dst[1] = (byte) 0x01;
    dst[15] = 2;
    frame.put(src);
    frame.put(dst);
    frame.putShort((short) srcPort);
    frame.putShort((short) dstPort);
    frame.putInt(1);
    frame.putInt(0);
    frame.put((byte) 0x50);
    frame.put((byte) flags);
    frame.putShort((short) 1024);
    frame.putInt(0);
    return frame.array();
  }

  private static byte[] ipv4(String address) {
    String[] parts = address.split("\\.");
    byte[] out = new byte[4];
    for (int i = 0; i < 4; i++) {
      out[i] = (byte) Integer.parseInt(parts[i]);
    }
    return out;
  }
}
