package ca.gc.cra.warden.infrastructure.net;

import ca.gc.cra.warden.application.port.FrameDecoder;
import ca.gc.cra.warden.domain.net.HttpHints;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.domain.net.Protocol;
import ca.gc.cra.warden.domain.net.RawFrame;
import ca.gc.cra.warden.domain.net.TcpFlags;
import ca.gc.cra.warden.domain.util.Bytes;
import ca.gc.cra.warden.domain.util.Entropy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Optional;

public final class PacketDecoder implements FrameDecoder {
  private static final int ETHERTYPE_IPV4 = 0x0800;
  private static final int ETHERTYPE_ARP = 0x0806;
  private static final int ETHERTYPE_IPV6 = 0x86DD;
  private static final int ETHERTYPE_VLAN = 0x8100;
  private static final int ETHERTYPE_QINQ = 0x88A8;
  private static final int MAX_VLAN_TAGS = 2;
  private static final int MAX_IPV6_EXTENSIONS = 4;

  @Override
  public Optional<PacketRecord> decode(RawFrame frame) {
    if (frame == null) return Optional.empty();
    byte[] pkt = frame.data();
    int caplen = pkt.length;
    long ts = frame.timestampMicros();

    return switch (frame.linkType()) {
      case ETHERNET -> decodeEthernet(pkt, caplen, ts);
      case LINUX_SLL -> caplen < 16
          ? Optional.empty()
          : dispatch(Bytes.u16be(pkt, 14), pkt, caplen, 16, ts);
      case LINUX_SLL2 -> caplen < 20
          ? Optional.empty()
          : dispatch(Bytes.u16be(pkt, 0), pkt, caplen, 20, ts);
      case NULL -> decodeLoopback(pkt, caplen, ts);
      case RAW -> decodeRawIp(pkt, caplen, 0, ts);
      case UNSUPPORTED -> Optional.empty();
    };
  }

  private Optional<PacketRecord> decodeEthernet(byte[] pkt, int caplen, long ts) {
    if (caplen < 14) return Optional.empty();

    int etherType = Bytes.u16be(pkt, 12);
    int offset = 14;

    // VLAN tags, including QinQ stacks
    for (int tags = 0; tags < MAX_VLAN_TAGS && (etherType == ETHERTYPE_VLAN || etherType == ETHERTYPE_QINQ); tags++) {
      if (caplen < offset + 4) return Optional.empty();
      etherType = Bytes.u16be(pkt, offset + 2);
      offset += 4;
    }
    return dispatch(etherType, pkt, caplen, offset, ts);
  }

  private Optional<PacketRecord> decodeLoopback(byte[] pkt, int caplen, long ts) {
    if (caplen < 4) return Optional.empty();
    // Address family is stored in the capturing host's byte order.
    int family = Bytes.u8(pkt, 0) != 0 ? Bytes.u8(pkt, 0) : Bytes.u8(pkt, 3);
    return switch (family) {
      case 2 -> decodeIpv4(pkt, caplen, 4, ts);
      case 24, 28, 30 -> decodeIpv6(pkt, caplen, 4, ts);
      default -> Optional.empty();
    };
  }

  private Optional<PacketRecord> decodeRawIp(byte[] pkt, int caplen, int offset, long ts) {
    if (caplen <= offset) return Optional.empty();
    int version = Bytes.u8(pkt, offset) >>> 4;
    if (version == 4) return decodeIpv4(pkt, caplen, offset, ts);
    if (version == 6) return decodeIpv6(pkt, caplen, offset, ts);
    return Optional.empty();
  }

  private Optional<PacketRecord> dispatch(int etherType, byte[] pkt, int caplen, int offset, long ts) {
    return switch (etherType) {
      case ETHERTYPE_IPV4 -> decodeIpv4(pkt, caplen, offset, ts);
      case ETHERTYPE_IPV6 -> decodeIpv6(pkt, caplen, offset, ts);
      case ETHERTYPE_ARP -> decodeArp(pkt, caplen, offset, ts);
      default -> Optional.of(new PacketRecord(
          ts, null, null, 0, 0, Protocol.other(etherType), caplen, 0, TcpFlags.NONE, null, HttpHints.NONE, "", 0d));
    };
  }

  private Optional<PacketRecord> decodeIpv4(byte[] pkt, int caplen, int offset, long ts) {
    if (caplen < offset + 20) return Optional.empty();
    int vihl = Bytes.u8(pkt, offset);
    if ((vihl >>> 4) != 4) return Optional.empty();
    int ihl = (vihl & 0x0F) * 4;
    if (ihl < 20 || caplen < offset + ihl) return Optional.empty();

    int proto = Bytes.u8(pkt, offset + 9);
    int totalLen = Bytes.u16be(pkt, offset + 2);
    int ipPayload = Math.max(0, Math.min(totalLen - ihl, caplen - offset - ihl));
    boolean laterFragment = (Bytes.u16be(pkt, offset + 6) & 0x1FFF) != 0;

    String src = ipv4(pkt, offset + 12);
    String dst = ipv4(pkt, offset + 16);

    offset += ihl;
    Protocol protocol = Protocol.fromIpv4(proto);
    if (laterFragment) {
      // Non-first fragments carry no transport header.
      return Optional.of(opaque(pkt, caplen, offset, ipPayload, src, dst, protocol, ts));
    }
    return decodeTransport(pkt, caplen, offset, ipPayload, src, dst, protocol, ts);
  }

  private Optional<PacketRecord> decodeIpv6(byte[] pkt, int caplen, int offset, long ts) {
    if (caplen < offset + 40) return Optional.empty();
    if ((Bytes.u8(pkt, offset) >>> 4) != 6) return Optional.empty();
    int nextHdr = Bytes.u8(pkt, offset + 6);
    int payloadLen = Bytes.u16be(pkt, offset + 4);
    int ipPayload = Math.max(0, Math.min(payloadLen, caplen - offset - 40));

    String src = ipv6(pkt, offset + 8);
    String dst = ipv6(pkt, offset + 24);

    offset += 40;
    for (int i = 0; i < MAX_IPV6_EXTENSIONS && isExtension(nextHdr); i++) {
      if (caplen < offset + 8) return Optional.empty();
      int extLen = nextHdr == 44 ? 8 : (Bytes.u8(pkt, offset + 1) + 1) * 8;
      nextHdr = Bytes.u8(pkt, offset);
      offset += extLen;
      ipPayload -= extLen;
      if (ipPayload < 0 || offset > caplen) return Optional.empty();
    }
    return decodeTransport(pkt, caplen, offset, ipPayload, src, dst, Protocol.fromIpv6(nextHdr), ts);
  }

  private Optional<PacketRecord> decodeArp(byte[] pkt, int caplen, int offset, long ts) {
    if (caplen < offset + 28) return Optional.empty();
    int ptype = Bytes.u16be(pkt, offset + 2);
    int hlen = Bytes.u8(pkt, offset + 4);
    int plen = Bytes.u8(pkt, offset + 5);
    if (ptype != ETHERTYPE_IPV4 || hlen != 6 || plen != 4) {
      return Optional.of(new PacketRecord(
          ts, null, null, 0, 0, Protocol.ARP, caplen, 0, TcpFlags.NONE, null, HttpHints.NONE, "", 0d));
    }
    String sender = ipv4(pkt, offset + 14);
    String target = ipv4(pkt, offset + 24);
    return Optional.of(new PacketRecord(
        ts, sender, target, 0, 0, Protocol.ARP, caplen, 0, TcpFlags.NONE, null, HttpHints.NONE, "", 0d));
  }

  private Optional<PacketRecord> decodeTransport(
      byte[] pkt,
      int caplen,
      int offset,
      int ipPayload,
      String src,
      String dst,
      Protocol protocol,
      long ts) {
    return switch (protocol.kind()) {
      case TCP -> decodeTcp(pkt, caplen, offset, ipPayload, src, dst, ts);
      case UDP -> decodeUdp(pkt, caplen, offset, ipPayload, src, dst, ts);
      case ICMP, ICMPV6 -> {
        if (caplen < offset + 4) yield Optional.empty();
        int headerLen = Math.min(8, ipPayload);
        yield Optional.of(opaque(pkt, caplen, offset + headerLen, ipPayload - headerLen, src, dst, protocol, ts));
      }
      default -> Optional.of(opaque(pkt, caplen, offset, ipPayload, src, dst, protocol, ts));
    };
  }

  private Optional<PacketRecord> decodeTcp(
      byte[] pkt, int caplen, int offset, int ipPayload, String src, String dst, long ts) {
    if (caplen < offset + 20) return Optional.empty();

    int sport = Bytes.u16be(pkt, offset);
    int dport = Bytes.u16be(pkt, offset + 2);

    int dataOff = (Bytes.u8(pkt, offset + 12) >>> 4) * 4;
    if (dataOff < 20 || caplen < offset + dataOff) return Optional.empty();

    TcpFlags flags = TcpFlags.fromBits(Bytes.u8(pkt, offset + 13));

    int payloadOffset = offset + dataOff;
    int payloadLen = Math.max(0, Math.min(caplen - payloadOffset, ipPayload - dataOff));
    HttpHints http = ApplicationHints.http(pkt, payloadOffset, payloadLen);
    return Optional.of(new PacketRecord(
        ts,
        src,
        dst,
        sport,
        dport,
        Protocol.TCP,
        caplen,
        payloadLen,
        flags,
        sample(pkt, payloadOffset, payloadLen),
        http,
        "",
        Entropy.shannon(pkt, payloadOffset, payloadLen)));
  }

  private Optional<PacketRecord> decodeUdp(
      byte[] pkt, int caplen, int offset, int ipPayload, String src, String dst, long ts) {
    if (caplen < offset + 8) return Optional.empty();

    int sport = Bytes.u16be(pkt, offset);
    int dport = Bytes.u16be(pkt, offset + 2);
    int udpLen = Bytes.u16be(pkt, offset + 4);
    int declared = udpLen >= 8 ? udpLen - 8 : ipPayload - 8;

    int payloadOffset = offset + 8;
    int payloadLen = Math.max(0, Math.min(caplen - payloadOffset, Math.min(declared, ipPayload - 8)));
    String dnsQuery = (sport == 53 || dport == 53)
        ? ApplicationHints.dnsQuery(pkt, payloadOffset, payloadLen)
        : "";
    return Optional.of(new PacketRecord(
        ts,
        src,
        dst,
        sport,
        dport,
        Protocol.UDP,
        caplen,
        payloadLen,
        TcpFlags.NONE,
        sample(pkt, payloadOffset, payloadLen),
        HttpHints.NONE,
        dnsQuery,
        Entropy.shannon(pkt, payloadOffset, payloadLen)));
  }

  private static PacketRecord opaque(
      byte[] pkt, int caplen, int offset, int length, String src, String dst, Protocol protocol, long ts) {
    int payloadLen = Math.max(0, Math.min(caplen - offset, length));
    return new PacketRecord(
        ts,
        src,
        dst,
        0,
        0,
        protocol,
        caplen,
        payloadLen,
        TcpFlags.NONE,
        sample(pkt, offset, payloadLen),
        HttpHints.NONE,
        "",
        Entropy.shannon(pkt, offset, payloadLen));
  }

  private static byte[] sample(byte[] pkt, int offset, int length) {
    if (length <= 0 || offset >= pkt.length) {
      return new byte[0];
    }
    int end = Math.min(pkt.length, offset + Math.min(length, PacketRecord.PAYLOAD_SAMPLE_BYTES));
    return Arrays.copyOfRange(pkt, offset, end);
  }

  private static boolean isExtension(int nextHdr) {
    return nextHdr == 0 || nextHdr == 43 || nextHdr == 44 || nextHdr == 60;
  }

  private static String ipv4(byte[] p, int off) {
    return (Bytes.u8(p, off))
        + "." + Bytes.u8(p, off + 1)
        + "." + Bytes.u8(p, off + 2)
        + "." + Bytes.u8(p, off + 3);
  }

  private static String ipv6(byte[] p, int off) {
    try {
      return InetAddress.getByAddress(Arrays.copyOfRange(p, off, off + 16)).getHostAddress();
    } catch (UnknownHostException e) {
      return "::";
    }
  }
}
