package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void parseAddressHandlesIpv4() {
    assertArrayEquals(new byte[] {10, 0, 0, 1}, Net.parseAddress(" 10.0.0.1 "));
  }

  @Test
  void parseAddressHandlesIpv6() {
    assertEquals(16, Net.parseAddress("2001:db8::1").length);
  }

  @Test
  void parseAddressRejectsHostnamesAndBadOctets() {
    assertThrows(IllegalArgumentException.class, () -> Net.parseAddress("example.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.parseAddress("10.0.0.256"));
    assertThrows(IllegalArgumentException.class, () -> Net.parseAddress("unknown"));
  }

  @Test
  void cidrContainsAddressesUnderPrefix() {
    Net.Cidr block = Net.parseCidr("192.168.0.0/16");

    assertTrue(block.contains("192.168.44.3"));
    assertFalse(block.contains("192.169.0.1"));
    assertFalse(block.contains("2001:db8::1"));
    assertFalse(block.contains("unknown"));
    assertEquals("192.168.0.0/16", block.toString());
  }

  @Test
  void cidrHandlesPartialBytePrefixes() {
    Net.Cidr block = Net.parseCidr("10.0.0.0/12");

    assertTrue(block.contains("10.15.255.255"));
    assertFalse(block.contains("10.16.0.0"));
  }

  @Test
  void bareAddressIsHostPrefix() {
    assertEquals(32, Net.parseCidr("127.0.0.1").prefixLength());
    assertEquals(128, Net.parseCidr("::1").prefixLength());
  }

  @Test
  void parseCidrRejectsOversizedPrefix() {
    assertThrows(IllegalArgumentException.class, () -> Net.parseCidr("10.0.0.0/33"));
    assertThrows(IllegalArgumentException.class, () -> Net.parseCidr("10.0.0.0/x"));
  }

  @Test
  void parsePortEnforcesRange() {
    assertEquals(443, Net.parsePort("443"));
    assertThrows(IllegalArgumentException.class, () -> Net.parsePort("65536"));
    assertThrows(IllegalArgumentException.class, () -> Net.parsePort("-1"));
  }
}
