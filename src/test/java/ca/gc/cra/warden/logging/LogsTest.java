package ca.gc.cra.warden.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {
  @Test
  void sanitizeFlattensForgedLogLines() {
    String hostile = "evil.example\r\n2024-01-01 INFO forged entry\u0000";

    String clean = Logs.sanitize(hostile, 256);

    assertFalse(clean.contains("\n"));
    assertFalse(clean.contains("\r"));
    assertEquals("evil.example??2024-01-01 INFO forged entry?", clean);
  }

  @Test
  void sanitizeReturnsCleanInputUnchanged() {
    String description = "SQL injection attempt detected";

    assertSame(description, Logs.sanitize(description, 256));
    assertEquals("<null>", Logs.sanitize(null, 16));
  }

  @Test
  void truncateKeepsWholeCodePoints() {
    String value = "caf\u00e9-payload";

    String truncated = Logs.truncate(value, 4);

    assertTrue(truncated.startsWith("caf..."));
    assertTrue(truncated.endsWith("(truncated, 4 of 13)"));
    assertEquals("short", Logs.truncate("short", 16));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
