package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("queueCapacity", 10, 1, 64));
    assertEquals(0.5, Numbers.requireRange("anomalyThreshold", 0.5, 0d, 1d));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("queueCapacity", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("queueCapacity", 65, 1, 64));
  }

  @Test
  void requireRangeRejectsNonFiniteDoubles() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("threshold", Double.NaN, 0d, 1d));
    assertThrows(
        IllegalArgumentException.class,
        () -> Numbers.requireRange("threshold", Double.POSITIVE_INFINITY, 0d, Double.MAX_VALUE));
  }

  @Test
  void parseRejectsNonNumericText() {
    assertEquals(42L, Numbers.parseLong("maxPackets", " 42 "));
    assertEquals(0.25, Numbers.parseDouble("threshold", "0.25"));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("maxPackets", "many"));
    assertEquals("maxPackets must be numeric (was many)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("threshold", ""));
  }
}
