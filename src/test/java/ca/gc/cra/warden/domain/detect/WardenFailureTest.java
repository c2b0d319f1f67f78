package ca.gc.cra.warden.domain.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class WardenFailureTest {

  @Test
  void renderIncludesKindDetailAndSuggestion() {
    WardenFailure failure = new WardenFailure(
        WardenFailure.Kind.PERMISSION_DENIED, "cannot open eth0", "run as root");

    assertEquals("permission_denied: cannot open eth0 (run as root)", failure.render());
  }

  @Test
  void renderOmitsEmptySuggestion() {
    WardenFailure failure = new WardenFailure(WardenFailure.Kind.PCAP_EMPTY, "no packets", null);

    assertEquals("pcap_empty: no packets", failure.render());
  }

  @Test
  void detectionClampsConfidence() {
    Detection high = new Detection(
        DetectionType.SIGNATURE, "rule", Severity.HIGH, 1.7, "d", "payload_analysis", "", 0L);
    Detection nan = new Detection(
        DetectionType.ANOMALY, "rule", Severity.LOW, Double.NaN, "d", "ml_analysis", "", 0L);

    assertEquals(1d, high.confidence());
    assertEquals(0d, nan.confidence());
  }
}
