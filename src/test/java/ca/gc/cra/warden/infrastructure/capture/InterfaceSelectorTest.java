package ca.gc.cra.warden.infrastructure.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.infrastructure.capture.InterfaceSelector.Candidate;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class InterfaceSelectorTest {

  @Test
  void prefersUpNonLoopbackInterfaceWithAddress() {
    List<Candidate> candidates = List.of(
        new Candidate("lo", true, true, true),
        new Candidate("docker0", false, false, true),
        new Candidate("eth1", false, true, false),
        new Candidate("eth0", false, true, true));

    assertEquals("eth0", InterfaceSelector.choose(candidates).orElseThrow().name());
  }

  @Test
  void fallsBackToLoopbackWhenNothingElseExists() {
    assertEquals("lo", InterfaceSelector.choose(List.of(new Candidate("lo", true, true, true))).orElseThrow().name());
    assertTrue(InterfaceSelector.choose(List.of()).isEmpty());
  }

  @Test
  void classifiesPermissionErrors() {
    IOException cause = new IOException("socket: Operation not permitted");

    CaptureException ex = InterfaceSelector.classify("Opening eth0", cause);

    assertEquals(WardenFailure.Kind.PERMISSION_DENIED, ex.failure().kind());
    assertEquals(InterfaceSelector.PERMISSION_SUGGESTION, ex.failure().suggestion());
    assertSame(cause, ex.getCause());
  }

  @Test
  void classifiesOtherErrorsAsCaptureIo() {
    CaptureException ex = InterfaceSelector.classify("Opening eth0", new IOException("device busy"));

    assertEquals(WardenFailure.Kind.CAPTURE_IO, ex.failure().kind());
    assertTrue(ex.failure().detail().contains("device busy"));
  }
}
