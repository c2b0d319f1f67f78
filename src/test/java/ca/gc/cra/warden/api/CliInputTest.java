package ca.gc.cra.warden.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"interface=eth0", "--DRY-RUN", "-v", "bpf=tcp port 80"});

    assertArrayEquals(new String[] {"interface=eth0", "bpf=tcp port 80"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.dryRun());
    assertFalse(input.noMl());
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).hasFlag("--help"));
  }

  @Test
  void emptyInputHasNothing() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.hasFlag(null));
    assertFalse(input.hasFlag(" "));
  }

  @Test
  void bareArgumentsArePositional() {
    CliInput input = CliInput.parse(new String[] {"capture.pcap", "--no-ml", "maxPackets=10"});

    assertEquals(List.of("capture.pcap"), input.positionalArgs());
    assertArrayEquals(new String[] {"maxPackets=10"}, input.keyValueArgs());
    assertTrue(input.noMl());
  }

  @Test
  void requireOnlyRejectsUnexpectedArguments() {
    CliInput input = CliInput.parse(new String[] {"a.pcap", "b.pcap", "--no-ml"});

    assertDoesNotThrow(() -> input.requireOnly(Set.of(CliInput.NO_ML), 2));
    IllegalArgumentException extra =
        assertThrows(IllegalArgumentException.class, () -> input.requireOnly(Set.of(CliInput.NO_ML), 1));
    IllegalArgumentException flag =
        assertThrows(IllegalArgumentException.class, () -> input.requireOnly(Set.of(CliInput.DRY_RUN), 2));

    assertTrue(extra.getMessage().contains("b.pcap"));
    assertTrue(flag.getMessage().contains("--no-ml"));
  }
}
