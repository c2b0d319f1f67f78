package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("warden.yaml");
    Files.writeString(yaml, """
        common:
          anomalyThreshold: 0.4
          portScanThreshold: 10
        live:
          interface: eth1
          portScanThreshold: 20
        analyze:
          pcapMaxPackets: 5000
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "LIVE").orElseThrow();

    assertEquals("0.4", map.get("anomalyThreshold"));
    assertEquals("eth1", map.get("interface"));
    assertEquals("20", map.get("portScanThreshold"));
    assertFalse(map.containsKey("pcapMaxPackets"));
  }

  @Test
  void listsBecomeCommaSeparatedAndNullsBecomeBlank() throws IOException {
    Path yaml = tempDir.resolve("lists.yaml");
    Files.writeString(yaml, """
        common:
          whitelistIps:
            - 127.0.0.1
            - 10.0.0.0/8
          whitelistPorts: []
          signatureFile:
          otel:
            endpoint: http://collector:4317
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "analyze").orElseThrow();

    assertEquals("127.0.0.1,10.0.0.0/8", map.get("whitelistIps"));
    assertEquals("", map.get("whitelistPorts"));
    assertEquals("", map.get("signatureFile"));
    assertEquals("http://collector:4317", map.get("otel.endpoint"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "live");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertTrue(YamlConfigLoader.load(yaml, "live").orElseThrow().isEmpty());
  }

  @Test
  void invalidStructuresAreRejected() throws IOException {
    Path sequenceRoot = Files.writeString(tempDir.resolve("seq.yaml"), "- live:\n    interface: eth0\n");
    Path nestedList = Files.writeString(tempDir.resolve("nested.yaml"), """
        common:
          whitelistIps:
            - [10.0.0.1, 10.0.0.2]
        """);
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(sequenceRoot, "live"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "live"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "live"));
  }
}
