package ca.gc.cra.warden.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigCliUtilsTest {
  @TempDir Path tempDir;

  @Test
  void parseBooleanAcceptsCommonSpellings() {
    Map<String, String> map = Map.of("a", "YES", "b", "off", "c", " ");

    assertTrue(ConfigCliUtils.parseBoolean(map, "a", false));
    assertFalse(ConfigCliUtils.parseBoolean(map, "b", true));
    assertTrue(ConfigCliUtils.parseBoolean(map, "c", true));
    assertFalse(ConfigCliUtils.parseBoolean(null, "a", false));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigCliUtils.parseBoolean(Map.of("ml", "maybe"), "ml", true));
  }

  @Test
  void extractConfigPathRemovesKey() {
    Map<String, String> args = new HashMap<>(Map.of("config", " warden.yaml ", "interface", "eth0"));

    assertEquals("warden.yaml", ConfigCliUtils.extractConfigPath(args));
    assertFalse(args.containsKey("config"));
    assertNull(ConfigCliUtils.extractConfigPath(args));
  }

  @Test
  void effectiveConfigLayersDefaultsYamlAndCli() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("warden.yaml"), """
        common:
          dedupWindowSeconds: 60
          otelEndpoint: http://collector:4317
        live:
          interface: eth0
          snaplen: 1500
        """);
    Map<String, String> cli = new LinkedHashMap<>();
    cli.put("config", yaml.toString());
    cli.put("snaplen", "9000");

    ConfigCliUtils.Effective effective = ConfigCliUtils.effectiveConfig(cli, "live");
    Map<String, String> merged = effective.values();

    assertEquals("eth0", merged.get("interface"));
    assertEquals("9000", merged.get("snaplen"));
    assertEquals("60", merged.get("dedupWindowSeconds"));
    assertEquals("300", merged.get("idleTimeoutSeconds"));
    assertFalse(merged.containsKey("otelEndpoint"));
    assertEquals("http://collector:4317", effective.telemetry().endpoint().toString());
  }

  @Test
  void missingConfigFileIsRejected() {
    Map<String, String> cli = new LinkedHashMap<>(Map.of("config", tempDir.resolve("absent.yaml").toString()));

    assertThrows(IllegalArgumentException.class, () -> ConfigCliUtils.effectiveConfig(cli, "live"));
  }

  @Test
  void telemetryKeysAreValidatedBeforeStartup() {
    Map<String, String> cli = new LinkedHashMap<>(Map.of("metricsExporter", "prometheus"));

    assertThrows(IllegalArgumentException.class, () -> ConfigCliUtils.effectiveConfig(cli, "analyze"));
  }

  @Test
  void requirePathRejectsMissingKeys() {
    assertThrows(IllegalArgumentException.class, () -> ConfigCliUtils.requirePath(Map.of(), "pcap"));
    assertTrue(ConfigCliUtils.requirePath(Map.of("pcap", "a.pcap"), "pcap").isAbsolute());
  }
}
