package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("interface", "auto", "snaplen", "65535");
    Map<String, String> yaml = Map.of("interface", "eth0", "dedupWindowSeconds", "60");
    Map<String, String> cli = Map.of("interface", "eth1");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("eth1", merged.get("interface"));
    assertEquals("60", merged.get("dedupWindowSeconds"));
    assertEquals("65535", merged.get("snaplen"));
    assertEquals(List.of("CLI overrides YAML for key: interface"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("snaplen", "1500")), Map.of(), Map.of("snaplen", "65535"), warnings::add);

    assertEquals("1500", merged.get("snaplen"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void nullCliEntriesAreIgnored() {
    Map<String, String> cli = new HashMap<>();
    cli.put("interface", null);

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(Optional.empty(), cli, Map.of("interface", "auto"), null);

    assertEquals("auto", merged.get("interface"));
  }
}
