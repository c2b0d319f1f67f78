package ca.gc.cra.warden.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.detect.Severity;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SignatureRuleLoaderTest {
  private final SignatureRuleLoader loader = new SignatureRuleLoader();

  @TempDir Path tempDir;

  @Test
  void builtInRulesKeepDeclaredOrder() throws IOException {
    SignatureRuleSet rules = loader.loadBuiltIn();

    assertEquals(7, rules.size());
    assertEquals("sql_injection", rules.rules().get(0).id());
    assertEquals(Severity.CRITICAL, rules.rules().get(5).severity());
    assertTrue(rules.scanner().methods().contains("POST"));
    assertTrue(rules.scanner().agents().contains("nikto"));
  }

  @Test
  void loadsCustomFileCaseInsensitively() throws IOException {
    Path file = tempDir.resolve("rules.yaml");
    Files.writeString(file, String.join("\n",
        "version: 1",
        "rules:",
        "  - id: beacon",
        "    severity: low",
        "    patterns: 'BEACON-[0-9]+'",
        ""), StandardCharsets.UTF_8);

    SignatureRuleSet rules = loader.load(file);

    assertEquals(1, rules.size());
    assertTrue(rules.rules().get(0).firstMatch("payload beacon-42 seen").isPresent());
    assertEquals(ScannerRule.DISABLED, rules.scanner());
  }

  @Test
  void rejectsDuplicateIds() {
    String yaml = String.join("\n",
        "version: 1",
        "rules:",
        "  - {id: a, severity: low, patterns: [x]}",
        "  - {id: a, severity: high, patterns: [y]}");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> loader.parse(new StringReader(yaml), "inline"));
    assertTrue(ex.getMessage().contains("Duplicate signature id"));
  }

  @Test
  void rejectsInvalidRegex() {
    String yaml = "version: 1\nrules:\n  - {id: bad, severity: low, patterns: ['(unclosed']}\n";

    assertThrows(IllegalArgumentException.class, () -> loader.parse(new StringReader(yaml), "inline"));
  }

  @Test
  void rejectsUnsupportedVersion() {
    assertThrows(IllegalArgumentException.class, () -> loader.parse(new StringReader("version: 2\n"), "inline"));
  }

  @Test
  void missingFileIsIoError() {
    assertThrows(IOException.class, () -> loader.load(tempDir.resolve("absent.yaml")));
  }
}
