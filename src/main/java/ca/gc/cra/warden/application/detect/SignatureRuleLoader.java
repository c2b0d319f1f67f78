package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.domain.detect.Severity;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads signature rules from YAML: the built-in classpath set or an operator-supplied file.
 *
 * <p>Documents carry {@code version: 1}, an ordered {@code rules} list and an optional
 * {@code suspicious_user_agents} section. Rule ids must be unique.</p>
 *
 * @since 0.1.0
 */
public final class SignatureRuleLoader {
  /** Classpath location of the built-in rule set. */
  public static final String BUILT_IN_RESOURCE = "/ca/gc/cra/warden/signatures.yaml";

  /**
   * Loads the rule set bundled with WARDEN.
   *
   * @return built-in rules
   * @throws IOException if the resource is missing or unreadable
   */
  public SignatureRuleSet loadBuiltIn() throws IOException {
    try (InputStream in = SignatureRuleLoader.class.getResourceAsStream(BUILT_IN_RESOURCE)) {
      if (in == null) {
        throw new IOException("Built-in signature resource not found: " + BUILT_IN_RESOURCE);
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), BUILT_IN_RESOURCE);
    }
  }

  /**
   * Loads rules from a YAML file.
   *
   * @param path rule file
   * @return parsed rules
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document is malformed
   */
  public SignatureRuleSet load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Signature file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  SignatureRuleSet parse(Reader reader, String origin) {
    try {
      Object rootObj = new Yaml().load(reader);
      if (rootObj == null) {
        return new SignatureRuleSet(List.of(), ScannerRule.DISABLED);
      }
      Map<String, Object> root = asMap(rootObj, "root");
      int version = toInt(root.get("version"), "version");
      if (version != 1) {
        throw new IllegalArgumentException("Unsupported signature version " + version + " in " + origin);
      }

      List<SignatureRule> rules = new ArrayList<>();
      Set<String> ids = new LinkedHashSet<>();
      Object rulesNode = root.get("rules");
      if (rulesNode instanceof Iterable<?> iterable) {
        for (Object ruleNode : iterable) {
          SignatureRule rule = parseRule(asMap(ruleNode, "rule"));
          if (!ids.add(rule.id())) {
            throw new IllegalArgumentException("Duplicate signature id detected: " + rule.id());
          }
          rules.add(rule);
        }
      } else if (rulesNode != null) {
        throw new IllegalArgumentException("rules must be a list in " + origin);
      }

      ScannerRule scanner = ScannerRule.DISABLED;
      Object scannerNode = root.get("suspicious_user_agents");
      if (scannerNode != null) {
        scanner = parseScanner(asMap(scannerNode, "suspicious_user_agents"));
      }
      return new SignatureRuleSet(rules, scanner);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML signatures at " + origin, ex);
    }
  }

  private SignatureRule parseRule(Map<String, Object> map) {
    String id = requireString(map, "id");
    Severity severity = Severity.parse(requireString(map, "severity"));
    String description = toString(map.get("description"));
    List<Pattern> patterns = new ArrayList<>();
    for (String regex : toStringList(map.get("patterns"), "patterns")) {
      try {
        patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
      } catch (PatternSyntaxException ex) {
        throw new IllegalArgumentException("Invalid pattern for signature " + id + ": " + regex, ex);
      }
    }
    return new SignatureRule(id, severity, description, patterns);
  }

  private ScannerRule parseScanner(Map<String, Object> map) {
    Object idNode = map.get("id");
    String id = idNode == null ? ScannerRule.DEFAULT_ID : toString(idNode);
    Object severityNode = map.get("severity");
    Severity severity = severityNode == null ? Severity.MEDIUM : Severity.parse(toString(severityNode));
    List<String> methods = toStringList(map.get("methods"), "methods");
    List<String> agents = toStringList(map.get("agents"), "agents");
    return new ScannerRule(id, severity, new LinkedHashSet<>(methods), agents);
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object keyObj = entry.getKey();
      if (!(keyObj instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private List<String> toStringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    List<String> values = new ArrayList<>();
    if (node instanceof String single) {
      values.add(single);
    } else if (node instanceof Iterable<?> iterable) {
      for (Object value : iterable) {
        values.add(toString(value));
      }
    } else {
      throw new IllegalArgumentException(context + " must be string or list");
    }
    return values;
  }

  private String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return toString(value);
  }

  private String toString(Object value) {
    if (value == null) {
      return "";
    }
    return value.toString();
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'", ex);
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }
}
