package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.domain.detect.Severity;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Flags requests whose User-Agent names a known attack tool, limited to state-changing methods.
 *
 * @param id rule identifier reported on detections
 * @param severity severity reported when the rule fires
 * @param methods HTTP methods the rule applies to (upper case)
 * @param agents lower-case tool names searched for in the User-Agent
 * @since 0.1.0
 */
public record ScannerRule(String id, Severity severity, Set<String> methods, List<String> agents) {
  /** Identifier used for suspicious User-Agent detections. */
  public static final String DEFAULT_ID = "suspicious_scanner";

  /** Rule with no agents; never fires. */
  public static final ScannerRule DISABLED = new ScannerRule(DEFAULT_ID, Severity.MEDIUM, Set.of(), List.of());

  /**
   * Normalizes method and agent case.
   */
  public ScannerRule {
    if (id == null || id.isBlank()) {
      id = DEFAULT_ID;
    }
    Objects.requireNonNull(severity, "severity");
    Set<String> upper = new LinkedHashSet<>();
    for (String method : Objects.requireNonNull(methods, "methods")) {
      upper.add(method.trim().toUpperCase(Locale.ROOT));
    }
    methods = Set.copyOf(upper);
    List<String> lower = new ArrayList<>();
    for (String agent : Objects.requireNonNull(agents, "agents")) {
      if (!agent.isBlank()) {
        lower.add(agent.trim().toLowerCase(Locale.ROOT));
      }
    }
    agents = List.copyOf(lower);
  }

  /**
   * Returns the first listed tool name contained in the User-Agent, when the method is in scope.
   *
   * @param method HTTP method
   * @param userAgent User-Agent header value
   * @return matched tool name
   */
  public Optional<String> match(String method, String userAgent) {
    if (method == null || userAgent == null || userAgent.isEmpty()) {
      return Optional.empty();
    }
    if (!methods.contains(method.toUpperCase(Locale.ROOT))) {
      return Optional.empty();
    }
    String haystack = userAgent.toLowerCase(Locale.ROOT);
    for (String agent : agents) {
      if (haystack.contains(agent)) {
        return Optional.of(agent);
      }
    }
    return Optional.empty();
  }
}
