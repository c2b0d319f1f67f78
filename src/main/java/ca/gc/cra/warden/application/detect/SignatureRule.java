package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.domain.detect.Severity;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A named content signature: static metadata plus an ordered list of case-insensitive patterns.
 *
 * @param id signature identifier, e.g. {@code sql_injection}
 * @param severity severity reported when the rule fires
 * @param description human-readable description copied onto detections
 * @param patterns compiled patterns evaluated in order
 * @since 0.1.0
 */
public record SignatureRule(String id, Severity severity, String description, List<Pattern> patterns) {

  /**
   * Validates the rule and copies the pattern list.
   */
  public SignatureRule {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("signature id must not be blank");
    }
    Objects.requireNonNull(severity, "severity");
    description = Objects.requireNonNullElse(description, "");
    patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
    if (patterns.isEmpty()) {
      throw new IllegalArgumentException("signature " + id + " must declare at least one pattern");
    }
  }

  /**
   * Returns the first pattern found anywhere in {@code text}.
   *
   * @param text text to search; empty text never matches
   * @return matching pattern, if any
   */
  public Optional<Pattern> firstMatch(CharSequence text) {
    if (text == null || text.length() == 0) {
      return Optional.empty();
    }
    for (Pattern pattern : patterns) {
      if (pattern.matcher(text).find()) {
        return Optional.of(pattern);
      }
    }
    return Optional.empty();
  }
}
