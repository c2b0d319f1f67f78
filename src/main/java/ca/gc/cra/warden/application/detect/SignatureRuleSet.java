package ca.gc.cra.warden.application.detect;

import java.util.List;
import java.util.Objects;

/**
 * Ordered content signatures plus the User-Agent scanner rule.
 *
 * @param rules content signatures in evaluation order
 * @param scanner suspicious User-Agent rule
 * @since 0.1.0
 */
public record SignatureRuleSet(List<SignatureRule> rules, ScannerRule scanner) {

  /**
   * Copies the rule list.
   */
  public SignatureRuleSet {
    rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    scanner = Objects.requireNonNullElse(scanner, ScannerRule.DISABLED);
  }

  /**
   * Returns the number of content signatures.
   *
   * @return rule count
   */
  public int size() {
    return rules.size();
  }
}
