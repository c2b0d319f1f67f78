package ca.gc.cra.warden.domain.detect;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Feature layout negotiated with a trained classifier.
 * <p><strong>Why:</strong> Models are trained offline against a schema that may differ from what live extraction
 * produces; reconciliation is resolved once at model load and reused for every packet.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param names feature names in model order; may be empty when the model does not publish them
 * @param expectedLength vector length the model accepts
 * @since 0.1.0
 */
public record FeatureSchema(List<String> names, int expectedLength) {

  /**
   * Copies names and validates the expected length.
   */
  public FeatureSchema {
    names = names == null ? List.of() : List.copyOf(names);
    if (expectedLength < 0) {
      throw new IllegalArgumentException("expectedLength must be >= 0");
    }
  }

  /**
   * Schema matching the engine's own six-slot {@link FeatureVector}.
   *
   * @return native schema
   */
  public static FeatureSchema nativeSchema() {
    return new FeatureSchema(FeatureVector.NAMES, FeatureVector.LENGTH);
  }

  /**
   * Builds a vector of exactly {@link #expectedLength()} values from named features.
   *
   * <p>With published names, values are taken in schema order and missing names default to {@code 0.0}. Without
   * names, the map's values are taken in sorted-key order. The result is then zero-padded or truncated to
   * {@link #expectedLength()}.</p>
   *
   * @param namedFeatures feature values keyed by name; may be empty
   * @return reconciled vector
   */
  public double[] reconcile(Map<String, Double> namedFeatures) {
    Map<String, Double> features = namedFeatures == null ? Map.of() : namedFeatures;
    double[] vector = new double[expectedLength];
    if (!names.isEmpty()) {
      int limit = Math.min(names.size(), expectedLength);
      for (int i = 0; i < limit; i++) {
        Double value = features.get(names.get(i));
        vector[i] = value == null || value.isNaN() ? 0d : value;
      }
      return vector;
    }
    int i = 0;
    for (Double value : new TreeMap<>(features).values()) {
      if (i >= expectedLength) {
        break;
      }
      vector[i++] = value == null || value.isNaN() ? 0d : value;
    }
    return vector;
  }
}
