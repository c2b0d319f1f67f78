package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.detect.FeatureSchema;

/**
 * <strong>What:</strong> Inference contract of a supervised binary classifier (benign=0, malicious=1).
 * <p><strong>Why:</strong> Training happens elsewhere; the engine only needs probabilities and the feature layout
 * the model was trained on.</p>
 * <p><strong>Role:</strong> Implemented by {@code LogisticClassificationModel} and
 * {@code UnavailableClassificationModel}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be immutable or otherwise safe for concurrent
 * prediction.</p>
 *
 * @since 0.1.0
 */
public interface ClassificationModel {
  /**
   * Indicates whether a trained model is loaded.
   *
   * @return {@code false} when predictions are unavailable
   */
  boolean isTrained();

  /**
   * Returns the feature layout the model expects.
   *
   * @return schema with feature names and expected vector length
   */
  FeatureSchema featureSchema();

  /**
   * Predicts class probabilities for a vector already reconciled to {@link #featureSchema()}.
   *
   * @param vector feature values of length {@code featureSchema().expectedLength()}
   * @return {@code [p_benign, p_malicious]}
   */
  double[] predictProba(double[] vector);

  /**
   * Returns the model family name reported in model info.
   *
   * @return type label
   */
  String modelType();
}
