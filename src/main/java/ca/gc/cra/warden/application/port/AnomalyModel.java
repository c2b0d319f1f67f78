package ca.gc.cra.warden.application.port;

/**
 * A fitted unsupervised model that scores feature vectors.
 *
 * <p>Implementations are immutable once fitted so the scorer can swap them atomically.</p>
 *
 * @since 0.1.0
 */
public interface AnomalyModel {
  /**
   * Returns the signed decision score; larger magnitudes lie further from the fitted boundary.
   *
   * @param features feature values in schema order
   * @return decision score
   */
  double decisionScore(double[] features);

  /**
   * Indicates whether the vector falls outside the fitted region.
   *
   * @param features feature values in schema order
   * @return {@code true} for outliers
   */
  boolean isAnomaly(double[] features);

  /**
   * Returns the model family name reported in model info.
   *
   * @return type label
   */
  String modelType();
}
