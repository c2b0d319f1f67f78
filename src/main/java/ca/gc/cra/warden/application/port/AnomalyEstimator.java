package ca.gc.cra.warden.application.port;

import java.util.List;

/**
 * Pluggable fitting step for the anomaly scorer: scales features and fits a density or isolation estimator.
 *
 * @since 0.1.0
 */
public interface AnomalyEstimator {
  /**
   * Fits a model to the buffered samples.
   *
   * @param samples feature arrays, all of the same length; never empty
   * @return fitted model
   */
  AnomalyModel fit(List<double[]> samples);
}
