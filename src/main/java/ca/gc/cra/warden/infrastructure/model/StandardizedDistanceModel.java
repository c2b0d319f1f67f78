package ca.gc.cra.warden.infrastructure.model;

import ca.gc.cra.warden.application.port.AnomalyModel;
import java.util.Arrays;

/**
 * <strong>What:</strong> Fitted standardized-distance anomaly model.
 * <p>Each feature is z-scored with the training mean and standard deviation; the distance of a vector is the root
 * mean square of its z-scores. Vectors further than the training cutoff (the 90th percentile of training distances)
 * are anomalies. The decision score is {@code (cutoff - distance) / cutoff}: positive inside the fitted region,
 * negative outside it.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class StandardizedDistanceModel implements AnomalyModel {
  /** Model family reported in model info and model files. */
  public static final String TYPE = "standardized_distance";

  private final double[] mean;
  private final double[] scale;
  private final double cutoff;

  /**
   * Creates a model from fitted parameters.
   *
   * @param mean per-feature training mean
   * @param scale per-feature scale; zero entries are replaced by 1
   * @param cutoff distance above which vectors are anomalous; must be positive
   */
  public StandardizedDistanceModel(double[] mean, double[] scale, double cutoff) {
    if (mean == null || scale == null || mean.length != scale.length || mean.length == 0) {
      throw new IllegalArgumentException("mean and scale must be non-empty and of equal length");
    }
    if (!(cutoff > 0d) || Double.isInfinite(cutoff)) {
      throw new IllegalArgumentException("cutoff must be positive and finite: " + cutoff);
    }
    this.mean = mean.clone();
    this.scale = new double[scale.length];
    for (int i = 0; i < scale.length; i++) {
      this.scale[i] = scale[i] > 0d && Double.isFinite(scale[i]) ? scale[i] : 1d;
    }
    this.cutoff = cutoff;
  }

  /**
   * Returns the standardized distance of a vector from the training mean.
   *
   * @param features vector of the fitted length
   * @return root-mean-square z-score
   */
  public double distance(double[] features) {
    if (features == null || features.length != mean.length) {
      throw new IllegalArgumentException(
          "expected " + mean.length + " features, got " + (features == null ? 0 : features.length));
    }
    double sum = 0d;
    for (int i = 0; i < mean.length; i++) {
      double z = (features[i] - mean[i]) / scale[i];
      sum += z * z;
    }
    return Math.sqrt(sum / mean.length);
  }

  @Override
  public double decisionScore(double[] features) {
    return (cutoff - distance(features)) / cutoff;
  }

  @Override
  public boolean isAnomaly(double[] features) {
    return distance(features) > cutoff;
  }

  @Override
  public String modelType() {
    return TYPE;
  }

  /**
   * Returns the training means.
   *
   * @return copy of the mean vector
   */
  public double[] mean() {
    return mean.clone();
  }

  /**
   * Returns the feature scales.
   *
   * @return copy of the scale vector
   */
  public double[] scale() {
    return scale.clone();
  }

  /**
   * Returns the anomaly cutoff.
   *
   * @return cutoff distance
   */
  public double cutoff() {
    return cutoff;
  }

  @Override
  public String toString() {
    return "StandardizedDistanceModel{features=" + mean.length
        + ", mean=" + Arrays.toString(mean)
        + ", cutoff=" + cutoff + '}';
  }
}
