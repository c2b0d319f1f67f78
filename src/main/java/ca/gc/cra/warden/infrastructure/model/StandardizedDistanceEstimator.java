package ca.gc.cra.warden.infrastructure.model;

import ca.gc.cra.warden.application.port.AnomalyEstimator;
import ca.gc.cra.warden.application.port.AnomalyModel;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Fits a {@link StandardizedDistanceModel} with Commons Math summary statistics.
 *
 * <p>Scaling uses the sample standard deviation of each feature; the cutoff is a percentile of the training
 * distances (default 90, so roughly a tenth of training traffic lies on the boundary).</p>
 *
 * @since 0.1.0
 */
public final class StandardizedDistanceEstimator implements AnomalyEstimator {
  /** Default cutoff percentile. */
  public static final double DEFAULT_PERCENTILE = 90d;
  private static final double MIN_CUTOFF = 1e-6;

  private final double percentile;

  /**
   * Creates an estimator with {@link #DEFAULT_PERCENTILE}.
   */
  public StandardizedDistanceEstimator() {
    this(DEFAULT_PERCENTILE);
  }

  /**
   * Creates an estimator.
   *
   * @param percentile cutoff percentile in {@code (0, 100]}
   */
  public StandardizedDistanceEstimator(double percentile) {
    if (!(percentile > 0d && percentile <= 100d)) {
      throw new IllegalArgumentException("percentile must be in (0,100]: " + percentile);
    }
    this.percentile = percentile;
  }

  @Override
  public AnomalyModel fit(List<double[]> samples) {
    if (samples == null || samples.isEmpty()) {
      throw new IllegalArgumentException("samples must not be empty");
    }
    int width = samples.get(0).length;
    SummaryStatistics[] columns = new SummaryStatistics[width];
    for (int i = 0; i < width; i++) {
      columns[i] = new SummaryStatistics();
    }
    for (double[] sample : samples) {
      if (sample.length != width) {
        throw new IllegalArgumentException("samples must share one length; expected " + width);
      }
      for (int i = 0; i < width; i++) {
        columns[i].addValue(sample[i]);
      }
    }
    double[] mean = new double[width];
    double[] scale = new double[width];
    for (int i = 0; i < width; i++) {
      mean[i] = columns[i].getMean();
      scale[i] = columns[i].getStandardDeviation();
    }
    // Distances are computed with a provisional cutoff; only the scaling matters here.
    StandardizedDistanceModel provisional = new StandardizedDistanceModel(mean, scale, 1d);
    double[] distances = new double[samples.size()];
    for (int i = 0; i < distances.length; i++) {
      distances[i] = provisional.distance(samples.get(i));
    }
    double cutoff = new Percentile(percentile).evaluate(distances);
    return new StandardizedDistanceModel(mean, scale, Math.max(MIN_CUTOFF, cutoff));
  }
}
