package ca.gc.cra.warden.infrastructure.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.AnomalyModel;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StandardizedDistanceEstimatorTest {

  @Test
  void fitsColumnStatisticsAndFlagsOutliers() {
    List<double[]> samples = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      samples.add(new double[] {i % 10, 5d});
    }

    AnomalyModel model = new StandardizedDistanceEstimator().fit(samples);

    StandardizedDistanceModel fitted = assertInstanceOf(StandardizedDistanceModel.class, model);
    assertArrayEquals(new double[] {4.5, 5d}, fitted.mean(), 1e-9);
    // Constant columns fall back to unit scale.
    assertEquals(1d, fitted.scale()[1], 1e-9);
    assertTrue(fitted.cutoff() > 0d);
    assertFalse(model.isAnomaly(new double[] {5d, 5d}));
    assertTrue(model.isAnomaly(new double[] {100d, 5d}));
    assertTrue(model.decisionScore(new double[] {100d, 5d}) < 0d);
    assertTrue(model.decisionScore(new double[] {4.5, 5d}) > 0d);
  }

  @Test
  void rejectsEmptyOrRaggedSamples() {
    StandardizedDistanceEstimator estimator = new StandardizedDistanceEstimator();

    assertThrows(IllegalArgumentException.class, () -> estimator.fit(List.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> estimator.fit(List.of(new double[] {1d, 2d}, new double[] {1d})));
  }

  @Test
  void rejectsPercentileOutsideRange() {
    assertThrows(IllegalArgumentException.class, () -> new StandardizedDistanceEstimator(0d));
    assertThrows(IllegalArgumentException.class, () -> new StandardizedDistanceEstimator(101d));
  }

  @Test
  void modelRejectsWrongFeatureCount() {
    StandardizedDistanceModel model = new StandardizedDistanceModel(new double[] {0d}, new double[] {1d}, 1d);

    assertThrows(IllegalArgumentException.class, () -> model.distance(new double[] {1d, 2d}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StandardizedDistanceModel(new double[] {0d}, new double[] {1d}, 0d));
  }
}
