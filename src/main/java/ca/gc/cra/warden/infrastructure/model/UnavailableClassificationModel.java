package ca.gc.cra.warden.infrastructure.model;

import ca.gc.cra.warden.application.port.ClassificationModel;
import ca.gc.cra.warden.domain.detect.FeatureSchema;

/**
 * Placeholder used when no classifier model is configured; reports itself untrained.
 *
 * @since 0.1.0
 */
public final class UnavailableClassificationModel implements ClassificationModel {
  /** Shared instance. */
  public static final UnavailableClassificationModel INSTANCE = new UnavailableClassificationModel();

  private UnavailableClassificationModel() {}

  @Override
  public boolean isTrained() {
    return false;
  }

  @Override
  public FeatureSchema featureSchema() {
    return FeatureSchema.nativeSchema();
  }

  @Override
  public double[] predictProba(double[] vector) {
    throw new IllegalStateException("No classifier model loaded");
  }

  @Override
  public String modelType() {
    return "none";
  }
}
