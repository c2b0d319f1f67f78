package ca.gc.cra.warden.infrastructure.model;

import ca.gc.cra.warden.application.port.ClassificationModel;
import ca.gc.cra.warden.domain.detect.FeatureSchema;
import ca.gc.cra.warden.infrastructure.json.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.analysis.function.Sigmoid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Logistic-regression inference for the benign/malicious classifier.
 * <p><strong>Why:</strong> Models are trained offline; the engine only applies exported coefficients.</p>
 * <p>The model file is snake_case JSON:</p>
 * <pre>{@code
 * {"weights": [..], "bias": 0.0, "mean": [..], "scale": [..],
 *  "feature_names": ["packet_size", ...], "expected_features": 6}
 * }</pre>
 * <p>{@code mean} and {@code scale} are optional standardization parameters; {@code feature_names} may be empty, in
 * which case named features are taken in key order.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class LogisticClassificationModel implements ClassificationModel {
  private static final Logger log = LoggerFactory.getLogger(LogisticClassificationModel.class);
  /** Model family reported in model info. */
  public static final String TYPE = "logistic_regression";

  private static final Sigmoid SIGMOID = new Sigmoid();

  private final double[] weights;
  private final double bias;
  private final double[] mean;
  private final double[] scale;
  private final FeatureSchema schema;

  /**
   * Creates a model from coefficients.
   *
   * @param weights one weight per expected feature
   * @param bias intercept
   * @param mean standardization means, or {@code null}
   * @param scale standardization scales, or {@code null}; zero entries are treated as 1
   * @param schema feature layout; {@code expectedLength} must equal {@code weights.length}
   */
  public LogisticClassificationModel(
      double[] weights, double bias, double[] mean, double[] scale, FeatureSchema schema) {
    if (weights == null || weights.length == 0) {
      throw new IllegalArgumentException("weights must not be empty");
    }
    if (schema == null || schema.expectedLength() != weights.length) {
      throw new IllegalArgumentException("expected_features must equal the number of weights (" + weights.length + ")");
    }
    this.weights = weights.clone();
    this.bias = bias;
    this.mean = mean == null ? new double[weights.length] : requireLength("mean", mean, weights.length);
    this.scale = scale == null ? ones(weights.length) : requireLength("scale", scale, weights.length);
    this.schema = schema;
  }

  /**
   * Loads a model file.
   *
   * @param file JSON model path
   * @return loaded model
   * @throws IOException if the file is unreadable or its parameters are inconsistent
   */
  public static LogisticClassificationModel load(Path file) throws IOException {
    if (!Files.isRegularFile(file)) {
      throw new IOException("Classifier model file not found: " + file);
    }
    ModelFile content;
    try {
      content = JsonMappers.compact().readValue(file.toFile(), ModelFile.class);
    } catch (JsonProcessingException ex) {
      throw new IOException("Classifier model file " + file + " is not valid JSON", ex);
    }
    try {
      int expected = content.expectedFeatures() > 0
          ? content.expectedFeatures()
          : content.weights() == null ? 0 : content.weights().length;
      List<String> names = content.featureNames() == null ? List.of() : content.featureNames();
      LogisticClassificationModel model = new LogisticClassificationModel(
          content.weights(), content.bias(), content.mean(), content.scale(), new FeatureSchema(names, expected));
      log.info("Classifier model loaded from {} ({} features)", file, expected);
      return model;
    } catch (IllegalArgumentException ex) {
      throw new IOException("Classifier model file " + file + " is invalid: " + ex.getMessage(), ex);
    }
  }

  @Override
  public boolean isTrained() {
    return true;
  }

  @Override
  public FeatureSchema featureSchema() {
    return schema;
  }

  @Override
  public double[] predictProba(double[] vector) {
    if (vector == null || vector.length != weights.length) {
      throw new IllegalArgumentException("expected " + weights.length + " features");
    }
    double z = bias;
    for (int i = 0; i < weights.length; i++) {
      double standardized = (vector[i] - mean[i]) / (scale[i] == 0d ? 1d : scale[i]);
      z += weights[i] * standardized;
    }
    double malicious = SIGMOID.value(z);
    return new double[] {1d - malicious, malicious};
  }

  @Override
  public String modelType() {
    return TYPE;
  }

  private static double[] requireLength(String name, double[] values, int length) {
    if (values.length != length) {
      throw new IllegalArgumentException(name + " must have " + length + " entries, got " + values.length);
    }
    return values.clone();
  }

  private static double[] ones(int length) {
    double[] values = new double[length];
    Arrays.fill(values, 1d);
    return values;
  }

  record ModelFile(
      double[] weights,
      double bias,
      double[] mean,
      double[] scale,
      List<String> featureNames,
      int expectedFeatures) {}
}
