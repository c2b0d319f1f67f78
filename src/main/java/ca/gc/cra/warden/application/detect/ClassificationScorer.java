package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.application.port.ClassificationModel;
import ca.gc.cra.warden.domain.detect.ClassificationResult;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.DetectionType;
import ca.gc.cra.warden.domain.detect.FeatureSchema;
import ca.gc.cra.warden.domain.detect.Severity;
import ca.gc.cra.warden.validation.Numbers;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Supervised classification stage over a pluggable binary model.
 * <p><strong>Why:</strong> A model trained on labelled traffic recognizes attack families the signature set does
 * not enumerate.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reconcile named features to the model's {@link FeatureSchema}, resolved once at construction.</li>
 *   <li>Label a sample malicious when {@code p_malicious > 0.5}; confidence is the chosen label's probability.</li>
 *   <li>Emit a detection only for confident malicious verdicts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable model reference.</p>
 *
 * @since 0.1.0
 */
public final class ClassificationScorer {
  private static final Logger log = LoggerFactory.getLogger(ClassificationScorer.class);

  /** Rule id of classification detections. */
  public static final String RULE_ID = "ml_classification";
  /** Source tag of classification detections. */
  public static final String SOURCE = "ml_classification";

  private static final double DECISION_BOUNDARY = 0.5;
  private static final double HIGH_SEVERITY_CONFIDENCE = 0.9;

  private final ClassificationModel model;
  private final FeatureSchema schema;
  private final double threshold;

  /**
   * Creates a scorer.
   *
   * @param model classifier; use an unavailable model when none is configured
   * @param threshold minimum confidence for a detection, inclusive
   */
  public ClassificationScorer(ClassificationModel model, double threshold) {
    this.model = Objects.requireNonNull(model, "model");
    this.schema = Objects.requireNonNull(model.featureSchema(), "featureSchema");
    this.threshold = Numbers.requireRange("classificationThreshold", threshold, 0d, 1d);
  }

  /**
   * Classifies a named feature map.
   *
   * @param namedFeatures features keyed by name; padded or truncated to the model schema
   * @return verdict, or {@link ClassificationResult#UNKNOWN} without a trained model
   */
  public ClassificationResult classify(Map<String, Double> namedFeatures) {
    if (!model.isTrained()) {
      return ClassificationResult.UNKNOWN;
    }
    double[] vector = schema.reconcile(namedFeatures);
    double[] proba;
    try {
      proba = model.predictProba(vector);
    } catch (RuntimeException ex) {
      log.debug("Classifier prediction failed; reporting unknown", ex);
      return ClassificationResult.UNKNOWN;
    }
    if (proba == null || proba.length < 2) {
      return ClassificationResult.UNKNOWN;
    }
    double benign = proba[0];
    double malicious = proba[1];
    if (malicious > DECISION_BOUNDARY) {
      return new ClassificationResult(ClassificationResult.Label.MALICIOUS, malicious, benign, malicious);
    }
    return new ClassificationResult(ClassificationResult.Label.BENIGN, benign, benign, malicious);
  }

  /**
   * Converts a verdict into a detection when it is malicious and at least as confident as the threshold.
   *
   * @param result classification verdict
   * @param nowMillis detection creation time
   * @return classification detection
   */
  public Optional<Detection> detect(ClassificationResult result, long nowMillis) {
    if (result.label() != ClassificationResult.Label.MALICIOUS || result.confidence() < threshold) {
      return Optional.empty();
    }
    Severity severity = result.confidence() > HIGH_SEVERITY_CONFIDENCE ? Severity.HIGH : Severity.MEDIUM;
    return Optional.of(new Detection(
        DetectionType.CLASSIFICATION,
        RULE_ID,
        severity,
        result.confidence(),
        String.format(Locale.ROOT, "Classifier flagged traffic as malicious (p=%.3f)", result.maliciousProbability()),
        SOURCE,
        model.modelType(),
        nowMillis));
  }

  /**
   * Reports classifier metadata.
   *
   * @return model info
   */
  public ModelInfo modelInfo() {
    return new ModelInfo(model.modelType(), model.isTrained(), schema.expectedLength(), schema.names());
  }

  /**
   * Indicates whether the underlying model can classify.
   *
   * @return trained flag
   */
  public boolean isAvailable() {
    return model.isTrained();
  }

  /**
   * Classifier metadata.
   *
   * @param modelType model family
   * @param trained trained flag
   * @param expectedLength vector length the model accepts
   * @param featureNames model feature names
   */
  public record ModelInfo(String modelType, boolean trained, int expectedLength, List<String> featureNames) {
    /**
     * Copies feature names.
     */
    public ModelInfo {
      featureNames = List.copyOf(featureNames);
    }
  }
}
