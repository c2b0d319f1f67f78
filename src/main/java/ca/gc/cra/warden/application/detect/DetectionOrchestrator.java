package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.application.features.FeatureExtractor;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.SampleCollectorPort;
import ca.gc.cra.warden.domain.detect.ClassificationResult;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.FeatureVector;
import ca.gc.cra.warden.domain.net.PacketRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs feature extraction and the three detectors for each packet and merges the results.
 * <p><strong>Why:</strong> Detectors are independent; a single coordinator keeps their side effects (login
 * tracking, sample hand-off, retraining) in one place.</p>
 * <p><strong>Role:</strong> Application service invoked by the live processing worker and the batch analyzer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run signatures, anomaly scoring and classification without short-circuiting.</li>
 *   <li>Feed {@code brute_force} signature hits back to the login-attempt tracker.</li>
 *   <li>Hand classified samples to the {@link SampleCollectorPort}, best effort.</li>
 *   <li>Retrain the anomaly model when the wall-clock interval has elapsed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent calls; detectors guard their own state.</p>
 * <p><strong>Observability:</strong> Emits {@code detect.*} counters through {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class DetectionOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

  /** Signature id whose hits count as failed logins. */
  public static final String BRUTE_FORCE = "brute_force";

  static final double MALICIOUS_SAMPLE_CONFIDENCE = 0.8;
  static final double BENIGN_SAMPLE_CONFIDENCE = 0.6;
  static final String AUTO_LABEL = "auto";
  private static final int COLLECTOR_WARN_EVERY = 1_000;

  private final FeatureExtractor extractor;
  private final SignatureMatcher signatures;
  private final AnomalyScorer anomaly;
  private final ClassificationScorer classifier;
  private final SampleCollectorPort samples;
  private final ClockPort clock;
  private final Duration retrainInterval;
  private final MetricsPort metrics;
  private final AtomicLong lastRetrainMillis;
  private final AtomicLong collectorFailures = new AtomicLong();

  /**
   * Creates an orchestrator.
   *
   * @param extractor feature extractor and its trackers
   * @param signatures signature matcher
   * @param anomaly anomaly scorer
   * @param classifier classification scorer
   * @param samples sample collector; {@link SampleCollectorPort#NONE} to disable
   * @param clock wall clock gating retraining
   * @param retrainInterval minimum time between anomaly retrains
   * @param metrics metrics sink
   */
  public DetectionOrchestrator(
      FeatureExtractor extractor,
      SignatureMatcher signatures,
      AnomalyScorer anomaly,
      ClassificationScorer classifier,
      SampleCollectorPort samples,
      ClockPort clock,
      Duration retrainInterval,
      MetricsPort metrics) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.signatures = Objects.requireNonNull(signatures, "signatures");
    this.anomaly = Objects.requireNonNull(anomaly, "anomaly");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.samples = Objects.requireNonNull(samples, "samples");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.retrainInterval = Objects.requireNonNull(retrainInterval, "retrainInterval");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.lastRetrainMillis = new AtomicLong(clock.nowMillis());
  }

  /**
   * Extracts features and runs every detector for one packet.
   *
   * @param packet decoded packet
   * @return features, merged detections and the classifier verdict
   */
  public AnalysisResult analyze(PacketRecord packet) {
    long now = packet.timestampMillis();
    FeatureVector features = extractor.extract(packet);
    List<Detection> detections = new ArrayList<>(4);

    for (Detection detection : signatures.match(packet)) {
      detections.add(detection);
      if (BRUTE_FORCE.equals(detection.ruleId())) {
        extractor.recordFailedLogin(packet.srcIp(), now);
      }
    }

    anomaly.observe(features, now);
    anomaly.score(features, now).ifPresent(detections::add);

    ClassificationResult classification = classifier.classify(features.toNamedMap());
    classifier.detect(classification, now).ifPresent(detections::add);

    if (classification.classified()) {
      collectSample(features, packet, !detections.isEmpty());
    }

    metrics.increment("detect.packets");
    for (Detection detection : detections) {
      metrics.increment("detect." + detection.type().label());
    }
    return new AnalysisResult(features, detections, classification);
  }

  /**
   * Retrains the anomaly model when the retrain interval has elapsed on the wall clock.
   *
   * @return {@code true} if a retrain ran and produced a model
   */
  public boolean retrainIfDue() {
    long last = lastRetrainMillis.get();
    if (!clock.hasElapsed(last, retrainInterval)) {
      return false;
    }
    long now = clock.nowMillis();
    if (!lastRetrainMillis.compareAndSet(last, now)) {
      return false;
    }
    boolean retrained = anomaly.retrain(now);
    if (retrained) {
      metrics.increment("detect.anomaly.retrain");
      log.info("Periodic anomaly retrain completed");
    } else {
      log.debug("Periodic anomaly retrain skipped; insufficient samples or training in progress");
    }
    return retrained;
  }

  /**
   * Returns the feature extractor, whose trackers are swept by the live engine.
   *
   * @return extractor
   */
  public FeatureExtractor extractor() {
    return extractor;
  }

  /**
   * Returns the anomaly scorer.
   *
   * @return scorer
   */
  public AnomalyScorer anomaly() {
    return anomaly;
  }

  /**
   * Returns the classification scorer.
   *
   * @return scorer
   */
  public ClassificationScorer classifier() {
    return classifier;
  }

  private void collectSample(FeatureVector features, PacketRecord packet, boolean flagged) {
    String label = flagged
        ? ClassificationResult.Label.MALICIOUS.label()
        : ClassificationResult.Label.BENIGN.label();
    double confidence = flagged ? MALICIOUS_SAMPLE_CONFIDENCE : BENIGN_SAMPLE_CONFIDENCE;
    try {
      samples.collect(features, packet, label, AUTO_LABEL, confidence);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (Exception ex) {
      long count = collectorFailures.incrementAndGet();
      metrics.increment("detect.samples.failed");
      if (count == 1 || count % COLLECTOR_WARN_EVERY == 0) {
        log.warn("Sample collection failed ({} failures so far)", count, ex);
      }
    }
  }

  /**
   * Per-packet analysis outcome.
   *
   * @param features extracted feature vector
   * @param detections detections from every stage, in stage order
   * @param classification classifier verdict; {@link ClassificationResult#UNKNOWN} without a model
   */
  public record AnalysisResult(
      FeatureVector features, List<Detection> detections, ClassificationResult classification) {
    /**
     * Copies the detection list.
     */
    public AnalysisResult {
      detections = List.copyOf(detections);
    }
  }
}
