package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.application.port.AnomalyEstimator;
import ca.gc.cra.warden.application.port.AnomalyModel;
import ca.gc.cra.warden.application.port.AnomalyModelStore;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.DetectionType;
import ca.gc.cra.warden.domain.detect.FeatureVector;
import ca.gc.cra.warden.domain.detect.Severity;
import ca.gc.cra.warden.validation.Numbers;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Unsupervised anomaly stage: collects feature history, trains itself, then scores packets.
 * <p><strong>Why:</strong> Catches traffic that no signature describes by comparing it with what this network
 * normally looks like.</p>
 * <p><strong>Role:</strong> Second detector run by the {@link DetectionOrchestrator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Move through {@link State#UNTRAINED}, {@link State#COLLECTING} and {@link State#TRAINED}.</li>
 *   <li>Fit the pluggable {@link AnomalyEstimator} once the buffer reaches the training minimum and persist the
 *       result.</li>
 *   <li>Refit on demand for drift ({@link #retrain(long)}).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The sample buffer is guarded by a lock held only for append and snapshot.
 * Fitting runs outside the lock and at most one fit runs at a time. The live model is swapped atomically.</p>
 * <p><strong>Observability:</strong> Logs training transitions at INFO and persistence failures at WARN.</p>
 *
 * @since 0.1.0
 */
public final class AnomalyScorer {
  private static final Logger log = LoggerFactory.getLogger(AnomalyScorer.class);

  /** Rule id of anomaly detections. */
  public static final String RULE_ID = "ml_anomaly";
  /** Source tag of anomaly detections. */
  public static final String SOURCE = "ml_analysis";

  private static final double HIGH_SEVERITY_CONFIDENCE = 0.8;

  /** Training lifecycle. */
  public enum State {
    /** No samples and no model. */
    UNTRAINED,
    /** Buffering samples below the training minimum. */
    COLLECTING,
    /** A fitted model is scoring packets. */
    TRAINED
  }

  private final Settings settings;
  private final AnomalyEstimator estimator;
  private final AnomalyModelStore store;
  private final ConfidenceTransform transform;
  private final boolean frozen;

  private final ArrayDeque<double[]> buffer;
  private final ReentrantLock bufferLock = new ReentrantLock();
  private final AtomicReference<AnomalyModel> model = new AtomicReference<>();
  private final AtomicReference<State> state = new AtomicReference<>(State.UNTRAINED);
  private final AtomicBoolean training = new AtomicBoolean();
  private volatile int trainingSamples;
  private volatile long lastTrainedAtMillis;

  /**
   * Creates a scorer.
   *
   * @param settings buffer, training and threshold settings
   * @param estimator model fitting strategy
   * @param store persistence for fitted models
   * @param transform decision-score to confidence heuristic
   */
  public AnomalyScorer(
      Settings settings, AnomalyEstimator estimator, AnomalyModelStore store, ConfidenceTransform transform) {
    this(settings, estimator, store, transform, false);
  }

  private AnomalyScorer(
      Settings settings,
      AnomalyEstimator estimator,
      AnomalyModelStore store,
      ConfidenceTransform transform,
      boolean frozen) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.estimator = Objects.requireNonNull(estimator, "estimator");
    this.store = Objects.requireNonNull(store, "store");
    this.transform = Objects.requireNonNull(transform, "transform");
    this.frozen = frozen;
    this.buffer = new ArrayDeque<>(Math.min(settings.bufferCapacity(), 1_024));
  }

  /**
   * Restores a persisted model, starting in {@link State#TRAINED} when one exists.
   *
   * @return {@code true} if a model was restored
   */
  public boolean restore() {
    try {
      Optional<AnomalyModel> loaded = store.load();
      if (loaded.isEmpty()) {
        return false;
      }
      model.set(loaded.get());
      state.set(State.TRAINED);
      log.info("Restored persisted anomaly model ({})", loaded.get().modelType());
      return true;
    } catch (IOException | RuntimeException ex) {
      log.warn("Unable to restore anomaly model; collecting fresh samples", ex);
      return false;
    }
  }

  /**
   * Appends a sample to the training buffer and trains once the minimum is reached. No-op on frozen views.
   *
   * @param features feature vector of one packet
   * @param nowMillis event time recorded as the training time
   */
  public void observe(FeatureVector features, long nowMillis) {
    if (frozen) {
      return;
    }
    int size;
    bufferLock.lock();
    try {
      if (buffer.size() >= settings.bufferCapacity()) {
        buffer.pollFirst();
      }
      buffer.addLast(features.toArray());
      size = buffer.size();
    } finally {
      bufferLock.unlock();
    }
    state.compareAndSet(State.UNTRAINED, State.COLLECTING);
    if (state.get() != State.TRAINED && size >= settings.minSamplesForTraining()) {
      train(nowMillis);
    }
  }

  /**
   * Scores a vector. Before training this always returns empty.
   *
   * @param features feature vector
   * @param nowMillis detection creation time
   * @return anomaly detection when the model flags the vector and confidence exceeds the threshold
   */
  public Optional<Detection> score(FeatureVector features, long nowMillis) {
    AnomalyModel current = model.get();
    if (current == null) {
      return Optional.empty();
    }
    double[] vector = features.toArray();
    double decision = current.decisionScore(vector);
    double confidence = transform.toConfidence(decision);
    if (!current.isAnomaly(vector) || !(confidence > settings.threshold())) {
      return Optional.empty();
    }
    Severity severity = confidence < HIGH_SEVERITY_CONFIDENCE ? Severity.MEDIUM : Severity.HIGH;
    return Optional.of(new Detection(
        DetectionType.ANOMALY,
        RULE_ID,
        severity,
        confidence,
        String.format(Locale.ROOT, "Anomalous traffic pattern detected (decision score %.3f)", decision),
        SOURCE,
        current.modelType(),
        nowMillis));
  }

  /**
   * Refits on the current buffer regardless of state. Requires the training minimum.
   *
   * @param nowMillis time recorded as the training time
   * @return {@code true} if a new model was fitted
   */
  public boolean retrain(long nowMillis) {
    if (frozen) {
      return false;
    }
    return train(nowMillis);
  }

  /**
   * Returns a view sharing the current model that scores without collecting or training.
   *
   * @return frozen scorer
   */
  public AnomalyScorer frozenView() {
    AnomalyScorer view = new AnomalyScorer(settings, estimator, AnomalyModelStore.NONE, transform, true);
    AnomalyModel current = model.get();
    if (current != null) {
      view.model.set(current);
      view.state.set(State.TRAINED);
      view.trainingSamples = trainingSamples;
      view.lastTrainedAtMillis = lastTrainedAtMillis;
    }
    return view;
  }

  /**
   * Returns the lifecycle state.
   *
   * @return state
   */
  public State state() {
    return state.get();
  }

  /**
   * Reports model metadata for health output.
   *
   * @return model info snapshot
   */
  public ModelInfo modelInfo() {
    AnomalyModel current = model.get();
    return new ModelInfo(
        state.get(),
        current == null ? "none" : current.modelType(),
        trainingSamples,
        lastTrainedAtMillis,
        bufferSize(),
        settings.minSamplesForTraining());
  }

  int bufferSize() {
    bufferLock.lock();
    try {
      return buffer.size();
    } finally {
      bufferLock.unlock();
    }
  }

  private boolean train(long nowMillis) {
    if (!training.compareAndSet(false, true)) {
      return false;
    }
    try {
      List<double[]> samples;
      bufferLock.lock();
      try {
        samples = new ArrayList<>(buffer);
      } finally {
        bufferLock.unlock();
      }
      if (samples.size() < settings.minSamplesForTraining()) {
        return false;
      }

      AnomalyModel fitted;
      try {
        fitted = estimator.fit(samples);
      } catch (RuntimeException ex) {
        log.warn("Anomaly model fit failed on {} samples", samples.size(), ex);
        return false;
      }
      model.set(fitted);
      trainingSamples = samples.size();
      lastTrainedAtMillis = nowMillis;
      State previous = state.getAndSet(State.TRAINED);
      log.info("Anomaly model trained on {} samples ({} -> TRAINED)", samples.size(), previous);
      persist(fitted, samples.size());
      return true;
    } finally {
      training.set(false);
    }
  }

  private void persist(AnomalyModel fitted, int samples) {
    try {
      store.save(fitted, samples);
    } catch (IOException | RuntimeException ex) {
      log.warn("Unable to persist anomaly model; continuing with in-memory model", ex);
    }
  }

  /**
   * Scorer configuration.
   *
   * @param bufferCapacity maximum buffered samples
   * @param minSamplesForTraining samples required before fitting
   * @param threshold confidence that must be exceeded to emit a detection
   */
  public record Settings(int bufferCapacity, int minSamplesForTraining, double threshold) {
    /** Default sample buffer capacity. */
    public static final int DEFAULT_BUFFER_CAPACITY = 10_000;

    /**
     * Validates bounds.
     */
    public Settings {
      Numbers.requireRange("anomalyBufferCapacity", bufferCapacity, 1, 10_000_000);
      Numbers.requireRange("minSamplesForTraining", minSamplesForTraining, 1, bufferCapacity);
      Numbers.requireRange("anomalyThreshold", threshold, 0d, 1d);
    }

    /**
     * Returns the stock settings: 10,000 samples, train at 100, threshold 0.5.
     *
     * @return defaults
     */
    public static Settings defaults() {
      return new Settings(DEFAULT_BUFFER_CAPACITY, 100, 0.5);
    }
  }

  /**
   * Anomaly model metadata.
   *
   * @param state lifecycle state
   * @param modelType estimator name, or {@code none}
   * @param trainingSamples samples used for the last fit
   * @param lastTrainedAtMillis time of the last fit; 0 if never trained in this process
   * @param bufferSize samples currently buffered
   * @param minSamplesForTraining training minimum
   */
  public record ModelInfo(
      State state,
      String modelType,
      int trainingSamples,
      long lastTrainedAtMillis,
      int bufferSize,
      int minSamplesForTraining) {}
}
