package ca.gc.cra.warden.infrastructure.metrics;

import ca.gc.cra.warden.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards WARDEN counters and observations to OpenTelemetry.
 * <p><strong>Why:</strong> Keeps the pipeline free of SDK types while still exporting over OTLP.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created once per key in concurrent maps and are themselves
 * thread-safe.</p>
 * <p><strong>Observability:</strong> Each instrument is named after the sanitized dotted key prefixed with
 * {@code warden.} and carries the original key as the {@code warden.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("warden.metric.key");
  private static final String NAME_PREFIX = "warden.";
  private static final String FALLBACK_METRIC_NAME = "warden.metric";

  private final OpenTelemetryBootstrap.Session session;
  private final Meter meter;
  private final boolean noop;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting as {@code settings} describes.
   *
   * @param settings resolved exporter settings
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Session session) {
    this.session = Objects.requireNonNull(session, "session");
    this.meter = session.meter();
    this.noop = session.isNoop();
    if (noop) {
      log.debug("Metrics adapter discarding measurements");
    }
  }

  @Override
  public void increment(String key) {
    if (noop) {
      return;
    }
    Counter instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    if (noop) {
      return;
    }
    Histogram instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /**
   * Reports whether metrics are discarded.
   *
   * @return {@code true} when the exporter is {@code none} or initialization failed
   */
  public boolean isNoop() {
    return noop;
  }

  void forceFlush() {
    session.forceFlush();
  }

  @Override
  public void close() {
    session.close();
  }

  private Counter createCounter(String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("WARDEN counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram createHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("WARDEN observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(NAME_PREFIX.length() + lower.length());
    result.append(NAME_PREFIX);
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Counter(LongCounter counter, Attributes attributes) {}

  private record Histogram(LongHistogram histogram, Attributes attributes) {}
}
