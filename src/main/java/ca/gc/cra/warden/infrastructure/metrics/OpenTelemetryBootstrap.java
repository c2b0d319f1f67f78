package ca.gc.cra.warden.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@link TelemetrySettings} into a meter. A disabled exporter, or an SDK that fails to start, yields a noop
 * meter so detection never depends on the collector.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.warden";
  private static final String POM_PROPERTIES = "/META-INF/maven/ca.gc.cra/WARDEN/pom.properties";
  private static final String DEV_VERSION = "0.0.0-dev";
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  static Session initialize(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (!settings.enabled()) {
      log.info("Metrics export disabled");
      return Session.noop();
    }
    String version = serviceVersion();
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder()
          .setEndpoint(settings.endpoint().toString())
          .build();
      MetricReader reader = PeriodicMetricReader.builder(exporter)
          .setInterval(settings.exportInterval())
          .build();
      SdkMeterProvider provider = meterProvider(reader, buildResource(version, settings.resourceAttributes()));
      log.info("Metrics export: {}", settings.describe());
      return new Session(provider, version);
    } catch (RuntimeException ex) {
      log.error("Metrics exporter for {} failed to start; counting into a noop meter", settings.endpoint(), ex);
      return Session.noop();
    }
  }

  static Session forTesting(MetricReader reader) {
    String version = serviceVersion();
    return new Session(meterProvider(Objects.requireNonNull(reader, "reader"), buildResource(version, Map.of())),
        version);
  }

  private static SdkMeterProvider meterProvider(MetricReader reader, Resource resource) {
    return SdkMeterProvider.builder().setResource(resource).registerMetricReader(reader).build();
  }

  static Resource buildResource(String version, Map<String, String> extra) {
    AttributesBuilder attributes = Attributes.builder()
        .put("service.name", "warden")
        .put("service.namespace", "ca.gc.cra")
        .put("service.version", version)
        .put("service.instance.id", hostName());
    // Operator attributes may override the built-in ones, service.name included.
    extra.forEach((key, value) -> attributes.put(AttributeKey.stringKey(key), value));
    return Resource.getDefault().merge(Resource.create(attributes.build()));
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable; using the runtime name as instance id", ex);
      return ManagementFactory.getRuntimeMXBean().getName();
    }
  }

  static String serviceVersion() {
    String manifest = OpenTelemetryBootstrap.class.getPackage() == null
        ? null
        : OpenTelemetryBootstrap.class.getPackage().getImplementationVersion();
    if (manifest != null && !manifest.isBlank()) {
      return manifest;
    }
    Properties pom = new Properties();
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        pom.load(in);
      }
    } catch (IOException ex) {
      log.debug("Cannot read {}", POM_PROPERTIES, ex);
    }
    return pom.getProperty("version", DEV_VERSION);
  }

  /** Meter plus the provider that must be flushed and shut down with it; the provider is absent for noop. */
  static final class Session implements AutoCloseable {
    private final SdkMeterProvider provider;
    private final Meter meter;

    private Session(SdkMeterProvider provider, String version) {
      this.provider = provider;
      this.meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    }

    private Session(Meter noopMeter) {
      this.provider = null;
      this.meter = noopMeter;
    }

    static Session noop() {
      return new Session(MeterProvider.noop().get(INSTRUMENTATION_SCOPE));
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await("flush", provider::forceFlush);
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await("shutdown", provider::shutdown);
      }
    }

    private static void await(String action, Supplier<CompletableResultCode> operation) {
      try {
        if (!operation.get().join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
          log.warn("Metrics {} did not finish within {} s", action, SHUTDOWN_WAIT_SECONDS);
        }
      } catch (RuntimeException ex) {
        log.warn("Metrics {} failed", action, ex);
      }
    }
  }
}
