package ca.gc.cra.warden.api;

import ca.gc.cra.warden.application.detect.AlertDeduplicator;
import ca.gc.cra.warden.application.pipeline.AlertListener;
import ca.gc.cra.warden.application.pipeline.LiveEngine;
import ca.gc.cra.warden.config.CompositionRoot;
import ca.gc.cra.warden.config.EngineConfig;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.StructuredFailure;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot;
import ca.gc.cra.warden.infrastructure.json.JsonMappers;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.warden.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.warden.logging.LoggingConfigurator;
import ca.gc.cra.warden.logging.Logs;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the live detection engine from CLI key-value arguments until interrupted.
 *
 * <p>Each emitted alert is printed to stdout as one compact JSON line.</p>
 *
 * @since 0.1.0
 */
public final class LiveCli {
  private static final Logger log = LoggerFactory.getLogger(LiveCli.class);
  private static final int MAX_DESCRIPTION_BYTES = 256;
  private static final String SUMMARY_USAGE =
      "usage: live [config=PATH] [interface=NAME|auto] [bpf='expr'] [whitelistIps=CIDR,...] "
          + "[alertLogFile=PATH] [classifierModelFile=PATH] [--dry-run] [metricsExporter=otlp|none] "
          + "[otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      WARDEN live detection

      Usage:
        live [key=value ...] [flags]

      Common keys (see warden.yaml for the full list):
        config=PATH                 YAML file; 'common' and 'live' sections apply, CLI keys win
        interface=NAME|auto         Capture interface (default auto-detect)
        bpf="expr"                  Capture filter; printable ASCII, ';' and '`' rejected
        whitelistIps=CIDR,...       Tracked but not analyzed (default 127.0.0.1,10.0.0.0/8,192.168.0.0/16)
        whitelistPorts=PORT,...     Ports skipped by deep analysis
        dedupWindowSeconds=N        Alert dedup window (default 300)
        signatureFile=PATH          Signature rules overriding the built-in set
        classifierModelFile=PATH    Logistic classifier model (JSON)
        anomalyModelFile=PATH       Persisted anomaly model (default ~/.warden/models/anomaly-model.json)
        alertLogFile=PATH           Append alerts as NDJSON; dedup state survives restarts
        sampleFile=PATH             Append training samples as NDJSON
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes

      Flags:
        --dry-run                   Validate configuration and print the plan without capturing
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private LiveCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the live command and returns the resulting exit code.
   *
   * @param args raw CLI arguments
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for live CLI");
    }

    Map<String, String> kv;
    try {
      input.requireOnly(Set.of(CliInput.DRY_RUN), 0);
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    EngineConfig config;
    TelemetrySettings telemetry;
    try {
      ConfigCliUtils.Effective effective = ConfigCliUtils.effectiveConfig(kv, "live");
      config = EngineConfig.fromMap(effective.values());
      telemetry = effective.telemetry();
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid live configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (input.dryRun()) {
      printDryRunPlan(config, telemetry);
      return ExitCode.SUCCESS;
    }
    if (!config.bpf().isEmpty()) {
      log.info("Capture filter enabled ({} bytes)", config.bpf().length());
      log.debug("Capture filter '{}'", Logs.truncate(config.bpf(), 128));
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry);
        CompositionRoot root = new CompositionRoot(config, metrics)) {
      LiveEngine engine = root.liveEngine(new StdoutAlertListener());
      Thread hook = new Thread(engine::stop, "warden-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      engine.start();
      engine.awaitTermination();
      printSummary(engine.health());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Live detection I/O failure: {}", ex.getMessage(), ex);
      if (ex instanceof StructuredFailure structured) {
        CliPrinter.printFailure(structured.failure());
        return ExitCode.forFailure(structured.failure().kind());
      }
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Live detection configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Live detection interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in live detection", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static String formatAlert(
      ObjectMapper mapper, Detection detection, PacketRecord packet, AlertDeduplicator.Outcome outcome)
      throws JsonProcessingException {
    Map<String, Object> line = new LinkedHashMap<>();
    line.put("alert_id", outcome.alertId());
    line.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
    line.put("rule_id", detection.ruleId());
    line.put("type", detection.type().label());
    line.put("severity", detection.severity().label());
    line.put("confidence", detection.confidence());
    line.put("source_ip", packet.srcIp());
    line.put("source_port", packet.srcPort());
    line.put("dest_ip", packet.dstIp());
    line.put("dest_port", packet.dstPort());
    line.put("protocol", packet.protocol().label());
    line.put("description", Logs.truncate(detection.description(), MAX_DESCRIPTION_BYTES));
    line.put("created_at", Instant.ofEpochMilli(detection.createdAtMillis()).toString());
    return mapper.writeValueAsString(line);
  }

  private static void printDryRunPlan(EngineConfig config, TelemetrySettings telemetry) {
    CliPrinter.printLines(
        "Live dry-run: no packets will be captured.",
        " Interface         : " + config.iface(),
        " Snaplen           : " + config.snaplen(),
        " Promiscuous       : " + config.promiscuous(),
        " Capture filter    : " + (config.bpf().isEmpty() ? "<none>" : Logs.truncate(config.bpf(), 96)),
        " Whitelist         : " + config.whitelist(),
        " Queue capacity    : " + config.queueCapacity(),
        " Dedup window (s)  : " + config.dedupWindow().toSeconds(),
        " Signature file    : " + orBuiltIn(config.signatureFile()),
        " Classifier model  : " + (config.classifierModelFile() == null ? "<none>" : config.classifierModelFile()),
        " Anomaly model     : " + config.anomalyModelFile(),
        " Alert log         : " + (config.alertLogFile() == null ? "<memory>" : config.alertLogFile()),
        " Metrics           : " + telemetry.describe(),
        " Re-run without --dry-run to start capture.");
  }

  private static String orBuiltIn(Object value) {
    return value == null ? "<built-in>" : value.toString();
  }

  private static void printSummary(LiveEngine.Health health) {
    CaptureStatsSnapshot stats = health.stats();
    CliPrinter.printLines(
        "Live detection stopped.",
        " Packets           : " + stats.totalPackets(),
        " Bytes             : " + stats.totalBytes(),
        " Dropped           : " + stats.droppedPackets(),
        " Capture state     : " + stats.captureState(),
        " Capture restarts  : " + health.captureRestarts(),
        " Anomaly model     : " + health.anomalyModel().state());
    health.captureFailure().ifPresent(failure -> CliPrinter.println(" Capture failure   : " + failure.render()));
  }

  /** Prints each emitted alert as one JSON line. */
  private static final class StdoutAlertListener implements AlertListener {
    private final ObjectMapper mapper = JsonMappers.compact();

    @Override
    public void onAlert(Detection detection, PacketRecord packet, AlertDeduplicator.Outcome outcome) {
      try {
        CliPrinter.println(formatAlert(mapper, detection, packet, outcome));
      } catch (JsonProcessingException ex) {
        log.warn("Unable to render alert {} as JSON", detection.ruleId(), ex);
      }
    }
  }
}
