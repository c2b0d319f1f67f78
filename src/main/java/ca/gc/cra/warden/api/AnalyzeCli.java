package ca.gc.cra.warden.api;

import ca.gc.cra.warden.application.batch.BatchAnalyzer;
import ca.gc.cra.warden.application.batch.BatchReport;
import ca.gc.cra.warden.config.CompositionRoot;
import ca.gc.cra.warden.config.EngineConfig;
import ca.gc.cra.warden.domain.detect.StructuredFailure;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.infrastructure.capture.PcapFormatException;
import ca.gc.cra.warden.infrastructure.json.JsonMappers;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.warden.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.warden.logging.LoggingConfigurator;
import ca.gc.cra.warden.validation.Numbers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes a capture file and prints or writes the JSON report.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  /** Largest packet budget accepted on the command line. */
  static final int MAX_PACKET_BUDGET = 100_000;
  private static final String SUMMARY_USAGE =
      "usage: analyze PATH|pcap=PATH [maxPackets=1-100000] [out=PATH] [ml=true|false|--no-ml] [config=PATH]";
  private static final String HELP_TEXT = """
      WARDEN capture file analysis

      Usage:
        analyze PATH [options]
        analyze pcap=PATH [options]

      Required:
        pcap=PATH                 .pcap or .pcapng file to analyze; may be given bare

      Optional:
        maxPackets=1-100000       Packet budget (default pcapMaxPackets, 2000)
        out=PATH                  Write the JSON report here instead of stdout
        ml=true|false             Run signature, anomaly and classifier detectors per packet (default true)
        --no-ml                   Same as ml=false
        config=PATH               YAML file; 'common' and 'analyze' sections apply, CLI keys win
        pcapMaxFileMiB=N          Reject larger files (default 100)
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private AnalyzeCli() {}

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
   * Executes the analyze command and returns the resulting exit code.
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
      log.debug("Verbose logging enabled for analyze CLI");
    }

    Map<String, String> kv;
    Path pcap;
    Path out;
    boolean ml;
    String budget;
    try {
      input.requireOnly(Set.of(CliInput.NO_ML), 1);
      kv = CliArgsParser.toMap(input.keyValueArgs());
      if (!input.positionalArgs().isEmpty() && kv.putIfAbsent("pcap", input.positionalArgs().get(0)) != null) {
        throw new IllegalArgumentException("capture file given both as pcap= and as an argument");
      }
      pcap = ConfigCliUtils.requirePath(kv, "pcap");
      out = kv.containsKey("out") ? ConfigCliUtils.requirePath(kv, "out") : null;
      ml = !input.noMl() && ConfigCliUtils.parseBoolean(kv, "ml", true);
      budget = kv.get("maxPackets");
      kv.keySet().removeAll(List.of("pcap", "out", "ml", "maxPackets"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    EngineConfig config;
    TelemetrySettings telemetry;
    int maxPackets;
    try {
      ConfigCliUtils.Effective effective = ConfigCliUtils.effectiveConfig(kv, "analyze");
      config = EngineConfig.fromMap(effective.values());
      telemetry = effective.telemetry();
      maxPackets = budget == null
          ? config.pcapMaxPackets()
          : (int) Numbers.requireRange("maxPackets", Numbers.parseLong("maxPackets", budget), 1, MAX_PACKET_BUDGET);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry);
        CompositionRoot root = new CompositionRoot(config, metrics)) {
      checkInput(pcap, config.pcapMaxFileBytes());
      BatchAnalyzer analyzer = root.batchAnalyzer(ml);
      BatchReport report = analyzer.analyze(pcap, maxPackets);
      if (out == null) {
        CliPrinter.printJson(report);
      } else {
        Path parent = out.getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        JsonMappers.pretty().writeValue(out.toFile(), report);
        CliPrinter.println("Report written to " + out + " (risk " + report.risk().score() + ", "
            + report.risk().level() + ", " + report.detections().size() + " detections)");
      }
      return ExitCode.SUCCESS;
    } catch (PcapFormatException ex) {
      CliPrinter.printFailure(ex.failure());
      log.error("Capture file rejected: {}", ex.getMessage());
      return ExitCode.forFailure(ex.failure().kind());
    } catch (IOException ex) {
      log.error("Analysis I/O failure for {}: {}", pcap, ex.getMessage(), ex);
      if (ex instanceof StructuredFailure structured) {
        CliPrinter.printFailure(structured.failure());
        return ExitCode.forFailure(structured.failure().kind());
      }
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Analysis configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in analysis", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Rejects files the analyzer should never open: wrong extension, empty or over the size limit.
   *
   * @param pcap capture file
   * @param maxBytes size limit
   * @throws PcapFormatException if the file is rejected
   * @throws IOException if the file size cannot be read
   */
  static void checkInput(Path pcap, long maxBytes) throws IOException {
    String name = pcap.getFileName() == null ? "" : pcap.getFileName().toString().toLowerCase(Locale.ROOT);
    if (!name.endsWith(".pcap") && !name.endsWith(".pcapng")) {
      throw new PcapFormatException(
          WardenFailure.Kind.PCAP_INVALID,
          "File must be .pcap or .pcapng: " + pcap,
          "Export the capture in pcap or pcapng format");
    }
    if (!Files.isRegularFile(pcap)) {
      throw new PcapFormatException(
          WardenFailure.Kind.PCAP_INVALID,
          "Capture file not found: " + pcap,
          "Check the pcap= path");
    }
    long size = Files.size(pcap);
    if (size == 0) {
      throw new PcapFormatException(
          WardenFailure.Kind.PCAP_EMPTY, "Capture file is empty: " + pcap, "Provide a non-empty capture");
    }
    if (size > maxBytes) {
      throw new PcapFormatException(
          WardenFailure.Kind.PCAP_TOO_LARGE,
          String.format(Locale.ROOT, "File size %.1f MiB exceeds the %d MiB limit: %s",
              size / (1024d * 1024d), maxBytes / (1024L * 1024L), pcap),
          "Trim the capture or raise pcapMaxFileMiB");
    }
  }
}
