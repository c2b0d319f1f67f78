package ca.gc.cra.warden.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.infrastructure.capture.PcapFormatException;
import ca.gc.cra.warden.testutil.Frames;
import ca.gc.cra.warden.testutil.PcapFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class AnalyzeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(AnalyzeCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = AnalyzeCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("WARDEN capture file analysis"));
  }

  @Test
  void missingPcapReturnsInvalidArgs() {
    ExitCode code = AnalyzeCli.run(new String[] {"ml=false"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: analyze"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("pcap is required")));
  }

  @Test
  void outOfRangeBudgetIsConfigError() throws Exception {
    Path pcap = capture("budget.pcap");

    ExitCode code = AnalyzeCli.run(
        new String[] {"pcap=" + pcap, "maxPackets=100001", "metricsExporter=none", "ml=false"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void wrongExtensionIsRejectedWithStructuredFailure() throws Exception {
    Path text = Files.writeString(tempDir.resolve("notes.txt"), "not a capture");

    ExitCode code = AnalyzeCli.run(new String[] {"pcap=" + text, "metricsExporter=none", "ml=false"});

    assertEquals(ExitCode.INPUT_REJECTED, code);
    assertTrue(buffer.toString().contains("pcap_invalid: File must be .pcap or .pcapng"));
  }

  @Test
  void writesReportFileWithoutDetectors() throws Exception {
    Path pcap = capture("flows.pcap");
    Path out = tempDir.resolve("reports").resolve("flows.json");

    ExitCode code = AnalyzeCli.run(new String[] {
        "pcap=" + pcap, "out=" + out, "ml=false", "metricsExporter=none",
        "anomalyModelFile=" + tempDir.resolve("anomaly.json")});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Report written to " + out));
    String json = Files.readString(out, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"packets_processed\" : 3"));
    assertTrue(json.contains("\"risk_source\" : \"unavailable\""));
  }

  @Test
  void printsReportWithDetectorsToStdout() throws Exception {
    Path pcap = capture("flows.pcapng");

    ExitCode code = AnalyzeCli.run(new String[] {
        "pcap=" + pcap, "maxPackets=2", "metricsExporter=none",
        "anomalyModelFile=" + tempDir.resolve("anomaly.json")});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("\"packets_processed\" : 2"));
    assertTrue(output.contains("\"ml_enabled\" : true"));
    assertTrue(output.contains("SQL injection attempt detected"));
  }

  @Test
  void acceptsBareCapturePathAndNoMlFlag() throws Exception {
    Path pcap = capture("bare.pcap");

    ExitCode code = AnalyzeCli.run(new String[] {
        pcap.toString(), "--no-ml", "metricsExporter=none",
        "anomalyModelFile=" + tempDir.resolve("anomaly.json")});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("\"packets_processed\" : 3"));
    assertTrue(output.contains("\"ml_enabled\" : false"));
  }

  @Test
  void rejectsConflictingCapturePathsAndUnknownFlags() throws Exception {
    Path pcap = capture("twice.pcap");

    assertEquals(ExitCode.INVALID_ARGS, AnalyzeCli.run(new String[] {pcap.toString(), "pcap=" + pcap}));
    assertEquals(ExitCode.INVALID_ARGS, AnalyzeCli.run(new String[] {pcap.toString(), "--dry-run"}));
    assertEquals(ExitCode.INVALID_ARGS, AnalyzeCli.run(new String[] {pcap.toString(), "other.pcap"}));
  }

  @Test
  void checkInputRejectsEmptyAndOversizedFiles() throws Exception {
    Path empty = Files.write(tempDir.resolve("empty.pcap"), new byte[0]);
    Path upper = capture("UPPER.PCAPNG");

    PcapFormatException emptyFailure =
        assertThrows(PcapFormatException.class, () -> AnalyzeCli.checkInput(empty, 1_024));
    PcapFormatException tooLarge =
        assertThrows(PcapFormatException.class, () -> AnalyzeCli.checkInput(upper, 10));
    PcapFormatException missing = assertThrows(
        PcapFormatException.class, () -> AnalyzeCli.checkInput(tempDir.resolve("gone.pcap"), 1_024));

    assertEquals(WardenFailure.Kind.PCAP_EMPTY, emptyFailure.failure().kind());
    assertEquals(WardenFailure.Kind.PCAP_TOO_LARGE, tooLarge.failure().kind());
    assertEquals(WardenFailure.Kind.PCAP_INVALID, missing.failure().kind());
    AnalyzeCli.checkInput(upper, 1_024 * 1_024);
  }

  private Path capture(String name) throws Exception {
    List<byte[]> frames = List.of(
        Frames.tcp("203.0.113.5", "198.51.100.10", 40000, 80, "GET /?id=1' UNION SELECT password FROM users"),
        Frames.tcp("198.51.100.10", "203.0.113.5", 80, 40000, "HTTP/1.1 200 OK\r\n\r\n"),
        Frames.dnsQuery("203.0.113.5", "198.51.100.53", "example.org"));
    Path file = tempDir.resolve(name);
    return name.toLowerCase(Locale.ROOT).endsWith(".pcapng")
        ? PcapFixtures.writePcapng(file, frames)
        : PcapFixtures.writePcap(file, frames);
  }
}
