package ca.gc.cra.warden.api;

import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.infrastructure.json.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Stdout channel of the WARDEN commands: usage text, NDJSON alerts, JSON reports and failure lines.
 *
 * <p>Diagnostics go to Logback on stderr, so stdout carries only output a caller may pipe into another tool.
 * Each call emits whole lines under the writer's lock; alert lines from the worker thread never interleave with the
 * summary printed on shutdown.</p>
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  /**
   * Prints one line, such as an NDJSON alert.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a block of lines without another caller's output in between.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    synchronized (writer) {
      for (String line : lines) {
        writer.println(line);
      }
    }
  }

  /**
   * Prints a value as indented JSON.
   *
   * @param value report or other serializable value
   * @throws JsonProcessingException if the value cannot be serialized
   */
  public static void printJson(Object value) throws JsonProcessingException {
    println(JsonMappers.pretty().writeValueAsString(value));
  }

  /**
   * Prints a structured failure as {@code kind: detail (suggestion)}.
   *
   * @param failure failure to report
   */
  public static void printFailure(WardenFailure failure) {
    println(failure.render());
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
