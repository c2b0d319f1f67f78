package ca.gc.cra.warden.infrastructure.persistence;

import ca.gc.cra.warden.application.port.SampleCollectorPort;
import ca.gc.cra.warden.domain.detect.FeatureVector;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.infrastructure.json.JsonMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;

/**
 * Appends labelled training samples to an NDJSON file for offline model training.
 *
 * <p>Each line holds the named features, the packet's addresses, ports and protocol, and the label with its origin
 * and confidence. Writes synchronize on the instance.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonSampleCollector implements SampleCollectorPort, Closeable {
  private final Path file;
  private final ObjectMapper mapper = JsonMappers.compact();
  private BufferedWriter writer;

  /**
   * Opens (creating if needed) the sample file.
   *
   * @param file NDJSON path
   * @throws IOException if the file cannot be opened
   */
  public NdjsonSampleCollector(Path file) throws IOException {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
    Path parent = this.file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    this.writer = Files.newBufferedWriter(
        this.file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  @Override
  public synchronized void collect(
      FeatureVector features, PacketRecord context, String label, String labeledBy, double confidence)
      throws IOException {
    if (writer == null) {
      throw new IOException("Sample file " + file + " is closed");
    }
    Sample sample = new Sample(
        context.timestampMillis(),
        features.toNamedMap(),
        context.srcIp(),
        context.dstIp(),
        context.srcPort(),
        context.dstPort(),
        context.protocol().label(),
        label,
        labeledBy,
        confidence);
    writer.write(mapper.writeValueAsString(sample));
    writer.newLine();
    writer.flush();
  }

  @Override
  public synchronized void close() throws IOException {
    if (writer != null) {
      try {
        writer.close();
      } finally {
        writer = null;
      }
    }
  }

  record Sample(
      long timestampMillis,
      Map<String, Double> features,
      String sourceIp,
      String destIp,
      int sourcePort,
      int destPort,
      String protocol,
      String label,
      String labeledBy,
      double confidence) {}
}
