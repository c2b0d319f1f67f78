package ca.gc.cra.warden.infrastructure.persistence;

import ca.gc.cra.warden.application.port.AlertStorePort;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.infrastructure.json.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link AlertStorePort} that appends one JSON object per alert to a file.
 * <p><strong>Why:</strong> Gives operators a durable, grep-friendly alert log without a database.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append and flush each alert as a snake_case JSON line.</li>
 *   <li>Answer {@link #existsRecent} from a bounded in-memory index seeded from the existing file, so a restarted
 *       engine does not re-alert on the same key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Writes synchronize on the instance.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonAlertStore implements AlertStorePort, Closeable {
  private static final Logger log = LoggerFactory.getLogger(NdjsonAlertStore.class);

  private final Path file;
  private final ObjectMapper mapper = JsonMappers.compact();
  private final InMemoryAlertStore index = new InMemoryAlertStore();
  private BufferedWriter writer;

  /**
   * Opens (creating if needed) the alert log and indexes its existing entries.
   *
   * @param file NDJSON file path
   * @throws IOException if the file cannot be opened
   */
  public NdjsonAlertStore(Path file) throws IOException {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
    Path parent = this.file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    int seeded = seedIndex();
    this.writer = Files.newBufferedWriter(
        this.file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    log.info("Alert log {} opened ({} existing alerts indexed)", this.file, seeded);
  }

  @Override
  public synchronized String insert(Detection detection, PacketRecord context) throws IOException {
    if (writer == null) {
      throw new IOException("Alert log " + file + " is closed");
    }
    AlertRecord record = AlertRecord.of(UUID.randomUUID().toString(), detection, context);
    writer.write(mapper.writeValueAsString(record));
    writer.newLine();
    writer.flush();
    index.add(record);
    return record.alertId();
  }

  @Override
  public boolean existsRecent(String sourceIp, String ruleId, int destPort, long sinceMillis) {
    return index.existsRecent(sourceIp, ruleId, destPort, sinceMillis);
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

  private int seedIndex() throws IOException {
    if (!Files.isRegularFile(file)) {
      return 0;
    }
    int seeded = 0;
    int skipped = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        try {
          index.add(mapper.readValue(line, AlertRecord.class));
          seeded++;
        } catch (JsonProcessingException ex) {
          skipped++;
          if (skipped == 1) {
            log.warn("Skipping unreadable line in alert log {}: {}", file, ex.getOriginalMessage());
          }
        }
      }
    }
    if (skipped > 1) {
      log.warn("Skipped {} unreadable lines in alert log {}", skipped, file);
    }
    return seeded;
  }
}
