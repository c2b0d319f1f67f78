package ca.gc.cra.warden.infrastructure.model;

import ca.gc.cra.warden.application.port.AnomalyModel;
import ca.gc.cra.warden.application.port.AnomalyModelStore;
import ca.gc.cra.warden.infrastructure.json.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link AnomalyModelStore} persisting {@link StandardizedDistanceModel}s as JSON.
 * <p><strong>Why:</strong> A restarted engine restores its baseline instead of collecting samples again.</p>
 * <p>Saves go to a sibling temp file that is then moved over the target, so a crash mid-write never leaves a
 * half-written model.</p>
 *
 * @since 0.1.0
 */
public final class JsonAnomalyModelStore implements AnomalyModelStore {
  private static final Logger log = LoggerFactory.getLogger(JsonAnomalyModelStore.class);

  private final Path file;
  private final ObjectMapper mapper = JsonMappers.pretty();

  /**
   * Creates a store.
   *
   * @param file model file path; parent directories are created on save
   */
  public JsonAnomalyModelStore(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
  }

  @Override
  public void save(AnomalyModel model, int trainingSamples) throws IOException {
    if (!(model instanceof StandardizedDistanceModel fitted)) {
      throw new IOException("Cannot persist anomaly model of type " + model.modelType());
    }
    ModelFile content = new ModelFile(
        fitted.modelType(), trainingSamples, Instant.now().toString(), fitted.mean(), fitted.scale(), fitted.cutoff());
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    mapper.writeValue(temp.toFile(), content);
    try {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
    log.info("Anomaly model saved to {} ({} samples)", file, trainingSamples);
  }

  @Override
  public Optional<AnomalyModel> load() throws IOException {
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    ModelFile content;
    try {
      content = mapper.readValue(file.toFile(), ModelFile.class);
    } catch (JsonProcessingException ex) {
      throw new IOException("Anomaly model file " + file + " is not valid JSON", ex);
    }
    if (!StandardizedDistanceModel.TYPE.equals(content.modelType())) {
      throw new IOException("Unsupported anomaly model type '" + content.modelType() + "' in " + file);
    }
    try {
      StandardizedDistanceModel model =
          new StandardizedDistanceModel(content.mean(), content.scale(), content.cutoff());
      log.info("Anomaly model restored from {} (saved {}, {} samples)",
          file, content.savedAt(), content.trainingSamples());
      return Optional.of(model);
    } catch (IllegalArgumentException ex) {
      throw new IOException("Anomaly model file " + file + " has invalid parameters", ex);
    }
  }

  /**
   * Returns the model file path.
   *
   * @return absolute path
   */
  public Path file() {
    return file;
  }

  record ModelFile(
      String modelType, int trainingSamples, String savedAt, double[] mean, double[] scale, double cutoff) {}
}
