package ca.gc.cra.warden.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * Persists fitted anomaly models so a restarted engine can score immediately.
 *
 * @since 0.1.0
 */
public interface AnomalyModelStore {
  /**
   * Saves a fitted model.
   *
   * @param model fitted model
   * @param trainingSamples number of samples the model was fitted on
   * @throws IOException if the model cannot be written
   */
  void save(AnomalyModel model, int trainingSamples) throws IOException;

  /**
   * Loads the previously saved model.
   *
   * @return saved model, or empty when none exists
   * @throws IOException if a saved model exists but cannot be read
   */
  Optional<AnomalyModel> load() throws IOException;

  /**
   * Store that keeps nothing.
   */
  AnomalyModelStore NONE = new AnomalyModelStore() {
    @Override public void save(AnomalyModel model, int trainingSamples) {}

    @Override public Optional<AnomalyModel> load() {
      return Optional.empty();
    }
  };
}
