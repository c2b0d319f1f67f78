package ca.gc.cra.warden.infrastructure.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration: snake_case property names, unknown properties ignored on read.
 *
 * <p>{@link ObjectMapper} is thread-safe once configured, so callers share the returned instances.</p>
 *
 * @since 0.1.0
 */
public final class JsonMappers {
  private static final ObjectMapper COMPACT = configure(new ObjectMapper());
  private static final ObjectMapper PRETTY = configure(new ObjectMapper()).enable(SerializationFeature.INDENT_OUTPUT);

  private JsonMappers() {}

  /**
   * Returns the single-line mapper used for NDJSON records and model files.
   *
   * @return shared mapper
   */
  public static ObjectMapper compact() {
    return COMPACT;
  }

  /**
   * Returns the indented mapper used for reports written for people.
   *
   * @return shared mapper
   */
  public static ObjectMapper pretty() {
    return PRETTY;
  }

  private static ObjectMapper configure(ObjectMapper mapper) {
    mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    mapper.setSerializationInclusion(JsonInclude.Include.ALWAYS);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    return mapper;
  }
}
