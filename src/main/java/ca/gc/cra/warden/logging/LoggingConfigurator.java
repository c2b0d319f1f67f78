package ca.gc.cra.warden.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code --verbose} flag of the WARDEN commands to Logback.
 *
 * <p>Only the {@value #APP_LOGGER} hierarchy drops to DEBUG. pcap4j, gRPC and OpenTelemetry keep the levels from
 * {@code logback.xml}, which would otherwise flood stderr with per-packet and per-export chatter.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger hierarchy raised by {@link #enableVerboseLogging()}. */
  public static final String APP_LOGGER = "ca.gc.cra.warden";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Raises WARDEN's own loggers to DEBUG for the rest of the JVM's life.
   *
   * @return {@code true} if the level changed; {@code false} when already DEBUG or the backend is not Logback
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
          factory.getClass().getName());
      return false;
    }
    Logger app = context.getLogger(APP_LOGGER);
    if (Level.DEBUG.equals(app.getLevel())) {
      return false;
    }
    app.setLevel(Level.DEBUG);
    return true;
  }
}
