package ca.gc.cra.warden.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger app;
  private Logger pcap4j;
  private Level appLevel;
  private Level pcap4jLevel;

  @BeforeEach
  void setUp() {
    app = (Logger) LoggerFactory.getLogger(LoggingConfigurator.APP_LOGGER);
    pcap4j = (Logger) LoggerFactory.getLogger("org.pcap4j");
    appLevel = app.getLevel();
    pcap4jLevel = pcap4j.getLevel();
    app.setLevel(Level.INFO);
    pcap4j.setLevel(Level.WARN);
  }

  @AfterEach
  void tearDown() {
    app.setLevel(appLevel);
    pcap4j.setLevel(pcap4jLevel);
  }

  @Test
  void verboseRaisesOnlyApplicationLoggers() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertTrue(LoggerFactory.getLogger("ca.gc.cra.warden.application.pipeline.LiveEngine").isDebugEnabled());
    assertEquals(Level.WARN, pcap4j.getLevel());
    assertFalse(LoggerFactory.getLogger("org.pcap4j.core.PcapHandle").isDebugEnabled());
  }

  @Test
  void secondCallIsNoOp() {
    LoggingConfigurator.enableVerboseLogging();

    assertFalse(LoggingConfigurator.enableVerboseLogging());
  }
}
