package ca.gc.cra.secretscan.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private LoggerContext context;
  private Level rootLevel;
  private Level appLevel;
  private Level sdkLevel;

  @BeforeEach
  void captureLevels() {
    context = (LoggerContext) LoggerFactory.getILoggerFactory();
    rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    appLevel = context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel();
    sdkLevel = context.getLogger(LoggingConfigurator.AWS_SDK_LOGGER).getLevel();
  }

  @AfterEach
  void restoreLevels() {
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
    context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).setLevel(appLevel);
    context.getLogger(LoggingConfigurator.AWS_SDK_LOGGER).setLevel(sdkLevel);
  }

  @Test
  void verboseRaisesApplicationLoggersButCapsAwsSdk() {
    context.getLogger(LoggingConfigurator.AWS_SDK_LOGGER).setLevel(Level.WARN);

    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    assertEquals(Level.DEBUG, context.getLogger(LoggingConfigurator.APPLICATION_LOGGER).getLevel());
    assertEquals(Level.INFO, context.getLogger(LoggingConfigurator.AWS_SDK_LOGGER).getLevel());
  }
}
