package ca.gc.cra.secretscan.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime log levels for CLI-driven scans.
 * <p><strong>Why:</strong> Lets operators raise verbosity with {@code --verbose} without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 * <p><strong>Observability:</strong> Warns when the SLF4J backend does not support dynamic level changes.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configured levels.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String APPLICATION_LOGGER = "ca.gc.cra.secretscan";
  static final String AWS_SDK_LOGGER = "software.amazon.awssdk";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root and application loggers to DEBUG. The AWS SDK stays at INFO so request wire logs are not
   * emitted.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
      context.getLogger(APPLICATION_LOGGER).setLevel(Level.DEBUG);
      Logger sdk = context.getLogger(AWS_SDK_LOGGER);
      if (sdk.getLevel() == null || sdk.getLevel().isGreaterOrEqual(Level.WARN)) {
        sdk.setLevel(Level.INFO);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
