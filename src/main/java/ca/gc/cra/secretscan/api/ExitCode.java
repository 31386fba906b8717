package ca.gc.cra.secretscan.api;

/**
 * <strong>What:</strong> Process exit codes shared by the {@code secretscan} commands.
 * <p><strong>Why:</strong> Lets scheduled scans distinguish bad input, unreadable files, partial scans and
 * interruption without parsing log output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Scan completed; every selected resource type was enumerated. */
  SUCCESS(0),
  /** Command-line arguments were malformed. */
  INVALID_ARGS(2),
  /** A local file could not be read. */
  IO_ERROR(3),
  /** Configuration values or the pattern file were invalid. */
  CONFIG_ERROR(4),
  /** At least one resource type could not be enumerated, or an unexpected failure occurred. */
  RUNTIME_FAILURE(5),
  /** Interrupted or cancelled (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric process status */
  public int code() {
    return code;
  }
}
