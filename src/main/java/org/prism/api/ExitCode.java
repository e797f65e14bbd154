package org.prism.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by PRISM command-line tools.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate well-known success and failure outcomes.</li>
 *   <li>Expose the numeric value consumed by operating systems and scripts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments, label map or configuration values were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** A document could not be parsed and the run was aborted. */
  DOCUMENT_FAILURE(6),
  /** The batch completed but one or more documents were skipped. */
  PARTIAL_SUCCESS(7),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
