package ca.gc.cra.induform.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by InduForm command-line tools.
 * <ul>
 *   <li>Enumerate well-known success and failure outcomes.</li>
 *   <li>Expose the numeric value consumed by CI jobs and scripts.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** The project was assessed and found invalid. */
  VALIDATION_FAILED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading a project or writing output. */
  IO_ERROR(3),
  /** Configuration or project document was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

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
