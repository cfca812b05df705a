package amc.error;

/** An external backend exited with a nonzero code or could not be run at all. */
public final class BackendFailureException extends AmcException {
  private final String backend;
  private final int exitCode;

  public BackendFailureException(String backend, int exitCode) {
    super(backend + " failed with exit code " + exitCode + ".");
    this.backend = backend;
    this.exitCode = exitCode;
  }

  public BackendFailureException(String backend, String message, Throwable cause) {
    super(backend + ": " + message, cause);
    this.backend = backend;
    this.exitCode = -1;
  }

  public String backend() {
    return backend;
  }

  /** Exit code of the process, {@code -1} if it never produced one. */
  public int exitCode() {
    return exitCode;
  }
}
