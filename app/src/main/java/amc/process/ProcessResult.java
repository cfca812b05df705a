package amc.process;

import amc.error.BackendFailureException;
import java.util.Set;

/** Exit code and captured output of a finished external process. */
public record ProcessResult(String backend, int exitCode, String stdout, String stderr) {

  /**
   * Fails with {@link BackendFailureException} unless the exit code is zero or one of {@code
   * accepted}.
   */
  public ProcessResult requireExitCode(Set<Integer> accepted) {
    if (exitCode != 0 && !accepted.contains(exitCode)) {
      throw new BackendFailureException(backend, exitCode);
    }
    return this;
  }

  public ProcessResult requireSuccess() {
    return requireExitCode(Set.of());
  }
}
