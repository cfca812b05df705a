package amc.process;

import amc.util.Timing;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs a backend to completion, feeding standard input and collecting its output. */
public final class ProcessRunner {
  private static final Logger LOG = LoggerFactory.getLogger(ProcessRunner.class);

  private ProcessRunner() {}

  public static ProcessResult run(ResourceGuard guard, String backend, List<String> command) {
    return run(guard, backend, command, null);
  }

  /**
   * Starts {@code command}, writes {@code input} (if not null) to its standard input and waits for
   * it to exit. Output is drained concurrently so large outputs cannot stall the child.
   */
  public static ProcessResult run(
      ResourceGuard guard, String backend, List<String> command, String input) {
    return run(guard, backend, command, input, null);
  }

  public static ProcessResult run(
      ResourceGuard guard,
      String backend,
      List<String> command,
      String input,
      Path workingDirectory) {
    Timing timing = Timing.start();
    try (ExternalProcess process =
        ExternalProcess.start(guard, backend, command, workingDirectory)) {
      process.collectStdout();
      process.writeStdin(input == null ? "" : input);
      ProcessResult result = process.finish(process.collectedStdout());
      LOG.debug("{} exited with {} after {} ms", backend, result.exitCode(), timing.elapsedMillis());
      return result;
    }
  }
}
