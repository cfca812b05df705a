package amc.process;

import amc.error.BackendFailureException;
import amc.error.EvaluationCancelledException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A child process started under a {@link ResourceGuard}. Its standard error is drained in the
 * background; standard input and output are left to the caller, which makes incremental reading
 * of streaming backends possible.
 */
public final class ExternalProcess implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(ExternalProcess.class);

  private final String backend;
  private final Process process;
  private final ResourceGuard guard;
  private final StreamCollector stderr;
  private BufferedReader stdout;
  private StreamCollector stdoutCollector;

  private ExternalProcess(String backend, Process process, ResourceGuard guard) {
    this.backend = backend;
    this.process = process;
    this.guard = guard;
    this.stderr = StreamCollector.start(process.getErrorStream(), backend + "-stderr");
  }

  public static ExternalProcess start(ResourceGuard guard, String backend, List<String> command) {
    return start(guard, backend, command, null);
  }

  /** Starts {@code command} in {@code workingDirectory}, or the current directory if null. */
  public static ExternalProcess start(
      ResourceGuard guard, String backend, List<String> command, Path workingDirectory) {
    guard.checkNotCancelled();
    LOG.debug("Starting {}: {}", backend, String.join(" ", command));
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDirectory != null) {
      builder.directory(workingDirectory.toFile());
    }
    Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      throw new BackendFailureException(backend, "could not start " + command.get(0), ex);
    }
    guard.register(process);
    return new ExternalProcess(backend, process, guard);
  }

  public String backend() {
    return backend;
  }

  public OutputStream stdin() {
    return process.getOutputStream();
  }

  /** Writes {@code text} to standard input and closes it. */
  public void writeStdin(String text) {
    try (Writer writer = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)) {
      writer.write(text);
    } catch (IOException ex) {
      guard.checkNotCancelled();
      if (process.isAlive()) {
        throw new BackendFailureException(backend, "could not write input", ex);
      }
      // exited without reading its input; the exit code tells whether that is a failure
      LOG.debug("{} closed its input early: {}", backend, ex.getMessage());
    }
  }

  public synchronized BufferedReader stdout() {
    if (stdout == null) {
      stdout =
          new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    }
    return stdout;
  }

  /** Reads standard output up to end-of-file. */
  public String readStdout() {
    StringBuilder out = new StringBuilder();
    try {
      String line;
      while ((line = stdout().readLine()) != null) {
        out.append(line).append('\n');
      }
    } catch (IOException ex) {
      guard.checkNotCancelled();
      throw new BackendFailureException(backend, "could not read output", ex);
    }
    return out.toString();
  }

  /**
   * Drains standard output in the background from now on, for backends that print while the
   * caller only waits. Retrieve the text with {@link #collectedStdout()}.
   */
  public synchronized void collectStdout() {
    if (stdoutCollector == null) {
      stdoutCollector = StreamCollector.start(process.getInputStream(), backend + "-stdout");
    }
  }

  /** Waits for the end of standard output and returns what {@link #collectStdout()} gathered. */
  public String collectedStdout() {
    if (stdoutCollector == null) {
      throw new IllegalStateException("collectStdout() was not called");
    }
    try {
      return stdoutCollector.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      guard.cancel();
      throw new EvaluationCancelledException("Interrupted while reading " + backend);
    }
  }

  /** Blocks until the process exits and returns its exit code. */
  public int waitFor() {
    try {
      int exitCode = process.waitFor();
      guard.checkNotCancelled();
      return exitCode;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      guard.cancel();
      throw new EvaluationCancelledException("Interrupted while waiting for " + backend);
    }
  }

  /** Waits at most {@code timeout}; returns whether the process exited. */
  public boolean waitFor(Duration timeout) {
    try {
      boolean exited = process.waitFor(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
      guard.checkNotCancelled();
      return exited;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      guard.cancel();
      throw new EvaluationCancelledException("Interrupted while waiting for " + backend);
    }
  }

  /**
   * Asks the process to stop (SIGTERM) and kills it with its descendants if it is still running
   * after {@code grace}.
   */
  public void terminate(Duration grace) {
    if (!process.isAlive()) {
      return;
    }
    process.destroy();
    if (!waitFor(grace)) {
      LOG.debug("{} ignored the termination request, killing it", backend);
      ResourceGuard.killTree(process);
      waitFor();
    }
  }

  public boolean isAlive() {
    return process.isAlive();
  }

  /** Standard error captured so far. */
  public String stderr() {
    return stderr.content();
  }

  /** Waits for exit and the end of standard error, pairing them with the given output. */
  public ProcessResult finish(String output) {
    int exitCode = waitFor();
    String errors;
    try {
      errors = stderr.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new EvaluationCancelledException("Interrupted while waiting for " + backend);
    }
    if (exitCode != 0 && !errors.isBlank()) {
      LOG.debug("{} exited with {}: {}", backend, exitCode, errors.strip());
    }
    return new ProcessResult(backend, exitCode, output, errors);
  }

  @Override
  public void close() {
    if (process.isAlive()) {
      ResourceGuard.killTree(process);
    }
    guard.deregister(process);
  }
}
