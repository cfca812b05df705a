package amc.process;

import amc.error.BackendFailureException;
import amc.error.EvaluationCancelledException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped registry of the temp files, pipes and child processes one evaluation creates.
 *
 * <p>Every path is registered when it is created and deregistered right after it is deleted.
 * Every open guard is also listed in a process-wide set, which the cleanup hook walks when the JVM
 * is asked to terminate: it {@link #cancel() cancels} each guard, deleting its files and killing
 * its process trees. Callers blocked on a killed process then observe an {@link
 * EvaluationCancelledException}. Several guards can be open at once, one per concurrent
 * evaluation.
 */
public final class ResourceGuard implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(ResourceGuard.class);
  private static final Set<ResourceGuard> LIVE = ConcurrentHashMap.newKeySet();

  private final Object lock = new Object();
  private final Map<Path, ResourceKind> paths = new LinkedHashMap<>();
  private final Set<Process> processes = new LinkedHashSet<>();
  private volatile boolean cancelled;
  private boolean closed;

  private ResourceGuard() {}

  public static ResourceGuard open() {
    CleanupHook.install();
    ResourceGuard guard = new ResourceGuard();
    LIVE.add(guard);
    return guard;
  }

  /** Cancels every open guard. Invoked by the cleanup hook. */
  public static void cancelAll() {
    for (ResourceGuard guard : List.copyOf(LIVE)) {
      guard.cancel();
    }
  }

  static int liveCount() {
    return LIVE.size();
  }

  public Path createTempFile(String prefix, String suffix) {
    checkNotCancelled();
    Path path;
    try {
      path = Files.createTempFile(prefix, suffix);
    } catch (IOException ex) {
      throw new BackendFailureException("tempfile", "could not create temp file", ex);
    }
    try {
      register(path, ResourceKind.FILE);
    } catch (RuntimeException ex) {
      deleteQuietly(path);
      throw ex;
    }
    return path;
  }

  /**
   * Registers a path created elsewhere so that it is removed with this guard.
   *
   * @throws EvaluationCancelledException if the guard was cancelled
   * @throws IllegalStateException if the guard was closed
   */
  public void register(Path path, ResourceKind kind) {
    synchronized (lock) {
      checkNotCancelled();
      if (closed) {
        throw new IllegalStateException("Resource guard is already closed");
      }
      paths.put(path, kind);
    }
  }

  /** Deletes the path now and deregisters it. */
  public void delete(Path path) {
    synchronized (lock) {
      deleteQuietly(path);
      paths.remove(path);
    }
  }

  public Set<Path> registeredPaths() {
    synchronized (lock) {
      return Set.copyOf(paths.keySet());
    }
  }

  void register(Process process) {
    synchronized (lock) {
      if (cancelled) {
        killTree(process);
        throw new EvaluationCancelledException("Evaluation cancelled");
      }
      processes.add(process);
    }
  }

  void deregister(Process process) {
    synchronized (lock) {
      processes.remove(process);
    }
  }

  /** Deletes every registered path and kills every registered process with its descendants. */
  public void cancel() {
    List<Process> victims;
    synchronized (lock) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      victims = new ArrayList<>(processes);
      processes.clear();
      deleteAll();
    }
    if (!victims.isEmpty()) {
      LOG.warn("Cancelling evaluation, killing {} child process(es)", victims.size());
    }
    for (Process process : victims) {
      killTree(process);
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public void checkNotCancelled() {
    if (cancelled) {
      throw new EvaluationCancelledException("Evaluation cancelled");
    }
  }

  @Override
  public void close() {
    List<Process> leftovers;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      leftovers = new ArrayList<>(processes);
      processes.clear();
      deleteAll();
    }
    for (Process process : leftovers) {
      killTree(process);
    }
    LIVE.remove(this);
  }

  private void deleteAll() {
    for (Path path : paths.keySet()) {
      deleteQuietly(path);
    }
    paths.clear();
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      LOG.warn("Could not delete {}: {}", path, ex.getMessage());
    }
  }

  static void killTree(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }
}
