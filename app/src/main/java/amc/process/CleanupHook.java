package amc.process;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single JVM shutdown hook that runs on SIGINT or SIGTERM and cancels every live {@link
 * ResourceGuard}.
 */
final class CleanupHook {
  private static final Logger LOG = LoggerFactory.getLogger(CleanupHook.class);
  private static final AtomicBoolean INSTALLED = new AtomicBoolean();

  private CleanupHook() {}

  static void install() {
    if (!INSTALLED.compareAndSet(false, true)) {
      return;
    }
    try {
      Runtime.getRuntime().addShutdownHook(new Thread(CleanupHook::run, "amc-cleanup"));
    } catch (IllegalStateException ex) {
      LOG.debug("JVM already shutting down, cleanup hook not installed");
    }
  }

  private static void run() {
    if (ResourceGuard.liveCount() > 0) {
      LOG.info("Termination requested, cleaning up temporary files and child processes");
    }
    ResourceGuard.cancelAll();
  }
}
