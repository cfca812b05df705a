package amc.util;

import java.util.Locale;

/** Lightweight timer for logging phase durations. */
public final class Timing {
  private final long startedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  /** Elapsed time as seconds with two decimals, e.g. {@code 1.25}. */
  public String elapsedSeconds() {
    return String.format(Locale.ROOT, "%.2f", (System.nanoTime() - startedAt) / 1e9);
  }
}
