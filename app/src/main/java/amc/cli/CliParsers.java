package amc.cli;

import amc.cnf.WeightedCnf;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/** Shared helpers for CLI argument parsing and input loading. */
final class CliParsers {
  static final Set<String> LOG_LEVELS = Set.of("trace", "debug", "info", "warn", "error", "off");

  private CliParsers() {}

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  /** Seconds, possibly fractional, e.g. {@code 0.5}. */
  static Duration parseSeconds(String raw, String optionName) {
    double seconds;
    try {
      seconds = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number of seconds for " + optionName + ": " + raw);
    }
    if (!(seconds >= 0) || Double.isInfinite(seconds)) {
      throw new IllegalArgumentException(optionName + " must be a non-negative number: " + raw);
    }
    return Duration.ofMillis(Math.round(seconds * 1000));
  }

  static String parseVerbosity(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!LOG_LEVELS.contains(normalized)) {
      throw new IllegalArgumentException("Invalid verbosity: " + raw);
    }
    return normalized;
  }

  /**
   * Scans the raw arguments for a verbosity option, so the log level can be set before the first
   * logger is created.
   */
  static String findVerbosity(String[] args) {
    String found = null;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg.startsWith("--verbosity=")) {
        found = arg.substring("--verbosity=".length());
      } else if (arg.equals("--verbosity") && i + 1 < args.length) {
        found = args[i + 1];
      }
    }
    if (found == null) {
      return null;
    }
    String normalized = found.trim().toLowerCase(Locale.ROOT);
    return LOG_LEVELS.contains(normalized) ? normalized : null;
  }

  static WeightedCnf loadCnf(CliOptions options) throws IOException {
    if (options.readsStdin()) {
      Reader reader = new InputStreamReader(System.in, StandardCharsets.UTF_8);
      return WeightedCnf.parse(reader);
    }
    Path path = Path.of(options.inputFile());
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Input file not found: " + path);
    }
    return WeightedCnf.fromFile(path);
  }
}
