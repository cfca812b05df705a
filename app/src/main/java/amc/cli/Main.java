package amc.cli;

import amc.error.BackendFailureException;
import amc.error.ConfigurationException;
import amc.error.EvaluationCancelledException;
import amc.error.FormatException;
import amc.error.NumericOverflowException;
import amc.error.SolvingException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code amc evaluate [options] [file.cnf]} evaluates a weighted CNF
 *   <li>{@code amc treewidth [--decot s] file.cnf} reports a tree decomposition of its primal graph
 * </ul>
 *
 * <p>This is the only place that turns errors into exit codes.
 */
public final class Main {
  static final int EXIT_OK = 0;
  static final int EXIT_UNEXPECTED = 1;
  static final int EXIT_FORMAT = 2;
  static final int EXIT_CONFIGURATION = 3;
  static final int EXIT_OVERFLOW = 4;
  static final int EXIT_BACKEND = 5;
  static final int EXIT_SOLVING = 6;
  static final int EXIT_CANCELLED = 130;

  private static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    String[] effectiveArgs = args == null ? new String[0] : args;
    // slf4j-simple reads its level when the first logger is created
    String verbosity = CliParsers.findVerbosity(effectiveArgs);
    if (verbosity != null) {
      System.setProperty(LOG_LEVEL_PROPERTY, verbosity);
    }
    Logger log = LoggerFactory.getLogger(Main.class);
    try {
      CliOptions options = CliArguments.parse(effectiveArgs);
      if (options.help()) {
        System.out.println(CliArguments.usage());
        return EXIT_OK;
      }
      return switch (options.command()) {
        case EVALUATE -> new EvaluateCommand().execute(options);
        case TREEWIDTH -> new TreewidthCommand().execute(options);
      };
    } catch (IllegalArgumentException ex) {
      log.error(ex.getMessage());
      System.err.println(CliArguments.usage());
      return EXIT_CONFIGURATION;
    } catch (FormatException ex) {
      log.error("Malformed input: {}", ex.getMessage());
      return EXIT_FORMAT;
    } catch (ConfigurationException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      return EXIT_CONFIGURATION;
    } catch (NumericOverflowException ex) {
      log.error("Numeric overflow: {}", ex.getMessage());
      return EXIT_OVERFLOW;
    } catch (BackendFailureException ex) {
      log.error("Backend {} failed: {}", ex.backend(), ex.getMessage());
      return EXIT_BACKEND;
    } catch (SolvingException ex) {
      log.error("No usable answer: {}", ex.getMessage());
      return EXIT_SOLVING;
    } catch (EvaluationCancelledException ex) {
      log.error("Cancelled: {}", ex.getMessage());
      return EXIT_CANCELLED;
    } catch (IOException | RuntimeException ex) {
      log.error("Unexpected failure", ex);
      return EXIT_UNEXPECTED;
    }
  }
}
