package amc.eval;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of one evaluation.
 *
 * @param preprocessedOutput where to write the CNF after preprocessing, or null
 * @param maxSatPrecisionDigits significant digits kept when MaxSAT weights are scaled to integers
 */
public record EvaluationOptions(
    Strategy strategy,
    boolean preprocessing,
    CompilerKind compiler,
    Duration decompositionTimeout,
    int maxSatPrecisionDigits,
    Path preprocessedOutput) {

  public static final int DEFAULT_MAXSAT_PRECISION = 8;

  public static EvaluationOptions defaults() {
    return new EvaluationOptions(
        Strategy.FLEXIBLE, false, CompilerKind.C2D, Duration.ofSeconds(1), DEFAULT_MAXSAT_PRECISION, null);
  }

  public static EvaluationOptions normalize(EvaluationOptions options) {
    if (options == null) {
      return defaults();
    }
    EvaluationOptions defaults = defaults();
    Strategy strategy = options.strategy() != null ? options.strategy() : defaults.strategy();
    CompilerKind compiler = options.compiler() != null ? options.compiler() : defaults.compiler();
    Duration timeout =
        options.decompositionTimeout() != null && !options.decompositionTimeout().isNegative()
            ? options.decompositionTimeout()
            : defaults.decompositionTimeout();
    int precision =
        options.maxSatPrecisionDigits() > 0
            ? options.maxSatPrecisionDigits()
            : defaults.maxSatPrecisionDigits();
    return new EvaluationOptions(
        strategy, options.preprocessing(), compiler, timeout, precision, options.preprocessedOutput());
  }

  public EvaluationOptions withStrategy(Strategy newStrategy) {
    return new EvaluationOptions(
        newStrategy,
        preprocessing,
        compiler,
        decompositionTimeout,
        maxSatPrecisionDigits,
        preprocessedOutput);
  }
}
