package amc.cli;

import amc.eval.CompilerKind;
import amc.eval.EvaluationOptions;
import amc.eval.Strategy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

record CliOptions(
    Command command,
    String inputFile,
    Strategy strategy,
    boolean preprocess,
    CompilerKind compiler,
    Duration decompositionTimeout,
    int precision,
    Path writePath,
    Path jsonPath,
    String verbosity,
    boolean help) {

  enum Command {
    EVALUATE,
    TREEWIDTH
  }

  CliOptions {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(strategy, "strategy");
    Objects.requireNonNull(compiler, "compiler");
    Objects.requireNonNull(decompositionTimeout, "decompositionTimeout");
    if (precision < 1) {
      throw new IllegalArgumentException("--precision must be at least 1");
    }
    if (writePath != null && !preprocess) {
      throw new IllegalArgumentException("--write requires --preprocess");
    }
  }

  /** True if the CNF is read from standard input. */
  boolean readsStdin() {
    return inputFile == null || inputFile.isBlank() || "-".equals(inputFile);
  }

  EvaluationOptions evaluationOptions() {
    return new EvaluationOptions(
        strategy, preprocess, compiler, decompositionTimeout, precision, writePath);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Command command = Command.EVALUATE;
    private String inputFile;
    private Strategy strategy = EvaluationOptions.defaults().strategy();
    private boolean preprocess;
    private CompilerKind compiler = EvaluationOptions.defaults().compiler();
    private Duration decompositionTimeout = EvaluationOptions.defaults().decompositionTimeout();
    private int precision = EvaluationOptions.DEFAULT_MAXSAT_PRECISION;
    private Path writePath;
    private Path jsonPath;
    private String verbosity = "info";
    private boolean help;

    Builder command(Command command) {
      this.command = command;
      return this;
    }

    Builder inputFile(String inputFile) {
      if (this.inputFile != null) {
        throw new IllegalArgumentException(
            "Only one input file is accepted, got " + this.inputFile + " and " + inputFile);
      }
      this.inputFile = inputFile;
      return this;
    }

    Builder strategy(Strategy strategy) {
      this.strategy = strategy;
      return this;
    }

    Builder preprocess(boolean preprocess) {
      this.preprocess = preprocess;
      return this;
    }

    Builder compiler(CompilerKind compiler) {
      this.compiler = compiler;
      return this;
    }

    Builder decompositionTimeout(Duration decompositionTimeout) {
      this.decompositionTimeout = decompositionTimeout;
      return this;
    }

    Builder precision(int precision) {
      this.precision = precision;
      return this;
    }

    Builder writePath(Path writePath) {
      this.writePath = writePath;
      return this;
    }

    Builder jsonPath(Path jsonPath) {
      this.jsonPath = jsonPath;
      return this;
    }

    Builder verbosity(String verbosity) {
      this.verbosity = verbosity;
      return this;
    }

    Builder help(boolean help) {
      this.help = help;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          command,
          inputFile,
          strategy,
          preprocess,
          compiler,
          decompositionTimeout,
          precision,
          writePath,
          jsonPath,
          verbosity,
          help);
    }
  }
}
