package amc.cli;

import amc.cnf.WeightedCnf;
import amc.eval.BackendConfig;
import amc.eval.Backends;
import amc.eval.EvaluationOptions;
import amc.eval.EvaluationResult;
import amc.eval.Evaluator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the {@code evaluate} command. */
final class EvaluateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(EvaluateCommand.class);

  private final Function<EvaluationOptions, Backends> backendFactory;

  EvaluateCommand() {
    this(options -> Backends.external(BackendConfig.fromEnvironment(), options));
  }

  EvaluateCommand(Function<EvaluationOptions, Backends> backendFactory) {
    this.backendFactory = backendFactory;
  }

  int execute(CliOptions options) throws IOException {
    WeightedCnf cnf = CliParsers.loadCnf(options);
    EvaluationOptions evaluationOptions = options.evaluationOptions();
    Evaluator evaluator = new Evaluator(backendFactory.apply(evaluationOptions), evaluationOptions);
    EvaluationResult result = evaluator.evaluate(cnf);
    logResult(result);
    if (options.jsonPath() != null) {
      String json = new JsonReportBuilder().build(options, result);
      Files.writeString(options.jsonPath(), json, StandardCharsets.UTF_8);
      LOG.info("Wrote JSON report to {}", options.jsonPath());
    }
    return 0;
  }

  private static void logResult(EvaluationResult result) {
    List<String> values = result.formatted();
    if (values.size() == 1) {
      LOG.info("The overall weight is {}", values.get(0));
      return;
    }
    for (int i = 0; i < values.size(); i++) {
      LOG.info("Query {}: {}", i, values.get(i));
    }
  }
}
