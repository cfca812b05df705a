package amc.backend;

import amc.error.BackendFailureException;
import amc.process.ProcessResult;
import amc.process.ProcessRunner;
import amc.process.ResourceGuard;
import amc.semiring.Numbers;
import amc.util.Timing;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** sharpSAT-TD as a weighted model counter; reads {@code c s exact arb float <v1;...>}. */
public final class SharpSatTdCounter implements ExactCounter {
  private static final String NAME = "sharpsat-td-counter";
  private static final String RESULT_PREFIX = "c s exact arb float";
  private static final Logger LOG = LoggerFactory.getLogger(SharpSatTdCounter.class);
  private static final Splitter VALUES =
      Splitter.on(CharMatcher.anyOf("; ")).omitEmptyStrings().trimResults();

  private final Path executable;
  private final Duration decompositionTimeout;

  public SharpSatTdCounter(Path executable, Duration decompositionTimeout) {
    this.executable = executable;
    this.decompositionTimeout = decompositionTimeout;
  }

  @Override
  public List<Double> count(String cnfText, ResourceGuard guard) {
    Path cnfFile = CompilerFiles.writeTemp(guard, NAME, ".cnf", cnfText);
    List<String> command = new ArrayList<>();
    command.add(executable.toString());
    command.add("-WE");
    command.addAll(SharpSatTdCompiler.baseCommand(decompositionTimeout));
    command.add(cnfFile.toString());
    Timing timing = Timing.start();
    try {
      ProcessResult result =
          ProcessRunner.run(guard, NAME, command, null, executable.getParent()).requireSuccess();
      LOG.info("Counting time: {} s", timing.elapsedSeconds());
      return parseCount(result.stdout());
    } finally {
      guard.delete(cnfFile);
    }
  }

  static List<Double> parseCount(String output) {
    for (String line : output.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.startsWith(RESULT_PREFIX)) {
        List<Double> values = new ArrayList<>();
        for (String value : VALUES.split(trimmed.substring(RESULT_PREFIX.length()))) {
          values.add(Numbers.parseDouble(value));
        }
        if (!values.isEmpty()) {
          return values;
        }
      }
    }
    throw new BackendFailureException(NAME, "printed no '" + RESULT_PREFIX + "' line", null);
  }
}
