package amc.backend;

import amc.error.BackendFailureException;
import amc.process.ProcessResult;
import amc.process.ProcessRunner;
import amc.process.ResourceGuard;
import amc.util.Timing;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The sharpSAT-based exact preprocessor ({@code -m <mode> -t FPVEGV}). */
public final class SharpSatPreprocessor implements Preprocessor {
  private static final String NAME = "preprocessor";
  private static final Logger LOG = LoggerFactory.getLogger(SharpSatPreprocessor.class);
  private static final Splitter TOKENS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final Path executable;

  public SharpSatPreprocessor(Path executable) {
    this.executable = executable;
  }

  @Override
  public Result preprocess(String cnfText, Mode mode, ResourceGuard guard) {
    Path cnfFile = CompilerFiles.writeTemp(guard, NAME, ".cnf", cnfText);
    Timing timing = Timing.start();
    try {
      ProcessResult result =
          ProcessRunner.run(
                  guard,
                  NAME,
                  List.of(
                      executable.toString(), "-m", mode.flag(), "-t", "FPVEGV", cnfFile.toString()))
              .requireSuccess();
      LOG.info("Preprocessing time: {} s", timing.elapsedSeconds());
      return parseOutput(result.stdout());
    } finally {
      guard.delete(cnfFile);
    }
  }

  /** Reads the {@code p cnf} header and the clauses after it; comment lines are skipped. */
  static Result parseOutput(String output) {
    int nrVars = -1;
    List<List<Integer>> clauses = new ArrayList<>();
    for (String line : output.split("\n")) {
      List<String> tokens = TOKENS.splitToList(line);
      if (tokens.isEmpty() || tokens.get(0).equals("c")) {
        continue;
      }
      if (tokens.get(0).equals("p")) {
        if (tokens.size() < 3 || !tokens.get(1).equals("cnf")) {
          throw new BackendFailureException(NAME, "malformed header '" + line + "'", null);
        }
        nrVars = parseNumber(tokens.get(2), line);
        continue;
      }
      if (nrVars < 0) {
        continue;
      }
      List<Integer> clause = new ArrayList<>(tokens.size());
      for (String token : tokens) {
        int literal = parseNumber(token, line);
        if (literal != 0) {
          clause.add(literal);
        }
      }
      clauses.add(clause);
    }
    if (nrVars < 0) {
      throw new BackendFailureException(NAME, "printed no 'p cnf' line", null);
    }
    return new Result(nrVars, clauses);
  }

  private static int parseNumber(String token, String line) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException ex) {
      throw new BackendFailureException(NAME, "malformed output line '" + line + "'", ex);
    }
  }
}
