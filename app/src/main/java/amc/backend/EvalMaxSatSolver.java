package amc.backend;

import amc.error.SolvingException;
import amc.process.ProcessResult;
import amc.process.ProcessRunner;
import amc.process.ResourceGuard;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * EvalMaxSAT on a WCNF file. Reads the {@code s} status line and the {@code v} model line, which
 * is either a bit string (one character per variable) or a list of literals. Exit codes 10, 20 and
 * 30 are the solver's answer codes, not failures.
 */
public final class EvalMaxSatSolver implements MaxSatSolver {
  private static final String NAME = "evalmaxsat";
  private static final Set<Integer> ANSWER_CODES = Set.of(10, 20, 30);
  private static final Splitter TOKENS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final Path executable;

  public EvalMaxSatSolver(Path executable) {
    this.executable = executable;
  }

  @Override
  public Optional<Assignment> solve(String wcnf, int nrVars, ResourceGuard guard) {
    Path wcnfFile = CompilerFiles.writeTemp(guard, NAME, ".wcnf", wcnf);
    try {
      ProcessResult result =
          ProcessRunner.run(guard, NAME, List.of(executable.toString(), wcnfFile.toString()))
              .requireExitCode(ANSWER_CODES);
      return parseOutput(nrVars, result.stdout());
    } finally {
      guard.delete(wcnfFile);
    }
  }

  static Optional<Assignment> parseOutput(int nrVars, String output) {
    String status = null;
    Assignment model = null;
    for (String line : output.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.startsWith("s ")) {
        status = trimmed.substring(2).trim();
      } else if (trimmed.startsWith("v ")) {
        model = parseModel(nrVars, trimmed.substring(2).trim());
      }
    }
    if (status == null) {
      throw new SolvingException("MaxSAT solver did not print a status line");
    }
    switch (status) {
      case "OPTIMUM FOUND" -> {
        if (model == null) {
          throw new SolvingException("MaxSAT solver reported an optimum but printed no model");
        }
        return Optional.of(model);
      }
      case "UNSATISFIABLE" -> {
        return Optional.empty();
      }
      case "UNKNOWN" -> throw new SolvingException("MaxSAT solver returned UNKNOWN");
      case "SATISFIABLE" -> throw new SolvingException(
          "MaxSAT solver returned SATISFIABLE. Probably it was interrupted during execution");
      default -> throw new SolvingException(
          "MaxSAT solver printed unknown status '" + status + "'");
    }
  }

  static Assignment parseModel(int nrVars, String model) {
    if (!model.isEmpty() && CharMatcher.anyOf("01").matchesAllOf(model)) {
      BitSet bits = new BitSet(nrVars + 1);
      for (int i = 0; i < model.length() && i < nrVars; i++) {
        if (model.charAt(i) == '1') {
          bits.set(i + 1);
        }
      }
      return new Assignment(nrVars, bits);
    }
    List<Integer> literals = new ArrayList<>();
    for (String token : TOKENS.split(model)) {
      literals.add(Integer.parseInt(token));
    }
    return Assignment.fromLiterals(nrVars, literals);
  }
}
