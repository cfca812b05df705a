package amc.backend;

import amc.error.BackendFailureException;
import amc.process.ProcessRunner;
import amc.process.ResourceGuard;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * minisat on a DIMACS file. Exit codes 10 (SAT) and 20 (UNSAT) follow the SAT competition
 * convention. The result file holds {@code SAT} or {@code UNSAT} and, when satisfiable, the model
 * as a line of literals.
 */
public final class MinisatSolver implements SatSolver {
  private static final String NAME = "minisat";
  private static final Set<Integer> ANSWER_CODES = Set.of(10, 20);
  private static final Splitter TOKENS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final Path executable;

  public MinisatSolver(Path executable) {
    this.executable = executable;
  }

  @Override
  public Optional<Assignment> solve(int nrVars, List<List<Integer>> clauses, ResourceGuard guard) {
    Path cnfFile = CompilerFiles.writeTemp(guard, NAME, ".cnf", dimacs(nrVars, clauses));
    Path resultFile = guard.createTempFile("amc-", ".sat");
    try {
      ProcessRunner.run(
              guard, NAME, List.of(executable.toString(), cnfFile.toString(), resultFile.toString()))
          .requireExitCode(ANSWER_CODES);
      return parseResult(nrVars, CompilerFiles.read(NAME, resultFile));
    } finally {
      guard.delete(cnfFile);
      guard.delete(resultFile);
    }
  }

  static Optional<Assignment> parseResult(int nrVars, String content) {
    String[] lines = content.split("\n");
    String status = lines.length > 0 ? lines[0].trim() : "";
    if (status.equals("UNSAT")) {
      return Optional.empty();
    }
    if (!status.equals("SAT")) {
      throw new BackendFailureException(NAME, "unexpected result '" + status + "'", null);
    }
    List<Integer> literals = new ArrayList<>();
    if (lines.length > 1) {
      for (String token : TOKENS.split(lines[1])) {
        int literal = Integer.parseInt(token);
        if (literal != 0) {
          literals.add(literal);
        }
      }
    }
    return Optional.of(Assignment.fromLiterals(nrVars, literals));
  }

  static String dimacs(int nrVars, List<List<Integer>> clauses) {
    StringBuilder out = new StringBuilder();
    out.append("p cnf ").append(nrVars).append(' ').append(clauses.size()).append('\n');
    for (List<Integer> clause : clauses) {
      for (int literal : clause) {
        out.append(literal).append(' ');
      }
      out.append("0\n");
    }
    return out.toString();
  }
}
