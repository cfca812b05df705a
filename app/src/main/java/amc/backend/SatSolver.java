package amc.backend;

import amc.process.ResourceGuard;
import java.util.List;
import java.util.Optional;

/** Decides satisfiability of a plain CNF. */
public interface SatSolver {

  /**
   * Returns a satisfying assignment, or empty if the clauses are unsatisfiable.
   *
   * @param nrVars number of variables; clauses only use variables {@code 1..nrVars}
   */
  Optional<Assignment> solve(int nrVars, List<List<Integer>> clauses, ResourceGuard guard);

  default boolean isSatisfiable(int nrVars, List<List<Integer>> clauses, ResourceGuard guard) {
    return solve(nrVars, clauses, guard).isPresent();
  }
}
