package amc.backend;

import amc.process.ResourceGuard;
import java.util.Optional;

/** Solves weighted partial MaxSAT instances given in DIMACS WCNF. */
public interface MaxSatSolver {

  /**
   * Returns an optimal assignment, or empty if the hard clauses are unsatisfiable.
   *
   * @throws amc.error.SolvingException if the solver stops without proving optimality
   */
  Optional<Assignment> solve(String wcnf, int nrVars, ResourceGuard guard);
}
