package amc.cnf;

import amc.backend.SatSolver;
import amc.process.ResourceGuard;
import amc.semiring.Semiring;
import amc.semiring.Semirings;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Shortcuts for instances without clauses and for unsatisfiable instances. */
final class TrivialEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(TrivialEvaluator.class);

  private TrivialEvaluator() {}

  static Optional<List<Object>> evaluate(WeightedCnf cnf, SatSolver solver, ResourceGuard guard) {
    cnf.removeTrivialClauses();
    if (cnf.clauses().isEmpty()) {
      LOG.info("No clauses left, the result is a product of literal sums");
      return Optional.of(freeProduct(cnf));
    }
    if (!solver.isSatisfiable(cnf.nrVars(), cnf.clauses(), guard)) {
      LOG.info("The instance is unsatisfiable");
      return Optional.of(Semirings.filled(cnf.outerSemiring().zero(), cnf.queryCount()));
    }
    return Optional.empty();
  }

  /**
   * Weighted count of the empty clause set: the product of {@code w(v) + w(-v)} over all
   * variables, level by level.
   */
  static List<Object> freeProduct(WeightedCnf cnf) {
    if (!cnf.isTwoLevel()) {
      return levelProduct(cnf, cnf.outerSemiring(), -1);
    }
    List<Object> inner = levelProduct(cnf, cnf.semiringOfLevel(1), 1);
    List<Object> result = cnf.foldToOuter(inner);
    return Semirings.multiply(cnf.outerSemiring(), result, levelProduct(cnf, cnf.outerSemiring(), 0));
  }

  private static List<Object> levelProduct(WeightedCnf cnf, Semiring<Object> semiring, int level) {
    List<Object> result = Semirings.filled(semiring.one(), cnf.queryCount());
    for (int v = 1; v <= cnf.nrVars(); v++) {
      if (level >= 0 && cnf.levelOf(v) != level) {
        continue;
      }
      List<Object> sum = Semirings.add(semiring, cnf.weight(v), cnf.weight(-v));
      result = Semirings.multiply(semiring, result, sum);
    }
    return result;
  }
}
