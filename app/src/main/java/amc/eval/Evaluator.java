package amc.eval;

import amc.backend.NnfCircuit;
import amc.backend.Preprocessor;
import amc.cnf.WeightedCnf;
import amc.error.AmcException;
import amc.error.BackendFailureException;
import amc.error.ConfigurationException;
import amc.process.ResourceGuard;
import amc.semiring.Semiring;
import amc.semiring.SemiringRegistry;
import amc.util.Timing;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses how to answer a weighted CNF and runs the chosen path.
 *
 * <p>After optional preprocessing and the trivial shortcuts, single idempotent semirings go to
 * MaxSAT, the probabilistic semiring goes to the exact counter when the configured compiler counts
 * live, and everything else is compiled: one circuit for a single level, an X/D-constrained one
 * for two levels.
 */
public final class Evaluator {
  private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

  private final Backends backends;
  private final EvaluationOptions options;

  public Evaluator(Backends backends, EvaluationOptions options) {
    this.backends = backends;
    this.options = EvaluationOptions.normalize(options);
  }

  public EvaluationOptions options() {
    return options;
  }

  /** Evaluates {@code cnf} under a fresh resource guard that is closed afterwards. */
  public EvaluationResult evaluate(WeightedCnf cnf) {
    try (ResourceGuard guard = ResourceGuard.open()) {
      return evaluate(cnf, guard);
    }
  }

  /**
   * Evaluates {@code cnf}. The clauses of {@code cnf} may be simplified in place (trivial clauses,
   * preprocessing).
   */
  public EvaluationResult evaluate(WeightedCnf cnf, ResourceGuard guard) {
    Timing total = Timing.start();
    if (cnf.semirings().size() > 2) {
      throw new ConfigurationException(
          "At most two semirings are supported, got " + cnf.semirings().size());
    }
    Semiring<Object> semiring = cnf.outerSemiring();
    LOG.info(
        "Evaluating {} variables, {} clauses, {} level(s) over {}",
        cnf.nrVars(),
        cnf.clauses().size(),
        Math.max(1, cnf.semirings().size()),
        semiring.name());

    if (options.preprocessing()) {
      preprocess(cnf, guard);
    }

    Optional<List<Object>> trivial = cnf.evaluateTrivial(backends.satSolver(), guard);
    if (trivial.isPresent()) {
      return result(trivial.get(), semiring, Method.TRIVIAL, total);
    }
    guard.checkNotCancelled();

    if (options.strategy() == Strategy.FLEXIBLE && cnf.semirings().size() == 1) {
      if (semiring.isIdempotent()) {
        LOG.info("Using MaxSAT for the idempotent semiring {}", semiring.name());
        MaxSatReduction.Outcome outcome =
            new MaxSatReduction(options.maxSatPrecisionDigits())
                .evaluate(cnf, backends.maxSatSolver(), backends.satSolver(), guard);
        return result(
            outcome.values(), semiring, outcome.solvedBySat() ? Method.SAT : Method.MAXSAT, total);
      }
      if (SemiringRegistry.isProbabilistic(semiring) && backends.compiler().supportsLiveCounting()) {
        LOG.info("Using direct weighted model counting");
        List<Double> counts = backends.exactCounter().count(counterInput(cnf), guard);
        if (counts.size() != cnf.queryCount()) {
          throw new BackendFailureException(
              "counter",
              "returned " + counts.size() + " values for " + cnf.queryCount() + " queries",
              null);
        }
        return result(new ArrayList<>(counts), semiring, Method.EXACT_COUNTING, total);
      }
    }

    if (cnf.isTwoLevel()) {
      return compileConstrained(cnf, guard, total);
    }
    return compile(cnf, guard, total);
  }

  private EvaluationResult compile(WeightedCnf cnf, ResourceGuard guard, Timing total) {
    LOG.info("Compiling with {}", backends.compiler().name());
    Timing timing = Timing.start();
    NnfCircuit circuit = backends.compiler().compile(cnf, guard);
    LOG.info("Compilation took {}s, circuit has {} nodes", timing.elapsedSeconds(), circuit.size());
    guard.checkNotCancelled();
    timing = Timing.start();
    List<Object> values = backends.circuitEvaluator().evaluate(circuit, cnf);
    LOG.info("Circuit evaluation took {}s", timing.elapsedSeconds());
    return result(values, cnf.outerSemiring(), Method.COMPILATION, total);
  }

  private EvaluationResult compileConstrained(WeightedCnf cnf, ResourceGuard guard, Timing total) {
    if (!backends.compiler().supportsConstrained()) {
      throw new ConfigurationException(
          "Two-level instances need X/D-constrained compilation, which "
              + backends.compiler().name()
              + " does not support; use c2d");
    }
    LOG.info("Compiling X/D-constrained with {}", backends.compiler().name());
    Timing timing = Timing.start();
    NnfCircuit circuit = backends.compiler().compileConstrained(cnf, guard);
    LOG.info("Compilation took {}s, circuit has {} nodes", timing.elapsedSeconds(), circuit.size());
    guard.checkNotCancelled();
    timing = Timing.start();
    List<Object> values = backends.constrainedEvaluator().evaluate(circuit, cnf);
    LOG.info("Circuit evaluation took {}s", timing.elapsedSeconds());
    return result(values, cnf.outerSemiring(), Method.CONSTRAINED_COMPILATION, total);
  }

  private void preprocess(WeightedCnf cnf, ResourceGuard guard) {
    Preprocessor.Mode mode =
        cnf.semirings().size() == 1 && cnf.outerSemiring().isIdempotent()
            ? Preprocessor.Mode.IDEMPOTENT
            : Preprocessor.Mode.GENERAL;
    Timing timing = Timing.start();
    Preprocessor.Result reduced =
        backends.preprocessor().preprocess(cnf.serialize(true), mode, guard);
    int before = cnf.clauses().size();
    cnf.replaceClauses(reduced.nrVars(), reduced.clauses());
    LOG.info(
        "Preprocessing ({}) took {}s: {} -> {} clauses",
        mode.flag(),
        timing.elapsedSeconds(),
        before,
        cnf.clauses().size());
    if (options.preprocessedOutput() != null) {
      try {
        Files.writeString(
            options.preprocessedOutput(), cnf.serialize(true), StandardCharsets.UTF_8);
        LOG.info("Wrote preprocessed CNF to {}", options.preprocessedOutput());
      } catch (IOException ex) {
        throw new AmcException(
            "Could not write preprocessed CNF to " + options.preprocessedOutput(), ex);
      }
    }
  }

  /** Plain clauses followed by the weight of every literal, the exact counter's input format. */
  static String counterInput(WeightedCnf cnf) {
    Semiring<Object> semiring = cnf.outerSemiring();
    StringBuilder sb = new StringBuilder(cnf.serialize(false));
    for (int v = 1; v <= cnf.nrVars(); v++) {
      appendWeight(sb, semiring, v, cnf.weight(v));
      appendWeight(sb, semiring, -v, cnf.weight(-v));
    }
    return sb.toString();
  }

  private static void appendWeight(
      StringBuilder sb, Semiring<Object> semiring, int literal, List<Object> values) {
    sb.append("c p weight ").append(literal).append(' ');
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(';');
      }
      sb.append(semiring.format(values.get(i)));
    }
    sb.append(" 0\n");
  }

  private static EvaluationResult result(
      List<Object> values, Semiring<Object> semiring, Method method, Timing total) {
    LOG.info("Evaluation by {} took {}s", method, total.elapsedSeconds());
    return new EvaluationResult(values, semiring, method, total.elapsedMillis());
  }
}
