package amc.eval;

import amc.backend.Assignment;
import amc.backend.MaxSatSolver;
import amc.backend.SatSolver;
import amc.cnf.WeightedCnf;
import amc.error.ConfigurationException;
import amc.error.NumericOverflowException;
import amc.process.ResourceGuard;
import amc.semiring.Semiring;
import amc.semiring.Semiring.MaxSatScale;
import amc.util.Timing;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers single-level instances over an idempotent semiring as weighted partial MaxSAT.
 *
 * <p>Literal weights are mapped onto an additive "larger is better" scale, irrelevant variables
 * are dropped, literals that can never be part of an optimum become hard units, and the remaining
 * weights are scaled to integers with {@code precisionDigits} significant digits for the smallest
 * one. The optimum assignment found by the backend is then weighed in the original semiring.
 */
public final class MaxSatReduction {
  private static final Logger LOG = LoggerFactory.getLogger(MaxSatReduction.class);

  static final BigInteger MAX_TOP = BigInteger.ONE.shiftLeft(63);

  private final int precisionDigits;

  public MaxSatReduction(int precisionDigits) {
    if (precisionDigits <= 0) {
      throw new IllegalArgumentException("precisionDigits must be positive");
    }
    this.precisionDigits = precisionDigits;
  }

  /** Hard clauses, forced units and integer soft units of one query. */
  record Encoding(
      int nrVars,
      List<List<Integer>> hardClauses,
      List<Integer> forcedLiterals,
      Map<Integer, BigInteger> softWeights,
      BigInteger top) {

    Encoding {
      hardClauses = List.copyOf(hardClauses);
      forcedLiterals = List.copyOf(forcedLiterals);
      softWeights = Collections.unmodifiableMap(new LinkedHashMap<>(softWeights));
    }

    boolean hasSoftWeights() {
      return !softWeights.isEmpty();
    }

    /** Hard clauses together with the forced units. */
    List<List<Integer>> satClauses() {
      List<List<Integer>> clauses = new ArrayList<>(hardClauses);
      for (int literal : forcedLiterals) {
        clauses.add(List.of(literal));
      }
      return clauses;
    }

    String toWcnf() {
      int count = hardClauses.size() + forcedLiterals.size() + softWeights.size();
      StringBuilder sb = new StringBuilder();
      sb.append("p wcnf ").append(nrVars).append(' ').append(count).append(' ').append(top);
      sb.append('\n');
      for (List<Integer> clause : hardClauses) {
        sb.append(top);
        for (int literal : clause) {
          sb.append(' ').append(literal);
        }
        sb.append(" 0\n");
      }
      for (int literal : forcedLiterals) {
        sb.append(top).append(' ').append(literal).append(" 0\n");
      }
      for (Map.Entry<Integer, BigInteger> entry : softWeights.entrySet()) {
        sb.append(entry.getValue()).append(' ').append(entry.getKey()).append(" 0\n");
      }
      return sb.toString();
    }
  }

  /**
   * Values of every query of {@code cnf}, one MaxSAT (or SAT) call each.
   *
   * @param solvedBySat true if no query had soft weights left, so only SAT calls were made
   */
  public record Outcome(List<Object> values, boolean solvedBySat) {}

  public Outcome evaluate(
      WeightedCnf cnf, MaxSatSolver maxSatSolver, SatSolver satSolver, ResourceGuard guard) {
    List<Object> values = new ArrayList<>(cnf.queryCount());
    boolean solvedBySat = true;
    for (int query = 0; query < cnf.queryCount(); query++) {
      guard.checkNotCancelled();
      Encoding encoding = encode(cnf, query);
      Optional<Assignment> optimum;
      Timing timing = Timing.start();
      if (encoding.hasSoftWeights()) {
        solvedBySat = false;
        optimum = maxSatSolver.solve(encoding.toWcnf(), cnf.nrVars(), guard);
        LOG.info("MaxSAT solving for query {} took {}s", query, timing.elapsedSeconds());
      } else {
        LOG.info("No soft weights left for query {}, asking for any model", query);
        optimum = satSolver.solve(cnf.nrVars(), encoding.satClauses(), guard);
      }
      int index = query;
      values.add(
          optimum.map(model -> weigh(cnf, model, index)).orElse(cnf.outerSemiring().zero()));
    }
    return new Outcome(Collections.unmodifiableList(values), solvedBySat);
  }

  Encoding encode(WeightedCnf cnf, int query) {
    Semiring<Object> semiring = cnf.outerSemiring();
    MaxSatScale scale = semiring.maxSatScale();
    if (scale == MaxSatScale.UNSUPPORTED) {
      throw new ConfigurationException(
          "Semiring " + semiring.name() + " cannot be reduced to MaxSAT");
    }
    List<Integer> forced = new ArrayList<>();
    Map<Integer, Double> soft = new LinkedHashMap<>();
    for (int v = 1; v <= cnf.nrVars(); v++) {
      double positive = toScale(semiring, scale, cnf.weight(v).get(query));
      double negative = toScale(semiring, scale, cnf.weight(-v).get(query));
      if (positive == negative) {
        continue;
      }
      if (positive == Double.NEGATIVE_INFINITY) {
        forced.add(-v);
      } else if (negative == Double.NEGATIVE_INFINITY) {
        forced.add(v);
      } else if (positive > negative) {
        soft.put(v, positive - negative);
      } else {
        soft.put(-v, negative - positive);
      }
    }
    Map<Integer, BigInteger> scaled = quantize(soft);
    BigInteger sum = BigInteger.ZERO;
    for (BigInteger weight : scaled.values()) {
      sum = sum.add(weight);
    }
    BigInteger top = sum.add(BigInteger.TWO);
    if (top.compareTo(MAX_TOP) >= 0) {
      throw new NumericOverflowException(
          "Cannot reduce this instance to MaxSAT: top weight " + top + " exceeds 2^63 - 1");
    }
    LOG.debug(
        "MaxSAT encoding: {} soft units, {} forced units, top weight {}",
        scaled.size(),
        forced.size(),
        top);
    return new Encoding(cnf.nrVars(), cnf.clauses(), forced, scaled, top);
  }

  /** Floors every weight to {@code precisionDigits} significant digits of the smallest one. */
  Map<Integer, BigInteger> quantize(Map<Integer, Double> weights) {
    int maxExponent = 0;
    for (double weight : weights.values()) {
      if (Double.isInfinite(weight) || Double.isNaN(weight)) {
        throw new NumericOverflowException("Cannot scale MaxSAT weight " + weight + " to an integer");
      }
      maxExponent = Math.max(maxExponent, (int) Math.ceil(-Math.log10(weight)));
    }
    int scaleExponent = precisionDigits + maxExponent;
    Map<Integer, BigInteger> scaled = new LinkedHashMap<>();
    BigInteger gcd = BigInteger.ZERO;
    for (Map.Entry<Integer, Double> entry : weights.entrySet()) {
      BigInteger value =
          new BigDecimal(entry.getValue())
              .movePointRight(scaleExponent)
              .setScale(0, RoundingMode.FLOOR)
              .toBigIntegerExact();
      if (value.signum() > 0) {
        scaled.put(entry.getKey(), value);
        gcd = gcd.gcd(value);
      }
    }
    if (scaled.size() < weights.size()) {
      LOG.debug("Dropped {} weights below 1e-{}", weights.size() - scaled.size(), scaleExponent);
    }
    for (Map.Entry<Integer, BigInteger> entry : scaled.entrySet()) {
      entry.setValue(entry.getValue().divide(gcd));
    }
    return scaled;
  }

  private static double toScale(Semiring<Object> semiring, MaxSatScale scale, Object value) {
    double number = semiring.components(value)[0];
    return switch (scale) {
      case IDENTITY -> number;
      case LOGARITHM -> number > 0 ? Math.log(number) : Double.NEGATIVE_INFINITY;
      case NEGATION -> -number;
      case UNSUPPORTED -> throw new IllegalStateException("unreachable");
    };
  }

  private static Object weigh(WeightedCnf cnf, Assignment model, int query) {
    Semiring<Object> semiring = cnf.outerSemiring();
    Object value = semiring.one();
    for (int literal : model.literals()) {
      value = semiring.multiply(value, cnf.weight(literal).get(query));
    }
    return value;
  }
}
