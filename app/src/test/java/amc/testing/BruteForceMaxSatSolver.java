package amc.testing;

import amc.backend.Assignment;
import amc.backend.MaxSatSolver;
import amc.process.ResourceGuard;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a WCNF and returns an assignment that satisfies every clause of weight {@code top} and
 * maximizes the satisfied soft weight.
 */
public final class BruteForceMaxSatSolver implements MaxSatSolver {
  private final List<String> inputs = new ArrayList<>();

  @Override
  public Optional<Assignment> solve(String wcnf, int nrVars, ResourceGuard guard) {
    inputs.add(wcnf);
    BigInteger top = null;
    List<List<Integer>> hard = new ArrayList<>();
    List<List<Integer>> soft = new ArrayList<>();
    List<BigInteger> softWeights = new ArrayList<>();
    for (String line : wcnf.split("\n")) {
      String[] tokens = line.trim().split("\\s+");
      if (tokens.length == 0 || tokens[0].isEmpty() || tokens[0].equals("c")) {
        continue;
      }
      if (tokens[0].equals("p")) {
        top = new BigInteger(tokens[4]);
        continue;
      }
      BigInteger weight = new BigInteger(tokens[0]);
      List<Integer> clause = new ArrayList<>();
      for (int i = 1; i < tokens.length - 1; i++) {
        clause.add(Integer.parseInt(tokens[i]));
      }
      if (weight.equals(top)) {
        hard.add(clause);
      } else {
        soft.add(clause);
        softWeights.add(weight);
      }
    }
    Assignment best = null;
    BigInteger bestWeight = BigInteger.valueOf(-1);
    for (Assignment assignment : BruteForceSatSolver.assignments(nrVars)) {
      if (!assignment.satisfies(hard)) {
        continue;
      }
      BigInteger weight = BigInteger.ZERO;
      for (int i = 0; i < soft.size(); i++) {
        if (assignment.satisfies(List.of(soft.get(i)))) {
          weight = weight.add(softWeights.get(i));
        }
      }
      if (weight.compareTo(bestWeight) > 0) {
        best = assignment;
        bestWeight = weight;
      }
    }
    return Optional.ofNullable(best);
  }

  /** Every WCNF this solver was given, in call order. */
  public List<String> inputs() {
    return inputs;
  }
}
