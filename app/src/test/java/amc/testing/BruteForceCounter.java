package amc.testing;

import amc.backend.Assignment;
import amc.backend.ExactCounter;
import amc.process.ResourceGuard;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Weighted model counting over doubles by enumeration of all assignments. */
public final class BruteForceCounter implements ExactCounter {
  private final List<String> inputs = new ArrayList<>();

  @Override
  public List<Double> count(String cnfText, ResourceGuard guard) {
    inputs.add(cnfText);
    int nrVars = 0;
    List<List<Integer>> clauses = new ArrayList<>();
    Map<Integer, double[]> weights = new HashMap<>();
    int queries = 1;
    for (String line : cnfText.split("\n")) {
      String[] tokens = line.trim().split("\\s+");
      if (tokens[0].isEmpty()) {
        continue;
      }
      if (tokens[0].equals("p")) {
        nrVars = Integer.parseInt(tokens[2]);
      } else if (tokens[0].equals("c")) {
        if (tokens.length >= 5 && tokens[1].equals("p") && tokens[2].equals("weight")) {
          String[] values = tokens[4].split(";");
          double[] parsed = new double[values.length];
          for (int i = 0; i < values.length; i++) {
            parsed[i] = Double.parseDouble(values[i]);
          }
          queries = parsed.length;
          weights.put(Integer.parseInt(tokens[3]), parsed);
        }
      } else {
        List<Integer> clause = new ArrayList<>();
        for (int i = 0; i < tokens.length - 1; i++) {
          clause.add(Integer.parseInt(tokens[i]));
        }
        clauses.add(clause);
      }
    }
    double[] totals = new double[queries];
    for (Assignment assignment : BruteForceSatSolver.assignments(nrVars)) {
      if (!assignment.satisfies(clauses)) {
        continue;
      }
      for (int q = 0; q < queries; q++) {
        double product = 1.0;
        for (int literal : assignment.literals()) {
          double[] weight = weights.get(literal);
          product *= weight == null ? 1.0 : weight[q];
        }
        totals[q] += product;
      }
    }
    List<Double> result = new ArrayList<>();
    for (double total : totals) {
      result.add(total);
    }
    return result;
  }

  public List<String> inputs() {
    return inputs;
  }
}
