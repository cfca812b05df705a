package amc.cnf;

import amc.semiring.Semiring;
import java.util.List;

/**
 * Flat weight table of a weighted CNF. {@code weights().get(2 * (v - 1))} is the weight vector of
 * {@code v}, {@code weights().get(2 * (v - 1) + 1)} that of {@code -v}. {@code zero} and {@code
 * one} belong to the outer semiring.
 */
public record WeightsView(
    List<List<Object>> weights, Object zero, Object one, Semiring<Object> semiring) {

  public WeightsView {
    weights = List.copyOf(weights);
  }

  public static int index(int literal) {
    int base = 2 * (Math.abs(literal) - 1);
    return literal > 0 ? base : base + 1;
  }

  public List<Object> of(int literal) {
    return weights.get(index(literal));
  }
}
