package amc.backend;

import amc.cnf.WeightedCnf;
import amc.error.FormatException;
import amc.semiring.Semiring;
import amc.semiring.Semirings;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bottom-up evaluation of a d-DNNF over a single semiring. OR children that miss variables of
 * their parent are multiplied with {@code w(v) + w(-v)} for each missing variable, and so is the
 * root for variables absent from the whole circuit, so the input need not be smooth.
 */
public final class SmoothingCircuitEvaluator implements CircuitEvaluator {

  @Override
  public List<Object> evaluate(NnfCircuit circuit, WeightedCnf cnf) {
    Semiring<Object> semiring = cnf.outerSemiring();
    int queries = cnf.queryCount();
    List<Object> zero = Semirings.filled(semiring.zero(), queries);
    List<Object> one = Semirings.filled(semiring.one(), queries);
    Map<Integer, List<Object>> freeSums = new HashMap<>();
    @SuppressWarnings("unchecked")
    List<Object>[] values = new List[circuit.size()];
    for (int node : circuit.postOrder()) {
      List<Object> value;
      switch (circuit.kind(node)) {
        case LITERAL -> value = cnf.weight(checkLiteral(circuit.literal(node), cnf));
        case TRUE -> value = one;
        case FALSE -> value = zero;
        case AND -> {
          value = one;
          for (int child : circuit.children(node)) {
            value = Semirings.multiply(semiring, value, values[child]);
          }
        }
        default -> {
          value = zero;
          BitSet scope = circuit.variables(node);
          for (int child : circuit.children(node)) {
            List<Object> smoothed =
                smooth(values[child], missing(scope, circuit.variables(child)), cnf, semiring, freeSums);
            value = Semirings.add(semiring, value, smoothed);
          }
        }
      }
      values[node] = value;
    }
    BitSet all = new BitSet();
    all.set(1, cnf.nrVars() + 1);
    return smooth(
        values[circuit.root()], missing(all, circuit.variables(circuit.root())), cnf, semiring, freeSums);
  }

  static BitSet missing(BitSet scope, BitSet present) {
    BitSet missing = (BitSet) scope.clone();
    missing.andNot(present);
    return missing;
  }

  static int checkLiteral(int literal, WeightedCnf cnf) {
    if (literal == 0 || Math.abs(literal) > cnf.nrVars()) {
      throw new FormatException("Circuit literal " + literal + " outside the CNF's variables");
    }
    return literal;
  }

  private static List<Object> smooth(
      List<Object> value,
      BitSet missing,
      WeightedCnf cnf,
      Semiring<Object> semiring,
      Map<Integer, List<Object>> freeSums) {
    List<Object> result = value;
    for (int v = missing.nextSetBit(0); v >= 0; v = missing.nextSetBit(v + 1)) {
      int variable = v;
      List<Object> sum =
          freeSums.computeIfAbsent(
              variable, k -> Semirings.add(semiring, cnf.weight(variable), cnf.weight(-variable)));
      result = Semirings.multiply(semiring, result, sum);
    }
    return result;
  }
}
