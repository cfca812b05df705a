package amc.eval;

import amc.semiring.Semiring;
import amc.semiring.Semirings;
import java.util.List;

/**
 * Outcome of one evaluation.
 *
 * @param values one value per query, in the outer semiring
 * @param semiring the outer semiring
 */
public record EvaluationResult(
    List<Object> values, Semiring<Object> semiring, Method method, long elapsedMillis) {

  public EvaluationResult {
    values = List.copyOf(values);
  }

  public List<String> formatted() {
    return Semirings.format(semiring, values);
  }

  public int queryCount() {
    return values.size();
  }
}
