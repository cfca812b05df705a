package amc.cnf;

import amc.semiring.Semiring;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Writes the extended DIMACS format read by {@link WeightedCnfParser}. */
final class WeightedCnfWriter {
  private WeightedCnfWriter() {}

  static String write(WeightedCnf cnf, boolean extras) {
    StringBuilder out = new StringBuilder();
    out.append("p cnf ").append(cnf.nrVars()).append(' ').append(cnf.clauses().size()).append('\n');
    for (List<Integer> clause : cnf.clauses()) {
      appendClause(out, clause);
    }
    if (!extras) {
      return out.toString();
    }
    for (Map.Entry<Integer, List<Object>> entry : cnf.weights().entrySet()) {
      int literal = entry.getKey();
      Semiring<Object> semiring = cnf.semiringOf(Math.abs(literal));
      out.append("c p weight ").append(literal).append(' ');
      List<Object> values = entry.getValue();
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) {
          out.append(';');
        }
        out.append(semiring.format(values.get(i)));
      }
      out.append(" 0\n");
    }
    if (!cnf.semirings().isEmpty()) {
      out.append("c p semirings");
      for (Semiring<?> semiring : cnf.semirings()) {
        out.append(' ').append(semiring.name());
      }
      out.append(" 0\n");
    }
    cnf.transform().ifPresent(t -> out.append("c p transform ").append(t.source()).append(" 0\n"));
    for (Set<Integer> level : cnf.quantified()) {
      out.append("c p quantify");
      for (int variable : level) {
        out.append(' ').append(variable);
      }
      out.append(" 0\n");
    }
    return out.toString();
  }

  static void appendClause(StringBuilder out, List<Integer> clause) {
    for (int literal : clause) {
      out.append(literal).append(' ');
    }
    out.append("0\n");
  }
}
