package amc.backend;

import amc.cnf.WeightedCnf;
import java.util.List;

/** Computes the algebraic model count of a compiled circuit under the weights of a CNF. */
public interface CircuitEvaluator {

  /** One value per query, in the outer semiring of {@code cnf}. */
  List<Object> evaluate(NnfCircuit circuit, WeightedCnf cnf);
}
