package amc.eval;

/** The path that produced an evaluation result. */
public enum Method {
  /** No clauses left, or unsatisfiable. */
  TRIVIAL,
  MAXSAT,
  /** MaxSAT reduction without soft weights, answered by a SAT query. */
  SAT,
  EXACT_COUNTING,
  COMPILATION,
  CONSTRAINED_COMPILATION
}
