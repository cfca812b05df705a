package amc.backend;

import amc.process.ResourceGuard;
import java.util.List;

/** Equivalence-preserving CNF simplification before counting. */
public interface Preprocessor {

  /** Simplification strength, which depends on whether the semiring is idempotent. */
  enum Mode {
    IDEMPOTENT("idemp"),
    GENERAL("general");

    private final String flag;

    Mode(String flag) {
      this.flag = flag;
    }

    public String flag() {
      return flag;
    }
  }

  /** Reduced clause set with its variable count. */
  record Result(int nrVars, List<List<Integer>> clauses) {}

  /**
   * Simplifies the extended CNF in {@code cnfText}. Weighted variables are kept, so weights and
   * quantification stay meaningful for the result.
   */
  Result preprocess(String cnfText, Mode mode, ResourceGuard guard);
}
