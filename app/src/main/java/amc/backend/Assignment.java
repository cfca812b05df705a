package amc.backend;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/** Total truth assignment to variables {@code 1..nrVars} returned by a SAT or MaxSAT backend. */
public final class Assignment {
  private final int nrVars;
  private final BitSet trueVariables;

  public Assignment(int nrVars, BitSet trueVariables) {
    this.nrVars = nrVars;
    this.trueVariables = (BitSet) trueVariables.clone();
  }

  /** Builds an assignment from DIMACS literals; variables not mentioned are false. */
  public static Assignment fromLiterals(int nrVars, Iterable<Integer> literals) {
    BitSet bits = new BitSet(nrVars + 1);
    for (int literal : literals) {
      if (literal > 0 && literal <= nrVars) {
        bits.set(literal);
      }
    }
    return new Assignment(nrVars, bits);
  }

  public int nrVars() {
    return nrVars;
  }

  public boolean isTrue(int variable) {
    return trueVariables.get(variable);
  }

  /** The assignment as one literal per variable, in variable order. */
  public List<Integer> literals() {
    List<Integer> literals = new ArrayList<>(nrVars);
    for (int v = 1; v <= nrVars; v++) {
      literals.add(isTrue(v) ? v : -v);
    }
    return literals;
  }

  public boolean satisfies(List<? extends List<Integer>> clauses) {
    for (List<Integer> clause : clauses) {
      boolean satisfied = false;
      for (int literal : clause) {
        if (isTrue(Math.abs(literal)) == (literal > 0)) {
          satisfied = true;
          break;
        }
      }
      if (!satisfied) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return literals().toString();
  }
}
