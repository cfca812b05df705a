package amc.testing;

import amc.backend.KnowledgeCompiler;
import amc.backend.NnfCircuit;
import amc.backend.NnfFormat;
import amc.backend.NnfParser;
import amc.cnf.WeightedCnf;
import amc.process.ResourceGuard;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles by Shannon expansion over all variables, writing the decision tree in the c2d NNF
 * format and reading it back. Constrained compilation decides level-0 variables first.
 * Exponential; only for small test instances.
 */
public final class ShannonCompiler implements KnowledgeCompiler {
  private final boolean constrained;
  private final boolean live;
  private final List<String> written = new ArrayList<>();

  public ShannonCompiler() {
    this(true, false);
  }

  public ShannonCompiler(boolean constrained, boolean live) {
    this.constrained = constrained;
    this.live = live;
  }

  @Override
  public String name() {
    return "shannon";
  }

  @Override
  public boolean supportsConstrained() {
    return constrained;
  }

  @Override
  public boolean supportsLiveCounting() {
    return live;
  }

  @Override
  public NnfCircuit compile(WeightedCnf cnf, ResourceGuard guard) {
    List<Integer> order = new ArrayList<>();
    for (int v = 1; v <= cnf.nrVars(); v++) {
      order.add(v);
    }
    return expand(cnf, order);
  }

  @Override
  public NnfCircuit compileConstrained(WeightedCnf cnf, ResourceGuard guard) {
    if (!constrained) {
      return KnowledgeCompiler.super.compileConstrained(cnf, guard);
    }
    List<Integer> order = new ArrayList<>(cnf.quantified().get(0));
    for (int v = 1; v <= cnf.nrVars(); v++) {
      if (!order.contains(v)) {
        order.add(v);
      }
    }
    return expand(cnf, order);
  }

  /** The NNF texts produced so far. */
  public List<String> written() {
    return written;
  }

  private NnfCircuit expand(WeightedCnf cnf, List<Integer> order) {
    List<String> lines = new ArrayList<>();
    int root = node(cnf.clauses(), order, 0, new int[cnf.nrVars() + 1], lines);
    if (root != lines.size() - 1) {
      throw new IllegalStateException("root must be the last node");
    }
    StringBuilder text = new StringBuilder();
    text.append("nnf ").append(lines.size()).append(" 0 ").append(cnf.nrVars()).append('\n');
    lines.forEach(line -> text.append(line).append('\n'));
    written.add(text.toString());
    return NnfParser.parse(new StringReader(text.toString()), NnfFormat.C2D);
  }

  /** Values: 0 unassigned, 1 true, -1 false. Returns the id of the emitted node. */
  private static int node(
      List<List<Integer>> clauses,
      List<Integer> order,
      int depth,
      int[] values,
      List<String> lines) {
    if (falsified(clauses, values)) {
      lines.add("O 0 0");
      return lines.size() - 1;
    }
    if (depth == order.size()) {
      lines.add("A 0");
      return lines.size() - 1;
    }
    int variable = order.get(depth);
    int[] branches = new int[2];
    for (int i = 0; i < 2; i++) {
      int literal = i == 0 ? variable : -variable;
      values[variable] = i == 0 ? 1 : -1;
      int below = node(clauses, order, depth + 1, values, lines);
      lines.add("L " + literal);
      int leaf = lines.size() - 1;
      lines.add("A 2 " + leaf + " " + below);
      branches[i] = lines.size() - 1;
    }
    values[variable] = 0;
    lines.add("O " + variable + " 2 " + branches[0] + " " + branches[1]);
    return lines.size() - 1;
  }

  private static boolean falsified(List<List<Integer>> clauses, int[] values) {
    for (List<Integer> clause : clauses) {
      boolean open = false;
      for (int literal : clause) {
        int value = values[Math.abs(literal)];
        if (value == 0 || (value > 0) == (literal > 0)) {
          open = true;
          break;
        }
      }
      if (!open) {
        return true;
      }
    }
    return false;
  }
}
