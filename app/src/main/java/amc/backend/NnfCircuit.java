package amc.backend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Decomposable negation normal form circuit as a DAG of nodes addressed by dense ids. Every node
 * knows the set of variables below it, which evaluators use to smooth OR nodes on the fly.
 */
public final class NnfCircuit {

  public enum Kind {
    LITERAL,
    AND,
    OR,
    TRUE,
    FALSE
  }

  private final List<Kind> kinds;
  private final int[] literals;
  private final List<int[]> children;
  private final int root;
  private final BitSet[] variables;

  private NnfCircuit(List<Kind> kinds, int[] literals, List<int[]> children, int root) {
    this.kinds = kinds;
    this.literals = literals;
    this.children = children;
    this.root = root;
    this.variables = new BitSet[kinds.size()];
    for (int node : postOrder()) {
      BitSet below = new BitSet();
      if (kinds.get(node) == Kind.LITERAL) {
        below.set(Math.abs(literals[node]));
      }
      for (int child : children.get(node)) {
        below.or(variables[child]);
      }
      variables[node] = below;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return kinds.size();
  }

  public int root() {
    return root;
  }

  public Kind kind(int node) {
    return kinds.get(node);
  }

  public int literal(int node) {
    return literals[node];
  }

  public int[] children(int node) {
    return children.get(node);
  }

  /** Variables occurring below {@code node}; do not modify. */
  public BitSet variables(int node) {
    return variables[node];
  }

  /** Nodes reachable from the root, every node after all of its children. */
  public List<Integer> postOrder() {
    List<Integer> order = new ArrayList<>();
    boolean[] done = new boolean[kinds.size()];
    boolean[] entered = new boolean[kinds.size()];
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      int node = stack.peek();
      if (done[node]) {
        stack.pop();
        continue;
      }
      if (!entered[node]) {
        entered[node] = true;
        for (int child : children.get(node)) {
          if (!done[child]) {
            stack.push(child);
          }
        }
      } else {
        stack.pop();
        done[node] = true;
        order.add(node);
      }
    }
    return order;
  }

  /** Assembles a circuit node by node; children may be attached after a node is created. */
  public static final class Builder {
    private final List<Kind> kinds = new ArrayList<>();
    private final List<Integer> literals = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();

    private Builder() {}

    public int literal(int literal) {
      return add(Kind.LITERAL, literal);
    }

    public int and() {
      return add(Kind.AND, 0);
    }

    public int or() {
      return add(Kind.OR, 0);
    }

    public int constant(boolean value) {
      return add(value ? Kind.TRUE : Kind.FALSE, 0);
    }

    public int add(Kind kind, int literal) {
      kinds.add(kind);
      literals.add(literal);
      children.add(new ArrayList<>());
      return kinds.size() - 1;
    }

    public void addChild(int parent, int child) {
      if (child < 0 || child >= kinds.size()) {
        throw new IllegalArgumentException("Unknown child node " + child);
      }
      Kind kind = kinds.get(parent);
      if (kind != Kind.AND && kind != Kind.OR) {
        throw new IllegalArgumentException(kind + " node " + parent + " cannot have children");
      }
      children.get(parent).add(child);
    }

    public int size() {
      return kinds.size();
    }

    public NnfCircuit build(int root) {
      if (root < 0 || root >= kinds.size()) {
        throw new IllegalArgumentException("Unknown root node " + root);
      }
      int[] literalArray = new int[literals.size()];
      List<int[]> childArrays = new ArrayList<>(children.size());
      for (int i = 0; i < literals.size(); i++) {
        literalArray[i] = literals.get(i);
        childArrays.add(children.get(i).stream().mapToInt(Integer::intValue).toArray());
      }
      return new NnfCircuit(List.copyOf(kinds), literalArray, childArrays, root);
    }
  }
}
