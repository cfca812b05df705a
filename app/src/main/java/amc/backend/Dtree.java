package amc.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary decomposition tree over clause indices, written in the c2d {@code .dtree} format: a
 * {@code dtree <nodes>} header, {@code L <clause>} leaves and {@code I <left> <right>} internal
 * nodes, numbered by line from 0, root last.
 */
public final class Dtree {
  private final List<int[]> nodes = new ArrayList<>();

  /** Adds a leaf for the clause at {@code clauseIndex} (0-based) and returns its id. */
  public int leaf(int clauseIndex) {
    nodes.add(new int[] {clauseIndex});
    return nodes.size() - 1;
  }

  public int join(int left, int right) {
    if (left >= nodes.size() || right >= nodes.size()) {
      throw new IllegalArgumentException("Unknown dtree node");
    }
    nodes.add(new int[] {left, right});
    return nodes.size() - 1;
  }

  public int size() {
    return nodes.size();
  }

  /** Number of leaves, i.e. clauses covered. */
  public int leafCount() {
    int leaves = 0;
    for (int[] node : nodes) {
      if (node.length == 1) {
        leaves++;
      }
    }
    return leaves;
  }

  /** Serializes with the most recently added node as root. */
  @Override
  public String toString() {
    StringBuilder out = new StringBuilder("dtree ").append(nodes.size()).append('\n');
    for (int[] node : nodes) {
      if (node.length == 1) {
        out.append("L ").append(node[0]).append('\n');
      } else {
        out.append("I ").append(node[0]).append(' ').append(node[1]).append('\n');
      }
    }
    return out.toString();
  }
}
