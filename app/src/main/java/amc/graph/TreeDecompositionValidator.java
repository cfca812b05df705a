package amc.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Checks the defining properties of a tree decomposition against the graph it covers. */
public final class TreeDecompositionValidator {
  private TreeDecompositionValidator() {}

  /** Returns a description of every violated property; empty when the decomposition is valid. */
  public static List<String> violations(TreeDecomposition decomposition, Graph graph) {
    List<String> violations = new ArrayList<>();
    Set<Integer> covered = new HashSet<>();
    int largest = 0;
    for (Bag bag : decomposition.bags()) {
      for (int vertex : bag.vertices()) {
        if (vertex < 1 || vertex > decomposition.vertexCount()) {
          violations.add(
              "Bag " + bag.id() + " holds vertex " + vertex + " outside 1.."
                  + decomposition.vertexCount());
        }
      }
      covered.addAll(bag.vertices());
      largest = Math.max(largest, bag.vertices().size());
    }
    for (int vertex = 1; vertex <= decomposition.vertexCount(); vertex++) {
      if (!covered.contains(vertex)) {
        violations.add("Vertex " + vertex + " is in no bag");
      }
    }
    for (Graph.Edge edge : graph.edges()) {
      if (decomposition.findContaining(List.of(edge.u(), edge.v())).isEmpty()) {
        violations.add("Edge " + edge.u() + "-" + edge.v() + " is in no bag");
      }
    }
    if (decomposition.bagCount() > 0 && decomposition.width() != largest - 1) {
      violations.add(
          "Declared width " + decomposition.width() + " but largest bag has " + largest
              + " vertices");
    }
    return violations;
  }

  public static boolean isValid(TreeDecomposition decomposition, Graph graph) {
    return violations(decomposition, graph).isEmpty();
  }
}
