package amc.testing;

import amc.backend.TreewidthSolver;
import amc.graph.Graph;
import amc.graph.TreeDecomposition;
import amc.process.AnytimeResult;
import amc.process.ResourceGuard;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/** Min-degree elimination; a deterministic in-process stand-in for the anytime heuristic. */
public final class GreedyTreewidthSolver implements TreewidthSolver {
  private int calls;

  @Override
  public AnytimeResult<TreeDecomposition> decompose(
      Graph graph, Duration timeout, ResourceGuard guard) {
    calls++;
    Map<Integer, Set<Integer>> adjacency = new TreeMap<>();
    for (int v : graph.vertices()) {
      adjacency.put(v, new TreeSet<>(graph.neighbors(v)));
    }
    List<Integer> eliminated = new ArrayList<>();
    Map<Integer, Set<Integer>> bagOf = new HashMap<>();
    while (!adjacency.isEmpty()) {
      int next = -1;
      for (Map.Entry<Integer, Set<Integer>> entry : adjacency.entrySet()) {
        if (next < 0 || entry.getValue().size() < adjacency.get(next).size()) {
          next = entry.getKey();
        }
      }
      Set<Integer> neighbors = adjacency.remove(next);
      Set<Integer> bag = new TreeSet<>(neighbors);
      bag.add(next);
      bagOf.put(next, bag);
      eliminated.add(next);
      for (int u : neighbors) {
        Set<Integer> adjacent = adjacency.get(u);
        adjacent.remove(next);
        for (int w : neighbors) {
          if (w != u) {
            adjacent.add(w);
          }
        }
      }
    }
    Map<Integer, Integer> position = new HashMap<>();
    for (int i = 0; i < eliminated.size(); i++) {
      position.put(eliminated.get(i), i);
    }
    Map<Integer, Set<Integer>> bags = new TreeMap<>();
    List<int[]> edges = new ArrayList<>();
    int width = 0;
    for (int i = 0; i < eliminated.size(); i++) {
      int v = eliminated.get(i);
      Set<Integer> bag = bagOf.get(v);
      bags.put(i + 1, bag);
      width = Math.max(width, bag.size() - 1);
      int parent = -1;
      for (int u : bag) {
        if (u != v && (parent < 0 || position.get(u) < parent)) {
          parent = position.get(u);
        }
      }
      if (parent < 0 && i + 1 < eliminated.size()) {
        // disconnected component, hang it below the last bag
        parent = eliminated.size() - 1;
      }
      if (parent >= 0) {
        edges.add(new int[] {i + 1, parent + 1});
      }
    }
    TreeDecomposition decomposition =
        TreeDecomposition.of(width, graph.vertexCount(), bags, edges);
    return new AnytimeResult<>(decomposition, true);
  }

  public int calls() {
    return calls;
  }
}
