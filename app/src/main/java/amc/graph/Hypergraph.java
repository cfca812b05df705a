package amc.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Hypergraph over integer vertices; every hyperedge is a set of vertices. */
public final class Hypergraph {
  private final Set<Integer> vertices = new TreeSet<>();
  private final List<Set<Integer>> edges = new ArrayList<>();

  public void addVertex(int vertex) {
    vertices.add(vertex);
  }

  public void addEdge(Collection<Integer> edge) {
    Set<Integer> copy = new LinkedHashSet<>(edge);
    vertices.addAll(copy);
    edges.add(Collections.unmodifiableSet(copy));
  }

  public Set<Integer> vertices() {
    return Collections.unmodifiableSet(vertices);
  }

  public List<Set<Integer>> edges() {
    return Collections.unmodifiableList(edges);
  }

  /** Clique expansion: every hyperedge becomes a clique over its vertices. */
  public Graph toGraph() {
    Graph graph = new Graph();
    for (int vertex : vertices) {
      graph.addVertex(vertex);
    }
    for (Set<Integer> edge : edges) {
      List<Integer> members = new ArrayList<>(edge);
      for (int i = 0; i < members.size(); i++) {
        for (int j = i + 1; j < members.size(); j++) {
          graph.addEdge(members.get(i), members.get(j));
        }
      }
    }
    return graph;
  }
}
