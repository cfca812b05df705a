package amc.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/** Simple undirected graph over integer vertices without self loops or parallel edges. */
public final class Graph {
  private final Map<Integer, Set<Integer>> adjacency = new TreeMap<>();
  private final List<Edge> edges = new ArrayList<>();

  public void addVertex(int vertex) {
    adjacency.computeIfAbsent(vertex, k -> new LinkedHashSet<>());
  }

  /** Adds the edge if it is new. Self loops only add the vertex. */
  public void addEdge(int u, int v) {
    addVertex(u);
    addVertex(v);
    if (u == v || adjacency.get(u).contains(v)) {
      return;
    }
    adjacency.get(u).add(v);
    adjacency.get(v).add(u);
    edges.add(new Edge(Math.min(u, v), Math.max(u, v)));
  }

  public boolean hasEdge(int u, int v) {
    return adjacency.getOrDefault(u, Set.of()).contains(v);
  }

  public Set<Integer> vertices() {
    return Collections.unmodifiableSet(adjacency.keySet());
  }

  public Set<Integer> neighbors(int vertex) {
    return Collections.unmodifiableSet(adjacency.getOrDefault(vertex, Set.of()));
  }

  public List<Edge> edges() {
    return Collections.unmodifiableList(edges);
  }

  public int vertexCount() {
    return adjacency.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  /** Undirected edge with {@code u < v}. */
  public record Edge(int u, int v) {}
}
