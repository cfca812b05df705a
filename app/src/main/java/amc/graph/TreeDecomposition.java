package amc.graph;

import amc.backend.TreewidthSolver;
import amc.process.AnytimeResult;
import amc.process.ResourceGuard;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree of vertex bags covering a graph. The tree itself is stored as an undirected adjacency
 * relation between bag ids; rooting it fills in the {@link Bag#children()} lists. All traversals
 * use explicit stacks, so deep decompositions do not exhaust the call stack.
 */
public final class TreeDecomposition {
  private static final Logger LOG = LoggerFactory.getLogger(TreeDecomposition.class);

  private final int bagCount;
  private int width;
  private final int vertexCount;
  private final Map<Integer, Bag> bags;
  private final Map<Integer, Set<Integer>> tree;
  private Bag root;

  private TreeDecomposition(
      int bagCount,
      int width,
      int vertexCount,
      Map<Integer, Bag> bags,
      Map<Integer, Set<Integer>> tree) {
    this.bagCount = bagCount;
    this.width = width;
    this.vertexCount = vertexCount;
    this.bags = bags;
    this.tree = tree;
    if (!bags.isEmpty()) {
      setRoot(bags.keySet().iterator().next());
    }
  }

  /**
   * Builds a decomposition from bag contents and tree edges, rooted at the smallest bag id.
   *
   * @throws IllegalArgumentException if an edge refers to an unknown bag or the edges do not form
   *     a tree
   */
  public static TreeDecomposition of(
      int width,
      int vertexCount,
      Map<Integer, ? extends Collection<Integer>> bagVertices,
      Collection<int[]> treeEdges) {
    Map<Integer, Bag> bags = new TreeMap<>();
    Map<Integer, Set<Integer>> tree = new TreeMap<>();
    bagVertices.forEach(
        (id, vertices) -> {
          bags.put(id, new Bag(id, vertices));
          tree.put(id, new TreeSet<>());
        });
    for (int[] edge : treeEdges) {
      if (!tree.containsKey(edge[0]) || !tree.containsKey(edge[1])) {
        throw new IllegalArgumentException(
            "Tree edge " + edge[0] + " " + edge[1] + " refers to an unknown bag");
      }
      tree.get(edge[0]).add(edge[1]);
      tree.get(edge[1]).add(edge[0]);
    }
    checkTree(bags.keySet(), tree, treeEdges.size());
    return new TreeDecomposition(bags.size(), width, vertexCount, bags, tree);
  }

  public static TreeDecomposition parse(String text) {
    return parse(new StringReader(text));
  }

  public static TreeDecomposition parse(Reader reader) {
    return new TreeDecompositionParser().parse(reader);
  }

  public static TreeDecomposition fromStream(InputStream stream) {
    return parse(new InputStreamReader(stream, StandardCharsets.UTF_8));
  }

  public static TreeDecomposition fromFile(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader);
    }
  }

  /**
   * Decomposes {@code graph} with an anytime heuristic. Vertices are relabelled to {@code 1..n}
   * before the call and mapped back afterwards.
   */
  public static TreeDecomposition fromGraph(
      Graph graph, TreewidthSolver solver, Duration timeout, ResourceGuard guard) {
    Objects.requireNonNull(solver, "solver");
    List<Integer> labels = new ArrayList<>(graph.vertices());
    Map<Integer, Integer> dense = new HashMap<>();
    Graph relabelled = new Graph();
    for (int i = 0; i < labels.size(); i++) {
      dense.put(labels.get(i), i + 1);
      relabelled.addVertex(i + 1);
    }
    for (Graph.Edge edge : graph.edges()) {
      relabelled.addEdge(dense.get(edge.u()), dense.get(edge.v()));
    }
    AnytimeResult<TreeDecomposition> result = solver.decompose(relabelled, timeout, guard);
    if (!result.completed()) {
      LOG.debug(
          "Treewidth heuristic stopped after {} ms, using its last decomposition",
          timeout.toMillis());
    }
    return result.result().relabel(labels);
  }

  public static TreeDecomposition fromHypergraph(
      Hypergraph hypergraph, TreewidthSolver solver, Duration timeout, ResourceGuard guard) {
    return fromGraph(hypergraph.toGraph(), solver, timeout, guard);
  }

  public int bagCount() {
    return bagCount;
  }

  public int width() {
    return width;
  }

  public int vertexCount() {
    return vertexCount;
  }

  public Optional<Bag> root() {
    return Optional.ofNullable(root);
  }

  public Bag bag(int id) {
    Bag bag = bags.get(id);
    if (bag == null) {
      throw new IllegalArgumentException("Unknown bag " + id);
    }
    return bag;
  }

  public Collection<Bag> bags() {
    return bags.values();
  }

  /** Ids of the bags adjacent to {@code id} in the (unrooted) tree. */
  public Set<Integer> neighbors(int id) {
    bag(id);
    return tree.get(id);
  }

  /** Re-roots the tree at bag {@code id}, recomputing the children of every bag. */
  public void setRoot(int id) {
    Bag newRoot = bag(id);
    Deque<int[]> stack = new ArrayDeque<>();
    stack.push(new int[] {-1, id});
    while (!stack.isEmpty()) {
      int[] frame = stack.pop();
      int parent = frame[0];
      int current = frame[1];
      List<Bag> children = new ArrayList<>();
      for (int neighbor : tree.get(current)) {
        if (neighbor != parent) {
          children.add(bags.get(neighbor));
          stack.push(new int[] {current, neighbor});
        }
      }
      bags.get(current).replaceChildren(children);
    }
    root = newRoot;
  }

  /** Bags in the given order, starting from the current root. */
  public List<Bag> iterate(TraversalOrder order) {
    List<Bag> visited = new ArrayList<>(bags.size());
    if (root == null) {
      return visited;
    }
    if (order == TraversalOrder.PRE_ORDER) {
      Deque<Bag> stack = new ArrayDeque<>();
      stack.push(root);
      while (!stack.isEmpty()) {
        Bag current = stack.pop();
        visited.add(current);
        List<Bag> children = current.children();
        for (int i = children.size() - 1; i >= 0; i--) {
          stack.push(children.get(i));
        }
      }
      return visited;
    }
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(root));
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.next < frame.bag.children().size()) {
        stack.push(new Frame(frame.bag.children().get(frame.next++)));
      } else {
        stack.pop();
        visited.add(frame.bag);
      }
    }
    return visited;
  }

  public List<Bag> postOrder() {
    return iterate(TraversalOrder.POST_ORDER);
  }

  /**
   * Returns the first bag in post-order whose subtree introduces more than half of all vertices.
   * A bag introduces the vertices it has and its parent lacks.
   *
   * <p>The returned bag is the one whose own subtree crosses the threshold, not its parent. Falls
   * back to the root when no proper subtree does.
   */
  public Bag findCentroid() {
    if (root == null) {
      throw new IllegalStateException("Empty tree decomposition has no centroid");
    }
    Map<Integer, Bag> parents = parents();
    Map<Integer, Integer> subtreeWeight = new HashMap<>();
    for (Bag bag : postOrder()) {
      Bag parent = parents.get(bag.id());
      int introduced = bag.vertices().size();
      if (parent != null) {
        Set<Integer> fresh = new HashSet<>(bag.vertices());
        fresh.removeAll(parent.vertices());
        introduced = fresh.size();
      }
      int weight = introduced;
      for (Bag child : bag.children()) {
        weight += subtreeWeight.get(child.id());
      }
      subtreeWeight.put(bag.id(), weight);
      if (weight > vertexCount / 2) {
        return bag;
      }
    }
    return root;
  }

  /** First bag in post-order whose vertex set contains all of {@code vertices}. */
  public Optional<Bag> findContaining(Collection<Integer> vertices) {
    for (Bag bag : postOrder()) {
      if (bag.containsAll(vertices)) {
        return Optional.of(bag);
      }
    }
    return Optional.empty();
  }

  /** Deletes {@code vertices} from every bag. */
  public void remove(Collection<Integer> vertices) {
    Set<Integer> removed = new HashSet<>(vertices);
    int largest = 0;
    for (Bag bag : bags.values()) {
      bag.removeVertices(removed);
      largest = Math.max(largest, bag.vertices().size());
    }
    width = largest - 1;
  }

  private Map<Integer, Bag> parents() {
    Map<Integer, Bag> parents = new HashMap<>();
    for (Bag bag : bags.values()) {
      for (Bag child : bag.children()) {
        parents.put(child.id(), bag);
      }
    }
    return parents;
  }

  private TreeDecomposition relabel(List<Integer> labels) {
    Map<Integer, List<Integer>> bagVertices = new LinkedHashMap<>();
    for (Bag bag : bags.values()) {
      List<Integer> mapped = new ArrayList<>(bag.vertices().size());
      for (int vertex : bag.vertices()) {
        mapped.add(labels.get(vertex - 1));
      }
      bagVertices.put(bag.id(), mapped);
    }
    return of(width, labels.size(), bagVertices, treeEdges());
  }

  private List<int[]> treeEdges() {
    List<int[]> edges = new ArrayList<>();
    tree.forEach(
        (id, neighbors) -> {
          for (int neighbor : neighbors) {
            if (id < neighbor) {
              edges.add(new int[] {id, neighbor});
            }
          }
        });
    return edges;
  }

  private static void checkTree(Set<Integer> ids, Map<Integer, Set<Integer>> tree, int edgeCount) {
    if (ids.isEmpty()) {
      return;
    }
    if (edgeCount != ids.size() - 1) {
      throw new IllegalArgumentException(
          "A tree over " + ids.size() + " bags needs " + (ids.size() - 1) + " edges, got " + edgeCount);
    }
    Set<Integer> reached = new HashSet<>();
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(ids.iterator().next());
    while (!stack.isEmpty()) {
      int current = stack.pop();
      if (reached.add(current)) {
        stack.addAll(tree.get(current));
      }
    }
    if (reached.size() != ids.size()) {
      throw new IllegalArgumentException("Tree decomposition is not connected");
    }
  }

  /** Serializes in the {@code s tw} / {@code b} / edge format read by {@link #parse}. */
  @Override
  public String toString() {
    StringBuilder out = new StringBuilder();
    out.append("s tw ").append(bagCount).append(' ').append(width).append(' ').append(vertexCount);
    out.append('\n');
    List<Bag> order = postOrder();
    for (Bag bag : order) {
      out.append("b ").append(bag.id());
      for (int vertex : bag.vertices()) {
        out.append(' ').append(vertex);
      }
      out.append('\n');
    }
    for (Bag bag : order) {
      for (Bag child : bag.children()) {
        out.append(bag.id()).append(' ').append(child.id()).append('\n');
      }
    }
    return out.toString();
  }

  private static final class Frame {
    private final Bag bag;
    private int next;

    Frame(Bag bag) {
      this.bag = bag;
    }
  }
}
