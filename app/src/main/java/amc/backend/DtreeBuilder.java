package amc.backend;

import amc.cnf.WeightedCnf;
import amc.graph.Bag;
import amc.graph.Hypergraph;
import amc.graph.TreeDecomposition;
import amc.process.ResourceGuard;
import amc.util.Timing;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a tree decomposition of the primal hypergraph into a dtree for c2d. Every clause hangs
 * below the first bag in post-order that contains all its variables; the clauses of a bag and the
 * dtrees of its children are joined left to right.
 */
public final class DtreeBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(DtreeBuilder.class);

  private final TreewidthSolver treewidthSolver;
  private final Duration timeout;

  public DtreeBuilder(TreewidthSolver treewidthSolver, Duration timeout) {
    this.treewidthSolver = treewidthSolver;
    this.timeout = timeout;
  }

  /** Dtree rooted at the centroid of the decomposition, for unconstrained compilation. */
  public Dtree build(WeightedCnf cnf, ResourceGuard guard) {
    TreeDecomposition decomposition = decompose(cnf.primalHypergraph(), guard);
    decomposition.setRoot(decomposition.findCentroid().id());
    return fromDecomposition(cnf, decomposition);
  }

  /**
   * Dtree for X/D-constrained compilation: the {@code outer} variables form a clique, so some bag
   * holds all of them, and the tree is rooted there. Every level-0 decision then happens above
   * the level-1 variables.
   */
  public Dtree buildConstrained(WeightedCnf cnf, Set<Integer> outer, ResourceGuard guard) {
    Hypergraph hypergraph = cnf.primalHypergraph();
    if (!outer.isEmpty()) {
      hypergraph.addEdge(outer);
    }
    TreeDecomposition decomposition = decompose(hypergraph, guard);
    Bag root =
        decomposition
            .findContaining(outer)
            .orElseThrow(
                () -> new IllegalStateException("No bag contains all level-0 variables"));
    decomposition.setRoot(root.id());
    return fromDecomposition(cnf, decomposition);
  }

  private TreeDecomposition decompose(Hypergraph hypergraph, ResourceGuard guard) {
    Timing timing = Timing.start();
    TreeDecomposition decomposition =
        TreeDecomposition.fromHypergraph(hypergraph, treewidthSolver, timeout, guard);
    LOG.info(
        "Tree decomposition #bags: {} treewidth: {} #vertices: {} ({} ms)",
        decomposition.bagCount(),
        decomposition.width(),
        decomposition.vertexCount(),
        timing.elapsedMillis());
    return decomposition;
  }

  static Dtree fromDecomposition(WeightedCnf cnf, TreeDecomposition decomposition) {
    List<List<Integer>> clauses = cnf.clauses();
    if (clauses.isEmpty()) {
      throw new IllegalArgumentException("Cannot build a dtree without clauses");
    }
    Set<Integer> unused = new TreeSet<>();
    for (int v = 1; v <= cnf.nrVars(); v++) {
      unused.add(v);
    }
    for (List<Integer> clause : clauses) {
      for (int literal : clause) {
        unused.remove(Math.abs(literal));
      }
    }
    decomposition.remove(unused);

    Map<Integer, List<Integer>> clausesOfBag = new HashMap<>();
    for (int index = 0; index < clauses.size(); index++) {
      List<Integer> variables = new ArrayList<>();
      for (int literal : clauses.get(index)) {
        variables.add(Math.abs(literal));
      }
      Bag bag =
          decomposition
              .findContaining(variables)
              .orElseThrow(() -> new IllegalStateException("Clause not covered by any bag"));
      clausesOfBag.computeIfAbsent(bag.id(), k -> new ArrayList<>()).add(index);
    }

    Dtree dtree = new Dtree();
    Map<Integer, Integer> subtree = new HashMap<>();
    for (Bag bag : decomposition.postOrder()) {
      Integer current = null;
      for (int clause : clausesOfBag.getOrDefault(bag.id(), List.of())) {
        current = join(dtree, current, dtree.leaf(clause));
      }
      for (Bag child : bag.children()) {
        Integer below = subtree.get(child.id());
        if (below != null) {
          current = join(dtree, current, below);
        }
      }
      if (current != null) {
        subtree.put(bag.id(), current);
      }
    }
    return dtree;
  }

  private static int join(Dtree dtree, Integer current, int next) {
    return current == null ? next : dtree.join(current, next);
  }
}
