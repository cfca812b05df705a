package amc.backend;

import amc.graph.Graph;
import amc.graph.TreeDecomposition;
import amc.process.AnytimeResult;
import amc.process.ResourceGuard;
import java.time.Duration;

/** Anytime tree decomposition heuristic over graphs with vertices {@code 1..n}. */
public interface TreewidthSolver {

  /**
   * Decomposes {@code graph}, stopping at {@code timeout}. The returned decomposition is valid
   * even when the heuristic was stopped early.
   */
  AnytimeResult<TreeDecomposition> decompose(Graph graph, Duration timeout, ResourceGuard guard);
}
