package amc.backend;

import amc.error.BackendFailureException;
import amc.graph.Graph;
import amc.graph.TreeDecomposition;
import amc.process.AnytimeResult;
import amc.process.ExternalProcess;
import amc.process.ResourceGuard;
import amc.util.Timing;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The FlowCutter PACE 2017 heuristic. It reads the graph on standard input, improves its
 * decomposition until it receives SIGTERM and then prints the best one found.
 */
public final class FlowCutterSolver implements TreewidthSolver {
  private static final String NAME = "flow-cutter";
  private static final Logger LOG = LoggerFactory.getLogger(FlowCutterSolver.class);
  private static final Duration GRACE = Duration.ofSeconds(5);

  private final Path executable;

  public FlowCutterSolver(Path executable) {
    this.executable = executable;
  }

  @Override
  public AnytimeResult<TreeDecomposition> decompose(
      Graph graph, Duration timeout, ResourceGuard guard) {
    Timing timing = Timing.start();
    try (ExternalProcess process =
        ExternalProcess.start(guard, NAME, List.of(executable.toString()))) {
      process.collectStdout();
      process.writeStdin(graphInput(graph));
      Duration left = timeout.minusMillis(timing.elapsedMillis());
      boolean completed = process.waitFor(left.isNegative() ? Duration.ZERO : left);
      if (!completed) {
        process.terminate(GRACE);
      }
      String output = process.collectedStdout();
      int exitCode = process.finish(output).exitCode();
      if (completed && exitCode != 0) {
        throw new BackendFailureException(NAME, exitCode);
      }
      LOG.debug("{} finished after {} ms (completed: {})", NAME, timing.elapsedMillis(), completed);
      return new AnytimeResult<>(TreeDecomposition.parse(output), completed);
    }
  }

  /** PACE graph format: {@code p tw <vertices> <edges>} followed by one edge per line. */
  static String graphInput(Graph graph) {
    StringBuilder input = new StringBuilder();
    input.append("p tw ").append(graph.vertexCount()).append(' ').append(graph.edgeCount());
    input.append('\n');
    for (Graph.Edge edge : graph.edges()) {
      input.append(edge.u()).append(' ').append(edge.v()).append('\n');
    }
    return input.toString();
  }
}
