package amc.cli;

import amc.backend.FlowCutterSolver;
import amc.backend.TreewidthSolver;
import amc.cnf.WeightedCnf;
import amc.eval.BackendConfig;
import amc.graph.TreeDecomposition;
import amc.process.ResourceGuard;
import amc.util.Timing;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the {@code treewidth} command: decomposes the primal hypergraph and reports it. */
final class TreewidthCommand {
  private static final Logger LOG = LoggerFactory.getLogger(TreewidthCommand.class);

  private final TreewidthSolver solver;

  TreewidthCommand() {
    this(new FlowCutterSolver(BackendConfig.fromEnvironment().flowCutter()));
  }

  TreewidthCommand(TreewidthSolver solver) {
    this.solver = solver;
  }

  int execute(CliOptions options) throws IOException {
    WeightedCnf cnf = CliParsers.loadCnf(options);
    Timing timing = Timing.start();
    TreeDecomposition decomposition;
    try (ResourceGuard guard = ResourceGuard.open()) {
      decomposition =
          TreeDecomposition.fromHypergraph(
              cnf.primalHypergraph(), solver, options.decompositionTimeout(), guard);
    }
    LOG.info("Tree decomposition #bags: {}", decomposition.bagCount());
    LOG.info("Tree decomposition width: {}", decomposition.width());
    LOG.info("Tree decomposition #vertices: {}", decomposition.vertexCount());
    if (options.jsonPath() != null) {
      String json = new JsonReportBuilder().build(options, decomposition, timing.elapsedMillis());
      Files.writeString(options.jsonPath(), json, StandardCharsets.UTF_8);
    }
    return 0;
  }
}
