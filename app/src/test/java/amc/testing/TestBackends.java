package amc.testing;

import amc.backend.ConstrainedCircuitEvaluator;
import amc.backend.KnowledgeCompiler;
import amc.backend.SmoothingCircuitEvaluator;
import amc.eval.Backends;

/** In-process backends, so evaluation paths run without external binaries. */
public final class TestBackends {
  public final BruteForceSatSolver sat = new BruteForceSatSolver();
  public final BruteForceMaxSatSolver maxSat = new BruteForceMaxSatSolver();
  public final GreedyTreewidthSolver treewidth = new GreedyTreewidthSolver();
  public final DeduplicatingPreprocessor preprocessor = new DeduplicatingPreprocessor();
  public final BruteForceCounter counter = new BruteForceCounter();
  public final ShannonCompiler compiler;

  public TestBackends() {
    this(new ShannonCompiler());
  }

  public TestBackends(ShannonCompiler compiler) {
    this.compiler = compiler;
  }

  public Backends backends() {
    return backends(compiler);
  }

  public Backends backends(KnowledgeCompiler knowledgeCompiler) {
    return new Backends(
        sat,
        maxSat,
        treewidth,
        preprocessor,
        counter,
        knowledgeCompiler,
        new SmoothingCircuitEvaluator(),
        new ConstrainedCircuitEvaluator());
  }
}
