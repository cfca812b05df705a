package amc.eval;

import amc.backend.C2dCompiler;
import amc.backend.CircuitEvaluator;
import amc.backend.ConstrainedCircuitEvaluator;
import amc.backend.D4Compiler;
import amc.backend.DtreeBuilder;
import amc.backend.EvalMaxSatSolver;
import amc.backend.ExactCounter;
import amc.backend.FlowCutterSolver;
import amc.backend.KnowledgeCompiler;
import amc.backend.MaxSatSolver;
import amc.backend.MinisatSolver;
import amc.backend.Preprocessor;
import amc.backend.SatSolver;
import amc.backend.SharpSatPreprocessor;
import amc.backend.SharpSatTdCompiler;
import amc.backend.SharpSatTdCounter;
import amc.backend.SmoothingCircuitEvaluator;
import amc.backend.TreewidthSolver;
import java.time.Duration;
import java.util.Objects;

/** The collaborators one evaluator calls. Tests substitute in-process implementations. */
public record Backends(
    SatSolver satSolver,
    MaxSatSolver maxSatSolver,
    TreewidthSolver treewidthSolver,
    Preprocessor preprocessor,
    ExactCounter exactCounter,
    KnowledgeCompiler compiler,
    CircuitEvaluator circuitEvaluator,
    CircuitEvaluator constrainedEvaluator) {

  public Backends {
    Objects.requireNonNull(satSolver, "satSolver");
    Objects.requireNonNull(maxSatSolver, "maxSatSolver");
    Objects.requireNonNull(treewidthSolver, "treewidthSolver");
    Objects.requireNonNull(preprocessor, "preprocessor");
    Objects.requireNonNull(exactCounter, "exactCounter");
    Objects.requireNonNull(compiler, "compiler");
    Objects.requireNonNull(circuitEvaluator, "circuitEvaluator");
    Objects.requireNonNull(constrainedEvaluator, "constrainedEvaluator");
  }

  /** Subprocess backends at the configured locations. */
  public static Backends external(BackendConfig config, EvaluationOptions options) {
    EvaluationOptions normalized = EvaluationOptions.normalize(options);
    Duration timeout = normalized.decompositionTimeout();
    TreewidthSolver treewidth = new FlowCutterSolver(config.flowCutter());
    KnowledgeCompiler compiler =
        switch (normalized.compiler()) {
          case C2D -> new C2dCompiler(config.c2d(), new DtreeBuilder(treewidth, timeout));
          case D4 -> new D4Compiler(config.d4());
          case SHARPSAT_TD -> SharpSatTdCompiler.fileOutput(config.sharpSatTd(), timeout);
          case SHARPSAT_TD_LIVE -> SharpSatTdCompiler.live(config.sharpSatTd(), timeout);
        };
    return new Backends(
        new MinisatSolver(config.minisat()),
        new EvalMaxSatSolver(config.evalMaxSat()),
        treewidth,
        new SharpSatPreprocessor(config.preprocessor()),
        new SharpSatTdCounter(config.sharpSatTd(), timeout),
        compiler,
        new SmoothingCircuitEvaluator(),
        new ConstrainedCircuitEvaluator());
  }

  public Backends withCompiler(KnowledgeCompiler newCompiler) {
    return new Backends(
        satSolver,
        maxSatSolver,
        treewidthSolver,
        preprocessor,
        exactCounter,
        newCompiler,
        circuitEvaluator,
        constrainedEvaluator);
  }
}
