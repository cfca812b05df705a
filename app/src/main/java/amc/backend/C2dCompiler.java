package amc.backend;

import amc.cnf.WeightedCnf;
import amc.process.ProcessRunner;
import amc.process.ResourceGuard;
import amc.util.Timing;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The c2d compiler, guided by a dtree built from a tree decomposition. Constrained compilation
 * passes the level-0 variables as a {@code -force} file.
 */
public final class C2dCompiler implements KnowledgeCompiler {
  public static final String NAME = "c2d";
  private static final Logger LOG = LoggerFactory.getLogger(C2dCompiler.class);

  private final Path executable;
  private final DtreeBuilder dtreeBuilder;

  public C2dCompiler(Path executable, DtreeBuilder dtreeBuilder) {
    this.executable = executable;
    this.dtreeBuilder = dtreeBuilder;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean supportsConstrained() {
    return true;
  }

  @Override
  public NnfCircuit compile(WeightedCnf cnf, ResourceGuard guard) {
    Dtree dtree = dtreeBuilder.build(cnf, guard);
    Path cnfFile = CompilerFiles.writeTemp(guard, NAME, ".cnf", cnf.serialize(false));
    Path dtreeFile = CompilerFiles.sibling(guard, cnfFile, ".dtree");
    CompilerFiles.write(NAME, dtreeFile, dtree.toString());
    Path nnfFile = CompilerFiles.sibling(guard, cnfFile, ".nnf");
    return run(
        guard,
        List.of(
            executable.toString(),
            "-smooth_all",
            "-reduce",
            "-in",
            cnfFile.toString(),
            "-dt_in",
            dtreeFile.toString()),
        nnfFile,
        cnfFile,
        dtreeFile);
  }

  @Override
  public NnfCircuit compileConstrained(WeightedCnf cnf, ResourceGuard guard) {
    Set<Integer> outer = new TreeSet<>(cnf.quantified().get(0));
    Dtree dtree = dtreeBuilder.buildConstrained(cnf, outer, guard);
    Path cnfFile = CompilerFiles.writeTemp(guard, NAME, ".cnf", cnf.serialize(false));
    Path dtreeFile = CompilerFiles.sibling(guard, cnfFile, ".dtree");
    CompilerFiles.write(NAME, dtreeFile, dtree.toString());
    StringBuilder force = new StringBuilder().append(outer.size());
    for (int variable : outer) {
      force.append(' ').append(variable);
    }
    Path forceFile = CompilerFiles.writeTemp(guard, NAME, ".force", force.toString());
    Path nnfFile = CompilerFiles.sibling(guard, cnfFile, ".nnf");
    return run(
        guard,
        List.of(
            executable.toString(),
            "-cache_size",
            "3500",
            "-keep_trivial_cls",
            "-smooth_all",
            "-in",
            cnfFile.toString(),
            "-dt_in",
            dtreeFile.toString(),
            "-force",
            forceFile.toString()),
        nnfFile,
        cnfFile,
        dtreeFile,
        forceFile);
  }

  private NnfCircuit run(ResourceGuard guard, List<String> command, Path nnfFile, Path... inputs) {
    Timing timing = Timing.start();
    ProcessRunner.run(guard, NAME, command).requireSuccess();
    LOG.info("Compilation time: {} s", timing.elapsedSeconds());
    try {
      return CompilerFiles.readCircuit(NAME, nnfFile, NnfFormat.C2D);
    } finally {
      guard.delete(nnfFile);
      for (Path input : inputs) {
        guard.delete(input);
      }
    }
  }
}
