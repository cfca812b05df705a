package amc.backend;

import amc.cnf.WeightedCnf;
import amc.process.ProcessRunner;
import amc.process.ResourceGuard;
import amc.util.Timing;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The d4 compiler; writes a smooth d-DNNF in its own node/edge format. */
public final class D4Compiler implements KnowledgeCompiler {
  public static final String NAME = "d4";
  private static final Logger LOG = LoggerFactory.getLogger(D4Compiler.class);

  private final Path executable;

  public D4Compiler(Path executable) {
    this.executable = executable;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public NnfCircuit compile(WeightedCnf cnf, ResourceGuard guard) {
    Path cnfFile = CompilerFiles.writeTemp(guard, NAME, ".cnf", cnf.serialize(false));
    Path nnfFile = CompilerFiles.sibling(guard, cnfFile, ".nnf");
    Timing timing = Timing.start();
    try {
      ProcessRunner.run(
              guard,
              NAME,
              List.of(
                  executable.toString(),
                  cnfFile.toString(),
                  "-dDNNF",
                  "-out=" + nnfFile,
                  "-smooth"))
          .requireSuccess();
      LOG.info("Compilation time: {} s", timing.elapsedSeconds());
      return CompilerFiles.readCircuit(NAME, nnfFile, NnfFormat.D4);
    } finally {
      guard.delete(nnfFile);
      guard.delete(cnfFile);
    }
  }
}
