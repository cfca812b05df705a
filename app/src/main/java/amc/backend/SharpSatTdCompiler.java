package amc.backend;

import amc.cnf.WeightedCnf;
import amc.error.BackendFailureException;
import amc.process.ExternalProcess;
import amc.process.ProcessRunner;
import amc.process.ResourceGuard;
import amc.util.Timing;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * sharpSAT-TD in d-DNNF mode. The file variant writes the circuit next to the CNF; the live
 * variant streams it on standard output, where it is parsed while the compiler is still running.
 * The compiler runs in the directory of its executable, where it finds its own treewidth helper.
 */
public final class SharpSatTdCompiler implements KnowledgeCompiler {
  public static final String NAME = "sharpsat-td";
  public static final String LIVE_NAME = "sharpsat-td-live";
  private static final Logger LOG = LoggerFactory.getLogger(SharpSatTdCompiler.class);

  private final Path executable;
  private final Duration decompositionTimeout;
  private final boolean live;

  private SharpSatTdCompiler(Path executable, Duration decompositionTimeout, boolean live) {
    this.executable = executable;
    this.decompositionTimeout = decompositionTimeout;
    this.live = live;
  }

  public static SharpSatTdCompiler fileOutput(Path executable, Duration decompositionTimeout) {
    return new SharpSatTdCompiler(executable, decompositionTimeout, false);
  }

  public static SharpSatTdCompiler live(Path executable, Duration decompositionTimeout) {
    return new SharpSatTdCompiler(executable, decompositionTimeout, true);
  }

  @Override
  public String name() {
    return live ? LIVE_NAME : NAME;
  }

  @Override
  public boolean supportsLiveCounting() {
    return live;
  }

  @Override
  public NnfCircuit compile(WeightedCnf cnf, ResourceGuard guard) {
    Path cnfFile = CompilerFiles.writeTemp(guard, name(), ".cnf", compilerInput(cnf));
    List<String> command = new ArrayList<>();
    command.add(executable.toString());
    command.add("-dDNNF");
    command.addAll(baseCommand(decompositionTimeout));
    command.add(cnfFile.toString());
    Timing timing = Timing.start();
    try {
      if (live) {
        return compileLive(command, guard, timing);
      }
      Path nnfFile = CompilerFiles.sibling(guard, cnfFile, ".nnf");
      command.add("-dDNNF_out");
      command.add(nnfFile.toString());
      try {
        ProcessRunner.run(guard, name(), command, null, executable.getParent()).requireSuccess();
        LOG.info("Compilation time: {} s", timing.elapsedSeconds());
        return CompilerFiles.readCircuit(name(), nnfFile, NnfFormat.D4);
      } finally {
        guard.delete(nnfFile);
      }
    } finally {
      guard.delete(cnfFile);
    }
  }

  private NnfCircuit compileLive(List<String> command, ResourceGuard guard, Timing timing) {
    try (ExternalProcess process =
        ExternalProcess.start(guard, name(), command, executable.getParent())) {
      process.writeStdin("");
      NnfCircuit circuit;
      try {
        circuit = NnfParser.parse(process.stdout(), NnfFormat.D4);
      } catch (RuntimeException ex) {
        guard.checkNotCancelled();
        int exitCode = process.waitFor();
        if (exitCode != 0) {
          throw new BackendFailureException(name(), exitCode);
        }
        throw ex;
      }
      process.finish("").requireSuccess();
      LOG.info("Compilation & parsing time: {} s", timing.elapsedSeconds());
      return circuit;
    }
  }

  /**
   * Clauses plus a weight line for every literal, so the compiler keeps every variable in the
   * circuit.
   */
  static String compilerInput(WeightedCnf cnf) {
    StringBuilder out = new StringBuilder(cnf.serialize(false));
    for (int v = 1; v <= cnf.nrVars(); v++) {
      out.append("c p weight ").append(v).append(' ').append(v).append(" 0\n");
      out.append("c p weight ").append(-v).append(' ').append(-v).append(" 0\n");
    }
    return out.toString();
  }

  /** Flags shared with the weighted counter. The decomposition time is at least 0.1 s. */
  static List<String> baseCommand(Duration decompositionTimeout) {
    double seconds = Math.max(decompositionTimeout.toMillis() / 1000.0, 0.1);
    return List.of(
        "-decot",
        String.format(Locale.ROOT, "%.1f", seconds),
        "-decow",
        "100",
        "-tmpdir",
        System.getProperty("java.io.tmpdir"),
        "-cs",
        "3500");
  }
}
