package amc.backend;

import amc.cnf.WeightedCnf;
import amc.error.ConfigurationException;
import amc.process.ResourceGuard;

/** Compiles a CNF into a d-DNNF circuit. */
public interface KnowledgeCompiler {

  /** Name used on the command line, e.g. {@code c2d}. */
  String name();

  NnfCircuit compile(WeightedCnf cnf, ResourceGuard guard);

  /**
   * Compiles a two-level instance into an X/D-constrained circuit in which every level-0
   * variable is decided above all level-1 variables.
   */
  default NnfCircuit compileConstrained(WeightedCnf cnf, ResourceGuard guard) {
    throw new ConfigurationException(
        "Knowledge compiler " + name() + " does not support X/D-constrained compilation");
  }

  default boolean supportsConstrained() {
    return false;
  }

  /** True if the circuit is streamed and read while the compiler is still running. */
  default boolean supportsLiveCounting() {
    return false;
  }
}
