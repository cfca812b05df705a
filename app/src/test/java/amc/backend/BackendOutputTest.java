package amc.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import amc.cnf.WeightedCnf;
import amc.error.BackendFailureException;
import amc.error.SolvingException;
import amc.graph.Graph;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Output and input formats of the external backends, without running them. */
final class BackendOutputTest {

  @Test
  void minisatResultFile() {
    Optional<Assignment> model = MinisatSolver.parseResult(3, "SAT\n1 -2 3 0\n");
    assertEquals(List.of(1, -2, 3), model.orElseThrow().literals());
    assertFalse(MinisatSolver.parseResult(3, "UNSAT\n").isPresent());
    BackendFailureException failure =
        assertThrows(BackendFailureException.class, () -> MinisatSolver.parseResult(3, "INDET\n"));
    assertEquals("minisat", failure.backend());
  }

  @Test
  void minisatInputIsPlainDimacs() {
    assertEquals(
        "p cnf 2 2\n1 -2 0\n2 0\n",
        MinisatSolver.dimacs(2, List.of(List.of(1, -2), List.of(2))));
  }

  @Test
  void evalMaxSatReadsBitStringAndLiteralModels() {
    Optional<Assignment> bits =
        EvalMaxSatSolver.parseOutput(3, "c comment\no 4\ns OPTIMUM FOUND\nv 101\n");
    assertEquals(List.of(1, -2, 3), bits.orElseThrow().literals());
    Optional<Assignment> literals =
        EvalMaxSatSolver.parseOutput(3, "s OPTIMUM FOUND\nv -1 2 -3\n");
    assertEquals(List.of(-1, 2, -3), literals.orElseThrow().literals());
    assertFalse(EvalMaxSatSolver.parseOutput(3, "s UNSATISFIABLE\n").isPresent());
  }

  @Test
  void evalMaxSatWithoutOptimumIsASolvingError() {
    assertThrows(
        SolvingException.class, () -> EvalMaxSatSolver.parseOutput(2, "s UNKNOWN\n"));
    SolvingException interrupted =
        assertThrows(
            SolvingException.class, () -> EvalMaxSatSolver.parseOutput(2, "s SATISFIABLE\nv 11\n"));
    assertTrue(interrupted.getMessage().contains("interrupted"));
    assertThrows(
        SolvingException.class, () -> EvalMaxSatSolver.parseOutput(2, "s OPTIMUM FOUND\n"));
  }

  @Test
  void evalMaxSatWithoutUsableStatusIsASolvingError() {
    assertThrows(SolvingException.class, () -> EvalMaxSatSolver.parseOutput(2, "c nothing\n"));
    assertThrows(SolvingException.class, () -> EvalMaxSatSolver.parseOutput(2, "o 1\n"));
    assertThrows(
        SolvingException.class, () -> EvalMaxSatSolver.parseOutput(2, "s MEMOUT\nv 11\n"));
  }

  @Test
  void preprocessorOutputSkipsCommentsBeforeTheHeader() {
    Preprocessor.Result result =
        SharpSatPreprocessor.parseOutput("c o banner\n1 2 0\np cnf 4 2\nc kept\n1 -3 0\n4 0\n");
    assertEquals(4, result.nrVars());
    assertEquals(List.of(List.of(1, -3), List.of(4)), result.clauses());
    assertThrows(
        BackendFailureException.class, () -> SharpSatPreprocessor.parseOutput("c nothing\n"));
  }

  @Test
  void preprocessorGarbageIsABackendFailure() {
    BackendFailureException header =
        assertThrows(
            BackendFailureException.class,
            () -> SharpSatPreprocessor.parseOutput("p cnf x 1\n1 0\n"));
    assertEquals("preprocessor", header.backend());
    assertThrows(
        BackendFailureException.class,
        () -> SharpSatPreprocessor.parseOutput("p cnf 2 1\n1 y 0\n"));
  }

  @Test
  void counterReadsOneValuePerQuery() {
    assertEquals(
        List.of(0.25, 1.5),
        SharpSatTdCounter.parseCount("c o solving\nc s exact arb float 0.25;1.5\n"));
    assertEquals(List.of(0.5), SharpSatTdCounter.parseCount("c s exact arb float 5e-1\n"));
    assertThrows(
        BackendFailureException.class, () -> SharpSatTdCounter.parseCount("s SATISFIABLE\n"));
  }

  @Test
  void flowCutterInputIsPaceGraph() {
    Graph graph = new Graph();
    graph.addEdge(1, 2);
    graph.addEdge(2, 3);
    assertEquals("p tw 3 2\n1 2\n2 3\n", FlowCutterSolver.graphInput(graph));
  }

  @Test
  void sharpSatTdWeighsEveryLiteralByItself() {
    WeightedCnf cnf = WeightedCnf.builder().nrVars(2).addClause(1, 2).build();
    assertEquals(
        "p cnf 2 1\n1 2 0\n"
            + "c p weight 1 1 0\nc p weight -1 -1 0\n"
            + "c p weight 2 2 0\nc p weight -2 -2 0\n",
        SharpSatTdCompiler.compilerInput(cnf));
  }

  @Test
  void decompositionTimeIsAtLeastATenthOfASecond() {
    List<String> command = SharpSatTdCompiler.baseCommand(Duration.ZERO);
    assertEquals("-decot", command.get(0));
    assertEquals("0.1", command.get(1));
    assertEquals("2.5", SharpSatTdCompiler.baseCommand(Duration.ofMillis(2500)).get(1));
  }
}
