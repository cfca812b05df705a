package amc.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import amc.cnf.WeightedCnf;
import amc.error.FormatException;
import amc.semiring.TwoNatValue;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

final class CircuitEvaluatorTest {
  private static final double EPSILON = 1e-9;

  private static NnfCircuit c2d(String text) {
    return NnfParser.parse(new StringReader(text), NnfFormat.C2D);
  }

  private static WeightedCnf probabilistic(int nrVars) {
    WeightedCnf.Builder builder =
        WeightedCnf.builder()
            .nrVars(nrVars)
            .addClause(-1, 2)
            .semiring("probabilistic")
            .quantifyAll()
            .weight(1, 0.3)
            .weight(-1, 0.7)
            .weight(2, 0.4)
            .weight(-2, 0.6);
    if (nrVars > 2) {
      builder.weight(3, 0.2).weight(-3, 0.3);
    }
    return builder.build();
  }

  /** x1 = probabilistic (0.3, 0.7); x2 = two_nat (1,1) and (0,1); x1 or x2; w[0]/w[1]. */
  private static WeightedCnf twoLevel() {
    return WeightedCnf.builder()
        .nrVars(2)
        .addClause(1, 2)
        .semiring("probabilistic")
        .semiring("two_nat")
        .quantify(1)
        .quantify(2)
        .transform("lambda w : w[0]/w[1]")
        .weight(1, 0.3)
        .weight(-1, 0.7)
        .weight(2, new TwoNatValue(1.0, 1.0))
        .weight(-2, new TwoNatValue(0.0, 1.0))
        .build();
  }

  @Test
  void smoothingHandlesNonSmoothOrNodes() {
    // (x1 and x2) or not x1; the second branch misses x2
    List<Object> values =
        new SmoothingCircuitEvaluator()
            .evaluate(c2d(NnfParserTest.C2D_CIRCUIT), probabilistic(2));
    assertEquals(0.3 * 0.4 + 0.7, (double) values.get(0), EPSILON);
  }

  @Test
  void smoothingMultipliesVariablesAbsentFromTheCircuit() {
    List<Object> values =
        new SmoothingCircuitEvaluator()
            .evaluate(c2d(NnfParserTest.C2D_CIRCUIT), probabilistic(3));
    assertEquals((0.3 * 0.4 + 0.7) * 0.5, (double) values.get(0), EPSILON);
  }

  @Test
  void d4AndC2dCircuitsAgree() {
    NnfCircuit d4 = NnfParser.parse(new StringReader(NnfParserTest.D4_CIRCUIT), NnfFormat.D4);
    List<Object> values = new SmoothingCircuitEvaluator().evaluate(d4, probabilistic(2));
    assertEquals(0.82, (double) values.get(0), EPSILON);
  }

  @Test
  void countingWithoutSemiringCountsModels() {
    WeightedCnf cnf = WeightedCnf.builder().nrVars(3).addClause(-1, 2).build();
    List<Object> values =
        new SmoothingCircuitEvaluator().evaluate(c2d(NnfParserTest.C2D_CIRCUIT), cnf);
    assertEquals(List.of(BigInteger.valueOf(6)), values, "Three models over x1, x2 times two");
  }

  @Test
  void literalOutsideTheCnfIsRejected() {
    assertThrows(
        FormatException.class,
        () -> new SmoothingCircuitEvaluator().evaluate(c2d("nnf 1 0 5\nL 5\n"), probabilistic(2)));
  }

  @Test
  void constrainedEvaluationFoldsInnerSums() {
    // x1 ? (x2 or not x2) : x2
    String circuit =
        String.join(
            "\n",
            "nnf 8 9 2",
            "L 1",
            "L 2",
            "L -2",
            "O 2 2 1 2",
            "A 2 0 3",
            "L -1",
            "A 2 5 1",
            "O 1 2 4 6",
            "");
    List<Object> values = new ConstrainedCircuitEvaluator().evaluate(c2d(circuit), twoLevel());
    assertEquals(0.3 * 0.5 + 0.7 * 1.0, (double) values.get(0), EPSILON);
  }

  @Test
  void constrainedEvaluationSmoothsMissingInnerVariables() {
    // x1 ? true : x2, with x2 summed out below x1
    String circuit =
        String.join("\n", "nnf 5 4 2", "L 1", "L 2", "L -1", "A 2 2 1", "O 1 2 0 3", "");
    List<Object> values = new ConstrainedCircuitEvaluator().evaluate(c2d(circuit), twoLevel());
    assertEquals(0.85, (double) values.get(0), EPSILON);
  }

  @Test
  void constrainedEvaluationNeedsTwoLevels() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ConstrainedCircuitEvaluator()
                .evaluate(c2d(NnfParserTest.C2D_CIRCUIT), probabilistic(2)));
  }
}
