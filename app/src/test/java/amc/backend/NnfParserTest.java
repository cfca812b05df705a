package amc.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import amc.error.FormatException;
import java.io.StringReader;
import java.util.BitSet;
import org.junit.jupiter.api.Test;

final class NnfParserTest {

  static final String C2D_CIRCUIT =
      String.join(
          "\n",
          "nnf 6 6 2",
          "L 1",
          "L 2",
          "L -1",
          "A 2 0 1",
          "O 1 2 3 2",
          "");

  static final String D4_CIRCUIT =
      String.join(
          "\n",
          "o 1 0",
          "a 2 0",
          "t 3 0",
          "1 2 0",
          "2 3 1 2 0",
          "1 3 -1 0",
          "");

  private static NnfCircuit parse(String text, NnfFormat format) {
    return NnfParser.parse(new StringReader(text), format);
  }

  @Test
  void c2dNodesAreNumberedByLineWithTheRootLast() {
    NnfCircuit circuit = parse(C2D_CIRCUIT, NnfFormat.C2D);
    assertEquals(5, circuit.size());
    assertEquals(4, circuit.root());
    assertEquals(NnfCircuit.Kind.OR, circuit.kind(4));
    assertEquals(-1, circuit.literal(2));
    assertEquals(5, circuit.postOrder().size());
    BitSet both = new BitSet();
    both.set(1, 3);
    assertEquals(both, circuit.variables(4));
  }

  @Test
  void c2dConstantsAreEmptyGates() {
    NnfCircuit truth = parse("nnf 1 0 0\nA 0\n", NnfFormat.C2D);
    assertEquals(NnfCircuit.Kind.TRUE, truth.kind(truth.root()));
    NnfCircuit falsity = parse("nnf 1 0 0\nO 0 0\n", NnfFormat.C2D);
    assertEquals(NnfCircuit.Kind.FALSE, falsity.kind(falsity.root()));
  }

  @Test
  void d4EdgeLiteralsBecomeConjunctions() {
    NnfCircuit circuit = parse(D4_CIRCUIT, NnfFormat.D4);
    assertEquals(0, circuit.root(), "First declared node is the root");
    assertEquals(NnfCircuit.Kind.OR, circuit.kind(circuit.root()));
    assertEquals(2, circuit.children(circuit.root()).length);
    BitSet both = new BitSet();
    both.set(1, 3);
    assertEquals(both, circuit.variables(circuit.root()));
  }

  @Test
  void malformedCircuitsAreFormatErrors() {
    assertThrows(FormatException.class, () -> parse("", NnfFormat.C2D));
    assertThrows(FormatException.class, () -> parse("nnf 2 1 1\nA 1 1\nL 1\n", NnfFormat.C2D));
    assertThrows(FormatException.class, () -> parse("nnf 1 0 1\nX 1\n", NnfFormat.C2D));
    assertThrows(FormatException.class, () -> parse("nnf 2 2 1\nL 1\nA 2 0\n", NnfFormat.C2D));
    assertThrows(FormatException.class, () -> parse("o 1 0\n1 2 0\n", NnfFormat.D4));
    assertThrows(FormatException.class, () -> parse("c only comments\n", NnfFormat.D4));
    assertThrows(FormatException.class, () -> parse("o 1 0\n1 2\n", NnfFormat.D4));
  }
}
