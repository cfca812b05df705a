package amc.backend;

import amc.error.FormatException;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads circuits in the formats of {@link NnfFormat}. */
public final class NnfParser {
  private static final Splitter TOKENS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private NnfParser() {}

  public static NnfCircuit parse(Reader reader, NnfFormat format) {
    BufferedReader lines =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    try {
      return format == NnfFormat.C2D ? parseC2d(lines) : parseD4(lines);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  /**
   * c2d format: {@code nnf <nodes> <edges> <vars>}, then {@code L <lit>}, {@code A <k> <ids>} and
   * {@code O <var> <k> <ids>} lines. Nodes are numbered by line from 0; the last node is the root.
   * {@code A 0} is true and {@code O <var> 0} is false.
   */
  private static NnfCircuit parseC2d(BufferedReader lines) throws IOException {
    NnfCircuit.Builder builder = NnfCircuit.builder();
    int lineNumber = 0;
    String line;
    while ((line = lines.readLine()) != null) {
      lineNumber++;
      List<String> tokens = TOKENS.splitToList(line);
      if (tokens.isEmpty() || tokens.get(0).equals("c") || tokens.get(0).equals("nnf")) {
        continue;
      }
      switch (tokens.get(0)) {
        case "L" -> builder.literal(integer(tokens, 1, lineNumber));
        case "A" -> {
          int count = integer(tokens, 1, lineNumber);
          int node = count == 0 ? builder.constant(true) : builder.and();
          addChildren(builder, node, tokens, 2, count, lineNumber);
        }
        case "O" -> {
          int count = integer(tokens, 2, lineNumber);
          int node = count == 0 ? builder.constant(false) : builder.or();
          addChildren(builder, node, tokens, 3, count, lineNumber);
        }
        default -> throw new FormatException("Unknown NNF node '" + tokens.get(0) + "'", lineNumber);
      }
    }
    if (builder.size() == 0) {
      throw new FormatException("Empty NNF circuit");
    }
    return builder.build(builder.size() - 1);
  }

  private static void addChildren(
      NnfCircuit.Builder builder,
      int node,
      List<String> tokens,
      int offset,
      int count,
      int lineNumber) {
    if (tokens.size() < offset + count) {
      throw new FormatException("Node declares " + count + " children but lists fewer", lineNumber);
    }
    for (int i = 0; i < count; i++) {
      int child = integer(tokens, offset + i, lineNumber);
      if (child >= node) {
        throw new FormatException("Child " + child + " is not defined before its parent", lineNumber);
      }
      builder.addChild(node, child);
    }
  }

  /**
   * d4 format: {@code o|a|t|f <id> 0} declares a node, {@code <parent> <child> <lit>* 0} an edge
   * whose literals are conjoined with the child. The first declared node is the root.
   */
  private static NnfCircuit parseD4(BufferedReader lines) throws IOException {
    Map<Integer, String> declared = new LinkedHashMap<>();
    List<int[]> edges = new ArrayList<>();
    int lineNumber = 0;
    String line;
    while ((line = lines.readLine()) != null) {
      lineNumber++;
      List<String> tokens = TOKENS.splitToList(line);
      if (tokens.isEmpty() || tokens.get(0).equals("c")) {
        continue;
      }
      String head = tokens.get(0);
      if (head.equals("o") || head.equals("a") || head.equals("t") || head.equals("f")) {
        declared.put(integer(tokens, 1, lineNumber), head);
        continue;
      }
      if (!tokens.get(tokens.size() - 1).equals("0") || tokens.size() < 3) {
        throw new FormatException("Malformed edge line", lineNumber);
      }
      int[] edge = new int[tokens.size() - 1];
      for (int i = 0; i < edge.length; i++) {
        edge[i] = integer(tokens, i, lineNumber);
      }
      edges.add(edge);
    }
    if (declared.isEmpty()) {
      throw new FormatException("Empty d4 circuit");
    }
    NnfCircuit.Builder builder = NnfCircuit.builder();
    Map<Integer, Integer> nodes = new HashMap<>();
    declared.forEach(
        (id, kind) -> {
          int node =
              switch (kind) {
                case "o" -> builder.or();
                case "a" -> builder.and();
                case "t" -> builder.constant(true);
                default -> builder.constant(false);
              };
          nodes.put(id, node);
        });
    Map<Integer, Integer> literalNodes = new HashMap<>();
    for (int[] edge : edges) {
      Integer parent = nodes.get(edge[0]);
      Integer child = nodes.get(edge[1]);
      if (parent == null || child == null) {
        throw new FormatException("Edge " + edge[0] + " -> " + edge[1] + " refers to an unknown node");
      }
      int target = child;
      if (edge.length > 2) {
        target = builder.and();
        for (int i = 2; i < edge.length; i++) {
          int literal = edge[i];
          builder.addChild(target, literalNodes.computeIfAbsent(literal, builder::literal));
        }
        builder.addChild(target, child);
      }
      builder.addChild(parent, target);
    }
    return builder.build(nodes.get(declared.keySet().iterator().next()));
  }

  private static int integer(List<String> tokens, int index, int lineNumber) {
    if (index >= tokens.size()) {
      throw new FormatException("Truncated NNF line", lineNumber);
    }
    try {
      return Integer.parseInt(tokens.get(index));
    } catch (NumberFormatException ex) {
      throw new FormatException("Expected an integer, got '" + tokens.get(index) + "'", lineNumber);
    }
  }
}
