package amc.graph;

import amc.error.FormatException;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the PACE tree decomposition format: an {@code s tw|td <bags> <width> <vertices>} header,
 * one {@code b <id> <vertex...>} line per bag and one {@code <id> <id>} line per tree edge.
 * {@code c} lines are comments.
 *
 * <p>Anytime heuristics print a sequence of improving decompositions. Every header starts a new
 * one; the last decomposition that is complete wins, so output cut off by a timeout is still
 * usable.
 */
final class TreeDecompositionParser {
  private static final Splitter TOKENS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private Section lastComplete;
  private Section current;

  TreeDecomposition parse(Reader reader) {
    BufferedReader lines =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    int lineNumber = 0;
    try {
      String line;
      while ((line = lines.readLine()) != null) {
        lineNumber++;
        List<String> tokens = TOKENS.splitToList(line);
        if (tokens.isEmpty() || tokens.get(0).equals("c")) {
          continue;
        }
        readLine(tokens, lineNumber);
      }
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    if (current != null && current.isComplete()) {
      lastComplete = current;
    }
    if (lastComplete == null) {
      throw new FormatException(
          current == null ? "Missing 's tw' header line" : "Incomplete tree decomposition");
    }
    return lastComplete.build();
  }

  private void readLine(List<String> tokens, int lineNumber) {
    switch (tokens.get(0)) {
      case "s" -> {
        if (tokens.size() < 5 || !(tokens.get(1).equals("tw") || tokens.get(1).equals("td"))) {
          throw new FormatException("Malformed header, expected 's tw <bags> <width> <vertices>'", lineNumber);
        }
        if (current != null && current.isComplete()) {
          lastComplete = current;
        }
        current =
            new Section(
                number(tokens.get(2), lineNumber),
                number(tokens.get(3), lineNumber),
                number(tokens.get(4), lineNumber));
      }
      case "b" -> {
        requireHeader(lineNumber);
        if (tokens.size() < 2) {
          throw new FormatException("Bag line without id", lineNumber);
        }
        int id = number(tokens.get(1), lineNumber);
        if (id < 1 || id > current.bagCount) {
          throw new FormatException("Bag id " + id + " out of range", lineNumber);
        }
        List<Integer> vertices = new ArrayList<>(tokens.size() - 2);
        for (String token : tokens.subList(2, tokens.size())) {
          vertices.add(number(token, lineNumber));
        }
        current.bags.put(id, vertices);
      }
      default -> {
        requireHeader(lineNumber);
        if (tokens.size() != 2) {
          throw new FormatException("Expected a tree edge '<id> <id>'", lineNumber);
        }
        current.edges.add(
            new int[] {number(tokens.get(0), lineNumber), number(tokens.get(1), lineNumber)});
      }
    }
  }

  private void requireHeader(int lineNumber) {
    if (current == null) {
      throw new FormatException("Content before the 's tw' header line", lineNumber);
    }
  }

  private static int number(String token, int lineNumber) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException ex) {
      throw new FormatException("Expected an integer, got '" + token + "'", lineNumber);
    }
  }

  private static final class Section {
    private final int bagCount;
    private final int width;
    private final int vertexCount;
    private final Map<Integer, List<Integer>> bags = new TreeMap<>();
    private final List<int[]> edges = new ArrayList<>();

    Section(int bagCount, int width, int vertexCount) {
      this.bagCount = bagCount;
      this.width = width;
      this.vertexCount = vertexCount;
    }

    boolean isComplete() {
      return bags.size() == bagCount && edges.size() == Math.max(0, bagCount - 1);
    }

    TreeDecomposition build() {
      try {
        return TreeDecomposition.of(width, vertexCount, bags, edges);
      } catch (IllegalArgumentException ex) {
        throw new FormatException(ex.getMessage());
      }
    }
  }
}
