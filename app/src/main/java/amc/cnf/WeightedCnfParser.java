package amc.cnf;

import amc.error.FormatException;
import amc.semiring.Semiring;
import amc.semiring.SemiringRegistry;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the extended DIMACS format:
 *
 * <pre>
 *   p cnf &lt;nvars&gt; &lt;nclauses&gt;
 *   &lt;lit&gt; ... 0
 *   c p weight &lt;lit&gt; &lt;v1&gt;;&lt;v2&gt;;...;&lt;vn&gt; 0
 *   c p semirings &lt;name&gt; ... 0
 *   c p quantify &lt;var&gt; ... 0
 *   c p transform &lt;expr&gt; 0
 * </pre>
 *
 * Weight values can only be interpreted once the semirings and levels are known, so weight lines
 * are collected first and parsed at the end.
 */
final class WeightedCnfParser {
  private static final Logger LOG = LoggerFactory.getLogger(WeightedCnfParser.class);
  private static final Splitter TOKENS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final Splitter VALUES = Splitter.on(';').trimResults();
  private static final Joiner SPACE = Joiner.on(' ');

  private final WeightedCnf.Builder builder = WeightedCnf.builder();
  private final List<RawWeight> rawWeights = new ArrayList<>();
  private final List<Semiring<?>> semirings = new ArrayList<>();
  private final List<List<Integer>> levels = new ArrayList<>();
  private boolean headerSeen;
  private boolean semiringsSeen;
  private int nrVars;

  WeightedCnf parse(Reader reader) {
    BufferedReader lines =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    int lineNumber = 0;
    try {
      String line;
      while ((line = lines.readLine()) != null) {
        lineNumber++;
        List<String> tokens = TOKENS.splitToList(line);
        if (!tokens.isEmpty()) {
          readLine(tokens, lineNumber);
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    if (!headerSeen) {
      throw new FormatException("Missing 'p cnf' header line");
    }
    semirings.forEach(builder::semiring);
    levels.forEach(builder::quantify);
    if (semirings.size() == levels.size() && semirings.size() <= 2) {
      for (RawWeight raw : rawWeights) {
        builder.weight(raw.literal, parseValues(raw));
      }
    } else if (!rawWeights.isEmpty() && semirings.isEmpty()) {
      throw new FormatException("Weights need a semiring", rawWeights.get(0).line);
    }
    return builder.build();
  }

  private void readLine(List<String> tokens, int lineNumber) {
    String first = tokens.get(0);
    if (first.equals("c")) {
      if (tokens.size() > 2 && tokens.get(1).equals("p")) {
        readProperty(tokens, lineNumber);
      }
      return;
    }
    if (first.equals("p")) {
      if (tokens.size() < 3 || !tokens.get(1).equals("cnf")) {
        throw new FormatException("Malformed header, expected 'p cnf <nvars> <nclauses>'", lineNumber);
      }
      nrVars = integer(tokens.get(2), lineNumber);
      builder.nrVars(nrVars);
      headerSeen = true;
      return;
    }
    if (first.equals("%")) {
      return;
    }
    if (!headerSeen) {
      throw new FormatException("Clause before the 'p cnf' header line", lineNumber);
    }
    List<Integer> clause = new ArrayList<>(tokens.size());
    for (String token : tokens) {
      clause.add(integer(token, lineNumber));
    }
    if (clause.get(clause.size() - 1) != 0) {
      throw new FormatException("Clause not terminated by 0", lineNumber);
    }
    List<Integer> literals = clause.subList(0, clause.size() - 1);
    if (literals.contains(0)) {
      throw new FormatException("Literal 0 inside a clause", lineNumber);
    }
    builder.addClause(literals);
  }

  private void readProperty(List<String> tokens, int lineNumber) {
    if (!tokens.get(tokens.size() - 1).equals("0")) {
      throw new FormatException("Property line not terminated by 0", lineNumber);
    }
    if (tokens.size() < 4) {
      throw new FormatException("Property line without a name", lineNumber);
    }
    List<String> arguments = tokens.subList(3, tokens.size() - 1);
    switch (tokens.get(2)) {
      case "weight" -> {
        if (arguments.size() < 2) {
          throw new FormatException("Weight line needs a literal and a value", lineNumber);
        }
        int literal = integer(arguments.get(0), lineNumber);
        if (literal == 0) {
          throw new FormatException("Literal 0 cannot carry a weight", lineNumber);
        }
        String values = SPACE.join(arguments.subList(1, arguments.size()));
        rawWeights.add(new RawWeight(literal, values, lineNumber));
      }
      case "semirings" -> {
        if (semiringsSeen) {
          throw new FormatException("Semirings declared twice", lineNumber);
        }
        semiringsSeen = true;
        for (String name : arguments) {
          try {
            semirings.add(SemiringRegistry.lookup(name));
          } catch (IllegalArgumentException ex) {
            throw new FormatException(ex.getMessage(), lineNumber);
          }
        }
      }
      case "quantify" -> {
        List<Integer> level = new ArrayList<>(arguments.size());
        for (String token : arguments) {
          level.add(integer(token, lineNumber));
        }
        levels.add(level);
      }
      case "transform" -> {
        if (arguments.isEmpty()) {
          throw new FormatException("Empty transform", lineNumber);
        }
        builder.transform(Transform.parse(SPACE.join(arguments)));
      }
      default -> LOG.warn("Ignoring unknown property '{}' on line {}", tokens.get(2), lineNumber);
    }
  }

  private List<Object> parseValues(RawWeight raw) {
    int variable = Math.abs(raw.literal);
    if (variable > nrVars) {
      throw new FormatException("Weight for unknown literal " + raw.literal, raw.line);
    }
    Semiring<?> semiring = semirings.get(levelOf(variable, raw.line));
    List<Object> values = new ArrayList<>();
    for (String text : VALUES.split(raw.text)) {
      try {
        values.add(semiring.parse(text));
      } catch (IllegalArgumentException ex) {
        throw new FormatException(
            "Cannot parse '" + text + "' as a " + semiring.name() + " value", raw.line);
      }
    }
    return values;
  }

  private int levelOf(int variable, int lineNumber) {
    for (int level = 0; level < levels.size(); level++) {
      if (levels.get(level).contains(variable)) {
        return level;
      }
    }
    throw new FormatException("Weighted variable " + variable + " is not quantified", lineNumber);
  }

  private static int integer(String token, int lineNumber) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException ex) {
      throw new FormatException("Expected an integer, got '" + token + "'", lineNumber);
    }
  }

  private record RawWeight(int literal, String text, int line) {}
}
