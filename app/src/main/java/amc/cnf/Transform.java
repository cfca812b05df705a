package amc.cnf;

import amc.error.FormatException;
import amc.semiring.Semiring;
import java.util.Locale;

/**
 * Cross-semiring transform of a two-level weighted CNF: maps a value of the inner (level-1)
 * semiring to a number that the outer (level-0) semiring lifts with {@link Semiring#fromValue}.
 *
 * <p>The textual form is a small arithmetic language over the inner value {@code w}:
 *
 * <pre>
 *   transform := [ 'lambda' 'w' ':' ] expr
 *   expr      := term (('+' | '-') term)*
 *   term      := unary (('*' | '/') unary)*
 *   unary     := '-' unary | primary
 *   primary   := number | 'w' | 'w' '[' index ']' | '(' expr ')'
 * </pre>
 *
 * {@code w} alone stands for component 0 of the value, {@code w[i]} for component {@code i} of
 * {@link Semiring#components}. The source text is kept verbatim for serialization.
 */
public final class Transform {
  private final String source;
  private final Expression expression;

  private Transform(String source, Expression expression) {
    this.source = source;
    this.expression = expression;
  }

  public static Transform parse(String text) {
    if (text == null || text.isBlank()) {
      throw new FormatException("Empty transform");
    }
    String source = text.trim();
    Expression expression = new ExpressionParser(source).parseTransform();
    return new Transform(source, expression);
  }

  /** The identity on component 0, as used by MAP-style instances. */
  public static Transform identity() {
    return parse("lambda w : w");
  }

  public String source() {
    return source;
  }

  public double apply(double[] components) {
    return expression.evaluate(components);
  }

  /** Folds one inner value into the outer semiring. */
  public Object fold(Semiring<Object> inner, Semiring<Object> outer, Object value) {
    return outer.fromValue(apply(inner.components(value)));
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Transform that && source.equals(that.source);
  }

  @Override
  public int hashCode() {
    return source.hashCode();
  }

  @Override
  public String toString() {
    return source;
  }

  @FunctionalInterface
  private interface Expression {
    double evaluate(double[] w);
  }

  private static final class ExpressionParser {
    private final String text;
    private int pos;

    ExpressionParser(String text) {
      this.text = text;
    }

    Expression parseTransform() {
      skipWhitespace();
      if (text.startsWith("lambda", pos)) {
        pos += "lambda".length();
        skipWhitespace();
        expectKeyword("w");
        skipWhitespace();
        expect(':');
      }
      Expression expression = parseExpression();
      skipWhitespace();
      if (pos < text.length()) {
        throw error("Unexpected trailing input");
      }
      return expression;
    }

    private Expression parseExpression() {
      Expression left = parseTerm();
      while (true) {
        skipWhitespace();
        char next = peek();
        if (next == '+') {
          pos++;
          Expression l = left;
          Expression r = parseTerm();
          left = w -> l.evaluate(w) + r.evaluate(w);
        } else if (next == '-') {
          pos++;
          Expression l = left;
          Expression r = parseTerm();
          left = w -> l.evaluate(w) - r.evaluate(w);
        } else {
          return left;
        }
      }
    }

    private Expression parseTerm() {
      Expression left = parseUnary();
      while (true) {
        skipWhitespace();
        char next = peek();
        if (next == '*') {
          pos++;
          Expression l = left;
          Expression r = parseUnary();
          left = w -> l.evaluate(w) * r.evaluate(w);
        } else if (next == '/') {
          pos++;
          Expression l = left;
          Expression r = parseUnary();
          left = w -> l.evaluate(w) / r.evaluate(w);
        } else {
          return left;
        }
      }
    }

    private Expression parseUnary() {
      skipWhitespace();
      if (peek() == '-') {
        pos++;
        Expression operand = parseUnary();
        return w -> -operand.evaluate(w);
      }
      return parsePrimary();
    }

    private Expression parsePrimary() {
      skipWhitespace();
      char next = peek();
      if (next == '(') {
        pos++;
        Expression inner = parseExpression();
        skipWhitespace();
        expect(')');
        return inner;
      }
      if (next == 'w') {
        pos++;
        skipWhitespace();
        if (peek() != '[') {
          return w -> component(w, 0);
        }
        pos++;
        skipWhitespace();
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
          pos++;
        }
        if (start == pos) {
          throw error("Expected component index");
        }
        int index = Integer.parseInt(text.substring(start, pos));
        skipWhitespace();
        expect(']');
        return w -> component(w, index);
      }
      if (Character.isDigit(next) || next == '.') {
        return parseNumber();
      }
      throw error(next == 0 ? "Unexpected end of transform" : "Unexpected character '" + next + "'");
    }

    private Expression parseNumber() {
      int start = pos;
      while (pos < text.length()) {
        char c = text.charAt(pos);
        boolean exponentSign =
            (c == '+' || c == '-')
                && pos > start
                && Character.toLowerCase(text.charAt(pos - 1)) == 'e';
        if (Character.isDigit(c) || c == '.' || c == 'e' || c == 'E' || exponentSign) {
          pos++;
        } else {
          break;
        }
      }
      String literal = text.substring(start, pos);
      try {
        double value = Double.parseDouble(literal);
        return w -> value;
      } catch (NumberFormatException ex) {
        throw error("Invalid number '" + literal + "'");
      }
    }

    private static double component(double[] w, int index) {
      if (index >= w.length) {
        throw new IllegalArgumentException(
            "Transform reads component " + index + " of a value with " + w.length + " component(s)");
      }
      return w[index];
    }

    private void expectKeyword(String keyword) {
      if (!text.startsWith(keyword, pos)) {
        throw error("Expected '" + keyword + "'");
      }
      pos += keyword.length();
    }

    private void expect(char expected) {
      if (peek() != expected) {
        throw error("Expected '" + expected + "'");
      }
      pos++;
    }

    private char peek() {
      return pos < text.length() ? text.charAt(pos) : 0;
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private FormatException error(String message) {
      return new FormatException(
          String.format(
              Locale.ROOT, "%s at position %d of transform '%s'", message, pos, text));
    }
  }
}
