package amc.semiring;

import com.google.common.base.Splitter;
import java.util.List;

/**
 * Component-wise product of two counting semirings. Typically carries a numerator and a
 * denominator that a transform divides when folding into an outer level.
 */
public final class TwoNatSemiring implements Semiring<TwoNatValue> {
  public static final String NAME = "two_nat";
  private static final Splitter PAIR_SPLITTER = Splitter.on(',').trimResults();

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public TwoNatValue zero() {
    return new TwoNatValue(0.0, 0.0);
  }

  @Override
  public TwoNatValue one() {
    return new TwoNatValue(1.0, 1.0);
  }

  @Override
  public TwoNatValue add(TwoNatValue left, TwoNatValue right) {
    return new TwoNatValue(left.first() + right.first(), left.second() + right.second());
  }

  @Override
  public TwoNatValue multiply(TwoNatValue left, TwoNatValue right) {
    return new TwoNatValue(left.first() * right.first(), left.second() * right.second());
  }

  @Override
  public TwoNatValue parse(String text) {
    String trimmed = text.trim();
    if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }
    List<String> parts = PAIR_SPLITTER.splitToList(trimmed);
    if (parts.size() != 2) {
      throw new IllegalArgumentException("Expected (first,second) but got: " + text);
    }
    return new TwoNatValue(Numbers.parseDouble(parts.get(0)), Numbers.parseDouble(parts.get(1)));
  }

  @Override
  public String format(TwoNatValue value) {
    return value.toString();
  }

  @Override
  public boolean isIdempotent() {
    return false;
  }

  @Override
  public TwoNatValue negate(TwoNatValue value) {
    return one();
  }

  @Override
  public TwoNatValue fromValue(double value) {
    return new TwoNatValue(value, value);
  }

  @Override
  public double[] components(TwoNatValue value) {
    return new double[] {value.first(), value.second()};
  }

  @Override
  public String toString() {
    return NAME;
  }
}
