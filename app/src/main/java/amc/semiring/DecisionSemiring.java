package amc.semiring;

import com.google.common.base.Splitter;
import java.math.BigInteger;
import java.util.List;

/**
 * Product of a max-semiring with the decisions that achieve the maximum. Adding keeps the better
 * operand with its decisions; multiplying combines the values and joins the decisions.
 */
abstract class DecisionSemiring implements Semiring<DecisionValue> {
  private static final Splitter PAIR_SPLITTER = Splitter.on(',').trimResults();

  abstract double combine(double left, double right);

  abstract double zeroValue();

  abstract double oneValue();

  @Override
  public DecisionValue zero() {
    return DecisionValue.of(zeroValue());
  }

  @Override
  public DecisionValue one() {
    return DecisionValue.of(oneValue());
  }

  @Override
  public DecisionValue add(DecisionValue left, DecisionValue right) {
    return left.value() >= right.value() ? left : right;
  }

  @Override
  public DecisionValue multiply(DecisionValue left, DecisionValue right) {
    return new DecisionValue(
        combine(left.value(), right.value()), left.decisions().or(right.decisions()));
  }

  @Override
  public DecisionValue parse(String text) {
    String trimmed = text.trim();
    if (!trimmed.startsWith("(") || !trimmed.endsWith(")")) {
      throw new IllegalArgumentException("Expected (value,decisions) but got: " + text);
    }
    List<String> parts = PAIR_SPLITTER.splitToList(trimmed.substring(1, trimmed.length() - 1));
    if (parts.size() != 2) {
      throw new IllegalArgumentException("Expected (value,decisions) but got: " + text);
    }
    try {
      return new DecisionValue(Numbers.parseDouble(parts.get(0)), new BigInteger(parts.get(1)));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid decision bitmask in: " + text);
    }
  }

  @Override
  public String format(DecisionValue value) {
    return value.toString();
  }

  @Override
  public boolean isIdempotent() {
    return true;
  }

  @Override
  public DecisionValue negate(DecisionValue value) {
    return one();
  }

  @Override
  public DecisionValue fromValue(double value) {
    return DecisionValue.of(value);
  }

  @Override
  public double[] components(DecisionValue value) {
    return new double[] {value.value()};
  }

  @Override
  public String toString() {
    return name();
  }
}
