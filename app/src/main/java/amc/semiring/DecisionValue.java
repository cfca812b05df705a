package amc.semiring;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A numeric value together with the bitmask of decisions that produced it. Equality and ordering
 * only look at {@link #value()}.
 */
public record DecisionValue(double value, BigInteger decisions) implements Comparable<DecisionValue> {

  public DecisionValue {
    Objects.requireNonNull(decisions, "decisions");
    if (decisions.signum() < 0) {
      throw new IllegalArgumentException("decisions must be a non-negative bitmask");
    }
  }

  public static DecisionValue of(double value) {
    return new DecisionValue(value, BigInteger.ZERO);
  }

  public boolean isDecided(int index) {
    return decisions.testBit(index);
  }

  @Override
  public int compareTo(DecisionValue other) {
    return Double.compare(value, other.value);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof DecisionValue that && Double.compare(value, that.value) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }

  @Override
  public String toString() {
    return "(" + Numbers.formatDouble(value) + "," + decisions + ")";
  }
}
