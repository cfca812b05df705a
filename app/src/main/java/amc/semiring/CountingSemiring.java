package amc.semiring;

import java.math.BigInteger;

/**
 * Exact model counting over the naturals. Backs instances that declare no semiring, where every
 * literal has multiplicity one.
 */
public final class CountingSemiring implements Semiring<BigInteger> {
  public static final String NAME = "counting";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public BigInteger zero() {
    return BigInteger.ZERO;
  }

  @Override
  public BigInteger one() {
    return BigInteger.ONE;
  }

  @Override
  public BigInteger add(BigInteger left, BigInteger right) {
    return left.add(right);
  }

  @Override
  public BigInteger multiply(BigInteger left, BigInteger right) {
    return left.multiply(right);
  }

  @Override
  public BigInteger parse(String text) {
    try {
      return new BigInteger(text.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid count: " + text);
    }
  }

  @Override
  public String format(BigInteger value) {
    return value.toString();
  }

  @Override
  public boolean isIdempotent() {
    return false;
  }

  @Override
  public BigInteger negate(BigInteger value) {
    return one();
  }

  @Override
  public BigInteger fromValue(double value) {
    return BigInteger.valueOf(Math.round(value));
  }

  @Override
  public double[] components(BigInteger value) {
    return new double[] {value.doubleValue()};
  }

  @Override
  public String toString() {
    return NAME;
  }
}
