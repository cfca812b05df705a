package amc.semiring;

/** Tropical min-plus semiring: cheapest assignment. */
public final class MinPlusSemiring extends DoubleSemiring {
  public static final String NAME = "minplus";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Double zero() {
    return Double.POSITIVE_INFINITY;
  }

  @Override
  public Double one() {
    return 0.0;
  }

  @Override
  public Double add(Double left, Double right) {
    return Math.min(left, right);
  }

  @Override
  public Double multiply(Double left, Double right) {
    return left + right;
  }

  @Override
  public boolean isIdempotent() {
    return true;
  }

  @Override
  public Double negate(Double value) {
    return zero();
  }

  @Override
  public MaxSatScale maxSatScale() {
    return MaxSatScale.NEGATION;
  }
}
