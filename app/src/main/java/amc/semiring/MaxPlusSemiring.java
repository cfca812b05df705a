package amc.semiring;

/** Tropical max-plus semiring: best total weight of an assignment. */
public final class MaxPlusSemiring extends DoubleSemiring {
  public static final String NAME = "maxplus";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Double zero() {
    return Double.NEGATIVE_INFINITY;
  }

  @Override
  public Double one() {
    return 0.0;
  }

  @Override
  public Double add(Double left, Double right) {
    return Math.max(left, right);
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
    return MaxSatScale.IDENTITY;
  }
}
