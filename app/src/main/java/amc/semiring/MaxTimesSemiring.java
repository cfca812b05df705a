package amc.semiring;

/** Viterbi (max-times) semiring: most probable assignment. */
public final class MaxTimesSemiring extends DoubleSemiring {
  public static final String NAME = "maxtimes";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Double zero() {
    return 0.0;
  }

  @Override
  public Double one() {
    return 1.0;
  }

  @Override
  public Double add(Double left, Double right) {
    return Math.max(left, right);
  }

  @Override
  public Double multiply(Double left, Double right) {
    return left * right;
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
    return MaxSatScale.LOGARITHM;
  }
}
