package amc.semiring;

/** Probabilities with ordinary addition and multiplication. */
public final class ProbabilisticSemiring extends DoubleSemiring {
  public static final String NAME = "probabilistic";

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
    return left + right;
  }

  @Override
  public Double multiply(Double left, Double right) {
    return left * right;
  }

  @Override
  public boolean isIdempotent() {
    return false;
  }

  @Override
  public Double negate(Double value) {
    return 1.0 - value;
  }
}
