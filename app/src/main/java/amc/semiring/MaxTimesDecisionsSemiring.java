package amc.semiring;

/** Max-times values annotated with the decisions attaining them (maximum a posteriori). */
public final class MaxTimesDecisionsSemiring extends DecisionSemiring {
  public static final String NAME = "maxtimesdecisions";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  double combine(double left, double right) {
    return left * right;
  }

  @Override
  double zeroValue() {
    return 0.0;
  }

  @Override
  double oneValue() {
    return 1.0;
  }

  @Override
  public MaxSatScale maxSatScale() {
    return MaxSatScale.LOGARITHM;
  }
}
