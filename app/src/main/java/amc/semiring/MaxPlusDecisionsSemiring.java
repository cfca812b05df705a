package amc.semiring;

/** Max-plus values annotated with the decisions attaining them (maximum expected utility). */
public final class MaxPlusDecisionsSemiring extends DecisionSemiring {
  public static final String NAME = "maxplusdecisions";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  double combine(double left, double right) {
    return left + right;
  }

  @Override
  double zeroValue() {
    return Double.NEGATIVE_INFINITY;
  }

  @Override
  double oneValue() {
    return 0.0;
  }

  @Override
  public MaxSatScale maxSatScale() {
    return MaxSatScale.IDENTITY;
  }
}
