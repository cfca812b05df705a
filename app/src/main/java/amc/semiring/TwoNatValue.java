package amc.semiring;

/** Pair of non-negative reals, combined component-wise. */
public record TwoNatValue(double first, double second) {
  @Override
  public String toString() {
    return "(" + Numbers.formatDouble(first) + "," + Numbers.formatDouble(second) + ")";
  }
}
