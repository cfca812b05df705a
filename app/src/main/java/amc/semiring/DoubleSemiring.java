package amc.semiring;

/** Shared plumbing of the semirings whose values are plain doubles. */
abstract class DoubleSemiring implements Semiring<Double> {

  @Override
  public Double parse(String text) {
    return Numbers.parseDouble(text);
  }

  @Override
  public String format(Double value) {
    return Numbers.formatDouble(value);
  }

  @Override
  public Double fromValue(double value) {
    return value;
  }

  @Override
  public double[] components(Double value) {
    return new double[] {value};
  }

  @Override
  public String toString() {
    return name();
  }
}
