package amc.error;

/** Raised when quantized MaxSAT weights do not fit the solver's 63-bit weight range. */
public final class NumericOverflowException extends AmcException {
  public NumericOverflowException(String message) {
    super(message);
  }
}
