package amc.error;

/** Base type of every failure the evaluation engine reports to its caller. */
public class AmcException extends RuntimeException {
  public AmcException(String message) {
    super(message);
  }

  public AmcException(String message, Throwable cause) {
    super(message, cause);
  }
}
