package amc.error;

/** The evaluation was cancelled by a termination signal after its resources were cleaned up. */
public final class EvaluationCancelledException extends AmcException {
  public EvaluationCancelledException(String message) {
    super(message);
  }
}
