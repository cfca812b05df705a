package amc.error;

/**
 * A solver exited cleanly but produced no usable answer (status {@code UNKNOWN}, a non-optimal
 * {@code SATISFIABLE}, or no model). Callers may retry with another backend; the engine does not.
 */
public final class SolvingException extends AmcException {
  public SolvingException(String message) {
    super(message);
  }
}
