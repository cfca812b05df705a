package amc.error;

/** Malformed extended CNF, tree decomposition or transform text. */
public final class FormatException extends AmcException {
  private final int line;

  public FormatException(String message) {
    this(message, -1);
  }

  public FormatException(String message, int line) {
    super(line > 0 ? "line " + line + ": " + message : message);
    this.line = line;
  }

  /** One-based input line of the problem, or {@code -1} when not tied to a line. */
  public int line() {
    return line;
  }
}
