package amc.error;

/** Unsupported combination of compiler, semiring(s) and strategy. */
public final class ConfigurationException extends AmcException {
  public ConfigurationException(String message) {
    super(message);
  }
}
