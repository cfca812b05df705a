package amc.eval;

import amc.error.ConfigurationException;
import java.util.Locale;

/** How the dispatcher may answer a query. */
public enum Strategy {
  /** Use MaxSAT or direct counting when the instance allows it, compile otherwise. */
  FLEXIBLE,
  /** Always compile. */
  COMPILATION;

  public static Strategy fromName(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("Unknown strategy '" + name + "', expected flexible or compilation");
    }
  }

  public String cliName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
