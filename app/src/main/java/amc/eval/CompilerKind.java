package amc.eval;

import amc.error.ConfigurationException;

/** Knowledge compilers the engine can drive. */
public enum CompilerKind {
  C2D("c2d"),
  D4("d4"),
  SHARPSAT_TD("sharpsat-td"),
  SHARPSAT_TD_LIVE("sharpsat-td-live");

  private final String cliName;

  CompilerKind(String cliName) {
    this.cliName = cliName;
  }

  public String cliName() {
    return cliName;
  }

  public static CompilerKind fromName(String name) {
    for (CompilerKind kind : values()) {
      if (kind.cliName.equalsIgnoreCase(name.trim())) {
        return kind;
      }
    }
    if (name.trim().equalsIgnoreCase("miniC2D")) {
      throw new ConfigurationException(
          "miniC2D produces SDDs, which this engine cannot evaluate; use c2d instead");
    }
    throw new ConfigurationException("Unknown knowledge compiler '" + name + "'");
  }
}
