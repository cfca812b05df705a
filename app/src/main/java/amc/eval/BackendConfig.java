package amc.eval;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Locations of the external backend executables. Each one is looked up as the system property
 * {@code amc.backend.<name>}, then the environment variable {@code AMC_BACKEND_<NAME>} (dashes
 * become underscores), then a default below the external directory, which is itself configurable
 * through {@code amc.external} / {@code AMC_EXTERNAL}.
 */
public record BackendConfig(
    Path c2d,
    Path d4,
    Path sharpSatTd,
    Path minisat,
    Path evalMaxSat,
    Path flowCutter,
    Path preprocessor) {

  private static final String EXTERNAL_PROPERTY = "amc.external";
  private static final String EXTERNAL_ENV = "AMC_EXTERNAL";
  private static final String DEFAULT_EXTERNAL = "external";

  public static BackendConfig fromEnvironment() {
    Path external = Path.of(lookup(EXTERNAL_PROPERTY, EXTERNAL_ENV, DEFAULT_EXTERNAL));
    return new BackendConfig(
        resolve("c2d", external.resolve("c2d/bin/c2d_linux")),
        resolve("d4", external.resolve("d4/d4_static")),
        resolve("sharpsat-td", external.resolve("sharpsat-td/bin/sharpSAT")),
        resolve("minisat", external.resolve("minisat-definitions/bin/minisat")),
        resolve("evalmaxsat", external.resolve("EvalMaxSAT/bin/EvalMaxSAT")),
        resolve("flow-cutter", external.resolve("flow-cutter/flow_cutter_pace17")),
        resolve("preprocessor", external.resolve("preprocessor/bin/sharpSAT")));
  }

  private static Path resolve(String name, Path fallback) {
    String env = "AMC_BACKEND_" + name.toUpperCase(Locale.ROOT).replace('-', '_');
    return Path.of(lookup("amc.backend." + name, env, fallback.toString())).toAbsolutePath();
  }

  private static String lookup(String property, String env, String fallback) {
    String propertyValue = System.getProperty(property);
    if (propertyValue != null && !propertyValue.isBlank()) {
      return propertyValue;
    }
    String envValue = System.getenv(env);
    if (envValue != null && !envValue.isBlank()) {
      return envValue;
    }
    return fallback;
  }
}
