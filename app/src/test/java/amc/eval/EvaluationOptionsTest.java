package amc.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import amc.backend.C2dCompiler;
import amc.backend.SharpSatTdCompiler;
import amc.error.ConfigurationException;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class EvaluationOptionsTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("amc.external");
    System.clearProperty("amc.backend.c2d");
  }

  @Test
  void normalizeFillsMissingAndInvalidSettings() {
    EvaluationOptions normalized =
        EvaluationOptions.normalize(
            new EvaluationOptions(null, true, null, Duration.ofSeconds(-1), -3, null));
    assertEquals(Strategy.FLEXIBLE, normalized.strategy());
    assertEquals(CompilerKind.C2D, normalized.compiler());
    assertEquals(Duration.ofSeconds(1), normalized.decompositionTimeout());
    assertEquals(EvaluationOptions.DEFAULT_MAXSAT_PRECISION, normalized.maxSatPrecisionDigits());
    assertTrue(normalized.preprocessing(), "Explicit settings are kept");
    assertNull(normalized.preprocessedOutput());
  }

  @Test
  void withStrategyKeepsEverythingElse() {
    EvaluationOptions options =
        new EvaluationOptions(
            Strategy.FLEXIBLE,
            true,
            CompilerKind.D4,
            Duration.ofMillis(300),
            4,
            Path.of("out.cnf"));
    EvaluationOptions compiled = options.withStrategy(Strategy.COMPILATION);
    assertEquals(Strategy.COMPILATION, compiled.strategy());
    assertEquals(CompilerKind.D4, compiled.compiler());
    assertEquals(4, compiled.maxSatPrecisionDigits());
    assertEquals(Path.of("out.cnf"), compiled.preprocessedOutput());
  }

  @Test
  void strategyNamesAreCaseInsensitive() {
    assertEquals(Strategy.COMPILATION, Strategy.fromName(" Compilation "));
    assertEquals("flexible", Strategy.FLEXIBLE.cliName());
    assertThrows(ConfigurationException.class, () -> Strategy.fromName("fastest"));
  }

  @Test
  void compilerNamesMatchTheCommandLine() {
    assertEquals(CompilerKind.SHARPSAT_TD_LIVE, CompilerKind.fromName("sharpsat-td-live"));
    assertEquals(CompilerKind.D4, CompilerKind.fromName("D4"));
    ConfigurationException sdd =
        assertThrows(ConfigurationException.class, () -> CompilerKind.fromName("miniC2D"));
    assertTrue(sdd.getMessage().contains("SDD"));
    assertThrows(ConfigurationException.class, () -> CompilerKind.fromName("dsharp"));
  }

  @Test
  void backendLocationsFollowPropertiesBeforeDefaults() {
    System.setProperty("amc.external", "/opt/amc");
    System.setProperty("amc.backend.c2d", "/usr/local/bin/c2d");
    BackendConfig config = BackendConfig.fromEnvironment();
    assertEquals(Path.of("/usr/local/bin/c2d"), config.c2d());
    assertEquals(Path.of("/opt/amc/EvalMaxSAT/bin/EvalMaxSAT"), config.evalMaxSat());
    assertTrue(config.minisat().isAbsolute());
  }

  @Test
  void externalBackendsFollowTheCompilerChoice() {
    BackendConfig config = BackendConfig.fromEnvironment();
    Backends c2d = Backends.external(config, EvaluationOptions.defaults());
    assertEquals(C2dCompiler.NAME, c2d.compiler().name());
    assertTrue(c2d.compiler().supportsConstrained());

    Backends live =
        Backends.external(
            config,
            new EvaluationOptions(
                Strategy.FLEXIBLE, false, CompilerKind.SHARPSAT_TD_LIVE, null, 0, null));
    assertEquals(SharpSatTdCompiler.LIVE_NAME, live.compiler().name());
    assertTrue(live.compiler().supportsLiveCounting());
    assertFalse(live.compiler().supportsConstrained());
  }
}
